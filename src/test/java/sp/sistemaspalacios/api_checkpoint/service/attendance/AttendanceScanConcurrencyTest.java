package sp.sistemaspalacios.api_checkpoint.service.attendance;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.FaceScanRequest;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.ScanResponse;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceAction;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_checkpoint.entity.member.Member;
import sp.sistemaspalacios.api_checkpoint.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.api_checkpoint.repository.member.MemberRepository;
import sp.sistemaspalacios.api_checkpoint.service.boundaries.generalConfiguration.GeneralConfigurationService;
import sp.sistemaspalacios.api_checkpoint.service.common.TimeService;
import sp.sistemaspalacios.api_checkpoint.service.face.IdentityMatcherService;
import sp.sistemaspalacios.api_checkpoint.service.geo.GeofenceService;
import sp.sistemaspalacios.api_checkpoint.service.policy.LocationPolicyResolver;
import sp.sistemaspalacios.api_checkpoint.support.MutableClock;
import sp.sistemaspalacios.api_checkpoint.support.ScriptedFaceComparisonClient;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Escaneos simultáneos del mismo miembro con transacciones reales (sin la transacción
 * envolvente de la prueba).
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
        AttendanceScanService.class,
        AttendanceLedgerService.class,
        AttendanceStatusClassifier.class,
        MemberDayLocks.class,
        IdentityMatcherService.class,
        LocationPolicyResolver.class,
        GeofenceService.class,
        GeneralConfigurationService.class,
        TimeService.class,
        AttendanceScanConcurrencyTest.ConcurrencyTestConfig.class
})
class AttendanceScanConcurrencyTest {

    private static final ZoneId KL = ZoneId.of("Asia/Kuala_Lumpur");
    private static final LocalDate DAY = LocalDate.of(2025, 3, 10);
    private static final String CAPTURED = "https://i.ibb.co/scan/capture.jpg";

    @TestConfiguration
    static class ConcurrencyTestConfig {
        @Bean
        MutableClock organizationClock() {
            return new MutableClock(KL, DAY.atTime(12, 0));
        }

        @Bean
        ScriptedFaceComparisonClient faceComparisonClient() {
            return new ScriptedFaceComparisonClient();
        }
    }

    @Autowired
    private AttendanceScanService scanService;

    @Autowired
    private AttendanceRecordRepository recordRepository;

    @Autowired
    private MemberRepository memberRepository;

    @Autowired
    private ScriptedFaceComparisonClient faceClient;

    private Member alice;

    @BeforeEach
    void setUp() {
        faceClient.reset();
        alice = memberRepository.save(Member.builder()
                .firstName("Alice")
                .lastName("Tan")
                .photoUrl("https://i.ibb.co/ref/alice.jpg")
                .build());
        faceClient.score(CAPTURED, alice.getPhotoUrl(), 90);
    }

    @AfterEach
    void cleanUp() {
        recordRepository.deleteAll();
        memberRepository.deleteAll();
    }

    @Test
    void simultaneousScansProduceOneRowWithOneCheckInAndOneCheckOut() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<ScanResponse> responses = new ArrayList<>();

        try {
            List<Future<ScanResponse>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return scanService.scan(new FaceScanRequest(CAPTURED,
                            new FaceScanRequest.UserLocation(3.1390, 101.6869)), "10.0.0.1");
                }));
            }
            start.countDown();
            for (Future<ScanResponse> f : futures) {
                responses.add(f.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(responses)
                .extracting(ScanResponse::getAction)
                .containsExactlyInAnyOrder(AttendanceAction.CHECK_IN, AttendanceAction.CHECK_OUT);

        List<AttendanceRecord> rows = recordRepository.findAll();
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getAttendanceDate()).isEqualTo(DAY);
        assertThat(rows.get(0).getCheckInTime()).isNotNull();
        assertThat(rows.get(0).getCheckOutTime()).isNotNull();
    }
}
