package sp.sistemaspalacios.api_checkpoint.service.attendance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.FaceScanRequest;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.LedgerOutcome;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.ScanResponse;
import sp.sistemaspalacios.api_checkpoint.dto.face.IdentityMatch;
import sp.sistemaspalacios.api_checkpoint.dto.policy.EffectivePolicy;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceAction;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_checkpoint.entity.member.Member;
import sp.sistemaspalacios.api_checkpoint.service.common.TimeService;
import sp.sistemaspalacios.api_checkpoint.service.face.IdentityMatcherService;
import sp.sistemaspalacios.api_checkpoint.service.geo.GeofenceService;
import sp.sistemaspalacios.api_checkpoint.service.policy.LocationPolicyResolver;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Otro nodo inserta la fila del día entre la lectura y la escritura: la marcación se
 * reintenta una sola vez.
 */
@ExtendWith(MockitoExtension.class)
class AttendanceScanServiceRetryTest {

    private static final String CAPTURED = "https://i.ibb.co/scan/capture.jpg";
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);

    @Mock
    private IdentityMatcherService identityMatcher;

    @Mock
    private LocationPolicyResolver policyResolver;

    @Mock
    private AttendanceLedgerService ledger;

    @Mock
    private TimeService timeService;

    private final MemberDayLocks memberDayLocks = new MemberDayLocks();
    private final Member alice = Member.builder().id(7L).firstName("Alice").lastName("Tan")
            .photoUrl("https://i.ibb.co/ref/alice.jpg").build();

    private AttendanceScanService scanService;

    @BeforeEach
    void setUp() {
        scanService = new AttendanceScanService(identityMatcher, policyResolver, new GeofenceService(),
                ledger, new AttendanceStatusClassifier(), memberDayLocks, timeService);
        ReflectionTestUtils.setField(scanService, "allowedImageHosts", List.of("i.ibb.co"));

        when(identityMatcher.candidatePool()).thenReturn(List.of(alice));
        when(identityMatcher.match(CAPTURED, List.of(alice)))
                .thenReturn(Optional.of(new IdentityMatch(alice, 90, 70)));
        when(policyResolver.resolveEffectivePolicy(alice)).thenReturn(EffectivePolicy.none(500));
        when(timeService.now()).thenReturn(NOW);
    }

    @Test
    void lostInsertRaceIsRetriedAsCheckOut() {
        LedgerOutcome checkOut = new LedgerOutcome(
                AttendanceAction.CHECK_OUT, AttendanceStatus.EARLY_OUT, new AttendanceRecord(), false);
        when(ledger.applyScan(eq(alice), eq(NOW), anyString(), any()))
                .thenThrow(new DataIntegrityViolationException("uk_attendance_member_day"))
                .thenReturn(checkOut);

        ScanResponse response = scanService.scan(request(), "10.0.0.1");

        assertThat(response.getAction()).isEqualTo(AttendanceAction.CHECK_OUT);
        assertThat(response.getStatus()).isEqualTo(AttendanceStatus.EARLY_OUT);
        verify(ledger, times(2)).applyScan(eq(alice), eq(NOW), anyString(), any());
        assertThat(memberDayLocks.activeKeys()).isZero();
    }

    @Test
    void secondConflictPropagates() {
        when(ledger.applyScan(eq(alice), eq(NOW), anyString(), any()))
                .thenThrow(new DataIntegrityViolationException("uk_attendance_member_day"));

        assertThatThrownBy(() -> scanService.scan(request(), "10.0.0.1"))
                .isInstanceOf(DataIntegrityViolationException.class);
        verify(ledger, times(2)).applyScan(eq(alice), eq(NOW), anyString(), any());
    }

    private static FaceScanRequest request() {
        return new FaceScanRequest(CAPTURED, new FaceScanRequest.UserLocation(3.1390, 101.6869));
    }
}
