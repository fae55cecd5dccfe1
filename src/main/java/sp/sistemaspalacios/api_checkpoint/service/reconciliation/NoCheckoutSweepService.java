package sp.sistemaspalacios.api_checkpoint.service.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_checkpoint.dto.reconciliation.SweepSummary;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_checkpoint.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.api_checkpoint.service.common.TimeService;
import sp.sistemaspalacios.api_checkpoint.service.policy.LocationPolicyResolver;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Marca como {@code no_checkout} toda fila sin hora de salida de días anteriores, y las
 * de hoy cuya hora de salida ya pasó.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NoCheckoutSweepService {

    private final AttendanceRecordRepository recordRepository;
    private final LocationPolicyResolver policyResolver;
    private final TimeService timeService;

    @Transactional
    public SweepSummary sweepNoCheckout() {
        LocalDateTime now = timeService.now();
        LocalDate today = now.toLocalDate();
        LocalTime currentTime = timeService.toMinuteOfDay(now.toLocalTime());

        List<AttendanceRecord> openSessions = recordRepository.findOpenSessions(AttendanceStatus.NO_CHECKOUT);
        int updated = 0;

        for (AttendanceRecord record : openSessions) {
            if (!isExpired(record, today, currentTime)) {
                continue;
            }
            int changed = recordRepository.markIfStillOpen(record.getId(), AttendanceStatus.NO_CHECKOUT, now);
            if (changed > 0) {
                updated++;
                log.info("Registro {} (miembro {}, {}) marcado sin salida",
                        record.getId(), record.getMember().getId(), record.getAttendanceDate());
            }
        }

        log.info("✅ Barrido sin salida - revisadas: {}, actualizadas: {}", openSessions.size(), updated);
        return new SweepSummary(openSessions.size(), updated);
    }

    private boolean isExpired(AttendanceRecord record, LocalDate today, LocalTime currentTime) {
        if (record.getAttendanceDate().isBefore(today)) {
            return true;
        }
        if (record.getAttendanceDate().isAfter(today)) {
            return false;
        }
        LocalTime endTime = timeService.toMinuteOfDay(policyResolver.resolveEndTime(record.getMember()));
        return endTime != null && currentTime.isAfter(endTime);
    }
}
