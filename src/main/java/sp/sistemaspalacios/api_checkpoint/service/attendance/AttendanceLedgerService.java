package sp.sistemaspalacios.api_checkpoint.service.attendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.LedgerOutcome;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceAction;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_checkpoint.entity.member.Member;
import sp.sistemaspalacios.api_checkpoint.repository.attendance.AttendanceRecordRepository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ledger vivo de asistencia: una fila por miembro y día.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceLedgerService {

    private final AttendanceRecordRepository repository;

    @Transactional(readOnly = true)
    public Optional<AttendanceRecord> findForDay(Long memberId, LocalDate day) {
        return repository.findByMemberIdAndAttendanceDate(memberId, day);
    }

    /**
     * Acción que correspondería a una marcación en este momento: entrada si no hay fila
     * o la fila no tiene hora de entrada, salida en otro caso.
     */
    @Transactional(readOnly = true)
    public AttendanceAction nextAction(Long memberId, LocalDate day) {
        return findForDay(memberId, day)
                .map(AttendanceLedgerService::actionFor)
                .orElse(AttendanceAction.CHECK_IN);
    }

    /**
     * Upsert condicional de una marcación. Lee la fila del día con bloqueo, decide la
     * acción, clasifica y escribe en una sola transacción.
     * <ul>
     *   <li>Entrada: crea la fila o completa la fila pre-cargada (entrada nula) con hora,
     *       estado y ubicación.</li>
     *   <li>Salida: solo hora de salida y estado; se puede repetir.</li>
     * </ul>
     * Quien llama debe tener el lock (miembro, día) de {@link MemberDayLocks}.
     */
    @Transactional
    public LedgerOutcome applyScan(
            Member member,
            LocalDateTime now,
            String location,
            Function<AttendanceAction, AttendanceStatus> classifier
    ) {
        LocalDate day = now.toLocalDate();
        AttendanceRecord record = repository.findForUpdate(member.getId(), day).orElse(null);
        AttendanceAction action = record == null ? AttendanceAction.CHECK_IN : actionFor(record);
        AttendanceStatus status = classifier.apply(action);

        if (action == AttendanceAction.CHECK_IN) {
            if (record == null) {
                record = new AttendanceRecord();
                record.setMember(member);
                record.setAttendanceDate(day);
                record.setCreatedAt(now);
            }
            record.setCheckInTime(now);
            record.setStatus(status);
            record.setLocation(location);
            record.setUpdatedAt(now);
            AttendanceRecord saved = repository.saveAndFlush(record);

            log.info("✅ Entrada registrada - Miembro: {}, Estado: {}", member.getId(), status);
            return new LedgerOutcome(action, status, saved, false);
        }

        boolean repeated = record.getCheckOutTime() != null;
        record.setCheckOutTime(now);
        record.setStatus(status);
        record.setUpdatedAt(now);
        AttendanceRecord saved = repository.saveAndFlush(record);

        log.info("✅ Salida registrada{} - Miembro: {}, Estado: {}",
                repeated ? " (actualizada)" : "", member.getId(), status);
        return new LedgerOutcome(action, status, saved, repeated);
    }

    private static AttendanceAction actionFor(AttendanceRecord record) {
        return record.hasCheckIn() ? AttendanceAction.CHECK_OUT : AttendanceAction.CHECK_IN;
    }
}
