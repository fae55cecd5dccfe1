package sp.sistemaspalacios.api_checkpoint.service.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import sp.sistemaspalacios.api_checkpoint.dto.reconciliation.ArchiveSummary;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceHistory;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_checkpoint.repository.attendance.AttendanceHistoryRepository;
import sp.sistemaspalacios.api_checkpoint.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.api_checkpoint.service.common.TimeService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Mueve al histórico las filas del ledger de días anteriores.
 * <p>
 * Cada lote se copia y se elimina en una sola transacción. Si una copia quedó sin
 * borrar, la siguiente corrida la salta (llave {@code attendance_id}) y solo borra.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceArchiveService {

    private static final int MAX_CONFLICTS = 3;

    private final AttendanceRecordRepository recordRepository;
    private final AttendanceHistoryRepository historyRepository;
    private final TimeService timeService;
    private final TransactionTemplate transactionTemplate;

    @Value("${attendance.reconciliation.batch-size:200}")
    private int batchSize;

    public ArchiveSummary archivePriorDays() {
        LocalDate today = timeService.today();
        LocalDateTime archivedAt = timeService.now();
        log.info("🗄️ Archivando asistencia anterior a {}", today);

        int archived = 0;
        int skipped = 0;
        int deleted = 0;
        int noCheckout = 0;
        int conflicts = 0;

        while (true) {
            BatchResult batch;
            try {
                batch = transactionTemplate.execute(status -> archiveBatch(today, archivedAt));
            } catch (DataIntegrityViolationException e) {
                // Otra corrida archivó el mismo lote al mismo tiempo
                if (++conflicts > MAX_CONFLICTS) {
                    throw e;
                }
                log.warn("⚠️ Conflicto archivando lote ({}), reintentando", e.getMostSpecificCause().getMessage());
                continue;
            }

            if (batch == null || batch.selected() == 0) {
                break;
            }
            archived += batch.archived();
            skipped += batch.skipped();
            deleted += batch.deleted();
            noCheckout += batch.noCheckout();
        }

        log.info("✅ Archivado completado - copiadas: {}, ya existentes: {}, eliminadas: {}, sin salida: {}",
                archived, skipped, deleted, noCheckout);
        return new ArchiveSummary(today, archived, skipped, deleted, noCheckout);
    }

    private BatchResult archiveBatch(LocalDate today, LocalDateTime archivedAt) {
        List<AttendanceRecord> records = recordRepository
                .findByAttendanceDateBeforeOrderByIdAsc(today, PageRequest.of(0, batchSize));
        if (records.isEmpty()) {
            return new BatchResult(0, 0, 0, 0, 0);
        }

        List<Long> ids = records.stream().map(AttendanceRecord::getId).toList();
        Set<Long> alreadyArchived = historyRepository.findArchivedAttendanceIds(ids);

        List<AttendanceHistory> copies = new ArrayList<>();
        int noCheckout = 0;
        for (AttendanceRecord record : records) {
            AttendanceStatus finalStatus = finalStatusOf(record);
            if (finalStatus == AttendanceStatus.NO_CHECKOUT && record.getStatus() != AttendanceStatus.NO_CHECKOUT) {
                noCheckout++;
            }
            if (alreadyArchived.contains(record.getId())) {
                log.debug("Registro {} ya estaba en el histórico", record.getId());
                continue;
            }
            copies.add(AttendanceHistory.archiveOf(record, finalStatus, archivedAt));
        }

        historyRepository.saveAllAndFlush(copies);
        int deleted = recordRepository.deleteByIdIn(ids);

        return new BatchResult(records.size(), copies.size(), alreadyArchived.size(), deleted, noCheckout);
    }

    /** Toda fila de un día cerrado sin hora de salida se archiva como sin salida. */
    static AttendanceStatus finalStatusOf(AttendanceRecord record) {
        if (record.getCheckOutTime() == null) {
            return AttendanceStatus.NO_CHECKOUT;
        }
        return record.getStatus();
    }

    private record BatchResult(int selected, int archived, int skipped, int deleted, int noCheckout) {
    }
}
