package sp.sistemaspalacios.api_checkpoint.service.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_checkpoint.dto.reconciliation.ArchiveSummary;
import sp.sistemaspalacios.api_checkpoint.dto.reconciliation.ReconciliationSummary;
import sp.sistemaspalacios.api_checkpoint.dto.reconciliation.SweepSummary;

/**
 * Corrida nocturna: primero marca sesiones abiertas, luego archiva los días cerrados.
 * Se puede ejecutar varias veces (o en paralelo) sin cambiar el resultado.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final NoCheckoutSweepService sweepService;
    private final AttendanceArchiveService archiveService;

    public ReconciliationSummary runNightly() {
        SweepSummary sweep = sweepService.sweepNoCheckout();
        ArchiveSummary archive = archiveService.archivePriorDays();
        return new ReconciliationSummary(archive.archived(), sweep.updated(), archive, sweep);
    }
}
