package sp.sistemaspalacios.api_checkpoint.controller.reconciliation;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sp.sistemaspalacios.api_checkpoint.dto.reconciliation.ArchiveSummary;
import sp.sistemaspalacios.api_checkpoint.dto.reconciliation.ReconciliationSummary;
import sp.sistemaspalacios.api_checkpoint.dto.reconciliation.SweepSummary;
import sp.sistemaspalacios.api_checkpoint.service.reconciliation.AttendanceArchiveService;
import sp.sistemaspalacios.api_checkpoint.service.reconciliation.NoCheckoutSweepService;
import sp.sistemaspalacios.api_checkpoint.service.reconciliation.ReconciliationService;

/**
 * Disparadores para un programador externo. Todas las operaciones son idempotentes.
 */
@RestController
@RequestMapping("/api/attendance/reconciliation")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final AttendanceArchiveService archiveService;
    private final NoCheckoutSweepService sweepService;

    // POST /api/attendance/reconciliation/run
    @PostMapping("/run")
    public ResponseEntity<ReconciliationSummary> run() {
        return ResponseEntity.ok(reconciliationService.runNightly());
    }

    // POST /api/attendance/reconciliation/archive
    @PostMapping("/archive")
    public ResponseEntity<ArchiveSummary> archive() {
        return ResponseEntity.ok(archiveService.archivePriorDays());
    }

    // POST /api/attendance/reconciliation/no-checkout
    @PostMapping("/no-checkout")
    public ResponseEntity<SweepSummary> sweepNoCheckout() {
        return ResponseEntity.ok(sweepService.sweepNoCheckout());
    }
}
