package sp.sistemaspalacios.api_checkpoint.service.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "attendance.reconciliation.scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;
    private final NoCheckoutSweepService sweepService;

    @Scheduled(cron = "${attendance.reconciliation.archive-cron:0 5 0 * * *}",
            zone = "${attendance.time-zone:Asia/Kuala_Lumpur}")
    public void nightly() {
        try {
            reconciliationService.runNightly();
        } catch (RuntimeException e) {
            log.error("❌ Error en la conciliación nocturna: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${attendance.reconciliation.sweep-cron:0 */15 * * * *}",
            zone = "${attendance.time-zone:Asia/Kuala_Lumpur}")
    public void noCheckoutSweep() {
        try {
            sweepService.sweepNoCheckout();
        } catch (RuntimeException e) {
            log.error("❌ Error en el barrido de salidas: {}", e.getMessage(), e);
        }
    }
}
