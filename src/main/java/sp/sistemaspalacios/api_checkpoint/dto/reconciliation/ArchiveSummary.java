package sp.sistemaspalacios.api_checkpoint.dto.reconciliation;

import java.time.LocalDate;

/**
 * @param archivedBefore filas con fecha anterior a este día
 * @param archived       copias nuevas en el histórico
 * @param skipped        filas que ya estaban en el histórico (reintento)
 * @param deleted        filas eliminadas del ledger vivo
 * @param noCheckout     filas archivadas como sin salida
 */
public record ArchiveSummary(LocalDate archivedBefore, int archived, int skipped, int deleted, int noCheckout) {
}
