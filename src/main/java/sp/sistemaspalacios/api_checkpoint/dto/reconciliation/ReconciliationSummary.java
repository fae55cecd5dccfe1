package sp.sistemaspalacios.api_checkpoint.dto.reconciliation;

public record ReconciliationSummary(int archived, int updated, ArchiveSummary archive, SweepSummary sweep) {
}
