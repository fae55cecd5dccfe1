package sp.sistemaspalacios.api_checkpoint.dto.reconciliation;

public record SweepSummary(int checked, int updated) {
}
