package sp.sistemaspalacios.api_checkpoint.dto.face;

/**
 * Respuesta de una comparación facial: similitud 0-100 y, si el proveedor la entrega,
 * el umbral de aceptación que recomienda.
 */
public record FaceComparison(double confidence, Double suggestedThreshold) {
}
