package sp.sistemaspalacios.api_checkpoint.dto.face;

import java.util.Locale;

/**
 * Cómo se decide el umbral de aceptación de una comparación facial.
 */
public enum MatchThresholdPolicy {
    FIXED,    // Umbral constante configurado (por defecto 70)
    PROVIDER; // Umbral sugerido por el proveedor en cada respuesta

    public static MatchThresholdPolicy from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Política de umbral vacía");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Política de umbral inválida: " + raw + ". Usa FIXED o PROVIDER.");
        }
    }
}
