package sp.sistemaspalacios.api_checkpoint.entity.boundaries.generalConfiguration;

import java.util.Arrays;
import java.util.Locale;

public enum GeneralConfigurationType {
    MATCH_THRESHOLD_POLICY,  // FIXED o PROVIDER
    MATCH_THRESHOLD,         // Umbral fijo 0-100
    DEFAULT_GEOFENCE_RADIUS; // Metros, cuando el grupo/departamento no define radio

    public static GeneralConfigurationType from(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Tipo de configuración nulo");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Tipo de configuración desconocido: " + raw));
    }
}
