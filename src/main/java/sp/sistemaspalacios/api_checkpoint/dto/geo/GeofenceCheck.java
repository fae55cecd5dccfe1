package sp.sistemaspalacios.api_checkpoint.dto.geo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resultado de validar una posición contra una geocerca circular.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeofenceCheck {
    private boolean within;
    private double distanceMeters;
    private double radiusMeters;
}
