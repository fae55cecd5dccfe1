package sp.sistemaspalacios.api_checkpoint.dto.policy;

import sp.sistemaspalacios.api_checkpoint.dto.geo.GeoPoint;

import java.time.LocalTime;

/**
 * Política de ubicación y horario que realmente se aplica a un miembro, etiquetada con
 * su origen. {@code center} nulo significa que no hay geocerca que validar.
 */
public record EffectivePolicy(
        PolicySource source,
        Long sourceId,
        GeoPoint center,
        double radiusMeters,
        LocalTime startTime,
        LocalTime endTime
) {

    public static EffectivePolicy none(double defaultRadius) {
        return new EffectivePolicy(PolicySource.NONE, null, null, defaultRadius, null, null);
    }

    public boolean hasGeofence() {
        return center != null;
    }
}
