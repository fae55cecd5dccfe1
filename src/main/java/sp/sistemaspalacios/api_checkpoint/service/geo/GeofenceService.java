package sp.sistemaspalacios.api_checkpoint.service.geo;

import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_checkpoint.dto.geo.GeoPoint;
import sp.sistemaspalacios.api_checkpoint.dto.geo.GeofenceCheck;

@Service
public class GeofenceService {

    /** Radio medio de la Tierra en metros. */
    public static final double EARTH_RADIUS_METERS = 6_371_000d;

    /**
     * Distancia de círculo máximo (Haversine) en metros.
     */
    public double distanceMeters(GeoPoint a, GeoPoint b) {
        double phi1 = Math.toRadians(a.latitude());
        double phi2 = Math.toRadians(b.latitude());
        double deltaPhi = Math.toRadians(b.latitude() - a.latitude());
        double deltaLambda = Math.toRadians(b.longitude() - a.longitude());

        double sinPhi = Math.sin(deltaPhi / 2);
        double sinLambda = Math.sin(deltaLambda / 2);
        double h = sinPhi * sinPhi + Math.cos(phi1) * Math.cos(phi2) * sinLambda * sinLambda;

        return 2 * EARTH_RADIUS_METERS * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    /**
     * ¿Está {@code position} dentro del círculo de radio {@code radiusMeters} alrededor de
     * {@code center}? El borde cuenta como dentro.
     */
    public GeofenceCheck check(GeoPoint position, GeoPoint center, double radiusMeters) {
        if (radiusMeters < 0) {
            throw new IllegalArgumentException("El radio de la geocerca no puede ser negativo: " + radiusMeters);
        }
        double distance = distanceMeters(position, center);
        return GeofenceCheck.builder()
                .within(distance <= radiusMeters)
                .distanceMeters(distance)
                .radiusMeters(radiusMeters)
                .build();
    }
}
