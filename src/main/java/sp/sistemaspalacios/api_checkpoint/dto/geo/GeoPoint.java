package sp.sistemaspalacios.api_checkpoint.dto.geo;

/**
 * Coordenada en grados decimales. En memoria siempre (latitud, longitud); el orden
 * de almacenamiento lo define {@link sp.sistemaspalacios.api_checkpoint.service.geo.StoredCoordinates}.
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitud fuera de rango [-90, 90]: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitud fuera de rango [-180, 180]: " + longitude);
        }
    }
}
