package sp.sistemaspalacios.api_checkpoint.service.geo;

import sp.sistemaspalacios.api_checkpoint.dto.geo.GeoPoint;

/**
 * Formato único de coordenadas persistidas: {@code "longitud,latitud"} en grados
 * decimales (ej. Kuala Lumpur = {@code "101.6869,3.1390"}).
 * <p>
 * Aplica a la ubicación de departamentos y grupos y a la ubicación guardada en cada
 * marcación. Ningún otro código debe partir estos textos a mano.
 */
public final class StoredCoordinates {

    private StoredCoordinates() {
    }

    public static GeoPoint parse(String stored) {
        if (stored == null || stored.isBlank()) {
            throw new IllegalArgumentException("Coordenada almacenada vacía");
        }
        String[] parts = stored.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException(
                    String.format("Coordenada '%s' no tiene formato 'longitud,latitud'.", stored));
        }
        try {
            double longitude = Double.parseDouble(parts[0].trim());
            double latitude = Double.parseDouble(parts[1].trim());
            return new GeoPoint(latitude, longitude);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Coordenada '%s' contiene valores no numéricos.", stored));
        }
    }

    public static String format(GeoPoint point) {
        return point.longitude() + "," + point.latitude();
    }
}
