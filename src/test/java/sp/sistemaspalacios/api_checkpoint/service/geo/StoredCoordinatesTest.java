package sp.sistemaspalacios.api_checkpoint.service.geo;

import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.api_checkpoint.dto.geo.GeoPoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoredCoordinatesTest {

    @Test
    void parsesLongitudeFirst() {
        GeoPoint point = StoredCoordinates.parse("101.6869,3.1390");

        assertThat(point.latitude()).isEqualTo(3.1390);
        assertThat(point.longitude()).isEqualTo(101.6869);
    }

    @Test
    void toleratesWhitespace() {
        GeoPoint point = StoredCoordinates.parse(" 101.6869 , 3.1390 ");
        assertThat(point).isEqualTo(new GeoPoint(3.1390, 101.6869));
    }

    @Test
    void formatWritesLongitudeFirstAndParsesBack() {
        GeoPoint point = new GeoPoint(3.1390, 101.6869);
        String stored = StoredCoordinates.format(point);

        assertThat(stored).startsWith("101.6869,");
        assertThat(StoredCoordinates.parse(stored)).isEqualTo(point);
    }

    @Test
    void rejectsMalformedValues() {
        assertThatThrownBy(() -> StoredCoordinates.parse("101.6869")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StoredCoordinates.parse("abc,3.1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StoredCoordinates.parse(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsOutOfRangeLatitude() {
        // Orden invertido por error: "lat,lon" con longitud > 90 cae como latitud
        assertThatThrownBy(() -> StoredCoordinates.parse("3.1390,101.6869"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
