package sp.sistemaspalacios.api_checkpoint.dto.attendance;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.URL;
import sp.sistemaspalacios.api_checkpoint.dto.geo.GeoPoint;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FaceScanRequest {

    @NotBlank(message = "capturedImageUrl es requerido")
    @Size(max = 2048, message = "capturedImageUrl no puede superar 2048 caracteres")
    @URL(message = "capturedImageUrl debe ser una URL válida")
    private String capturedImageUrl;

    @NotNull(message = "userLocation es requerido")
    @Valid
    private UserLocation userLocation;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserLocation {
        @NotNull(message = "latitude es requerido")
        @DecimalMin(value = "-90.0", message = "latitude debe estar entre -90 y 90")
        @DecimalMax(value = "90.0", message = "latitude debe estar entre -90 y 90")
        private Double latitude;

        @NotNull(message = "longitude es requerido")
        @DecimalMin(value = "-180.0", message = "longitude debe estar entre -180 y 180")
        @DecimalMax(value = "180.0", message = "longitude debe estar entre -180 y 180")
        private Double longitude;

        public GeoPoint toGeoPoint() {
            return new GeoPoint(latitude, longitude);
        }
    }
}
