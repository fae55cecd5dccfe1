package sp.sistemaspalacios.api_checkpoint.dto.face;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;

/**
 * Cuerpo de /facepp/v3/compare. Solo se mapean los campos que usa el motor.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FacePlusPlusCompareResponse {

    private Double confidence;

    // Claves "1e-3", "1e-4", "1e-5"
    private Map<String, Double> thresholds;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("request_id")
    private String requestId;
}
