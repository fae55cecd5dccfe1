package sp.sistemaspalacios.api_checkpoint.dto.face;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FaceVerificationResponse {

    private boolean matched;
    private VerifiedUser user;
    private Double confidence;
    private String message;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class VerifiedUser {
        @JsonProperty("user_id")
        private Long userId;
        private String name;
    }
}
