package sp.sistemaspalacios.api_checkpoint.dto.attendance;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceAction;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_checkpoint.entity.member.Member;

/**
 * Respuesta del escaneo. Los rechazos de negocio (sin coincidencia, fuera de la
 * geocerca) viajan aquí con HTTP 200 y el campo {@code error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanResponse {

    public static final String USER_NOT_FOUND = "User not found";
    public static final String LOCATION_MISMATCH = "Location mismatch";

    private boolean match;
    private ScannedUser user;
    private Double confidence;
    private AttendanceAction action;
    private AttendanceStatus status;
    private String error;
    private String message;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScannedUser {
        @JsonProperty("user_id")
        private Long userId;

        @JsonProperty("first_name")
        private String firstName;

        @JsonProperty("last_name")
        private String lastName;

        public static ScannedUser of(Member member) {
            return new ScannedUser(member.getId(), member.getFirstName(), member.getLastName());
        }
    }

    public static ScanResponse userNotFound() {
        return ScanResponse.builder()
                .match(false)
                .error(USER_NOT_FOUND)
                .message(USER_NOT_FOUND)
                .build();
    }

    public static ScanResponse locationMismatch(Member member, double confidence, AttendanceAction attempted) {
        String verb = attempted == AttendanceAction.CHECK_OUT ? "Check-out" : "Check-in";
        return ScanResponse.builder()
                .match(true)
                .user(ScannedUser.of(member))
                .confidence(confidence)
                .error(LOCATION_MISMATCH)
                .message(String.format("%s is unsuccessful due to location mismatch. Pls try again, %s %s",
                        verb, member.getFirstName(), member.getLastName()))
                .action(attempted)
                .build();
    }

    public static ScanResponse recorded(Member member, double confidence, AttendanceAction action, AttendanceStatus status) {
        return ScanResponse.builder()
                .match(true)
                .user(ScannedUser.of(member))
                .confidence(confidence)
                .action(action)
                .status(status)
                .build();
    }
}
