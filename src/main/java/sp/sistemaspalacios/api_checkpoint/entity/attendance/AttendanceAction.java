package sp.sistemaspalacios.api_checkpoint.entity.attendance;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AttendanceAction {
    CHECK_IN("check-in"),   // Entrada del día
    CHECK_OUT("check-out"); // Salida, se puede repetir

    private final String value;

    AttendanceAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
