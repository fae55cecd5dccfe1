package sp.sistemaspalacios.api_checkpoint.entity.attendance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AttendanceStatus {
    PRESENT,
    LATE,
    EARLY_OUT,
    NO_CHECKOUT, // Entrada sin salida al cierre de la jornada
    ABSENT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
