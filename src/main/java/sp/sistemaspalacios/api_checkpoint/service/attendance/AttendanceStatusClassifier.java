package sp.sistemaspalacios.api_checkpoint.service.attendance;

import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceAction;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceStatus;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * Deriva el estado de una marcación a partir de la hora de pared (zona de la
 * organización) y el límite de la ventana configurada. Se compara a nivel de minuto:
 * una entrada a las 09:00:45 con inicio 09:00 es puntual.
 */
@Component
public class AttendanceStatusClassifier {

    public AttendanceStatus classify(LocalTime eventTime, LocalTime boundary, AttendanceAction direction) {
        if (eventTime == null) {
            throw new IllegalArgumentException("Hora de marcación nula");
        }
        if (boundary == null) {
            return AttendanceStatus.PRESENT;
        }

        LocalTime event = eventTime.truncatedTo(ChronoUnit.MINUTES);
        LocalTime limit = boundary.truncatedTo(ChronoUnit.MINUTES);

        if (direction == AttendanceAction.CHECK_IN) {
            return event.isAfter(limit) ? AttendanceStatus.LATE : AttendanceStatus.PRESENT;
        }
        return event.isBefore(limit) ? AttendanceStatus.EARLY_OUT : AttendanceStatus.PRESENT;
    }
}
