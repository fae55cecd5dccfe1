package sp.sistemaspalacios.api_checkpoint.service.common;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

@Service
@RequiredArgsConstructor
public class TimeService {

    // 24h: "HH:mm"
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final Clock organizationClock;

    /** Fecha y hora de pared en la zona de la organización. */
    public LocalDateTime now() {
        return LocalDateTime.now(organizationClock);
    }

    /** Día calendario actual en la zona de la organización (bucket del ledger). */
    public LocalDate today() {
        return LocalDate.now(organizationClock);
    }

    /** Hora truncada a minutos, igual que una comparación "HH:mm". */
    public LocalTime toMinuteOfDay(LocalTime time) {
        return time == null ? null : time.truncatedTo(ChronoUnit.MINUTES);
    }

    /** Formatea a "HH:mm". */
    public String format(LocalTime t) {
        return (t == null) ? null : t.format(HH_MM);
    }
}
