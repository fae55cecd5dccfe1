package sp.sistemaspalacios.api_checkpoint.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Reloj de la organización. Todas las decisiones de día y hora (bucket del ledger,
 * tarde / salida temprana, barridos nocturnos) se toman en esta zona y nunca en la
 * zona del servidor.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock organizationClock(@Value("${attendance.time-zone:Asia/Kuala_Lumpur}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
