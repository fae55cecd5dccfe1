package sp.sistemaspalacios.api_checkpoint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ApiCheckpointApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiCheckpointApplication.class, args);
    }
}
