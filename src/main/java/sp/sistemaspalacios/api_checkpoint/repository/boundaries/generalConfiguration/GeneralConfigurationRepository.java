package sp.sistemaspalacios.api_checkpoint.repository.boundaries.generalConfiguration;

import org.springframework.data.jpa.repository.JpaRepository;
import sp.sistemaspalacios.api_checkpoint.entity.boundaries.generalConfiguration.GeneralConfiguration;
import sp.sistemaspalacios.api_checkpoint.entity.boundaries.generalConfiguration.GeneralConfigurationType;

import java.util.Optional;

public interface GeneralConfigurationRepository extends JpaRepository<GeneralConfiguration, Long> {
    Optional<GeneralConfiguration> findByType(GeneralConfigurationType type);
}
