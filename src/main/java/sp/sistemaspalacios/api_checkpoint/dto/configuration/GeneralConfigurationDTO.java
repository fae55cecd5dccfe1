package sp.sistemaspalacios.api_checkpoint.dto.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GeneralConfigurationDTO {
    @NotBlank(message = "value es requerido")
    private String value;
}
