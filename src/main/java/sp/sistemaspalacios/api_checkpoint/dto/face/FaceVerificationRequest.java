package sp.sistemaspalacios.api_checkpoint.dto.face;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.hibernate.validator.constraints.URL;

@Data
public class FaceVerificationRequest {

    @NotNull(message = "memberId es requerido")
    private Long memberId;

    @NotBlank(message = "capturedImageUrl es requerido")
    @Size(max = 2048, message = "capturedImageUrl no puede superar 2048 caracteres")
    @URL(message = "capturedImageUrl debe ser una URL válida")
    private String capturedImageUrl;
}
