package sp.sistemaspalacios.api_checkpoint.controller.face;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sp.sistemaspalacios.api_checkpoint.dto.face.FaceVerificationRequest;
import sp.sistemaspalacios.api_checkpoint.dto.face.FaceVerificationResponse;
import sp.sistemaspalacios.api_checkpoint.service.face.IdentityMatcherService;

@RestController
@RequestMapping("/api/face")
@RequiredArgsConstructor
public class FaceVerificationController {

    private final IdentityMatcherService identityMatcherService;

    /**
     * Verifica que la foto capturada corresponda a un miembro conocido
     * POST /api/face/verify
     */
    @PostMapping("/verify")
    public ResponseEntity<FaceVerificationResponse> verify(@Valid @RequestBody FaceVerificationRequest request) {
        return ResponseEntity.ok(
                identityMatcherService.verify(request.getMemberId(), request.getCapturedImageUrl()));
    }
}
