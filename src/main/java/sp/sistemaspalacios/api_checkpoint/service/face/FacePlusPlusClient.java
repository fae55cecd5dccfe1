package sp.sistemaspalacios.api_checkpoint.service.face;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import sp.sistemaspalacios.api_checkpoint.dto.face.FaceComparison;
import sp.sistemaspalacios.api_checkpoint.dto.face.FacePlusPlusCompareResponse;
import sp.sistemaspalacios.api_checkpoint.exception.FaceComparisonException;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class FacePlusPlusClient implements FaceComparisonClient {

    static final String RECOMMENDED_THRESHOLD_KEY = "1e-3";

    private final RestTemplate restTemplate;

    @Value("${face.compare.url:https://api-us.faceplusplus.com/facepp/v3/compare}")
    private String compareUrl;

    @Value("${face.compare.api-key:}")
    private String apiKey;

    @Value("${face.compare.api-secret:}")
    private String apiSecret;

    @Override
    public FaceComparison compare(String capturedImageUrl, String referencePhotoUrl) {
        if (apiKey.isBlank() || apiSecret.isBlank()) {
            throw new FaceComparisonException("Credenciales de Face++ no configuradas");
        }

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("api_key", apiKey);
        form.add("api_secret", apiSecret);
        form.add("image_url1", capturedImageUrl);
        form.add("image_url2", referencePhotoUrl);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        HttpEntity<MultiValueMap<String, Object>> request = new HttpEntity<>(form, headers);

        FacePlusPlusCompareResponse body;
        try {
            log.debug("📤 Face++ compare - URL: {}, referencia: {}", compareUrl, referencePhotoUrl);
            ResponseEntity<FacePlusPlusCompareResponse> response = restTemplate.exchange(
                    compareUrl,
                    HttpMethod.POST,
                    request,
                    FacePlusPlusCompareResponse.class
            );
            body = response.getBody();
        } catch (RestClientException e) {
            throw new FaceComparisonException("Error llamando a Face++: " + e.getMessage(), e);
        }

        if (body == null) {
            throw new FaceComparisonException("Face++ devolvió una respuesta vacía");
        }
        if (body.getErrorMessage() != null) {
            throw new FaceComparisonException("Face++ respondió con error: " + body.getErrorMessage());
        }

        double confidence = body.getConfidence() != null ? body.getConfidence() : 0d;
        Map<String, Double> thresholds = body.getThresholds();
        Double suggested = thresholds != null ? thresholds.get(RECOMMENDED_THRESHOLD_KEY) : null;

        return new FaceComparison(confidence, suggested);
    }
}
