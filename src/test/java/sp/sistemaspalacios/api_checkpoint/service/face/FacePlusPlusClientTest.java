package sp.sistemaspalacios.api_checkpoint.service.face;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;
import sp.sistemaspalacios.api_checkpoint.dto.face.FaceComparison;
import sp.sistemaspalacios.api_checkpoint.exception.FaceComparisonException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class FacePlusPlusClientTest {

    private static final String URL = "https://api-us.faceplusplus.com/facepp/v3/compare";

    private MockRestServiceServer server;
    private FacePlusPlusClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new FacePlusPlusClient(restTemplate);
        ReflectionTestUtils.setField(client, "compareUrl", URL);
        ReflectionTestUtils.setField(client, "apiKey", "key");
        ReflectionTestUtils.setField(client, "apiSecret", "secret");
    }

    @Test
    void readsConfidenceAndRecommendedThreshold() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("""
                        {"request_id":"r1","confidence":87.5,
                         "thresholds":{"1e-3":62.327,"1e-4":69.101,"1e-5":73.975}}
                        """, MediaType.APPLICATION_JSON));

        FaceComparison comparison = client.compare("https://i.ibb.co/a.jpg", "https://i.ibb.co/b.jpg");

        assertThat(comparison.confidence()).isEqualTo(87.5);
        assertThat(comparison.suggestedThreshold()).isEqualTo(62.327);
        server.verify();
    }

    @Test
    void noFaceDetectedIsZeroConfidence() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"request_id\":\"r2\"}", MediaType.APPLICATION_JSON));

        FaceComparison comparison = client.compare("https://i.ibb.co/a.jpg", "https://i.ibb.co/b.jpg");

        assertThat(comparison.confidence()).isZero();
        assertThat(comparison.suggestedThreshold()).isNull();
    }

    @Test
    void providerErrorMessageIsAComparisonFailure() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"error_message\":\"INVALID_IMAGE_URL\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.compare("https://i.ibb.co/a.jpg", "https://i.ibb.co/b.jpg"))
                .isInstanceOf(FaceComparisonException.class)
                .hasMessageContaining("INVALID_IMAGE_URL");
    }

    @Test
    void httpErrorIsAComparisonFailure() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.compare("https://i.ibb.co/a.jpg", "https://i.ibb.co/b.jpg"))
                .isInstanceOf(FaceComparisonException.class);
    }

    @Test
    void missingCredentialsFailWithoutCallingTheProvider() {
        ReflectionTestUtils.setField(client, "apiKey", "");

        assertThatThrownBy(() -> client.compare("https://i.ibb.co/a.jpg", "https://i.ibb.co/b.jpg"))
                .isInstanceOf(FaceComparisonException.class);
        server.verify();
    }
}
