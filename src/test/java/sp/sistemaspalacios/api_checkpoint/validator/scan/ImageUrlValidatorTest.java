package sp.sistemaspalacios.api_checkpoint.validator.scan;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageUrlValidatorTest {

    private static final List<String> ALLOWED = List.of("i.ibb.co", "ibb.co");

    @Test
    void acceptsAllowListedHosts() {
        assertThatCode(() -> ImageUrlValidator.validateImageUrl("https://i.ibb.co/abc/face.jpg", ALLOWED))
                .doesNotThrowAnyException();
        assertThatCode(() -> ImageUrlValidator.validateImageUrl("https://IBB.CO/abc", ALLOWED))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsOtherHosts() {
        assertThatThrownBy(() -> ImageUrlValidator.validateImageUrl("https://evil.example.com/face.jpg", ALLOWED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage(ImageUrlValidator.UNTRUSTED_DOMAIN);
    }

    @Test
    void rejectsLookalikeSubdomains() {
        assertThatThrownBy(() -> ImageUrlValidator.validateImageUrl("https://i.ibb.co.evil.com/x.jpg", ALLOWED))
                .hasMessage(ImageUrlValidator.UNTRUSTED_DOMAIN);
    }

    @Test
    void rejectsNonHttpSchemes() {
        assertThatThrownBy(() -> ImageUrlValidator.validateImageUrl("ftp://i.ibb.co/x.jpg", ALLOWED))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
