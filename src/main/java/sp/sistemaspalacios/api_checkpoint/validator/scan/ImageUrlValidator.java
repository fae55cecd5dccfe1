package sp.sistemaspalacios.api_checkpoint.validator.scan;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Locale;

/**
 * Solo se aceptan imágenes alojadas en los dominios de la lista blanca. Se valida antes
 * de cualquier llamada externa.
 */
public class ImageUrlValidator {

    public static final String UNTRUSTED_DOMAIN = "Image URL from untrusted domain";

    private ImageUrlValidator() {
    }

    public static void validateImageUrl(String imageUrl, Collection<String> allowedHosts) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new IllegalArgumentException("La URL de la imagen es obligatoria.");
        }

        URI uri;
        try {
            uri = new URI(imageUrl.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(
                    String.format("La URL de la imagen '%s' no es válida.", imageUrl));
        }

        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("https") || scheme.equalsIgnoreCase("http"))) {
            throw new IllegalArgumentException("La URL de la imagen debe ser http o https.");
        }

        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException(UNTRUSTED_DOMAIN);
        }
        String normalizedHost = host.toLowerCase(Locale.ROOT);
        boolean trusted = allowedHosts.stream()
                .map(h -> h.trim().toLowerCase(Locale.ROOT))
                .anyMatch(normalizedHost::equals);
        if (!trusted) {
            throw new IllegalArgumentException(UNTRUSTED_DOMAIN);
        }
    }
}
