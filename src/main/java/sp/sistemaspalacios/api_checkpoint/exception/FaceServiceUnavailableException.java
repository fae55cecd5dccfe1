package sp.sistemaspalacios.api_checkpoint.exception;

/**
 * Ninguna comparación del pool pudo completarse: el servicio facial no está disponible.
 */
public class FaceServiceUnavailableException extends RuntimeException {
    public FaceServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
