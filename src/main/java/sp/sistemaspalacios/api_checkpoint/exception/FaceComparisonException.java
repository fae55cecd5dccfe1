package sp.sistemaspalacios.api_checkpoint.exception;

/**
 * Falla de una sola comparación facial. El matcher la registra y continúa con el
 * siguiente candidato.
 */
public class FaceComparisonException extends RuntimeException {
    public FaceComparisonException(String message) {
        super(message);
    }

    public FaceComparisonException(String message, Throwable cause) {
        super(message, cause);
    }
}
