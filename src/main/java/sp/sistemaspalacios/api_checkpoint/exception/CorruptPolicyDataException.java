package sp.sistemaspalacios.api_checkpoint.exception;

/**
 * La política guardada de un grupo o departamento no se puede interpretar
 * (por ejemplo, una ubicación mal formada). Es un error de datos del servidor.
 */
public class CorruptPolicyDataException extends RuntimeException {
    public CorruptPolicyDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
