package sp.sistemaspalacios.api_checkpoint.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> onBeanValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", "VALIDATION_ERROR");
        body.put("message", "La solicitud no pasó validación");
        body.put("validationErrors", ex.getBindingResult().getFieldErrors()
                .stream().map(f -> f.getField() + ": " + f.getDefaultMessage()).toList());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> onUnreadableBody(HttpMessageNotReadableException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", "Invalid input");
        body.put("message", "El cuerpo de la solicitud no es un JSON válido");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> onIllegalArgument(IllegalArgumentException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", ex.getMessage());
        body.put("message", ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> onNotFound(ResourceNotFoundException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", "NOT_FOUND");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(FaceServiceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> onFaceServiceUnavailable(FaceServiceUnavailableException ex) {
        log.error("❌ Servicio de comparación facial no disponible: {}", ex.getMessage(), ex);
        return internalError("FACE_SERVICE_UNAVAILABLE", ex);
    }

    @ExceptionHandler(CorruptPolicyDataException.class)
    public ResponseEntity<Map<String, Object>> onCorruptPolicyData(CorruptPolicyDataException ex) {
        log.error("❌ Política guardada inválida: {}", ex.getMessage(), ex);
        return internalError("POLICY_DATA_ERROR", ex);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> onDataAccess(DataAccessException ex) {
        log.error("❌ Error de base de datos: {}", ex.getMessage(), ex);
        return internalError("DATABASE_ERROR", ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> onUnexpected(Exception ex) {
        log.error("❌ Error inesperado: {}", ex.getMessage(), ex);
        return internalError("INTERNAL_ERROR", ex);
    }

    private ResponseEntity<Map<String, Object>> internalError(String code, Exception ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", code);
        body.put("message", "Ocurrió un error inesperado: " + ex.getMessage());
        body.put("rootCause", rootCause(ex));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private String rootCause(Throwable t) {
        Throwable c = t;
        while (c.getCause() != null && c.getCause() != c) {
            c = c.getCause();
        }
        return c.getClass().getSimpleName();
    }
}
