package envsentinel.compute.api;

import envsentinel.domain.exception.InvalidRequestException;
import envsentinel.domain.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Petición mal formada (ej: horizonte negativo, lectura sin valores).
     * Log: WARN (No es un error del sistema, es un error del cliente/petición).
     */
    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Object> handleInvalidRequest(InvalidRequestException ex) {
        log.warn("Petición no válida: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
    }

    /**
     * Parámetros que no se pueden convertir (ej: hours_ahead=abc) o cuerpo ilegible.
     */
    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Object> handleUnreadableRequest(Exception ex) {
        log.warn("Petición ilegible: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid Request", "Malformed request parameter or body");
    }

    /**
     * El almacén de lecturas no responde.
     * Log: ERROR con traza (es un fallo de infraestructura).
     */
    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<Object> handleUpstreamUnavailable(UpstreamUnavailableException ex) {
        log.error("Almacén de lecturas no disponible", ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage());
    }

    /**
     * Maneja todo lo demás.
     * Log: ERROR (Incluye StackTrace completo).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support referencing this timestamp.");
    }

    private static ResponseEntity<Object> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now(),
                "status", status.value(),
                "error", error,
                "message", message
        ));
    }
}
