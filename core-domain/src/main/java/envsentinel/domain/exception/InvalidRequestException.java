package envsentinel.domain.exception;

/**
 * Petición mal formada por parte del cliente (ej: horizonte negativo, sensor sin id).
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
