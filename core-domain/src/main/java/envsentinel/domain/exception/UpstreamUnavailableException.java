package envsentinel.domain.exception;

/**
 * El almacén de lecturas no responde. No hay datos de los que tirar, así que la
 * operación completa (entrenamiento, predicción o chequeo) falla.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
