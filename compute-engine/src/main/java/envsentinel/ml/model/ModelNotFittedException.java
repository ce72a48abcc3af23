package envsentinel.ml.model;

/**
 * Se ha usado un componente que todavía no se ha ajustado (trío por defecto).
 */
public class ModelNotFittedException extends IllegalStateException {

    public ModelNotFittedException(String component) {
        super(component + " no está ajustado todavía");
    }
}
