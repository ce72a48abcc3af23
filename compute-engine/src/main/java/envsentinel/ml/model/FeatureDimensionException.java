package envsentinel.ml.model;

/**
 * El vector no tiene el ancho con el que se ajustó el modelo.
 */
public class FeatureDimensionException extends IllegalArgumentException {

    public FeatureDimensionException(String component, int expected, int actual) {
        super(String.format("%s espera %d columnas y recibió %d", component, expected, actual));
    }
}
