package envsentinel.ml.feature;

import envsentinel.domain.reading.Parameter;

/**
 * Matriz X / vector y listos para ajustar los modelos de un parámetro.
 * Las filas sin valor objetivo ya se han descartado y los huecos de X ya están imputados.
 */
public record TargetDataset(
        Parameter target,
        FeatureLayout layout,
        double[][] features,
        double[] values
) {

    public int size() {
        return values.length;
    }
}
