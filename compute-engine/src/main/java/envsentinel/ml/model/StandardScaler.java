package envsentinel.ml.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import envsentinel.ml.feature.FeatureLayout;

import java.util.List;

/**
 * Normalización z-score columna a columna: {@code (x - media) / desviación}.
 * <p>
 * Desviación poblacional (ddof = 0). Las columnas constantes usan escala 1.0 para
 * no dividir por cero.
 *
 * @param layout Columnas sobre las que se ajustó, en orden.
 */
public record StandardScaler(FeatureLayout layout, double[] mean, double[] scale) {

    private static final StandardScaler UNFITTED =
            new StandardScaler(new FeatureLayout(List.of()), new double[0], new double[0]);

    public StandardScaler {
        if (mean.length != scale.length || mean.length != layout.width()) {
            throw new IllegalArgumentException("Media, escala y layout deben tener el mismo ancho");
        }
    }

    public static StandardScaler unfitted() {
        return UNFITTED;
    }

    public static StandardScaler fit(double[][] x, FeatureLayout layout) {
        if (x.length == 0) {
            throw new IllegalArgumentException("No se puede ajustar un escalador sin filas");
        }
        int width = layout.width();
        double[] mean = new double[width];
        double[] scale = new double[width];

        for (double[] row : x) {
            if (row.length != width) throw new FeatureDimensionException("StandardScaler", width, row.length);
            for (int j = 0; j < width; j++) mean[j] += row[j];
        }
        for (int j = 0; j < width; j++) mean[j] /= x.length;

        for (double[] row : x) {
            for (int j = 0; j < width; j++) {
                double d = row[j] - mean[j];
                scale[j] += d * d;
            }
        }
        for (int j = 0; j < width; j++) {
            double std = Math.sqrt(scale[j] / x.length);
            scale[j] = std < 1e-12 ? 1.0 : std;
        }
        return new StandardScaler(layout, mean, scale);
    }

    public double[] transform(double[] row) {
        if (!isFitted()) throw new ModelNotFittedException("StandardScaler");
        if (row.length != mean.length) throw new FeatureDimensionException("StandardScaler", mean.length, row.length);

        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - mean[j]) / scale[j];
        }
        return out;
    }

    public double[][] transform(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) out[i] = transform(rows[i]);
        return out;
    }

    @JsonIgnore
    public boolean isFitted() {
        return !layout.isEmpty();
    }
}
