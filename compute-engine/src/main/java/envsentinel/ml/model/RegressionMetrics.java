package envsentinel.ml.model;

public final class RegressionMetrics {

    private RegressionMetrics() {}

    /**
     * Coeficiente de determinación R² = 1 - SS_res / SS_tot.
     * Con SS_tot = 0 devuelve 1.0 si el ajuste es perfecto y 0.0 si no. Sin filas devuelve NaN.
     */
    public static double r2(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("Longitudes distintas: " + actual.length + " vs " + predicted.length);
        }
        if (actual.length == 0) return Double.NaN;

        double mean = 0.0;
        for (double v : actual) mean += v;
        mean /= actual.length;

        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < actual.length; i++) {
            ssRes += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
            ssTot += (actual[i] - mean) * (actual[i] - mean);
        }
        if (ssTot == 0.0) return ssRes == 0.0 ? 1.0 : 0.0;
        return 1.0 - ssRes / ssTot;
    }
}
