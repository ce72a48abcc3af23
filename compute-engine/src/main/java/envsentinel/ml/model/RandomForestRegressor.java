package envsentinel.ml.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Bosque aleatorio de regresión: media de {@code trees} árboles CART, cada uno
 * ajustado sobre un bootstrap de las filas.
 * <p>
 * Reproducible: las semillas de cada árbol se derivan de la semilla maestra antes de
 * construir, así que el resultado no depende del orden en que terminen los hilos.
 *
 * @param featureCount Ancho del vector de entrada.
 * @param trees        Árboles ajustados; vacío si el regresor no se ha ajustado.
 * @param fittedAt     Instante del ajuste, {@code null} si no se ha ajustado.
 */
public record RandomForestRegressor(int featureCount, List<RegressionTree> trees, Instant fittedAt) {

    private static final RandomForestRegressor UNFITTED = new RandomForestRegressor(0, List.of(), null);

    public RandomForestRegressor {
        trees = List.copyOf(trees);
    }

    public static RandomForestRegressor unfitted() {
        return UNFITTED;
    }

    public static RandomForestRegressor fit(double[][] x, double[] y, ForestSettings settings, Instant fittedAt) {
        if (x.length == 0 || x.length != y.length) {
            throw new IllegalArgumentException("Datos de entrenamiento vacíos o inconsistentes");
        }
        for (double v : y) {
            if (!Double.isFinite(v)) throw new IllegalArgumentException("El objetivo contiene valores no finitos");
        }
        int n = x.length;
        int width = x[0].length;

        // 1. Semillas por árbol, fijadas de antemano
        Random master = new Random(settings.seed());
        long[] seeds = new long[settings.trees()];
        for (int t = 0; t < seeds.length; t++) seeds[t] = master.nextLong();

        // 2. Árboles en paralelo; el orden del resultado lo fija el índice
        List<RegressionTree> trees = IntStream.range(0, settings.trees())
                .parallel()
                .mapToObj(t -> {
                    Random random = new Random(seeds[t]);
                    int[] bootstrap = new int[n];
                    for (int i = 0; i < n; i++) bootstrap[i] = random.nextInt(n);
                    return new RegressionTreeBuilder(x, y, settings.maxDepth()).build(bootstrap);
                })
                .toList();

        return new RandomForestRegressor(width, trees, fittedAt);
    }

    public double predict(double[] x) {
        if (!isFitted()) throw new ModelNotFittedException("RandomForestRegressor");
        if (x.length != featureCount) throw new FeatureDimensionException("RandomForestRegressor", featureCount, x.length);

        double sum = 0.0;
        for (RegressionTree tree : trees) sum += tree.predict(x);
        return sum / trees.size();
    }

    public double[] predict(double[][] rows) {
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) out[i] = predict(rows[i]);
        return out;
    }

    /**
     * R² de las predicciones sobre {@code (x, y)}.
     */
    public double score(double[][] x, double[] y) {
        return RegressionMetrics.r2(y, predict(x));
    }

    @JsonIgnore
    public boolean isFitted() {
        return !trees.isEmpty();
    }
}
