package envsentinel.ml.model;

import com.amazon.randomcutforest.RandomCutForest;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Detector de anomalías no supervisado sobre vectores ya escalados.
 * <p>
 * Un Random Cut Forest da a cada punto un score de rareza (más alto = más raro).
 * Tras el ajuste se puntúan las propias filas de entrenamiento y se fija el umbral
 * ({@code offset}) en su cuantil {@code 1 - contamination}. La función de decisión es
 * {@code offset - score}: negativa para el {@code contamination} más raro del
 * entrenamiento y para todo lo que quede aún más lejos.
 */
@Slf4j
public final class ForestAnomalyDetector {

    private static final ForestAnomalyDetector UNFITTED = new ForestAnomalyDetector(null, Double.NaN, Double.NaN);

    private final RandomCutForest forest;
    private final double offset;
    private final double contamination;

    private ForestAnomalyDetector(RandomCutForest forest, double offset, double contamination) {
        this.forest = forest;
        this.offset = offset;
        this.contamination = contamination;
    }

    public static ForestAnomalyDetector unfitted() {
        return UNFITTED;
    }

    /**
     * Reconstruye un detector ya ajustado (p. ej. desde un checkpoint).
     */
    public static ForestAnomalyDetector restore(RandomCutForest forest, double offset, double contamination) {
        if (forest == null) throw new IllegalArgumentException("forest no puede ser null");
        return new ForestAnomalyDetector(forest, offset, contamination);
    }

    public static ForestAnomalyDetector fit(double[][] x, DetectorSettings settings) {
        if (x.length == 0) {
            throw new IllegalArgumentException("No se puede ajustar un detector sin filas");
        }
        int dimensions = x[0].length;

        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(dimensions)
                .numberOfTrees(settings.trees())
                .sampleSize(settings.sampleSize())
                .randomSeed(settings.seed())
                .outputAfter(1)
                .parallelExecutionEnabled(false)
                .build();

        for (double[] row : x) {
            if (row.length != dimensions) throw new FeatureDimensionException("ForestAnomalyDetector", dimensions, row.length);
            forest.update(row);
        }

        // Umbral: cuantil (1 - contamination) de los scores de entrenamiento
        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) scores[i] = forest.getAnomalyScore(x[i]);
        double offset = quantile(scores, 1.0 - settings.contamination());

        log.debug("Detector ajustado: {} filas, {} dimensiones, umbral {}", x.length, dimensions, offset);
        return new ForestAnomalyDetector(forest, offset, settings.contamination());
    }

    /**
     * Puntúa un vector escalado.
     * El bosque no garantiza lecturas concurrentes, de ahí el {@code synchronized}.
     */
    public synchronized AnomalyScore score(double[] scaled) {
        if (!isFitted()) throw new ModelNotFittedException("ForestAnomalyDetector");
        if (scaled.length != forest.getDimensions()) {
            throw new FeatureDimensionException("ForestAnomalyDetector", forest.getDimensions(), scaled.length);
        }
        double decision = offset - forest.getAnomalyScore(scaled);
        return new AnomalyScore(decision, decision < 0);
    }

    public boolean isFitted() {
        return forest != null;
    }

    public RandomCutForest getForest() {
        return forest;
    }

    public double getOffset() {
        return offset;
    }

    public double getContamination() {
        return contamination;
    }

    public int getDimensions() {
        return isFitted() ? forest.getDimensions() : 0;
    }

    /**
     * Cuantil con interpolación lineal entre los dos órdenes estadísticos vecinos.
     */
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }
}
