package envsentinel.ml.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Ajuste CART de un árbol de regresión por reducción de varianza (error cuadrático).
 * <p>
 * Se evalúan todas las columnas en cada nodo; el umbral es el punto medio entre dos
 * valores consecutivos distintos. Se deja de partir al alcanzar la profundidad máxima,
 * con menos de 2 muestras o cuando el nodo es puro.
 */
final class RegressionTreeBuilder {

    private static final int MIN_SAMPLES_SPLIT = 2;
    private static final int MIN_SAMPLES_LEAF = 1;

    private final double[][] x;
    private final double[] y;
    private final int maxDepth;

    // Nodos en construcción (se aplanan al final)
    private final List<Integer> feature = new ArrayList<>();
    private final List<Double> threshold = new ArrayList<>();
    private final List<Integer> left = new ArrayList<>();
    private final List<Integer> right = new ArrayList<>();
    private final List<Double> value = new ArrayList<>();

    RegressionTreeBuilder(double[][] x, double[] y, int maxDepth) {
        this.x = x;
        this.y = y;
        this.maxDepth = maxDepth;
    }

    /**
     * @param samples Índices de filas (con repeticiones si vienen de un bootstrap).
     */
    RegressionTree build(int[] samples) {
        grow(samples, 0);
        return new RegressionTree(
                feature.stream().mapToInt(Integer::intValue).toArray(),
                threshold.stream().mapToDouble(Double::doubleValue).toArray(),
                left.stream().mapToInt(Integer::intValue).toArray(),
                right.stream().mapToInt(Integer::intValue).toArray(),
                value.stream().mapToDouble(Double::doubleValue).toArray());
    }

    private int grow(int[] samples, int depth) {
        int node = newLeaf(mean(samples));

        if (depth >= maxDepth || samples.length < MIN_SAMPLES_SPLIT || isPure(samples)) {
            return node;
        }

        Split best = findBestSplit(samples);
        if (best == null) {
            return node;
        }

        int[] leftSamples = Arrays.stream(samples).filter(i -> x[i][best.feature()] <= best.threshold()).toArray();
        int[] rightSamples = Arrays.stream(samples).filter(i -> x[i][best.feature()] > best.threshold()).toArray();

        feature.set(node, best.feature());
        threshold.set(node, best.threshold());
        left.set(node, grow(leftSamples, depth + 1));
        right.set(node, grow(rightSamples, depth + 1));
        return node;
    }

    /**
     * Maximizar {@code sumL²/nL + sumR²/nR} equivale a minimizar el SSE de los dos hijos.
     */
    private Split findBestSplit(int[] samples) {
        int n = samples.length;
        double total = 0.0;
        for (int i : samples) total += y[i];

        Split best = null;
        double bestGain = total * total / n; // proxy del nodo sin partir

        for (int f = 0; f < x[0].length; f++) {
            final int col = f;
            int[] sorted = IntStream.of(samples).boxed()
                    .sorted(Comparator.comparingDouble(i -> x[i][col]))
                    .mapToInt(Integer::intValue)
                    .toArray();

            double leftSum = 0.0;
            for (int k = 1; k < n; k++) {
                leftSum += y[sorted[k - 1]];
                double prev = x[sorted[k - 1]][col];
                double next = x[sorted[k]][col];
                if (prev == next || k < MIN_SAMPLES_LEAF || n - k < MIN_SAMPLES_LEAF) continue;

                double rightSum = total - leftSum;
                double gain = leftSum * leftSum / k + rightSum * rightSum / (n - k);
                if (gain > bestGain + 1e-12) {
                    bestGain = gain;
                    double cut = prev + (next - prev) / 2.0;
                    // Con valores muy próximos el punto medio puede redondear a 'next'
                    best = new Split(col, cut >= next ? prev : cut);
                }
            }
        }
        return best;
    }

    private int newLeaf(double leafValue) {
        feature.add(RegressionTree.LEAF);
        threshold.add(0.0);
        left.add(RegressionTree.LEAF);
        right.add(RegressionTree.LEAF);
        value.add(leafValue);
        return feature.size() - 1;
    }

    private double mean(int[] samples) {
        double sum = 0.0;
        for (int i : samples) sum += y[i];
        return sum / samples.length;
    }

    private boolean isPure(int[] samples) {
        double first = y[samples[0]];
        for (int i : samples) {
            if (y[i] != first) return false;
        }
        return true;
    }

    private record Split(int feature, double threshold) {}
}
