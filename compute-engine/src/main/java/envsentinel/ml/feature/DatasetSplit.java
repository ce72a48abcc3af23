package envsentinel.ml.feature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Partición train/test reproducible: barajado con semilla y las primeras
 * {@code ceil(n * testFraction)} filas van a test.
 */
public record DatasetSplit(
        double[][] trainFeatures,
        double[] trainValues,
        double[][] testFeatures,
        double[] testValues
) {

    public static DatasetSplit of(TargetDataset dataset, double testFraction, long seed) {
        int n = dataset.size();
        if (testFraction < 0.0 || testFraction >= 1.0) {
            throw new IllegalArgumentException("testFraction debe estar en [0, 1): " + testFraction);
        }
        int testSize = (int) Math.ceil(n * testFraction);
        if (n - testSize < 1) {
            throw new IllegalArgumentException("No quedan filas de entrenamiento (n=" + n + ")");
        }

        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) order.add(i);
        Collections.shuffle(order, new Random(seed));

        double[][] xTest = new double[testSize][];
        double[] yTest = new double[testSize];
        double[][] xTrain = new double[n - testSize][];
        double[] yTrain = new double[n - testSize];

        for (int i = 0; i < n; i++) {
            int row = order.get(i);
            if (i < testSize) {
                xTest[i] = dataset.features()[row];
                yTest[i] = dataset.values()[row];
            } else {
                xTrain[i - testSize] = dataset.features()[row];
                yTrain[i - testSize] = dataset.values()[row];
            }
        }
        return new DatasetSplit(xTrain, yTrain, xTest, yTest);
    }
}
