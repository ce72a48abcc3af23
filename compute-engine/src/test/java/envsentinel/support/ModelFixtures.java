package envsentinel.support;

import envsentinel.compute.config.TrainingProperties;
import envsentinel.domain.reading.Parameter;
import envsentinel.domain.reading.Reading;
import envsentinel.ml.feature.FeatureLayout;
import envsentinel.ml.model.DetectorSettings;
import envsentinel.ml.model.ForestAnomalyDetector;
import envsentinel.ml.model.ForestSettings;
import envsentinel.ml.model.RandomForestRegressor;
import envsentinel.ml.model.StandardScaler;
import envsentinel.ml.registry.ModelTriple;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Datos y modelos pequeños para los tests.
 */
public final class ModelFixtures {

    public static final Instant T0 = Instant.parse("2025-06-02T00:00:00Z");

    private ModelFixtures() {}

    /**
     * Ajustes por defecto con bosques pequeños para que los tests vayan rápido.
     */
    public static TrainingProperties fastTrainingProperties() {
        return new TrainingProperties(Duration.ofDays(30), Duration.ofHours(6), Duration.ofMinutes(5),
                true, true, 10, 0.2, 42L, 20, 10, 30, 64, 0.1, "UTC");
    }

    /**
     * Trío entrenado de verdad sobre datos aleatorios con semilla.
     *
     * @param covariates Códigos de las covariables del layout (ancho = 3 + covariables).
     */
    public static ModelTriple trainedTriple(Parameter parameter, List<String> covariates, Instant fittedAt) {
        FeatureLayout layout = FeatureLayout.of(covariates);
        Random random = new Random(11);
        double[][] x = new double[40][layout.width()];
        double[] y = new double[40];
        for (int i = 0; i < x.length; i++) {
            x[i][0] = i % 24;
            x[i][1] = i % 7;
            x[i][2] = 6;
            for (int j = 3; j < layout.width(); j++) x[i][j] = 10 + random.nextGaussian();
            y[i] = 7 + random.nextGaussian() * 0.1;
        }
        StandardScaler scaler = StandardScaler.fit(x, layout);
        double[][] scaled = scaler.transform(x);
        return new ModelTriple(parameter,
                RandomForestRegressor.fit(scaled, y, new ForestSettings(5, 4, 42L), fittedAt),
                scaler,
                ForestAnomalyDetector.fit(scaled, new DetectorSettings(20, 64, 0.1, 42L)));
    }

    /**
     * Lecturas de agua cada hora desde {@link #T0}: ph en [6.5, 8.5] y temperatura en [15, 20].
     * La lectura con índice {@code nullPhIndex} no reporta ph.
     *
     * @param withTurbidity Si además se reporta turbidez en [2, 3].
     */
    public static List<Reading> waterReadings(int count, int nullPhIndex, boolean withTurbidity) {
        Random random = new Random(3);
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Double> values = new HashMap<>();
            values.put("ph", i == nullPhIndex ? null : 6.5 + 2.0 * random.nextDouble());
            values.put("temperature", 15 + 5 * random.nextDouble());
            if (withTurbidity) values.put("turbidity", 2 + random.nextDouble());
            readings.add(new Reading(T0.plus(Duration.ofHours(i)), "WATER-001", "water", values));
        }
        return readings;
    }
}
