package envsentinel.compute.service;

import envsentinel.compute.config.TrainingProperties;
import envsentinel.ml.feature.DatasetSplit;
import envsentinel.ml.feature.TargetDataset;
import envsentinel.ml.model.ForestAnomalyDetector;
import envsentinel.ml.model.RandomForestRegressor;
import envsentinel.ml.model.StandardScaler;
import envsentinel.ml.registry.ModelTriple;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Ajusta el trío de modelos de un parámetro a partir de su dataset ya preparado.
 */
@Component
@RequiredArgsConstructor
public class TripleTrainer {

    private final TrainingProperties properties;
    private final Clock clock;

    public TrainedTriple train(TargetDataset dataset) {
        // 1. Split reproducible
        DatasetSplit split = DatasetSplit.of(dataset, properties.testFraction(), properties.seed());

        // 2. Escalado ajustado solo con train
        StandardScaler scaler = StandardScaler.fit(split.trainFeatures(), dataset.layout());
        double[][] xTrain = scaler.transform(split.trainFeatures());
        double[][] xTest = scaler.transform(split.testFeatures());

        // 3. Regresor
        RandomForestRegressor regressor = RandomForestRegressor.fit(
                xTrain, split.trainValues(), properties.forestSettings(), clock.instant());

        // 4. Detector sobre las features escaladas de train
        ForestAnomalyDetector detector = ForestAnomalyDetector.fit(xTrain, properties.detectorSettings());

        // 5. Métricas (informativas, no hay umbral de calidad)
        double trainR2 = regressor.score(xTrain, split.trainValues());
        double testR2 = regressor.score(xTest, split.testValues());

        return new TrainedTriple(new ModelTriple(dataset.target(), regressor, scaler, detector), trainR2, testR2);
    }

    public record TrainedTriple(ModelTriple triple, double trainR2, double testR2) {}
}
