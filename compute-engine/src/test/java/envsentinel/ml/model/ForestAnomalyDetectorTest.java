package envsentinel.ml.model;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ForestAnomalyDetectorTest {

    private static final DetectorSettings SETTINGS = new DetectorSettings(50, 256, 0.1, 42L);

    private static double[][] training;
    private static ForestAnomalyDetector detector;

    @BeforeAll
    static void fitDetector() {
        Random random = new Random(7);
        training = new double[200][4];
        for (double[] row : training) {
            for (int j = 0; j < row.length; j++) row[j] = random.nextGaussian();
        }
        detector = ForestAnomalyDetector.fit(training, SETTINGS);
    }

    @Test
    @DisplayName("Un punto muy alejado es anómalo y tiene score negativo")
    void score_ShouldFlagFarPoint() {
        AnomalyScore score = detector.score(new double[]{40, 40, 40, 40});

        assertThat(score.anomaly()).isTrue();
        assertThat(score.decision()).isNegative();
    }

    @Test
    @DisplayName("El centro de la nube no es anómalo")
    void score_ShouldAcceptCentralPoint() {
        AnomalyScore score = detector.score(new double[]{0, 0, 0, 0});

        assertThat(score.anomaly()).isFalse();
        assertThat(score.decision()).isPositive();
    }

    @Test
    @DisplayName("Con contamination 0.1, en torno al 10% del entrenamiento queda marcado")
    void fit_ShouldCalibrateOffsetToContamination() {
        long flagged = 0;
        for (double[] row : training) {
            if (detector.score(row).anomaly()) flagged++;
        }
        assertThat(flagged / (double) training.length).isCloseTo(0.1, within(0.05));
    }

    @Test
    @DisplayName("Ancho distinto o detector sin ajustar: excepción")
    void score_ShouldValidateState() {
        assertThatThrownBy(() -> detector.score(new double[]{0, 0, 0}))
                .isInstanceOf(FeatureDimensionException.class);
        assertThatThrownBy(() -> ForestAnomalyDetector.unfitted().score(new double[]{0, 0, 0, 0}))
                .isInstanceOf(ModelNotFittedException.class);
    }

    @Test
    @DisplayName("Cuantil con interpolación lineal")
    void quantile_ShouldInterpolate() {
        double[] values = {4, 1, 3, 2, 5};

        assertThat(ForestAnomalyDetector.quantile(values, 0.5)).isEqualTo(3.0);
        assertThat(ForestAnomalyDetector.quantile(values, 0.9)).isCloseTo(4.6, within(1e-12));
        assertThat(ForestAnomalyDetector.quantile(values, 1.0)).isEqualTo(5.0);
    }
}
