package envsentinel.compute.service;

import envsentinel.domain.dto.training.ParameterOutcomeDTO;
import envsentinel.domain.reading.Parameter;

/**
 * Resultado de un parámetro dentro de un ciclo de entrenamiento.
 *
 * @param samples Filas utilizables (objetivo no nulo).
 * @param trainR2 NaN si no se entrenó.
 * @param testR2  NaN si no se entrenó.
 */
public record ParameterOutcome(
        Parameter parameter,
        Status status,
        int samples,
        double trainR2,
        double testR2,
        String message
) {

    public enum Status {
        TRAINED,
        SKIPPED_INSUFFICIENT_SAMPLES,
        FAILED
    }

    public static ParameterOutcome trained(Parameter parameter, int samples, double trainR2, double testR2) {
        return new ParameterOutcome(parameter, Status.TRAINED, samples, trainR2, testR2, null);
    }

    public static ParameterOutcome skipped(Parameter parameter, int samples, int minSamples) {
        return new ParameterOutcome(parameter, Status.SKIPPED_INSUFFICIENT_SAMPLES, samples, Double.NaN, Double.NaN,
                "Datos insuficientes: " + samples + " muestras (mínimo " + minSamples + ")");
    }

    public static ParameterOutcome failed(Parameter parameter, int samples, Exception cause) {
        return new ParameterOutcome(parameter, Status.FAILED, samples, Double.NaN, Double.NaN,
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    public ParameterOutcomeDTO toResponse() {
        return new ParameterOutcomeDTO(parameter.getCode(), status.name(), samples,
                finiteOrNull(trainR2), finiteOrNull(testR2), message);
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
