package envsentinel.ml.registry;

import envsentinel.domain.reading.Parameter;
import envsentinel.ml.model.ForestAnomalyDetector;
import envsentinel.ml.model.RandomForestRegressor;
import envsentinel.ml.model.StandardScaler;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Regresor, escalador y detector de UN parámetro.
 * <p>
 * Inmutable: nunca se actualiza un campo suelto, se sustituye el trío entero.
 * Así un regresor nuevo no puede acabar emparejado con un escalador viejo.
 */
public record ModelTriple(
        Parameter parameter,
        RandomForestRegressor regressor,
        StandardScaler scaler,
        ForestAnomalyDetector detector
) {

    public ModelTriple {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(regressor, "regressor");
        Objects.requireNonNull(scaler, "scaler");
        Objects.requireNonNull(detector, "detector");
    }

    /**
     * Trío por defecto de un parámetro que nunca se ha entrenado.
     * Se puede consultar sin riesgo; usarlo para predecir lanza
     * {@link envsentinel.ml.model.ModelNotFittedException}.
     */
    public static ModelTriple untrained(Parameter parameter) {
        return new ModelTriple(parameter,
                RandomForestRegressor.unfitted(),
                StandardScaler.unfitted(),
                ForestAnomalyDetector.unfitted());
    }

    public boolean isTrained() {
        return regressor.isFitted() && scaler.isFitted() && detector.isFitted();
    }

    public Optional<Instant> trainedAt() {
        return isTrained() ? Optional.ofNullable(regressor.fittedAt()) : Optional.empty();
    }
}
