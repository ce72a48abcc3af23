package envsentinel.compute.service;

import envsentinel.compute.repository.ReadingStore;
import envsentinel.domain.dto.prediction.AnomalyResponseDTO;
import envsentinel.domain.dto.prediction.AnomalyScoreDTO;
import envsentinel.domain.dto.prediction.ForecastResponseDTO;
import envsentinel.domain.dto.prediction.ParameterForecastDTO;
import envsentinel.domain.exception.InvalidRequestException;
import envsentinel.domain.reading.Parameter;
import envsentinel.domain.reading.Reading;
import envsentinel.ml.feature.FeatureBuilder;
import envsentinel.ml.model.AnomalyScore;
import envsentinel.ml.model.FeatureDimensionException;
import envsentinel.ml.model.ModelNotFittedException;
import envsentinel.ml.registry.ModelRegistry;
import envsentinel.ml.registry.ModelTriple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Motor de predicción y anomalías.
 * <p>
 * Solo lee del registro: cada parámetro toma su trío UNA vez por petición, así que
 * regresor, escalador y detector siempre pertenecen al mismo ciclo aunque otro hilo
 * esté reentrenando. Un parámetro que falla se omite de la respuesta; la petición no falla.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionService {

    static final int RECENT_READINGS = 10;

    private final ReadingStore readingStore;
    private final FeatureBuilder featureBuilder;
    private final ModelRegistry registry;
    private final Clock clock;

    /**
     * Predice cada parámetro del sensor {@code hoursAhead} horas por delante de ahora.
     * Un horizonte negativo evalúa el modelo en un instante pasado.
     * Sin lecturas del sensor la respuesta lleva un mapa vacío.
     */
    public ForecastResponseDTO forecast(String sensorId, int hoursAhead) {
        if (sensorId == null || sensorId.isBlank()) {
            throw new InvalidRequestException("sensorId es obligatorio");
        }

        Instant now = clock.instant();
        Map<String, ParameterForecastDTO> predictions = new LinkedHashMap<>();

        // 1. Lectura más reciente del sensor
        List<Reading> recent = readingStore.findRecent(sensorId, RECENT_READINGS);
        if (recent.isEmpty()) {
            log.info("Sin lecturas recientes para {}", sensorId);
            return new ForecastResponseDTO(sensorId, hoursAhead, predictions, now);
        }
        Reading latest = recent.get(0);
        Instant futureTime = now.plus(Duration.ofHours(hoursAhead));

        // 2. Un parámetro cada vez, con su propio trío
        for (Parameter parameter : Parameter.values()) {
            Double current = latest.value(parameter);
            if (current == null) continue;

            predictOne(registry.get(parameter), latest, current, futureTime)
                    .ifPresent(p -> predictions.put(parameter.getCode(), p));
        }
        return new ForecastResponseDTO(sensorId, hoursAhead, predictions, now);
    }

    /**
     * Chequeo en tiempo real de valores sueltos (código -> número).
     * Ignora códigos desconocidos, valores no numéricos y parámetros sin entrenar.
     */
    public AnomalyResponseDTO checkAnomalies(Map<String, Object> sensorData) {
        Instant now = clock.instant();
        Map<String, AnomalyScoreDTO> anomalies = new LinkedHashMap<>();
        if (sensorData == null) {
            return new AnomalyResponseDTO(anomalies, now);
        }

        sensorData.forEach((code, raw) -> {
            Optional<Parameter> parameter = Parameter.fromCode(code);
            if (parameter.isEmpty() || !(raw instanceof Number number)) return;

            ModelTriple triple = registry.get(parameter.get());
            if (!triple.isTrained()) return;

            double value = number.doubleValue();
            try {
                double[] scaled = triple.scaler().transform(featureBuilder.buildRealtimeVector(value, now));
                AnomalyScore score = triple.detector().score(scaled);
                anomalies.put(code, new AnomalyScoreDTO(score.anomaly(), score.decision(), value));
            } catch (FeatureDimensionException e) {
                log.warn("Chequeo de anomalía omitido para {}: {}", code, e.getMessage());
            } catch (Exception e) {
                log.error("Error detectando anomalía en {}", code, e);
            }
        });
        return new AnomalyResponseDTO(anomalies, now);
    }

    private Optional<ParameterForecastDTO> predictOne(ModelTriple triple, Reading latest, double current, Instant futureTime) {
        try {
            double[] vector = featureBuilder.buildFeatureVector(latest.values(), triple.scaler().layout(), futureTime);
            double[] scaled = triple.scaler().transform(vector);
            double predicted = triple.regressor().predict(scaled);
            AnomalyScore score = triple.detector().score(scaled);

            return Optional.of(ParameterForecastDTO.builder()
                    .predictedValue(predicted)
                    .currentValue(current)
                    .change(predicted - current)
                    .anomalyScore(score.decision())
                    .anomaly(score.anomaly())
                    .predictionTime(futureTime)
                    .build());
        } catch (ModelNotFittedException e) {
            log.warn("Sin modelo entrenado para {}; se omite de la predicción", triple.parameter());
        } catch (Exception e) {
            log.error("Error prediciendo {}", triple.parameter(), e);
        }
        return Optional.empty();
    }
}
