package envsentinel.domain.dto.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * Predicción de un parámetro para un sensor en un horizonte dado.
 *
 * @param change Diferencia con signo {@code predictedValue - currentValue}.
 */
@Builder
public record ParameterForecastDTO(
        @JsonProperty("predicted_value") double predictedValue,
        @JsonProperty("current_value") double currentValue,
        @JsonProperty("change") double change,
        @JsonProperty("anomaly_score") double anomalyScore,
        @JsonProperty("is_anomaly") boolean anomaly,
        @JsonProperty("prediction_time") Instant predictionTime
) {}
