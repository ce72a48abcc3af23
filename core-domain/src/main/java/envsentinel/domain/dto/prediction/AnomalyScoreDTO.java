package envsentinel.domain.dto.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Veredicto del detector para un valor puntual.
 * Cuanto más negativo el score, más anómalo.
 */
public record AnomalyScoreDTO(
        @JsonProperty("is_anomaly") boolean anomaly,
        @JsonProperty("anomaly_score") double anomalyScore,
        double value
) {}
