package envsentinel.domain.dto.prediction;

import java.time.Instant;
import java.util.Map;

public record AnomalyResponseDTO(
        Map<String, AnomalyScoreDTO> anomalies,
        Instant timestamp
) {}
