package envsentinel.domain.dto.training;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record HealthResponseDTO(
        String status,
        Instant timestamp,
        @JsonProperty("models_loaded") boolean modelsLoaded
) {}
