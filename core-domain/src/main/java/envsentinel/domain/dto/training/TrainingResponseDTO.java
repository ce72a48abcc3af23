package envsentinel.domain.dto.training;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
public record TrainingResponseDTO(
        boolean success,
        String message,
        int records,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        List<ParameterOutcomeDTO> outcomes
) {}
