package envsentinel.domain.dto.training;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterOutcomeDTO(
        String parameter,
        String status, // TRAINED, SKIPPED_INSUFFICIENT_SAMPLES, FAILED
        int samples,
        @JsonProperty("train_r2") Double trainR2,
        @JsonProperty("test_r2") Double testR2,
        String message
) {}
