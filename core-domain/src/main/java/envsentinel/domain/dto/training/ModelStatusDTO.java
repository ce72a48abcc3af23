package envsentinel.domain.dto.training;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Estado del registro de modelos.
 *
 * @param models      Parámetros con un trío entrenado (no por defecto).
 * @param trainedAt   Instante de ajuste de cada trío entrenado.
 * @param lastTrained Fin del último ciclo de entrenamiento, {@code null} si aún no hubo ninguno.
 */
@Builder
public record ModelStatusDTO(
        List<String> models,
        @JsonProperty("model_count") int modelCount,
        @JsonProperty("trained_at") Map<String, Instant> trainedAt,
        @JsonProperty("last_trained") Instant lastTrained,
        @JsonProperty("last_cycle") TrainingResponseDTO lastCycle,
        Instant timestamp
) {}
