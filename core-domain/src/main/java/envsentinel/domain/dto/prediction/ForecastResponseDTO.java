package envsentinel.domain.dto.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record ForecastResponseDTO(
        @JsonProperty("sensor_id") String sensorId,
        @JsonProperty("hours_ahead") int hoursAhead,
        Map<String, ParameterForecastDTO> predictions, // Clave: código del parámetro (ej: "pm25")
        Instant timestamp
) {}
