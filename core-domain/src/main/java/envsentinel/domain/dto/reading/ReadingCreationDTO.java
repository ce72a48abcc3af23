package envsentinel.domain.dto.reading;

import java.time.Instant;
import java.util.Map;

public record ReadingCreationDTO(
        String sensorId,
        String sensorType, // "air" o "water"
        Instant timestamp, // Opcional: si falta se usa el instante de ingesta
        Map<String, Double> readings
) {}
