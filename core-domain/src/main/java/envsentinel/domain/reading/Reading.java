package envsentinel.domain.reading;

import lombok.Builder;
import lombok.Singular;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Una lectura ingerida: instante, sensor y mapa código -> valor.
 * <p>
 * Un código ausente del mapa (o con valor {@code null}) significa que el sensor no lo reportó.
 *
 * @param timestamp  Instante de la medición.
 * @param sensorId   Identificador del sensor (ej: "AIR-001").
 * @param sensorType "air" o "water".
 * @param values     Parámetros y covariables auxiliares (temperature, humidity).
 */
@Builder
public record Reading(
        Instant timestamp,
        String sensorId,
        String sensorType,
        @Singular Map<String, Double> values
) {

    public Reading {
        // Map.copyOf no admite valores null
        values = values == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Valor reportado para el código, o {@code null} si no se reportó.
     */
    public Double value(String code) {
        return values.get(code);
    }

    public Double value(Covariate covariate) {
        return values.get(covariate.getCode());
    }

    public Double value(Parameter parameter) {
        return values.get(parameter.getCode());
    }

    public boolean hasValue(Parameter parameter) {
        return value(parameter) != null;
    }
}
