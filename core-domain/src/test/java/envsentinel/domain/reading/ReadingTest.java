package envsentinel.domain.reading;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReadingTest {

    @Test
    @DisplayName("Un valor null equivale a 'no reportado' y se conserva")
    void nullValues_ShouldBeKeptAsNotReported() {
        Map<String, Double> values = new HashMap<>();
        values.put("ph", 7.2);
        values.put("turbidity", null);

        Reading reading = new Reading(Instant.parse("2025-06-01T10:00:00Z"), "WATER-001", "water", values);

        assertThat(reading.hasValue(Parameter.PH)).isTrue();
        assertThat(reading.hasValue(Parameter.TURBIDITY)).isFalse();
        assertThat(reading.value(Covariate.TEMPERATURE)).isNull();
        assertThat(reading.values()).containsKey("turbidity");
    }

    @Test
    @DisplayName("El mapa de valores es una copia inmutable")
    void values_ShouldBeImmutableCopy() {
        Map<String, Double> values = new HashMap<>();
        values.put("pm25", 12.0);

        Reading reading = Reading.builder()
                .timestamp(Instant.EPOCH)
                .sensorId("AIR-001")
                .sensorType("air")
                .values(values)
                .build();
        values.put("pm25", 99.0);

        assertThat(reading.value(Parameter.PM25)).isEqualTo(12.0);
        assertThatThrownBy(() -> reading.values().put("co2", 400.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
