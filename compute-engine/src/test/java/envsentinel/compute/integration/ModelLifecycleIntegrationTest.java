package envsentinel.compute.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import envsentinel.compute.repository.mock.InMemoryReadingStore;
import envsentinel.config.ApiRoutes;
import envsentinel.domain.dto.reading.ReadingCreationDTO;
import envsentinel.domain.reading.Parameter;
import envsentinel.ml.registry.ModelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Flujo completo sobre el perfil mock: ingesta -> entrenamiento -> predicción -> estado.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles({"mock", "test"})
class ModelLifecycleIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private InMemoryReadingStore store;

    @Autowired
    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        store.clear();
    }

    private void ingestWaterReadings(int count) throws Exception {
        Random random = new Random(5);
        Instant start = Instant.now().truncatedTo(ChronoUnit.HOURS).minus(Duration.ofHours(count));
        for (int i = 0; i < count; i++) {
            Map<String, Double> values = new HashMap<>();
            values.put("ph", 6.5 + 2.0 * random.nextDouble());
            values.put("temperature", 15 + 5 * random.nextDouble());
            values.put("turbidity", 2 + random.nextDouble());
            var request = new ReadingCreationDTO("WATER-001", "water", start.plus(Duration.ofHours(i)), values);

            mockMvc.perform(post(ApiRoutes.READINGS)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isCreated());
        }
    }

    @Test
    @DisplayName("Ingesta, entrenamiento y predicción de extremo a extremo")
    void fullLifecycle_ShouldTrainAndServePredictions() throws Exception {
        // --- 1. Arrange ---
        ingestWaterReadings(24);

        // --- 2. Act: entrenamiento ---
        mockMvc.perform(post(ApiRoutes.MODELS + "/train"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.records").value(24));

        // --- 3. Assert ---
        assertThat(registry.isTrained(Parameter.PH)).isTrue();
        assertThat(registry.isTrained(Parameter.TURBIDITY)).isTrue();

        mockMvc.perform(get(ApiRoutes.PREDICTIONS + "/WATER-001").param("hours_ahead", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hours_ahead").value(2))
                .andExpect(jsonPath("$.predictions.ph.predicted_value").isNumber())
                .andExpect(jsonPath("$.predictions.turbidity.is_anomaly").isBoolean());

        mockMvc.perform(get(ApiRoutes.MODELS + "/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.models", hasItem("ph")))
                .andExpect(jsonPath("$.last_cycle.success").value(true));

        mockMvc.perform(get(ApiRoutes.HEALTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.models_loaded").value(true));
    }

    @Test
    @DisplayName("Horizonte no numérico -> 400 con cuerpo de error")
    void malformedHorizon_ShouldReturn400() throws Exception {
        mockMvc.perform(get(ApiRoutes.PREDICTIONS + "/WATER-001").param("hours_ahead", "dos"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Request"));
    }
}
