package envsentinel.compute.service;

import envsentinel.domain.dto.training.HealthResponseDTO;
import envsentinel.domain.dto.training.ModelStatusDTO;
import envsentinel.domain.reading.Parameter;
import envsentinel.ml.registry.ModelRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vista de solo lectura del registro para los endpoints de estado y salud.
 */
@Service
@RequiredArgsConstructor
public class ModelStatusService {

    private final ModelRegistry registry;
    private final ModelTrainingService trainingService;
    private final Clock clock;

    public ModelStatusDTO status() {
        Map<String, Instant> trainedAt = new LinkedHashMap<>();
        registry.snapshot().forEach((parameter, triple) ->
                triple.trainedAt().ifPresent(at -> trainedAt.put(parameter.getCode(), at)));

        List<String> models = registry.trainedParameters().stream().map(Parameter::getCode).toList();
        var lastReport = trainingService.lastReport();

        return ModelStatusDTO.builder()
                .models(models)
                .modelCount(models.size())
                .trainedAt(trainedAt)
                .lastTrained(lastReport.map(TrainingCycleReport::finishedAt).orElse(null))
                .lastCycle(lastReport.map(TrainingCycleReport::toResponse).orElse(null))
                .timestamp(clock.instant())
                .build();
    }

    public HealthResponseDTO health() {
        return new HealthResponseDTO("healthy", clock.instant(), !registry.trainedParameters().isEmpty());
    }
}
