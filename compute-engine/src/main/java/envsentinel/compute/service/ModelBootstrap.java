package envsentinel.compute.service;

import envsentinel.compute.config.TrainingProperties;
import envsentinel.io.ModelPersistence;
import envsentinel.ml.registry.ModelRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Arranque de los modelos.
 * <p>
 * 1. Carga en el registro los tríos persistidos.
 * 2. Si no se cargó ninguno (y está permitido), entrena en el acto.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelBootstrap implements CommandLineRunner {

    private final ModelPersistence persistence;
    private final ModelRegistry registry;
    private final ModelTrainingService trainingService;
    private final TrainingProperties properties;

    @Override
    public void run(String... args) {
        log.info(">>> BOOTSTRAP: Cargando modelos persistidos...");
        ModelPersistence.LoadResult result = persistence.hydrate(registry);

        if (result.success()) {
            log.info(">>> BOOTSTRAP: {} modelos listos.", result.loaded().size());
            return;
        }
        if (!properties.trainOnStartup()) {
            log.warn(">>> BOOTSTRAP: No hay modelos y el entrenamiento inicial está desactivado.");
            return;
        }

        log.info(">>> BOOTSTRAP: No hay modelos guardados, entrenando...");
        try {
            TrainingCycleReport report = trainingService.runTrainingCycle();
            log.info(">>> BOOTSTRAP: Entrenamiento inicial terminado (éxito: {})", report.success());
        } catch (Exception e) {
            // El servicio arranca igualmente con los tríos por defecto
            log.error(">>> BOOTSTRAP: Falló el entrenamiento inicial", e);
        }
    }
}
