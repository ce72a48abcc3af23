package envsentinel.compute.config;

import envsentinel.io.FileSystemArtifactStore;
import envsentinel.io.ModelArtifactStore;
import envsentinel.io.ModelPersistence;
import envsentinel.ml.feature.FeatureBuilder;
import envsentinel.ml.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Cableado del ciclo de vida de los modelos.
 * Las piezas de {@code envsentinel.ml} y {@code envsentinel.io} no dependen de Spring;
 * aquí se convierten en beans.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({TrainingProperties.class, ModelStorageProperties.class})
public class ModelConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FeatureBuilder featureBuilder(TrainingProperties properties) {
        return new FeatureBuilder(properties.zoneId());
    }

    @Bean
    public ModelRegistry modelRegistry() {
        return new ModelRegistry();
    }

    @Bean
    public ModelArtifactStore modelArtifactStore(ModelStorageProperties storage) {
        log.info("Directorio de modelos: {}", storage.path().toAbsolutePath());
        return new FileSystemArtifactStore(storage.path());
    }

    @Bean
    public ModelPersistence modelPersistence(ModelArtifactStore store) {
        return new ModelPersistence(store);
    }

    /**
     * Hilo único para el reentrenamiento: dos ciclos nunca corren a la vez en él.
     */
    @Bean
    public ThreadPoolTaskScheduler retrainingScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("retraining-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
