package envsentinel.compute.service;

import envsentinel.compute.config.TrainingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ScheduledFuture;

/**
 * Dispara el ciclo de entrenamiento a intervalo fijo ({@code envsentinel.training.interval}).
 * <p>
 * Arranca y se detiene con el contexto de Spring. Un fallo de un ciclo se registra y
 * no cancela los siguientes.
 */
@Slf4j
@Component
public class RetrainingClock implements SmartLifecycle {

    private final TaskScheduler scheduler;
    private final ModelTrainingService trainingService;
    private final TrainingProperties properties;
    private final Clock clock;

    private ScheduledFuture<?> task;

    public RetrainingClock(@Qualifier("retrainingScheduler") TaskScheduler scheduler,
                           ModelTrainingService trainingService,
                           TrainingProperties properties,
                           Clock clock) {
        this.scheduler = scheduler;
        this.trainingService = trainingService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (task != null) return;
        if (!properties.scheduleEnabled()) {
            log.info("Reentrenamiento programado desactivado");
            return;
        }
        task = scheduler.scheduleAtFixedRate(this::tick,
                clock.instant().plus(properties.initialDelay()), properties.interval());
        log.info("Reentrenamiento programado cada {} (primer ciclo en {})",
                properties.interval(), properties.initialDelay());
    }

    @Override
    public synchronized void stop() {
        if (task == null) return;
        task.cancel(false);
        task = null;
        log.info("Reentrenamiento programado detenido");
    }

    @Override
    public synchronized boolean isRunning() {
        return task != null;
    }

    void tick() {
        log.info("Ejecutando reentrenamiento programado...");
        try {
            TrainingCycleReport report = trainingService.runTrainingCycle();
            log.info("Reentrenamiento programado terminado (éxito: {})", report.success());
        } catch (Exception e) {
            log.error("Fallo en el reentrenamiento programado", e);
        }
    }
}
