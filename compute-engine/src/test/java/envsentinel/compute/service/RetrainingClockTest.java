package envsentinel.compute.service;

import envsentinel.compute.config.TrainingProperties;
import envsentinel.domain.exception.UpstreamUnavailableException;
import envsentinel.support.ModelFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetrainingClockTest {

    private static final Instant NOW = Instant.parse("2025-06-02T08:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private TaskScheduler scheduler;
    @Mock
    private ModelTrainingService trainingService;
    @Mock
    private ScheduledFuture<Object> future;

    @Test
    @DisplayName("start programa el ciclo a intervalo fijo y stop lo cancela")
    void startStop_ShouldScheduleAndCancel() {
        // --- 1. Arrange ---
        TrainingProperties properties = ModelFixtures.fastTrainingProperties();
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        RetrainingClock clock = new RetrainingClock(scheduler, trainingService, properties, CLOCK);

        // --- 2. Act ---
        clock.start();
        clock.start(); // idempotente

        // --- 3. Assert ---
        verify(scheduler, times(1)).scheduleAtFixedRate(any(Runnable.class),
                eq(NOW.plus(properties.initialDelay())), eq(properties.interval()));
        assertThat(clock.isRunning()).isTrue();

        clock.stop();
        verify(future).cancel(false);
        assertThat(clock.isRunning()).isFalse();
    }

    @Test
    @DisplayName("La tarea programada lanza un ciclo de entrenamiento")
    void scheduledTask_ShouldRunTrainingCycle() {
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        when(trainingService.runTrainingCycle()).thenReturn(
                TrainingCycleReport.noData(NOW, NOW));
        RetrainingClock clock = new RetrainingClock(scheduler, trainingService, ModelFixtures.fastTrainingProperties(), CLOCK);

        clock.start();
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(task.capture(), any(Instant.class), any(Duration.class));
        task.getValue().run();

        verify(trainingService).runTrainingCycle();
    }

    @Test
    @DisplayName("Un ciclo que falla no rompe el reloj")
    void tick_ShouldContainFailures() {
        when(trainingService.runTrainingCycle())
                .thenThrow(new UpstreamUnavailableException("caído", new RuntimeException()));
        RetrainingClock clock = new RetrainingClock(scheduler, trainingService, ModelFixtures.fastTrainingProperties(), CLOCK);

        assertThatCode(clock::tick).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Con la programación desactivada no se programa nada")
    void start_ShouldDoNothingWhenDisabled() {
        TrainingProperties disabled = new TrainingProperties(Duration.ofDays(30), Duration.ofHours(6), Duration.ofHours(6),
                false, true, 10, 0.2, 42L, 20, 10, 30, 64, 0.1, "UTC");
        RetrainingClock clock = new RetrainingClock(scheduler, trainingService, disabled, CLOCK);

        clock.start();

        verifyNoInteractions(scheduler);
        assertThat(clock.isRunning()).isFalse();
    }
}
