package envsentinel.compute.service;

import envsentinel.compute.config.TrainingProperties;
import envsentinel.compute.repository.ReadingStore;
import envsentinel.domain.reading.Parameter;
import envsentinel.domain.reading.Reading;
import envsentinel.io.ModelPersistence;
import envsentinel.ml.feature.FeatureBuilder;
import envsentinel.ml.feature.TargetDataset;
import envsentinel.ml.feature.TrainingTable;
import envsentinel.ml.registry.ModelRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orquestador de entrenamiento.
 * <p>
 * Un ciclo recupera la ventana histórica una sola vez y entrena los siete parámetros
 * de forma independiente: el fallo de uno se registra y los demás siguen. Cada trío
 * nuevo se publica en el registro y después se persiste.
 * <p>
 * Solo corre un ciclo a la vez: si llega otro mientras tanto, vuelve enseguida con un
 * informe "en curso" en lugar de esperar. Los lectores del registro nunca ven el cerrojo.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelTrainingService {

    private final ReadingStore readingStore;
    private final FeatureBuilder featureBuilder;
    private final TripleTrainer tripleTrainer;
    private final ModelRegistry registry;
    private final ModelPersistence persistence;
    private final TrainingProperties properties;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile TrainingCycleReport lastReport;

    /**
     * Ejecuta un ciclo completo. Si ya hay uno en marcha no lo repite: devuelve
     * {@link TrainingCycleReport#inProgress(Instant)} y no toca {@link #lastReport()}.
     *
     * @throws envsentinel.domain.exception.UpstreamUnavailableException si el almacén no responde.
     */
    public TrainingCycleReport runTrainingCycle() {
        if (!cycleLock.tryLock()) {
            log.info("Ya hay un ciclo de entrenamiento en curso; se ignora la petición");
            return TrainingCycleReport.inProgress(clock.instant());
        }
        try {
            TrainingCycleReport report = doRunCycle();
            lastReport = report;
            return report;
        } finally {
            cycleLock.unlock();
        }
    }

    public Optional<TrainingCycleReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    private TrainingCycleReport doRunCycle() {
        Instant startedAt = clock.instant();
        log.info(">>> Iniciando ciclo de entrenamiento (ventana {})", properties.lookback());

        // 1. Ventana histórica, una sola consulta
        List<Reading> readings = readingStore.findBetween(startedAt.minus(properties.lookback()), startedAt);
        if (readings.isEmpty()) {
            log.warn("No hay lecturas en la ventana de entrenamiento; se conservan los modelos actuales");
            return TrainingCycleReport.noData(startedAt, clock.instant());
        }
        TrainingTable table = featureBuilder.buildTrainingTable(readings);
        log.info("Lecturas recuperadas: {} (covariables: {})", readings.size(), table.columns());

        // 2. Cada parámetro por separado
        List<ParameterOutcome> outcomes = new ArrayList<>();
        for (Parameter parameter : Parameter.values()) {
            outcomes.add(trainParameter(table, parameter));
        }

        long trained = outcomes.stream().filter(o -> o.status() == ParameterOutcome.Status.TRAINED).count();
        log.info("<<< Ciclo de entrenamiento completado: {}/{} parámetros entrenados",
                trained, Parameter.values().length);

        return new TrainingCycleReport(true, "Modelos entrenados correctamente", readings.size(),
                startedAt, clock.instant(), outcomes);
    }

    private ParameterOutcome trainParameter(TrainingTable table, Parameter parameter) {
        int samples = 0;
        try {
            TargetDataset dataset = table.forTarget(parameter);
            samples = dataset.size();
            if (samples < properties.minSamples()) {
                log.warn("Datos insuficientes para {}: {} muestras", parameter, samples);
                return ParameterOutcome.skipped(parameter, samples, properties.minSamples());
            }

            TripleTrainer.TrainedTriple result = tripleTrainer.train(dataset);

            // Primero el registro, después el disco
            registry.replace(result.triple());
            persistence.save(result.triple());

            log.info("Modelo {} entrenado - R² train: {}, R² test: {}", parameter,
                    String.format("%.3f", result.trainR2()), String.format("%.3f", result.testR2()));
            return ParameterOutcome.trained(parameter, samples, result.trainR2(), result.testR2());

        } catch (Exception e) {
            log.error("Error entrenando el modelo de {}", parameter, e);
            return ParameterOutcome.failed(parameter, samples, e);
        }
    }
}
