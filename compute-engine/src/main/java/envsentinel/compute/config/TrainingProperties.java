package envsentinel.compute.config;

import envsentinel.ml.model.DetectorSettings;
import envsentinel.ml.model.ForestSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Ajustes del ciclo de entrenamiento ({@code envsentinel.training.*}).
 *
 * @param lookback           Longitud de la ventana histórica.
 * @param interval           Periodo del reentrenamiento automático.
 * @param initialDelay       Espera antes del primer ciclo programado.
 * @param scheduleEnabled    Activa el reloj de reentrenamiento.
 * @param trainOnStartup     Entrena al arrancar si no se pudo cargar ningún modelo.
 * @param minSamples         Filas mínimas por parámetro para entrenar.
 * @param testFraction       Fracción reservada para test.
 * @param seed               Semilla del split y de ambos bosques.
 * @param trees              Árboles del bosque de regresión.
 * @param maxDepth           Profundidad máxima de cada árbol de regresión.
 * @param detectorTrees      Árboles del Random Cut Forest.
 * @param detectorSampleSize Muestra por árbol del Random Cut Forest.
 * @param contamination      Fracción esperada de anomalías en entrenamiento.
 * @param zone               Zona horaria de las columnas de calendario.
 */
@ConfigurationProperties(prefix = "envsentinel.training")
public record TrainingProperties(
        @DefaultValue("P30D") Duration lookback,
        @DefaultValue("PT6H") Duration interval,
        @DefaultValue("PT6H") Duration initialDelay,
        @DefaultValue("true") boolean scheduleEnabled,
        @DefaultValue("true") boolean trainOnStartup,
        @DefaultValue("10") int minSamples,
        @DefaultValue("0.2") double testFraction,
        @DefaultValue("42") long seed,
        @DefaultValue("100") int trees,
        @DefaultValue("10") int maxDepth,
        @DefaultValue("100") int detectorTrees,
        @DefaultValue("256") int detectorSampleSize,
        @DefaultValue("0.1") double contamination,
        @DefaultValue("UTC") String zone
) {

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public ForestSettings forestSettings() {
        return new ForestSettings(trees, maxDepth, seed);
    }

    public DetectorSettings detectorSettings() {
        return new DetectorSettings(detectorTrees, detectorSampleSize, contamination, seed);
    }
}
