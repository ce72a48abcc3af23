package envsentinel.ml.model;

/**
 * Hiperparámetros del detector de anomalías.
 *
 * @param trees         Árboles del Random Cut Forest.
 * @param sampleSize    Puntos retenidos por árbol.
 * @param contamination Fracción esperada de anomalías en entrenamiento; fija el umbral de decisión.
 * @param seed          Semilla del bosque.
 */
public record DetectorSettings(int trees, int sampleSize, double contamination, long seed) {

    public DetectorSettings {
        if (contamination <= 0.0 || contamination >= 0.5) {
            throw new IllegalArgumentException("contamination debe estar en (0, 0.5): " + contamination);
        }
    }
}
