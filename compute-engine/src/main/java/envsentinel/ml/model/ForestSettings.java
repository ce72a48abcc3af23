package envsentinel.ml.model;

/**
 * Hiperparámetros del bosque de regresión.
 *
 * @param trees    Número de árboles.
 * @param maxDepth Profundidad máxima de cada árbol.
 * @param seed     Semilla maestra; cada árbol deriva la suya de ella.
 */
public record ForestSettings(int trees, int maxDepth, long seed) {

    public ForestSettings {
        if (trees < 1) throw new IllegalArgumentException("trees debe ser >= 1");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth debe ser >= 1");
    }
}
