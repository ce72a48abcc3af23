package envsentinel.ml.model;

/**
 * @param decision Valor de la función de decisión. Cuanto más negativo, más anómalo.
 * @param anomaly  {@code decision < 0}.
 */
public record AnomalyScore(double decision, boolean anomaly) {}
