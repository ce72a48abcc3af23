package envsentinel.io;

/**
 * Envoltorio común a los tres artefactos de un trío.
 * Las tres piezas escritas por un mismo guardado comparten {@code generation}.
 *
 * @param generation Identificador del guardado que produjo la pieza.
 * @param payload    Regresor, escalador o checkpoint del detector.
 */
public record StoredArtifact<T>(String generation, T payload) {}
