package envsentinel.io;

/**
 * Forma persistida del detector de anomalías.
 *
 * @param forest Estado del Random Cut Forest en protostuff, codificado en Base64.
 */
public record DetectorCheckpoint(int dimensions, double offset, double contamination, String forest) {}
