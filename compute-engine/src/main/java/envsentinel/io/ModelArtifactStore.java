package envsentinel.io;

import java.io.IOException;

/**
 * Almacén clave -> blob opaco para los artefactos de modelos.
 * Claves: {@code "{parametro}_model"}, {@code "{parametro}_scaler"}, {@code "{parametro}_anomaly"}.
 */
public interface ModelArtifactStore {

    boolean exists(String name);

    /**
     * Escribe (o sobrescribe) el artefacto. Un lector concurrente ve la versión vieja o la nueva completa.
     */
    void write(String name, byte[] content) throws IOException;

    byte[] read(String name) throws IOException;
}
