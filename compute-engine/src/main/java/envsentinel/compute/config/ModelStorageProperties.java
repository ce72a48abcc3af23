package envsentinel.compute.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * Dónde viven los artefactos de modelos ({@code envsentinel.models.*}).
 *
 * @param dir Directorio de los artefactos, relativo al directorio de trabajo si no es absoluto.
 */
@ConfigurationProperties(prefix = "envsentinel.models")
public record ModelStorageProperties(@DefaultValue("models") String dir) {

    public Path path() {
        return Path.of(dir);
    }
}
