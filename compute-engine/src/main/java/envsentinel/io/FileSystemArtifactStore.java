package envsentinel.io;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Artefactos como ficheros {@code <directorio>/<nombre>.json}.
 * <p>
 * La escritura va a un fichero temporal en el mismo directorio y después se mueve
 * encima del destino, de modo que nunca queda un artefacto a medio escribir.
 */
@Slf4j
public class FileSystemArtifactStore implements ModelArtifactStore {

    private static final String EXTENSION = ".json";

    private final Path directory;

    public FileSystemArtifactStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public boolean exists(String name) {
        return Files.isRegularFile(resolve(name));
    }

    @Override
    public void write(String name, byte[] content) throws IOException {
        Path target = resolve(name);
        log.debug("Escribiendo artefacto {} ({} bytes)", target.toAbsolutePath(), content.length);

        try {
            // Asegurarse de que el directorio existe
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, name + "-", ".tmp");
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Error al escribir el artefacto {}", target.toAbsolutePath(), e);
            throw e; // Relanzamos para que el llamador decida
        }
    }

    @Override
    public byte[] read(String name) throws IOException {
        Path path = resolve(name);
        if (!Files.exists(path)) {
            throw new IOException("El artefacto no existe: " + path.toAbsolutePath());
        }
        return Files.readAllBytes(path);
    }

    private Path resolve(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new IllegalArgumentException("Nombre de artefacto no válido: " + name);
        }
        return directory.resolve(name + EXTENSION);
    }
}
