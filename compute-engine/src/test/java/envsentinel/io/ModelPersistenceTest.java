package envsentinel.io;

import envsentinel.domain.reading.Parameter;
import envsentinel.ml.model.AnomalyScore;
import envsentinel.ml.registry.ModelRegistry;
import envsentinel.ml.registry.ModelTriple;
import envsentinel.support.ModelFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ModelPersistenceTest {

    private static final Instant FITTED_AT = Instant.parse("2025-06-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private FileSystemArtifactStore store;
    private ModelPersistence persistence;

    @BeforeEach
    void setUp() {
        store = new FileSystemArtifactStore(tempDir);
        persistence = new ModelPersistence(store);
    }

    @Test
    @DisplayName("Guardar y cargar reproduce las mismas predicciones y scores")
    void saveThenLoad_ShouldBehaveIdentically() throws IOException {
        // --- 1. Arrange ---
        ModelTriple original = ModelFixtures.trainedTriple(Parameter.PH, List.of("temperature", "turbidity"), FITTED_AT);
        double[] vector = {10, 2, 6, 11.0, 9.5};

        // --- 2. Act ---
        persistence.save(original);
        Optional<ModelTriple> loaded = persistence.load(Parameter.PH);

        // --- 3. Assert ---
        assertThat(store.exists("ph_model")).isTrue();
        assertThat(store.exists("ph_scaler")).isTrue();
        assertThat(store.exists("ph_anomaly")).isTrue();
        assertThat(loaded).isPresent();

        ModelTriple copy = loaded.get();
        assertThat(copy.isTrained()).isTrue();
        assertThat(copy.trainedAt()).contains(FITTED_AT);
        assertThat(copy.scaler().layout()).isEqualTo(original.scaler().layout());

        double[] scaledOriginal = original.scaler().transform(vector);
        double[] scaledCopy = copy.scaler().transform(vector);
        assertThat(scaledCopy).containsExactly(scaledOriginal, within(1e-12));
        assertThat(copy.regressor().predict(scaledCopy)).isEqualTo(original.regressor().predict(scaledOriginal));

        AnomalyScore before = original.detector().score(scaledOriginal);
        AnomalyScore after = copy.detector().score(scaledCopy);
        assertThat(after.anomaly()).isEqualTo(before.anomaly());
        assertThat(after.decision()).isCloseTo(before.decision(), within(1e-9));
    }

    @Test
    @DisplayName("Sin alguno de los tres artefactos no se carga nada de ese parámetro")
    void load_ShouldSkipIncompleteTriple() throws IOException {
        persistence.save(ModelFixtures.trainedTriple(Parameter.CO2, List.of("pm25"), FITTED_AT));
        Files.delete(tempDir.resolve("co2_anomaly.json"));

        assertThat(persistence.load(Parameter.CO2)).isEmpty();
    }

    @Test
    @DisplayName("Un artefacto corrupto se ignora sin excepción")
    void load_ShouldSkipCorruptArtifact() throws IOException {
        persistence.save(ModelFixtures.trainedTriple(Parameter.NO2, List.of("pm25"), FITTED_AT));
        store.write("no2_scaler", "{ esto no es json".getBytes(StandardCharsets.UTF_8));

        assertThat(persistence.load(Parameter.NO2)).isEmpty();
    }

    @Test
    @DisplayName("loadAll: éxito con al menos un parámetro; hydrate los publica en el registro")
    void hydrate_ShouldInstallLoadedTriples() throws IOException {
        ModelRegistry registry = new ModelRegistry();
        assertThat(persistence.loadAll().success()).isFalse();

        persistence.save(ModelFixtures.trainedTriple(Parameter.TURBIDITY, List.of("ph", "temperature"), FITTED_AT));
        ModelPersistence.LoadResult result = persistence.hydrate(registry);

        assertThat(result.success()).isTrue();
        assertThat(result.loaded()).containsOnlyKeys(Parameter.TURBIDITY);
        assertThat(result.skipped()).hasSize(6).doesNotContain(Parameter.TURBIDITY);
        assertThat(registry.trainedParameters()).containsExactly(Parameter.TURBIDITY);
    }

    @Test
    @DisplayName("Un guardado cortado en el detector no deja un trío mezclado cargable")
    void save_WhenAnomalyWriteFails_ShouldNotLoadMixedGenerations() throws IOException {
        // --- 1. Arrange ---
        Instant secondFit = Instant.parse("2025-07-01T12:00:00Z");
        persistence.save(ModelFixtures.trainedTriple(Parameter.PH, List.of("temperature"), FITTED_AT));
        ModelPersistence failing = new ModelPersistence(new FailingOnSuffixStore(store, "_anomaly"));

        // --- 2. Act ---
        assertThatThrownBy(() -> failing.save(ModelFixtures.trainedTriple(Parameter.PH, List.of("temperature"), secondFit)))
                .isInstanceOf(IOException.class);
        Optional<ModelTriple> loaded = persistence.load(Parameter.PH);

        // --- 3. Assert ---
        // El regresor y el escalador nuevos conviven en disco con el detector viejo
        assertThat(store.exists("ph_anomaly")).isTrue();
        assertThat(loaded).isEmpty();
        assertThat(persistence.loadAll().skipped()).contains(Parameter.PH);
    }

    @Test
    @DisplayName("Un guardado completo posterior vuelve a dejar el trío cargable")
    void save_AfterInterruptedSave_ShouldLoadLatestTriple() throws IOException {
        Instant latestFit = Instant.parse("2025-08-01T12:00:00Z");
        ModelPersistence failing = new ModelPersistence(new FailingOnSuffixStore(store, "_scaler"));
        persistence.save(ModelFixtures.trainedTriple(Parameter.DISSOLVED_OXYGEN, List.of("temperature"), FITTED_AT));
        assertThatThrownBy(() -> failing.save(ModelFixtures.trainedTriple(Parameter.DISSOLVED_OXYGEN, List.of("temperature"), latestFit)))
                .isInstanceOf(IOException.class);
        assertThat(persistence.load(Parameter.DISSOLVED_OXYGEN)).isEmpty();

        persistence.save(ModelFixtures.trainedTriple(Parameter.DISSOLVED_OXYGEN, List.of("temperature"), latestFit));

        assertThat(persistence.load(Parameter.DISSOLVED_OXYGEN))
                .hasValueSatisfying(triple -> assertThat(triple.trainedAt()).contains(latestFit));
    }

    @Test
    @DisplayName("Un trío sin entrenar no se persiste")
    void save_ShouldRejectUntrainedTriple() {
        assertThatThrownBy(() -> persistence.save(ModelTriple.untrained(Parameter.PM10)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Delega en otro almacén pero falla al escribir los artefactos con el sufijo dado.
     */
    private static final class FailingOnSuffixStore implements ModelArtifactStore {

        private final ModelArtifactStore delegate;
        private final String failingSuffix;

        FailingOnSuffixStore(ModelArtifactStore delegate, String failingSuffix) {
            this.delegate = delegate;
            this.failingSuffix = failingSuffix;
        }

        @Override
        public boolean exists(String name) {
            return delegate.exists(name);
        }

        @Override
        public void write(String name, byte[] content) throws IOException {
            if (name.endsWith(failingSuffix)) {
                throw new IOException("Disco lleno al escribir " + name);
            }
            delegate.write(name, content);
        }

        @Override
        public byte[] read(String name) throws IOException {
            return delegate.read(name);
        }
    }
}
