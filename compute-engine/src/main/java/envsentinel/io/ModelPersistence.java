package envsentinel.io;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import envsentinel.domain.reading.Parameter;
import envsentinel.ml.model.ForestAnomalyDetector;
import envsentinel.ml.model.RandomForestRegressor;
import envsentinel.ml.model.StandardScaler;
import envsentinel.ml.registry.ModelRegistry;
import envsentinel.ml.registry.ModelTriple;
import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Guarda y recupera los tríos de modelos como tres artefactos por parámetro.
 * <ul>
 * <li>{@code {p}_model}: el bosque de regresión en JSON.</li>
 * <li>{@code {p}_scaler}: medias, escalas y el layout de columnas en JSON.</li>
 * <li>{@code {p}_anomaly}: umbral del detector y el estado del Random Cut Forest (protostuff + Base64).</li>
 * </ul>
 * Cada pieza va envuelta en un {@link StoredArtifact} con la generación del guardado.
 * Un trío solo se carga si sus tres piezas existen, se leen bien, son de la misma
 * generación y son coherentes en ancho.
 */
@Slf4j
public class ModelPersistence {

    static final String MODEL_SUFFIX = "_model";
    static final String SCALER_SUFFIX = "_scaler";
    static final String ANOMALY_SUFFIX = "_anomaly";

    private static final int SERIALIZATION_BUFFER_BYTES = 512;

    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private final ModelArtifactStore store;
    private final RandomCutForestMapper forestMapper;
    private final Schema<RandomCutForestState> forestSchema;

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // 1. JSON legible, fechas ISO-8601
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // 2. Módulos para java.time
        mapper.findAndRegisterModules();
        return mapper;
    }

    public ModelPersistence(ModelArtifactStore store) {
        this.store = store;
        this.forestMapper = new RandomCutForestMapper();
        this.forestMapper.setSaveExecutorContextEnabled(true);
        this.forestMapper.setSaveTreeStateEnabled(true);
        this.forestSchema = RuntimeSchema.getSchema(RandomCutForestState.class);
    }

    /**
     * Escribe los tres artefactos del trío. Solo acepta tríos entrenados.
     * Si la escritura se corta a medias, las piezas en disco quedan con generaciones
     * distintas y {@link #load(Parameter)} las rechaza.
     */
    public void save(ModelTriple triple) throws IOException {
        if (!triple.isTrained()) {
            throw new IllegalArgumentException("No se persiste un trío sin entrenar: " + triple.parameter());
        }
        String code = triple.parameter().getCode();
        String generation = UUID.randomUUID().toString();

        write(code + MODEL_SUFFIX, generation, triple.regressor());
        write(code + SCALER_SUFFIX, generation, triple.scaler());
        write(code + ANOMALY_SUFFIX, generation, toCheckpoint(triple.detector()));

        log.info("Modelos de {} guardados (generación {})", code, generation);
    }

    /**
     * Carga el trío de un parámetro. Vacío si falta alguna pieza o no se puede leer.
     */
    public Optional<ModelTriple> load(Parameter parameter) {
        String code = parameter.getCode();
        if (!store.exists(code + MODEL_SUFFIX)
                || !store.exists(code + SCALER_SUFFIX)
                || !store.exists(code + ANOMALY_SUFFIX)) {
            log.debug("Artefactos incompletos para {}", code);
            return Optional.empty();
        }

        try {
            StoredArtifact<RandomForestRegressor> model = read(code + MODEL_SUFFIX, RandomForestRegressor.class);
            StoredArtifact<StandardScaler> scalerArtifact = read(code + SCALER_SUFFIX, StandardScaler.class);
            StoredArtifact<DetectorCheckpoint> anomaly = read(code + ANOMALY_SUFFIX, DetectorCheckpoint.class);

            String generation = model.generation();
            if (generation == null
                    || !Objects.equals(generation, scalerArtifact.generation())
                    || !Objects.equals(generation, anomaly.generation())) {
                log.warn("Artefactos de {} de guardados distintos (modelo {}, escalador {}, detector {}); se ignoran",
                        code, generation, scalerArtifact.generation(), anomaly.generation());
                return Optional.empty();
            }

            RandomForestRegressor regressor = model.payload();
            StandardScaler scaler = scalerArtifact.payload();
            ForestAnomalyDetector detector = fromCheckpoint(anomaly.payload());

            ModelTriple triple = new ModelTriple(parameter, regressor, scaler, detector);
            if (!triple.isTrained()) {
                log.warn("Los artefactos de {} describen un modelo sin ajustar; se ignoran", code);
                return Optional.empty();
            }
            int width = scaler.layout().width();
            if (regressor.featureCount() != width || detector.getDimensions() != width) {
                log.warn("Anchos incoherentes en {}: regresor {}, escalador {}, detector {}",
                        code, regressor.featureCount(), width, detector.getDimensions());
                return Optional.empty();
            }
            return Optional.of(triple);
        } catch (IOException | RuntimeException e) {
            log.warn("No se pudieron leer los artefactos de {}: {}", code, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Intenta cargar los siete parámetros.
     */
    public LoadResult loadAll() {
        Map<Parameter, ModelTriple> loaded = new EnumMap<>(Parameter.class);
        List<Parameter> skipped = new ArrayList<>();
        for (Parameter parameter : Parameter.values()) {
            load(parameter).ifPresentOrElse(
                    triple -> loaded.put(parameter, triple),
                    () -> skipped.add(parameter));
        }
        return new LoadResult(Collections.unmodifiableMap(loaded), List.copyOf(skipped));
    }

    /**
     * Publica en el registro todo lo que se pueda cargar; lo demás queda sin entrenar.
     */
    public LoadResult hydrate(ModelRegistry registry) {
        LoadResult result = loadAll();
        result.loaded().values().forEach(registry::replace);
        log.info("Modelos cargados desde disco: {} (sin artefactos válidos: {})",
                result.loaded().keySet(), result.skipped());
        return result;
    }

    private void write(String name, String generation, Object payload) throws IOException {
        store.write(name, objectMapper.writeValueAsBytes(new StoredArtifact<>(generation, payload)));
    }

    private <T> StoredArtifact<T> read(String name, Class<T> payloadType) throws IOException {
        JavaType type = objectMapper.getTypeFactory().constructParametricType(StoredArtifact.class, payloadType);
        StoredArtifact<T> artifact = objectMapper.readValue(store.read(name), type);
        if (artifact == null || artifact.payload() == null) {
            throw new IOException("Artefacto vacío: " + name);
        }
        return artifact;
    }

    private DetectorCheckpoint toCheckpoint(ForestAnomalyDetector detector) {
        RandomCutForestState state = forestMapper.toState(detector.getForest());
        byte[] bytes = ProtostuffIOUtil.toByteArray(state, forestSchema, LinkedBuffer.allocate(SERIALIZATION_BUFFER_BYTES));
        return new DetectorCheckpoint(
                detector.getDimensions(),
                detector.getOffset(),
                detector.getContamination(),
                Base64.getEncoder().encodeToString(bytes));
    }

    private ForestAnomalyDetector fromCheckpoint(DetectorCheckpoint checkpoint) {
        byte[] bytes = Base64.getDecoder().decode(checkpoint.forest());
        RandomCutForestState state = forestSchema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state, forestSchema);
        RandomCutForest forest = forestMapper.toModel(state);
        if (forest.getDimensions() != checkpoint.dimensions()) {
            throw new IllegalStateException("Dimensiones del bosque (" + forest.getDimensions()
                    + ") distintas de las declaradas (" + checkpoint.dimensions() + ")");
        }
        return ForestAnomalyDetector.restore(forest, checkpoint.offset(), checkpoint.contamination());
    }

    /**
     * @param loaded  Tríos cargados correctamente.
     * @param skipped Parámetros sin artefactos válidos.
     */
    public record LoadResult(Map<Parameter, ModelTriple> loaded, List<Parameter> skipped) {

        public boolean success() {
            return !loaded.isEmpty();
        }
    }
}
