package envsentinel.ml.registry;

import envsentinel.domain.reading.Parameter;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registro vivo parámetro -> trío de modelos.
 * <p>
 * Único estado mutable compartido entre las peticiones (lectores) y el ciclo de
 * reentrenamiento (escritor). Reglas:
 * <ul>
 * <li>Todo parámetro tiene SIEMPRE un trío; al arrancar es el trío sin entrenar.</li>
 * <li>{@link #replace(ModelTriple)} cambia el trío entero de un golpe; un lector ve el
 * viejo o el nuevo, nunca una mezcla.</li>
 * <li>No hay atomicidad entre parámetros distintos.</li>
 * </ul>
 */
@Slf4j
public class ModelRegistry {

    private final Map<Parameter, ModelTriple> triples = new ConcurrentHashMap<>();

    public ModelRegistry() {
        for (Parameter parameter : Parameter.values()) {
            triples.put(parameter, ModelTriple.untrained(parameter));
        }
    }

    public ModelTriple get(Parameter parameter) {
        return triples.get(parameter);
    }

    public void replace(ModelTriple triple) {
        triples.put(triple.parameter(), triple);
        log.debug("Trío de {} sustituido (entrenado: {})", triple.parameter(), triple.isTrained());
    }

    public boolean isTrained(Parameter parameter) {
        return get(parameter).isTrained();
    }

    /**
     * Parámetros con un trío entrenado, en el orden del enum.
     */
    public List<Parameter> trainedParameters() {
        return Arrays.stream(Parameter.values())
                .filter(this::isTrained)
                .toList();
    }

    /**
     * Copia inmutable del estado actual (cada entrada es coherente por sí sola).
     */
    public Map<Parameter, ModelTriple> snapshot() {
        return Collections.unmodifiableMap(new EnumMap<>(triples));
    }
}
