package envsentinel.compute.repository;

import envsentinel.domain.reading.Reading;

import java.time.Instant;
import java.util.List;

/**
 * Acceso al histórico de lecturas, sin importar de dónde vengan.
 * <p>
 * Cualquier fallo del almacén subyacente se traduce a
 * {@link envsentinel.domain.exception.UpstreamUnavailableException}.
 */
public interface ReadingStore {

    /**
     * Lecturas de todos los sensores con {@code start <= timestamp <= end}, de la más antigua a la más reciente.
     */
    List<Reading> findBetween(Instant start, Instant end);

    /**
     * Las {@code limit} lecturas más recientes de un sensor, de la más reciente a la más antigua.
     */
    List<Reading> findRecent(String sensorId, int limit);

    Reading save(Reading reading);
}
