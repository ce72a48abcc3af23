package envsentinel.compute.repository.mock;

import envsentinel.compute.repository.ReadingStore;
import envsentinel.domain.reading.Reading;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Almacén en memoria para demos y tests (perfil {@code mock}).
 */
@Repository
@Profile("mock")
public class InMemoryReadingStore implements ReadingStore {

    private final List<Reading> readings = new ArrayList<>();

    @Override
    public synchronized List<Reading> findBetween(Instant start, Instant end) {
        return readings.stream()
                .filter(r -> !r.timestamp().isBefore(start) && !r.timestamp().isAfter(end))
                .sorted(Comparator.comparing(Reading::timestamp))
                .toList();
    }

    @Override
    public synchronized List<Reading> findRecent(String sensorId, int limit) {
        return readings.stream()
                .filter(r -> r.sensorId().equals(sensorId))
                .sorted(Comparator.comparing(Reading::timestamp).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized Reading save(Reading reading) {
        readings.add(reading);
        return reading;
    }

    public synchronized int size() {
        return readings.size();
    }

    public synchronized void clear() {
        readings.clear();
    }
}
