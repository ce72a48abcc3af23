package envsentinel.compute.repository.sql;

import envsentinel.compute.entity.ReadingEntity;
import envsentinel.compute.repository.ReadingStore;
import envsentinel.domain.exception.UpstreamUnavailableException;
import envsentinel.domain.reading.Reading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;

@Slf4j
@Repository
@Profile("sql")
@RequiredArgsConstructor
public class ReadingStoreImpl implements ReadingStore {

    private final JpaReadingRepository jpaReadingRepository;

    @Override
    public List<Reading> findBetween(Instant start, Instant end) {
        try {
            return jpaReadingRepository.findByTimestampBetweenOrderByTimestampAsc(start, end).stream()
                    .map(ReadingStoreImpl::toDomain)
                    .toList();
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("No se pudo leer el histórico de lecturas", e);
        }
    }

    @Override
    public List<Reading> findRecent(String sensorId, int limit) {
        try {
            return jpaReadingRepository.findBySensorIdOrderByTimestampDesc(sensorId, PageRequest.of(0, limit)).stream()
                    .map(ReadingStoreImpl::toDomain)
                    .toList();
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("No se pudieron leer las lecturas de " + sensorId, e);
        }
    }

    @Override
    public Reading save(Reading reading) {
        ReadingEntity entity = ReadingEntity.builder()
                .sensorId(reading.sensorId())
                .sensorType(reading.sensorType())
                .timestamp(reading.timestamp())
                .values(withoutNulls(reading))
                .build();
        try {
            return toDomain(jpaReadingRepository.save(entity));
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("No se pudo guardar la lectura de " + reading.sensorId(), e);
        }
    }

    private static HashMap<String, Double> withoutNulls(Reading reading) {
        HashMap<String, Double> values = new HashMap<>();
        reading.values().forEach((code, value) -> {
            if (value != null) values.put(code, value);
        });
        return values;
    }

    private static Reading toDomain(ReadingEntity entity) {
        return new Reading(entity.getTimestamp(), entity.getSensorId(), entity.getSensorType(), entity.getValues());
    }
}
