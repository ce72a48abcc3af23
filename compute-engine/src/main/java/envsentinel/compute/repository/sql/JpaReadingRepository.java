package envsentinel.compute.repository.sql;

import envsentinel.compute.entity.ReadingEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

/**
 * Interfaz interna de Spring Data JPA.
 * ReadingStoreImpl delegará en esta interfaz.
 */
public interface JpaReadingRepository extends JpaRepository<ReadingEntity, String> {

    List<ReadingEntity> findByTimestampBetweenOrderByTimestampAsc(Instant start, Instant end);

    List<ReadingEntity> findBySensorIdOrderByTimestampDesc(String sensorId, Pageable pageable);
}
