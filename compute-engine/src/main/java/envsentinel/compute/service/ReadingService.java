package envsentinel.compute.service;

import envsentinel.compute.repository.ReadingStore;
import envsentinel.domain.dto.reading.ReadingCreationDTO;
import envsentinel.domain.exception.InvalidRequestException;
import envsentinel.domain.reading.Reading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Ingesta de lecturas en el almacén.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadingService {

    private final ReadingStore readingStore;
    private final Clock clock;

    public Reading ingest(ReadingCreationDTO request) {
        // 1. Validación mínima
        if (request.sensorId() == null || request.sensorId().isBlank()) {
            throw new InvalidRequestException("sensorId es obligatorio");
        }
        if (request.readings() == null || request.readings().isEmpty()) {
            throw new InvalidRequestException("La lectura no contiene valores");
        }

        // 2. Mapeo DTO -> dominio; sin instante, el de ingesta
        Reading reading = new Reading(
                request.timestamp() != null ? request.timestamp() : clock.instant(),
                request.sensorId(),
                request.sensorType(),
                request.readings());

        Reading saved = readingStore.save(reading);
        log.debug("Lectura de {} guardada con {} valores", saved.sensorId(), saved.values().size());
        return saved;
    }
}
