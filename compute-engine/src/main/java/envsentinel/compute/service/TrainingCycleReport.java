package envsentinel.compute.service;

import envsentinel.domain.dto.training.TrainingResponseDTO;
import envsentinel.domain.reading.Parameter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Resumen de un ciclo de entrenamiento.
 *
 * @param success  {@code false} si la ventana no trajo ninguna lectura o si ya había un ciclo en curso.
 * @param records  Lecturas recuperadas del almacén.
 * @param outcomes Un resultado por parámetro; vacío si {@code success} es falso.
 */
public record TrainingCycleReport(
        boolean success,
        String message,
        int records,
        Instant startedAt,
        Instant finishedAt,
        List<ParameterOutcome> outcomes
) {

    public TrainingCycleReport {
        outcomes = List.copyOf(outcomes);
    }

    public static TrainingCycleReport noData(Instant startedAt, Instant finishedAt) {
        return new TrainingCycleReport(false, "No hay datos en la ventana de entrenamiento", 0,
                startedAt, finishedAt, List.of());
    }

    public static TrainingCycleReport inProgress(Instant requestedAt) {
        return new TrainingCycleReport(false, "Ya hay un ciclo de entrenamiento en curso", 0,
                requestedAt, requestedAt, List.of());
    }

    public Optional<ParameterOutcome> outcome(Parameter parameter) {
        return outcomes.stream().filter(o -> o.parameter() == parameter).findFirst();
    }

    public long count(ParameterOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public TrainingResponseDTO toResponse() {
        return TrainingResponseDTO.builder()
                .success(success)
                .message(message)
                .records(records)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .outcomes(outcomes.stream().map(ParameterOutcome::toResponse).toList())
                .build();
    }
}
