package envsentinel.ml.feature;

import envsentinel.domain.reading.Covariate;
import envsentinel.domain.reading.Reading;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Convierte lecturas crudas en la representación tabular que consumen los modelos.
 * <p>
 * Hay dos caminos que DEBEN producir el mismo orden de columnas:
 * <ul>
 * <li><b>Entrenamiento:</b> {@link #buildTrainingTable(List)} + {@link TrainingTable#forTarget}.
 * Huecos imputados con la media de la columna del ciclo actual.</li>
 * <li><b>Inferencia:</b> {@link #buildFeatureVector(Map, FeatureLayout, Instant)}.
 * Huecos imputados con 0.0, no con la media de entrenamiento.</li>
 * </ul>
 */
@Slf4j
public class FeatureBuilder {

    private final ZoneId zone;

    /**
     * @param zone Zona horaria en la que se derivan hora, día de la semana y mes.
     */
    public FeatureBuilder(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Aplana las lecturas (ya ordenadas por tiempo) en una tabla con columnas de calendario
     * y una columna por covariable reportada al menos una vez en la ventana.
     */
    public TrainingTable buildTrainingTable(List<Reading> readings) {
        // 1. Qué covariables existen en esta ventana (en el orden fijo del enum)
        Set<Covariate> present = EnumSet.noneOf(Covariate.class);
        for (Reading reading : readings) {
            for (Covariate covariate : Covariate.values()) {
                if (reading.value(covariate) != null) present.add(covariate);
            }
        }
        List<Covariate> columns = new ArrayList<>(present);

        // 2. Relleno de filas
        double[][] calendar = new double[readings.size()][];
        Double[][] cells = new Double[readings.size()][columns.size()];
        for (int row = 0; row < readings.size(); row++) {
            Reading reading = readings.get(row);
            calendar[row] = calendarFeatures(reading.timestamp());
            for (int col = 0; col < columns.size(); col++) {
                cells[row][col] = reading.value(columns.get(col));
            }
        }

        log.debug("Tabla de entrenamiento: {} filas, covariables {}", readings.size(), columns);
        return new TrainingTable(calendar, columns, cells);
    }

    /**
     * Vector de inferencia con el mismo layout que se usó al entrenar.
     *
     * @param values Valores actuales (código -> valor). Ausente o null se imputa con 0.0.
     * @param layout Layout persistido con el escalador del parámetro.
     * @param asOf   Instante del que salen las columnas de calendario (puede ser futuro).
     */
    public double[] buildFeatureVector(Map<String, Double> values, FeatureLayout layout, Instant asOf) {
        List<String> codes = layout.covariateCodes();
        double[] vector = new double[FeatureLayout.CALENDAR_COLUMNS.size() + codes.size()];

        double[] calendar = calendarFeatures(asOf);
        System.arraycopy(calendar, 0, vector, 0, calendar.length);

        for (int i = 0; i < codes.size(); i++) {
            Double value = values.get(codes.get(i));
            vector[calendar.length + i] = value != null ? value : 0.0;
        }
        return vector;
    }

    /**
     * Vector reducido del chequeo en tiempo real: {@code [hour, day_of_week, month, value]}.
     * No sigue el layout de entrenamiento.
     */
    public double[] buildRealtimeVector(double value, Instant asOf) {
        double[] calendar = calendarFeatures(asOf);
        return new double[]{calendar[0], calendar[1], calendar[2], value};
    }

    /**
     * {@code [hora 0-23, día de la semana 0=lunes..6=domingo, mes 1-12]}.
     */
    public double[] calendarFeatures(Instant instant) {
        ZonedDateTime time = instant.atZone(zone);
        return new double[]{
                time.getHour(),
                time.getDayOfWeek().getValue() - 1,
                time.getMonthValue()
        };
    }
}
