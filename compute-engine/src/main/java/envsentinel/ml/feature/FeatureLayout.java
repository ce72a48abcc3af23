package envsentinel.ml.feature;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Orden exacto de columnas con el que se ajustó el escalador de un parámetro.
 * <p>
 * Siempre empieza por las tres columnas de calendario; detrás van los códigos de
 * las covariables presentes en la tabla de entrenamiento de ese parámetro.
 * Viaja persistido junto al escalador para que la inferencia reconstruya el
 * vector columna a columna.
 */
public record FeatureLayout(List<String> columns) {

    public static final String HOUR = "hour";
    public static final String DAY_OF_WEEK = "day_of_week";
    public static final String MONTH = "month";
    public static final List<String> CALENDAR_COLUMNS = List.of(HOUR, DAY_OF_WEEK, MONTH);

    public FeatureLayout {
        columns = List.copyOf(columns);
        if (!columns.isEmpty() && !columns.subList(0, Math.min(3, columns.size())).equals(CALENDAR_COLUMNS)) {
            throw new IllegalArgumentException("El layout debe empezar por " + CALENDAR_COLUMNS + ": " + columns);
        }
    }

    public static FeatureLayout of(List<String> covariateCodes) {
        return new FeatureLayout(concat(CALENDAR_COLUMNS, covariateCodes));
    }

    /**
     * Códigos de covariables, sin las columnas de calendario.
     */
    public List<String> covariateCodes() {
        return columns.size() <= CALENDAR_COLUMNS.size()
                ? List.of()
                : columns.subList(CALENDAR_COLUMNS.size(), columns.size());
    }

    public int width() {
        return columns.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return columns.isEmpty();
    }

    private static List<String> concat(List<String> head, List<String> tail) {
        List<String> all = new ArrayList<>(head.size() + tail.size());
        all.addAll(head);
        all.addAll(tail);
        return all;
    }
}
