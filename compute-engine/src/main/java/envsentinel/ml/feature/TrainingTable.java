package envsentinel.ml.feature;

import envsentinel.domain.reading.Covariate;
import envsentinel.domain.reading.Parameter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Tabla plana de un ciclo de entrenamiento: una fila por lectura.
 * <p>
 * Columnas: las tres de calendario (siempre completas) y una celda anulable por
 * cada covariable que apareció al menos una vez en la ventana. Se construye una
 * vez por ciclo y se comparte entre todos los parámetros; cada parámetro filtra
 * sus propias filas en {@link #forTarget(Parameter)}.
 */
@Slf4j
public final class TrainingTable {

    private final double[][] calendar;   // [fila][hour, day_of_week, month]
    private final List<Covariate> columns;
    private final Double[][] cells;      // [fila][columna], null = no reportado

    TrainingTable(double[][] calendar, List<Covariate> columns, Double[][] cells) {
        this.calendar = calendar;
        this.columns = List.copyOf(columns);
        this.cells = cells;
    }

    public int rowCount() {
        return calendar.length;
    }

    public List<Covariate> columns() {
        return columns;
    }

    /**
     * Prepara X / y para un parámetro.
     * <ol>
     * <li>Descarta las filas sin valor del parámetro objetivo.</li>
     * <li>Toma como entradas el calendario más todas las covariables salvo el objetivo.</li>
     * <li>Imputa huecos con la media de la columna calculada SOLO sobre las filas supervivientes.</li>
     * </ol>
     * Una covariable sin ningún valor observado en esas filas no tiene media y se deja
     * fuera del layout de este parámetro.
     */
    public TargetDataset forTarget(Parameter target) {
        int targetColumn = columns.indexOf(target.asCovariate());

        // 1. Filtrado por objetivo
        List<Integer> kept = new ArrayList<>();
        if (targetColumn >= 0) {
            for (int row = 0; row < cells.length; row++) {
                if (cells[row][targetColumn] != null) kept.add(row);
            }
        }

        // 2. Columnas de entrada y su media sobre las filas filtradas
        List<Integer> inputColumns = new ArrayList<>();
        List<String> codes = new ArrayList<>();
        List<Double> means = new ArrayList<>();
        for (int col = 0; col < columns.size(); col++) {
            if (col == targetColumn) continue;

            double sum = 0.0;
            int observed = 0;
            for (int row : kept) {
                Double cell = cells[row][col];
                if (cell != null) {
                    sum += cell;
                    observed++;
                }
            }
            if (observed == 0) {
                if (!kept.isEmpty()) {
                    log.debug("Covariable {} sin valores para {}; se excluye del layout", columns.get(col).getCode(), target);
                }
                continue;
            }
            inputColumns.add(col);
            codes.add(columns.get(col).getCode());
            means.add(sum / observed);
        }

        // 3. Matriz final con imputación por media
        int width = FeatureLayout.CALENDAR_COLUMNS.size() + inputColumns.size();
        double[][] x = new double[kept.size()][width];
        double[] y = new double[kept.size()];
        for (int i = 0; i < kept.size(); i++) {
            int row = kept.get(i);
            System.arraycopy(calendar[row], 0, x[i], 0, 3);
            for (int j = 0; j < inputColumns.size(); j++) {
                Double cell = cells[row][inputColumns.get(j)];
                x[i][3 + j] = cell != null ? cell : means.get(j);
            }
            y[i] = cells[row][targetColumn];
        }

        return new TargetDataset(target, FeatureLayout.of(codes), x, y);
    }
}
