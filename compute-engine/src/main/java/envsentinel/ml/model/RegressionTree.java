package envsentinel.ml.model;

/**
 * Árbol de regresión aplanado en arrays paralelos (serializable tal cual).
 * <p>
 * Nodo {@code i}: si {@code feature[i] < 0} es hoja y devuelve {@code value[i]};
 * si no, se baja por {@code left[i]} cuando {@code x[feature[i]] <= threshold[i]}
 * y por {@code right[i]} en otro caso. La raíz es el nodo 0.
 */
public record RegressionTree(int[] feature, double[] threshold, int[] left, int[] right, double[] value) {

    static final int LEAF = -1;

    public double predict(double[] x) {
        int node = 0;
        while (feature[node] != LEAF) {
            node = x[feature[node]] <= threshold[node] ? left[node] : right[node];
        }
        return value[node];
    }
}
