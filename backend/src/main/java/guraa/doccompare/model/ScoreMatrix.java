package guraa.doccompare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Arrays;
import java.util.List;

/**
 * Similarity scores indexed by document position.
 * In full mode rows and columns name the same documents and the diagonal holds {@link #NOT_APPLICABLE}.
 * In targeted mode there is a single row for the target document.
 */
public class ScoreMatrix {

    /**
     * Marks a self-pair. Never used for a failed comparison.
     */
    public static final double NOT_APPLICABLE = -1.0;

    private final List<String> rowNames;
    private final List<String> columnNames;
    private final double[][] values;

    public ScoreMatrix(List<String> rowNames, List<String> columnNames, double[][] values) {
        if (values.length != rowNames.size()) {
            throw new IllegalArgumentException("Expected " + rowNames.size() + " rows but got " + values.length);
        }
        for (double[] row : values) {
            if (row.length != columnNames.size()) {
                throw new IllegalArgumentException("Expected " + columnNames.size() + " columns but got " + row.length);
            }
        }
        this.rowNames = List.copyOf(rowNames);
        this.columnNames = List.copyOf(columnNames);
        this.values = copy(values);
    }

    public List<String> getRowNames() {
        return rowNames;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    /**
     * A copy of the score table.
     */
    public double[][] getValues() {
        return copy(values);
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    @JsonIgnore
    public int getRowCount() {
        return values.length;
    }

    @JsonIgnore
    public int getColumnCount() {
        return columnNames.size();
    }

    @JsonIgnore
    public boolean isSquare() {
        return rowNames.equals(columnNames);
    }

    private static double[][] copy(double[][] source) {
        double[][] result = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            result[i] = source[i].clone();
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoreMatrix)) return false;
        ScoreMatrix other = (ScoreMatrix) o;
        return rowNames.equals(other.rowNames)
                && columnNames.equals(other.columnNames)
                && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rowNames.hashCode() + columnNames.hashCode()) + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "ScoreMatrix{rows=" + rowNames + ", columns=" + columnNames + ", values=" + Arrays.deepToString(values) + "}";
    }
}
