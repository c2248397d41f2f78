package org.bigcsters.matching.strategy;

import java.util.Arrays;

/**
 * Minimum-cost rectangular assignment (rows &lt;= columns) by the Hungarian method with
 * row/column potentials and shortest augmenting paths. O(rows^2 * columns).
 *
 * <p>Every row is assigned to exactly one distinct column. Costs are read through
 * {@link CostFunction} so callers need not materialise the full matrix.</p>
 */
final class HungarianAssignment {

    /**
     * Cost lookup for one (row, column) cell. Must be finite.
     */
    @FunctionalInterface
    interface CostFunction {
        double cost(int row, int column);
    }

    private HungarianAssignment() {
    }

    /**
     * Solves the assignment.
     *
     * @param rows number of rows.
     * @param columns number of columns, {@code >= rows}.
     * @param costs cost lookup.
     * @return column index per row.
     */
    static int[] solve(int rows, int columns, CostFunction costs) {
        if (rows > columns) {
            throw new IllegalArgumentException("rows (" + rows + ") must not exceed columns (" + columns + ")");
        }
        int[] rowToColumn = new int[rows];
        if (rows == 0) {
            return rowToColumn;
        }

        // 1-based; column 0 is the virtual root of each augmenting search
        double[] rowPotential = new double[rows + 1];
        double[] columnPotential = new double[columns + 1];
        int[] columnOwner = new int[columns + 1];
        int[] previousColumn = new int[columns + 1];
        double[] minSlack = new double[columns + 1];
        boolean[] visited = new boolean[columns + 1];

        for (int row = 1; row <= rows; row++) {
            columnOwner[0] = row;
            int currentColumn = 0;
            Arrays.fill(minSlack, Double.POSITIVE_INFINITY);
            Arrays.fill(visited, false);
            do {
                visited[currentColumn] = true;
                int currentRow = columnOwner[currentColumn];
                double delta = Double.POSITIVE_INFINITY;
                int nextColumn = 0;
                for (int column = 1; column <= columns; column++) {
                    if (visited[column]) {
                        continue;
                    }
                    double slack = costs.cost(currentRow - 1, column - 1)
                            - rowPotential[currentRow]
                            - columnPotential[column];
                    if (slack < minSlack[column]) {
                        minSlack[column] = slack;
                        previousColumn[column] = currentColumn;
                    }
                    if (minSlack[column] < delta) {
                        delta = minSlack[column];
                        nextColumn = column;
                    }
                }
                for (int column = 0; column <= columns; column++) {
                    if (visited[column]) {
                        rowPotential[columnOwner[column]] += delta;
                        columnPotential[column] -= delta;
                    } else {
                        minSlack[column] -= delta;
                    }
                }
                currentColumn = nextColumn;
            } while (columnOwner[currentColumn] != 0);

            do {
                int previous = previousColumn[currentColumn];
                columnOwner[currentColumn] = columnOwner[previous];
                currentColumn = previous;
            } while (currentColumn != 0);
        }

        for (int column = 1; column <= columns; column++) {
            if (columnOwner[column] != 0) {
                rowToColumn[columnOwner[column] - 1] = column - 1;
            }
        }
        return rowToColumn;
    }
}
