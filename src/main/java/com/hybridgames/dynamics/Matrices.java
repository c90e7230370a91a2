package com.hybridgames.dynamics;

import static com.google.common.base.Preconditions.checkArgument;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.SingularOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import org.ejml.simple.SimpleMatrix;

/** Conversions between nested arrays and EJML matrices, plus the few decompositions we need. */
public final class Matrices {
  private Matrices() {}

  /** Copies a rectangular nested array. Ragged input is rejected. */
  public static SimpleMatrix of(double[][] data) {
    int rows = data.length;
    int columns = rows == 0 ? 0 : data[0].length;
    SimpleMatrix matrix = new SimpleMatrix(rows, columns);
    for (int i = 0; i < rows; i++) {
      checkArgument(data[i].length == columns, "Row %s has %s entries, expected %s", i, data[i].length, columns);
      for (int j = 0; j < columns; j++) {
        matrix.set(i, j, data[i][j]);
      }
    }
    return matrix;
  }

  public static SimpleMatrix column(double... values) {
    SimpleMatrix matrix = new SimpleMatrix(values.length, 1);
    for (int i = 0; i < values.length; i++) {
      matrix.set(i, 0, values[i]);
    }
    return matrix;
  }

  public static double[][] toArray(SimpleMatrix matrix) {
    double[][] data = new double[matrix.numRows()][matrix.numCols()];
    for (int i = 0; i < data.length; i++) {
      for (int j = 0; j < data[i].length; j++) {
        data[i][j] = matrix.get(i, j);
      }
    }
    return data;
  }

  public static double[] toVector(SimpleMatrix column) {
    checkArgument(column.numCols() == 1, "Expected a column vector, got %s columns", column.numCols());
    double[] vector = new double[column.numRows()];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = column.get(i, 0);
    }
    return vector;
  }

  /** Numerical rank: the number of singular values above {@code tolerance}. */
  public static int rank(SimpleMatrix matrix, double tolerance) {
    if (matrix.numRows() == 0 || matrix.numCols() == 0) {
      return 0;
    }
    SingularValueDecomposition_F64<DMatrixRMaj> svd =
        DecompositionFactory_DDRM.svd(matrix.numRows(), matrix.numCols(), false, false, true);
    if (!svd.decompose(matrix.getDDRM().copy())) {
      throw new IllegalStateException("Singular value decomposition failed");
    }
    return SingularOps_DDRM.rank(svd, tolerance);
  }

  /** {@code [left | right]}. */
  public static SimpleMatrix concatColumns(SimpleMatrix left, SimpleMatrix right) {
    checkArgument(left.numRows() == right.numRows(), "Row count mismatch: %s vs %s",
        left.numRows(), right.numRows());
    SimpleMatrix result = new SimpleMatrix(left.numRows(), left.numCols() + right.numCols());
    result.insertIntoThis(0, 0, left);
    result.insertIntoThis(0, left.numCols(), right);
    return result;
  }

  static String format(SimpleMatrix matrix) {
    StringBuilder builder = new StringBuilder();
    for (int i = 0; i < matrix.numRows(); i++) {
      builder.append('[');
      for (int j = 0; j < matrix.numCols(); j++) {
        if (j > 0) {
          builder.append(", ");
        }
        builder.append(matrix.get(i, j));
      }
      builder.append("]\n");
    }
    return builder.toString();
  }
}
