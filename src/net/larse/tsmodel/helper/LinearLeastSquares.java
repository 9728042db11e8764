/*
 * Copyright (c) 2015 Google, Inc.
 * 
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 * 
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 * 
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.tsmodel.helper;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

/**
 * Computes a multivariate linear regression via ordinary least squares, accumulating the normal
 * equations one observation at a time. Several dependent variables that share the same design
 * matrix are solved together.
 *
 * <p>Instances hold per-fit scratch state and are not thread safe; create one per fit.
 */
public class LinearLeastSquares {
  /**
   * Solutions whose Cholesky factor has a diagonal quality at or below this are treated as
   * singular. A rank-deficient design leaves at least one diagonal entry at roundoff level.
   */
  @VisibleForTesting
  static final double MIN_QUALITY = 1e-12;

  public final int numX;
  public final int numY;

  private int numInputs;
  // the lower-left elements of xMat, row by row
  private final double[] xSums;
  // the elements of yMat
  private final double[] ySums;
  // the sums of y_i^2
  private final double[] y2Sums;

  private boolean solved;
  private DenseMatrix64F yMat;

  /**
   * Creates a solver to compute a linear least squares regression with numX independent
   * variables and numY dependent variables.
   *
   * <p>Call addInput() at least numX times, then getSolution() and, optionally,
   * getRmsResiduals().
   */
  public LinearLeastSquares(int numX, int numY) {
    Preconditions.checkArgument(numX >= 1 && numY >= 1);
    this.numX = numX;
    this.numY = numY;
    this.xSums = new double[numX * (numX + 1) / 2];
    this.ySums = new double[numY * numX];
    this.y2Sums = new double[numY];
  }

  // With one row per observation
  //   X = [ x0 x1 x2 ... ]     Y = [ y0 y1 ... ]
  // we accumulate
  //    xMat = transpose(X) * X      (numX, numX), symmetric
  //    yMat = transpose(X) * Y      (numX, numY)
  // and solve xMat * R = yMat for the coefficients R.
  //
  //   xMat[i, j] = sum(x_i * x_j)
  //   yMat[i, j] = sum(x_i * y_j)
  //
  // Residual k is then
  //    Math.sqrt((sum(y_k^2) - dotProd(R[*, k], yMat[*, k])) / n)

  /**
   * Add one observation, using numX values from x starting with xStart and numY values from y
   * starting at yStart.
   */
  public void addInput(double[] x, int xStart, double[] y, int yStart) {
    ++numInputs;
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      double xi = x[xStart + i];
      for (int i2 = 0; i2 <= i; ++i2) {
        xSums[pos++] += xi * x[xStart + i2];
      }
    }
    for (int j = 0; j < numY; ++j) {
      double yj = y[yStart + j];
      y2Sums[j] += yj * yj;
    }
    pos = 0;
    for (int i = 0; i < numX; ++i) {
      double xi = x[xStart + i];
      for (int j = 0; j < numY; ++j) {
        ySums[pos++] += xi * y[yStart + j];
      }
    }
    solved = false;
  }

  public int numInputs() {
    return numInputs;
  }

  /**
   * Compute results from the accumulated state. Returns false if there were not enough inputs or
   * the normal matrix is singular. Returns true if it was successful, and sets results to have
   * numX rows and numY columns, where each column contains the coefficients for the corresponding
   * dependent variable.
   */
  public boolean getSolution(DenseMatrix64F results) {
    solved = false;
    if (numInputs < numX) {
      return false;
    }
    DenseMatrix64F xMat = new DenseMatrix64F(numX, numX);
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      for (int i2 = 0; i2 <= i; ++i2) {
        double sum = xSums[pos++];
        xMat.unsafe_set(i, i2, sum);
        if (i != i2) {
          xMat.unsafe_set(i2, i, sum);
        }
      }
    }
    // the solver may modify its inputs, so hand it copies
    yMat = DenseMatrix64F.wrap(numX, numY, ySums.clone());
    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.symmPosDef(numX);
    if (solver.setA(xMat) && solver.quality() > MIN_QUALITY) {
      results.reshape(numX, numY, false);
      solver.solve(yMat.copy(), results);
      solved = true;
    }
    return solved;
  }

  /**
   * Compute the square root of the mean squared residual for each dependent variable. May only
   * be called after a successful call to getSolution(), and must be given the (unmodified)
   * results of that call.
   *
   * @param dof degrees of freedom to subtract from the number of inputs, e.g. numX for an
   *     unbiased estimate, 0 for the plain mean.
   */
  public double[] getRmsResiduals(DenseMatrix64F results, int dof) {
    Preconditions.checkState(solved, "no solution");
    Preconditions.checkArgument(results.getNumRows() == numX && results.getNumCols() == numY);
    double[] residuals = new double[numY];
    int n = numInputs - dof;
    for (int i = 0; i < numY; ++i) {
      double sumSq = y2Sums[i];
      for (int j = 0; j < numX; ++j) {
        sumSq -= results.unsafe_get(j, i) * yMat.unsafe_get(j, i);
      }
      // due to roundoff, sumSq could end up slightly negative
      residuals[i] = (sumSq <= 0 || n <= 0) ? 0 : Math.sqrt(sumSq / n);
    }
    return residuals;
  }
}
