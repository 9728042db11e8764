package net.larse.tsmodel.helper;

import org.ejml.data.DenseMatrix64F;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LinearLeastSquaresTest {
  @Test
  public void testExactLine() {
    // y0 = 1 + 2x, y1 = -3 + 0.5x
    LinearLeastSquares lls = new LinearLeastSquares(2, 2);
    for (int i = 0; i < 10; i++) {
      lls.addInput(new double[] {1, i}, 0, new double[] {1 + 2 * i, -3 + 0.5 * i}, 0);
    }
    DenseMatrix64F results = new DenseMatrix64F(2, 2);
    assertTrue(lls.getSolution(results));
    assertEquals(1, results.get(0, 0), 1e-10);
    assertEquals(2, results.get(1, 0), 1e-10);
    assertEquals(-3, results.get(0, 1), 1e-10);
    assertEquals(0.5, results.get(1, 1), 1e-10);
    double[] rms = lls.getRmsResiduals(results, 2);
    assertEquals(0, rms[0], 1e-6);
    assertEquals(0, rms[1], 1e-6);
    assertEquals(10, lls.numInputs());
  }

  @Test
  public void testResiduals() {
    // alternating +-1 around a constant
    LinearLeastSquares lls = new LinearLeastSquares(1, 1);
    for (int i = 0; i < 4; i++) {
      lls.addInput(new double[] {1}, 0, new double[] {i % 2 == 0 ? 4 : 6}, 0);
    }
    DenseMatrix64F results = new DenseMatrix64F(1, 1);
    assertTrue(lls.getSolution(results));
    assertEquals(5, results.get(0, 0), 1e-12);
    assertEquals(1, lls.getRmsResiduals(results, 0)[0], 1e-9);
    assertEquals(Math.sqrt(4 / 3.0), lls.getRmsResiduals(results, 1)[0], 1e-9);
  }

  @Test
  public void testOffsets() {
    LinearLeastSquares lls = new LinearLeastSquares(2, 1);
    double[] row = new double[5];
    double[] y = new double[3];
    for (int i = 0; i < 5; i++) {
      row[3] = 1;
      row[4] = i;
      y[2] = 7 - i;
      lls.addInput(row, 3, y, 2);
    }
    DenseMatrix64F results = new DenseMatrix64F(2, 1);
    assertTrue(lls.getSolution(results));
    assertEquals(7, results.get(0, 0), 1e-10);
    assertEquals(-1, results.get(1, 0), 1e-10);
  }

  @Test
  public void testTooFewInputs() {
    LinearLeastSquares lls = new LinearLeastSquares(3, 1);
    lls.addInput(new double[] {1, 2, 3}, 0, new double[] {1}, 0);
    assertFalse(lls.getSolution(new DenseMatrix64F(3, 1)));
  }

  @Test
  public void testSingularWithEmptyColumn() {
    LinearLeastSquares lls = new LinearLeastSquares(2, 1);
    for (int i = 0; i < 10; i++) {
      lls.addInput(new double[] {1, 0}, 0, new double[] {i}, 0);
    }
    assertFalse(lls.getSolution(new DenseMatrix64F(2, 1)));
  }

  @Test(expected = IllegalStateException.class)
  public void testResidualsNeedASolution() {
    LinearLeastSquares lls = new LinearLeastSquares(1, 1);
    lls.getRmsResiduals(new DenseMatrix64F(1, 1), 0);
  }
}
