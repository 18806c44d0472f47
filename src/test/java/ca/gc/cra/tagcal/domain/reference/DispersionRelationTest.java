package ca.gc.cra.tagcal.domain.reference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class DispersionRelationTest {

  @Test
  void evaluatesPolynomialAndDerivative() {
    DispersionRelation relation = new DispersionRelation(new double[] {1000.0, 0.01, 1e-6}, 10.0);

    double u = 8000.0 + 10.0;
    assertEquals(1000.0 + 0.01 * u + 1e-6 * u * u, relation.wavelength(8000.0), 1e-9);
    assertEquals(0.01 + 2e-6 * u, relation.dispersion(8000.0), 1e-12);
  }

  @Test
  void constantRelationHasZeroDispersion() {
    DispersionRelation relation = new DispersionRelation(new double[] {1500.0}, 0.0);

    assertEquals(1500.0, relation.wavelength(42.0));
    assertEquals(0.0, relation.dispersion(42.0));
  }

  @Test
  void coefficientsAreCopied() {
    double[] coefficients = {1.0, 2.0};
    DispersionRelation relation = new DispersionRelation(coefficients, 0.0);
    coefficients[0] = 99.0;

    assertEquals(1.0, relation.coefficients()[0]);
    assertThrows(IllegalArgumentException.class, () -> new DispersionRelation(new double[0], 0.0));
  }
}
