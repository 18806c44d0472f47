package ca.gc.cra.tagcal.infrastructure.reference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.InMemoryReferenceTables;
import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ReferenceLookupException;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.reference.OpticalKey;
import org.junit.jupiter.api.Test;

class CachingReferenceTablesTest {

  @Test
  void repeatedLookupsHitDelegateOnce() throws CalibrationException {
    InMemoryReferenceTables delegate = new InMemoryReferenceTables();
    CachingReferenceTables cache = new CachingReferenceTables(delegate);
    OpticalKey psa = new OpticalKey("G130M", 1309, "PSA", "FUVA");

    assertSame(cache.baseline(Segment.FUVA), cache.baseline(Segment.FUVA));
    cache.trace(psa);
    cache.trace(psa);
    cache.trace(psa.withAperture("WCA"));

    assertEquals(1, delegate.calls("brftab"));
    assertEquals(2, delegate.calls("xtractab"));
  }

  @Test
  void keysDistinguishSegments() throws CalibrationException {
    InMemoryReferenceTables delegate = new InMemoryReferenceTables();
    CachingReferenceTables cache = new CachingReferenceTables(delegate);

    cache.livetime(Segment.FUVA);
    cache.livetime(Segment.FUVB);

    assertEquals(2, delegate.calls("deadtab"));
  }

  @Test
  void dispersionRowsAreKeyedByFpoffsetAndStepsizesByGrating() throws CalibrationException {
    InMemoryReferenceTables delegate = new InMemoryReferenceTables();
    delegate.stepsize = 2.5;
    CachingReferenceTables cache = new CachingReferenceTables(delegate);
    OpticalKey psa = new OpticalKey("G130M", 1309, "PSA", "FUVA");

    cache.dispersion(psa, 0);
    cache.dispersion(psa, 0);
    cache.dispersion(psa, 1);
    assertEquals(2.5, cache.fpoffsetStepsize("G130M"));
    assertEquals(2.5, cache.fpoffsetStepsize("G130M"));

    assertEquals(2, delegate.calls("disptab"));
    assertEquals(1, delegate.calls("wcptab"));
  }

  @Test
  void failuresAreNotCached() {
    InMemoryReferenceTables delegate = new InMemoryReferenceTables();
    CachingReferenceTables cache = new CachingReferenceTables(delegate);

    assertThrows(ReferenceLookupException.class, () -> cache.flatField(Segment.FUVA));
    assertThrows(ReferenceLookupException.class, () -> cache.flatField(Segment.FUVA));

    assertEquals(2, delegate.calls("flatfile"));
  }
}
