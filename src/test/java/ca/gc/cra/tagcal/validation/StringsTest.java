package ca.gc.cra.tagcal.validation;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StringsTest {
  @Test
  void trimsValidValues() {
    assertEquals("lexp01abq", Strings.requireNonBlank("rootname", "  lexp01abq "));
  }

  @Test
  void rejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("refs", "   "));
    assertEquals("refs must not be blank", blank.getMessage());
    IllegalArgumentException control =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank(null, "a\tb"));
    assertEquals("value must not contain control characters", control.getMessage());
  }

  @Test
  void nullValueNamesParameter() {
    NullPointerException ex = assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("in", null));
    assertEquals("in", ex.getMessage());
  }
}
