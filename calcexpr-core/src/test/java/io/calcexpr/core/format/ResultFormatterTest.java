package io.calcexpr.core.format;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ResultFormatterTest {

  private final ResultFormatter formatter = new ResultFormatter();

  // ==================== Special values ====================

  @Test
  void nonFiniteValues() {
    assertEquals("Error", formatter.format(Double.NaN));
    assertEquals("Infinity", formatter.format(Double.POSITIVE_INFINITY));
    assertEquals("-Infinity", formatter.format(Double.NEGATIVE_INFINITY));
  }

  @Test
  void zeroAndNoise() {
    assertEquals("0", formatter.format(0.0));
    assertEquals("0", formatter.format(-0.0));
    assertEquals("0", formatter.format(1e-16));
    assertEquals("0", formatter.format(-1e-16));
    assertEquals("0", formatter.format(Double.MIN_VALUE));
  }

  // ==================== Plain notation ====================

  @Test
  void floatingPointNoiseIsRoundedAway() {
    assertEquals("0.3", formatter.format(0.1 + 0.2));
    assertEquals("1", formatter.format(0.1 * 3 / 0.3));
  }

  @ParameterizedTest
  @CsvSource({
    "11, 11",
    "1024, 1024",
    "-4, -4",
    "0.5, 0.5",
    "123456789, 123456789",
    "9999999999.5, 9999999999.5",
    "0.000001, 0.000001",
    "3.14159, 3.14159"
  })
  void plain(double value, String expected) {
    assertEquals(expected, formatter.format(value));
  }

  @Test
  void repeatingFractionsUseFifteenDigits() {
    assertEquals("0.333333333333333", formatter.format(1.0 / 3));
    assertEquals("0.666666666666667", formatter.format(2.0 / 3));
    assertEquals("3.14159265358979", formatter.format(Math.PI));
  }

  // ==================== Scientific notation ====================

  @ParameterizedTest
  @CsvSource({
    "1e10, 1.0000000000e+10",
    "12345678900, 1.2345678900e+10",
    "-1e10, -1.0000000000e+10",
    "1e-7, 1.0000000000e-7",
    "2.5e-9, 2.5000000000e-9",
    "1e300, 1.0000000000e+300"
  })
  void scientific(double value, String expected) {
    assertEquals(expected, formatter.format(value));
  }

  // ==================== Digit budget ====================

  @Test
  void smallerDigitBudget() {
    ResultFormatter narrow = new ResultFormatter(10);
    assertEquals(10, narrow.displayDigits());
    assertEquals("0.3333333333", narrow.format(1.0 / 3));
    assertEquals("1.00000e+10", narrow.format(1e10));
  }

  @Test
  void rejectsBudgetWithoutRoomForMantissa() {
    assertThrows(IllegalArgumentException.class, () -> new ResultFormatter(5));
  }
}
