package io.calcexpr.core.eval;

import io.calcexpr.core.ExpressionException;
import io.calcexpr.core.ExpressionException.ErrorType;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factorials of the integers 0 to {@value #MAX_ARGUMENT}, the largest whose factorial is a finite
 * double.
 *
 * <p>When memoizing, results are inserted once per key and never change, so the table can be shared
 * between threads.
 */
public final class FactorialTable {

  public static final int MAX_ARGUMENT = 170;

  private final Map<Integer, Double> cache;

  /**
   * Creates a table.
   *
   * @param memoize whether computed values are kept for later calls
   */
  public FactorialTable(boolean memoize) {
    this.cache = memoize ? new ConcurrentHashMap<>() : null;
  }

  /**
   * Computes {@code n!}.
   *
   * @param n the argument; must be a non-negative integer no larger than {@value #MAX_ARGUMENT}
   * @return the factorial
   * @throws ExpressionException of type {@link ErrorType#DOMAIN} when {@code n} is out of range
   */
  public double factorial(double n) {
    if (n < 0) {
      throw new ExpressionException(ErrorType.DOMAIN, "Factorial of negative number");
    }
    if (Double.isNaN(n) || Double.isInfinite(n) || Math.rint(n) != n) {
      throw new ExpressionException(ErrorType.DOMAIN, "Factorial requires integer");
    }
    if (n > MAX_ARGUMENT) {
      throw new ExpressionException(ErrorType.DOMAIN, "Factorial overflow");
    }
    int k = (int) n;
    if (k <= 1) {
      return 1;
    }
    if (cache == null) {
      return compute(k);
    }
    Double cached = cache.get(k);
    if (cached != null) {
      return cached;
    }
    double result = compute(k);
    cache.putIfAbsent(k, result);
    return result;
  }

  /** Number of memoized entries; always 0 when memoization is off. */
  public int cachedCount() {
    return cache == null ? 0 : cache.size();
  }

  private static double compute(int k) {
    double result = 1;
    for (int i = 2; i <= k; i++) {
      result *= i;
    }
    return result;
  }
}
