package io.intellixity.relata.persistence.jdbc.relation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/** Key comparison across drivers that box the same integer as Integer, Long or BigDecimal. */
public final class Keys {
  private Keys() {}

  /** Integral numbers become Long; everything else is returned as is. */
  public static Object normalize(Object key) {
    if (key instanceof Integer || key instanceof Long || key instanceof Short || key instanceof Byte) {
      return ((Number) key).longValue();
    }
    if (key instanceof BigInteger bi && bi.bitLength() < 64) return bi.longValue();
    if (key instanceof BigDecimal bd) {
      try {
        return bd.longValueExact();
      } catch (ArithmeticException e) {
        return bd.stripTrailingZeros();
      }
    }
    return key;
  }

  /** First column of a generated-key row, whatever label the driver gave it. */
  public static Object first(Map<String, Object> row) {
    if (row == null || row.isEmpty()) return null;
    return row.values().iterator().next();
  }
}
