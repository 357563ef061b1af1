package io.waveswap.bridgebackend.util;

import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/** Conversions between human-readable decimal amounts and integer base units. No floating point. */
public final class TokenAmounts {
  private TokenAmounts() {}

  private static final MathContext RATE_PRECISION = new MathContext(18, RoundingMode.HALF_EVEN);
  // digits with an optional fraction; no sign, no exponent
  private static final Pattern PLAIN_DECIMAL = Pattern.compile("^\\d+(\\.\\d+)?$");
  static final int MAX_INTEGER_DIGITS = 40;

  public static BigDecimal parsePositive(String amount) {
    if (amount == null || amount.isBlank()) {
      throw new BridgeException(BridgeErrorCode.INVALID_AMOUNT, "amount is required");
    }
    String trimmed = amount.trim();
    if (!PLAIN_DECIMAL.matcher(trimmed).matches()) {
      throw new BridgeException(BridgeErrorCode.INVALID_AMOUNT, "amount is not a plain decimal number: " + amount);
    }
    BigDecimal value = new BigDecimal(trimmed);
    if (value.signum() <= 0) {
      throw new BridgeException(BridgeErrorCode.INVALID_AMOUNT, "amount must be greater than zero: " + amount);
    }
    if (value.precision() - value.scale() > MAX_INTEGER_DIGITS) {
      throw new BridgeException(
          BridgeErrorCode.INVALID_AMOUNT, "amount has more than " + MAX_INTEGER_DIGITS + " integer digits");
    }
    return value;
  }

  public static boolean isPositive(String amount) {
    try {
      parsePositive(amount);
      return true;
    } catch (BridgeException e) {
      return false;
    }
  }

  /** "1.5" with 9 decimals becomes 1500000000. Rejects more fractional digits than the token has. */
  public static BigInteger toBaseUnits(String amount, int decimals) {
    BigDecimal value = parsePositive(amount).stripTrailingZeros();
    if (value.scale() > decimals) {
      throw new BridgeException(
          BridgeErrorCode.INVALID_AMOUNT,
          "amount " + amount + " has more than " + decimals + " fractional digits");
    }
    try {
      return value.movePointRight(decimals).toBigIntegerExact();
    } catch (ArithmeticException e) {
      throw new BridgeException(BridgeErrorCode.INVALID_AMOUNT, "amount " + amount + " is out of range", e);
    }
  }

  public static String fromBaseUnits(BigInteger baseUnits, int decimals) {
    if (baseUnits == null) return "0";
    BigDecimal v = new BigDecimal(baseUnits, decimals).stripTrailingZeros();
    return v.signum() == 0 ? "0" : v.toPlainString();
  }

  public static BigInteger parseBaseUnits(String raw) {
    if (raw == null || raw.isBlank()) return BigInteger.ZERO;
    try {
      return new BigInteger(raw.trim());
    } catch (NumberFormatException e) {
      return BigInteger.ZERO;
    }
  }

  /** toAmount / fromAmount, both in human units. */
  public static String rate(String fromAmount, String toAmount) {
    BigDecimal from = new BigDecimal(fromAmount);
    if (from.signum() == 0) return "0";
    return new BigDecimal(toAmount).divide(from, RATE_PRECISION).stripTrailingZeros().toPlainString();
  }

  /** {@code amount * bps / 10000}, truncated to the token's precision. */
  public static BigInteger basisPointsOf(BigInteger baseUnits, int bps) {
    return baseUnits.multiply(BigInteger.valueOf(bps)).divide(BigInteger.valueOf(10_000));
  }

  public static BigDecimal bpsToPercent(int bps) {
    return BigDecimal.valueOf(bps).movePointLeft(2).stripTrailingZeros();
  }
}
