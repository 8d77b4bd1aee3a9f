package hdlopt.ir;

import java.math.BigInteger;

/**
 * Unsigned two-state bit vector of fixed width.
 * The value is always kept within [0, 2^width).
 */
public record BitVector(int width, BigInteger value) {

  public BitVector {
    if (width < 1)
      throw new IllegalArgumentException("bit vector width must be positive, got " + width);
    if (value.signum() < 0 || value.bitLength() > width)
      value = value.and(mask(width));
  }

  public static BitVector of(int width, long value) { return new BitVector(width, BigInteger.valueOf(value)); }
  public static BitVector zero(int width) { return new BitVector(width, BigInteger.ZERO); }
  public static BitVector ones(int width) { return new BitVector(width, mask(width)); }
  public static BitVector fromBoolean(boolean value) { return new BitVector(1, value ? BigInteger.ONE : BigInteger.ZERO); }

  /** All-ones mask of the given width. */
  public static BigInteger mask(int width) { return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE); }

  public boolean isZero() { return value.signum() == 0; }
  public boolean isAllOnes() { return value.equals(mask(width)); }
  public boolean isTrue() { return !isZero(); }
  public boolean testBit(int bit) { return value.testBit(bit); }

  /** Zero-extends or truncates to the given width. */
  public BitVector resize(int newWidth) {
    if (newWidth == width)
      return this;
    return new BitVector(newWidth, value);
  }

  /** Extracts bits msb..lsb (inclusive). */
  public BitVector slice(int msb, int lsb) {
    if (lsb < 0 || msb < lsb)
      throw new IllegalArgumentException("invalid slice [" + msb + ":" + lsb + "]");
    return new BitVector(msb - lsb + 1, value.shiftRight(lsb));
  }

  /** Binary digits, most significant first, padded to the full width. */
  public String toBinaryString() {
    String bits = value.toString(2);
    if (bits.length() < width)
      bits = "0".repeat(width - bits.length()) + bits;
    return bits;
  }

  @Override
  public String toString() {
    return width + "'b" + toBinaryString();
  }
}
