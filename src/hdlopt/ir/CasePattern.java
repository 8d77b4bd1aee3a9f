package hdlopt.ir;

import java.math.BigInteger;

/**
 * Case item pattern as a (value, care mask) pair.
 * Bits cleared in the care mask are don't-care positions.
 */
public record CasePattern(int width, BigInteger value, BigInteger careMask) {

  public CasePattern {
    if (width < 1)
      throw new IllegalArgumentException("case pattern width must be positive");
    careMask = careMask.and(BitVector.mask(width));
    value = value.and(careMask);
  }

  /** Exact pattern without don't-care bits. */
  public static CasePattern exact(BitVector value) { return new CasePattern(value.width(), value.value(), BitVector.mask(value.width())); }

  /**
   * Parses a binary digit string, most significant first.
   * '?', 'x', 'X', 'z' and 'Z' mark don't-care positions; '_' is ignored.
   */
  public static CasePattern parse(String bits) {
    String digits = bits.replace("_", "");
    if (digits.isEmpty())
      throw new IllegalArgumentException("empty case pattern");
    BigInteger value = BigInteger.ZERO;
    BigInteger care = BigInteger.ZERO;
    for (char c : digits.toCharArray()) {
      value = value.shiftLeft(1);
      care = care.shiftLeft(1);
      switch (c) {
      case '0':
        care = care.setBit(0);
        break;
      case '1':
        care = care.setBit(0);
        value = value.setBit(0);
        break;
      case '?':
      case 'x':
      case 'X':
      case 'z':
      case 'Z':
        break;
      default:
        throw new IllegalArgumentException("invalid case pattern digit '" + c + "' in " + bits);
      }
    }
    return new CasePattern(digits.length(), value, care);
  }

  public boolean hasDontCare() { return !careMask.equals(BitVector.mask(width)); }

  /** Matches a selector value; selector bits above the pattern width must be zero. */
  public boolean matches(BitVector selector) {
    return selector.value().and(careMask).equals(value) && selector.value().shiftRight(width).signum() == 0;
  }

  /**
   * True if some selector encoding matches both patterns.
   * Bits above the width of the narrower pattern must be zero for it to match, so they count as cared-for zeros.
   */
  public boolean overlaps(CasePattern other) {
    BigInteger full = BitVector.mask(Math.max(width, other.width));
    BigInteger care = careMask.or(full.andNot(BitVector.mask(width)));
    BigInteger otherCare = other.careMask.or(full.andNot(BitVector.mask(other.width)));
    BigInteger common = care.and(otherCare);
    return value.and(common).equals(other.value.and(common));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(width).append("'b");
    for (int bit = width - 1; bit >= 0; --bit) {
      if (!careMask.testBit(bit))
        sb.append('?');
      else
        sb.append(value.testBit(bit) ? '1' : '0');
    }
    return sb.toString();
  }
}
