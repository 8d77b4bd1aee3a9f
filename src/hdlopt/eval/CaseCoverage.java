package hdlopt.eval;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import hdlopt.ir.BitVector;
import hdlopt.ir.CasePattern;

/**
 * Decides whether a list of case patterns covers every selector encoding.
 */
public final class CaseCoverage {
  /** Selectors up to this width are checked by enumerating every encoding. */
  static final int ENUMERATION_LIMIT = 16;

  private CaseCoverage() {}

  public static boolean isComplete(List<CasePattern> patterns, int selectorWidth) {
    return firstUncovered(patterns, selectorWidth).isEmpty();
  }

  /**
   * Returns some selector encoding that no pattern matches, if there is one.
   * Wide selectors are only considered covered by a pattern that cares about none of their bits.
   */
  public static Optional<BitVector> firstUncovered(List<CasePattern> patterns, int selectorWidth) {
    if (selectorWidth > ENUMERATION_LIMIT) {
      BigInteger selectorMask = BitVector.mask(selectorWidth);
      boolean catchAll = patterns.stream().anyMatch(pattern -> pattern.careMask().and(selectorMask).signum() == 0);
      return catchAll ? Optional.empty() : Optional.of(BitVector.zero(selectorWidth));
    }
    long count = 1L << selectorWidth;
    for (long encoding = 0; encoding < count; ++encoding) {
      BitVector selector = BitVector.of(selectorWidth, encoding);
      if (patterns.stream().noneMatch(pattern -> pattern.matches(selector)))
        return Optional.of(selector);
    }
    return Optional.empty();
  }
}
