package ca.gc.cra.helios.domain.quality;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Decides whether a candidate image is usable from its quality mask.
 * <p><strong>Why:</strong> Several captures share a nominal timestamp; only defect-free ones (after tolerated bits
 * are cleared) may enter the segmentation pipeline.</p>
 * <p><strong>Role:</strong> Pure domain service consulted by the file locator and the quality report command.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use by lookup workers.</p>
 *
 * @since 0.1.0
 * @see QualityBits
 */
public final class QualityGate {
  private final IgnoreSet ignore;

  /**
   * Creates a gate bound to an operator ignore set.
   *
   * @param ignore tolerated bits; must not be {@code null}
   */
  public QualityGate(IgnoreSet ignore) {
    this.ignore = Objects.requireNonNull(ignore, "ignore");
  }

  /**
   * Returns the ignore set applied by this gate.
   *
   * @return ignore set
   */
  public IgnoreSet ignoreSet() {
    return ignore;
  }

  /**
   * Applies this gate's ignore set.
   *
   * @param mask mask read from the candidate header
   * @return {@code true} if no untolerated bit remains
   */
  public boolean isGood(QualityMask mask) {
    return isGood(mask, ignore);
  }

  /**
   * Clears the ignored bits and reports whether anything remains.
   *
   * @param mask mask read from the candidate header; must not be {@code null}
   * @param ignore tolerated bits; must not be {@code null}
   * @return {@code true} iff the cleared mask equals zero
   */
  public static boolean isGood(QualityMask mask, IgnoreSet ignore) {
    Objects.requireNonNull(mask, "mask");
    Objects.requireNonNull(ignore, "ignore");
    return mask.clear(ignore).value() == 0L;
  }

  /**
   * Describes the defects still raised after this gate's ignore set is applied.
   *
   * @param mask candidate mask
   * @return descriptions of untolerated defects
   */
  public List<String> explainRejection(QualityMask mask) {
    return explain(mask.clear(ignore));
  }

  /**
   * Describes every raised bit of {@code mask}, one entry per bit. Reserved positions yield
   * {@link QualityBits#UNKNOWN_ERROR}.
   *
   * @param mask mask to describe (callers clear ignored bits first if needed)
   * @return unmodifiable descriptions, ascending by bit
   */
  public static List<String> explain(QualityMask mask) {
    Objects.requireNonNull(mask, "mask");
    List<String> errors = new ArrayList<>();
    for (int bit : mask.setBits()) {
      errors.add(QualityBits.describe(bit));
    }
    return List.copyOf(errors);
  }
}
