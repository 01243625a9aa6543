package ca.gc.cra.helios.domain.quality;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of quality bits the operator tolerates.
 *
 * <p>Built once from configuration. Bit {@value QualityBits#IMAGE_NOT_AVAILABLE} is absent from the
 * defaults and is only ignored when an operator lists it explicitly.</p>
 *
 * @param bits tolerated bit positions in {@code [0, 31]}
 * @since 0.1.0
 */
public record IgnoreSet(Set<Integer> bits) {
  /** Nothing tolerated. */
  public static final IgnoreSet NONE = new IgnoreSet(Set.of());

  /** Calibration-record bits that are routinely missing on fresh data, plus MISSVALS &gt; 0. */
  public static final IgnoreSet DEFAULT = new IgnoreSet(Set.of(0, 1, 2, 3, 4, 8));

  /**
   * Validates and freezes the bit set.
   *
   * @throws IllegalArgumentException if any bit is out of range
   */
  public IgnoreSet {
    TreeSet<Integer> sorted = new TreeSet<>();
    for (Integer bit : bits) {
      if (bit == null) {
        throw new IllegalArgumentException("ignore set must not contain null bits");
      }
      sorted.add(QualityBits.requireBit(bit));
    }
    bits = Set.copyOf(sorted);
  }

  /**
   * Builds an ignore set from bit positions.
   *
   * @param bits bit positions
   * @return ignore set
   */
  public static IgnoreSet of(Collection<Integer> bits) {
    return new IgnoreSet(Set.copyOf(bits));
  }

  /**
   * Returns the bits as a mask suitable for clearing.
   *
   * @return bitmask with every ignored position raised
   */
  public long bitmask() {
    long mask = 0L;
    for (int bit : bits) {
      mask |= 1L << bit;
    }
    return mask;
  }

  /**
   * Returns whether a bit is tolerated.
   *
   * @param bit bit position
   * @return {@code true} if ignored
   */
  public boolean contains(int bit) {
    return bits.contains(bit);
  }

  @Override
  public String toString() {
    return new TreeSet<>(bits).toString();
  }
}
