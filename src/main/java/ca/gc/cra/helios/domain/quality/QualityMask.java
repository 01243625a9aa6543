package ca.gc.cra.helios.domain.quality;

import java.util.ArrayList;
import java.util.List;

/**
 * Unsigned 32-bit quality bitfield read from an image header.
 *
 * @param value mask value in {@code [0, 0xFFFFFFFF]}
 * @since 0.1.0
 */
public record QualityMask(long value) {
  private static final long MAX = 0xFFFF_FFFFL;

  /** Mask with no defect raised. */
  public static final QualityMask CLEAN = new QualityMask(0L);

  /**
   * Validates the mask range.
   *
   * @throws IllegalArgumentException if the value does not fit in 32 unsigned bits
   */
  public QualityMask {
    if (value < 0 || value > MAX) {
      throw new IllegalArgumentException("quality mask must fit in 32 unsigned bits (was " + value + ")");
    }
  }

  /**
   * Builds a mask from a header value, reinterpreting negative 32-bit integers as unsigned.
   *
   * @param raw header value; headers store the mask as a signed 32-bit integer
   * @return quality mask
   */
  public static QualityMask fromHeader(long raw) {
    if (raw < 0 && raw >= Integer.MIN_VALUE) {
      return new QualityMask(raw & MAX);
    }
    return new QualityMask(raw);
  }

  /**
   * Builds a mask with the given bits raised.
   *
   * @param bits bit positions in {@code [0, 31]}
   * @return quality mask
   */
  public static QualityMask ofBits(int... bits) {
    long value = 0L;
    for (int bit : bits) {
      value |= 1L << QualityBits.requireBit(bit);
    }
    return new QualityMask(value);
  }

  /**
   * Returns whether a bit is raised.
   *
   * @param bit bit position in {@code [0, 31]}
   * @return {@code true} when set
   */
  public boolean isSet(int bit) {
    return (value & (1L << QualityBits.requireBit(bit))) != 0;
  }

  /**
   * Returns a copy of this mask with the ignored bits cleared.
   *
   * @param ignore bits to clear; must not be {@code null}
   * @return new mask; this instance is unchanged
   */
  public QualityMask clear(IgnoreSet ignore) {
    return new QualityMask(value & ~ignore.bitmask());
  }

  /**
   * Lists raised bit positions in ascending order.
   *
   * @return raised bits
   */
  public List<Integer> setBits() {
    List<Integer> bits = new ArrayList<>();
    for (int bit = 0; bit < QualityBits.WIDTH; bit++) {
      if ((value & (1L << bit)) != 0) {
        bits.add(bit);
      }
    }
    return List.copyOf(bits);
  }

  @Override
  public String toString() {
    return String.format("0x%08X", value);
  }
}
