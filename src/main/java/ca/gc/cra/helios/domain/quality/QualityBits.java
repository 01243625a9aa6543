package ca.gc.cra.helios.domain.quality;

import java.util.List;

/**
 * <strong>What:</strong> Fixed lookup table describing each bit of the image {@code QUALITY} keyword.
 * <p><strong>Why:</strong> The gate, the quality report command, and log messages must all describe defects
 * with the same wording.</p>
 * <p><strong>Role:</strong> Domain constant table.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 * @see QualityGate
 */
public final class QualityBits {
  /** Number of bit positions carried by a quality mask. */
  public static final int WIDTH = 32;

  /** Bit raised on quicklook (non-definitive) products. */
  public static final int QUICKLOOK = 30;

  /** Bit raised when the image itself is missing. */
  public static final int IMAGE_NOT_AVAILABLE = 31;

  /** Description returned for reserved positions that carry no table entry. */
  public static final String UNKNOWN_ERROR = "Unknown error";

  private static final List<String> DESCRIPTIONS = List.of(
      "FLAT_REC == MISSING (Flatfield data not available)",
      "ORB_REC == MISSING (Orbit data not available)",
      "ASD_REC == MISSING (Ancillary Science Data not available)",
      "MPO_REC == MISSING (Master pointing data not available)",
      "RSUN_LF == MISSING or X0_LF == MISSING or Y0_LF == MISSING (HMI Limb fit not acceptable)",
      "",
      "",
      "",
      "MISSVALS > 0",
      "MISSVALS > 0.01*TOTVALS",
      "MISSVALS > 0.05*TOTVALS",
      "MISSVALS > 0.25*TOTVALS",
      "ACS_MODE != \"SCIENCE\" (Spacecraft not in science pointing mode)",
      "ACS_ECLP == \"YES\" (Spacecraft eclipse flag set)",
      "ACS_SUNP == \"NO\" (Spacecraft sun presence flag not set)",
      "ACS_SAFE == \"YES\" (Spacecraft safemode flag set)",
      "IMG_TYPE == \"DARK\" (Dark image)",
      "HWLTNSET == \"OPEN\" or AISTATE == \"OPEN\" (HMI ISS loop open or AIA ISS loop open)",
      "(FID >= 1 and FID <= 9999) or (AIFTSID >= 0xC000) (HMI Calibration Image or AIA Calibration Image)",
      "HCFTID == 17 (HMI CAL mode image)",
      "(AIFCPS <= -20 or AIFCPS >= 100) (AIA focus out of range)",
      "AIAGP6 != 0 (AIA register flag)",
      "",
      "",
      "",
      "",
      "",
      "",
      "",
      "",
      "Quicklook image",
      "Image not available");

  private QualityBits() {
    // Utility
  }

  /**
   * Returns the raw table entry for a bit position.
   *
   * @param bit bit position in {@code [0, 31]}
   * @return description, empty for reserved positions
   * @throws IllegalArgumentException if {@code bit} is out of range
   */
  public static String description(int bit) {
    requireBit(bit);
    return DESCRIPTIONS.get(bit);
  }

  /**
   * Returns the description used when reporting a raised bit; reserved positions map to
   * {@link #UNKNOWN_ERROR}.
   *
   * @param bit bit position in {@code [0, 31]}
   * @return non-empty description
   */
  public static String describe(int bit) {
    String description = description(bit);
    return description.isEmpty() ? UNKNOWN_ERROR : description;
  }

  /**
   * Returns whether the table leaves a bit position undocumented.
   *
   * @param bit bit position in {@code [0, 31]}
   * @return {@code true} for reserved positions
   */
  public static boolean isReserved(int bit) {
    return description(bit).isEmpty();
  }

  static int requireBit(int bit) {
    if (bit < 0 || bit >= WIDTH) {
      throw new IllegalArgumentException("quality bit must be between 0 and 31 (was " + bit + ")");
    }
    return bit;
  }
}
