package ca.gc.cra.helios.infrastructure.fits;

import ca.gc.cra.helios.application.port.QualityReaderPort;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalLong;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;

/**
 * Reads the quality keyword from one header-data unit of a FITS image using nom-tam-fits.
 *
 * <p>Only the requested header is parsed; pixel data is never read.</p>
 *
 * @since 0.1.0
 */
public final class FitsQualityReader implements QualityReaderPort {
  private final int hdu;
  private final String keyword;

  /**
   * Creates a reader.
   *
   * @param hdu zero-based HDU index holding the keyword (compressed images usually keep it in HDU 1)
   * @param keyword header keyword, typically {@code QUALITY}
   */
  public FitsQualityReader(int hdu, String keyword) {
    if (hdu < 0) {
      throw new IllegalArgumentException("data.hdu must not be negative");
    }
    this.hdu = hdu;
    this.keyword = Objects.requireNonNull(keyword, "keyword").trim();
    if (this.keyword.isEmpty()) {
      throw new IllegalArgumentException("data.qualityKeyword must not be blank");
    }
  }

  @Override
  public OptionalLong readQuality(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    try (Fits fits = new Fits(file.toFile())) {
      BasicHDU<?> unit = fits.getHDU(hdu);
      if (unit == null) {
        throw new IOException(file + " has no HDU " + hdu);
      }
      Header header = unit.getHeader();
      if (!header.containsKey(keyword)) {
        return OptionalLong.empty();
      }
      return OptionalLong.of(header.getLongValue(keyword));
    } catch (FitsException ex) {
      throw new IOException("Unable to read FITS header of " + file, ex);
    }
  }
}
