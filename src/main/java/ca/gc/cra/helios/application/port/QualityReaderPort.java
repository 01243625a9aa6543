package ca.gc.cra.helios.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * Reads the raw quality keyword from an image header.
 *
 * @since 0.1.0
 * @see ca.gc.cra.helios.infrastructure.fits.FitsQualityReader
 */
public interface QualityReaderPort {
  /**
   * Reads the quality value of one image.
   *
   * @param file candidate image
   * @return raw header value, or empty when the header carries no quality keyword
   * @throws IOException if the file cannot be opened or its header cannot be parsed
   */
  OptionalLong readQuality(Path file) throws IOException;
}
