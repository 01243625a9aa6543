package ca.gc.cra.helios.domain.locate;

import ca.gc.cra.helios.domain.quality.QualityMask;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A file matched for a {@link LocatorKey} together with the quality mask read from its header.
 *
 * @param path matched file
 * @param mask resolved quality mask
 * @since 0.1.0
 */
public record Candidate(Path path, QualityMask mask) {
  /**
   * Validates components.
   *
   * @throws NullPointerException if a component is {@code null}
   */
  public Candidate {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mask, "mask");
  }
}
