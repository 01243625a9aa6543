package ca.gc.cra.helios.config;

import ca.gc.cra.helios.domain.locate.PathTemplate;
import ca.gc.cra.helios.domain.quality.IgnoreSet;
import ca.gc.cra.helios.validation.Numbers;
import ca.gc.cra.helios.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Where images live and how their quality is judged.
 *
 * @param filePattern path template for candidate images; empty when the command does not search by date
 * @param ignore tolerated quality bits
 * @param hdu header-data unit holding the quality keyword
 * @param qualityKeyword header keyword carrying the quality mask
 * @since 0.1.0
 */
public record DataConfig(Optional<PathTemplate> filePattern, IgnoreSet ignore, int hdu, String qualityKeyword) {

  public DataConfig {
    Objects.requireNonNull(filePattern, "filePattern");
    Objects.requireNonNull(ignore, "ignore");
    Numbers.requireRange("data.hdu", hdu, 0, 999);
    qualityKeyword = Strings.requireNonBlank("data.qualityKeyword", qualityKeyword);
  }

  /**
   * Builds the data settings from flattened configuration.
   *
   * @param map effective configuration
   * @return parsed settings
   * @throws IllegalArgumentException if a value is malformed
   */
  public static DataConfig fromMap(Map<String, String> map) {
    String pattern = Strings.trimToEmpty(map.get("data.filePattern"));
    Optional<PathTemplate> template = pattern.isEmpty() ? Optional.empty() : Optional.of(PathTemplate.parse(pattern));
    return new DataConfig(
        template,
        parseIgnoreSet(map.getOrDefault("data.ignoreQualityBits", "0,1,2,3,4,8")),
        Numbers.parseInt("data.hdu", map.getOrDefault("data.hdu", "1"), 0, 999),
        map.getOrDefault("data.qualityKeyword", "QUALITY"));
  }

  /**
   * Returns the file pattern, failing when none was configured.
   *
   * @return path template
   * @throws IllegalArgumentException if {@code data.filePattern} is missing
   */
  public PathTemplate requireFilePattern() {
    return filePattern.orElseThrow(() -> new IllegalArgumentException("data.filePattern is required"));
  }

  static IgnoreSet parseIgnoreSet(String raw) {
    List<Integer> bits = new ArrayList<>();
    for (String token : Strings.splitList(raw)) {
      bits.add(Numbers.parseInt("data.ignoreQualityBits", token, 0, 31));
    }
    return IgnoreSet.of(bits);
  }
}
