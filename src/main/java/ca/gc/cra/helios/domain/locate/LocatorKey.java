package ca.gc.cra.helios.domain.locate;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Logical lookup key: the nominal capture time and, for multi-channel instruments, the channel
 * (wavelength) identifier.
 *
 * @param date nominal capture instant
 * @param channel optional channel identifier
 * @since 0.1.0
 */
public record LocatorKey(Instant date, OptionalInt channel) {
  /**
   * Validates components.
   *
   * @throws NullPointerException if a component is {@code null}
   */
  public LocatorKey {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(channel, "channel");
  }

  /**
   * Creates a key without a channel.
   *
   * @param date nominal capture instant
   * @return key
   */
  public static LocatorKey of(Instant date) {
    return new LocatorKey(date, OptionalInt.empty());
  }

  /**
   * Creates a key for one channel.
   *
   * @param date nominal capture instant
   * @param channel channel identifier
   * @return key
   */
  public static LocatorKey of(Instant date, int channel) {
    return new LocatorKey(date, OptionalInt.of(channel));
  }

  @Override
  public String toString() {
    return channel.isPresent() ? date + "/" + channel.getAsInt() : date.toString();
  }
}
