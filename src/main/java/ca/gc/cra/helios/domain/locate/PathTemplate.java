package ca.gc.cra.helios.domain.locate;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Date/channel templated path, expanded per {@link LocatorKey}.
 * <p><strong>Syntax:</strong></p>
 * <ul>
 *   <li>{@code {date:PATTERN}} formats the key date in UTC with a {@link DateTimeFormatter} pattern
 *       (for example {@code {date:yyyy/MM/dd}}).</li>
 *   <li>{@code {channel}} inserts the channel; {@code {channel:N}} zero-pads it to {@code N} digits.</li>
 *   <li>Everything else is copied verbatim, so glob characters ({@code *}, {@code ?}, {@code [..]}) survive.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once parsed.</p>
 *
 * @since 0.1.0
 */
public final class PathTemplate {
  private final String source;
  private final List<Part> parts;

  private PathTemplate(String source, List<Part> parts) {
    this.source = source;
    this.parts = List.copyOf(parts);
  }

  /**
   * Parses a template string.
   *
   * @param template template text; must not be blank
   * @return parsed template
   * @throws IllegalArgumentException if a placeholder is malformed
   */
  public static PathTemplate parse(String template) {
    Objects.requireNonNull(template, "template");
    if (template.isBlank()) {
      throw new IllegalArgumentException("path template must not be blank");
    }
    List<Part> parts = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < template.length()) {
      char c = template.charAt(i);
      if (c == '{') {
        int end = template.indexOf('}', i);
        String body = end < 0 ? "" : template.substring(i + 1, end);
        Part placeholder = end < 0 ? null : placeholder(body, template);
        if (placeholder != null) {
          if (literal.length() > 0) {
            parts.add(new Literal(literal.toString()));
            literal.setLength(0);
          }
          parts.add(placeholder);
          i = end + 1;
          continue;
        }
      }
      literal.append(c);
      i++;
    }
    if (literal.length() > 0) {
      parts.add(new Literal(literal.toString()));
    }
    return new PathTemplate(template, parts);
  }

  /**
   * Expands the template for a key.
   *
   * @param key lookup key
   * @return expanded glob pattern
   * @throws IllegalArgumentException if the template needs a channel and the key has none
   */
  public String expand(LocatorKey key) {
    Objects.requireNonNull(key, "key");
    TemporalAccessor date = key.date().atOffset(ZoneOffset.UTC);
    StringBuilder out = new StringBuilder(source.length() + 16);
    for (Part part : parts) {
      if (part instanceof Literal literal) {
        out.append(literal.text());
      } else if (part instanceof DatePart datePart) {
        out.append(datePart.formatter().format(date));
      } else if (part instanceof ChannelPart channelPart) {
        if (key.channel().isEmpty()) {
          throw new IllegalArgumentException("template " + source + " requires a channel");
        }
        out.append(pad(key.channel().getAsInt(), channelPart.width()));
      }
    }
    return out.toString();
  }

  /**
   * Returns whether the template references {@code {channel}}.
   *
   * @return {@code true} if a channel placeholder is present
   */
  public boolean usesChannel() {
    return parts.stream().anyMatch(ChannelPart.class::isInstance);
  }

  /**
   * Returns the original template text.
   *
   * @return template text
   */
  public String source() {
    return source;
  }

  @Override
  public String toString() {
    return source;
  }

  private static Part placeholder(String body, String template) {
    if (body.equals("channel")) {
      return new ChannelPart(0);
    }
    if (body.startsWith("channel:")) {
      String width = body.substring("channel:".length());
      try {
        int parsed = Integer.parseInt(width);
        if (parsed < 0 || parsed > 12) {
          throw new IllegalArgumentException("channel width out of range in template " + template);
        }
        return new ChannelPart(parsed);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("invalid channel width '" + width + "' in template " + template, ex);
      }
    }
    if (body.startsWith("date:")) {
      String pattern = body.substring("date:".length());
      if (pattern.isEmpty()) {
        throw new IllegalArgumentException("empty date pattern in template " + template);
      }
      try {
        return new DatePart(DateTimeFormatter.ofPattern(pattern, Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("invalid date pattern '" + pattern + "' in template " + template, ex);
      }
    }
    // Not ours: leave glob alternation such as {a,b} untouched.
    return null;
  }

  private static String pad(int value, int width) {
    String digits = Integer.toString(Math.abs(value));
    StringBuilder padded = new StringBuilder();
    if (value < 0) {
      padded.append('-');
    }
    for (int i = digits.length(); i < width; i++) {
      padded.append('0');
    }
    return padded.append(digits).toString();
  }

  private sealed interface Part permits Literal, DatePart, ChannelPart {}

  private record Literal(String text) implements Part {}

  private record DatePart(DateTimeFormatter formatter) implements Part {}

  private record ChannelPart(int width) implements Part {}
}
