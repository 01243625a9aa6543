package ca.gc.cra.helios.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEqualsAndKeepsOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "run.start=2024-01-01T00:00:00Z", " step.stack.options.expr=a=b ", "run.reportDir=", ""});

    assertEquals(List.of("run.start", "step.stack.options.expr", "run.reportDir"), List.copyOf(map.keySet()));
    assertEquals("a=b", map.get("step.stack.options.expr"));
    assertEquals("", map.get("run.reportDir"));
  }

  @Test
  void nullArgumentsGiveEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"once"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"a=x\u0007y"}));
    IllegalArgumentException duplicate = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"channel=171", "channel=193"}));
    assertTrue(duplicate.getMessage().contains("more than once"));
  }
}
