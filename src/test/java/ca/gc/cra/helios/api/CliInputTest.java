package ca.gc.cra.helios.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"config=helios.yaml", "--ONCE", "-v", "--help", " ", null});

    assertArrayEquals(new String[] {"config=helios.yaml"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--once"));
    assertTrue(input.verbose());
    assertTrue(input.help());
    assertFalse(input.hasFlag("--dry-run"));
    assertFalse(input.hasFlag(null));
  }

  @Test
  void dashedKeyValueIsNotAFlag() {
    CliInput input = CliInput.parse(new String[] {"--config=helios.yaml"});

    assertArrayEquals(new String[] {"--config=helios.yaml"}, input.keyValueArgs());
    assertFalse(input.help());
  }
}
