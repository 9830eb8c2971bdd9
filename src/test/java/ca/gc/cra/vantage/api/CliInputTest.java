package ca.gc.cra.vantage.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"-H", "--DEBUG", "--dry-run", "topology=x", " "});

    assertTrue(input.help());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--Dry-Run"));
    assertFalse(input.hasFlag(null));
    assertArrayEquals(new String[] {"topology=x"}, input.keyValueArgs());
  }

  @Test
  void nullArgsProduceEmptyInput() {
    CliInput input = CliInput.parse(null);

    assertFalse(input.help());
    assertFalse(input.verbose());
    assertArrayEquals(new String[0], input.keyValueArgs());
  }
}
