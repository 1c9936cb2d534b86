package tracehook.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TraceEventTest {
  @ParameterizedTest
  @CsvSource({
    "enter, ENTER",
    "call, ENTER",
    "LINE, LINE",
    " return , RETURN",
    "Exception, EXCEPTION"
  })
  void parsesKnownNames(String name, TraceEvent expected) {
    assertEquals(expected, TraceEvent.parse(name));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "opcode", "c_call", "returns"})
  void rejectsUnknownNames(String name) {
    ConfigurationException e =
        assertThrows(ConfigurationException.class, () -> TraceEvent.parse(name));
    assertEquals("Unknown trace event: '" + name + "'", e.getMessage());
  }
}
