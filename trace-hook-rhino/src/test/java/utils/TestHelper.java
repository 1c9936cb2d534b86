package utils;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

public class TestHelper {
  public static String getFixtureContent(String fixture) throws IOException, URISyntaxException {
    return new String(
        Files.readAllBytes(Paths.get(TestHelper.class.getResource(fixture).toURI())),
        StandardCharsets.UTF_8);
  }

  public static List<String> getFixtureLines(String fixture) {
    try {
      return Files.readAllLines(
          Paths.get(TestHelper.class.getResource(fixture).toURI()), StandardCharsets.UTF_8);
    } catch (Exception e) {
      throw new RuntimeException(e.getMessage(), e);
    }
  }

  /** Whether the throwable or one of its causes is of the given type. */
  public static boolean hasCause(Throwable throwable, Class<? extends Throwable> type) {
    for (Throwable t = throwable; t != null; t = t.getCause()) {
      if (type.isInstance(t)) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }
}
