package tracehook.rhino;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracehook.api.CodeUnit;
import tracehook.api.SourceProvider;

/**
 * Source lines by source name. Filled with the source of every script compiled while the runtime
 * is attached, falling back to reading the file the source name points to.
 *
 * <p>Holds the most recently used {@link #MAX_SOURCES} sources. Names without a readable file are
 * not remembered, so a file created later is still found.
 */
final class RhinoSourceCache implements SourceProvider {
  private static final Logger log = LoggerFactory.getLogger(RhinoSourceCache.class);

  static final int MAX_SOURCES = 256;

  private final Map<String, List<String>> sources =
      new LinkedHashMap<String, List<String>>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, List<String>> eldest) {
          return size() > MAX_SOURCES;
        }
      };

  void put(String sourceName, String source) {
    sources.put(sourceName, splitLines(source));
  }

  @Nullable
  @Override
  public String sourceLine(CodeUnit code, int line) {
    List<String> lines = linesOf(code.file());
    if (line < 1 || line > lines.size()) {
      return null;
    }
    return lines.get(line - 1);
  }

  int size() {
    return sources.size();
  }

  private List<String> linesOf(String sourceName) {
    List<String> lines = sources.get(sourceName);
    if (lines == null) {
      lines = read(sourceName);
      if (lines == null) {
        return Collections.emptyList();
      }
      sources.put(sourceName, lines);
    }
    return lines;
  }

  @Nullable
  private static List<String> read(String sourceName) {
    if (sourceName.startsWith("<") && sourceName.endsWith(">")) {
      return null;
    }
    try {
      Path path = Paths.get(sourceName);
      if (Files.isRegularFile(path)) {
        return Files.readAllLines(path, StandardCharsets.UTF_8);
      }
    } catch (InvalidPathException | IOException e) {
      log.debug("No source available for {}", sourceName, e);
    }
    return null;
  }

  private static List<String> splitLines(String source) {
    return Arrays.asList(source.split("\r\n|\r|\n", -1));
  }
}
