package tracehook.core.scope;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import javax.annotation.Nullable;

/**
 * Matches the file name reported for a context.
 *
 * <p>Names the runtime makes up for code without a file, such as {@code <eval>}, are only matched
 * by exact string comparison.
 */
abstract class FileMatcher {
  abstract boolean matches(@Nullable String file);

  static FileMatcher exact(Path path) {
    return new Exact(path);
  }

  static FileMatcher glob(String pattern) {
    return new Glob(pattern);
  }

  static boolean isSpecialName(String file) {
    return file.startsWith("<") && file.endsWith(">");
  }

  @Nullable
  static Path resolve(String file) {
    try {
      return Paths.get(file).toAbsolutePath().normalize();
    } catch (InvalidPathException e) {
      return null;
    }
  }

  private static final class Exact extends FileMatcher {
    private final String original;
    private final Path resolved;

    Exact(Path path) {
      this.original = path.toString();
      this.resolved = path.toAbsolutePath().normalize();
    }

    @Override
    boolean matches(@Nullable String file) {
      if (file == null) {
        return false;
      }
      if (isSpecialName(file)) {
        return file.equals(original);
      }
      return resolved.equals(resolve(file));
    }

    @Override
    public String toString() {
      return resolved.toString();
    }
  }

  /**
   * Relative patterns match from the right, against as many trailing path elements as the pattern
   * has, so {@code lib/*.js} matches {@code /srv/app/lib/main.js}. Absolute patterns and patterns
   * using {@code **} match against the whole resolved path.
   */
  private static final class Glob extends FileMatcher {
    private final String pattern;
    private final PathMatcher matcher;
    private final boolean anchored;
    private final int segments;

    Glob(String pattern) {
      this.pattern = pattern;
      this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
      this.anchored = pattern.startsWith("/") || pattern.contains("**");
      int count = 0;
      for (String segment : pattern.split("/")) {
        if (!segment.isEmpty()) {
          count++;
        }
      }
      this.segments = count;
    }

    @Override
    boolean matches(@Nullable String file) {
      if (file == null) {
        return false;
      }
      if (isSpecialName(file)) {
        return file.equals(pattern);
      }
      Path candidate = resolve(file);
      if (candidate == null) {
        return false;
      }
      if (!anchored) {
        int names = candidate.getNameCount();
        if (names < segments || segments == 0) {
          return false;
        }
        candidate = candidate.subpath(names - segments, names);
      }
      return matcher.matches(candidate);
    }

    @Override
    public String toString() {
      return pattern;
    }
  }
}
