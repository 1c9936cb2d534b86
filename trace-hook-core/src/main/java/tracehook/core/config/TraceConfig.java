package tracehook.core.config;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Engine settings.
 *
 * <p>Each setting {@code key} is read from the {@code tracehook.key} system property, then from
 * the {@code TRACEHOOK_KEY} environment variable, and falls back to its default.
 */
public final class TraceConfig {
  public static final String EXCLUDED_FILES = "excluded.files";
  public static final String CAPTURE_GLOBALS = "capture.globals";
  public static final String STACK_DEPTH = "stack.depth";
  public static final String DEBUGGER_PROMPT = "debugger.prompt";

  static final boolean DEFAULT_CAPTURE_GLOBALS = true;
  static final int DEFAULT_STACK_DEPTH = 64;
  static final String DEFAULT_DEBUGGER_PROMPT = "(thd) ";

  private static volatile TraceConfig instance;

  private final Set<String> excludedFiles;
  private final boolean captureGlobals;
  private final int stackDepth;
  private final String debuggerPrompt;

  private TraceConfig(Builder builder) {
    this.excludedFiles = Collections.unmodifiableSet(new LinkedHashSet<>(builder.excludedFiles));
    this.captureGlobals = builder.captureGlobals;
    this.stackDepth = builder.stackDepth;
    this.debuggerPrompt = builder.debuggerPrompt;
  }

  /** Returns the configuration read from the environment, loading it on first use. */
  public static TraceConfig get() {
    TraceConfig config = instance;
    if (config == null) {
      synchronized (TraceConfig.class) {
        config = instance;
        if (config == null) {
          config = instance = load();
        }
      }
    }
    return config;
  }

  static TraceConfig load() {
    ConfigReader reader = new ConfigReader();
    // values are trimmed when read, the prompt gets its separator back
    String prompt = reader.getString(DEBUGGER_PROMPT);
    return builder()
        .excludedFiles(reader.getList(EXCLUDED_FILES))
        .captureGlobals(reader.getBoolean(CAPTURE_GLOBALS, DEFAULT_CAPTURE_GLOBALS))
        .stackDepth(reader.getInteger(STACK_DEPTH, DEFAULT_STACK_DEPTH))
        .debuggerPrompt(prompt == null ? DEFAULT_DEBUGGER_PROMPT : prompt + " ")
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Files whose code is never dispatched to callbacks. */
  public Set<String> getExcludedFiles() {
    return excludedFiles;
  }

  /** Whether completed call records carry a copy of the global bindings. */
  public boolean isCaptureGlobals() {
    return captureGlobals;
  }

  /** Maximum number of entries of a captured stack summary. */
  public int getStackDepth() {
    return stackDepth;
  }

  public String getDebuggerPrompt() {
    return debuggerPrompt;
  }

  @Override
  public String toString() {
    return "TraceConfig{"
        + "excludedFiles="
        + excludedFiles
        + ", captureGlobals="
        + captureGlobals
        + ", stackDepth="
        + stackDepth
        + ", debuggerPrompt='"
        + debuggerPrompt
        + '\''
        + '}';
  }

  public static final class Builder {
    private final Set<String> excludedFiles = new LinkedHashSet<>();
    private boolean captureGlobals = DEFAULT_CAPTURE_GLOBALS;
    private int stackDepth = DEFAULT_STACK_DEPTH;
    private String debuggerPrompt = DEFAULT_DEBUGGER_PROMPT;

    private Builder() {}

    public Builder excludedFiles(Iterable<String> files) {
      for (String file : files) {
        excludedFiles.add(file);
      }
      return this;
    }

    public Builder captureGlobals(boolean captureGlobals) {
      this.captureGlobals = captureGlobals;
      return this;
    }

    public Builder stackDepth(int stackDepth) {
      this.stackDepth = stackDepth > 0 ? stackDepth : DEFAULT_STACK_DEPTH;
      return this;
    }

    public Builder debuggerPrompt(String debuggerPrompt) {
      this.debuggerPrompt = debuggerPrompt;
      return this;
    }

    public TraceConfig build() {
      return new TraceConfig(this);
    }
  }
}
