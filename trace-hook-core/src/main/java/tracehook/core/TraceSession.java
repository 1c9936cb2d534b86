package tracehook.core;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracehook.api.ConfigurationException;
import tracehook.api.DebuggerFactory;
import tracehook.api.HookRuntime;
import tracehook.api.SessionStateException;
import tracehook.api.TraceEvent;
import tracehook.api.TraceHook;
import tracehook.core.breakpoint.Breakpoint;
import tracehook.core.breakpoint.LineSelector;
import tracehook.core.capture.CallCapture;
import tracehook.core.config.TraceConfig;
import tracehook.core.debugger.ConsoleDebugger;
import tracehook.core.scope.Scope;

/**
 * One attach/detach lifecycle of the engine on a {@link HookRuntime}.
 *
 * <p>A started session owns the runtime's global hook slot: {@link #start()} remembers the hook
 * that was installed and {@link #stop()} puts it back, unless a third party replaced the session's
 * hook in the meantime, in which case that third party's hook is left in place.
 *
 * <p>Sessions are confined to the thread executing the observed code. Registration helpers such
 * as {@link #captureCall(Scope)} start the session when needed and stop it again when the returned
 * object is closed.
 */
public final class TraceSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TraceSession.class);

  private static final ThreadLocal<TraceSession> DEFAULT_SESSION = new ThreadLocal<>();

  private final HookRuntime runtime;
  private final TraceConfig config;
  private final Dispatcher dispatcher;
  @Nullable private DebuggerFactory debuggerFactory;
  private boolean started;
  @Nullable private TraceHook previousHook;
  private int suspendedDepth;

  public TraceSession(HookRuntime runtime) {
    this(runtime, TraceConfig.get());
  }

  public TraceSession(HookRuntime runtime, TraceConfig config) {
    this.runtime = runtime;
    this.config = config;
    this.dispatcher = new Dispatcher(this, runtime, config.getExcludedFiles());
  }

  /**
   * Returns the session of the current thread for the given runtime: the session owning the
   * installed hook if there is one, otherwise a default session created on first use.
   */
  public static TraceSession current(HookRuntime runtime) {
    TraceHook installed = runtime.getHook();
    if (installed instanceof Dispatcher) {
      return ((Dispatcher) installed).session();
    }
    TraceSession session = DEFAULT_SESSION.get();
    if (session == null || session.runtime != runtime) {
      session = new TraceSession(runtime);
      DEFAULT_SESSION.set(session);
    }
    return session;
  }

  public HookRuntime runtime() {
    return runtime;
  }

  public TraceConfig config() {
    return config;
  }

  public boolean isStarted() {
    return started;
  }

  /** Whether this session is started and its hook is the one installed in the runtime. */
  public boolean isHookOwner() {
    return started && runtime.getHook() == dispatcher;
  }

  /**
   * Installs the session's hook, remembering the one it replaces.
   *
   * @throws SessionStateException if the session is already started or suspended, or another
   *     started session owns the hook.
   */
  public void start() {
    if (started) {
      throw new SessionStateException("The trace session has already been started");
    }
    if (suspendedDepth > 0) {
      throw new SessionStateException("The trace session cannot be started while suspended");
    }
    TraceHook current = runtime.getHook();
    if (current instanceof Dispatcher && ((Dispatcher) current).session().isStarted()) {
      throw new SessionStateException("Another trace session owns the active hook");
    }
    previousHook = current;
    runtime.setHook(dispatcher);
    started = true;
    log.debug("Trace session started, replaced hook: {}", current);
  }

  /**
   * Removes the session's hook and restores the one it replaced. If another hook has been
   * installed since, it is left in place and a warning is logged.
   *
   * @throws SessionStateException if the session is not started.
   */
  public void stop() {
    if (!started) {
      throw new SessionStateException("The trace session has not been started");
    }
    if (runtime.getHook() == dispatcher) {
      runtime.setHook(previousHook);
      log.debug("Trace session stopped, restored hook: {}", previousHook);
    } else {
      log.warn(
          "Another hook has been installed since the trace session was started. "
              + "Will not restore the original hook.");
    }
    previousHook = null;
    started = false;
  }

  @Override
  public void close() {
    if (started) {
      stop();
    }
  }

  /**
   * Suspends dispatching until the returned suspension is closed. Suspensions nest.
   *
   * <p>The engine suspends itself around any of its operations that run code in the observed
   * runtime, so that this code is not observed.
   */
  public Suspension suspend() {
    suspendedDepth++;
    return new Suspension() {
      private boolean closed;

      @Override
      public void close() {
        if (!closed) {
          closed = true;
          suspendedDepth--;
        }
      }
    };
  }

  public boolean isSuspended() {
    return suspendedDepth > 0;
  }

  /** Starts building a scope resolved by this session's runtime. */
  public Scope.Builder scope() {
    return Scope.builder(runtime.resolver());
  }

  /**
   * Registers a callback for the given events of the contexts matched by a scope.
   *
   * @return the handle to pass to {@link #removeCallback(Handle)}.
   */
  public Handle addCallback(Scope scope, TraceCallback callback, Collection<TraceEvent> events) {
    if (scope == null || callback == null || events == null) {
      throw new ConfigurationException("Scope, callback and events are required");
    }
    EnumSet<TraceEvent> subscribed = EnumSet.noneOf(TraceEvent.class);
    for (TraceEvent event : events) {
      if (event == null) {
        throw new ConfigurationException("Event kinds must not be null");
      }
      subscribed.add(event);
    }
    try (Suspension ignored = suspend()) {
      return dispatcher.add(scope, subscribed, callback);
    }
  }

  /**
   * Registers a callback for events given by name.
   *
   * @throws ConfigurationException if a name does not denote a known event kind.
   */
  public Handle addCallback(Scope scope, TraceCallback callback, String... eventNames) {
    EnumSet<TraceEvent> events = EnumSet.noneOf(TraceEvent.class);
    for (String name : eventNames) {
      events.add(TraceEvent.parse(name));
    }
    return addCallback(scope, callback, events);
  }

  /**
   * Removes a registration. Takes effect for the next event, and for the remainder of an event
   * being dispatched.
   *
   * @throws IllegalArgumentException if the handle is not registered with this session.
   */
  public void removeCallback(Handle handle) {
    if (!dispatcher.remove(handle)) {
      throw new IllegalArgumentException("Unknown callback handle: " + handle);
    }
  }

  /**
   * Registers a callback for as long as the returned registration is open, starting this session
   * if needed.
   *
   * @throws SessionStateException if the session is started but no longer owns the hook.
   */
  public Registration register(Scope scope, TraceCallback callback, Set<TraceEvent> events) {
    boolean startedHere = ensureStarted();
    try {
      return new Registration(this, addCallback(scope, callback, events), startedHere);
    } catch (RuntimeException e) {
      if (startedHere) {
        stop();
      }
      throw e;
    }
  }

  private boolean ensureStarted() {
    if (started) {
      if (!isHookOwner()) {
        throw new SessionStateException(
            "The trace session has been started, but a different hook was installed in the"
                + " meantime");
      }
      return false;
    }
    start();
    return true;
  }

  /** Captures the most recent completed call of the contexts matched by the scope. */
  public CallCapture.Single captureCall(Scope scope) {
    return CallCapture.Single.open(this, scope);
  }

  public CallCapture.Single captureCall(Object function) {
    return captureCall(scope().function(function).build());
  }

  /** Captures every completed call of the contexts matched by the scope, in completion order. */
  public CallCapture.All captureCalls(Scope scope) {
    return CallCapture.All.open(this, scope);
  }

  public CallCapture.All captureCalls(Object function) {
    return captureCalls(scope().function(function).build());
  }

  /**
   * Sets a breakpoint.
   *
   * @param scope the contexts to break in.
   * @param line where to break, {@code null} to break on entry.
   * @param guard an expression that must evaluate truthy for the breakpoint to fire, or {@code
   *     null}.
   */
  public Breakpoint breakpoint(Scope scope, @Nullable LineSelector line, @Nullable String guard) {
    return Breakpoint.open(this, scope, line, guard);
  }

  public Breakpoint breakpoint(Object function, int line) {
    return breakpoint(scope().function(function).build(), LineSelector.line(line), null);
  }

  /** The debugger of breakpoints that hand off without naming one, the console by default. */
  public DebuggerFactory debuggerFactory() {
    if (debuggerFactory == null) {
      debuggerFactory = ConsoleDebugger.console(config.getDebuggerPrompt());
    }
    return debuggerFactory;
  }

  /** Sets the debugger used by breakpoints that hand off without naming one. */
  public void setDebuggerFactory(DebuggerFactory debuggerFactory) {
    this.debuggerFactory = debuggerFactory;
  }

  int callbackCount() {
    return dispatcher.size();
  }

  TraceHook hook() {
    return dispatcher;
  }

  @Override
  public String toString() {
    return "TraceSession{started=" + started + ", " + dispatcher + '}';
  }

  /** Scope of a {@link #suspend()} call. */
  public interface Suspension extends AutoCloseable {
    @Override
    void close();
  }
}
