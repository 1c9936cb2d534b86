package tracehook.core.capture;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import tracehook.api.ExecutionContext;
import tracehook.api.SourceProvider;
import tracehook.api.TraceEvent;
import tracehook.api.Unwind;
import tracehook.core.Registration;
import tracehook.core.TraceCallback;
import tracehook.core.TraceSession;
import tracehook.core.config.TraceConfig;
import tracehook.core.scope.Scope;

/**
 * Turns the entry and return events of matched contexts into {@link CallInfo} records.
 *
 * <p>Pending records are keyed by context identity, so recursive activations of the same code are
 * recorded separately. A return without a recorded entry, e.g. of a call already running when the
 * capture was opened, publishes nothing.
 */
public abstract class CallCapture implements TraceCallback, AutoCloseable {
  private static final EnumSet<TraceEvent> EVENTS = EnumSet.of(TraceEvent.ENTER, TraceEvent.RETURN);

  private final Map<ExecutionContext, CallInfo> pending = new IdentityHashMap<>();
  private final SourceProvider sources;
  private final boolean captureGlobals;
  private final int stackDepth;
  private Registration registration;

  CallCapture(TraceSession session) {
    TraceConfig config = session.config();
    this.sources = session.runtime().sources();
    this.captureGlobals = config.isCaptureGlobals();
    this.stackDepth = config.getStackDepth();
  }

  final void register(TraceSession session, Scope scope) {
    registration = session.register(scope, this, EVENTS);
  }

  protected abstract void publish(CallInfo call);

  @Override
  public final void onEvent(ExecutionContext context, TraceEvent event, @Nullable Object payload) {
    if (event == TraceEvent.ENTER) {
      CallInfo call = new CallInfo();
      call.entered(
          context.code().name(),
          context.file(),
          ContextSnapshots.stack(context, sources, stackDepth),
          ContextSnapshots.copy(context.arguments()));
      pending.put(context, call);
    } else if (event == TraceEvent.RETURN) {
      CallInfo call = pending.remove(context);
      if (call == null) {
        return;
      }
      Map<String, Object> locals = ContextSnapshots.copy(context.locals());
      Map<String, Object> globals =
          captureGlobals
              ? ContextSnapshots.copy(context.globals())
              : Collections.<String, Object>emptyMap();
      if (payload instanceof Unwind) {
        call.unwound(locals, globals, ((Unwind) payload).cause());
      } else {
        call.returned(locals, globals, payload);
      }
      publish(call);
    }
  }

  /** Number of matched calls that have been entered but have not completed yet. */
  public int pendingCount() {
    return pending.size();
  }

  public boolean isClosed() {
    return registration == null || registration.isClosed();
  }

  @Override
  public void close() {
    pending.clear();
    if (registration != null) {
      registration.close();
    }
  }

  /** Keeps the most recently completed call. */
  public static final class Single extends CallCapture {
    private final CallInfo result = new CallInfo();

    private Single(TraceSession session) {
      super(session);
    }

    public static Single open(TraceSession session, Scope scope) {
      Single capture = new Single(session);
      capture.register(session, scope);
      return capture;
    }

    @Override
    protected void publish(CallInfo call) {
      result.copyFrom(call);
    }

    /** The live record, updated in place by every completed call. */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Live view")
    public CallInfo getResult() {
      return result;
    }
  }

  /** Keeps every completed call, in completion order. */
  public static final class All extends CallCapture {
    private final List<CallInfo> calls = new ArrayList<>();
    private final List<CallInfo> view = Collections.unmodifiableList(calls);

    private All(TraceSession session) {
      super(session);
    }

    public static All open(TraceSession session, Scope scope) {
      All capture = new All(session);
      capture.register(session, scope);
      return capture;
    }

    @Override
    protected void publish(CallInfo call) {
      calls.add(call);
    }

    /** A live read-only list of the completed calls. */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Live view")
    public List<CallInfo> getResults() {
      return view;
    }
  }
}
