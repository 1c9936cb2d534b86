package tracehook.core;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracehook.api.ExecutionContext;
import tracehook.api.HookRuntime;
import tracehook.api.TraceEvent;
import tracehook.api.TraceHook;
import tracehook.core.scope.Scope;

/**
 * The hook a {@link TraceSession} installs in the runtime. Fans every event out to the matching
 * registrations, in registration order, and tells the runtime whether the context needs to be
 * observed any further.
 */
final class Dispatcher implements TraceHook {
  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

  private static final CallbackEntry[] NO_ENTRIES = new CallbackEntry[0];

  private final TraceSession session;
  private final HookRuntime runtime;
  private final Set<String> excludedFiles;
  private final Map<Handle, CallbackEntry> entries = new LinkedHashMap<>();
  // copy-on-write view of entries, so that dispatch never sees concurrent changes
  private CallbackEntry[] snapshot = NO_ENTRIES;

  Dispatcher(TraceSession session, HookRuntime runtime, Set<String> excludedFiles) {
    this.session = session;
    this.runtime = runtime;
    Set<String> files = new LinkedHashSet<>(excludedFiles);
    files.addAll(runtime.internalFiles());
    this.excludedFiles = files;
  }

  TraceSession session() {
    return session;
  }

  Handle add(Scope scope, EnumSet<TraceEvent> events, TraceCallback callback) {
    Handle handle = new Handle();
    entries.put(handle, new CallbackEntry(handle, scope, events, callback));
    snapshot = entries.values().toArray(NO_ENTRIES);
    log.debug("Registered {} for {} on {}", handle, events, scope);
    return handle;
  }

  boolean remove(Handle handle) {
    CallbackEntry entry = entries.remove(handle);
    if (entry == null) {
      return false;
    }
    entry.markRemoved();
    snapshot = entries.values().toArray(NO_ENTRIES);
    log.debug("Removed {}", handle);
    return true;
  }

  int size() {
    return entries.size();
  }

  @Nullable
  @Override
  public TraceHook onEvent(ExecutionContext context, TraceEvent event, @Nullable Object payload) {
    if (runtime.getHook() != this || session.isSuspended()) {
      return null;
    }
    if (excludedFiles.contains(context.file())) {
      return null;
    }
    List<CallbackEntry> matched = new ArrayList<>(snapshot.length);
    boolean traceLocally = false;
    for (CallbackEntry entry : snapshot) {
      if (!entry.isRemoved() && entry.scope().matches(context)) {
        matched.add(entry);
        traceLocally |= entry.needsLocalTracing();
      }
    }
    if (event == TraceEvent.ENTER) {
      // a callback handing the context over saves this as the hook to restore
      context.setLocalHook(traceLocally ? this : null);
    }
    for (CallbackEntry entry : matched) {
      if (!entry.isRemoved() && entry.subscribes(event)) {
        try (TraceSession.Suspension ignored = session.suspend()) {
          entry.callback().onEvent(context, event, payload);
        }
      }
    }
    if (runtime.getHook() != this) {
      // a callback handed the runtime over to another hook, which also owns this context now
      return context.localHook();
    }
    return traceLocally ? this : null;
  }

  @Override
  public String toString() {
    return "Dispatcher{entries=" + entries.size() + '}';
  }
}
