package tracehook.core;

import java.util.EnumSet;
import java.util.Set;
import tracehook.api.TraceEvent;
import tracehook.core.scope.Scope;

final class CallbackEntry {
  private final Handle handle;
  private final Scope scope;
  private final Set<TraceEvent> events;
  private final TraceCallback callback;
  private final boolean needsLocalTracing;
  private volatile boolean removed;

  CallbackEntry(Handle handle, Scope scope, EnumSet<TraceEvent> events, TraceCallback callback) {
    this.handle = handle;
    this.scope = scope;
    this.events = events;
    this.callback = callback;
    EnumSet<TraceEvent> beyondEntry = EnumSet.copyOf(events);
    beyondEntry.remove(TraceEvent.ENTER);
    this.needsLocalTracing = !beyondEntry.isEmpty();
  }

  Handle handle() {
    return handle;
  }

  Scope scope() {
    return scope;
  }

  TraceCallback callback() {
    return callback;
  }

  boolean subscribes(TraceEvent event) {
    return events.contains(event);
  }

  /** Whether the entry wants events of a context beyond its entry. */
  boolean needsLocalTracing() {
    return needsLocalTracing;
  }

  boolean isRemoved() {
    return removed;
  }

  void markRemoved() {
    removed = true;
  }

  @Override
  public String toString() {
    return "CallbackEntry{" + handle + ", " + scope + ", events=" + events + '}';
  }
}
