package tracehook.core;

/**
 * A callback registered for a bounded extent. Closing it removes the callback and, if the
 * registration started its session, stops the session again.
 */
public final class Registration implements AutoCloseable {
  private final TraceSession session;
  private final Handle handle;
  private final boolean startedSession;
  private boolean closed;

  Registration(TraceSession session, Handle handle, boolean startedSession) {
    this.session = session;
    this.handle = handle;
    this.startedSession = startedSession;
  }

  public TraceSession session() {
    return session;
  }

  public Handle handle() {
    return handle;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      session.removeCallback(handle);
    } finally {
      if (startedSession && session.isStarted()) {
        session.stop();
      }
    }
  }
}
