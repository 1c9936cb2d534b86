package tracehook.core;

import java.util.concurrent.atomic.AtomicLong;

/** Opaque token identifying one callback registration of a {@link TraceSession}. */
public final class Handle {
  private static final AtomicLong NEXT_ID = new AtomicLong();

  private final long id;

  Handle() {
    this.id = NEXT_ID.incrementAndGet();
  }

  // we want identity equality, so no need to override equals()

  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }

  @Override
  public String toString() {
    return "Handle#" + id;
  }
}
