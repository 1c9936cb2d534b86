package tracehook.api;

/** What an {@link InteractiveDebugger} wants after handling an event. */
public enum DebuggerSignal {
  /** Keep the debugger installed and keep feeding it events. */
  STEP,
  /** Continue execution with no further debugger hook installed. */
  CONTINUE,
  /** The user quit the debugger. */
  QUIT
}
