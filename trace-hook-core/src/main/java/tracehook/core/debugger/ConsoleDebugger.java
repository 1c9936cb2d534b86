package tracehook.core.debugger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tracehook.api.DebuggerFactory;
import tracehook.api.DebuggerSignal;
import tracehook.api.ExecutionContext;
import tracehook.api.HookRuntime;
import tracehook.api.InteractiveDebugger;
import tracehook.api.TraceEvent;
import tracehook.api.TraceHookException;

/**
 * A line oriented debugger reading commands from a {@link Reader}.
 *
 * <pre>
 * s(tep)      stop at the next event
 * n(ext)      stop at the next line of the current call or its callers
 * r(eturn)    stop when the current call returns
 * c(ont)      continue without the debugger
 * q(uit)      same as continue, also on end of input
 * p expr      print the value of an expression
 * a(rgs)      print the arguments of the current call
 * l(ocals)    print the locals of the current call
 * w(here)     print the call stack
 * h(elp)      print this help
 * </pre>
 *
 * An empty line repeats the previous command.
 */
public final class ConsoleDebugger implements InteractiveDebugger {
  private static final Logger log = LoggerFactory.getLogger(ConsoleDebugger.class);

  static final String HELP =
      "Commands: s(tep) n(ext) r(eturn) c(ont) q(uit) p <expr> a(rgs) l(ocals) w(here) h(elp)";

  private enum Mode {
    STEP,
    NEXT,
    RETURN
  }

  private final HookRuntime runtime;
  private final BufferedReader in;
  private final PrintStream out;
  private final String prompt;
  private Mode mode = Mode.STEP;
  @Nullable private ExecutionContext stopContext;
  @Nullable private String lastCommand;

  ConsoleDebugger(HookRuntime runtime, BufferedReader in, PrintStream out, String prompt) {
    this.runtime = runtime;
    this.in = in;
    this.out = out;
    this.prompt = prompt;
  }

  /**
   * Debuggers on the standard input and error streams of the process. Standard input is wrapped
   * once, on first use, and shared by every factory this returns.
   */
  public static DebuggerFactory console(String prompt) {
    return factory(StandardInput.READER, System.err, prompt);
  }

  /** Debuggers sharing one input stream and output. */
  public static DebuggerFactory factory(Reader in, PrintStream out, String prompt) {
    final BufferedReader reader =
        in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
    return new DebuggerFactory() {
      @Override
      public InteractiveDebugger create(HookRuntime runtime, ExecutionContext context) {
        return new ConsoleDebugger(runtime, reader, out, prompt);
      }

      @Override
      public String toString() {
        return "ConsoleDebugger";
      }
    };
  }

  @Override
  public DebuggerSignal dispatch(
      ExecutionContext context, TraceEvent event, @Nullable Object payload) {
    if (!shouldStop(context, event)) {
      return DebuggerSignal.STEP;
    }
    printLocation(context, event, payload);
    while (true) {
      out.print(prompt);
      out.flush();
      String line;
      try {
        line = in.readLine();
      } catch (IOException e) {
        log.warn("Failed to read a debugger command, leaving the debugger", e);
        return DebuggerSignal.QUIT;
      }
      if (line == null) {
        out.println();
        return DebuggerSignal.QUIT;
      }
      line = line.trim();
      if (line.isEmpty()) {
        if (lastCommand == null) {
          continue;
        }
        line = lastCommand;
      }
      lastCommand = line;
      DebuggerSignal signal = execute(context, line);
      if (signal != null) {
        return signal;
      }
    }
  }

  /** Runs one command, returning the signal if it resumes execution. */
  @Nullable
  private DebuggerSignal execute(ExecutionContext context, String line) {
    int space = line.indexOf(' ');
    String command = space < 0 ? line : line.substring(0, space);
    String argument = space < 0 ? "" : line.substring(space + 1).trim();
    switch (command) {
      case "s":
      case "step":
        mode = Mode.STEP;
        stopContext = null;
        return DebuggerSignal.STEP;
      case "n":
      case "next":
        mode = Mode.NEXT;
        stopContext = context;
        return DebuggerSignal.STEP;
      case "r":
      case "return":
        mode = Mode.RETURN;
        stopContext = context;
        return DebuggerSignal.STEP;
      case "c":
      case "cont":
      case "continue":
        return DebuggerSignal.CONTINUE;
      case "q":
      case "quit":
      case "exit":
        return DebuggerSignal.QUIT;
      case "p":
        print(context, argument);
        return null;
      case "a":
      case "args":
        printBindings(context.arguments());
        return null;
      case "l":
      case "locals":
        printBindings(context.locals());
        return null;
      case "w":
      case "where":
        printStack(context);
        return null;
      case "h":
      case "help":
        out.println(HELP);
        return null;
      default:
        out.println("*** Unknown command: " + command);
        return null;
    }
  }

  private boolean shouldStop(ExecutionContext context, TraceEvent event) {
    switch (mode) {
      case NEXT:
        return event != TraceEvent.ENTER && isSelfOrCaller(context);
      case RETURN:
        return event == TraceEvent.RETURN && context == stopContext;
      default:
        return true;
    }
  }

  private boolean isSelfOrCaller(ExecutionContext context) {
    for (ExecutionContext current = stopContext; current != null; current = current.caller()) {
      if (current == context) {
        return true;
      }
    }
    return stopContext == null;
  }

  private void print(ExecutionContext context, String expression) {
    if (expression.isEmpty()) {
      out.println("*** Usage: p <expr>");
      return;
    }
    try {
      out.println(runtime.evaluator().evaluate(context, expression, context.locals()));
    } catch (TraceHookException e) {
      out.println("*** " + e.getMessage());
    }
  }

  private void printBindings(Map<String, Object> bindings) {
    for (Map.Entry<String, Object> binding : bindings.entrySet()) {
      out.println(binding.getKey() + " = " + binding.getValue());
    }
  }

  private void printLocation(ExecutionContext context, TraceEvent event, @Nullable Object payload) {
    if (event == TraceEvent.RETURN) {
      out.println("--Return--");
    } else if (event == TraceEvent.EXCEPTION) {
      out.println("--Exception-- " + payload);
    }
    out.println(location(context, "> "));
    String source = runtime.sources().sourceLine(context.code(), context.line());
    if (source != null) {
      out.println("-> " + source.trim());
    }
  }

  private void printStack(ExecutionContext context) {
    List<ExecutionContext> stack = new ArrayList<>();
    for (ExecutionContext current = context; current != null; current = current.caller()) {
      stack.add(current);
    }
    Collections.reverse(stack);
    for (ExecutionContext frame : stack) {
      out.println(location(frame, frame == context ? "> " : "  "));
    }
  }

  private static String location(ExecutionContext context, String marker) {
    return marker + context.file() + "(" + context.line() + ")" + context.code().name() + "()";
  }

  BufferedReader input() {
    return in;
  }

  private static final class StandardInput {
    static final BufferedReader READER =
        new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset()));
  }
}
