package tracehook.core.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tracehook.core.fake.FakeRuntime.bindings;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tracehook.core.TraceSession;
import tracehook.core.config.TraceConfig;
import tracehook.core.fake.FakeCode;
import tracehook.core.fake.FakeContext;
import tracehook.core.fake.FakeRuntime;

public class CallCaptureTest {
  private static final FakeCode MAIN = new FakeCode("main", "/src/app.js", 1);
  private static final FakeCode F = new FakeCode("f", "/src/app.js", 3, "x");
  private static final FakeCode FACT = new FakeCode("fact", "/src/app.js", 7, "n");

  private FakeRuntime runtime;
  private TraceSession session;

  @BeforeEach
  public void setUp() {
    runtime =
        new FakeRuntime()
            .source(
                "/src/app.js",
                "main();",
                "",
                "function f(x) {",
                "  var y = x * 2;",
                "  return y;",
                "}",
                "function fact(n) {",
                "  return n <= 1 ? 1 : n * fact(n - 1);",
                "}");
    runtime.globals().put("answer", 42);
    session = new TraceSession(runtime, TraceConfig.builder().build());
  }

  private Object f(int x) {
    return runtime.call(
        F,
        null,
        bindings("x", x),
        context -> {
          context.line(4);
          context.set("y", x * 2);
          context.line(5);
          return context.get("y");
        });
  }

  private Object fact(int n) {
    return runtime.call(
        FACT,
        null,
        bindings("n", n),
        context -> {
          context.line(8);
          return n <= 1 ? 1 : n * (Integer) fact(n - 1);
        });
  }

  @Test
  public void capturesArgumentsLocalsAndReturnValue() {
    CallInfo call;
    try (CallCapture.Single capture = session.captureCall(F)) {
      call = capture.getResult();
      assertFalse(call.isCompleted());
      runtime.call(MAIN, null, bindings(), context -> f(3));
    }

    assertTrue(call.isCompleted());
    assertEquals("f", call.getName());
    assertEquals("/src/app.js", call.getFile());
    assertEquals(bindings("x", 3), call.getArguments());
    assertEquals(bindings("x", 3, "y", 6), call.getLocals());
    assertEquals(6, call.getReturnValue());
    assertTrue(call.hasReturnValue());
    assertNull(call.getThrown());
    assertEquals(42, call.getGlobals().get("answer"));
    assertEquals("CallInfo(name=f, args={x=3}, returnValue=6)", call.toString());
  }

  @Test
  public void stackSummaryRunsFromOutermostCall() {
    try (CallCapture.Single capture = session.captureCall(F)) {
      runtime.call(
          MAIN,
          null,
          bindings(),
          context -> {
            context.line(1);
            return f(1);
          });

      List<StackElement> stack = capture.getResult().getStack();
      assertEquals(2, stack.size());
      assertEquals("main", stack.get(0).getName());
      assertEquals(1, stack.get(0).getLine());
      assertEquals("main();", stack.get(0).getSourceLine());
      assertEquals("f", stack.get(1).getName());
      assertEquals(3, stack.get(1).getLine());
      assertEquals("function f(x) {", stack.get(1).getSourceLine());
      String formatted = capture.getResult().formatStack();
      assertTrue(formatted.contains("File \"/src/app.js\", line 1, in main"));
    }
  }

  @Test
  public void singleCaptureKeepsMostRecentCall() {
    try (CallCapture.Single capture = session.captureCall(F)) {
      CallInfo call = capture.getResult();
      f(1);
      f(2);

      assertSame(call, capture.getResult());
      assertEquals(bindings("x", 2), call.getArguments());
      assertEquals(4, call.getReturnValue());
    }
  }

  @Test
  public void recursiveCallsAreRecordedInReturnOrder() {
    try (CallCapture.All capture = session.captureCalls(FACT)) {
      List<CallInfo> calls = capture.getResults();
      assertEquals(24, fact(4));

      assertEquals(4, calls.size());
      for (int i = 0; i < 4; i++) {
        int n = i + 1;
        assertEquals(bindings("n", n), calls.get(i).getArguments());
        assertEquals(factorial(n), calls.get(i).getReturnValue());
        assertEquals(5 - n, calls.get(i).getStack().size());
      }
      assertEquals(0, capture.pendingCount());
    }
  }

  private static int factorial(int n) {
    return n <= 1 ? 1 : n * factorial(n - 1);
  }

  @Test
  public void unwoundCallHasNoReturnValue() {
    IllegalStateException failure = new IllegalStateException("boom");
    try (CallCapture.Single capture = session.captureCall(F)) {
      assertThrows(
          IllegalStateException.class,
          () ->
              runtime.call(
                  F,
                  null,
                  bindings("x", 1),
                  context -> {
                    throw failure;
                  }));

      CallInfo call = capture.getResult();
      assertTrue(call.isCompleted());
      assertFalse(call.hasReturnValue());
      assertNull(call.getReturnValue());
      assertSame(failure, call.getThrown());
    }
  }

  @Test
  public void callsRunningBeforeTheCaptureAreNotRecorded() {
    CallCapture.All[] capture = new CallCapture.All[1];
    runtime.call(
        F,
        null,
        bindings("x", 1),
        context -> {
          capture[0] = session.captureCalls(F);
          f(5);
          return null;
        });
    capture[0].close();

    assertEquals(1, capture[0].getResults().size());
    assertEquals(bindings("x", 5), capture[0].getResults().get(0).getArguments());
  }

  @Test
  public void closingStopsTheSessionItStarted() {
    CallCapture.All capture = session.captureCalls(F);
    assertTrue(session.isHookOwner());

    capture.close();
    assertFalse(session.isStarted());
    assertNull(runtime.getHook());
    assertTrue(capture.isClosed());

    f(1);
    assertTrue(capture.getResults().isEmpty());
  }

  @Test
  public void nestedCapturesShareTheSession() {
    try (CallCapture.All outer = session.captureCalls(F)) {
      try (CallCapture.Single inner = session.captureCall(FACT)) {
        f(1);
        fact(2);
        assertEquals(2, inner.getResult().getReturnValue());
      }
      assertTrue(session.isHookOwner());
      f(2);
      assertEquals(2, outer.getResults().size());
    }
    assertFalse(session.isStarted());
  }

  @Test
  public void globalsAreOptional() {
    TraceConfig config = TraceConfig.builder().captureGlobals(false).stackDepth(1).build();
    session = new TraceSession(runtime, config);
    try (CallCapture.Single capture = session.captureCall(F)) {
      runtime.call(MAIN, null, bindings(), context -> f(3));

      assertTrue(capture.getResult().getGlobals().isEmpty());
      assertEquals(1, capture.getResult().getStack().size());
      assertEquals("f", capture.getResult().getStack().get(0).getName());
    }
  }

  @Test
  public void contextsAreNotRetained() {
    try (CallCapture.Single capture = session.captureCall(F)) {
      FakeContext[] seen = new FakeContext[1];
      runtime.call(
          F,
          null,
          bindings("x", 1),
          context -> {
            seen[0] = context;
            context.set("y", 1);
            return null;
          });
      seen[0].set("y", 100);

      assertEquals(1, capture.getResult().getLocals().get("y"));
      assertThrows(
          UnsupportedOperationException.class,
          () -> capture.getResult().getLocals().put("z", 1));
    }
  }
}
