package tracehook.core.scope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tracehook.core.fake.FakeRuntime.bindings;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import tracehook.api.ConfigurationException;
import tracehook.api.ExecutionContext;
import tracehook.core.fake.FakeCode;
import tracehook.core.fake.FakeFunction;
import tracehook.core.fake.FakeRuntime;

public class ScopeTest {
  private final FakeRuntime runtime = new FakeRuntime();

  private Scope.Builder builder() {
    return Scope.builder(runtime);
  }

  /** Runs a call and returns its context, as seen on entry. */
  private ExecutionContext contextOf(FakeCode code, Object receiver) {
    List<ExecutionContext> contexts = new ArrayList<>();
    runtime.call(
        code,
        receiver,
        bindings(),
        context -> {
          contexts.add(context);
          return null;
        });
    return contexts.get(0);
  }

  private ExecutionContext contextOf(FakeCode code) {
    return contextOf(code, null);
  }

  @Test
  public void scopeWithoutSelectorIsRejected() {
    ConfigurationException e = assertThrows(ConfigurationException.class, builder()::build);
    assertTrue(e.getMessage().contains("Scope.any()"));
  }

  @Test
  public void ancestorScopesAreRejected() {
    Scope parent = builder().name("main").build();

    assertThrows(
        ConfigurationException.class, () -> builder().name("f").ancestors(parent).build());
  }

  @Test
  public void receiverRequiresFunction() {
    assertThrows(
        ConfigurationException.class, () -> builder().name("f").receiver(new Object()).build());
  }

  @Test
  public void unresolvableCallableIsRejected() {
    assertThrows(ConfigurationException.class, () -> builder().function("not code").build());
  }

  @Test
  public void codeIdentityDoesNotMatchCodeSharingTheName() {
    FakeCode f = new FakeCode("f", "/src/a.js", 1);
    FakeCode otherF = new FakeCode("f", "/src/a.js", 1);
    Scope scope = builder().function(new FakeFunction(f)).build();

    assertTrue(scope.matches(contextOf(f)));
    assertFalse(scope.matches(contextOf(otherF)));
  }

  @Test
  public void nameMatchesAnyCodeWithThatName() {
    Scope scope = builder().name("f").build();

    assertTrue(scope.matches(contextOf(new FakeCode("f", "/src/a.js", 1))));
    assertTrue(scope.matches(contextOf(new FakeCode("f", "/src/b.js", 7))));
    assertFalse(scope.matches(contextOf(new FakeCode("g", "/src/a.js", 1))));
  }

  @Test
  public void boundFunctionMatchesOnlyItsReceiver() {
    FakeCode method = new FakeCode("m", "/src/a.js", 1);
    Object mine = new Object();
    Object other = new Object();
    Scope scope = builder().function(new FakeFunction(method).bind(mine)).build();

    assertTrue(scope.matches(contextOf(method, mine)));
    assertFalse(scope.matches(contextOf(method, other)));
  }

  @Test
  public void explicitReceiverRestrictsMatches() {
    FakeCode method = new FakeCode("m", "/src/a.js", 1);
    Object mine = new Object();
    Scope scope = builder().function(method).receiver(mine).build();

    assertTrue(scope.matches(contextOf(method, mine)));
    assertFalse(scope.matches(contextOf(method, new Object())));
  }

  @Test
  public void unwrapFollowsDecorators() {
    FakeCode inner = new FakeCode("inner", "/src/a.js", 1);
    FakeCode wrapper = new FakeCode("wrapper", "/src/deco.js", 1);
    FakeFunction decorated = new FakeFunction(inner).wrappedBy(wrapper);

    Scope unwrapped = builder().function(decorated).build();
    Scope asIs = builder().function(decorated).unwrap(false).build();

    assertTrue(unwrapped.matches(contextOf(inner)));
    assertFalse(unwrapped.matches(contextOf(wrapper)));
    assertTrue(asIs.matches(contextOf(wrapper)));
  }

  @Test
  public void moduleMatchesItsFile() {
    FakeCode module = new FakeCode("<script>", "/src/a.js", 1);
    Scope scope = builder().module(module).build();

    assertTrue(scope.matches(contextOf(new FakeCode("f", "/src/a.js", 3))));
    assertFalse(scope.matches(contextOf(new FakeCode("f", "/src/b.js", 3))));
  }

  @Test
  public void selectorsAreCombined() {
    Scope scope = builder().name("f").filePattern("*.js").build();

    assertTrue(scope.matches(contextOf(new FakeCode("f", "/src/a.js", 1))));
    assertFalse(scope.matches(contextOf(new FakeCode("f", "/src/a.ts", 1))));
    assertFalse(scope.matches(contextOf(new FakeCode("g", "/src/a.js", 1))));
  }

  @Test
  public void exactPathIsNormalized() {
    Scope scope = builder().file(Paths.get("/src/lib/../a.js")).build();

    assertTrue(scope.matches(contextOf(new FakeCode("f", "/src/a.js", 1))));
    assertTrue(scope.matches(contextOf(new FakeCode("f", "/src/./a.js", 1))));
    assertFalse(scope.matches(contextOf(new FakeCode("f", "/src/lib/a.js", 1))));
  }

  @Test
  public void specialFileNamesMatchExactly() {
    Scope byPath = builder().file(Paths.get("<eval>")).build();
    Scope byPattern = builder().filePattern("<eval>").build();
    Scope wildcard = builder().filePattern("*").build();

    ExecutionContext eval = contextOf(new FakeCode("f", "<eval>", 1));
    assertTrue(byPath.matches(eval));
    assertTrue(byPattern.matches(eval));
    assertFalse(wildcard.matches(eval));
    assertFalse(byPath.matches(contextOf(new FakeCode("f", "<stdin>", 1))));
  }

  @ParameterizedTest
  @CsvSource({
    "*.js, /srv/app/main.js, true",
    "*.js, /srv/app/main.ts, false",
    "lib/*.js, /srv/app/lib/main.js, true",
    "lib/*.js, /srv/app/main.js, false",
    "app/lib/*.js, /srv/lib/main.js, false",
    "/srv/*/main.js, /srv/app/main.js, true",
    "/srv/*.js, /srv/app/main.js, false",
    "/srv/**/main.js, /srv/app/lib/main.js, true",
    "m?in.js, /srv/main.js, true"
  })
  public void filePatterns(String pattern, String file, boolean expected) {
    Scope scope = builder().filePattern(pattern).build();

    assertEquals(expected, scope.matches(contextOf(new FakeCode("f", file, 1))));
  }

  @Test
  public void anyMatchesEverything() {
    assertTrue(Scope.any().matches(contextOf(new FakeCode("f", "<eval>", 1))));
    assertFalse(Scope.any().hasFunctionSelector());
    assertTrue(builder().name("f").build().hasFunctionSelector());
  }
}
