package tracehook.api;

import java.util.Map;
import javax.annotation.Nullable;

/**
 * Evaluates source snippets of the runtime's language against a binding environment.
 *
 * <p>The bindings passed in shadow the globals of the context, which stay visible.
 */
public interface ExpressionEvaluator {
  /**
   * @return the value of the expression.
   * @throws EvaluationException if the expression fails to compile or raises.
   */
  @Nullable
  Object evaluate(ExecutionContext context, String expression, Map<String, Object> bindings);

  /**
   * Executes statements. Names the statements assign or define are reflected in {@code bindings}
   * when this method returns.
   *
   * @throws EvaluationException if the statements fail to compile or raise.
   */
  void execute(ExecutionContext context, String statements, Map<String, Object> bindings);

  /** Applies the language's truthiness rules to a value. */
  boolean isTruthy(@Nullable Object value);
}
