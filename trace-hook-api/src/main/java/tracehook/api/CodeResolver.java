package tracehook.api;

import javax.annotation.Nullable;

/** Maps user supplied callables and modules to the runtime's code identities. */
public interface CodeResolver {
  /**
   * Finds the code unit implementing a callable.
   *
   * @param callable a function, bound callable or callable object of the runtime.
   * @param unwrap whether to follow a decorator chain to the innermost original function.
   * @return the code unit and, for bound callables, the receiver it is bound to.
   * @throws ConfigurationException if the callable cannot be resolved to interpreted code.
   */
  ResolvedCode resolve(Object callable, boolean unwrap);

  /**
   * Returns the source file a module was loaded from.
   *
   * @throws ConfigurationException if the object is not a module of the runtime.
   */
  String moduleFile(Object module);

  /** Result of {@link #resolve(Object, boolean)}. */
  final class ResolvedCode {
    private final CodeUnit code;
    @Nullable private final Object receiver;

    public ResolvedCode(CodeUnit code, @Nullable Object receiver) {
      this.code = code;
      this.receiver = receiver;
    }

    public CodeUnit code() {
      return code;
    }

    @Nullable
    public Object receiver() {
      return receiver;
    }

    @Override
    public String toString() {
      return "ResolvedCode{code=" + code + ", receiver=" + receiver + '}';
    }
  }
}
