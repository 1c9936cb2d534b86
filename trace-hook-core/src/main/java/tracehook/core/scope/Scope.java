package tracehook.core.scope;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;
import tracehook.api.CodeResolver;
import tracehook.api.CodeResolver.ResolvedCode;
import tracehook.api.CodeUnit;
import tracehook.api.ConfigurationException;
import tracehook.api.ExecutionContext;

/**
 * Predicate selecting the execution contexts an observer cares about.
 *
 * <p>A scope combines up to four selectors, all of which must match:
 *
 * <ul>
 *   <li>code identity: the context runs exactly the code unit of a given callable and, for bound
 *       callables or when a receiver is given explicitly, runs on that very receiver object;
 *   <li>name: the unqualified name of the code unit equals the given name. Unrelated code sharing
 *       the name matches too;
 *   <li>module: the context's file is the file the module was loaded from;
 *   <li>file: the context's file equals a path or matches a glob pattern.
 * </ul>
 *
 * <p>Scopes are immutable and stateless. A scope without any selector would match everything, so
 * it can only be obtained explicitly through {@link #any()}.
 */
public final class Scope {
  private static final Scope ANY = new Scope(null, null, null, null, null, null);

  @Nullable private final CodeUnit code;
  @Nullable private final Object receiver;
  @Nullable private final String name;
  @Nullable private final String moduleFile;
  @Nullable private final FileMatcher fileMatcher;
  @Nullable private final String description;

  private Scope(
      @Nullable CodeUnit code,
      @Nullable Object receiver,
      @Nullable String name,
      @Nullable String moduleFile,
      @Nullable FileMatcher fileMatcher,
      @Nullable String description) {
    this.code = code;
    this.receiver = receiver;
    this.name = name;
    this.moduleFile = moduleFile;
    this.fileMatcher = fileMatcher;
    this.description = description;
  }

  /** A scope matching every context. */
  public static Scope any() {
    return ANY;
  }

  public static Builder builder(CodeResolver resolver) {
    return new Builder(resolver);
  }

  public boolean matches(ExecutionContext context) {
    if (code != null) {
      if (!code.equals(context.code())) {
        return false;
      }
      if (receiver != null && context.receiver() != receiver) {
        return false;
      }
    }
    if (name != null && !name.equals(context.code().name())) {
      return false;
    }
    if (moduleFile != null && !moduleFile.equals(context.file())) {
      return false;
    }
    return fileMatcher == null || fileMatcher.matches(context.file());
  }

  /** Whether this scope selects a function, by code identity or by name. */
  public boolean hasFunctionSelector() {
    return code != null || name != null;
  }

  @Nullable
  public CodeUnit code() {
    return code;
  }

  @Nullable
  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return description == null ? "Scope{any}" : "Scope{" + description + '}';
  }

  public static final class Builder {
    private final CodeResolver resolver;
    @Nullable private Object function;
    @Nullable private Object receiver;
    private boolean unwrap = true;
    @Nullable private String name;
    @Nullable private Object module;
    @Nullable private FileMatcher fileMatcher;
    private final List<Scope> ancestors = new ArrayList<>();

    private Builder(CodeResolver resolver) {
      this.resolver = resolver;
    }

    /** Selects contexts running the code of the given callable. */
    public Builder function(Object callable) {
      this.function = callable;
      return this;
    }

    /** Restricts code identity matches to calls on this exact receiver object. */
    public Builder receiver(Object receiver) {
      this.receiver = receiver;
      return this;
    }

    /** Whether to follow a decorator chain to the innermost function. Defaults to {@code true}. */
    public Builder unwrap(boolean unwrap) {
      this.unwrap = unwrap;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder module(Object module) {
      this.module = module;
      return this;
    }

    /** Selects contexts whose file resolves to the given path. */
    public Builder file(Path file) {
      this.fileMatcher = FileMatcher.exact(file);
      return this;
    }

    /** Selects contexts whose file matches the given glob pattern. */
    public Builder filePattern(String pattern) {
      this.fileMatcher = FileMatcher.glob(pattern);
      return this;
    }

    /** Reserved: matching on the scopes of calling contexts is not supported. */
    public Builder ancestors(Scope... scopes) {
      ancestors.addAll(Arrays.asList(scopes));
      return this;
    }

    /**
     * @throws ConfigurationException if no selector is set, ancestor scopes are requested, or the
     *     callable or module cannot be resolved.
     */
    public Scope build() {
      if (!ancestors.isEmpty()) {
        throw new ConfigurationException("Matching on ancestor scopes is not supported");
      }
      if (function == null && name == null && module == null && fileMatcher == null) {
        throw new ConfigurationException(
            "A scope needs at least one of function, name, module or file; use Scope.any() to"
                + " match every context");
      }
      if (receiver != null && function == null) {
        throw new ConfigurationException("A receiver can only be given together with a function");
      }
      List<String> parts = new ArrayList<>();
      CodeUnit code = null;
      Object boundReceiver = receiver;
      if (function != null) {
        ResolvedCode resolved = resolver.resolve(function, unwrap);
        code = resolved.code();
        if (boundReceiver == null) {
          boundReceiver = resolved.receiver();
        }
        parts.add("code=" + code);
        if (boundReceiver != null) {
          parts.add("receiver=" + boundReceiver);
        }
      }
      if (name != null) {
        parts.add("name=" + name);
      }
      String moduleFile = null;
      if (module != null) {
        moduleFile = resolver.moduleFile(module);
        parts.add("module=" + moduleFile);
      }
      if (fileMatcher != null) {
        parts.add("file=" + fileMatcher);
      }
      return new Scope(
          code,
          boundReceiver,
          name,
          moduleFile,
          fileMatcher,
          String.join(", ", parts));
    }
  }
}
