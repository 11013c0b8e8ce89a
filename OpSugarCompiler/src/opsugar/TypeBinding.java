package opsugar;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

// Keyed by node identity. Nodes created after the resolution have no entry.
public final class TypeBinding {
  private final Map<Ast.Expr, Type> types;

  private TypeBinding(Map<Ast.Expr, Type> types) {
    this.types = types;
  }

  public Optional<Type> typeOf(Ast.Expr expr) {
    return Optional.ofNullable(types.get(expr));
  }

  public boolean isBound(Ast.Expr expr) {
    return types.containsKey(expr);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<Ast.Expr, Type> types = new IdentityHashMap<>();

    private Builder() {}

    public Builder bind(Ast.Expr expr, Type type) {
      types.put(expr, type);
      return this;
    }

    public TypeBinding build() {
      return new TypeBinding(new IdentityHashMap<>(types));
    }
  }
}
