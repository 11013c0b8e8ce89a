package opsugar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

final class Scope {

  static final class Entity {
    enum Kind {
      TYPE,
      VAR,
      CONST,
      FUNC,
      BUILTIN,
      NIL;
    }

    private final Kind kind;
    private final String name;
    private final Type type;
    private final OptionalLong constValue;
    private final Builtin builtin;
    private final Ast.Node decl;
    private boolean used = false;

    private Entity(
        Kind kind,
        String name,
        Type type,
        OptionalLong constValue,
        Builtin builtin,
        Ast.Node decl) {
      this.kind = kind;
      this.name = name;
      this.type = Preconditions.checkNotNull(type);
      this.constValue = constValue;
      this.builtin = builtin;
      this.decl = decl;
    }

    static Entity typeName(String name, Type type, Ast.Node decl) {
      return new Entity(Kind.TYPE, name, type, OptionalLong.empty(), null, decl);
    }

    static Entity var(String name, Type type, Ast.Node decl) {
      return new Entity(Kind.VAR, name, type, OptionalLong.empty(), null, decl);
    }

    static Entity constant(String name, Type type, OptionalLong value, Ast.Node decl) {
      return new Entity(Kind.CONST, name, type, value, null, decl);
    }

    static Entity func(String name, Type.SignatureType type, Ast.Node decl) {
      return new Entity(Kind.FUNC, name, type, OptionalLong.empty(), null, decl);
    }

    static Entity builtin(Builtin builtin) {
      return new Entity(
          Kind.BUILTIN,
          builtin.repr(),
          Type.BasicType.of(Type.BasicType.Which.INVALID),
          OptionalLong.empty(),
          builtin,
          null);
    }

    static Entity nil() {
      return new Entity(
          Kind.NIL,
          "nil",
          Type.BasicType.of(Type.BasicType.Which.UNTYPED_NIL),
          OptionalLong.empty(),
          null,
          null);
    }

    Kind kind() {
      return kind;
    }

    String name() {
      return name;
    }

    Type type() {
      return type;
    }

    OptionalLong constValue() {
      return constValue;
    }

    Builtin builtin() {
      Preconditions.checkState(kind == Kind.BUILTIN, "%s is not a builtin", name);
      return builtin;
    }

    // The declaring node; absent for predeclared names.
    Optional<Ast.Node> decl() {
      return Optional.ofNullable(decl);
    }

    boolean isUsed() {
      return used;
    }

    void markUsed() {
      used = true;
    }
  }

  private final Scope parent;
  private final boolean function;
  private final Map<String, Entity> entities = new LinkedHashMap<>();

  private Scope(Scope parent, boolean function) {
    this.parent = parent;
    this.function = function;
  }

  static Scope universe() {
    Scope universe = new Scope(null, false);
    for (Type.BasicType.Which which : Type.BasicType.Which.values()) {
      Type.BasicType.predeclared(which.repr())
          .ifPresent(t -> universe.declare(Entity.typeName(which.repr(), t, null)));
    }
    universe.declare(
        Entity.typeName("byte", Type.BasicType.of(Type.BasicType.Which.UINT8), null));
    universe.declare(
        Entity.typeName("rune", Type.BasicType.of(Type.BasicType.Which.INT32), null));
    universe.declare(Entity.typeName("error", errorType(), null));

    Type untypedBool = Type.BasicType.of(Type.BasicType.Which.UNTYPED_BOOL);
    universe.declare(Entity.constant("true", untypedBool, OptionalLong.empty(), null));
    universe.declare(Entity.constant("false", untypedBool, OptionalLong.empty(), null));
    universe.declare(Entity.nil());
    for (Builtin builtin : Builtin.values()) {
      universe.declare(Entity.builtin(builtin));
    }
    return universe;
  }

  private static Type.NamedType errorType() {
    Type.NamedType error = new Type.NamedType("error");
    Type.SignatureType sig =
        new Type.SignatureType(
            ImmutableList.of(),
            ImmutableList.of(Type.BasicType.of(Type.BasicType.Which.STRING)),
            false);
    error.setUnderlying(
        new Type.InterfaceType(ImmutableList.of(Method.create("Error", sig, false, "error"))));
    return error;
  }

  Scope child() {
    return new Scope(this, false);
  }

  Scope functionChild() {
    return new Scope(this, true);
  }

  Scope parent() {
    return parent;
  }

  boolean isFunction() {
    return function;
  }

  // Returns the conflicting entity, if any.
  Optional<Entity> declare(Entity entity) {
    if (entity.name().equals("_")) return Optional.empty();
    return Optional.ofNullable(entities.putIfAbsent(entity.name(), entity));
  }

  Optional<Entity> lookupLocal(String name) {
    return Optional.ofNullable(entities.get(name));
  }

  Optional<Entity> lookup(String name) {
    for (Scope scope = this; scope != null; scope = scope.parent) {
      Entity entity = scope.entities.get(name);
      if (entity != null) return Optional.of(entity);
    }
    return Optional.empty();
  }

  List<Entity> unusedVariables() {
    List<Entity> unused = new ArrayList<>();
    for (Entity entity : entities.values()) {
      if (entity.kind() == Entity.Kind.VAR && !entity.isUsed()) unused.add(entity);
    }
    return unused;
  }
}
