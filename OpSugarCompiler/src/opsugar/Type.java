package opsugar;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.ForOverride;

public abstract class Type {

  public enum Kind {
    BASIC,
    NAMED,
    POINTER,
    SLICE,
    ARRAY,
    MAP,
    STRUCT,
    INTERFACE,
    SIGNATURE,
    TUPLE;
  }

  private final Kind kind;

  protected Type(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  @SuppressWarnings("unchecked")
  public <T extends Type> T cast() {
    return (T) this;
  }

  public Type underlying() {
    return this;
  }

  public final boolean isNamed() {
    return kind == Kind.NAMED;
  }

  public final boolean isPointer() {
    return kind == Kind.POINTER;
  }

  public final boolean isInterface() {
    return underlying().kind == Kind.INTERFACE;
  }

  // Go type identity: named types are identical only to themselves, other types when they are
  // structurally the same.
  public final boolean identical(Type other) {
    if (this == other) return true;
    if (other == null || kind != other.kind) return false;
    return identicalImpl(other);
  }

  @ForOverride
  protected abstract boolean identicalImpl(Type other);

  static boolean identical(List<Type> a, List<Type> b) {
    if (a.size() != b.size()) return false;
    for (int i = 0; i < a.size(); i++) {
      if (!a.get(i).identical(b.get(i))) return false;
    }
    return true;
  }

  public final boolean isBasic(BasicType.Which... whiches) {
    Type u = underlying();
    if (u.kind != Kind.BASIC) return false;
    if (whiches.length == 0) return true;

    BasicType basic = u.cast();
    for (BasicType.Which which : whiches) {
      if (basic.which() == which) return true;
    }
    return false;
  }

  public static final class BasicType extends Type {
    public enum Which {
      BOOL("bool"),
      INT("int"),
      INT32("int32"),
      INT64("int64"),
      UINT("uint"),
      UINT8("uint8"),
      FLOAT64("float64"),
      STRING("string"),
      UNTYPED_BOOL("untyped bool"),
      UNTYPED_INT("untyped int"),
      UNTYPED_RUNE("untyped rune"),
      UNTYPED_FLOAT("untyped float"),
      UNTYPED_STRING("untyped string"),
      UNTYPED_NIL("untyped nil"),
      INVALID("invalid type");

      private final String repr;

      Which(String repr) {
        this.repr = repr;
      }

      public String repr() {
        return repr;
      }
    }

    private static final ImmutableMap<Which, BasicType> INSTANCES;

    static {
      ImmutableMap.Builder<Which, BasicType> builder = ImmutableMap.builder();
      for (Which which : Which.values()) {
        builder.put(which, new BasicType(which));
      }
      INSTANCES = builder.build();
    }

    private final Which which;

    private BasicType(Which which) {
      super(Kind.BASIC);
      this.which = which;
    }

    public static BasicType of(Which which) {
      return INSTANCES.get(which);
    }

    public static Optional<BasicType> predeclared(String name) {
      for (Which which : Which.values()) {
        if (!which.name().startsWith("UNTYPED_")
            && which != Which.INVALID
            && which.repr().equals(name)) {
          return Optional.of(of(which));
        }
      }
      return Optional.empty();
    }

    public Which which() {
      return which;
    }

    public boolean isUntyped() {
      return which.name().startsWith("UNTYPED_");
    }

    public boolean isInteger() {
      switch (which) {
        case INT:
        case INT32:
        case INT64:
        case UINT:
        case UINT8:
        case UNTYPED_INT:
        case UNTYPED_RUNE:
          return true;
        default:
          return false;
      }
    }

    public boolean isNumeric() {
      return isInteger() || which == Which.FLOAT64 || which == Which.UNTYPED_FLOAT;
    }

    public boolean isString() {
      return which == Which.STRING || which == Which.UNTYPED_STRING;
    }

    public boolean isBoolean() {
      return which == Which.BOOL || which == Which.UNTYPED_BOOL;
    }

    public boolean isUnsigned() {
      return which == Which.UINT || which == Which.UINT8;
    }

    @Override
    protected boolean identicalImpl(Type other) {
      return which == ((BasicType) other).which;
    }

    public BasicType defaultType() {
      switch (which) {
        case UNTYPED_BOOL:
          return of(Which.BOOL);
        case UNTYPED_INT:
          return of(Which.INT);
        case UNTYPED_RUNE:
          return of(Which.INT32);
        case UNTYPED_FLOAT:
          return of(Which.FLOAT64);
        case UNTYPED_STRING:
          return of(Which.STRING);
        default:
          return this;
      }
    }

    @Override
    public String toString() {
      return which.repr();
    }
  }

  // A declared type. Its underlying type is set once the declaration is resolved, which allows
  // recursive and forward references. Named types compare by identity.
  public static final class NamedType extends Type {
    private final String name;
    private Type underlying = null;
    private final Map<String, Method> methods = new LinkedHashMap<>();

    public NamedType(String name) {
      super(Kind.NAMED);
      this.name = name;
    }

    public String name() {
      return name;
    }

    public boolean isResolved() {
      return underlying != null;
    }

    public void setUnderlying(Type underlying) {
      Preconditions.checkState(this.underlying == null, "%s already resolved", name);
      Verify.verify(underlying.kind() != Kind.NAMED, "underlying type must not be named");
      this.underlying = underlying;
    }

    @Override
    public Type underlying() {
      return underlying == null ? BasicType.of(BasicType.Which.INVALID) : underlying;
    }

    // Returns false if a method of that name already exists.
    public boolean addMethod(Method method) {
      return methods.putIfAbsent(method.name(), method) == null;
    }

    public Optional<Method> declaredMethod(String name) {
      return Optional.ofNullable(methods.get(name));
    }

    public ImmutableList<Method> declaredMethods() {
      return ImmutableList.copyOf(methods.values());
    }

    @Override
    protected boolean identicalImpl(Type other) {
      return false;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static final class PointerType extends Type {
    private final Type elem;

    public PointerType(Type elem) {
      super(Kind.POINTER);
      this.elem = elem;
    }

    public Type elem() {
      return elem;
    }

    @Override
    public String toString() {
      return "*" + elem;
    }

    @Override
    protected boolean identicalImpl(Type other) {
      return elem.identical(((PointerType) other).elem);
    }
  }

  public static final class SliceType extends Type {
    private final Type elem;

    public SliceType(Type elem) {
      super(Kind.SLICE);
      this.elem = elem;
    }

    public Type elem() {
      return elem;
    }

    @Override
    public String toString() {
      return "[]" + elem;
    }

    @Override
    protected boolean identicalImpl(Type other) {
      return elem.identical(((SliceType) other).elem);
    }
  }

  public static final class ArrayType extends Type {
    private final long len;
    private final Type elem;

    public ArrayType(long len, Type elem) {
      super(Kind.ARRAY);
      this.len = len;
      this.elem = elem;
    }

    public long len() {
      return len;
    }

    public Type elem() {
      return elem;
    }

    @Override
    public String toString() {
      return "[" + len + "]" + elem;
    }

    @Override
    protected boolean identicalImpl(Type other) {
      ArrayType array = (ArrayType) other;
      return len == array.len && elem.identical(array.elem);
    }
  }

  public static final class MapType extends Type {
    private final Type key;
    private final Type value;

    public MapType(Type key, Type value) {
      super(Kind.MAP);
      this.key = key;
      this.value = value;
    }

    public Type key() {
      return key;
    }

    public Type value() {
      return value;
    }

    @Override
    public String toString() {
      return "map[" + key + "]" + value;
    }

    @Override
    protected boolean identicalImpl(Type other) {
      MapType map = (MapType) other;
      return key.identical(map.key) && value.identical(map.value);
    }
  }

  public static final class StructType extends Type {
    @AutoValue
    public abstract static class StructField {
      public abstract String name();

      public abstract Type type();

      public static StructField create(String name, Type type) {
        return new AutoValue_Type_StructType_StructField(name, type);
      }
    }

    private final ImmutableList<StructField> fields;

    public StructType(List<StructField> fields) {
      super(Kind.STRUCT);
      this.fields = ImmutableList.copyOf(fields);
    }

    public ImmutableList<StructField> fields() {
      return fields;
    }

    public Optional<StructField> field(String name) {
      return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    @Override
    public String toString() {
      return fields
          .stream()
          .map(f -> f.name() + " " + f.type())
          .collect(Collectors.joining("; ", "struct{", "}"));
    }

    @Override
    protected boolean identicalImpl(Type other) {
      ImmutableList<StructField> otherFields = ((StructType) other).fields;
      if (fields.size() != otherFields.size()) return false;
      for (int i = 0; i < fields.size(); i++) {
        if (!fields.get(i).name().equals(otherFields.get(i).name())
            || !fields.get(i).type().identical(otherFields.get(i).type())) {
          return false;
        }
      }
      return true;
    }
  }

  public static final class InterfaceType extends Type {
    private final ImmutableList<Method> methods;

    public InterfaceType(List<Method> methods) {
      super(Kind.INTERFACE);
      this.methods = ImmutableList.copyOf(methods);
    }

    public ImmutableList<Method> methods() {
      return methods;
    }

    public Optional<Method> method(String name) {
      return methods.stream().filter(m -> m.name().equals(name)).findFirst();
    }

    @Override
    public String toString() {
      return methods
          .stream()
          .map(m -> m.name() + m.signature().toString().substring("func".length()))
          .collect(Collectors.joining("; ", "interface{", "}"));
    }

    // Method order does not matter.
    @Override
    protected boolean identicalImpl(Type other) {
      InterfaceType iface = (InterfaceType) other;
      if (methods.size() != iface.methods.size()) return false;
      for (Method method : methods) {
        Optional<Method> match = iface.method(method.name());
        if (!match.isPresent() || !method.signature().identical(match.get().signature())) {
          return false;
        }
      }
      return true;
    }
  }

  public static final class SignatureType extends Type {
    private final ImmutableList<Type> params;
    private final ImmutableList<Type> results;
    private final boolean variadic;

    public SignatureType(List<Type> params, List<Type> results, boolean variadic) {
      super(Kind.SIGNATURE);
      this.params = ImmutableList.copyOf(params);
      this.results = ImmutableList.copyOf(results);
      this.variadic = variadic;
    }

    public ImmutableList<Type> params() {
      return params;
    }

    public ImmutableList<Type> results() {
      return results;
    }

    public boolean variadic() {
      return variadic;
    }

    @Override
    public String toString() {
      String paramString =
          params.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"));
      if (variadic) {
        paramString = paramString.replaceFirst("\\[\\]([^,]*)\\)$", "...$1)");
      }
      switch (results.size()) {
        case 0:
          return "func" + paramString;
        case 1:
          return "func" + paramString + " " + results.get(0);
        default:
          return "func"
              + paramString
              + results.stream().map(Type::toString).collect(Collectors.joining(", ", " (", ")"));
      }
    }

    @Override
    protected boolean identicalImpl(Type other) {
      SignatureType sig = (SignatureType) other;
      return variadic == sig.variadic
          && identical(params, sig.params)
          && identical(results, sig.results);
    }
  }

  // The result list of a call returning zero or several values.
  public static final class TupleType extends Type {
    private final ImmutableList<Type> types;

    public TupleType(List<Type> types) {
      super(Kind.TUPLE);
      this.types = ImmutableList.copyOf(types);
    }

    public ImmutableList<Type> types() {
      return types;
    }

    @Override
    public String toString() {
      return types.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    protected boolean identicalImpl(Type other) {
      return identical(types, ((TupleType) other).types);
    }
  }
}
