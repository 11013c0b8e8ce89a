package opsugar;

import java.util.Optional;

import opsugar.Type.BasicType;

final class Types {

  private Types() {}

  // A named type's method set holds its value-receiver methods, a pointer's those of both receiver
  // kinds. Addressable operands of named type may also call pointer-receiver methods.
  static Optional<Method> lookupMethod(Type type, String name, boolean addressable) {
    switch (type.kind()) {
      case POINTER:
        {
          Type elem = type.<Type.PointerType>cast().elem();
          if (!elem.isNamed() || elem.isInterface()) return Optional.empty();
          return elem.<Type.NamedType>cast().declaredMethod(name);
        }
      case NAMED:
        {
          Type.NamedType named = type.cast();
          if (named.isInterface()) {
            return named
                .underlying()
                .<Type.InterfaceType>cast()
                .method(name)
                .map(m -> Method.create(m.name(), m.signature(), false, named.name()));
          }
          return named.declaredMethod(name).filter(m -> addressable || !m.pointerReceiver());
        }
      case INTERFACE:
        return type.<Type.InterfaceType>cast().method(name);
      default:
        return Optional.empty();
    }
  }

  static Optional<String> missingMethod(Type type, Type iface) {
    for (Method wanted : iface.underlying().<Type.InterfaceType>cast().methods()) {
      Optional<Method> found = lookupMethod(type, wanted.name(), false);
      if (!found.isPresent()) {
        if (lookupMethod(type, wanted.name(), true).isPresent()) {
          return Optional.of(String.format("method %s has pointer receiver", wanted.name()));
        }
        return Optional.of(String.format("missing method %s", wanted.name()));
      }
      if (!found.get().signature().identical(wanted.signature())) {
        return Optional.of(String.format("wrong type for method %s", wanted.name()));
      }
    }
    return Optional.empty();
  }

  static boolean hasNil(Type type) {
    switch (type.underlying().kind()) {
      case POINTER:
      case SLICE:
      case MAP:
      case INTERFACE:
      case SIGNATURE:
        return true;
      default:
        return false;
    }
  }

  static boolean untypedCompatible(BasicType from, Type target) {
    if (from.which() == BasicType.Which.UNTYPED_NIL) return hasNil(target);

    Type u = target.underlying();
    if (u.kind() == Type.Kind.INTERFACE) {
      return u.<Type.InterfaceType>cast().methods().isEmpty();
    }
    if (u.kind() != Type.Kind.BASIC) return false;

    BasicType basic = u.cast();
    switch (from.which()) {
      case UNTYPED_BOOL:
        return basic.isBoolean();
      case UNTYPED_INT:
      case UNTYPED_RUNE:
      case UNTYPED_FLOAT:
        return basic.isNumeric();
      case UNTYPED_STRING:
        return basic.isString();
      default:
        return false;
    }
  }

  static boolean isUntyped(Type type) {
    return type.kind() == Type.Kind.BASIC && type.<BasicType>cast().isUntyped();
  }

  static boolean assignable(Type from, Type to) {
    if (isInvalid(from) || isInvalid(to)) return true;
    if (isUntyped(from)) return untypedCompatible(from.cast(), to);
    if (from.identical(to)) return true;
    if ((!from.isNamed() || !to.isNamed()) && from.underlying().identical(to.underlying())) {
      return true;
    }
    return to.isInterface() && !missingMethod(from, to).isPresent();
  }

  static boolean convertible(Type from, Type to) {
    if (assignable(from, to)) return true;

    Type fromU = from.underlying();
    Type toU = to.underlying();
    if (fromU.identical(toU)) return true;
    if (from.kind() == Type.Kind.POINTER
        && to.kind() == Type.Kind.POINTER
        && from.<Type.PointerType>cast()
            .elem()
            .underlying()
            .identical(to.<Type.PointerType>cast().elem().underlying())) {
      return true;
    }
    if (isNumeric(fromU) && isNumeric(toU)) return true;
    if (isInteger(fromU) && isString(toU)) return true;
    if (isString(fromU) && isByteOrRuneSlice(toU)) return true;
    return isByteOrRuneSlice(fromU) && isString(toU);
  }

  static boolean comparable(Type type) {
    Type u = type.underlying();
    switch (u.kind()) {
      case BASIC:
        return !u.isBasic(BasicType.Which.UNTYPED_NIL);
      case POINTER:
      case INTERFACE:
        return true;
      case STRUCT:
        return u.<Type.StructType>cast()
            .fields()
            .stream()
            .allMatch(f -> comparable(f.type()));
      case ARRAY:
        return comparable(u.<Type.ArrayType>cast().elem());
      default:
        return false;
    }
  }

  static boolean ordered(Type type) {
    return isNumeric(type) || isString(type);
  }

  static boolean isInvalid(Type type) {
    return type.isBasic(BasicType.Which.INVALID);
  }

  static boolean isNumeric(Type type) {
    return type.isBasic() && type.underlying().<BasicType>cast().isNumeric();
  }

  static boolean isInteger(Type type) {
    return type.isBasic() && type.underlying().<BasicType>cast().isInteger();
  }

  static boolean isString(Type type) {
    return type.isBasic() && type.underlying().<BasicType>cast().isString();
  }

  static boolean isBoolean(Type type) {
    return type.isBasic() && type.underlying().<BasicType>cast().isBoolean();
  }

  private static boolean isByteOrRuneSlice(Type type) {
    return type.kind() == Type.Kind.SLICE
        && type.<Type.SliceType>cast()
            .elem()
            .isBasic(BasicType.Which.UINT8, BasicType.Which.INT32);
  }

  static Type defaultType(Type type) {
    return isUntyped(type) ? type.<BasicType>cast().defaultType() : type;
  }

  // Ordering of untyped numeric kinds for mixed constant expressions.
  private static int untypedRank(BasicType.Which which) {
    switch (which) {
      case UNTYPED_INT:
        return 1;
      case UNTYPED_RUNE:
        return 2;
      case UNTYPED_FLOAT:
        return 3;
      default:
        return 0;
    }
  }

  // The kind of an expression combining two untyped numeric constants.
  static BasicType widerUntyped(BasicType x, BasicType y) {
    return untypedRank(y.which()) > untypedRank(x.which()) ? y : x;
  }
}
