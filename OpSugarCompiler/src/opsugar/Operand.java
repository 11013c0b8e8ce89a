package opsugar;

import java.util.OptionalLong;

final class Operand {
  enum Mode {
    INVALID,
    NO_VALUE,
    BUILTIN,
    TYPE,
    CONSTANT,
    VARIABLE,
    MAP_INDEX,
    VALUE;
  }

  private static final Operand INVALID =
      new Operand(Mode.INVALID, null, Type.BasicType.of(Type.BasicType.Which.INVALID));

  private final Mode mode;
  private final Ast.Expr expr;
  private final Type type;
  private OptionalLong constValue = OptionalLong.empty();
  private Builtin builtin = null;

  private Operand(Mode mode, Ast.Expr expr, Type type) {
    this.mode = mode;
    this.expr = expr;
    this.type = type;
  }

  static Operand invalid() {
    return INVALID;
  }

  static Operand of(Mode mode, Ast.Expr expr, Type type) {
    return new Operand(mode, expr, type);
  }

  static Operand constant(Ast.Expr expr, Type type, OptionalLong value) {
    Operand operand = new Operand(Mode.CONSTANT, expr, type);
    operand.constValue = value;
    return operand;
  }

  static Operand builtin(Ast.Expr expr, Builtin builtin) {
    Operand operand =
        new Operand(Mode.BUILTIN, expr, Type.BasicType.of(Type.BasicType.Which.INVALID));
    operand.builtin = builtin;
    return operand;
  }

  Mode mode() {
    return mode;
  }

  Ast.Expr expr() {
    return expr;
  }

  Type type() {
    return type;
  }

  OptionalLong constValue() {
    return constValue;
  }

  Builtin builtin() {
    return builtin;
  }

  boolean isInvalid() {
    return mode == Mode.INVALID;
  }

  boolean isValue() {
    switch (mode) {
      case CONSTANT:
      case VARIABLE:
      case MAP_INDEX:
      case VALUE:
        return true;
      default:
        return false;
    }
  }

  boolean isUntyped() {
    return type.kind() == Type.Kind.BASIC && type.<Type.BasicType>cast().isUntyped();
  }

  boolean isNil() {
    return type.isBasic(Type.BasicType.Which.UNTYPED_NIL);
  }

  Operand withType(Type type) {
    Operand operand = new Operand(mode, expr, type);
    operand.constValue = constValue;
    operand.builtin = builtin;
    return operand;
  }

  Operand withExpr(Ast.Expr expr) {
    Operand operand = new Operand(mode, expr, type);
    operand.constValue = constValue;
    operand.builtin = builtin;
    return operand;
  }

  Operand asValue() {
    if (mode != Mode.VARIABLE && mode != Mode.MAP_INDEX) return this;
    return new Operand(Mode.VALUE, expr, type);
  }

  // Go's operand description, e.g. a (variable of type Point).
  @Override
  public String toString() {
    if (isNil()) return "nil";

    String source = SourcePrinter.print(expr);
    switch (mode) {
      case INVALID:
        return source + " (invalid operand)";
      case NO_VALUE:
        return source + " (no value)";
      case BUILTIN:
        return source + " (built-in)";
      case TYPE:
        return source + " (type)";
      case CONSTANT:
        if (isUntyped()) return source + " (" + type + " constant)";
        return source + " (constant of type " + type + ")";
      case VARIABLE:
        return source + " (variable of type " + type + ")";
      case MAP_INDEX:
        return source + " (map index expression of type " + type + ")";
      default:
        return source + " (value of type " + type + ")";
    }
  }
}
