package opsugar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import opsugar.Operand.Mode;
import opsugar.Type.BasicType;

// Errors are collected and checking continues past them. Operands that are already invalid report
// nothing further.
final class TypeChecker extends ErrorCollectingValidator {

  private static final Type INVALID = BasicType.of(BasicType.Which.INVALID);
  private static final Type UNTYPED_BOOL = BasicType.of(BasicType.Which.UNTYPED_BOOL);
  private static final Type INT = BasicType.of(BasicType.Which.INT);

  private static final class FunctionContext {
    private final Type.SignatureType signature;
    private final boolean namedResults;

    private FunctionContext(Type.SignatureType signature, boolean namedResults) {
      this.signature = signature;
      this.namedResults = namedResults;
    }
  }

  private final TypeBinding.Builder binding = TypeBinding.builder();
  private final Scope packageScope = Scope.universe().child();

  private final Map<Type.NamedType, Ast.TypeSpec> pendingTypes = new HashMap<>();
  private final Set<Type.NamedType> resolving = new HashSet<>();
  private final Map<Ast.FuncDecl, Type.SignatureType> signatures = new IdentityHashMap<>();
  private final Map<Ast.FuncDecl, Type> receiverTypes = new IdentityHashMap<>();

  // Calls that may stand alone as statements.
  private final Set<Ast.CallExpr> statementCalls =
      Collections.newSetFromMap(new IdentityHashMap<>());

  private Scope scope = packageScope;
  private FunctionContext function = null;
  private int loopDepth = 0;

  private TypeChecker() {}

  static Resolution check(Ast.File file) {
    TypeChecker checker = new TypeChecker();
    checker.checkFile(file);
    return Resolution.create(checker.errors(), checker.binding.build());
  }

  private void checkFile(Ast.File file) {
    DeclarationCollector decls = DeclarationCollector.collect(file);
    takeErrors(decls);

    // Types first, so that everything else may refer to any of them.
    List<Type.NamedType> declared = new ArrayList<>();
    for (Ast.TypeSpec spec : decls.typeSpecs()) {
      Type.NamedType type = new Type.NamedType(spec.name().name());
      if (declare(Scope.Entity.typeName(spec.name().name(), type, spec), spec.name())) {
        pendingTypes.put(type, spec);
        declared.add(type);
      }
    }
    declared.forEach(this::resolveNamed);

    decls.methods().forEach(this::declareMethod);
    for (Ast.FuncDecl func : decls.funcs()) {
      Type.SignatureType signature = signature(func.type());
      signatures.put(func, signature);
      if (func.name().name().equals("init") || func.name().name().equals("_")) continue;
      declare(Scope.Entity.func(func.name().name(), signature, func), func.name());
    }

    for (int i = 0; i < decls.valueSpecs().size(); i++) {
      valueSpec(decls.valueSpecs().get(i), decls.valueTokens().get(i));
    }

    for (Ast.Decl decl : file.decls()) {
      if (decl.kind() != Ast.Kind.FUNC_DECL) continue;

      Ast.FuncDecl funcDecl = decl.cast();
      if (funcDecl.body() == null) {
        logError(funcDecl.name(), "missing function body");
        continue;
      }
      checkFunction(
          funcDecl.recv(),
          receiverTypes.getOrDefault(funcDecl, INVALID),
          funcDecl.type(),
          signatures.get(funcDecl),
          funcDecl.body());
    }
  }

  // Declarations

  private boolean declare(Scope.Entity entity, Ast.Ident ident) {
    if (scope.declare(entity).isPresent()) {
      logError(ident, "%s redeclared in this block", ident.name());
      return false;
    }
    return true;
  }

  private void resolveNamed(Type.NamedType type) {
    if (type.isResolved()) return;

    Ast.TypeSpec spec = pendingTypes.get(type);
    if (spec == null) return;
    if (!resolving.add(type)) {
      logError(spec.name(), "invalid recursive type %s", type.name());
      return;
    }

    Type underlying = typeExpr(spec.type());
    if (underlying.isNamed()) {
      resolveNamed(underlying.cast());
      underlying = underlying.underlying();
    }
    resolving.remove(type);
    if (!type.isResolved()) type.setUnderlying(underlying);
  }

  private void declareMethod(Ast.FuncDecl decl) {
    Type.SignatureType signature = signature(decl.type());
    signatures.put(decl, signature);

    List<Ast.Field> recv = decl.recv().list();
    if (recv.size() != 1 || recv.get(0).names().size() > 1) {
      logError(decl.name(), "method has %s receivers", recv.isEmpty() ? "no" : "multiple");
      return;
    }

    Ast.Expr recvExpr = unparen(recv.get(0).type());
    boolean pointer = recvExpr.kind() == Ast.Kind.STAR_EXPR;
    if (pointer) recvExpr = unparen(recvExpr.<Ast.StarExpr>cast().x());

    Type base = typeExpr(recvExpr);
    if (Types.isInvalid(base) && !base.isNamed()) return;
    if (!base.isNamed() || !pendingTypes.containsKey(base)) {
      logError(recvExpr, "cannot define new methods on non-local type %s", base);
      return;
    }

    Type.NamedType named = base.cast();
    Type recvType = pointer ? new Type.PointerType(named) : named;
    binding.bind(recv.get(0).type(), recvType);
    receiverTypes.put(decl, recvType);
    if (named.isInterface() || named.underlying().isPointer()) {
      logError(recvExpr, "invalid receiver type %s", named);
      return;
    }

    String name = decl.name().name();
    if (name.equals("_")) return;
    if (named.underlying().kind() == Type.Kind.STRUCT
        && named.underlying().<Type.StructType>cast().field(name).isPresent()) {
      logError(decl.name(), "field and method with the same name %s", name);
      return;
    }
    if (!named.addMethod(Method.create(name, signature, pointer, named.name()))) {
      logError(decl.name(), "method %s.%s already declared", named, name);
    }
  }

  private void valueSpec(Ast.ValueSpec spec, Token tok) {
    Type declared = spec.type() == null ? null : typeExpr(spec.type());
    List<Ast.Ident> names = spec.names();
    if (spec.values().isEmpty()) {
      if (tok == Token.CONST) {
        logError(spec, "missing init expr for const declaration");
      } else if (declared == null) {
        logError(spec, "missing type or init expr");
      }
      for (Ast.Ident name : names) {
        declareVar(name, declared == null ? INVALID : declared);
      }
      return;
    }

    List<Operand> values = rhsOperands(spec.values(), names.size(), spec);
    for (int i = 0; i < names.size(); i++) {
      Ast.Ident name = names.get(i);
      Operand x = values.get(i);
      String context = tok == Token.CONST ? "constant declaration" : "variable declaration";

      Type type;
      if (declared != null) {
        assignTo(x, declared, context);
        type = declared;
      } else if (x.isInvalid()) {
        type = INVALID;
      } else if (x.isNil()) {
        logError(x.expr(), "use of untyped nil in %s", context);
        type = INVALID;
      } else {
        type = tok == Token.CONST ? x.type() : Types.defaultType(x.type());
      }

      if (tok == Token.CONST) {
        if (!x.isInvalid() && x.mode() != Mode.CONSTANT) {
          logError(x.expr(), "%s is not constant", x);
        }
        binding.bind(name, type);
        declare(Scope.Entity.constant(name.name(), type, x.constValue(), name), name);
      } else {
        declareVar(name, type);
      }
    }
  }

  private void declareVar(Ast.Ident name, Type type) {
    if (!Types.isInvalid(type)) binding.bind(name, type);
    declare(Scope.Entity.var(name.name(), type, name), name);
  }

  private void localTypeSpec(Ast.TypeSpec spec) {
    Type.NamedType type = new Type.NamedType(spec.name().name());
    if (declare(Scope.Entity.typeName(spec.name().name(), type, spec), spec.name())) {
      pendingTypes.put(type, spec);
      resolveNamed(type);
    }
  }

  // Type expressions

  private Type typeExpr(Ast.Expr expr) {
    Type type = typeExprImpl(expr);
    if (type != INVALID) binding.bind(expr, type);
    return type;
  }

  private Type typeExprImpl(Ast.Expr expr) {
    switch (expr.kind()) {
      case IDENT:
        {
          Ast.Ident ident = expr.cast();
          Optional<Scope.Entity> entity = scope.lookup(ident.name());
          if (!entity.isPresent()) {
            logError(ident, "undefined: %s", ident.name());
            return INVALID;
          }
          if (entity.get().kind() != Scope.Entity.Kind.TYPE) {
            logError(ident, "%s is not a type", ident.name());
            return INVALID;
          }
          return entity.get().type();
        }
      case PAREN_EXPR:
        return typeExpr(expr.<Ast.ParenExpr>cast().x());
      case STAR_EXPR:
        return new Type.PointerType(typeExpr(expr.<Ast.StarExpr>cast().x()));
      case ARRAY_TYPE:
        {
          Ast.ArrayType arrayType = expr.cast();
          if (arrayType.len() == null) return new Type.SliceType(typeExpr(arrayType.elt()));
          if (arrayType.len().kind() == Ast.Kind.ELLIPSIS) {
            logError(arrayType, "invalid use of [...] array (outside a composite literal)");
            return INVALID;
          }

          Operand len = expr(arrayType.len());
          Type elem = typeExpr(arrayType.elt());
          if (len.isInvalid()) return INVALID;
          if (len.mode() != Mode.CONSTANT
              || !Types.isInteger(len.type())
              || !len.constValue().isPresent()) {
            logError(arrayType.len(), "array length %s must be constant", len);
            return INVALID;
          }
          if (len.constValue().getAsLong() < 0) {
            logError(arrayType.len(), "invalid array length %s", len);
            return INVALID;
          }
          return new Type.ArrayType(len.constValue().getAsLong(), elem);
        }
      case MAP_TYPE:
        {
          Ast.MapType mapType = expr.cast();
          Type key = typeExpr(mapType.key());
          Type value = typeExpr(mapType.value());
          if (!Types.isInvalid(key) && !Types.comparable(key)) {
            logError(mapType.key(), "invalid map key type %s", key);
          }
          return new Type.MapType(key, value);
        }
      case STRUCT_TYPE:
        return structType(expr.cast());
      case INTERFACE_TYPE:
        return interfaceType(expr.cast());
      case FUNC_TYPE:
        return signature(expr.cast());
      case CHAN_TYPE:
        logError(expr, "channel types are not supported");
        return INVALID;
      case SELECTOR_EXPR:
        logError(expr, "undefined: %s", SourcePrinter.print(expr));
        return INVALID;
      default:
        logError(expr, "%s is not a type", SourcePrinter.print(expr));
        return INVALID;
    }
  }

  private Type structType(Ast.StructType structType) {
    List<Type.StructType.StructField> fields = new ArrayList<>();
    Set<String> names = new HashSet<>();
    if (structType.fields() != null) {
      for (Ast.Field field : structType.fields().list()) {
        Type type = typeExpr(field.type());
        if (field.names().isEmpty()) {
          logError(field, "embedded fields are not supported");
          continue;
        }
        for (Ast.Ident name : field.names()) {
          if (!name.name().equals("_") && !names.add(name.name())) {
            logError(name, "%s redeclared", name.name());
          }
          fields.add(Type.StructType.StructField.create(name.name(), type));
        }
      }
    }
    return new Type.StructType(fields);
  }

  private Type interfaceType(Ast.InterfaceType interfaceType) {
    List<Method> methods = new ArrayList<>();
    Set<String> names = new HashSet<>();
    if (interfaceType.methods() != null) {
      for (Ast.Field field : interfaceType.methods().list()) {
        if (field.names().isEmpty() || field.type().kind() != Ast.Kind.FUNC_TYPE) {
          logError(field, "embedded interfaces are not supported");
          continue;
        }

        Type.SignatureType signature = signature(field.type().cast());
        binding.bind(field.type(), signature);
        for (Ast.Ident name : field.names()) {
          if (!names.add(name.name())) {
            logError(name, "duplicate method %s", name.name());
            continue;
          }
          methods.add(Method.create(name.name(), signature, false, "interface"));
        }
      }
    }
    return new Type.InterfaceType(methods);
  }

  private Type.SignatureType signature(Ast.FuncType funcType) {
    List<Type> params = new ArrayList<>();
    boolean variadic = false;
    if (funcType.params() != null) {
      List<Ast.Field> fields = funcType.params().list();
      for (int i = 0; i < fields.size(); i++) {
        Ast.Field field = fields.get(i);
        Type type;
        if (field.type().kind() == Ast.Kind.ELLIPSIS) {
          if (i == fields.size() - 1 && field.names().size() <= 1) {
            variadic = true;
          } else {
            logError(field, "can only use ... with final parameter in list");
          }
          type = new Type.SliceType(typeExpr(field.type().<Ast.Ellipsis>cast().elt()));
        } else {
          type = typeExpr(field.type());
        }
        for (int n = 0; n < Math.max(1, field.names().size()); n++) {
          params.add(type);
        }
      }
    }

    List<Type> results = new ArrayList<>();
    if (funcType.results() != null) {
      for (Ast.Field field : funcType.results().list()) {
        Type type = typeExpr(field.type());
        for (int n = 0; n < Math.max(1, field.names().size()); n++) {
          results.add(type);
        }
      }
    }
    return new Type.SignatureType(params, results, variadic);
  }

  // Functions

  private void checkFunction(
      Ast.FieldList recv,
      Type recvType,
      Ast.FuncType funcType,
      Type.SignatureType signature,
      Ast.BlockStmt body) {
    Scope savedScope = scope;
    FunctionContext savedFunction = function;
    int savedLoopDepth = loopDepth;

    scope = scope.functionChild();
    loopDepth = 0;
    if (recv != null && recv.list().size() == 1) {
      for (Ast.Ident name : recv.list().get(0).names()) {
        declareParam(name, recvType);
      }
    }

    int index = 0;
    if (funcType.params() != null) {
      for (Ast.Field field : funcType.params().list()) {
        for (Ast.Ident name : field.names()) {
          declareParam(name, signature.params().get(index++));
        }
        if (field.names().isEmpty()) index++;
      }
    }

    boolean namedResults = false;
    index = 0;
    if (funcType.results() != null) {
      for (Ast.Field field : funcType.results().list()) {
        for (Ast.Ident name : field.names()) {
          declareParam(name, signature.results().get(index++));
          namedResults = true;
        }
        if (field.names().isEmpty()) index++;
      }
    }

    function = new FunctionContext(signature, namedResults);
    stmt(body);
    if (!signature.results().isEmpty() && !isTerminating(body)) {
      logError(body, "missing return");
    }

    scope = savedScope;
    function = savedFunction;
    loopDepth = savedLoopDepth;
  }

  private void declareParam(Ast.Ident name, Type type) {
    declareVar(name, type);
    scope.lookupLocal(name.name()).ifPresent(Scope.Entity::markUsed);
  }

  private static boolean isTerminating(Ast.Stmt stmt) {
    if (stmt == null) return false;

    switch (stmt.kind()) {
      case RETURN_STMT:
        return true;
      case BRANCH_STMT:
        return stmt.<Ast.BranchStmt>cast().tok() == Token.GOTO;
      case EXPR_STMT:
        {
          Ast.Expr x = unparen(stmt.<Ast.ExprStmt>cast().x());
          if (x.kind() != Ast.Kind.CALL_EXPR) return false;
          Ast.Expr fun = unparen(x.<Ast.CallExpr>cast().fun());
          return fun.kind() == Ast.Kind.IDENT && fun.<Ast.Ident>cast().name().equals("panic");
        }
      case BLOCK_STMT:
        {
          List<Ast.Stmt> list = stmt.<Ast.BlockStmt>cast().list();
          return !list.isEmpty() && isTerminating(list.get(list.size() - 1));
        }
      case IF_STMT:
        {
          Ast.IfStmt ifStmt = stmt.cast();
          return ifStmt.els() != null
              && isTerminating(ifStmt.body())
              && isTerminating(ifStmt.els());
        }
      case FOR_STMT:
        {
          Ast.ForStmt forStmt = stmt.cast();
          return forStmt.cond() == null && !hasBreak(forStmt.body());
        }
      case LABELED_STMT:
        return isTerminating(stmt.<Ast.LabeledStmt>cast().stmt());
      default:
        return false;
    }
  }

  // Finds a break leaving the loop whose body is given.
  private static boolean hasBreak(Ast.BlockStmt body) {
    boolean[] found = {false};
    SyntaxTree.apply(
        body,
        (locator, node) -> {
          if (node == null) return false;
          switch (node.kind()) {
            case FOR_STMT:
            case RANGE_STMT:
            case SWITCH_STMT:
            case TYPE_SWITCH_STMT:
            case SELECT_STMT:
            case FUNC_LIT:
              return false;
            case BRANCH_STMT:
              if (node.<Ast.BranchStmt>cast().tok() == Token.BREAK) found[0] = true;
              return false;
            default:
              return true;
          }
        },
        null);
    return found[0];
  }

  // Statements

  private void stmt(Ast.Stmt stmt) {
    if (stmt != null) stmt.accept(this, null);
  }

  private void openScope() {
    scope = scope.child();
  }

  private void closeScope() {
    for (Scope.Entity entity : scope.unusedVariables()) {
      entity.decl().ifPresent(decl -> logError(decl, "declared and not used: %s", entity.name()));
    }
    scope = scope.parent();
  }

  private void unsupported(Ast.Stmt stmt, String what) {
    logError(stmt, "%s are not supported", what);
  }

  @Override
  public void visitImpl(Ast.BlockStmt block) {
    openScope();
    block.list().forEach(this::stmt);
    closeScope();
  }

  @Override
  public void visitImpl(Ast.EmptyStmt stmt) {}

  @Override
  public void visitImpl(Ast.ExprStmt stmt) {
    Operand x = expr(stmt.x());
    if (x.isInvalid()) return;

    Ast.Expr call = unparen(stmt.x());
    if (call.kind() == Ast.Kind.CALL_EXPR && statementCalls.contains(call)) return;
    logError(stmt.x(), "%s is not used", x);
  }

  @Override
  public void visitImpl(Ast.DeclStmt stmt) {
    stmt.decl().accept(this, null);
  }

  @Override
  public void visitImpl(Ast.GenDecl decl) {
    for (Ast.Spec spec : decl.specs()) {
      switch (spec.kind()) {
        case TYPE_SPEC:
          localTypeSpec(spec.cast());
          break;
        case VALUE_SPEC:
          valueSpec(spec.cast(), decl.tok());
          break;
        default:
          logError(spec, "imports are not supported");
          break;
      }
    }
  }

  @Override
  public void visitImpl(Ast.IncDecStmt stmt) {
    Operand x = target(stmt.x());
    if (x.isInvalid() || !checkAssignable(x)) return;
    if (!Types.isNumeric(x.type())) {
      logError(
          stmt, "invalid operation: %s%s (non-numeric type %s)", x.expr(), stmt.tok(), x.type());
    }
  }

  @Override
  public void visitImpl(Ast.AssignStmt stmt) {
    switch (stmt.tok()) {
      case DEFINE:
        define(stmt);
        break;
      case ASSIGN:
        assign(stmt);
        break;
      default:
        compoundAssign(stmt);
        break;
    }
  }

  private void define(Ast.AssignStmt stmt) {
    List<Ast.Ident> names = new ArrayList<>();
    boolean anyNew = false;
    for (Ast.Expr lhs : stmt.lhs()) {
      if (lhs.kind() != Ast.Kind.IDENT) {
        logError(lhs, "non-name %s on left side of :=", SourcePrinter.print(lhs));
        names.add(null);
        continue;
      }

      Ast.Ident name = lhs.cast();
      names.add(name);
      if (!name.name().equals("_") && !scope.lookupLocal(name.name()).isPresent()) {
        anyNew = true;
      }
    }
    if (!anyNew) logError(stmt, "no new variables on left side of :=");

    List<Operand> values = rhsOperands(stmt.rhs(), names.size(), stmt);
    List<Runnable> declarations = new ArrayList<>();
    for (int i = 0; i < names.size(); i++) {
      Ast.Ident name = names.get(i);
      Operand x = values.get(i);
      if (name == null) continue;

      if (name.name().equals("_")) {
        if (x.isNil()) logError(x.expr(), "use of untyped nil in assignment");
        continue;
      }

      Optional<Scope.Entity> existing = scope.lookupLocal(name.name());
      if (existing.isPresent()) {
        if (existing.get().kind() != Scope.Entity.Kind.VAR) {
          logError(name, "cannot assign to %s", name.name());
        } else {
          binding.bind(name, existing.get().type());
          assignTo(x, existing.get().type(), "assignment");
        }
        continue;
      }

      Type type;
      if (x.isInvalid()) {
        type = INVALID;
      } else if (x.isNil()) {
        logError(x.expr(), "use of untyped nil in assignment");
        type = INVALID;
      } else {
        type = Types.defaultType(x.type());
        if (Types.isUntyped(x.type())) binding.bind(x.expr(), type);
      }
      declarations.add(() -> declareVar(name, type));
    }
    // The new variables are not in scope on the right-hand side.
    declarations.forEach(Runnable::run);
  }

  private void assign(Ast.AssignStmt stmt) {
    List<Type> targets = new ArrayList<>();
    for (Ast.Expr lhs : stmt.lhs()) {
      if (isBlank(lhs)) {
        targets.add(null);
        continue;
      }

      Operand x = target(lhs);
      targets.add(x.isInvalid() || !checkAssignable(x) ? INVALID : x.type());
    }

    List<Operand> values = rhsOperands(stmt.rhs(), targets.size(), stmt);
    for (int i = 0; i < targets.size(); i++) {
      Operand x = values.get(i);
      if (targets.get(i) == null) {
        if (x.isNil()) logError(x.expr(), "use of untyped nil in assignment");
        continue;
      }
      assignTo(x, targets.get(i), "assignment");
    }
  }

  private void compoundAssign(Ast.AssignStmt stmt) {
    Optional<Token> op = stmt.tok().assignedOperator();
    if (!op.isPresent()) {
      logError(stmt, "unexpected %s in assignment", stmt.tok());
      return;
    }
    if (stmt.lhs().size() != 1 || stmt.rhs().size() != 1) {
      logError(stmt, "assignment operation %s requires single-valued expressions", stmt.tok());
      return;
    }

    Operand x = target(stmt.lhs().get(0));
    Operand y = singleValue(stmt.rhs().get(0));
    if (x.isInvalid() || !checkAssignable(x)) return;
    binaryOperation(stmt, null, x.asValue(), op.get(), y);
  }

  private static boolean isBlank(Ast.Expr expr) {
    return expr.kind() == Ast.Kind.IDENT && expr.<Ast.Ident>cast().name().equals("_");
  }

  // An assignment target. A variable assigned to is not thereby used.
  private Operand target(Ast.Expr expr) {
    Ast.Expr inner = unparen(expr);
    if (inner.kind() == Ast.Kind.IDENT) {
      Optional<Scope.Entity> entity = scope.lookup(inner.<Ast.Ident>cast().name());
      if (entity.isPresent() && entity.get().kind() == Scope.Entity.Kind.VAR) {
        Operand x = Operand.of(Mode.VARIABLE, expr, entity.get().type());
        bind(x);
        if (inner != expr) binding.bind(inner, x.type());
        return x;
      }
    }
    return expr(expr);
  }

  private boolean checkAssignable(Operand x) {
    if (x.mode() == Mode.VARIABLE || x.mode() == Mode.MAP_INDEX) return true;

    logError(
        x.expr(),
        "cannot assign to %s (neither addressable nor a map index expression)",
        SourcePrinter.print(x.expr()));
    return false;
  }

  @Override
  public void visitImpl(Ast.ReturnStmt stmt) {
    List<Type> results = function.signature.results();
    if (stmt.results().isEmpty()) {
      if (!results.isEmpty() && !function.namedResults) {
        logError(stmt, "not enough return values");
      }
      return;
    }

    List<Operand> values = operands(stmt.results());
    if (values.size() != results.size()) {
      logError(
          stmt,
          values.size() < results.size() ? "not enough return values" : "too many return values");
      return;
    }
    for (int i = 0; i < values.size(); i++) {
      assignTo(values.get(i), results.get(i), "return statement");
    }
  }

  @Override
  public void visitImpl(Ast.BranchStmt stmt) {
    if (stmt.label() != null) {
      unsupported(stmt, "labels");
      return;
    }
    switch (stmt.tok()) {
      case BREAK:
        if (loopDepth == 0) logError(stmt, "break is not in a loop, switch, or select");
        break;
      case CONTINUE:
        if (loopDepth == 0) logError(stmt, "continue is not in a loop");
        break;
      default:
        unsupported(stmt, stmt.tok() + " statements");
        break;
    }
  }

  @Override
  public void visitImpl(Ast.IfStmt stmt) {
    openScope();
    stmt(stmt.init());
    condition(stmt.cond(), "if statement");
    stmt(stmt.body());
    stmt(stmt.els());
    closeScope();
  }

  @Override
  public void visitImpl(Ast.ForStmt stmt) {
    openScope();
    stmt(stmt.init());
    if (stmt.cond() != null) condition(stmt.cond(), "for statement");
    if (stmt.post() != null
        && stmt.post().kind() == Ast.Kind.ASSIGN_STMT
        && stmt.post().<Ast.AssignStmt>cast().tok() == Token.DEFINE) {
      logError(stmt.post(), "cannot declare in post statement of for loop");
    } else {
      stmt(stmt.post());
    }
    loopBody(stmt.body());
    closeScope();
  }

  private void loopBody(Ast.BlockStmt body) {
    loopDepth++;
    stmt(body);
    loopDepth--;
  }

  private void condition(Ast.Expr cond, String where) {
    Operand x = singleValue(cond);
    if (!x.isInvalid() && !Types.isBoolean(x.type())) {
      logError(cond, "non-boolean condition in %s", where);
    }
  }

  @Override
  public void visitImpl(Ast.RangeStmt stmt) {
    Operand x = singleValue(stmt.x());
    Type key = INVALID;
    Type value = INVALID;
    boolean valueAllowed = true;
    if (!x.isInvalid()) {
      Type u = x.type().underlying();
      if (u.isPointer()
          && u.<Type.PointerType>cast().elem().underlying().kind() == Type.Kind.ARRAY) {
        u = u.<Type.PointerType>cast().elem().underlying();
      }
      switch (u.kind()) {
        case SLICE:
          key = INT;
          value = u.<Type.SliceType>cast().elem();
          break;
        case ARRAY:
          key = INT;
          value = u.<Type.ArrayType>cast().elem();
          break;
        case MAP:
          key = u.<Type.MapType>cast().key();
          value = u.<Type.MapType>cast().value();
          break;
        default:
          if (Types.isString(u)) {
            key = INT;
            value = BasicType.of(BasicType.Which.INT32);
          } else if (Types.isInteger(u)) {
            key = Types.defaultType(x.type());
            valueAllowed = false;
          } else {
            logError(stmt.x(), "cannot range over %s", x);
          }
          break;
      }
    }
    if (!valueAllowed && stmt.value() != null) {
      logError(stmt.value(), "range over %s permits only one iteration variable", x);
    }

    openScope();
    if (stmt.tok() == Token.DEFINE) {
      rangeVar(stmt.key(), key);
      rangeVar(stmt.value(), value);
    } else {
      rangeTarget(stmt.key(), key, stmt.x());
      rangeTarget(stmt.value(), value, stmt.x());
    }
    loopBody(stmt.body());
    closeScope();
  }

  private void rangeVar(Ast.Expr var, Type type) {
    if (var == null) return;
    if (var.kind() != Ast.Kind.IDENT) {
      logError(var, "non-name %s on left side of :=", SourcePrinter.print(var));
      return;
    }
    if (!isBlank(var)) declareVar(var.cast(), type);
  }

  private void rangeTarget(Ast.Expr var, Type type, Ast.Expr rangeExpr) {
    if (var == null || isBlank(var)) return;

    Operand x = target(var);
    if (x.isInvalid() || !checkAssignable(x)) return;
    assignTo(Operand.of(Mode.VALUE, rangeExpr, type), x.type(), "range");
  }

  @Override
  public void visitImpl(Ast.LabeledStmt stmt) {
    unsupported(stmt, "labels");
  }

  @Override
  public void visitImpl(Ast.GoStmt stmt) {
    unsupported(stmt, "go statements");
  }

  @Override
  public void visitImpl(Ast.DeferStmt stmt) {
    unsupported(stmt, "defer statements");
  }

  @Override
  public void visitImpl(Ast.SendStmt stmt) {
    unsupported(stmt, "channel operations");
  }

  @Override
  public void visitImpl(Ast.SwitchStmt stmt) {
    unsupported(stmt, "switch statements");
  }

  @Override
  public void visitImpl(Ast.TypeSwitchStmt stmt) {
    unsupported(stmt, "type switches");
  }

  @Override
  public void visitImpl(Ast.SelectStmt stmt) {
    unsupported(stmt, "select statements");
  }

  @Override
  public void visitImpl(Ast.BadStmt stmt) {
    logError(stmt, "invalid statement");
  }

  // Expressions

  private void bind(Operand x) {
    if (x.isValue() || x.mode() == Mode.TYPE || x.mode() == Mode.NO_VALUE) {
      binding.bind(x.expr(), x.type());
    }
  }

  private Operand expr(Ast.Expr expr) {
    Operand x = exprImpl(expr);
    bind(x);
    return x;
  }

  private Operand singleValue(Ast.Expr expr) {
    return requireValue(expr(expr));
  }

  private Operand requireValue(Operand x) {
    switch (x.mode()) {
      case INVALID:
        return x;
      case NO_VALUE:
        logError(x.expr(), "%s (no value) used as value", SourcePrinter.print(x.expr()));
        return Operand.invalid();
      case TYPE:
        logError(x.expr(), "%s (type) is not an expression", SourcePrinter.print(x.expr()));
        return Operand.invalid();
      case BUILTIN:
        logError(x.expr(), "%s (built-in) must be called", SourcePrinter.print(x.expr()));
        return Operand.invalid();
      default:
        if (x.type().kind() == Type.Kind.TUPLE) {
          logError(
              x.expr(),
              "multiple-value %s (value of type %s) in single-value context",
              SourcePrinter.print(x.expr()),
              x.type());
          return Operand.invalid();
        }
        return x;
    }
  }

  // Checks a list of values, spreading a single multi-value call.
  private List<Operand> operands(List<Ast.Expr> exprs) {
    if (exprs.size() == 1) {
      Operand x = expr(exprs.get(0));
      if (x.isValue() && x.type().kind() == Type.Kind.TUPLE) {
        List<Operand> spread = new ArrayList<>();
        for (Type type : x.type().<Type.TupleType>cast().types()) {
          spread.add(Operand.of(Mode.VALUE, exprs.get(0), type));
        }
        return spread;
      }
      return ImmutableList.of(requireValue(x));
    }

    List<Operand> operands = new ArrayList<>();
    for (Ast.Expr expr : exprs) {
      operands.add(singleValue(expr));
    }
    return operands;
  }

  // Allows comma-ok forms.
  private List<Operand> rhsOperands(List<Ast.Expr> rhs, int count, Ast.Node at) {
    List<Operand> values;
    if (count == 2 && rhs.size() == 1 && isCommaOk(rhs.get(0))) {
      Operand x = singleValue(rhs.get(0));
      if (x.isInvalid()) return Collections.nCopies(count, x);
      values = ImmutableList.of(x.asValue(), Operand.of(Mode.VALUE, rhs.get(0), UNTYPED_BOOL));
    } else {
      values = operands(rhs);
    }
    if (values.size() == count) return values;

    if (values.stream().noneMatch(Operand::isInvalid)) {
      logError(
          at,
          "assignment mismatch: %d variable%s but %d value%s",
          count,
          count == 1 ? "" : "s",
          values.size(),
          values.size() == 1 ? "" : "s");
    }
    return Collections.nCopies(count, Operand.invalid());
  }

  private static boolean isCommaOk(Ast.Expr expr) {
    Ast.Expr inner = unparen(expr);
    return inner.kind() == Ast.Kind.TYPE_ASSERT_EXPR || inner.kind() == Ast.Kind.INDEX_EXPR;
  }

  private void assignTo(Operand x, Type target, String context) {
    if (x.isInvalid() || Types.isInvalid(target)) return;

    if (Types.assignable(x.type(), target)) {
      if (x.isUntyped() && !x.isNil()) {
        binding.bind(x.expr(), target.isInterface() ? Types.defaultType(x.type()) : target);
      }
      return;
    }

    String reason = "";
    if (target.isInterface() && !x.isUntyped()) {
      Optional<String> missing = Types.missingMethod(x.type(), target);
      if (missing.isPresent()) {
        reason =
            String.format(": %s does not implement %s (%s)", x.type(), target, missing.get());
      }
    }
    logError(x.expr(), "cannot use %s as %s value in %s%s", x, target, context, reason);
  }

  private static Ast.Expr unparen(Ast.Expr expr) {
    while (expr.kind() == Ast.Kind.PAREN_EXPR) {
      expr = expr.<Ast.ParenExpr>cast().x();
    }
    return expr;
  }

  private Operand exprImpl(Ast.Expr expr) {
    switch (expr.kind()) {
      case IDENT:
        return ident(expr.cast());
      case BASIC_LIT:
        return basicLit(expr.cast());
      case PAREN_EXPR:
        return expr(expr.<Ast.ParenExpr>cast().x()).withExpr(expr);
      case FUNC_LIT:
        {
          Ast.FuncLit funcLit = expr.cast();
          Type.SignatureType signature = signature(funcLit.type());
          checkFunction(null, INVALID, funcLit.type(), signature, funcLit.body());
          return Operand.of(Mode.VALUE, expr, signature);
        }
      case COMPOSITE_LIT:
        return compositeLit(expr.cast(), null);
      case SELECTOR_EXPR:
        return selector(expr.cast());
      case INDEX_EXPR:
        return index(expr.cast());
      case SLICE_EXPR:
        return slice(expr.cast());
      case TYPE_ASSERT_EXPR:
        return typeAssert(expr.cast());
      case CALL_EXPR:
        return call(expr.cast());
      case STAR_EXPR:
        return star(expr.cast());
      case UNARY_EXPR:
        return unary(expr.cast());
      case BINARY_EXPR:
        {
          Ast.BinaryExpr binary = expr.cast();
          Operand x = singleValue(binary.x());
          Operand y = singleValue(binary.y());
          return binaryOperation(binary, binary, x, binary.op(), y);
        }
      case ARRAY_TYPE:
      case STRUCT_TYPE:
      case FUNC_TYPE:
      case INTERFACE_TYPE:
      case MAP_TYPE:
      case CHAN_TYPE:
        {
          Type type = typeExpr(expr);
          return type == INVALID ? Operand.invalid() : Operand.of(Mode.TYPE, expr, type);
        }
      case KEY_VALUE_EXPR:
        logError(expr, "unexpected key:value expression");
        return Operand.invalid();
      case ELLIPSIS:
        logError(expr, "invalid use of ...");
        return Operand.invalid();
      default:
        logError(expr, "invalid expression");
        return Operand.invalid();
    }
  }

  private Operand ident(Ast.Ident ident) {
    if (ident.name().equals("_")) {
      logError(ident, "cannot use _ as value");
      return Operand.invalid();
    }

    Optional<Scope.Entity> found = scope.lookup(ident.name());
    if (!found.isPresent()) {
      logError(ident, "undefined: %s", ident.name());
      return Operand.invalid();
    }

    Scope.Entity entity = found.get();
    entity.markUsed();
    switch (entity.kind()) {
      case TYPE:
        return Types.isInvalid(entity.type()) && !entity.type().isNamed()
            ? Operand.invalid()
            : Operand.of(Mode.TYPE, ident, entity.type());
      case VAR:
        return Types.isInvalid(entity.type())
            ? Operand.invalid()
            : Operand.of(Mode.VARIABLE, ident, entity.type());
      case CONST:
        return Types.isInvalid(entity.type())
            ? Operand.invalid()
            : Operand.constant(ident, entity.type(), entity.constValue());
      case FUNC:
        return Operand.of(Mode.VALUE, ident, entity.type());
      case BUILTIN:
        return Operand.builtin(ident, entity.builtin());
      default:
        return Operand.of(Mode.VALUE, ident, entity.type());
    }
  }

  private Operand basicLit(Ast.BasicLit lit) {
    switch (lit.litKind()) {
      case INT:
        return Operand.constant(
            lit, BasicType.of(BasicType.Which.UNTYPED_INT), parseInt(lit.value()));
      case FLOAT:
        return Operand.constant(
            lit, BasicType.of(BasicType.Which.UNTYPED_FLOAT), OptionalLong.empty());
      case CHAR:
        {
          String value = lit.value();
          OptionalLong code =
              value.length() == 3 ? OptionalLong.of(value.charAt(1)) : OptionalLong.empty();
          return Operand.constant(lit, BasicType.of(BasicType.Which.UNTYPED_RUNE), code);
        }
      case STRING:
        return Operand.constant(
            lit, BasicType.of(BasicType.Which.UNTYPED_STRING), OptionalLong.empty());
      default:
        logError(lit, "complex numbers are not supported");
        return Operand.invalid();
    }
  }

  private static OptionalLong parseInt(String literal) {
    String digits = literal.replace("_", "");
    try {
      if (digits.startsWith("0b") || digits.startsWith("0B")) {
        return OptionalLong.of(Long.parseLong(digits.substring(2), 2));
      }
      if (digits.startsWith("0o") || digits.startsWith("0O")) {
        return OptionalLong.of(Long.parseLong(digits.substring(2), 8));
      }
      return OptionalLong.of(Long.decode(digits));
    } catch (NumberFormatException ex) {
      return OptionalLong.empty();
    }
  }

  private Operand compositeLit(Ast.CompositeLit lit, Type elided) {
    Type type;
    int arrayLen = -1;
    if (lit.type() == null) {
      if (elided == null) {
        logError(lit, "invalid composite literal type: missing type");
        return Operand.invalid();
      }
      type = elided;
    } else if (lit.type().kind() == Ast.Kind.ARRAY_TYPE
        && lit.type().<Ast.ArrayType>cast().len() != null
        && lit.type().<Ast.ArrayType>cast().len().kind() == Ast.Kind.ELLIPSIS) {
      Type elem = typeExpr(lit.type().<Ast.ArrayType>cast().elt());
      type = new Type.ArrayType(elements(lit.elts(), elem, -1), elem);
      binding.bind(lit.type(), type);
      return Operand.of(Mode.VALUE, lit, type);
    } else {
      type = typeExpr(lit.type());
    }

    Type u = type.underlying();
    switch (u.kind()) {
      case STRUCT:
        structLit(lit, type, u.cast());
        break;
      case ARRAY:
        arrayLen = (int) u.<Type.ArrayType>cast().len();
        elements(lit.elts(), u.<Type.ArrayType>cast().elem(), arrayLen);
        break;
      case SLICE:
        elements(lit.elts(), u.<Type.SliceType>cast().elem(), -1);
        break;
      case MAP:
        {
          Type.MapType mapType = u.cast();
          for (Ast.Expr elt : lit.elts()) {
            if (elt.kind() != Ast.Kind.KEY_VALUE_EXPR) {
              logError(elt, "missing key in map literal");
              element(elt, mapType.value(), "map literal");
              continue;
            }
            Ast.KeyValueExpr kv = elt.cast();
            element(kv.key(), mapType.key(), "map literal");
            element(kv.value(), mapType.value(), "map literal");
          }
          break;
        }
      default:
        if (!Types.isInvalid(type)) {
          logError(lit, "invalid composite literal type %s", type);
        }
        for (Ast.Expr elt : lit.elts()) {
          expr(elt.kind() == Ast.Kind.KEY_VALUE_EXPR ? elt.<Ast.KeyValueExpr>cast().value() : elt);
        }
        return Operand.invalid();
    }
    return Operand.of(Mode.VALUE, lit, type);
  }

  private void structLit(Ast.CompositeLit lit, Type type, Type.StructType struct) {
    List<Ast.Expr> elts = lit.elts();
    if (elts.isEmpty()) return;

    boolean keyed = elts.get(0).kind() == Ast.Kind.KEY_VALUE_EXPR;
    if (keyed) {
      Set<String> seen = new HashSet<>();
      for (Ast.Expr elt : elts) {
        if (elt.kind() != Ast.Kind.KEY_VALUE_EXPR) {
          logError(elt, "mixture of field:value and value elements in struct literal");
          continue;
        }

        Ast.KeyValueExpr kv = elt.cast();
        if (kv.key().kind() != Ast.Kind.IDENT) {
          logError(
              kv.key(), "invalid field name %s in struct literal", SourcePrinter.print(kv.key()));
          expr(kv.value());
          continue;
        }

        String name = kv.key().<Ast.Ident>cast().name();
        Optional<Type.StructType.StructField> field = struct.field(name);
        if (!field.isPresent()) {
          logError(kv.key(), "unknown field %s in struct literal of type %s", name, type);
          expr(kv.value());
          continue;
        }
        if (!seen.add(name)) {
          logError(kv.key(), "duplicate field name %s in struct literal", name);
        }
        binding.bind(kv.key(), field.get().type());
        element(kv.value(), field.get().type(), "struct literal");
      }
      return;
    }

    for (int i = 0; i < elts.size(); i++) {
      Ast.Expr elt = elts.get(i);
      if (elt.kind() == Ast.Kind.KEY_VALUE_EXPR) {
        logError(elt, "mixture of field:value and value elements in struct literal");
        continue;
      }
      if (i >= struct.fields().size()) {
        logError(elt, "too many values in struct literal of type %s", type);
        return;
      }
      element(elt, struct.fields().get(i).type(), "struct literal");
    }
    if (elts.size() < struct.fields().size()) {
      logError(lit, "too few values in struct literal of type %s", type);
    }
  }

  // Returns the length the elements need.
  private int elements(List<Ast.Expr> elts, Type elem, int len) {
    int index = 0;
    int max = 0;
    for (Ast.Expr elt : elts) {
      Ast.Expr value = elt;
      if (elt.kind() == Ast.Kind.KEY_VALUE_EXPR) {
        Ast.KeyValueExpr kv = elt.cast();
        Operand key = singleValue(kv.key());
        if (!key.isInvalid()) {
          if (key.mode() == Mode.CONSTANT
              && Types.isInteger(key.type())
              && key.constValue().isPresent()) {
            index = (int) key.constValue().getAsLong();
            binding.bind(kv.key(), INT);
          } else {
            logError(kv.key(), "index %s must be integer constant", key);
          }
        }
        value = kv.value();
      }
      if (len >= 0 && index >= len) {
        logError(value, "index %d is out of bounds (>= %d)", index, len);
      }
      element(value, elem, "array or slice literal");
      index++;
      max = Math.max(max, index);
    }
    return max;
  }

  private void element(Ast.Expr value, Type type, String context) {
    if (value.kind() == Ast.Kind.COMPOSITE_LIT && value.<Ast.CompositeLit>cast().type() == null) {
      Type elided = type;
      if (type.isPointer()) elided = type.<Type.PointerType>cast().elem();
      bind(compositeLit(value.cast(), elided));
      return;
    }
    assignTo(singleValue(value), type, context);
  }

  private Operand selector(Ast.SelectorExpr selector) {
    String name = selector.sel().name();
    Operand x = expr(selector.x());
    if (x.isInvalid()) return Operand.invalid();
    if (x.mode() == Mode.TYPE) {
      logError(selector, "method expressions are not supported");
      return Operand.invalid();
    }
    x = requireValue(x);
    if (x.isInvalid()) return x;

    Type type = x.type();
    Optional<Method> method = Types.lookupMethod(type, name, x.mode() == Mode.VARIABLE);
    if (method.isPresent()) {
      return Operand.of(Mode.VALUE, selector, method.get().signature());
    }

    Type base = type;
    boolean viaPointer = false;
    if (type.underlying().isPointer()) {
      base = type.underlying().<Type.PointerType>cast().elem();
      viaPointer = true;
    }
    if (base.underlying().kind() == Type.Kind.STRUCT) {
      Optional<Type.StructType.StructField> field =
          base.underlying().<Type.StructType>cast().field(name);
      if (field.isPresent()) {
        Mode mode = viaPointer || x.mode() == Mode.VARIABLE ? Mode.VARIABLE : Mode.VALUE;
        return Operand.of(mode, selector, field.get().type());
      }
    }

    if (Types.lookupMethod(type, name, true).isPresent()) {
      logError(selector, "cannot call pointer method %s on %s", name, type);
    } else {
      logError(
          selector,
          "%s undefined (type %s has no field or method %s)",
          SourcePrinter.print(selector),
          type,
          name);
    }
    return Operand.invalid();
  }

  private Operand index(Ast.IndexExpr indexExpr) {
    Operand x = singleValue(indexExpr.x());
    List<Operand> indices = new ArrayList<>();
    for (Ast.Expr index : indexExpr.indices()) {
      indices.add(singleValue(index));
    }
    if (x.isInvalid()) return Operand.invalid();
    if (indices.size() != 1) {
      logError(indexExpr, "invalid operation: more than one index");
      return Operand.invalid();
    }

    Operand index = indices.get(0);
    Type u = x.type().underlying();
    if (u.isPointer()
        && u.<Type.PointerType>cast().elem().underlying().kind() == Type.Kind.ARRAY) {
      Type.ArrayType array = u.<Type.PointerType>cast().elem().underlying().cast();
      checkIndex(index, array.len());
      return Operand.of(Mode.VARIABLE, indexExpr, array.elem());
    }
    switch (u.kind()) {
      case SLICE:
        checkIndex(index, -1);
        return Operand.of(Mode.VARIABLE, indexExpr, u.<Type.SliceType>cast().elem());
      case ARRAY:
        checkIndex(index, u.<Type.ArrayType>cast().len());
        return Operand.of(
            x.mode() == Mode.VARIABLE ? Mode.VARIABLE : Mode.VALUE,
            indexExpr,
            u.<Type.ArrayType>cast().elem());
      case MAP:
        assignTo(index, u.<Type.MapType>cast().key(), "map index");
        return Operand.of(Mode.MAP_INDEX, indexExpr, u.<Type.MapType>cast().value());
      default:
        if (Types.isString(u)) {
          checkIndex(index, -1);
          return Operand.of(Mode.VALUE, indexExpr, BasicType.of(BasicType.Which.UINT8));
        }
        logError(indexExpr, "invalid operation: cannot index %s", x);
        return Operand.invalid();
    }
  }

  private void checkIndex(Operand index, long len) {
    if (index.isInvalid()) return;
    if (!Types.isInteger(index.type())) {
      logError(index.expr(), "invalid argument: index %s must be integer", index);
      return;
    }
    if (index.isUntyped()) binding.bind(index.expr(), INT);
    if (index.constValue().isPresent()) {
      long value = index.constValue().getAsLong();
      if (value < 0) {
        logError(index.expr(), "invalid argument: index %s must not be negative", index);
      } else if (len >= 0 && value >= len) {
        logError(index.expr(), "invalid argument: index %d out of bounds [0:%d]", value, len);
      }
    }
  }

  private Operand slice(Ast.SliceExpr sliceExpr) {
    Operand x = singleValue(sliceExpr.x());
    for (Ast.Expr bound : new Ast.Expr[] {sliceExpr.low(), sliceExpr.high(), sliceExpr.max()}) {
      if (bound != null) checkIndex(singleValue(bound), -1);
    }
    if (x.isInvalid()) return Operand.invalid();

    Type u = x.type().underlying();
    if (Types.isString(u)) {
      if (sliceExpr.slice3()) {
        logError(sliceExpr, "invalid operation: 3-index slice of string");
        return Operand.invalid();
      }
      return Operand.of(Mode.VALUE, sliceExpr, Types.defaultType(x.type()));
    }
    switch (u.kind()) {
      case SLICE:
        return Operand.of(Mode.VALUE, sliceExpr, x.type());
      case ARRAY:
        if (x.mode() != Mode.VARIABLE) {
          logError(sliceExpr, "invalid operation: %s (slice of unaddressable value)", x);
          return Operand.invalid();
        }
        return Operand.of(
            Mode.VALUE, sliceExpr, new Type.SliceType(u.<Type.ArrayType>cast().elem()));
      case POINTER:
        {
          Type elem = u.<Type.PointerType>cast().elem().underlying();
          if (elem.kind() == Type.Kind.ARRAY) {
            return Operand.of(
                Mode.VALUE, sliceExpr, new Type.SliceType(elem.<Type.ArrayType>cast().elem()));
          }
          break;
        }
      default:
        break;
    }
    logError(sliceExpr, "cannot slice %s", x);
    return Operand.invalid();
  }

  private Operand typeAssert(Ast.TypeAssertExpr assertExpr) {
    Operand x = singleValue(assertExpr.x());
    if (assertExpr.type() == null) {
      logError(assertExpr, "use of .(type) outside type switch");
      return Operand.invalid();
    }

    Type type = typeExpr(assertExpr.type());
    if (x.isInvalid() || Types.isInvalid(type)) return Operand.invalid();
    if (!x.type().isInterface()) {
      logError(assertExpr.x(), "invalid operation: %s is not an interface", x);
      return Operand.invalid();
    }
    if (!type.isInterface()) {
      Optional<String> missing = Types.missingMethod(type, x.type());
      if (missing.isPresent()) {
        logError(
            assertExpr,
            "impossible type assertion: %s (%s does not implement %s (%s))",
            SourcePrinter.print(assertExpr),
            type,
            x.type(),
            missing.get());
      }
    }
    return Operand.of(Mode.VALUE, assertExpr, type);
  }

  private Operand star(Ast.StarExpr star) {
    Operand x = expr(star.x());
    if (x.isInvalid()) return x;
    if (x.mode() == Mode.TYPE) {
      return Operand.of(Mode.TYPE, star, new Type.PointerType(x.type()));
    }

    x = requireValue(x);
    if (x.isInvalid()) return x;
    if (x.isNil()) {
      logError(star, "invalid operation: cannot indirect nil");
      return Operand.invalid();
    }
    if (!x.type().underlying().isPointer()) {
      logError(star, "invalid operation: cannot indirect %s", x);
      return Operand.invalid();
    }
    return Operand.of(
        Mode.VARIABLE, star, x.type().underlying().<Type.PointerType>cast().elem());
  }

  private Operand unary(Ast.UnaryExpr unary) {
    Token op = unary.op();
    if (op == Token.AND) {
      Ast.Expr inner = unparen(unary.x());
      Operand x = singleValue(unary.x());
      if (x.isInvalid()) return x;
      if (x.mode() != Mode.VARIABLE && inner.kind() != Ast.Kind.COMPOSITE_LIT) {
        logError(unary, "invalid operation: cannot take address of %s", x);
        return Operand.invalid();
      }
      return Operand.of(Mode.VALUE, unary, new Type.PointerType(x.type()));
    }
    if (op == Token.ARROW) {
      expr(unary.x());
      logError(unary, "channel operations are not supported");
      return Operand.invalid();
    }

    Operand x = singleValue(unary.x());
    if (x.isInvalid()) return x;

    boolean defined;
    switch (op) {
      case ADD:
      case SUB:
        defined = Types.isNumeric(x.type());
        break;
      case NOT:
        defined = Types.isBoolean(x.type());
        break;
      case XOR:
        defined = Types.isInteger(x.type());
        break;
      default:
        defined = false;
        break;
    }
    if (!defined) {
      logError(unary, "invalid operation: operator %s not defined on %s", op, x);
      return Operand.invalid();
    }

    if (x.mode() != Mode.CONSTANT) return Operand.of(Mode.VALUE, unary, x.type());
    OptionalLong value = OptionalLong.empty();
    if (x.constValue().isPresent()) {
      long v = x.constValue().getAsLong();
      if (op == Token.SUB) value = OptionalLong.of(-v);
      if (op == Token.ADD) value = OptionalLong.of(v);
      if (op == Token.XOR) value = OptionalLong.of(~v);
    }
    return Operand.constant(unary, x.type(), value);
  }

  // result is null for the operation of a compound assignment.
  private Operand binaryOperation(
      Ast.Node at, Ast.Expr result, Operand x, Token op, Operand y) {
    if (x.isInvalid() || y.isInvalid()) return Operand.invalid();
    String source = result == null ? SourcePrinter.print(at) : SourcePrinter.print(result);

    if (op == Token.SHL || op == Token.SHR) return shift(at, result, x, op, y);

    if (x.isUntyped() != y.isUntyped()) {
      if (x.isUntyped()) {
        x = convertUntyped(x, y.type());
      } else {
        y = convertUntyped(y, x.type());
      }
      if (x.isInvalid() || y.isInvalid()) {
        logError(
            at,
            "invalid operation: %s (mismatched types %s and %s)",
            source,
            x.isInvalid() ? "untyped value" : x.type(),
            y.isInvalid() ? "untyped value" : y.type());
        return Operand.invalid();
      }
    }

    if (op.isComparison()) return comparison(at, result, source, x, op, y);

    Type type;
    if (x.type().identical(y.type())) {
      type = x.type();
    } else if (x.isUntyped()
        && y.isUntyped()
        && Types.isNumeric(x.type())
        && Types.isNumeric(y.type())) {
      type = Types.widerUntyped(x.type().cast(), y.type().cast());
    } else {
      logError(
          at, "invalid operation: %s (mismatched types %s and %s)", source, x.type(), y.type());
      return Operand.invalid();
    }

    if (!operatorDefined(op, type)) {
      logError(at, "invalid operation: operator %s not defined on %s", op, x);
      return Operand.invalid();
    }
    if ((op == Token.QUO || op == Token.REM)
        && y.mode() == Mode.CONSTANT
        && y.constValue().isPresent()
        && y.constValue().getAsLong() == 0
        && Types.isInteger(type)) {
      logError(at, "invalid operation: division by zero");
      return Operand.invalid();
    }

    if (x.mode() == Mode.CONSTANT && y.mode() == Mode.CONSTANT) {
      return Operand.constant(result, type, fold(op, x, y, type));
    }
    return Operand.of(Mode.VALUE, result, type);
  }

  // An untyped operand given the type of the other operand, or invalid if it does not fit.
  private Operand convertUntyped(Operand x, Type target) {
    if (x.isNil()) {
      return Types.hasNil(target) ? x.withType(target) : Operand.invalid();
    }
    if (!Types.untypedCompatible(x.type().cast(), target)) return Operand.invalid();
    if (target.isInterface()) {
      Type type = Types.defaultType(x.type());
      binding.bind(x.expr(), type);
      return x.withType(type);
    }
    binding.bind(x.expr(), target);
    return x.withType(target);
  }

  private Operand comparison(
      Ast.Node at, Ast.Expr result, String source, Operand x, Token op, Operand y) {
    if (!Types.assignable(x.type(), y.type()) && !Types.assignable(y.type(), x.type())) {
      logError(
          at, "invalid operation: %s (mismatched types %s and %s)", source, x.type(), y.type());
      return Operand.invalid();
    }

    boolean defined;
    if (op == Token.EQL || op == Token.NEQ) {
      boolean againstNil = x.isNil() || y.isNil() || isNilValue(x) || isNilValue(y);
      defined = againstNil ? Types.hasNil(x.type()) : Types.comparable(x.type());
    } else {
      defined = Types.ordered(x.type());
    }
    if (!defined) {
      logError(at, "invalid operation: operator %s not defined on %s", op, x);
      return Operand.invalid();
    }

    if (x.mode() == Mode.CONSTANT && y.mode() == Mode.CONSTANT) {
      return Operand.constant(result, UNTYPED_BOOL, OptionalLong.empty());
    }
    return Operand.of(Mode.VALUE, result, UNTYPED_BOOL);
  }

  // A nil converted to the type of the other comparison operand.
  private static boolean isNilValue(Operand x) {
    Ast.Expr expr = x.expr() == null ? null : unparen(x.expr());
    return expr != null
        && expr.kind() == Ast.Kind.IDENT
        && expr.<Ast.Ident>cast().name().equals("nil")
        && Types.hasNil(x.type());
  }

  private Operand shift(Ast.Node at, Ast.Expr result, Operand x, Token op, Operand y) {
    if (!Types.isInteger(y.type())) {
      logError(at, "invalid operation: shift count %s must be integer", y);
      return Operand.invalid();
    }
    if (!Types.isInteger(x.type())) {
      logError(at, "invalid operation: shifted operand %s must be integer", x);
      return Operand.invalid();
    }
    if (y.isUntyped()) binding.bind(y.expr(), BasicType.of(BasicType.Which.UINT));

    if (x.mode() == Mode.CONSTANT && y.mode() == Mode.CONSTANT) {
      OptionalLong value = OptionalLong.empty();
      if (x.constValue().isPresent() && y.constValue().isPresent()) {
        long shift = y.constValue().getAsLong();
        long v = x.constValue().getAsLong();
        if (shift >= 0 && shift < 63) {
          value = OptionalLong.of(op == Token.SHL ? v << shift : v >> shift);
        }
      }
      return Operand.constant(result, x.type(), value);
    }

    Type type = x.isUntyped() ? Types.defaultType(x.type()) : x.type();
    if (x.isUntyped()) binding.bind(x.expr(), type);
    return Operand.of(Mode.VALUE, result, type);
  }

  private static boolean operatorDefined(Token op, Type type) {
    switch (op) {
      case ADD:
        return Types.isNumeric(type) || Types.isString(type);
      case SUB:
      case MUL:
      case QUO:
        return Types.isNumeric(type);
      case REM:
      case AND:
      case OR:
      case XOR:
      case AND_NOT:
        return Types.isInteger(type);
      case LAND:
      case LOR:
        return Types.isBoolean(type);
      default:
        return false;
    }
  }

  private static OptionalLong fold(Token op, Operand x, Operand y, Type type) {
    if (!Types.isInteger(type) || !x.constValue().isPresent() || !y.constValue().isPresent()) {
      return OptionalLong.empty();
    }

    long a = x.constValue().getAsLong();
    long b = y.constValue().getAsLong();
    switch (op) {
      case ADD:
        return OptionalLong.of(a + b);
      case SUB:
        return OptionalLong.of(a - b);
      case MUL:
        return OptionalLong.of(a * b);
      case QUO:
        return OptionalLong.of(a / b);
      case REM:
        return OptionalLong.of(a % b);
      case AND:
        return OptionalLong.of(a & b);
      case OR:
        return OptionalLong.of(a | b);
      case XOR:
        return OptionalLong.of(a ^ b);
      case AND_NOT:
        return OptionalLong.of(a & ~b);
      default:
        return OptionalLong.empty();
    }
  }

  // Calls

  private Operand call(Ast.CallExpr call) {
    Operand fun = expr(call.fun());
    switch (fun.mode()) {
      case INVALID:
        call.args().forEach(this::expr);
        return Operand.invalid();
      case TYPE:
        return conversion(call, fun.type());
      case BUILTIN:
        return builtinCall(call, fun.builtin());
      default:
        break;
    }

    fun = requireValue(fun);
    List<Operand> args = operands(call.args());
    if (fun.isInvalid()) return Operand.invalid();
    if (fun.type().underlying().kind() != Type.Kind.SIGNATURE) {
      logError(call, "invalid operation: cannot call non-function %s", fun);
      return Operand.invalid();
    }

    Type.SignatureType signature = fun.type().underlying().cast();
    arguments(call, signature, args);
    statementCalls.add(call);
    switch (signature.results().size()) {
      case 0:
        return Operand.of(Mode.NO_VALUE, call, new Type.TupleType(ImmutableList.of()));
      case 1:
        return Operand.of(Mode.VALUE, call, signature.results().get(0));
      default:
        return Operand.of(Mode.VALUE, call, new Type.TupleType(signature.results()));
    }
  }

  private void arguments(Ast.CallExpr call, Type.SignatureType signature, List<Operand> args) {
    if (args.stream().anyMatch(Operand::isInvalid)) return;

    String context = "argument to " + SourcePrinter.print(call.fun());
    List<Type> params = signature.params();
    int n = params.size();
    if (call.hasEllipsis()) {
      if (!signature.variadic()) {
        logError(
            call, "cannot use ... in call to non-variadic %s", SourcePrinter.print(call.fun()));
        return;
      }
      if (!checkArgumentCount(call, args.size(), n, n)) return;
      for (int i = 0; i < n; i++) {
        assignTo(args.get(i), params.get(i), context);
      }
      return;
    }

    int min = signature.variadic() ? n - 1 : n;
    int max = signature.variadic() ? Integer.MAX_VALUE : n;
    if (!checkArgumentCount(call, args.size(), min, max)) return;
    for (int i = 0; i < args.size(); i++) {
      Type param;
      if (signature.variadic() && i >= n - 1) {
        param = params.get(n - 1).<Type.SliceType>cast().elem();
      } else {
        param = params.get(i);
      }
      assignTo(args.get(i), param, context);
    }
  }

  private boolean checkArgumentCount(Ast.CallExpr call, int count, int min, int max) {
    if (count < min) {
      logError(call, "not enough arguments in call to %s", SourcePrinter.print(call.fun()));
      return false;
    }
    if (count > max) {
      logError(call, "too many arguments in call to %s", SourcePrinter.print(call.fun()));
      return false;
    }
    return true;
  }

  private Operand conversion(Ast.CallExpr call, Type type) {
    if (call.args().size() != 1) {
      call.args().forEach(this::expr);
      logError(
          call,
          "%s arguments in conversion to %s",
          call.args().isEmpty() ? "missing" : "too many",
          type);
      return Operand.invalid();
    }

    Operand x = singleValue(call.args().get(0));
    if (x.isInvalid() || Types.isInvalid(type)) return Operand.invalid();

    boolean ok =
        x.isUntyped() && !x.isNil()
            ? Types.untypedCompatible(x.type().cast(), type)
                || (Types.isNumeric(x.type()) && Types.isNumeric(type))
            : Types.convertible(x.type(), type);
    if (!ok) {
      logError(call, "cannot convert %s to type %s", x, type);
      return Operand.invalid();
    }
    if (x.isUntyped()) {
      binding.bind(x.expr(), type.isInterface() ? Types.defaultType(x.type()) : type);
    }

    if (x.mode() == Mode.CONSTANT && type.isBasic()) {
      return Operand.constant(call, type, x.constValue());
    }
    return Operand.of(Mode.VALUE, call, type);
  }

  private Operand builtinCall(Ast.CallExpr call, Builtin builtin) {
    if (call.hasEllipsis() && builtin != Builtin.APPEND) {
      call.args().forEach(this::expr);
      logError(call, "invalid use of ... with built-in %s", builtin.repr());
      return Operand.invalid();
    }
    if (builtin.isStatement()) statementCalls.add(call);

    switch (builtin) {
      case LEN:
      case CAP:
        {
          List<Operand> args = operands(call.args());
          if (!builtinArgumentCount(call, builtin, args.size(), 1, 1)) return Operand.invalid();

          Operand x = args.get(0);
          if (x.isInvalid()) return x;
          Type u = x.type().underlying();
          if (u.isPointer()) u = u.<Type.PointerType>cast().elem().underlying();
          boolean ok;
          switch (u.kind()) {
            case SLICE:
            case ARRAY:
              ok = true;
              break;
            case MAP:
              ok = builtin == Builtin.LEN;
              break;
            default:
              ok = builtin == Builtin.LEN && Types.isString(u) && !x.type().isPointer();
              break;
          }
          if (x.type().underlying().isPointer()
              && x.type().underlying().<Type.PointerType>cast().elem().underlying().kind()
                  != Type.Kind.ARRAY) {
            ok = false;
          }
          if (!ok) {
            logError(x.expr(), "invalid argument: %s for built-in %s", x, builtin.repr());
            return Operand.invalid();
          }
          return Operand.of(Mode.VALUE, call, INT);
        }
      case NEW:
        {
          if (!builtinArgumentCount(call, builtin, call.args().size(), 1, 1)) {
            return Operand.invalid();
          }
          Type type = typeExpr(call.args().get(0));
          if (Types.isInvalid(type) && !type.isNamed()) return Operand.invalid();
          return Operand.of(Mode.VALUE, call, new Type.PointerType(type));
        }
      case MAKE:
        {
          if (!builtinArgumentCount(call, builtin, call.args().size(), 1, 3)) {
            return Operand.invalid();
          }
          Type type = typeExpr(call.args().get(0));
          List<Ast.Expr> sizes = call.args().subList(1, call.args().size());
          sizes.forEach(size -> checkIndex(singleValue(size), -1));
          if (Types.isInvalid(type)) return Operand.invalid();

          switch (type.underlying().kind()) {
            case SLICE:
              if (sizes.isEmpty()) {
                logError(
                    call,
                    "invalid operation: %s expects 2 or 3 arguments; found 1",
                    SourcePrinter.print(call));
                return Operand.invalid();
              }
              break;
            case MAP:
              if (sizes.size() > 1) {
                logError(
                    call,
                    "invalid operation: %s expects 1 or 2 arguments; found %d",
                    SourcePrinter.print(call),
                    call.args().size());
                return Operand.invalid();
              }
              break;
            default:
              logError(
                  call.args().get(0),
                  "invalid argument: cannot make %s; type must be slice, map, or channel",
                  type);
              return Operand.invalid();
          }
          return Operand.of(Mode.VALUE, call, type);
        }
      case APPEND:
        {
          List<Operand> args = operands(call.args());
          if (!builtinArgumentCount(call, builtin, args.size(), 1, Integer.MAX_VALUE)) {
            return Operand.invalid();
          }
          Operand slice = args.get(0);
          if (slice.isInvalid()) return slice;
          if (slice.type().underlying().kind() != Type.Kind.SLICE) {
            logError(slice.expr(), "invalid argument: %s is not a slice", slice);
            return Operand.invalid();
          }

          String context = "argument to append";
          if (call.hasEllipsis()) {
            if (args.size() != 2) {
              logError(call, "can only use ... with final argument in list");
              return Operand.invalid();
            }
            Operand rest = args.get(1);
            boolean bytes =
                slice.type().underlying().<Type.SliceType>cast().elem()
                        .isBasic(BasicType.Which.UINT8)
                    && !rest.isInvalid()
                    && Types.isString(rest.type());
            if (!bytes) assignTo(rest, slice.type(), context);
          } else {
            Type elem = slice.type().underlying().<Type.SliceType>cast().elem();
            for (Operand arg : args.subList(1, args.size())) {
              assignTo(arg, elem, context);
            }
          }
          return Operand.of(Mode.VALUE, call, slice.type());
        }
      case PANIC:
        {
          List<Operand> args = operands(call.args());
          if (!builtinArgumentCount(call, builtin, args.size(), 1, 1)) return Operand.invalid();
          if (args.get(0).isNil()) {
            logError(args.get(0).expr(), "use of untyped nil in argument to built-in panic");
          }
          return Operand.of(Mode.NO_VALUE, call, new Type.TupleType(ImmutableList.of()));
        }
      default:
        {
          for (Operand arg : operands(call.args())) {
            if (arg.isNil()) {
              logError(
                  arg.expr(), "use of untyped nil in argument to built-in %s", builtin.repr());
            } else if (arg.isUntyped() && !arg.isInvalid()) {
              binding.bind(arg.expr(), Types.defaultType(arg.type()));
            }
          }
          return Operand.of(Mode.NO_VALUE, call, new Type.TupleType(ImmutableList.of()));
        }
    }
  }

  private boolean builtinArgumentCount(
      Ast.CallExpr call, Builtin builtin, int count, int min, int max) {
    if (count >= min && count <= max) return true;

    String expected = min == max ? Integer.toString(min) : min + " or more";
    if (max != Integer.MAX_VALUE && min != max) expected = min + " to " + max;
    logError(
        call,
        "%s arguments for %s (expected %s, found %d)",
        count < min ? "not enough" : "too many",
        SourcePrinter.print(call),
        expected,
        count);
    return false;
  }
}
