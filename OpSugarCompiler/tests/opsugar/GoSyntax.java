package opsugar;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** Terse builders for the syntax trees tests feed to the engine. */
final class GoSyntax {

  private GoSyntax() {}

  static Ast.Ident id(String name) {
    return Ast.Ident.of(name);
  }

  static Ast.BasicLit lit(long value) {
    return Ast.BasicLit.ofInt(value);
  }

  static Ast.BasicLit str(String value) {
    return Ast.BasicLit.ofString(value);
  }

  static Ast.BinaryExpr binary(Ast.Expr x, Token op, Ast.Expr y) {
    return Ast.BinaryExpr.of(x, op, y);
  }

  static Ast.SelectorExpr sel(Ast.Expr x, String name) {
    return Ast.SelectorExpr.of(x, id(name));
  }

  static Ast.IndexExpr index(Ast.Expr x, Ast.Expr... indices) {
    return Ast.IndexExpr.of(x, Arrays.asList(indices));
  }

  static Ast.CallExpr call(Ast.Expr fun, Ast.Expr... args) {
    return Ast.CallExpr.of(fun, Arrays.asList(args), false);
  }

  static Ast.CallExpr call(String fun, Ast.Expr... args) {
    return call(id(fun), args);
  }

  static Ast.StarExpr star(Ast.Expr x) {
    return Ast.StarExpr.of(x);
  }

  static Ast.UnaryExpr addressOf(Ast.Expr x) {
    return Ast.UnaryExpr.of(Token.AND, x);
  }

  static Ast.ParenExpr paren(Ast.Expr x) {
    return Ast.ParenExpr.of(x);
  }

  static Ast.CompositeLit composite(Ast.Expr type, Ast.Expr... elts) {
    return Ast.CompositeLit.of(type, Arrays.asList(elts));
  }

  static Ast.ArrayType sliceOf(Ast.Expr elt) {
    return Ast.ArrayType.of(null, elt);
  }

  // Statements

  static Ast.ExprStmt exprStmt(Ast.Expr x) {
    return Ast.ExprStmt.of(x);
  }

  static Ast.AssignStmt assign(Ast.Expr lhs, Ast.Expr rhs) {
    return Ast.AssignStmt.of(lhs, Token.ASSIGN, rhs);
  }

  static Ast.AssignStmt define(String name, Ast.Expr rhs) {
    return Ast.AssignStmt.of(id(name), Token.DEFINE, rhs);
  }

  static Ast.DeclStmt varDecl(String name, Ast.Expr type, Ast.Expr value) {
    return Ast.DeclStmt.of(
        Ast.GenDecl.of(
            null,
            Token.VAR,
            ImmutableList.<Ast.Spec>of(
                Ast.ValueSpec.of(
                    null,
                    ImmutableList.of(id(name)),
                    type,
                    value == null ? ImmutableList.of() : ImmutableList.of(value),
                    null))));
  }

  static Ast.ReturnStmt ret(Ast.Expr... results) {
    return Ast.ReturnStmt.of(Arrays.asList(results));
  }

  static Ast.BlockStmt block(Ast.Stmt... stmts) {
    return Ast.BlockStmt.of(Arrays.asList(stmts));
  }

  /** {@code for name := 0; name < limit; name++ { body } } */
  static Ast.ForStmt countTo(String name, Ast.Expr limit, Ast.Stmt... body) {
    return Ast.ForStmt.of(
        define(name, lit(0)),
        binary(id(name), Token.LSS, limit),
        Ast.IncDecStmt.of(id(name), Token.INC),
        block(body));
  }

  static Ast.ExprStmt println(Ast.Expr... args) {
    return exprStmt(call("println", args));
  }

  // Declarations

  static Ast.Field field(Ast.Expr type, String... names) {
    ImmutableList.Builder<Ast.Ident> idents = ImmutableList.builder();
    for (String name : names) {
      idents.add(id(name));
    }
    return Ast.Field.of(null, idents.build(), type, null, null);
  }

  static Ast.FieldList fields(Ast.Field... fields) {
    return Ast.FieldList.of(Arrays.asList(fields));
  }

  static Ast.FuncType funcType(List<Ast.Field> params, Ast.Expr result) {
    return Ast.FuncType.of(
        Ast.FieldList.of(params), result == null ? null : fields(field(result)));
  }

  static Ast.StructType struct(Ast.Field... fields) {
    return Ast.StructType.of(fields(fields));
  }

  static Ast.InterfaceType iface(Ast.Field... methods) {
    return Ast.InterfaceType.of(fields(methods));
  }

  /** An interface method: {@code name(params) result}. */
  static Ast.Field ifaceMethod(String name, List<Ast.Field> params, Ast.Expr result) {
    return Ast.Field.of(null, ImmutableList.of(id(name)), funcType(params, result), null, null);
  }

  static Ast.GenDecl typeDecl(String name, Ast.Expr type) {
    return Ast.GenDecl.of(
        null, Token.TYPE, ImmutableList.<Ast.Spec>of(Ast.TypeSpec.of(null, id(name), type, null)));
  }

  static Ast.FuncDecl func(
      String name, List<Ast.Field> params, Ast.Expr result, Ast.Stmt... body) {
    return Ast.FuncDecl.of(null, null, id(name), funcType(params, result), block(body));
  }

  static Ast.FuncDecl method(
      Ast.Field recv, String name, List<Ast.Field> params, Ast.Expr result, Ast.Stmt... body) {
    return Ast.FuncDecl.of(null, fields(recv), id(name), funcType(params, result), block(body));
  }

  static Ast.File file(Ast.Decl... decls) {
    return Ast.File.of("main.go", null, id("main"), Arrays.asList(decls));
  }

  static Ast.FuncDecl main(Ast.Stmt... body) {
    return func("main", ImmutableList.of(), null, body);
  }
}
