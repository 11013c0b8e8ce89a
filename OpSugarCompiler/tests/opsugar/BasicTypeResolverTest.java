package opsugar;

import static com.google.common.truth.Truth.assertThat;
import static opsugar.GoSyntax.binary;
import static opsugar.GoSyntax.call;
import static opsugar.GoSyntax.composite;
import static opsugar.GoSyntax.define;
import static opsugar.GoSyntax.field;
import static opsugar.GoSyntax.file;
import static opsugar.GoSyntax.func;
import static opsugar.GoSyntax.id;
import static opsugar.GoSyntax.index;
import static opsugar.GoSyntax.lit;
import static opsugar.GoSyntax.main;
import static opsugar.GoSyntax.println;
import static opsugar.GoSyntax.ret;
import static opsugar.GoSyntax.sel;
import static opsugar.GoSyntax.sliceOf;
import static opsugar.GoSyntax.str;
import static opsugar.GoSyntax.varDecl;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class BasicTypeResolverTest {

  private final BasicTypeResolver resolver = new BasicTypeResolver();

  private ImmutableList<String> errors(Ast.File file) {
    return resolver
        .resolve(file)
        .errors()
        .stream()
        .map(CompilerException::errorMsg)
        .collect(ImmutableList.toImmutableList());
  }

  private static Ast.File normalized(Ast.File file) {
    OperatorNameNormalizer.normalize(file);
    return file;
  }

  @Test
  public void acceptsDesugaredCalls() {
    Ast.Expr sum = call(sel(id("a"), "ADD__"), id("b"));
    Ast.File file =
        normalized(Fixtures.points(false, Fixtures.pointA(), Fixtures.pointB(), println(sum)));

    Resolution resolution = resolver.resolve(file);

    assertThat(resolution.succeeded()).isTrue();
    assertThat(resolution.binding().typeOf(sum).get().toString()).isEqualTo("Point");
    assertThat(resolution.binding().typeOf(id("a"))).isEmpty();
  }

  @Test
  public void reportsOperatorsUndefinedOnStructs() {
    Ast.File file =
        normalized(
            Fixtures.points(
                false,
                Fixtures.pointA(),
                Fixtures.pointB(),
                println(binary(id("a"), Token.MUL, id("b")))));

    assertThat(errors(file))
        .containsExactly("invalid operation: operator * not defined on a (variable of type Point)");
  }

  @Test
  public void bindsOperandsOfFailedOperations() {
    Ast.Ident a = id("a");
    Ast.BinaryExpr sum = binary(a, Token.ADD, id("b"));
    Ast.File file =
        normalized(Fixtures.points(false, Fixtures.pointA(), Fixtures.pointB(), println(sum)));

    Resolution resolution = resolver.resolve(file);

    assertThat(resolution.succeeded()).isFalse();
    assertThat(resolution.binding().typeOf(a).get().toString()).isEqualTo("Point");
    assertThat(resolution.binding().isBound(sum)).isFalse();
  }

  @Test
  public void untypedConstantsTakeTheirContextType() {
    Ast.BasicLit one = lit(1);
    Ast.BasicLit two = lit(2);
    Ast.File file =
        file(
            main(
                varDecl("x", id("int32"), one),
                define("y", two),
                println(binary(id("x"), Token.ADD, lit(3)), id("y"))));

    Resolution resolution = resolver.resolve(file);

    assertThat(resolution.succeeded()).isTrue();
    assertThat(resolution.binding().typeOf(one).get().toString()).isEqualTo("int32");
    assertThat(resolution.binding().typeOf(two).get().toString()).isEqualTo("int");
  }

  @Test
  public void reportsMismatchedTypes() {
    Ast.File file =
        file(
            main(
                define("n", lit(1)),
                define("s", str("x")),
                println(binary(id("n"), Token.ADD, id("s")))));

    assertThat(errors(file))
        .containsExactly("invalid operation: n + s (mismatched types int and string)");
  }

  @Test
  public void reportsUndefinedNames() {
    Ast.File file = file(main(println(id("missing"))));

    assertThat(errors(file)).containsExactly("undefined: missing");
  }

  @Test
  public void reportsUnusedVariables() {
    Ast.File file = file(main(define("unused", lit(1))));

    assertThat(errors(file)).containsExactly("declared and not used: unused");
  }

  @Test
  public void printsErrorsWithTheirSource() {
    Resolution resolution = resolver.resolve(file(main(println(id("missing")))));
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    PrintStream stdout = System.out;
    System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    try {
      resolution.printErrors();
    } finally {
      System.setOut(stdout);
    }

    assertThat(out.toString(StandardCharsets.UTF_8))
        .startsWith("ERROR: missing: undefined: missing");
  }

  @Test
  public void reportsMissingReturn() {
    Ast.File file =
        file(func("f", ImmutableList.of(), id("int"), println(lit(1))), main());

    assertThat(errors(file)).containsExactly("missing return");
  }

  @Test
  public void reportsAssignmentMismatch() {
    Ast.File file =
        file(
            func("pair", ImmutableList.of(), id("int"), ret(lit(1))),
            main(
                Ast.AssignStmt.of(
                    ImmutableList.of(id("a"), id("b")),
                    Token.DEFINE,
                    ImmutableList.of(call("pair"))),
                println(id("a"), id("b"))));

    assertThat(errors(file)).containsExactly("assignment mismatch: 2 variables but 1 value");
  }

  @Test
  public void reportsWrongArgumentTypes() {
    Ast.File file =
        file(
            func("f", ImmutableList.of(field(id("int"), "n")), null),
            main(GoSyntax.exprStmt(call("f", str("x")))));

    assertThat(errors(file))
        .containsExactly(
            "cannot use \"x\" (untyped string constant) as int value in argument to f");
  }

  @Test
  public void reportsTypesThatDoNotImplementInterfaces() {
    Ast.File file =
        normalized(
            Fixtures.points(
                true, Fixtures.pointA(), varDecl("sum", id("Adder"), id("a")), println(id("sum"))));

    assertThat(errors(file))
        .containsExactly(
            "cannot use a (variable of type Point) as Adder value in variable declaration: "
                + "Point does not implement Adder (method ADD__ has pointer receiver)");
  }

  @Test
  public void reportsUnsupportedStatements() {
    Ast.File file =
        file(main(Ast.GoStmt.of(call("println", lit(1)))));

    assertThat(errors(file)).containsExactly("go statements are not supported");
  }

  @Test
  public void indexesSlicesArraysStringsAndMaps() {
    Ast.Expr mapType = Ast.MapType.of(id("string"), id("int"));
    Ast.File file =
        file(
            main(
                define("s", composite(sliceOf(id("int")), lit(1))),
                define("m", composite(mapType, Ast.KeyValueExpr.of(str("k"), lit(1)))),
                define("t", str("abc")),
                println(index(id("s"), lit(0)), index(id("m"), str("k")), index(id("t"), lit(1)))));

    assertThat(errors(file)).isEmpty();
  }

  @Test
  public void lookupMethodFollowsMethodSets() {
    Ast.File file =
        normalized(Fixtures.vectors(Fixtures.vectorV(), println(id("v"))));
    Resolution resolution = resolver.resolve(file);
    assertThat(resolution.succeeded()).isTrue();

    Ast.FuncDecl main = file.decls().get(file.decls().size() - 1).cast();
    Ast.AssignStmt define = main.body().list().get(0).cast();
    Type pointer = resolution.binding().typeOf(define.lhs().get(0)).get();
    Type vector = pointer.<Type.PointerType>cast().elem();

    assertThat(pointer.toString()).isEqualTo("*Vector");
    assertThat(resolver.lookupMethod(pointer, "AT__")).isPresent();
    assertThat(resolver.lookupMethod(pointer, "AT__").get().pointerReceiver()).isTrue();
    // Pointer-receiver methods are not in the value type's method set.
    assertThat(resolver.lookupMethod(vector, "AT__")).isEmpty();
    assertThat(resolver.lookupMethod(pointer, "ADD__")).isEmpty();
  }

  @Test
  public void lookupMethodIgnoresFields() {
    Ast.File file = normalized(Fixtures.points(false, Fixtures.pointA(), println(id("a"))));
    Resolution resolution = resolver.resolve(file);

    Ast.FuncDecl main = file.decls().get(file.decls().size() - 1).cast();
    Ast.AssignStmt define = main.body().list().get(0).cast();
    Type point = resolution.binding().typeOf(define.lhs().get(0)).get();

    assertThat(resolver.lookupMethod(point, "X")).isEmpty();
    assertThat(resolver.lookupMethod(point, "ADD__").get().owner()).isEqualTo("Point");
  }

  @Test
  public void resolutionIsRepeatable() {
    Ast.File file =
        normalized(
            Fixtures.points(
                false, Fixtures.pointA(), Fixtures.pointB(), Fixtures.printChain()));
    String before = SourcePrinter.print(file);

    List<String> first = errors(file);
    List<String> second = errors(file);

    assertThat(second).isEqualTo(first);
    assertThat(SourcePrinter.print(file)).isEqualTo(before);
  }
}
