package opsugar;

import static com.google.common.truth.Truth.assertThat;
import static opsugar.GoSyntax.binary;
import static opsugar.GoSyntax.define;
import static opsugar.GoSyntax.id;
import static opsugar.GoSyntax.index;
import static opsugar.GoSyntax.lit;
import static opsugar.GoSyntax.println;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class OverloadDesugaringTest {

  private static DesugarResult desugar(Ast.File file) {
    return new OverloadDesugaring(new BasicTypeResolver()).desugar(file);
  }

  private static String mainBody(DesugarResult result) {
    List<Ast.Decl> decls = result.file().decls();
    Ast.FuncDecl main = decls.get(decls.size() - 1).cast();
    return SourcePrinter.print(main.body());
  }

  private static ImmutableList<String> errorMessages(DesugarResult result) {
    return result
        .resolution()
        .errors()
        .stream()
        .map(CompilerException::errorMsg)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void chainedAdditionIsLeftAssociative() {
    DesugarResult result =
        desugar(
            Fixtures.points(false, Fixtures.pointA(), Fixtures.pointB(), Fixtures.printChain()));

    assertThat(result.succeeded()).isTrue();
    assertThat(mainBody(result)).contains("println(a.ADD__(b).ADD__(a).ADD__(b))");
    // One nesting level per sweep.
    assertThat(result.rewritesPerSweep()).containsExactly(1, 1, 1).inOrder();
  }

  @Test
  public void interfaceReceiverResolvesLikeConcreteReceiver() {
    ImmutableList<Ast.Stmt> body =
        ImmutableList.<Ast.Stmt>builder()
            .add(Fixtures.pointA(), Fixtures.pointB())
            .add(println(binary(id("a"), Token.ADD, id("b"))))
            .addAll(Fixtures.interfaceSum())
            .build();
    DesugarResult result = desugar(Fixtures.points(false, body.toArray(new Ast.Stmt[0])));

    assertThat(result.succeeded()).isTrue();
    assertThat(mainBody(result)).contains("println(a.ADD__(b))");
    assertThat(mainBody(result)).contains("println(sum.ADD__(b))");
    assertThat(result.rewritesPerSweep()).containsExactly(2);
  }

  @Test
  public void elementWritesReadsAndProductsUsePointerReceivers() {
    DesugarResult result =
        desugar(
            Fixtures.vectors(
                Fixtures.vectorV(),
                GoSyntax.assign(index(id("v"), lit(0)), lit(10)),
                println(index(id("v"), lit(1))),
                define("w", binary(id("v"), Token.MUL, lit(2))),
                println(id("w"))));

    assertThat(result.succeeded()).isTrue();
    String body = mainBody(result);
    assertThat(body).contains("v.ATSET__(0, 10)");
    assertThat(body).contains("println(v.AT__(1))");
    assertThat(body).contains("w := v.MUL__(2)");
    assertThat(body).doesNotContain("v[");
    assertThat(result.rewritesPerSweep()).containsExactly(3);
  }

  @Test
  public void builtInOperationsAreUntouched() {
    Ast.File file =
        Fixtures.vectors(
            define("n", binary(lit(1), Token.ADD, lit(2))),
            define("s", GoSyntax.composite(GoSyntax.sliceOf(id("int")), lit(1), lit(2))),
            GoSyntax.assign(index(id("s"), lit(0)), binary(id("n"), Token.MUL, lit(3))),
            println(index(id("s"), lit(1))));
    String before = SourcePrinter.print(file);

    DesugarResult result = desugar(file);

    assertThat(result.succeeded()).isTrue();
    assertThat(result.sweeps()).isEqualTo(0);
    assertThat(result.totalRewrites()).isEqualTo(0);
    // Only the operator method names change.
    String renamed =
        before
            .replace(") [](", ") AT__(")
            .replace(") []=(", ") ATSET__(")
            .replace(") *(", ") MUL__(");
    assertThat(SourcePrinter.print(result.file())).isEqualTo(renamed);
  }

  @Test
  public void programWithoutOperatorDeclarationsIsUnchanged() {
    Ast.File file =
        GoSyntax.file(
            GoSyntax.func(
                "sum",
                ImmutableList.of(GoSyntax.field(GoSyntax.sliceOf(id("int")), "xs")),
                id("int"),
                define("total", lit(0)),
                GoSyntax.countTo(
                    "i",
                    GoSyntax.call("len", id("xs")),
                    Ast.AssignStmt.of(id("total"), Token.ADD_ASSIGN, index(id("xs"), id("i")))),
                GoSyntax.ret(id("total"))),
            GoSyntax.main(
                define("s", GoSyntax.composite(GoSyntax.sliceOf(id("int")), lit(1), lit(2))),
                GoSyntax.assign(index(id("s"), lit(0)), binary(lit(3), Token.MUL, lit(4))),
                println(binary(GoSyntax.call("sum", id("s")), Token.ADD, index(id("s"), lit(1))))));
    String before = SourcePrinter.print(file);

    DesugarResult result = desugar(file);

    assertThat(result.succeeded()).isTrue();
    assertThat(result.sweeps()).isEqualTo(0);
    assertThat(SourcePrinter.print(result.file())).isEqualTo(before);
  }

  @Test
  public void multiIndexElementAccessKeepsIndexOrder() {
    DesugarResult result =
        desugar(
            Fixtures.matrix(
                Fixtures.matrixA(),
                GoSyntax.assign(index(id("a"), lit(0), lit(1)), lit(5)),
                define("b", binary(id("a"), Token.MUL, id("a"))),
                println(index(id("b"), lit(0), lit(1)))));

    assertThat(result.succeeded()).isTrue();
    String body = mainBody(result);
    assertThat(body).contains("a.ATSET__(0, 1, 5)");
    assertThat(body).contains("b := a.MUL__(a)");
    assertThat(body).contains("println(b.AT__(0, 1))");
    // b is typed only once a * a has become a call.
    assertThat(result.rewritesPerSweep()).containsExactly(5, 1).inOrder();
  }

  @Test
  public void operatorsInsideOperatorMethodsAreRewritten() {
    DesugarResult result = desugar(Fixtures.matrix(Fixtures.matrixA(), println(id("a"))));

    assertThat(result.succeeded()).isTrue();
    Ast.FuncDecl product = result.file().decls().get(4).cast();
    assertThat(product.name().name()).isEqualTo("MUL__");
    // Slices keep their built-in indexing.
    Ast.FuncDecl at = result.file().decls().get(2).cast();
    assertThat(SourcePrinter.print(at.body())).contains("return m.cells[i * m.cols + j]");
    String body = SourcePrinter.print(product.body());
    assertThat(body).contains("t += a.AT__(i, k) * b.AT__(k, j)");
    assertThat(body).contains("c.ATSET__(i, j, t)");
    assertThat(result.rewritesPerSweep()).containsExactly(3);
  }

  @Test
  public void multiTargetAssignmentIsLeftAlone() {
    Ast.Stmt swap =
        Ast.AssignStmt.of(
            ImmutableList.of(index(id("v"), lit(0)), index(id("v"), lit(1))),
            Token.ASSIGN,
            ImmutableList.of(lit(1), lit(2)));
    DesugarResult result = desugar(Fixtures.vectors(Fixtures.vectorV(), swap));

    assertThat(result.succeeded()).isFalse();
    assertThat(mainBody(result)).contains("v[0], v[1] = 1, 2");
    assertThat(result.totalRewrites()).isEqualTo(0);
    assertThat(errorMessages(result))
        .contains("invalid operation: cannot index v (variable of type *Vector)");
  }

  @Test
  public void compoundElementAssignmentIsNotAnElementWrite() {
    Ast.Stmt addTo = Ast.AssignStmt.of(index(id("v"), lit(0)), Token.ADD_ASSIGN, lit(1));
    DesugarResult result = desugar(Fixtures.vectors(Fixtures.vectorV(), addTo));

    assertThat(result.succeeded()).isFalse();
    assertThat(mainBody(result)).contains("v[0] += 1");
    assertThat(result.rewritesPerSweep()).containsExactly(0);
  }

  @Test
  public void valueReceiverCannotUsePointerReceiverOperator() {
    DesugarResult result =
        desugar(
            Fixtures.points(
                true,
                Fixtures.pointA(),
                Fixtures.pointB(),
                println(binary(id("a"), Token.ADD, id("b")))));

    assertThat(result.succeeded()).isFalse();
    assertThat(mainBody(result)).contains("println(a + b)");
    assertThat(result.rewritesPerSweep()).containsExactly(0);
    assertThat(errorMessages(result))
        .containsExactly(
            "invalid operation: operator + not defined on a (variable of type Point)");
  }

  @Test
  public void pointerOperandUsesPointerReceiverOperator() {
    DesugarResult result =
        desugar(
            Fixtures.points(
                true,
                Fixtures.pointA(),
                Fixtures.pointB(),
                define("p", GoSyntax.addressOf(id("a"))),
                println(binary(id("p"), Token.ADD, id("b")))));

    assertThat(result.succeeded()).isTrue();
    assertThat(mainBody(result)).contains("println(p.ADD__(b))");
  }

  @Test
  public void compoundReceiversAreParenthesized() {
    DesugarResult result =
        desugar(
            Fixtures.vectors(
                Fixtures.vectorV(),
                define("pp", GoSyntax.addressOf(id("v"))),
                define("w", GoSyntax.star(id("v"))),
                println(index(GoSyntax.star(id("pp")), lit(0))),
                println(index(GoSyntax.addressOf(id("w")), lit(0)))));

    assertThat(result.succeeded()).isTrue();
    String body = mainBody(result);
    assertThat(body).contains("println((*pp).AT__(0))");
    assertThat(body).contains("println((&w).AT__(0))");
  }

  @Test
  public void sweepsStayWithinOperatorSiteBound() {
    DesugarResult result =
        desugar(
            Fixtures.points(
                false,
                Fixtures.pointA(),
                Fixtures.pointB(),
                Fixtures.printChain(),
                println(binary(id("a"), Token.SUB, id("b")))));

    assertThat(result.succeeded()).isFalse();
    assertThat(result.totalRewrites()).isAtMost(result.operatorSites());
    assertThat(result.sweeps()).isAtMost(result.operatorSites());
    assertThat(errorMessages(result))
        .containsExactly(
            "invalid operation: operator - not defined on a (variable of type Point)");
  }

  @Test
  public void unresolvableCodeKeepsResolverDiagnostics() {
    DesugarResult result =
        desugar(
            Fixtures.vectors(
                Fixtures.vectorV(), println(binary(id("v"), Token.MUL, id("undefinedName")))));

    assertThat(result.succeeded()).isFalse();
    assertThat(errorMessages(result)).containsExactly("undefined: undefinedName");
  }

  @Test
  public void operatorSitesCountedBeforeRewriting() {
    DesugarResult result =
        desugar(
            Fixtures.points(false, Fixtures.pointA(), Fixtures.pointB(), Fixtures.printChain()));

    // Three in main, two in the method body.
    assertThat(result.operatorSites()).isEqualTo(5);
  }
}
