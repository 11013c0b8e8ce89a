package opsugar;

import static com.google.common.truth.Truth.assertThat;
import static opsugar.GoSyntax.binary;
import static opsugar.GoSyntax.call;
import static opsugar.GoSyntax.exprStmt;
import static opsugar.GoSyntax.file;
import static opsugar.GoSyntax.id;
import static opsugar.GoSyntax.index;
import static opsugar.GoSyntax.lit;
import static opsugar.GoSyntax.main;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class OperatorDesugarerTest {

  /**
   * Types every identifier and call as {@code T}, whose method set holds the given operator
   * methods. Resolution fails while any binary or index expression remains.
   */
  private static final class FakeResolver implements TypeResolver {
    private final Type.NamedType t = new Type.NamedType("T");
    private final List<String> receiversLookedUp = new ArrayList<>();
    private int resolutions = 0;

    FakeResolver(OverloadableOperator... ops) {
      Type.SignatureType signature =
          new Type.SignatureType(ImmutableList.of(t), ImmutableList.of(t), false);
      t.setUnderlying(new Type.StructType(ImmutableList.of()));
      for (OverloadableOperator op : ops) {
        t.addMethod(Method.create(op.methodName(), signature, false, "T"));
      }
    }

    @Override
    public Resolution resolve(Ast.File file) {
      resolutions++;
      TypeBinding.Builder binding = TypeBinding.builder();
      List<CompilerException> errors = new ArrayList<>();
      SyntaxTree.apply(
          file,
          (locator, node) -> {
            if (node == null) return true;
            boolean operand =
                node.kind() == Ast.Kind.IDENT
                    ? locator.parent().kind() != Ast.Kind.SELECTOR_EXPR
                    : node.kind() == Ast.Kind.CALL_EXPR;
            if (operand) binding.bind(node.cast(), t);
            if (node.kind() == Ast.Kind.BINARY_EXPR || node.kind() == Ast.Kind.INDEX_EXPR) {
              errors.add(new CompilerException(node, "unsupported"));
            }
            return true;
          },
          null);
      return Resolution.create(errors, binding.build());
    }

    @Override
    public Optional<Method> lookupMethod(Type type, String name) {
      receiversLookedUp.add(name);
      return Types.lookupMethod(type, name, false);
    }
  }

  private static Ast.File program(Ast.Stmt... stmts) {
    return file(main(stmts));
  }

  @Test
  public void resolvedFileIsNotSwept() {
    FakeResolver resolver = new FakeResolver(OverloadableOperator.ADD);
    Ast.File file = program(exprStmt(call("f", id("a"))));

    DesugarResult result = new OperatorDesugarer(resolver).desugar(file);

    assertThat(result.succeeded()).isTrue();
    assertThat(result.sweeps()).isEqualTo(0);
    assertThat(resolver.resolutions).isEqualTo(1);
    assertThat(resolver.receiversLookedUp).isEmpty();
  }

  @Test
  public void rewritesLeftOperandBeforeRight() {
    FakeResolver resolver = new FakeResolver(OverloadableOperator.ADD, OverloadableOperator.SUB);
    // f(a + b, c - d)
    Ast.File file =
        program(
            exprStmt(
                call(
                    "f",
                    binary(id("a"), Token.ADD, id("b")),
                    binary(id("c"), Token.SUB, id("d")))));

    DesugarResult result = new OperatorDesugarer(resolver).desugar(file);

    assertThat(result.succeeded()).isTrue();
    assertThat(resolver.receiversLookedUp).containsExactly("ADD__", "SUB__").inOrder();
    assertThat(SourcePrinter.print(result.file())).contains("f(a.ADD__(b), c.SUB__(d))");
  }

  @Test
  public void stopsWhenASweepMakesNoProgress() {
    FakeResolver resolver = new FakeResolver(OverloadableOperator.ADD);
    Ast.File file = program(exprStmt(binary(id("a"), Token.MUL, id("b"))));

    DesugarResult result = new OperatorDesugarer(resolver).desugar(file);

    assertThat(result.succeeded()).isFalse();
    assertThat(result.rewritesPerSweep()).containsExactly(0);
    assertThat(resolver.resolutions).isEqualTo(2);
    assertThat(result.resolution().errors()).hasSize(1);
    assertThat(result.resolution().errors().get(0).errorMsg()).isEqualTo("unsupported");
  }

  @Test
  public void elementWriteTakesPrecedenceOverElementRead() {
    FakeResolver resolver = new FakeResolver(OverloadableOperator.AT, OverloadableOperator.AT_SET);
    Ast.File file =
        program(GoSyntax.assign(index(id("v"), id("i")), index(id("w"), id("j"))));

    DesugarResult result = new OperatorDesugarer(resolver).desugar(file);

    assertThat(result.succeeded()).isTrue();
    assertThat(SourcePrinter.print(result.file())).contains("v.ATSET__(i, w.AT__(j))");
    assertThat(result.rewritesPerSweep()).containsExactly(2);
  }

  @Test
  public void nestedOperatorsNeedOneSweepPerLevel() {
    FakeResolver resolver = new FakeResolver(OverloadableOperator.MUL);
    // a * b * c
    Ast.File file =
        program(
            exprStmt(binary(binary(id("a"), Token.MUL, id("b")), Token.MUL, id("c"))));

    DesugarResult result = new OperatorDesugarer(resolver).desugar(file);

    assertThat(result.succeeded()).isTrue();
    assertThat(result.rewritesPerSweep()).containsExactly(1, 1).inOrder();
    assertThat(result.operatorSites()).isEqualTo(2);
    assertThat(SourcePrinter.print(result.file())).contains("a.MUL__(b).MUL__(c)");
  }

  @Test
  public void comparisonsAreNotOverloadable() {
    FakeResolver resolver = new FakeResolver(OverloadableOperator.ADD);
    Ast.File file = program(exprStmt(binary(id("a"), Token.LSS, lit(1))));

    DesugarResult result = new OperatorDesugarer(resolver).desugar(file);

    assertThat(result.operatorSites()).isEqualTo(0);
    assertThat(resolver.receiversLookedUp).isEmpty();
    assertThat(result.totalRewrites()).isEqualTo(0);
  }
}
