package opsugar;

import static com.google.common.truth.Truth.assertThat;
import static opsugar.GoSyntax.field;
import static opsugar.GoSyntax.file;
import static opsugar.GoSyntax.func;
import static opsugar.GoSyntax.id;
import static opsugar.GoSyntax.iface;
import static opsugar.GoSyntax.ifaceMethod;
import static opsugar.GoSyntax.method;
import static opsugar.GoSyntax.typeDecl;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class OperatorNameNormalizerTest {

  private static Ast.FuncDecl funcDecl(Ast.File file, int index) {
    return file.decls().get(index).cast();
  }

  private static Ast.InterfaceType ifaceOf(Ast.File file, int index) {
    Ast.GenDecl decl = file.decls().get(index).cast();
    return decl.specs().get(0).<Ast.TypeSpec>cast().type().cast();
  }

  @Test
  public void renamesMethodDeclarations() {
    Ast.File file = Fixtures.vectors();

    OperatorNameNormalizer.normalize(file);

    assertThat(funcDecl(file, 1).name().name()).isEqualTo("AT__");
    assertThat(funcDecl(file, 2).name().name()).isEqualTo("ATSET__");
    assertThat(funcDecl(file, 3).name().name()).isEqualTo("MUL__");
  }

  @Test
  public void renamesInterfaceMethods() {
    Ast.File file = Fixtures.points(false);

    OperatorNameNormalizer.normalize(file);

    Ast.InterfaceType adder = ifaceOf(file, 1);
    assertThat(adder.methods().list().get(0).names().get(0).name()).isEqualTo("ADD__");
    assertThat(funcDecl(file, 2).name().name()).isEqualTo("ADD__");
  }

  @Test
  public void leavesOtherNamesAlone() {
    Ast.File file =
        file(
            typeDecl(
                "Named",
                iface(
                    ifaceMethod("Name", ImmutableList.of(), id("string")),
                    ifaceMethod("-", ImmutableList.of(field(id("Named"))), id("Named")))),
            method(field(id("T"), "t"), "String", ImmutableList.of(), id("string")),
            func("+", ImmutableList.of(), null));

    OperatorNameNormalizer.normalize(file);

    Ast.InterfaceType named = ifaceOf(file, 0);
    assertThat(named.methods().list().get(0).names().get(0).name()).isEqualTo("Name");
    assertThat(named.methods().list().get(1).names().get(0).name()).isEqualTo("SUB__");
    assertThat(funcDecl(file, 1).name().name()).isEqualTo("String");
    // Only methods are operators; a plain function keeps its name.
    assertThat(funcDecl(file, 2).name().name()).isEqualTo("+");
  }

  @Test
  public void isIdempotent() {
    Ast.File file = Fixtures.points(false);

    OperatorNameNormalizer.normalize(file);
    String once = SourcePrinter.print(file);
    OperatorNameNormalizer.normalize(file);

    assertThat(SourcePrinter.print(file)).isEqualTo(once);
  }

  @Test
  public void skipsFunctionBodies() {
    // A local interface type is not a declaration the normalizer renames.
    Ast.File file =
        file(
            func(
                "f",
                ImmutableList.of(),
                null,
                GoSyntax.varDecl(
                    "x",
                    iface(ifaceMethod("*", ImmutableList.of(), null)),
                    null)));

    OperatorNameNormalizer.normalize(file);

    assertThat(SourcePrinter.print(file)).contains("*()");
  }
}
