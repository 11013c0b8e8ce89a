package opsugar;

import static com.google.common.truth.Truth.assertThat;
import static opsugar.GoSyntax.addressOf;
import static opsugar.GoSyntax.binary;
import static opsugar.GoSyntax.call;
import static opsugar.GoSyntax.field;
import static opsugar.GoSyntax.file;
import static opsugar.GoSyntax.id;
import static opsugar.GoSyntax.index;
import static opsugar.GoSyntax.lit;
import static opsugar.GoSyntax.main;
import static opsugar.GoSyntax.println;
import static opsugar.GoSyntax.sel;
import static opsugar.GoSyntax.star;
import static opsugar.GoSyntax.struct;
import static opsugar.GoSyntax.typeDecl;

import org.junit.jupiter.api.Test;

public class SourcePrinterTest {

  @Test
  public void printsNil() {
    assertThat(SourcePrinter.print(null)).isEqualTo("nil");
  }

  @Test
  public void parenthesizesLooserOperands() {
    Ast.Expr product = binary(binary(id("a"), Token.ADD, id("b")), Token.MUL, id("c"));
    Ast.Expr leftChain = binary(binary(id("a"), Token.SUB, id("b")), Token.SUB, id("c"));
    Ast.Expr rightChain = binary(id("a"), Token.SUB, binary(id("b"), Token.SUB, id("c")));

    assertThat(SourcePrinter.print(product)).isEqualTo("(a + b) * c");
    assertThat(SourcePrinter.print(leftChain)).isEqualTo("a - b - c");
    assertThat(SourcePrinter.print(rightChain)).isEqualTo("a - (b - c)");
  }

  @Test
  public void parenthesizesUnaryReceivers() {
    assertThat(SourcePrinter.print(sel(star(id("p")), "X"))).isEqualTo("(*p).X");
    assertThat(SourcePrinter.print(index(addressOf(id("w")), lit(0)))).isEqualTo("(&w)[0]");
    assertThat(SourcePrinter.print(call(sel(call("f"), "g"), lit(1)))).isEqualTo("f().g(1)");
  }

  @Test
  public void printsFiles() {
    Ast.File file =
        file(typeDecl("Point", struct(field(id("int"), "X", "Y"))), main(println(lit(1))));

    assertThat(SourcePrinter.print(file))
        .isEqualTo(
            "package main\n"
                + "\n"
                + "type Point struct {\n"
                + "\tX, Y int\n"
                + "}\n"
                + "\n"
                + "func main() {\n"
                + "\tprintln(1)\n"
                + "}\n");
  }

  @Test
  public void printsOperatorMethodsBeforeNormalization() {
    Ast.File file = Fixtures.vectors();

    String printed = SourcePrinter.print(file);

    assertThat(printed).contains("func (v *Vector) [](i int) int {");
    assertThat(printed).contains("func (v *Vector) []=(i int, x int) {");
    assertThat(printed).contains("\t\tout[i] = x * k\n");
  }
}
