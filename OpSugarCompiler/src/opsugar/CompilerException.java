package opsugar;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Ast.Node node;
  private final String errorMsg;

  public CompilerException(Ast.Node node, String errorMsg) {
    super(errorMsg);
    this.node = node;
    this.errorMsg = errorMsg;
  }

  public Ast.Node node() {
    return node;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public void print() {
    System.out.println(String.format("ERROR: %s: %s", SourcePrinter.print(node), errorMsg));
  }
}
