package opsugar;

public final class OperatorSiteCounter extends VoidDefaultSyntaxVisitor {
  private int sites = 0;

  private OperatorSiteCounter() {}

  public static int count(Ast.Node root) {
    OperatorSiteCounter counter = new OperatorSiteCounter();
    root.accept(counter, null);
    return counter.sites;
  }

  @Override
  public void visitImpl(Ast.BinaryExpr node) {
    if (OverloadableOperator.forBinary(node.op()).isPresent()) sites++;
    super.visitImpl(node);
  }

  @Override
  public void visitImpl(Ast.IndexExpr node) {
    sites++;
    super.visitImpl(node);
  }

  @Override
  public void visitImpl(Ast.AssignStmt node) {
    if (OperatorDesugarer.isElementWrite(node)) sites++;
    super.visitImpl(node);
  }
}
