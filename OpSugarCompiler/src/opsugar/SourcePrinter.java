package opsugar;

import java.util.List;

public final class SourcePrinter extends VoidDefaultSyntaxVisitor {
  private final StringBuilder out = new StringBuilder();
  private int indent = 0;

  private SourcePrinter() {}

  public static String print(Ast.Node node) {
    if (node == null) return "nil";

    SourcePrinter printer = new SourcePrinter();
    node.accept(printer, null);
    return printer.out.toString();
  }

  private void emit(Ast.Node node) {
    if (node != null) node.accept(this, null);
  }

  private void print(String text) {
    out.append(text);
  }

  private void printList(List<? extends Ast.Node> nodes, String separator) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) print(separator);
      emit(nodes.get(i));
    }
  }

  private void newline() {
    out.append('\n');
    for (int i = 0; i < indent; i++) {
      out.append('\t');
    }
  }

  private void printOperand(Ast.Expr expr) {
    switch (expr.kind()) {
      case UNARY_EXPR:
      case BINARY_EXPR:
      case STAR_EXPR:
      case KEY_VALUE_EXPR:
        print("(");
        emit(expr);
        print(")");
        break;
      default:
        emit(expr);
    }
  }

  private void printBinaryOperand(Ast.Expr expr, int parentPrecedence, boolean right) {
    if (expr.kind() == Ast.Kind.BINARY_EXPR) {
      int precedence = expr.<Ast.BinaryExpr>cast().op().precedence();
      if (precedence < parentPrecedence || (right && precedence == parentPrecedence)) {
        print("(");
        emit(expr);
        print(")");
        return;
      }
    }
    emit(expr);
  }

  private void printDoc(Ast.CommentGroup doc) {
    if (doc == null) return;
    for (Ast.Comment comment : doc.list()) {
      emit(comment);
      newline();
    }
  }

  // Statements of a block or clause body, each on its own line one level deeper.
  private void printBody(List<Ast.Stmt> stmts) {
    indent++;
    for (Ast.Stmt stmt : stmts) {
      newline();
      emit(stmt);
    }
    indent--;
  }

  private void printSignature(Ast.FuncType type) {
    print("(");
    if (type.params() != null) emit(type.params());
    print(")");

    Ast.FieldList results = type.results();
    if (results == null || results.list().isEmpty()) return;
    if (results.list().size() == 1 && results.list().get(0).names().isEmpty()) {
      print(" ");
      emit(results.list().get(0).type());
    } else {
      print(" (");
      emit(results);
      print(")");
    }
  }

  @Override
  public void visitImpl(Ast.Comment node) {
    print(node.text());
  }

  @Override
  public void visitImpl(Ast.CommentGroup node) {
    for (int i = 0; i < node.list().size(); i++) {
      if (i > 0) newline();
      emit(node.list().get(i));
    }
  }

  @Override
  public void visitImpl(Ast.Field node) {
    printList(node.names(), ", ");
    if (!node.names().isEmpty()) print(" ");
    emit(node.type());
    if (node.tag() != null) {
      print(" ");
      emit(node.tag());
    }
  }

  @Override
  public void visitImpl(Ast.FieldList node) {
    printList(node.list(), ", ");
  }

  @Override
  public void visitImpl(Ast.BadExpr node) {
    print("BadExpr");
  }

  @Override
  public void visitImpl(Ast.Ident node) {
    print(node.name());
  }

  @Override
  public void visitImpl(Ast.BasicLit node) {
    print(node.value());
  }

  @Override
  public void visitImpl(Ast.Ellipsis node) {
    print("...");
    emit(node.elt());
  }

  @Override
  public void visitImpl(Ast.FuncLit node) {
    print("func");
    printSignature(node.type());
    print(" ");
    emit(node.body());
  }

  @Override
  public void visitImpl(Ast.CompositeLit node) {
    emit(node.type());
    print("{");
    printList(node.elts(), ", ");
    print("}");
  }

  @Override
  public void visitImpl(Ast.ParenExpr node) {
    print("(");
    emit(node.x());
    print(")");
  }

  @Override
  public void visitImpl(Ast.SelectorExpr node) {
    printOperand(node.x());
    print(".");
    emit(node.sel());
  }

  @Override
  public void visitImpl(Ast.IndexExpr node) {
    printOperand(node.x());
    print("[");
    printList(node.indices(), ", ");
    print("]");
  }

  @Override
  public void visitImpl(Ast.SliceExpr node) {
    printOperand(node.x());
    print("[");
    emit(node.low());
    print(":");
    emit(node.high());
    if (node.slice3()) {
      print(":");
      emit(node.max());
    }
    print("]");
  }

  @Override
  public void visitImpl(Ast.TypeAssertExpr node) {
    printOperand(node.x());
    print(".(");
    if (node.type() == null) {
      print("type");
    } else {
      emit(node.type());
    }
    print(")");
  }

  @Override
  public void visitImpl(Ast.CallExpr node) {
    printOperand(node.fun());
    print("(");
    printList(node.args(), ", ");
    if (node.hasEllipsis()) print("...");
    print(")");
  }

  @Override
  public void visitImpl(Ast.StarExpr node) {
    print("*");
    printOperand(node.x());
  }

  @Override
  public void visitImpl(Ast.UnaryExpr node) {
    print(node.op().repr());
    printOperand(node.x());
  }

  @Override
  public void visitImpl(Ast.BinaryExpr node) {
    int precedence = node.op().precedence();
    printBinaryOperand(node.x(), precedence, false);
    print(" " + node.op().repr() + " ");
    printBinaryOperand(node.y(), precedence, true);
  }

  @Override
  public void visitImpl(Ast.KeyValueExpr node) {
    emit(node.key());
    print(": ");
    emit(node.value());
  }

  @Override
  public void visitImpl(Ast.ArrayType node) {
    print("[");
    emit(node.len());
    print("]");
    emit(node.elt());
  }

  @Override
  public void visitImpl(Ast.StructType node) {
    if (node.fields() == null || node.fields().list().isEmpty()) {
      print("struct{}");
      return;
    }

    print("struct {");
    indent++;
    for (Ast.Field field : node.fields().list()) {
      newline();
      printDoc(field.doc());
      emit(field);
    }
    indent--;
    newline();
    print("}");
  }

  @Override
  public void visitImpl(Ast.FuncType node) {
    print("func");
    printSignature(node);
  }

  @Override
  public void visitImpl(Ast.InterfaceType node) {
    if (node.methods() == null || node.methods().list().isEmpty()) {
      print("interface{}");
      return;
    }

    print("interface {");
    indent++;
    for (Ast.Field method : node.methods().list()) {
      newline();
      printDoc(method.doc());
      if (method.names().isEmpty()) {
        emit(method.type());
      } else {
        printList(method.names(), ", ");
        printSignature(method.type().cast());
      }
    }
    indent--;
    newline();
    print("}");
  }

  @Override
  public void visitImpl(Ast.MapType node) {
    print("map[");
    emit(node.key());
    print("]");
    emit(node.value());
  }

  @Override
  public void visitImpl(Ast.ChanType node) {
    switch (node.dir()) {
      case SEND:
        print("chan<- ");
        break;
      case RECV:
        print("<-chan ");
        break;
      case BOTH:
        print("chan ");
        break;
    }
    emit(node.value());
  }

  @Override
  public void visitImpl(Ast.BadStmt node) {
    print("BadStmt");
  }

  @Override
  public void visitImpl(Ast.DeclStmt node) {
    emit(node.decl());
  }

  @Override
  public void visitImpl(Ast.EmptyStmt node) {}

  @Override
  public void visitImpl(Ast.LabeledStmt node) {
    emit(node.label());
    print(":");
    newline();
    emit(node.stmt());
  }

  @Override
  public void visitImpl(Ast.ExprStmt node) {
    emit(node.x());
  }

  @Override
  public void visitImpl(Ast.SendStmt node) {
    emit(node.chan());
    print(" <- ");
    emit(node.value());
  }

  @Override
  public void visitImpl(Ast.IncDecStmt node) {
    emit(node.x());
    print(node.tok().repr());
  }

  @Override
  public void visitImpl(Ast.AssignStmt node) {
    printList(node.lhs(), ", ");
    print(" " + node.tok().repr() + " ");
    printList(node.rhs(), ", ");
  }

  @Override
  public void visitImpl(Ast.GoStmt node) {
    print("go ");
    emit(node.call());
  }

  @Override
  public void visitImpl(Ast.DeferStmt node) {
    print("defer ");
    emit(node.call());
  }

  @Override
  public void visitImpl(Ast.ReturnStmt node) {
    print("return");
    if (!node.results().isEmpty()) {
      print(" ");
      printList(node.results(), ", ");
    }
  }

  @Override
  public void visitImpl(Ast.BranchStmt node) {
    print(node.tok().repr());
    if (node.label() != null) {
      print(" ");
      emit(node.label());
    }
  }

  @Override
  public void visitImpl(Ast.BlockStmt node) {
    print("{");
    printBody(node.list());
    newline();
    print("}");
  }

  @Override
  public void visitImpl(Ast.IfStmt node) {
    print("if ");
    if (node.init() != null) {
      emit(node.init());
      print("; ");
    }
    emit(node.cond());
    print(" ");
    emit(node.body());
    if (node.els() != null) {
      print(" else ");
      emit(node.els());
    }
  }

  @Override
  public void visitImpl(Ast.CaseClause node) {
    if (node.isDefault()) {
      print("default:");
    } else {
      print("case ");
      printList(node.list(), ", ");
      print(":");
    }
    printBody(node.body());
  }

  private void printClauses(Ast.BlockStmt body) {
    print(" {");
    for (Ast.Stmt clause : body.list()) {
      newline();
      emit(clause);
    }
    newline();
    print("}");
  }

  @Override
  public void visitImpl(Ast.SwitchStmt node) {
    print("switch");
    if (node.init() != null) {
      print(" ");
      emit(node.init());
      print(";");
    }
    if (node.tag() != null) {
      print(" ");
      emit(node.tag());
    }
    printClauses(node.body());
  }

  @Override
  public void visitImpl(Ast.TypeSwitchStmt node) {
    print("switch ");
    if (node.init() != null) {
      emit(node.init());
      print("; ");
    }
    emit(node.assign());
    printClauses(node.body());
  }

  @Override
  public void visitImpl(Ast.CommClause node) {
    if (node.comm() == null) {
      print("default:");
    } else {
      print("case ");
      emit(node.comm());
      print(":");
    }
    printBody(node.body());
  }

  @Override
  public void visitImpl(Ast.SelectStmt node) {
    print("select");
    printClauses(node.body());
  }

  @Override
  public void visitImpl(Ast.ForStmt node) {
    print("for ");
    if (node.init() != null || node.post() != null) {
      emit(node.init());
      print("; ");
      emit(node.cond());
      print("; ");
      emit(node.post());
      print(" ");
    } else if (node.cond() != null) {
      emit(node.cond());
      print(" ");
    }
    emit(node.body());
  }

  @Override
  public void visitImpl(Ast.RangeStmt node) {
    print("for ");
    if (node.key() != null) {
      emit(node.key());
      if (node.value() != null) {
        print(", ");
        emit(node.value());
      }
      print(" " + node.tok().repr() + " ");
    }
    print("range ");
    emit(node.x());
    print(" ");
    emit(node.body());
  }

  @Override
  public void visitImpl(Ast.ImportSpec node) {
    if (node.name() != null) {
      emit(node.name());
      print(" ");
    }
    emit(node.path());
  }

  @Override
  public void visitImpl(Ast.ValueSpec node) {
    printList(node.names(), ", ");
    if (node.type() != null) {
      print(" ");
      emit(node.type());
    }
    if (!node.values().isEmpty()) {
      print(" = ");
      printList(node.values(), ", ");
    }
  }

  @Override
  public void visitImpl(Ast.TypeSpec node) {
    emit(node.name());
    print(" ");
    emit(node.type());
  }

  @Override
  public void visitImpl(Ast.BadDecl node) {
    print("BadDecl");
  }

  @Override
  public void visitImpl(Ast.GenDecl node) {
    printDoc(node.doc());
    print(node.tok().repr());
    if (node.specs().size() == 1) {
      print(" ");
      emit(node.specs().get(0));
      return;
    }

    print(" (");
    indent++;
    for (Ast.Spec spec : node.specs()) {
      newline();
      emit(spec);
    }
    indent--;
    newline();
    print(")");
  }

  @Override
  public void visitImpl(Ast.FuncDecl node) {
    printDoc(node.doc());
    print("func ");
    if (node.recv() != null) {
      print("(");
      emit(node.recv());
      print(") ");
    }
    emit(node.name());
    printSignature(node.type());
    if (node.body() != null) {
      print(" ");
      emit(node.body());
    }
  }

  @Override
  public void visitImpl(Ast.File node) {
    printDoc(node.doc());
    print("package ");
    emit(node.name());
    newline();
    for (Ast.Decl decl : node.decls()) {
      newline();
      emit(decl);
      newline();
    }
  }

  @Override
  public void visitImpl(Ast.Package node) {
    for (int i = 0; i < node.files().size(); i++) {
      if (i > 0) newline();
      emit(node.files().get(i));
    }
  }
}
