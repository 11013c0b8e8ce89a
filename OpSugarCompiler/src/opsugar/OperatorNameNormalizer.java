package opsugar;

public final class OperatorNameNormalizer {

  private OperatorNameNormalizer() {}

  public static void normalize(Ast.Node root) {
    SyntaxTree.apply(root, OperatorNameNormalizer::pre, null);
  }

  private static boolean pre(Locator locator, Ast.Node node) {
    if (node == null) return true;

    switch (node.kind()) {
      case INTERFACE_TYPE:
        {
          Ast.InterfaceType interfaceType = node.cast();
          if (interfaceType.methods() == null) break;

          for (Ast.Field method : interfaceType.methods().list()) {
            for (int i = 0; i < method.names().size(); i++) {
              Ast.Ident renamed = canonical(method.names().get(i));
              if (renamed != null) SyntaxTree.setField(method, "names", i, renamed);
            }
          }
          break;
        }
      case FUNC_DECL:
        {
          Ast.FuncDecl funcDecl = node.cast();
          if (funcDecl.isMethod()) {
            Ast.Ident renamed = canonical(funcDecl.name());
            if (renamed != null) SyntaxTree.setField(funcDecl, "name", -1, renamed);
          }
          return false;
        }
      default:
        break;
    }
    return true;
  }

  // Null when the name is not an operator symbol.
  private static Ast.Ident canonical(Ast.Ident name) {
    return OverloadableOperator.parse(name.name())
        .map(op -> Ast.Ident.of(op.methodName()))
        .orElse(null);
  }
}
