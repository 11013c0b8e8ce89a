package opsugar;

import com.google.common.base.Preconditions;

public final class OverloadDesugaring {
  private final OperatorDesugarer desugarer;

  public OverloadDesugaring(TypeResolver typeResolver) {
    this.desugarer = new OperatorDesugarer(Preconditions.checkNotNull(typeResolver));
  }

  public DesugarResult desugar(Ast.File file) {
    OperatorNameNormalizer.normalize(file);
    return desugarer.desugar(file);
  }
}
