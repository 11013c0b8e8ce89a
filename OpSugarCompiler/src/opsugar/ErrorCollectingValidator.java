package opsugar;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingValidator extends VoidDefaultSyntaxVisitor {
  private final List<CompilerException> errors = new ArrayList<>();

  protected ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(Ast.Node node, String msg) {
    logError(new CompilerException(node, msg));
  }

  protected void logError(Ast.Node node, String format, Object... args) {
    logError(node, String.format(format, args));
  }

  protected void logError(CompilerException ex) {
    errors.add(ex);
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    errors.addAll(other.errors);
  }
}
