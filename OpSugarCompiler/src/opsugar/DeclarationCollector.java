package opsugar;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

final class DeclarationCollector extends ErrorCollectingValidator {
  private final List<Ast.TypeSpec> typeSpecs = new ArrayList<>();
  private final List<Ast.ValueSpec> valueSpecs = new ArrayList<>();
  private final List<Token> valueTokens = new ArrayList<>();
  private final List<Ast.FuncDecl> funcs = new ArrayList<>();
  private final List<Ast.FuncDecl> methods = new ArrayList<>();

  private Token currentTok = null;

  private DeclarationCollector() {}

  static DeclarationCollector collect(Ast.File file) {
    DeclarationCollector collector = new DeclarationCollector();
    file.accept(collector, null);
    return collector;
  }

  ImmutableList<Ast.TypeSpec> typeSpecs() {
    return ImmutableList.copyOf(typeSpecs);
  }

  ImmutableList<Ast.ValueSpec> valueSpecs() {
    return ImmutableList.copyOf(valueSpecs);
  }

  ImmutableList<Token> valueTokens() {
    return ImmutableList.copyOf(valueTokens);
  }

  ImmutableList<Ast.FuncDecl> funcs() {
    return ImmutableList.copyOf(funcs);
  }

  ImmutableList<Ast.FuncDecl> methods() {
    return ImmutableList.copyOf(methods);
  }

  @Override
  public void visitImpl(Ast.File file) {
    for (Ast.Decl decl : file.decls()) {
      decl.accept(this, null);
    }
  }

  @Override
  public void visitImpl(Ast.GenDecl genDecl) {
    currentTok = genDecl.tok();
    for (Ast.Spec spec : genDecl.specs()) {
      spec.accept(this, null);
    }
    currentTok = null;
  }

  @Override
  public void visitImpl(Ast.ImportSpec spec) {
    logError(spec, "imports are not supported");
  }

  @Override
  public void visitImpl(Ast.TypeSpec spec) {
    typeSpecs.add(spec);
  }

  @Override
  public void visitImpl(Ast.ValueSpec spec) {
    valueSpecs.add(spec);
    valueTokens.add(currentTok);
  }

  @Override
  public void visitImpl(Ast.FuncDecl funcDecl) {
    if (funcDecl.isMethod()) {
      methods.add(funcDecl);
    } else {
      funcs.add(funcDecl);
    }
  }

  @Override
  public void visitImpl(Ast.BadDecl badDecl) {
    logError(badDecl, "invalid declaration");
  }
}
