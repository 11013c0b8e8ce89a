package opsugar;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// Alternates resolution and rewrite sweeps until the file resolves or a sweep rewrites nothing. A
// call built in a sweep stays untyped until the next resolution, so nested operators are rewritten
// one level per sweep.
public final class OperatorDesugarer {
  private final TypeResolver typeResolver;

  public OperatorDesugarer(TypeResolver typeResolver) {
    this.typeResolver = Preconditions.checkNotNull(typeResolver);
  }

  public DesugarResult desugar(Ast.File file) {
    int operatorSites = OperatorSiteCounter.count(file);
    ImmutableList.Builder<Integer> rewritesPerSweep = ImmutableList.builder();

    boolean progress = true;
    while (true) {
      Resolution resolution = typeResolver.resolve(file);
      if (resolution.succeeded() || !progress) {
        return DesugarResult.create(file, resolution, operatorSites, rewritesPerSweep.build());
      }

      Sweep sweep = new Sweep(resolution.binding());
      SyntaxTree.apply(file, sweep::pre, sweep::post);
      rewritesPerSweep.add(sweep.rewrites);
      progress = sweep.rewrites > 0;
    }
  }

  // True for recv[i...] = value with exactly one target and one source.
  static boolean isElementWrite(Ast.AssignStmt assign) {
    return assign.tok() == Token.ASSIGN
        && assign.lhs().size() == 1
        && assign.rhs().size() == 1
        && assign.lhs().get(0).kind() == Ast.Kind.INDEX_EXPR;
  }

  // Slots holding a storage location rather than a value.
  private static boolean isAssignmentTarget(Locator locator) {
    switch (locator.parent().kind()) {
      case ASSIGN_STMT:
        return locator.slot().equals("lhs");
      case INC_DEC_STMT:
        return locator.slot().equals("x");
      case RANGE_STMT:
        return locator.slot().equals("key") || locator.slot().equals("value");
      default:
        return false;
    }
  }

  private final class Sweep {
    private final TypeBinding binding;
    private int rewrites = 0;

    private Sweep(TypeBinding binding) {
      this.binding = binding;
    }

    // Element writes are matched before their target is visited as an element read.
    private boolean pre(Locator locator, Ast.Node node) {
      if (node == null || node.kind() != Ast.Kind.ASSIGN_STMT) return true;

      Ast.AssignStmt assign = node.cast();
      if (!isElementWrite(assign)) return true;

      Ast.IndexExpr target = assign.lhs().get(0).cast();
      List<Ast.Expr> args = new ArrayList<>(target.indices());
      args.add(assign.rhs().get(0));
      rewrite(target.x(), OverloadableOperator.AT_SET, args)
          .ifPresent(call -> replace(locator, Ast.ExprStmt.of(call)));
      return true;
    }

    private boolean post(Locator locator, Ast.Node node) {
      if (node == null) return true;

      Optional<Ast.CallExpr> call = Optional.empty();
      switch (node.kind()) {
        case INDEX_EXPR:
          {
            if (isAssignmentTarget(locator)) break;

            Ast.IndexExpr indexExpr = node.cast();
            call = rewrite(indexExpr.x(), OverloadableOperator.AT, indexExpr.indices());
            break;
          }
        case BINARY_EXPR:
          {
            Ast.BinaryExpr binary = node.cast();
            call =
                OverloadableOperator.forBinary(binary.op())
                    .flatMap(op -> rewrite(binary.x(), op, ImmutableList.of(binary.y())));
            break;
          }
        default:
          break;
      }
      call.ifPresent(c -> replace(locator, c));
      return true;
    }

    private Optional<Ast.CallExpr> rewrite(
        Ast.Expr recv, OverloadableOperator op, List<Ast.Expr> args) {
      return binding
          .typeOf(recv)
          .flatMap(type -> typeResolver.lookupMethod(type, op.methodName()))
          .map(
              method ->
                  Ast.CallExpr.of(
                      Ast.SelectorExpr.of(asOperand(recv), Ast.Ident.of(method.name())),
                      args,
                      false));
    }

    private void replace(Locator locator, Ast.Node node) {
      locator.replace(node);
      rewrites++;
    }
  }

  // Receivers that bind looser than a selector need parentheses to stay the receiver.
  private static Ast.Expr asOperand(Ast.Expr recv) {
    switch (recv.kind()) {
      case UNARY_EXPR:
      case BINARY_EXPR:
      case STAR_EXPR:
      case KEY_VALUE_EXPR:
        return Ast.ParenExpr.of(recv);
      default:
        return recv;
    }
  }
}
