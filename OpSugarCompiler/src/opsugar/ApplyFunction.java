package opsugar;

// Also called for empty single slots, with a null node.
@FunctionalInterface
public interface ApplyFunction {
  boolean apply(Locator locator, Ast.Node node);
}
