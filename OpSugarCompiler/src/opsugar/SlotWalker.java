package opsugar;

@FunctionalInterface
public interface SlotWalker {
  // Returns false to stop the walk.
  boolean walk(SyntaxNodeInterface parent, String slot, int index);
}
