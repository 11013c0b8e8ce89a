package opsugar;

import com.google.common.collect.ImmutableList;

public interface SyntaxNodeInterface {
  <V> V accept(SyntaxVisitor<V> visitor, V value);

  <V> V visitChildren(SyntaxVisitor<V> visitor, V value);

  ImmutableList<String> slotNames();

  // Calls walker for every slot position, stopping when it returns false.
  boolean walkChildren(SlotWalker walker);

  SyntaxNodeInterface child(String slot, int index);

  void setChild(String slot, int index, SyntaxNodeInterface node);
}
