package opsugar;

import java.util.List;

import com.google.common.base.Preconditions;

public final class SyntaxNodeUtils {
  public static <V> V accept(SyntaxNodeInterface obj, SyntaxVisitor<V> visitor, V value) {
    return obj == null ? value : obj.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends SyntaxNodeInterface> obj, SyntaxVisitor<V> visitor, V value) {
    for (SyntaxNodeInterface o : obj) {
      value = accept(o, visitor, value);
    }
    return value;
  }

  public static void checkSingleSlot(SyntaxNodeInterface parent, String slot, int index) {
    Preconditions.checkArgument(
        index < 0,
        "slot '%s' of %s holds a single node, but index %s was given",
        slot,
        kindName(parent),
        index);
  }

  public static SyntaxNodeInterface element(
      SyntaxNodeInterface parent,
      String slot,
      int index,
      List<? extends SyntaxNodeInterface> list) {
    checkSequenceIndex(parent, slot, index, list);
    return list.get(index);
  }

  public static <T extends SyntaxNodeInterface> void setElement(
      Class<T> category,
      SyntaxNodeInterface parent,
      String slot,
      int index,
      List<T> list,
      SyntaxNodeInterface node) {
    checkSequenceIndex(parent, slot, index, list);
    Preconditions.checkArgument(
        node != null, "slot '%s' of %s cannot hold null elements", slot, kindName(parent));
    list.set(index, checkCategory(category, parent, slot, node));
  }

  public static <T extends SyntaxNodeInterface> T checkCategory(
      Class<T> category, SyntaxNodeInterface parent, String slot, SyntaxNodeInterface node) {
    if (node == null) return null;

    Preconditions.checkArgument(
        category.isInstance(node),
        "slot '%s' of %s takes %s nodes, but was given %s",
        slot,
        kindName(parent),
        category.getSimpleName(),
        kindName(node));
    return category.cast(node);
  }

  public static IllegalArgumentException noSuchSlot(SyntaxNodeInterface parent, String slot) {
    return new IllegalArgumentException(
        String.format(
            "%s has no slot '%s'; slots are %s", kindName(parent), slot, parent.slotNames()));
  }

  private static void checkSequenceIndex(
      SyntaxNodeInterface parent, String slot, int index, List<?> list) {
    Preconditions.checkArgument(
        index >= 0, "slot '%s' of %s is a sequence and needs an index", slot, kindName(parent));
    Preconditions.checkElementIndex(
        index, list.size(), String.format("slot '%s' of %s", slot, kindName(parent)));
  }

  static String kindName(Object node) {
    return node.getClass().getSimpleName();
  }

  private SyntaxNodeUtils() {}
}
