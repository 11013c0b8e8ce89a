package opsugar;

import com.google.common.base.Preconditions;
import com.google.common.base.VerifyException;

public final class SyntaxTree {

  private static final String ROOT_SLOT = "node";

  /**
   * Traverses {@code root} and its descendants, calling {@code pre} before and {@code post}
   * after the children of each node, and returns the possibly replaced root.
   *
   * <p>Children are visited in the slot order declared by their parent's kind, sequence slots
   * from the first element to the last. Both callbacks also see empty single slots, with a null
   * node. If {@code pre} returns false the node's children and its {@code post} call are
   * skipped. The children walked are those of the node occupying the locator once {@code pre}
   * returns, so a node replaced by {@code pre} has its replacement walked instead. If {@code
   * post} returns false the traversal ends immediately and {@code apply} returns normally.
   * Exceptions thrown by the callbacks propagate.
   *
   * <p>Either callback may be null.
   *
   * @throws VerifyException if the tree holds a node of an unregistered kind
   */
  public static Ast.Node apply(Ast.Node root, ApplyFunction pre, ApplyFunction post) {
    Ast.TreeRoot holder = Ast.TreeRoot.of(root);
    new Application(pre, post).walk(holder, ROOT_SLOT, -1);
    return holder.node();
  }

  /**
   * Returns the node attached at {@code (parent, slot, index)}.
   *
   * @throws IllegalArgumentException if the slot does not exist, or {@code index} does not
   *     match the slot's shape
   * @throws IndexOutOfBoundsException if {@code index} is past the end of a sequence slot
   */
  public static Ast.Node getField(Ast.Node parent, String slot, int index) {
    Preconditions.checkNotNull(parent, "parent");
    checkKind(parent);
    return checkKind(parent.child(slot, index));
  }

  /**
   * Attaches {@code node} at {@code (parent, slot, index)}, detaching the current occupant. A
   * negative index addresses a single slot, any other index an element of a sequence slot.
   *
   * @throws IllegalArgumentException if the slot does not exist, {@code index} does not match
   *     the slot's shape, or {@code node} does not belong to the slot's category
   * @throws IndexOutOfBoundsException if {@code index} is past the end of a sequence slot
   * @throws VerifyException if {@code parent} or {@code node} is of an unregistered kind
   */
  public static void setField(Ast.Node parent, String slot, int index, Ast.Node node) {
    Preconditions.checkNotNull(parent, "parent");
    checkKind(parent);
    parent.setChild(slot, index, checkKind(node));
  }

  private static Ast.Node checkKind(SyntaxNodeInterface node) {
    if (node == null) return null;
    if (!SyntaxKinds.isRegistered(node)) {
      throw new VerifyException(
          String.format("unexpected node type %s", node.getClass().getName()));
    }
    return (Ast.Node) node;
  }

  private static final class Application implements SlotWalker {
    private final ApplyFunction pre;
    private final ApplyFunction post;

    private Application(ApplyFunction pre, ApplyFunction post) {
      this.pre = pre;
      this.post = post;
    }

    // Returns false once post has asked to stop.
    @Override
    public boolean walk(SyntaxNodeInterface parent, String slot, int index) {
      Locator locator = Locator.of(checkKind(parent), slot, index);
      Ast.Node node = checkKind(parent.child(slot, index));
      if (pre != null) {
        if (!pre.apply(locator, node)) return true;
        node = checkKind(parent.child(slot, index));
      }

      if (node != null && !node.walkChildren(this)) return false;

      return post == null || post.apply(locator, node);
    }
  }

  private SyntaxTree() {}
}
