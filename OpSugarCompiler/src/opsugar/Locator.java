package opsugar;

import com.google.auto.value.AutoValue;

// A negative index addresses a single slot.
@AutoValue
public abstract class Locator {
  public abstract Ast.Node parent();

  public abstract String slot();

  public abstract int index();

  public static Locator of(Ast.Node parent, String slot, int index) {
    return new AutoValue_Locator(parent, slot, index);
  }

  public final boolean isSequenceElement() {
    return index() >= 0;
  }

  public final Ast.Node get() {
    return SyntaxTree.getField(parent(), slot(), index());
  }

  public final void replace(Ast.Node node) {
    SyntaxTree.setField(parent(), slot(), index(), node);
  }

  @Override
  public final String toString() {
    String parentKind = parent().kind().name();
    return isSequenceElement()
        ? String.format("%s.%s[%d]", parentKind, slot(), index())
        : String.format("%s.%s", parentKind, slot());
  }
}
