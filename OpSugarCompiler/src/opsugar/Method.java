package opsugar;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Method {
  public abstract String name();

  public abstract Type.SignatureType signature();

  public abstract boolean pointerReceiver();

  // "interface" for methods of unnamed interfaces.
  public abstract String owner();

  public static Method create(
      String name, Type.SignatureType signature, boolean pointerReceiver, String owner) {
    return new AutoValue_Method(name, signature, pointerReceiver, owner);
  }

  @Override
  public final String toString() {
    String recv = pointerReceiver() ? "*" + owner() : owner();
    return String.format("(%s).%s%s", recv, name(), signature().toString().substring(4));
  }
}
