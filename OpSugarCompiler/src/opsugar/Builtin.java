package opsugar;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

enum Builtin {
  APPEND("append"),
  CAP("cap"),
  LEN("len"),
  MAKE("make"),
  NEW("new"),
  PANIC("panic"),
  PRINT("print"),
  PRINTLN("println");

  private final String repr;

  Builtin(String repr) {
    this.repr = repr;
  }

  public String repr() {
    return repr;
  }

  public boolean isStatement() {
    switch (this) {
      case PANIC:
      case PRINT:
      case PRINTLN:
        return true;
      default:
        return false;
    }
  }

  private static final ImmutableMap<String, Builtin> REPR_MAP =
      Maps.uniqueIndex(Arrays.asList(values()), Builtin::repr);

  public static Optional<Builtin> parse(String repr) {
    return Optional.ofNullable(REPR_MAP.get(repr));
  }
}
