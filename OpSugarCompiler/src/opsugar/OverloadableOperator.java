package opsugar;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

public enum OverloadableOperator {
  ADD("+", "ADD__"),
  SUB("-", "SUB__"),
  MUL("*", "MUL__"),
  QUO("/", "QUO__"),
  REM("%", "REM__"),

  // Element access
  AT("[]", "AT__"),
  AT_SET("[]=", "ATSET__");

  private final String symbol;
  private final String methodName;

  OverloadableOperator(String symbol, String methodName) {
    this.symbol = symbol;
    this.methodName = methodName;
  }

  public String symbol() {
    return symbol;
  }

  public String methodName() {
    return methodName;
  }

  private static final ImmutableMap<String, OverloadableOperator> SYMBOL_MAP =
      Maps.uniqueIndex(Arrays.asList(values()), OverloadableOperator::symbol);

  public static Optional<OverloadableOperator> parse(String symbol) {
    return Optional.ofNullable(SYMBOL_MAP.get(symbol));
  }

  public static Optional<OverloadableOperator> forBinary(Token token) {
    return token.isBinaryOperator() ? parse(token.repr()) : Optional.empty();
  }
}
