package opsugar;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class OverloadableOperatorTest {

  @Test
  public void parsesSymbols() {
    assertThat(OverloadableOperator.parse("+")).hasValue(OverloadableOperator.ADD);
    assertThat(OverloadableOperator.parse("[]")).hasValue(OverloadableOperator.AT);
    assertThat(OverloadableOperator.parse("[]=")).hasValue(OverloadableOperator.AT_SET);
    assertThat(OverloadableOperator.parse("==")).isEmpty();
    assertThat(OverloadableOperator.parse("ADD__")).isEmpty();
  }

  @Test
  public void methodNamesAreIdentifiers() {
    for (OverloadableOperator op : OverloadableOperator.values()) {
      assertThat(op.methodName()).matches("[A-Z]+__");
    }
    assertThat(OverloadableOperator.AT_SET.methodName()).isEqualTo("ATSET__");
  }

  @Test
  public void binaryTokensMapToArithmeticOperators() {
    assertThat(OverloadableOperator.forBinary(Token.ADD)).hasValue(OverloadableOperator.ADD);
    assertThat(OverloadableOperator.forBinary(Token.REM)).hasValue(OverloadableOperator.REM);
    assertThat(OverloadableOperator.forBinary(Token.AND)).isEmpty();
    assertThat(OverloadableOperator.forBinary(Token.EQL)).isEmpty();
    // Compound assignments share a symbol prefix but are not binary operators.
    assertThat(OverloadableOperator.forBinary(Token.ADD_ASSIGN)).isEmpty();
  }
}
