package opsugar;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class TokenTest {

  @Test
  public void precedenceOrdersBinaryOperators() {
    assertThat(Token.MUL.precedence()).isGreaterThan(Token.ADD.precedence());
    assertThat(Token.ADD.precedence()).isGreaterThan(Token.LSS.precedence());
    assertThat(Token.LAND.precedence()).isGreaterThan(Token.LOR.precedence());
    assertThat(Token.ASSIGN.isBinaryOperator()).isFalse();
  }

  @Test
  public void comparisons() {
    assertThat(Token.EQL.isComparison()).isTrue();
    assertThat(Token.GEQ.isComparison()).isTrue();
    assertThat(Token.ADD.isComparison()).isFalse();
    assertThat(Token.LAND.isComparison()).isFalse();
  }

  @Test
  public void compoundAssignmentsApplyTheirOperator() {
    assertThat(Token.ADD_ASSIGN.assignedOperator()).hasValue(Token.ADD);
    assertThat(Token.AND_NOT_ASSIGN.assignedOperator()).hasValue(Token.AND_NOT);
    assertThat(Token.ASSIGN.assignedOperator()).isEmpty();
    assertThat(Token.DEFINE.assignedOperator()).isEmpty();
  }

  @Test
  public void parsesRepresentations() {
    assertThat(Token.parse("<<=")).hasValue(Token.SHL_ASSIGN);
    assertThat(Token.parse(":=")).hasValue(Token.DEFINE);
    assertThat(Token.parse("[]")).isEmpty();
    assertThat(Token.SHL_ASSIGN.toString()).isEqualTo("<<=");
  }
}
