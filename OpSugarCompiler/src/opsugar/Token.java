package opsugar;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

public enum Token {
  // Arithmetic
  ADD("+", 4),
  SUB("-", 4),
  MUL("*", 5),
  QUO("/", 5),
  REM("%", 5),

  // Bitwise
  AND("&", 5),
  OR("|", 4),
  XOR("^", 4),
  SHL("<<", 5),
  SHR(">>", 5),
  AND_NOT("&^", 5),

  // Compound assignment
  ADD_ASSIGN("+="),
  SUB_ASSIGN("-="),
  MUL_ASSIGN("*="),
  QUO_ASSIGN("/="),
  REM_ASSIGN("%="),
  AND_ASSIGN("&="),
  OR_ASSIGN("|="),
  XOR_ASSIGN("^="),
  SHL_ASSIGN("<<="),
  SHR_ASSIGN(">>="),
  AND_NOT_ASSIGN("&^="),

  // Logical and comparison
  LAND("&&", 2),
  LOR("||", 1),
  ARROW("<-"),
  INC("++"),
  DEC("--"),
  EQL("==", 3),
  LSS("<", 3),
  GTR(">", 3),
  NOT("!"),
  NEQ("!=", 3),
  LEQ("<=", 3),
  GEQ(">=", 3),

  // Assignment
  ASSIGN("="),
  DEFINE(":="),

  // Keywords
  BREAK("break"),
  CONTINUE("continue"),
  GOTO("goto"),
  FALLTHROUGH("fallthrough"),
  IMPORT("import"),
  CONST("const"),
  TYPE("type"),
  VAR("var");

  private final String repr;
  private final int precedence;

  Token(String repr) {
    this(repr, 0);
  }

  Token(String repr, int precedence) {
    this.repr = repr;
    this.precedence = precedence;
  }

  public String repr() {
    return repr;
  }

  // Binary precedence, 1 (lowest) to 5; 0 for tokens that are not binary operators.
  public int precedence() {
    return precedence;
  }

  public boolean isBinaryOperator() {
    return precedence > 0;
  }

  public boolean isComparison() {
    return precedence == 3;
  }

  // For a compound assignment such as +=, the binary operator it applies.
  public Optional<Token> assignedOperator() {
    if (!name().endsWith("_ASSIGN")) return Optional.empty();
    return Optional.of(valueOf(name().substring(0, name().length() - "_ASSIGN".length())));
  }

  private static final ImmutableMap<String, Token> REPR_MAP =
      Maps.uniqueIndex(Arrays.asList(values()), Token::repr);

  public static Optional<Token> parse(String repr) {
    return Optional.ofNullable(REPR_MAP.get(repr));
  }

  @Override
  public String toString() {
    return repr;
  }
}
