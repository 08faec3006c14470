package com.cliffc.calc.ast;

// Closed set of token kinds, with the derived predicates the parser and
// evaluator branch on.
public enum TokenKind {
  AmbiguousOperator,
  UnaryOperator,
  BinaryOperator,
  UnaryFunctionIdentifier,
  BinaryFunctionIdentifier,
  VariableIdentifier,
  Bitseq,
  Integer,
  Decimal,
  Expression;                 // Un-recursed parenthesized span

  public boolean is_numeral () { return this==Bitseq || this==Integer || this==Decimal; }
  public boolean is_terminal() { return is_numeral() || this==VariableIdentifier; }
  public boolean is_operator() { return this==AmbiguousOperator || this==UnaryOperator || this==BinaryOperator; }
  public boolean is_unary   () { return this==UnaryOperator  || this==UnaryFunctionIdentifier ; }
  public boolean is_binary  () { return this==BinaryOperator || this==BinaryFunctionIdentifier; }
  public boolean is_function_identifier() { return this==UnaryFunctionIdentifier || this==BinaryFunctionIdentifier; }
}
