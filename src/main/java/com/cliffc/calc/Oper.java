package com.cliffc.calc;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/** Operator and builtin-name tables.  Static configuration; nothing here
 *  changes after class init.

  Lexical classes, by first character:
  - whitespace: blank or tab, skipped
  - numeral: digit, '.' or ','; continues with hex digits, radix letters, separators
  - identifier: a letter or '\'; continues with the same
  - operator: any of +-!^*%/¬<>=:&|?~ ; greedy, so "<<<" is one token

  Operator roles:
  - ambiguous: + -     ; resolved to unary or binary by the parser
  - unary:     + - ! ¬ ~ ; '!' is postfix factorial, the rest are prefix
  - binary:    see PRECEDENCE

  Binary precedence, tightest first.  Within a tier operators group
  right-to-left, so a*b/c is a*(b/c).
 */
public abstract class Oper {
  public static final String WS_CHARS       = " \t";
  public static final String NUM0_CHARS     = "0123456789.,";
  public static final String NUM1_CHARS     = "0123456789.,abcdefoxABCDEFOX_";
  public static final String OP_CHARS       = "+-!^*/%¬<>=:&|?~";

  static boolean isWS  ( char c ) { return WS_CHARS  .indexOf(c) != -1; }
  static boolean isNum0( char c ) { return NUM0_CHARS.indexOf(c) != -1; }
  static boolean isNum1( char c ) { return NUM1_CHARS.indexOf(c) != -1; }
  static boolean isOp  ( char c ) { return OP_CHARS  .indexOf(c) != -1; }
  static boolean isId  ( char c ) { return ('a'<=c && c<='z') || ('A'<=c && c<='Z') || c=='\\'; }

  public static final Set<String> AMBIGUOUS = set("+","-");
  public static final Set<String> UNARY     = set("+","-","!","¬","~");
  public static final Set<String> BINARY    = set("^","*","/","%","+","-","<=>","<=",">=",":=","<<<",">>>","<<",">>","<",">",
                                                  "!=","==","&&","||","??","!?","&","|","^|");
  // Builtin function names; matched case-insensitively
  public static final Set<String> UNARY_FUNCS  = set("abs","not","sin","cos","tan","cot","sec","csc","exp","ln","lg","log",
                                                     "sqrt","cbrt","gamma","mem");
  public static final Set<String> BINARY_FUNCS = set("rt","logb","choose");

  public static final String FACT = "!";
  public static final String MUL  = "*";
  public static final String MEM  = "mem";

  public static final String[][] PRECEDENCE = {
    {"^"},                                           // Exponentiation
    {"rt","logb","choose"},                          // Binary functions
    {"*","/","%"},                                   // Multiplication, division, modulo
    {"+","-"},                                       // Addition, subtraction
    {"<<",">>","<<<",">>>"},                         // Shifts and rotations
    {"&"},                                           // Bitwise and
    {"|"},                                           // Bitwise or
    {"^|"},                                          // Bitwise xor
    {">","<","<=",">=","!=","==","<=>","??","!?"},   // Comparisons
    {"&&","||"},                                     // Logical
    {":="},                                          // Assignment
  };

  private static Set<String> set( String... ss ) { return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(ss))); }
}
