package com.cliffc.calc.val;

// The three value variants
public enum ValKind {
  BITS("Bitseq"),
  INT ("Integer"),
  DEC ("Decimal");

  public final String _name;
  ValKind( String name ) { _name=name; }
}
