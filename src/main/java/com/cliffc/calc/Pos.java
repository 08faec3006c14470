package com.cliffc.calc;

/** A source position: line and column, both as given by the caller.  Columns
 *  are absolute against the original input, even for text nested inside
 *  parentheses. */
public final class Pos {
  public final int _line, _col;
  public Pos( int line, int col ) { _line=line; _col=col; }

  @Override public String toString() { return _line+":"+_col; }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Pos p && _line==p._line && _col==p._col;
  }
  @Override public int hashCode() { return _line*31+_col; }
}
