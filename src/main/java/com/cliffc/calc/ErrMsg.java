package com.cliffc.calc;

import com.cliffc.calc.util.SB;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

// Error messages.  Every recoverable failure of parsing or evaluation.
public class ErrMsg extends RuntimeException {

  // Error levels
  public enum Level {
    Syntax,                   // Malformed input, unknown names, bad literals
    Conversion,               // Lossy or impossible numeric conversion
    InvalidOp,                // Valid syntax, but operation undefined for these values
  }

  public final Pos _loc;      // Point in code to blame, or null if unknown
  public final String _msg;   // Printable error message, minus code context
  public final Level _lvl;    // Error family

  public ErrMsg(@Nullable Pos loc, @NotNull String msg, @NotNull Level lvl) {
    super(msg);
    _loc=loc; _msg=msg; _lvl=lvl;
  }
  public static ErrMsg syntax    (Pos loc, String msg) { return new ErrMsg(loc,msg,Level.Syntax    ); }
  public static ErrMsg conversion(         String msg) { return new ErrMsg(null,msg,Level.Conversion); }
  public static ErrMsg invalid   (         String msg) { return new ErrMsg(null,msg,Level.InvalidOp ); }

  // Attach a location, if one is not already known.  Errors raised deep in
  // value arithmetic do not know where they are; the evaluator does.
  public ErrMsg at( Pos loc ) {
    return _loc!=null || loc==null ? this : new ErrMsg(loc,_msg,_lvl);
  }

  public boolean is_syntax() { return _lvl==Level.Syntax; }

  // "Syntax Error: msg at 1:5"
  @Override public String toString() {
    SB sb = new SB().p(name()).p(": ").p(_msg);
    return (_loc==null ? sb : sb.p(" at ").pobj(_loc)).toString();
  }
  String name() {
    return switch( _lvl ) {
    case Syntax     -> "Syntax Error";
    case Conversion -> "Conversion Error";
    case InvalidOp  -> "Invalid Operation Error";
    };
  }

  /** Error message with code context: "src:line:col: msg", then the source
   *  line, then a caret under the column.  The column is counted from the
   *  given line's start. */
  public String errLocMsg( String src, String line ) {
    SB sb = new SB().p(src).p(':');
    if( _loc==null ) return sb.p(' ').p(name()).p(": ").p(_msg).nl().toString();
    sb.p(_loc._line).p(':').p(_loc._col).p(": ").p(name()).p(": ").p(_msg).nl();
    sb.p(line).nl();
    return sb.rep(' ',Math.min(_loc._col,line.length())).p('^').nl().toString();
  }

  @Override public boolean equals(Object obj) {
    if( this==obj ) return true;
    if( !(obj instanceof ErrMsg err) ) return false;
    if( _lvl!=err._lvl || !_msg.equals(err._msg) ) return false;
    return _loc==err._loc || (_loc!=null && _loc.equals(err._loc));
  }
  @Override public int hashCode() {
    return (_loc==null ? 0 : _loc.hashCode())+_msg.hashCode()+_lvl.hashCode();
  }
}
