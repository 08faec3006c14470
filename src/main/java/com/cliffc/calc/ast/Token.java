package com.cliffc.calc.ast;

import com.cliffc.calc.Pos;
import com.cliffc.calc.util.SB;

/** Immutable lexical token.  Implicit tokens are synthesized by the parser and
 *  have no corresponding input text; they carry the position of the token
 *  they were inserted in front of. */
public final class Token {
  public final TokenKind _kind;
  public final String _text;
  public final Pos _pos;
  public final boolean _implicit;

  public Token( TokenKind kind, String text, Pos pos ) { this(kind,text,pos,false); }
  private Token( TokenKind kind, String text, Pos pos, boolean implicit ) {
    _kind=kind; _text=text; _pos=pos; _implicit=implicit;
  }
  public static Token implicit( TokenKind kind, String text, Pos pos ) { return new Token(kind,text,pos,true); }

  // Same text and position, new kind.  Used to resolve ambiguous operators.
  public Token as( TokenKind kind ) { return new Token(kind,_text,_pos,_implicit); }

  public boolean is( TokenKind kind, String text ) { return _kind==kind && _text.equals(text); }
  // Postfix factorial
  public boolean is_fact() { return is(TokenKind.UnaryOperator,"!"); }

  @Override public String toString() { return str(new SB()).toString(); }
  public SB str( SB sb ) {
    sb.p("Token(").p(_kind.name());
    if( _implicit ) sb.p(" (implicit)");
    return sb.p(": \"").p(_text).p("\" at ").pobj(_pos).p(')');
  }
}
