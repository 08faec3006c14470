package com.cliffc.calc;

import com.cliffc.calc.ast.Ast;
import com.cliffc.calc.ast.AstNode;
import com.cliffc.calc.ast.Token;
import com.cliffc.calc.ast.TokenKind;

import java.util.Locale;

/** Tokenizer for one nesting level.  Parenthesized spans are not recursed
 *  into; each becomes a single {@link TokenKind#Expression} token carrying
 *  the raw text between the parens.  Every token position is absolute: the
 *  caller's line, and the caller's starting column plus the local offset.
 */
public class Lex {
  private final char[] _buf;    // Text at this level
  private final int _line, _col;// Absolute position of _buf[0]
  private int _x;               // Lexer index

  public Lex( String text, int line, int col ) {
    _buf = text.toCharArray();
    _line = line;
    _col = col;
  }

  /** Flat sequence of terminal nodes at the given level.
   *  @throws ErrMsg a syntax error at the offending character */
  public static Ast tokenize( String text, int line, int col, int level ) {
    return new Lex(text,line,col).go(level);
  }

  Ast go( int level ) {
    Ast ast = new Ast(level);
    Token tok;
    while( (tok=token())!=null )
      ast.add(new AstNode(tok));
    return ast;
  }

  // Next token, or null at end of input
  Token token() {
    if( skipWS() == -1 ) return null;
    char c = _buf[_x];
    int x = _x;
    if( c=='(' ) return expr();
    if( c==')' ) throw ErrMsg.syntax(pos(x),"Unexpected closing parenthesis");
    if( Oper.isNum0(c) ) {
      while( _x < _buf.length && Oper.isNum1(_buf[_x]) ) _x++;
      String s = str(x);
      TokenKind kind = s.indexOf('.')>=0 || s.indexOf(',')>=0 ? TokenKind.Decimal
        : s.startsWith("0b") || s.startsWith("0B") ? TokenKind.Bitseq
        : TokenKind.Integer;
      return new Token(kind,s,pos(x));
    }
    if( Oper.isId(c) ) {
      while( _x < _buf.length && Oper.isId(_buf[_x]) ) _x++;
      String s = str(x), lc = s.toLowerCase(Locale.ROOT);
      TokenKind kind = Oper.UNARY_FUNCS .contains(lc) ? TokenKind.UnaryFunctionIdentifier
        :              Oper.BINARY_FUNCS.contains(lc) ? TokenKind.BinaryFunctionIdentifier
        :              TokenKind.VariableIdentifier;
      return new Token(kind,s,pos(x));
    }
    if( Oper.isOp(c) ) {
      while( _x < _buf.length && Oper.isOp(_buf[_x]) ) _x++;
      String s = str(x);
      TokenKind kind = Oper.AMBIGUOUS.contains(s) ? TokenKind.AmbiguousOperator
        :              Oper.UNARY    .contains(s) ? TokenKind.UnaryOperator
        :              Oper.BINARY   .contains(s) ? TokenKind.BinaryOperator
        :              null;
      if( kind==null ) throw ErrMsg.syntax(pos(x),"Unknown operator '"+s+"'");
      return new Token(kind,s,pos(x));
    }
    throw ErrMsg.syntax(pos(x),"Unknown character '"+c+"'");
  }

  // Balanced parenthesized span; _x is at the open paren
  private Token expr() {
    int x = _x++, depth = 1;
    while( _x < _buf.length ) {
      char c = _buf[_x];
      if( c=='(' ) depth++;
      else if( c==')' && --depth==0 ) break;
      _x++;
    }
    if( depth > 0 ) throw ErrMsg.syntax(pos(x),"Could not match open parenthesis with closing parenthesis");
    String inner = new String(_buf,x+1,_x-x-1);
    _x++;                       // Skip the closing paren
    return new Token(TokenKind.Expression,inner,pos(x));
  }

  // Skip whitespace; return the next char or -1 at end
  private int skipWS() {
    while( _x < _buf.length ) {
      char c = _buf[_x];
      if( !Oper.isWS(c) ) return c;
      _x++;
    }
    return -1;
  }

  private String str( int x ) { return new String(_buf,x,_x-x); }
  Pos pos( int x ) { return new Pos(_line,_col+x); }
}
