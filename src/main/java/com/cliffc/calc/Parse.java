package com.cliffc.calc;

import com.cliffc.calc.ast.Ast;
import com.cliffc.calc.ast.AstNode;
import com.cliffc.calc.ast.Token;
import com.cliffc.calc.ast.TokenKind;

/** Structural parser for calculator expressions.
 *
 *  GRAMMAR (informal, per nesting level):
 *  expr = [term [binop term]*]      // binops fold by PRECEDENCE tier, right-to-left within a tier
 *  term = [uniop | ufun]* post      // prefix unary operators and unary functions
 *  post = fact ['!']*               // postfix factorial
 *  fact = num | id | (expr)
 *  term term                        // adjacent values multiply: "2 x" is "2 * x"
 *  binop term ...                   // at top level only, a leading binop takes the previous result: "* 3" is "(mem 0) * 3"
 *
 *  Parsing is not recursive descent.  Each level is tokenized flat, then
 *  rewritten in place by a fixed series of passes:
 *  <ol>
 *    <li>recurse into every parenthesized span, one level down;</li>
 *    <li>resolve each ambiguous '+' or '-' into a unary or binary operator;</li>
 *    <li>splice an implicit '*' between adjacent values;</li>
 *    <li>at top level, prepend the previous result if the input opens with a binop;</li>
 *    <li>fold operands into their operators: factorials left-to-right, then
 *        prefix unary operators and functions right-to-left, then binary
 *        operators one precedence tier at a time.</li>
 *  </ol>
 *  After folding, a level holds at most one node, every interior node has
 *  exactly the children its arity requires, and every Expression node has
 *  its folded subtree as its single child.
 */
public class Parse {
  private Parse() {}

  /** Parse text into a folded tree at level 0.
   *  @param line line number of the text, used in error positions
   *  @param col  column of the first character, used in error positions
   *  @throws ErrMsg a syntax error at the offending token */
  public static Ast parse( String text, int line, int col ) {
    return parse(text,line,col,0);
  }

  static Ast parse( String text, int line, int col, int level ) {
    Ast ast = Lex.tokenize(text,line,col,level);
    for( AstNode n : ast )
      if( n.kind()==TokenKind.Expression ) {
        Pos pos = n.tok()._pos;
        if( level+1 > Ast.MAX_DEPTH ) throw ErrMsg.syntax(pos,"Expression nested too deeply");
        Ast kids = parse(n.text(),pos._line,pos._col+1,level+1);
        if( kids.isEmpty() ) throw ErrMsg.syntax(pos,"Empty parenthesized expression");
        n.set_kids(kids,level);
      }
    disambiguate(ast);
    implicit_mul(ast);
    implicit_mem0(ast);
    incorporate(ast);
    if( ast.len() > 1 ) throw ErrMsg.syntax(ast.at(1).tok()._pos,"Unexpected operand");
    return ast;
  }

  // A complete value: terminal, parenthesized, or a postfix factorial
  static boolean is_value( Token t ) {
    return t._kind.is_terminal() || t._kind==TokenKind.Expression || t.is_fact();
  }
  // Something a value can start with
  static boolean starts_value( Token t ) {
    return t._kind.is_terminal() || t._kind==TokenKind.Expression || t._kind==TokenKind.UnaryFunctionIdentifier ||
      (t._kind==TokenKind.UnaryOperator && !t.is_fact());
  }

  // Resolve every ambiguous '+' or '-', left to right
  static void disambiguate( Ast ast ) {
    for( int i=0; i<ast.len(); i++ ) {
      AstNode n = ast.at(i);
      Token t = n.tok();
      if( t._kind!=TokenKind.AmbiguousOperator ) continue;
      // At top level a leading operator takes the previous result
      boolean left = i==0 ? ast.level()==0 : is_value(ast.at(i-1).tok());
      boolean right = false;
      if( i+1 < ast.len() ) {
        Token r = ast.at(i+1).tok();
        if( r.is_fact() )
          throw ErrMsg.syntax(t._pos,"Ambiguous operator '"+t._text+"' cannot precede unary operator '!'");
        right = r._kind==TokenKind.AmbiguousOperator || starts_value(r);
      }
      if( left && right ) n.retok(t.as(TokenKind.BinaryOperator));
      else if( right )    n.retok(t.as(TokenKind.UnaryOperator ));
      else throw ErrMsg.syntax(t._pos,"Could not disambiguate ambiguous operator '"+t._text+"', consider using parentheses");
    }
  }

  // Splice an implicit '*' between each value and a following value start
  static void implicit_mul( Ast ast ) {
    for( int i=0; i+1<ast.len(); i++ ) {
      Token r = ast.at(i+1).tok();
      if( is_value(ast.at(i).tok()) && starts_value(r) )
        ast.insert(++i,new AstNode(Token.implicit(TokenKind.BinaryOperator,Oper.MUL,r._pos)));
    }
  }

  // At top level, a leading binop gets the previous result as its left
  // operand: an implicit "(mem 0)".
  static void implicit_mem0( Ast ast ) {
    if( ast.level() > 0 || ast.isEmpty() ) return;
    Token t = ast.at(0).tok();
    if( !t._kind.is_binary() ) return;
    Pos pos = t._pos;
    AstNode zero = new AstNode(Token.implicit(TokenKind.Integer,"0",pos));
    AstNode mem  = new AstNode(Token.implicit(TokenKind.UnaryFunctionIdentifier,Oper.MEM,pos));
    AstNode expr = new AstNode(Token.implicit(TokenKind.Expression,"(mem 0)",pos));
    mem .set_kids(new Ast(0,zero),0);
    expr.set_kids(new Ast(0,mem ),0);
    ast.insert(0,expr);
  }

  static void incorporate( Ast ast ) {
    factorials(ast);
    unaries(ast);
    for( String[] tier : Oper.PRECEDENCE )
      binaries(ast,tier);
  }

  // Operand of a fold: a value, or an already folded node
  private static boolean is_operand( AstNode n ) { return n.has_kids() || is_value(n.tok()); }

  // Postfix '!', left to right, so "x!!" is "(x!)!"
  static void factorials( Ast ast ) {
    for( int i=0; i<ast.len(); i++ ) {
      AstNode n = ast.at(i);
      if( !n.tok().is_fact() || n.has_kids() ) continue;
      if( i==0 || !is_operand(ast.at(i-1)) )
        throw ErrMsg.syntax(n.tok()._pos,"Unary operator '!' is missing a left-hand operand");
      n.set_kids(new Ast(0,ast.remove(--i)),ast.level());
    }
  }

  // Prefix unary operators and unary functions, right to left, so "- + x" is "-(+(x))"
  static void unaries( Ast ast ) {
    for( int i=ast.len()-1; i>=0; i-- ) {
      AstNode n = ast.at(i);
      if( !n.kind().is_unary() || n.tok().is_fact() || n.has_kids() ) continue;
      if( i+1 >= ast.len() || !is_operand(ast.at(i+1)) )
        throw ErrMsg.syntax(n.tok()._pos,"Unary operator '"+n.text()+"' is missing a right-hand operand");
      n.set_kids(new Ast(0,ast.remove(i+1)),ast.level());
    }
  }

  // One precedence tier of binary operators and functions, right to left
  static void binaries( Ast ast, String[] tier ) {
    for( int i=ast.len()-1; i>=0; i-- ) {
      AstNode n = ast.at(i);
      if( !n.kind().is_binary() || n.has_kids() || !in_tier(n.text(),tier) ) continue;
      String kind = n.kind()==TokenKind.BinaryOperator ? "Binary operator" : "Binary function";
      if( i==0 || !is_operand(ast.at(i-1)) )
        throw ErrMsg.syntax(n.tok()._pos,kind+" '"+n.text()+"' is missing a left-hand operand");
      if( i+1 >= ast.len() || !is_operand(ast.at(i+1)) )
        throw ErrMsg.syntax(n.tok()._pos,kind+" '"+n.text()+"' is missing a right-hand operand");
      AstNode rhs = ast.remove(i+1);
      AstNode lhs = ast.remove(--i);
      n.set_kids(new Ast(0,lhs,rhs),ast.level());
    }
  }
  private static boolean in_tier( String s, String[] tier ) {
    for( String op : tier )
      if( op.equalsIgnoreCase(s) ) return true;
    return false;
  }
}
