package com.cliffc.calc;

import com.cliffc.calc.ast.Ast;
import com.cliffc.calc.ast.AstNode;
import com.cliffc.calc.ast.Token;
import com.cliffc.calc.ast.TokenKind;
import com.cliffc.calc.val.Val;

/** Tree-walking evaluator.  Post-order, children left to right; every node
 *  gets its value attached.  Nodes already valued are skipped, so evaluating
 *  a tree twice changes nothing.
 *
 *  User errors are {@link ErrMsg}s positioned at the node that failed.  A
 *  tree whose shape the parser should never produce is a defect, reported
 *  with {@link Calc#TODO}.
 */
public class Eval {
  private final Env _env;
  public Eval( Env env ) { _env = env; }

  /** Value every node of the tree.
   *  @throws ErrMsg on the first failing node */
  public static void eval( Ast ast, Env env ) {
    Eval e = new Eval(env);
    for( AstNode n : ast ) e.eval(n);
  }

  public Val eval( AstNode n ) {
    if( n.has_val() ) return n.val();
    Token t = n.tok();
    TokenKind k = t._kind;
    if( k.is_numeral() ) {
      n.set_val(at(t,() -> Val.valueOf(t._text,t._pos)));
    } else if( k==TokenKind.VariableIdentifier ) {
      Val v = _env._vars.get(t._text);
      if( v==null ) throw ErrMsg.syntax(t._pos,"Undefined variable '"+t._text+"'");
      n.set_val(v);
    } else if( k==TokenKind.Expression ) {
      if( n.nkids()!=1 ) throw Calc.TODO("Expression with "+n.nkids()+" children: "+t);
      n.set_val(eval(n.kid(0)));
    } else if( !n.has_kids() ) {
      throw Calc.TODO("Non-terminal without children: "+t);
    } else if( k.is_unary() ) {
      if( n.nkids()!=1 ) throw Calc.TODO("Unary node with "+n.nkids()+" children: "+t);
      Val x = eval(n.kid(0));
      n.set_val(at(t,() -> unary(t,x)));
    } else if( k.is_binary() ) {
      if( n.nkids()!=2 ) throw Calc.TODO("Binary node with "+n.nkids()+" children: "+t);
      if( t.is(TokenKind.BinaryOperator,":=") ) return assign(n);
      Val x = eval(n.kid(0));
      Val y = eval(n.kid(1));
      n.set_val(at(t,() -> binary(t,x,y)));
    } else {
      throw Calc.TODO("Unexpected node: "+t);
    }
    return n.val();
  }

  private Val unary( Token t, Val x ) {
    if( t._kind==TokenKind.UnaryOperator ) {
      Prim.Op1 op = Prim.uniop(t._text);
      if( op==null ) throw Calc.TODO("No unary operator '"+t._text+"'");
      return op.op(x);
    }
    if( t._text.equalsIgnoreCase(Oper.MEM) ) return _env.mem(x);
    Prim.Op1 f = Prim.unifun(t._text);
    if( f==null ) throw ErrMsg.syntax(t._pos,"Undefined function '"+t._text+"'");
    return f.op(x);
  }

  private Val binary( Token t, Val x, Val y ) {
    if( t._kind==TokenKind.BinaryOperator ) {
      Prim.Op2 op = Prim.binop(t._text);
      if( op==null ) throw Calc.TODO("No binary operator '"+t._text+"'");
      return op.op(x,y);
    }
    Prim.Op2 f = Prim.binfun(t._text);
    if( f==null ) throw ErrMsg.syntax(t._pos,"Undefined function '"+t._text+"'");
    return f.op(x,y);
  }

  // "id := expr".  The left side is a name to bind, not a value to look up.
  private Val assign( AstNode n ) {
    Token t = n.tok();
    AstNode lhs = n.kid(0);
    if( lhs.kind()!=TokenKind.VariableIdentifier )
      throw ErrMsg.syntax(lhs.tok()._pos,"Left-hand side of ':=' must be a variable, but is '"+lhs.text()+"'");
    Val v = eval(n.kid(1));
    if( !_env._vars.set(lhs.text(),v) )
      throw ErrMsg.invalid("Cannot assign to readonly variable '"+lhs.text()+"'").at(t._pos);
    if( !lhs.has_val() ) lhs.set_val(v);
    n.set_val(v);
    return v;
  }

  private interface Op { Val op(); }
  // Run op, blaming t for any error that does not know its own position.
  // Arithmetic the range checks did not foresee (an exponent out of
  // BigDecimal's scale) is still an invalid operation, not a crash.
  private static Val at( Token t, Op op ) {
    try { return op.op(); }
    catch( ErrMsg e ) { throw e.at(t._pos); }
    catch( ArithmeticException e ) { throw ErrMsg.invalid("Arithmetic failure: "+e.getMessage()).at(t._pos); }
  }
}
