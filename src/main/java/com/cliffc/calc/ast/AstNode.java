package com.cliffc.calc.ast;

import com.cliffc.calc.val.Val;
import com.cliffc.calc.util.SB;
import org.jetbrains.annotations.Nullable;

/** A node of the syntax tree: a token, its children (empty for terminals),
 *  and the value the evaluator resolved for it, if any.  The value is set at
 *  most once. */
public final class AstNode {
  Token _tok;
  Ast _kids;                    // Children, one level deeper than this node
  private Val _val;

  public AstNode( Token tok ) { _tok = tok; }

  public Token tok() { return _tok; }
  public TokenKind kind() { return _tok._kind; }
  public String text() { return _tok._text; }

  // Reclassify; the parser resolves ambiguous operators in place
  public void retok( Token tok ) { _tok = tok; }

  public boolean has_kids() { return _kids!=null && !_kids.isEmpty(); }
  public int nkids() { return _kids==null ? 0 : _kids.len(); }
  public AstNode kid( int i ) { return _kids.at(i); }
  public @Nullable Ast kids() { return _kids; }

  // Attach a subtree, releveled under this node.  Returns the old subtree.
  public Ast set_kids( Ast kids, int level ) {
    Ast old = _kids;
    _kids = kids;
    kids.relevel(level+1);
    return old;
  }

  public @Nullable Val val() { return _val; }
  public boolean has_val() { return _val!=null; }
  public void set_val( Val v ) {
    assert _val==null : "node valued twice: "+_tok;
    _val = v;
  }

  @Override public String toString() { return str(new SB()).toString(); }
  // "- Token(...) -> value", children on the following lines
  SB str( SB sb ) {
    _tok.str(sb.p("- "));
    if( _val!=null ) sb.p(" -> ").p(_val.typeName()).p('(').p(_val.toString()).p(')');
    if( has_kids() ) _kids.str(sb.nl());
    return sb;
  }
}
