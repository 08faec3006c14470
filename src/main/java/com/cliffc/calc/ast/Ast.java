package com.cliffc.calc.ast;

import com.cliffc.calc.ErrMsg;
import com.cliffc.calc.util.Ary;
import com.cliffc.calc.util.SB;

import java.util.Iterator;

/** An ordered sequence of sibling nodes at one nesting level.  Level 0 is the
 *  top; every child sequence is one level deeper than the node owning it.
 *  The structural parser mutates the sequence in place by index (splice in,
 *  splice out), and every structural change must call {@link #relevel}. */
public final class Ast implements Iterable<AstNode> {
  // Deepest allowed level; guards both the parser and the evaluator recursion
  public static final int MAX_DEPTH = 1024;

  private final Ary<AstNode> _nodes = new Ary<>(new AstNode[2],0);
  private int _level;

  public Ast( int level ) { _level = level; }
  public Ast( int level, AstNode... nodes ) {
    this(level);
    for( AstNode n : nodes ) _nodes.add(n);
    relevel(level);
  }

  public int level() { return _level; }
  public int len() { return _nodes.len(); }
  public boolean isEmpty() { return _nodes.isEmpty(); }
  public AstNode at( int i ) { return _nodes.at(i); }

  public Ast add( AstNode n ) { _nodes.add(n); relevel_kids(n); return this; }
  public Ast insert( int i, AstNode n ) { _nodes.insert(i,n); relevel_kids(n); return this; }
  public AstNode remove( int i ) { return _nodes.remove(i); }

  /** Recompute levels: this sequence takes {@code level}, every child
   *  sequence takes its parent's level plus one. */
  public void relevel( int level ) {
    if( level > MAX_DEPTH )
      throw ErrMsg.syntax(_nodes.isEmpty() ? null : _nodes.at(0).tok()._pos, "Expression nested too deeply: parentheses and chained operators exceed "+MAX_DEPTH+" levels");
    _level = level;
    for( AstNode n : _nodes ) relevel_kids(n);
  }
  private void relevel_kids( AstNode n ) {
    if( n._kids!=null ) n._kids.relevel(_level+1);
  }

  @Override public Iterator<AstNode> iterator() { return _nodes.iterator(); }

  // One line per node: level, indentation, node; children nest below.
  @Override public String toString() { return str(new SB()).toString(); }
  SB str( SB sb ) {
    for( AstNode n : _nodes ) {
      sb.p(String.format("%2d ",_level)).rep(' ',4*_level);
      n.str(sb).nl();
    }
    return _nodes.isEmpty() ? sb : sb.unchar();
  }
}
