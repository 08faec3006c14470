package com.cliffc.calc;

import com.cliffc.calc.ast.Ast;
import com.cliffc.calc.val.Val;

// Result of one top-level evaluation: a value, or an error, or neither for
// blank input.
public class ValEnv {
  public final Val _v;          // Result, or null
  public final Ast _ast;        // Tree as far as parsed and valued, or null
  public final ErrMsg _err;     // Error, or null
  ValEnv( Val v, Ast ast, ErrMsg err ) { _v=v; _ast=ast; _err=err; }
}
