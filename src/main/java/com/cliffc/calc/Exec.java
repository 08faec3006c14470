package com.cliffc.calc;

import com.cliffc.calc.ast.Ast;
import com.cliffc.calc.val.Val;

/** Parse and evaluate one line of input against an environment. */
public abstract class Exec {
  // Parse, evaluate, and on success record the result for "mem".  Never
  // throws for bad input; errors come back in the ValEnv.
  public static ValEnv go( Env env, String src, String text, int line ) {
    Ast ast = null;
    try {
      ast = Parse.parse(text,line,0);
      if( Calc.DEBUG ) Calc.p(ast,"Parsed "+src+":"+line+"\n"+ast);
      Eval.eval(ast,env);
      if( Calc.DEBUG ) Calc.p(ast,"Valued "+src+":"+line+"\n"+ast);
      if( ast.isEmpty() ) return new ValEnv(null,ast,null);
      Val v = ast.at(0).val();
      env.record(v);
      return new ValEnv(v,ast,null);
    } catch( ErrMsg err ) {
      return new ValEnv(null,ast,err);
    }
  }
}
