package com.cliffc.calc;

/** An arbitrary-precision calculator: command-line entry and global flags.
 */

public abstract class Calc {
  // Parser or evaluator defect; never a user error
  public static IllegalStateException TODO( String msg) { return new IllegalStateException(msg); }

  // Debug printing to stderr; set with -d
  public static boolean DEBUG = false;

  public static void main( String[] args ) {
    int x=0;
    if( args.length > 0 && args[0].equals("-d") ) { DEBUG=true; x++; }
    // Command line program
    if( args.length > x ) {
      String prog = String.join(" ",java.util.Arrays.copyOfRange(args,x,args.length));
      ValEnv ve = Exec.go(new Env(),"args",prog,1);
      if( ve._err!=null ) System.out.print(ve._err.errLocMsg("args",prog));
      else if( ve._v!=null ) System.out.println(ve._v);
    } else {
      REPL.go();
    }
  }

  // Debug printers
  public static <T> T p(T x, String s) {
    if( !DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
