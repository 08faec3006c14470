package com.cliffc.calc;

import java.util.Scanner;

/** Read-eval-print loop over stdin.  One expression per line; each result is
 *  printed and becomes "mem 0" for the next line.
 */
public abstract class REPL {
  public static final String prompt="> ";
  public static Env go( ) {
    Env env = new Env();
    init();
    Scanner stdin = new Scanner(System.in);
    int lnum = 1;
    while( stdin.hasNextLine() )
      go_one(env,stdin.nextLine(),lnum++);
    return env;
  }

  static void init() {
    System.out.print(prompt);
    System.out.flush();
  }

  static void go_one( Env env, String line, int lnum ) {
    ValEnv ve = Exec.go(env,"stdin",line,lnum);
    if( ve._err != null )
      System.out.print( ve._err.errLocMsg("stdin",line) );
    else if( ve._v != null )
      System.out.println( ve._v );
    System.out.print(prompt);
    System.out.flush();
  }
}
