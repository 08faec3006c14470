package com.cliffc.calc;

import com.cliffc.calc.util.SB;
import org.junit.*;
import org.junit.contrib.java.lang.system.SystemErrRule;
import org.junit.contrib.java.lang.system.SystemOutRule;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestREPL {
  // Replace STDOUT/STDERR and track them
  @Rule public final SystemOutRule sysOut = new SystemOutRule().enableLog().muteForSuccessfulTests();
  @Rule public final SystemErrRule sysErr = new SystemErrRule().enableLog().muteForSuccessfulTests();

  private Env _env;
  private int _lnum;
  @Before public void open_repl() {
    REPL.init();
    _env = new Env();
    _lnum = 1;
    // Drain the initial prompt string so tests do not expect one
    assertEquals(REPL.prompt,sysOut.getLog());
    sysOut.clearLog();
    assertTrue(sysErr.getLog().isEmpty());
  }

  @Test public void testREPL00() {
    test("2", "2");
  }

  // Basic REPL, with errors & recovery
  @Test public void testREPL01() {
    test("2+3", "5");
    test("x := 3", "3");
    test("x*x", "9");
    testerr("y*y", "Syntax Error: Undefined variable 'y'",0);
    test("* 2", "18");
    testerr("pi := 3", "Invalid Operation Error: Cannot assign to readonly variable 'pi'",3);
    testerr("1 + (2 $ 3)", "Syntax Error: Unknown character '$'",7);
    test("0b1100 & 0b1010", "0b1000");
    test("1.5 + 1.5", "3.0");
    test("", "");
  }

  @Test public void testMain() {
    Calc.main(new String[]{"2","+","3"});
    assertEquals("5"+System.lineSeparator(),sysOut.getLog());
    sysOut.clearLog();
    Calc.main(new String[]{"1/0"});
    assertEquals("args:1:1: Invalid Operation Error: Division by zero\n1/0\n ^\n",sysOut.getLog());
  }

  // Run the REPL one step on a line, read the STDOUT and compare.
  private void test( String line, String expected ) {
    REPL.go_one(_env,line,_lnum++);
    String exp = expected.isEmpty() ? REPL.prompt : expected+System.lineSeparator()+REPL.prompt;
    assertEquals(exp,sysOut.getLog());
    sysOut.clearLog();
    assertTrue(sysErr.getLog().isEmpty());
  }
  // Includes the lengthy error message: location, line, caret.
  private void testerr( String line, String expected, int cur_off ) {
    int lnum = _lnum;
    REPL.go_one(_env,line,_lnum++);
    String exp = new SB().p("stdin:").p(lnum).p(':').p(cur_off).p(": ").p(expected).nl().p(line).nl().rep(' ',cur_off).p('^').nl().p(REPL.prompt).toString();
    assertEquals(exp,sysOut.getLog());
    sysOut.clearLog();
    assertTrue(sysErr.getLog().isEmpty());
  }
}
