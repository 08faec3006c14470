package com.cliffc.calc;

import com.cliffc.calc.ast.Ast;
import com.cliffc.calc.ast.Token;
import com.cliffc.calc.ast.TokenKind;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestLex {
  private static Ast lex( String s ) { return Lex.tokenize(s,1,0,0); }

  private static void check( Token t, TokenKind kind, String text, int col ) {
    assertEquals(kind,t._kind);
    assertEquals(text,t._text);
    assertEquals(new Pos(1,col),t._pos);
    assertFalse(t._implicit);
  }

  @Test public void testBasic() {
    Ast a = lex("2+3");
    assertEquals(3,a.len());
    check(a.at(0).tok(),TokenKind.Integer,"2",0);
    check(a.at(1).tok(),TokenKind.AmbiguousOperator,"+",1);
    check(a.at(2).tok(),TokenKind.Integer,"3",2);
  }

  @Test public void testKinds() {
    Ast a = lex("0b101 x (1+(2)) sin\tChoose 1.5 0x1F 3,25");
    assertEquals(8,a.len());
    check(a.at(0).tok(),TokenKind.Bitseq,"0b101",0);
    check(a.at(1).tok(),TokenKind.VariableIdentifier,"x",6);
    check(a.at(2).tok(),TokenKind.Expression,"1+(2)",8);
    check(a.at(3).tok(),TokenKind.UnaryFunctionIdentifier,"sin",16);
    check(a.at(4).tok(),TokenKind.BinaryFunctionIdentifier,"Choose",20);
    check(a.at(5).tok(),TokenKind.Decimal,"1.5",27);
    check(a.at(6).tok(),TokenKind.Integer,"0x1F",31);
    check(a.at(7).tok(),TokenKind.Decimal,"3,25",36);
    // Expressions are not recursed into by the lexer
    assertFalse(a.at(2).has_kids());
  }

  @Test public void testOperators() {
    Ast a = lex("a <<< b ! ¬c ~d := <=> ^|");
    check(a.at(1).tok(),TokenKind.BinaryOperator,"<<<",2);
    check(a.at(3).tok(),TokenKind.UnaryOperator,"!",8);
    check(a.at(4).tok(),TokenKind.UnaryOperator,"¬",10);
    check(a.at(6).tok(),TokenKind.UnaryOperator,"~",13);
    check(a.at(8).tok(),TokenKind.BinaryOperator,":=",16);
    check(a.at(9).tok(),TokenKind.BinaryOperator,"<=>",19);
    check(a.at(10).tok(),TokenKind.BinaryOperator,"^|",23);
    // Identifiers may use backslashes
    check(lex("\\inbase").at(0).tok(),TokenKind.VariableIdentifier,"\\inbase",0);
  }

  @Test public void testEmpty() {
    assertTrue(lex("").isEmpty());
    assertTrue(lex(" \t ").isEmpty());
  }

  // Positions are absolute: caller's line, caller's column plus offset
  @Test public void testOffset() {
    Ast a = Lex.tokenize("x + y",3,10,2);
    assertEquals(2,a.level());
    assertEquals(new Pos(3,14),a.at(2).tok()._pos);
  }

  private static void testerr( String s, String msg, int col ) {
    try { lex(s); fail(); }
    catch( ErrMsg e ) { assertEquals(ErrMsg.syntax(new Pos(1,col),msg),e); }
  }

  @Test public void testErrors() {
    testerr("2 $ 3"  ,"Unknown character '$'",2);
    testerr("2 +* 3" ,"Unknown operator '+*'",2);
    testerr("1 + (2" ,"Could not match open parenthesis with closing parenthesis",4);
    testerr("1+2)"   ,"Unexpected closing parenthesis",3);
  }
}
