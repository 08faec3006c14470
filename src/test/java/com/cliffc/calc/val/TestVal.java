package com.cliffc.calc.val;

import com.cliffc.calc.ErrMsg;
import com.cliffc.calc.Pos;
import org.junit.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.Assert.*;

public class TestVal {
  private static Val v( String s ) { return Val.valueOf(s,new Pos(1,0)); }
  private static IntVal i( long x ) { return IntVal.make(x); }

  // Literal forms and their variants
  @Test public void testParse() {
    assertEquals(ValKind.BITS,v("0b101").kind());
    assertEquals(ValKind.INT ,v("42"   ).kind());
    assertEquals(ValKind.DEC ,v("4.2"  ).kind());
    assertEquals(i(1000), v("1_000"));
    assertEquals(i(31)  , v("0x1F"));
    assertEquals(i(31)  , v("0X1f"));
    assertEquals(i(15)  , v("0o17"));
    assertEquals(i(12)  , v("0d12"));
    assertEquals("1.5"  , v("1.50").toString());
    assertEquals("5.0"  , v("5.").toString());
    assertEquals("0.5"  , v(".5").toString());
    assertEquals("3.25" , v("3,25").toString());
    assertEquals("1.5"  , v("0x1.8").toString());
    assertEquals("0.5"  , v("0b0.1").toString());
    assertEquals("0.5"  , v("0o0.4").toString());
  }

  @Test public void testBitseq() {
    BitsVal b = (BitsVal)v("0b101");
    assertEquals(3,b._len);
    assertEquals(BigInteger.valueOf(5),b._bits);
    BitsVal nb = b.bnot();
    assertEquals(3,nb._len);
    assertEquals(BigInteger.valueOf(2),nb._bits);
    assertEquals("0b010",nb.toString());
    // Leading zeros are width, not padding
    assertEquals(8,((BitsVal)v("0b0000_0001"))._len);
    assertEquals("0b00000001",v("0b0000_0001").toString());
  }

  @Test public void testBadNumerals() {
    try { v("0b102"); fail(); }
    catch( ErrMsg e ) {
      assertEquals(ErrMsg.syntax(new Pos(1,0),"The pattern of the numeral \"0b102\" is invalid"),e);
    }
    try { v("."); fail(); }
    catch( ErrMsg e ) {
      assertEquals("Failed to parse \".\" (normalised to \".\") into a Decimal value",e._msg);
      assertTrue(e.is_syntax());
    }
    try { v("0b"+"1".repeat(BitsVal.MAX_LEN+1)); fail(); }
    catch( ErrMsg e ) { assertTrue(e._msg.startsWith("Failed to parse")); }
  }

  // Output rendering reparses to an equal value
  @Test public void testRoundTrip() {
    String[] lits = {"0b0101","0b1","123","0","1.25","0.0","3,75","0x1F","0o777","0d9_9","1_000.000_1","0b1.01"};
    for( String s : lits ) {
      Val x = v(s);
      assertEquals(s,x,v(x.toString()));
    }
  }

  @Test public void testLosslessBits() {
    BigInteger max = BigInteger.ONE.shiftLeft(BitsVal.MAX_LEN).subtract(BigInteger.ONE);
    for( BigInteger x : new BigInteger[]{BigInteger.ZERO,BigInteger.ONE,BigInteger.valueOf(255),BigInteger.ONE.shiftLeft(64),max} ) {
      IntVal iv = IntVal.make(x);
      assertEquals(iv,iv.as_bits().as_int());
    }
    try { IntVal.make(max.add(BigInteger.ONE)).as_bits(); fail(); }
    catch( ErrMsg e ) { assertEquals(ErrMsg.Level.Conversion,e._lvl); }
    try { i(-1).as_bits(); fail(); }
    catch( ErrMsg e ) { assertEquals(ErrMsg.Level.Conversion,e._lvl); }
  }

  @Test public void testDecConversions() {
    assertEquals(i(4),v("4.0").as_int());
    assertEquals("0b100",v("4.0").as_bits().toString());
    try { v("2.5").as_int(); fail(); }
    catch( ErrMsg e ) { assertEquals(ErrMsg.Level.Conversion,e._lvl); }
    try { v("2.0").neg().as_bits(); fail(); }
    catch( ErrMsg e ) { assertEquals(ErrMsg.Level.Conversion,e._lvl); }
    assertEquals("5.0",i(5).as_dec().toString());
    assertEquals("5.0",v("0b101").as_dec().toString());
  }

  // convert() to every variant, exact or not at all
  @Test public void testConvert() {
    Val six = i(6);
    assertEquals("0b110",six.convert(ValKind.BITS).toString());
    assertSame(six,six.convert(ValKind.INT));
    assertEquals("6.0",six.convert(ValKind.DEC).toString());
    assertEquals(i(5),v("0b101").convert(ValKind.INT));
    assertEquals("0b11",v("3.0").convert(ValKind.BITS).toString());
    try { v("3.5").convert(ValKind.INT); fail(); }
    catch( ErrMsg e ) {
      assertEquals(ErrMsg.Level.Conversion,e._lvl);
      assertEquals("Cannot convert Decimal 3.5 with a fractional part to Integer",e._msg);
    }
    try { i(-6).convert(ValKind.BITS); fail(); }
    catch( ErrMsg e ) { assertEquals(ErrMsg.Level.Conversion,e._lvl); }
  }

  // Remainder and power far outside 100 digits of quotient or result
  @Test public void testDecimalRange() {
    DecVal big = DecVal.make(BigDecimal.TEN.pow(200));
    assertEquals("1.0",big.mod(i(3)).toString());
    assertEquals("0.6",big.mod(v("0.7")).toString());
    DecVal y = DecVal.make(BigDecimal.TEN.pow(30));
    try { v("1.00000000000000000001").pow(y); fail(); }
    catch( ErrMsg e ) {
      assertEquals(ErrMsg.Level.InvalidOp,e._lvl);
      assertEquals("Decimal overflow: magnitude exceeds 10^10000",e._msg);
    }
    assertTrue(v("0.99999999999999999999").pow(y).is_zero());
  }

  @Test public void testFactorial() {
    assertEquals(i(120),i(5).fact());
    assertEquals(i(1),i(0).fact());
    assertEquals(i(120),v("0b101").fact());
    i(IntVal.MAX_FACT).fact();
    try { i(100).fact(); fail(); }
    catch( ErrMsg e ) {
      assertEquals(ErrMsg.Level.InvalidOp,e._lvl);
      assertTrue(e._msg.contains("gamma (x + 1)"));
    }
    try { i(-1).fact(); fail(); }
    catch( ErrMsg e ) { assertEquals("Factorial undefined for values < 0",e._msg); }
    // Decimal factorial is gamma(x+1)
    BigDecimal g = ((DecVal)v("4.0").fact())._d;
    assertTrue(g.subtract(BigDecimal.valueOf(24)).abs().compareTo(new BigDecimal("0.01")) < 0);
  }

  @Test public void testGammaDomain() {
    try { Num.gamma(BigDecimal.ZERO); fail(); }
    catch( ErrMsg e ) { assertTrue(e._msg.startsWith("gamma is only defined for 0 < x <= 3249")); }
    try { Num.gamma(BigDecimal.valueOf(4000)); fail(); }
    catch( ErrMsg e ) { assertEquals(ErrMsg.Level.InvalidOp,e._lvl); }
    Num.gamma(Num.GAMMA_MAX);
  }

  @Test public void testUnary() {
    assertEquals(i(-5),v("0b101").neg());
    assertEquals("-2.5",v("2.5").neg().toString());
    assertEquals(i(1),i(0).lnot());
    assertEquals(i(1),v("0.0").lnot());
    assertEquals(i(1),v("0b000").lnot());
    assertEquals(i(0),i(7).lnot());
    assertEquals("0b010",i(5).bnot().toString());
    try { v("1.5").bnot(); fail(); }
    catch( ErrMsg e ) { assertTrue(e._msg.startsWith("Bitwise negation requires a Bitseq operand")); }
  }

  @Test public void testArith() {
    assertEquals(i(5),i(2).add(i(3)));
    assertEquals(i(8),v("0b101").add(i(3)));
    assertEquals("3.5",i(7).div(i(2)).toString());
    assertEquals(i(2),i(6).div(i(3)));
    assertEquals(i(1),i(7).mod(i(3)));
    assertEquals(i(-1),i(-7).mod(i(3)));
    assertEquals(i(1024),i(2).pow(i(10)));
    assertEquals("0.5",i(2).pow(i(-1)).toString());
    assertEquals("1.5",v("0.5").add(i(1)).toString());
    try { i(1).div(i(0)); fail(); }
    catch( ErrMsg e ) { assertEquals("Division by zero",e._msg); }
    try { i(2).pow(i(600)); fail(); }
    catch( ErrMsg e ) { assertEquals(ErrMsg.Level.InvalidOp,e._lvl); }
    try { IntVal.make(BigInteger.ONE.shiftLeft(IntVal.MAX_BITS)); fail(); }
    catch( ErrMsg e ) { assertEquals(ErrMsg.Level.InvalidOp,e._lvl); }
  }

  @Test public void testBitwise() {
    assertEquals("0b1000",v("0b1100").and(v("0b1010")).toString());
    assertEquals("0b101" ,v("0b1").or(v("0b100")).toString());
    assertEquals("0b0110",v("0b1100").xor(v("0b1010")).toString());
    assertEquals("0b1100",v("0b0011").shl(i(2)).toString());
    assertEquals("0b0000",v("0b0011").shl(i(4)).toString());
    assertEquals("0b0001",v("0b0011").shr(i(1)).toString());
    assertEquals("0b0011",v("0b1001").rotl(i(1)).toString());
    assertEquals("0b1100",v("0b1001").rotr(i(1)).toString());
    assertEquals(i(1024),i(1).shl(i(10)));
    assertEquals(i(-2),i(-4).shr(i(1)));
  }

  @Test public void testCompare() {
    assertEquals(0,i(1).compare(v("1.0")));
    assertEquals(0,v("0b1").compare(i(1)));
    assertTrue(i(2).compare(v("2.5")) < 0);
    assertTrue(v("1.0").approx(v("1.000000000000000000000001")));
    assertFalse(v("1.0").approx(v("1.0001")));
    assertTrue(i(0).approx(v("0.0")));
    // Equality is by variant and value
    assertNotEquals(i(5),v("0b101"));
    assertEquals(v("1.50"),v("1.5"));
  }

  @Test public void testFormat() {
    assertEquals("1000.0",DecVal.fmt(new BigDecimal("1E+3")));
    assertEquals("0.0"   ,DecVal.fmt(new BigDecimal("0.000")));
    assertEquals("-0.25" ,DecVal.fmt(new BigDecimal("-0.2500")));
  }
}
