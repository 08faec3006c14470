package com.cliffc.calc.val;

import ch.obermuhlner.math.big.BigDecimalMath;
import com.cliffc.calc.ErrMsg;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Signed decimal at {@link Num#MC} working precision. */
public final class DecVal extends Val {
  public final BigDecimal _d;
  private DecVal( BigDecimal d ) { _d = d; }

  public static DecVal make( BigDecimal d ) { return new DecVal(Num.check(d)); }

  // Digits in radix, with exactly one '.'; either side may be empty but not both
  static DecVal parse( String s, int radix ) {
    int dot = s.indexOf('.');
    String ip = s.substring(0,dot), fp = s.substring(dot+1);
    if( ip.isEmpty() && fp.isEmpty() ) throw new NumberFormatException("no digits");
    BigInteger num = new BigInteger(ip+fp,radix);
    // radix is 2, 8, 10 or 16, so dividing by radix^n always terminates in decimal
    BigDecimal den = new BigDecimal(BigInteger.valueOf(radix).pow(fp.length()));
    return make(new BigDecimal(num).divide(den));
  }

  /** Plain notation, trailing fractional zeros trimmed, at least one
   *  fractional digit. */
  public static String fmt( BigDecimal d ) {
    if( d.signum()==0 ) return "0.0";
    String s = d.stripTrailingZeros().toPlainString();
    return s.indexOf('.') < 0 ? s+".0" : s;
  }

  @Override public ValKind kind() { return ValKind.DEC; }
  @Override public boolean is_zero() { return _d.signum()==0; }
  @Override public int signum() { return _d.signum(); }
  public boolean is_integral() { return _d.signum()==0 || _d.stripTrailingZeros().scale() <= 0; }

  @Override public BitsVal as_bits() {
    if( !is_integral() ) throw ErrMsg.conversion("Cannot convert Decimal "+this+" with a fractional part to Bitseq");
    if( _d.signum() < 0 ) throw ErrMsg.conversion("Cannot convert negative Decimal "+this+" to Bitseq");
    BigInteger i = _d.toBigIntegerExact();
    if( i.bitLength() > BitsVal.MAX_LEN )
      throw ErrMsg.conversion("Decimal "+this+" is too wide for a Bitseq of at most "+BitsVal.MAX_LEN+" bits");
    return BitsVal.make(i,Math.max(1,i.bitLength()));
  }
  @Override public IntVal as_int() {
    if( !is_integral() ) throw ErrMsg.conversion("Cannot convert Decimal "+this+" with a fractional part to Integer");
    BigInteger i = _d.toBigIntegerExact();
    if( i.bitLength() > IntVal.MAX_BITS )
      throw ErrMsg.conversion("Decimal "+this+" is too large for an Integer of at most "+IntVal.MAX_BITS+" bits");
    return IntVal.make(i);
  }
  @Override public DecVal as_dec() { return this; }
  @Override BigDecimal exact() { return _d; }

  @Override public DecVal neg() { return make(_d.negate()); }
  @Override public DecVal abs() { return make(_d.abs()); }
  // gamma(x+1)
  @Override public DecVal fact() { return make(Num.gamma(_d.add(BigDecimal.ONE))); }

  DecVal dpow( DecVal b ) {
    BigDecimal x = _d, y = b._d;
    if( y.signum()==0 ) return make(BigDecimal.ONE);
    if( x.signum()==0 ) {
      if( y.signum() < 0 ) throw ErrMsg.invalid("Zero cannot be raised to a negative power");
      return this;
    }
    boolean integral = b.is_integral();
    if( x.signum() < 0 && !integral )
      throw ErrMsg.invalid("Negative base "+this+" requires an integral exponent, but the exponent is "+b);
    BigDecimal ax = x.abs();
    if( ax.compareTo(BigDecimal.ONE)==0 )
      return make(x.signum() > 0 || !y.toBigIntegerExact().testBit(0) ? BigDecimal.ONE : x);
    BigDecimal lg = y.multiply(Num.log10(ax));
    Num.check_log10(lg);
    if( lg.compareTo(Num.MAX_LOG10.negate()) < 0 ) return make(BigDecimal.ZERO);
    if( integral && y.abs().compareTo(BigDecimal.valueOf(999999999)) <= 0 )
      return make(x.pow(y.intValueExact(),Num.MC));
    return make(BigDecimalMath.pow(x,y,Num.MC));
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof DecVal dv && _d.compareTo(dv._d)==0;
  }
  @Override public int hashCode() { return _d.signum()==0 ? 0 : _d.stripTrailingZeros().hashCode(); }
  @Override public String toString() { return fmt(_d); }
}
