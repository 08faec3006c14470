package com.cliffc.calc.val;

import com.cliffc.calc.ErrMsg;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Arbitrary-precision signed integer, bounded to MAX_BITS of magnitude. */
public final class IntVal extends Val {
  // Widest magnitude, in bits
  public static final int MAX_BITS = 511;
  // Largest n with n! below 2^MAX_BITS
  public static final int MAX_FACT = 97;

  public static final IntVal ZERO = new IntVal(BigInteger.ZERO);
  public static final IntVal ONE  = new IntVal(BigInteger.ONE );
  private static final IntVal NEG1 = new IntVal(BigInteger.ONE.negate());

  public final BigInteger _i;
  private IntVal( BigInteger i ) { _i = i; }

  public static IntVal make( BigInteger i ) {
    if( i.bitLength() > MAX_BITS )
      throw ErrMsg.invalid("Integer overflow: magnitude exceeds "+MAX_BITS+" bits");
    return new IntVal(i);
  }
  public static IntVal make( long i ) { return make(BigInteger.valueOf(i)); }
  public static IntVal of( boolean b ) { return b ? ONE : ZERO; }
  public static IntVal sign( int s ) { return s<0 ? NEG1 : of(s>0); }

  // Digits already stripped of prefix and separators
  static IntVal parse( String digits, int radix ) {
    BigInteger i = new BigInteger(digits,radix);
    if( i.bitLength() > MAX_BITS ) throw new NumberFormatException("too wide");
    return new IntVal(i);
  }

  @Override public ValKind kind() { return ValKind.INT; }
  @Override public boolean is_zero() { return _i.signum()==0; }
  @Override public int signum() { return _i.signum(); }
  public boolean fits_int() { return _i.bitLength() < 32; }

  @Override public BitsVal as_bits() {
    if( _i.signum() < 0 ) throw ErrMsg.conversion("Cannot convert negative Integer "+_i+" to Bitseq");
    if( _i.bitLength() > BitsVal.MAX_LEN )
      throw ErrMsg.conversion("Integer "+_i+" is too wide for a Bitseq of at most "+BitsVal.MAX_LEN+" bits");
    return BitsVal.make(_i,Math.max(1,_i.bitLength()));
  }
  @Override public IntVal as_int() { return this; }
  @Override public DecVal as_dec() {
    BigDecimal d = new BigDecimal(_i);
    if( d.stripTrailingZeros().precision() > Num.MC.getPrecision() )
      throw ErrMsg.conversion("Integer "+_i+" has more than "+Num.MC.getPrecision()+" significant digits and cannot be a Decimal");
    return DecVal.make(d);
  }
  @Override BigDecimal exact() { return new BigDecimal(_i); }

  @Override public IntVal neg() { return make(_i.negate()); }
  @Override public IntVal abs() { return make(_i.abs()); }
  @Override public IntVal fact() {
    if( _i.signum() < 0 ) throw ErrMsg.invalid("Factorial undefined for values < 0");
    if( _i.compareTo(BigInteger.valueOf(MAX_FACT)) > 0 )
      throw ErrMsg.invalid("Factorial of value > "+MAX_FACT+" exceeds size of Integer type, consider approximating the factorial via `gamma (x + 1)`");
    BigInteger r = BigInteger.ONE;
    for( int i=2; i<=_i.intValue(); i++ )
      r = r.multiply(BigInteger.valueOf(i));
    return make(r);
  }

  // Non-negative exponent
  static IntVal pow( BigInteger x, BigInteger y ) {
    assert y.signum() >= 0;
    if( y.signum()==0 ) return ONE;
    if( x.signum()==0 || x.equals(BigInteger.ONE) ) return make(x);
    if( x.equals(BigInteger.ONE.negate()) ) return make(y.testBit(0) ? x : BigInteger.ONE);
    // |x| >= 2, so the result has at least y+1 bits
    if( y.compareTo(BigInteger.valueOf(MAX_BITS)) >= 0 ||
        (long)(x.abs().bitLength()-1)*y.intValue() >= MAX_BITS )
      throw ErrMsg.invalid("Integer overflow: "+x+" ^ "+y+" exceeds "+MAX_BITS+" bits");
    return make(x.pow(y.intValue()));
  }

  IntVal shl( int n ) { return make(_i.shiftLeft(n)); }
  IntVal shr( int n ) { return make(_i.shiftRight(n)); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof IntVal iv && _i.equals(iv._i);
  }
  @Override public int hashCode() { return _i.hashCode(); }
  @Override public String toString() { return _i.toString(); }
}
