package com.cliffc.calc.val;

import com.cliffc.calc.ErrMsg;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Fixed-width unsigned bit pattern, 1 to MAX_LEN bits wide.  Bits above the
 *  width are always zero. */
public final class BitsVal extends Val {
  public static final int MAX_LEN = 127;

  public final BigInteger _bits;
  public final int _len;
  private BitsVal( BigInteger bits, int len ) { _bits = bits; _len = len; }

  static BigInteger mask( int len ) { return BigInteger.ONE.shiftLeft(len).subtract(BigInteger.ONE); }

  // Bits above len are dropped
  public static BitsVal make( BigInteger bits, int len ) {
    if( len < 1 || len > MAX_LEN )
      throw ErrMsg.invalid("Bitseq width must be between 1 and "+MAX_LEN+", but is "+len);
    return new BitsVal(bits.and(mask(len)),len);
  }

  // Binary digits, already stripped of prefix and separators; width is the digit count
  static BitsVal parse( String digits ) {
    if( digits.length() > MAX_LEN ) throw new NumberFormatException("too wide");
    return new BitsVal(new BigInteger(digits,2),digits.length());
  }

  @Override public ValKind kind() { return ValKind.BITS; }
  @Override public boolean is_zero() { return _bits.signum()==0; }
  @Override public int signum() { return _bits.signum(); }

  @Override public BitsVal as_bits() { return this; }
  @Override public IntVal as_int() { return IntVal.make(_bits); }
  @Override public DecVal as_dec() { return DecVal.make(new BigDecimal(_bits)); }
  @Override BigDecimal exact() { return new BigDecimal(_bits); }

  @Override public IntVal neg() { return as_int().neg(); }
  @Override public BitsVal abs() { return this; }
  @Override public IntVal fact() { return as_int().fact(); }

  BitsVal flip() { return new BitsVal(_bits.xor(mask(_len)),_len); }
  BitsVal shl( int n ) { return make(_bits.shiftLeft(n),_len); }
  BitsVal shr( int n ) { return new BitsVal(_bits.shiftRight(n),_len); }
  // Rotate left by n, right if negative
  BitsVal rot( int n ) {
    int k = ((n % _len) + _len) % _len;
    if( k==0 ) return this;
    return make(_bits.shiftLeft(k).or(_bits.shiftRight(_len-k)),_len);
  }
  BitsVal and( BitsVal b ) { return new BitsVal(_bits.and(b._bits),Math.max(_len,b._len)); }
  BitsVal or ( BitsVal b ) { return new BitsVal(_bits.or (b._bits),Math.max(_len,b._len)); }
  BitsVal xor( BitsVal b ) { return new BitsVal(_bits.xor(b._bits),Math.max(_len,b._len)); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof BitsVal bv && _len==bv._len && _bits.equals(bv._bits);
  }
  @Override public int hashCode() { return _bits.hashCode()*31+_len; }
  // Zero-padded to the full width
  @Override public String toString() {
    String s = _bits.toString(2);
    return "0b"+"0".repeat(_len-s.length())+s;
  }
}
