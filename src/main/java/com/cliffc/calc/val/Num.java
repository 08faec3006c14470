package com.cliffc.calc.val;

import ch.obermuhlner.math.big.BigDecimalMath;
import com.cliffc.calc.ErrMsg;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/** Working precision and the few numeric routines that are ours rather than
 *  the big-math library's: the decimal range check, the gamma approximation,
 *  and exact integer roots. */
public abstract class Num {
  // Decimal working precision, in significant digits
  public static final MathContext MC = new MathContext(100, RoundingMode.HALF_EVEN);
  // Largest decimal exponent: every Decimal is below 10^(MAX_EXP+1) in magnitude
  public static final int MAX_EXP = 9999;
  // Largest gamma argument whose result stays below 10^(MAX_EXP+1)
  public static final BigDecimal GAMMA_MAX = BigDecimal.valueOf(3249);

  public static final BigDecimal PI  = BigDecimalMath.pi(MC);
  public static final BigDecimal TAU = PI.multiply(BigDecimal.valueOf(2),MC);
  public static final BigDecimal E   = BigDecimalMath.e(MC);
  private static final BigDecimal TWELVE = BigDecimal.valueOf(12);

  // Decimal exponent, i.e. floor(log10(|d|)); d must not be zero
  static int exp10( BigDecimal d ) { return d.precision() - d.scale() - 1; }

  /** Round to working precision and range-check.  Underflow flushes to zero,
   *  overflow is an error. */
  public static BigDecimal check( BigDecimal d ) {
    d = d.round(MC);
    if( d.signum()==0 ) return BigDecimal.ZERO;
    int x = exp10(d);
    if( x >  MAX_EXP ) throw ErrMsg.invalid("Decimal overflow: magnitude exceeds 10^"+(MAX_EXP+1));
    if( x < -MAX_EXP ) return BigDecimal.ZERO;
    return d;
  }

  // Approximate log10(|d|) to 20 digits, for overflow pre-checks before an
  // expensive computation.  d must not be zero.
  private static final MathContext LOG_MC = new MathContext(20, RoundingMode.HALF_EVEN);
  static BigDecimal log10( BigDecimal d ) { return BigDecimalMath.log10(d.abs(),LOG_MC); }
  static final BigDecimal MAX_LOG10 = BigDecimal.valueOf(MAX_EXP+1);
  static void check_log10( BigDecimal lg ) {
    if( lg.compareTo(MAX_LOG10) > 0 ) throw ErrMsg.invalid("Decimal overflow: magnitude exceeds 10^"+(MAX_EXP+1));
  }

  /** Stirling-De Moivre approximation with its first-order correction term:
   *  gamma(x) ~= sqrt(2 pi / x) * (x/e)^x * (1 + 1/(12x)).
   *  Defined for 0 < x <= GAMMA_MAX. */
  public static BigDecimal gamma( BigDecimal x ) {
    if( x.signum() <= 0 || x.compareTo(GAMMA_MAX) > 0 )
      throw ErrMsg.invalid("gamma is only defined for 0 < x <= "+GAMMA_MAX.toPlainString()+", but x = "+DecVal.fmt(x));
    BigDecimal root = TAU.divide(x,MC).sqrt(MC);
    BigDecimal pow  = BigDecimalMath.pow(x.divide(E,MC),x,MC);
    BigDecimal corr = BigDecimal.ONE.add(BigDecimal.ONE.divide(TWELVE.multiply(x),MC),MC);
    return check(root.multiply(pow,MC).multiply(corr,MC));
  }

  /** Floor of the n-th root of a non-negative integer, by Newton iteration. */
  public static BigInteger iroot( BigInteger x, int n ) {
    assert x.signum() >= 0 && n > 0;
    if( n==1 || x.signum()==0 ) return x;
    if( n==2 ) return x.sqrt();
    BigInteger N = BigInteger.valueOf(n), N1 = BigInteger.valueOf(n-1);
    // Start above the root: 2^ceil(bits/n)
    BigInteger r = BigInteger.ONE.shiftLeft((x.bitLength()+n-1)/n);
    while( true ) {
      BigInteger r2 = N1.multiply(r).add(x.divide(r.pow(n-1))).divide(N);
      if( r2.compareTo(r) >= 0 ) return r;
      r = r2;
    }
  }
}
