package com.cliffc.calc;

import ch.obermuhlner.math.big.BigDecimalMath;
import com.cliffc.calc.val.DecVal;
import com.cliffc.calc.val.IntVal;
import com.cliffc.calc.val.Num;
import com.cliffc.calc.val.Val;
import com.cliffc.calc.val.ValKind;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Locale;

import static com.cliffc.calc.val.Num.MC;

/** Primitive operator and builtin function tables, keyed by token text.
 *  Function names are keyed in lower case.  Assignment and {@code mem} need
 *  the environment and are handled by the evaluator instead. */
public abstract class Prim {
  public interface Op1 { Val op( Val x ); }
  public interface Op2 { Val op( Val x, Val y ); }

  static final HashMap<String,Op1> UNIOPS = new HashMap<>(){{
      put("+", Val::pos );
      put("-", Val::neg );
      put("!", Val::fact);
      put("¬", Val::lnot);
      put("~", Val::bnot);
    }};

  static final HashMap<String,Op2> BINOPS = new HashMap<>(){{
      put("^"  , Val::pow);
      put("*"  , Val::mul);
      put("/"  , Val::div);
      put("%"  , Val::mod);
      put("+"  , Val::add);
      put("-"  , Val::sub);
      put("<<" , Val::shl);
      put(">>" , Val::shr);
      put("<<<", Val::rotl);
      put(">>>", Val::rotr);
      put("&"  , Val::and);
      put("|"  , Val::or );
      put("^|" , Val::xor);
      put(">"  , (x,y) -> IntVal.of(x.compare(y) >  0));
      put("<"  , (x,y) -> IntVal.of(x.compare(y) <  0));
      put(">=" , (x,y) -> IntVal.of(x.compare(y) >= 0));
      put("<=" , (x,y) -> IntVal.of(x.compare(y) <= 0));
      put("==" , (x,y) -> IntVal.of(x.compare(y) == 0));
      put("!=" , (x,y) -> IntVal.of(x.compare(y) != 0));
      put("<=>", (x,y) -> IntVal.sign(x.compare(y)));
      put("??" , (x,y) -> IntVal.of( x.approx(y)));
      put("!?" , (x,y) -> IntVal.of(!x.approx(y)));
      put("&&" , (x,y) -> IntVal.of(!x.is_zero() && !y.is_zero()));
      put("||" , (x,y) -> IntVal.of(!x.is_zero() || !y.is_zero()));
    }};

  static final HashMap<String,Op1> UNIFUNS = new HashMap<>(){{
      put("abs"  , Val::abs );
      put("not"  , Val::lnot);
      put("sin"  , x -> DecVal.make(BigDecimalMath.sin(trig(x),MC)));
      put("cos"  , x -> DecVal.make(BigDecimalMath.cos(trig(x),MC)));
      put("tan"  , x -> DecVal.make(BigDecimalMath.tan(trig(x),MC)));
      put("cot"  , x -> recip("cot",BigDecimalMath.tan(trig(x),MC)));
      put("sec"  , x -> recip("sec",BigDecimalMath.cos(trig(x),MC)));
      put("csc"  , x -> recip("csc",BigDecimalMath.sin(trig(x),MC)));
      put("exp"  , Prim::exp );
      put("ln"   , x -> DecVal.make(BigDecimalMath.log  (pos_dom("ln" ,x),MC)));
      put("lg"   , x -> DecVal.make(BigDecimalMath.log2 (pos_dom("lg" ,x),MC)));
      put("log"  , x -> DecVal.make(BigDecimalMath.log10(pos_dom("log",x),MC)));
      put("sqrt" , x -> root(x,2));
      put("cbrt" , x -> root(x,3));
      put("gamma", x -> DecVal.make(Num.gamma(x.as_dec()._d)));
    }};

  static final HashMap<String,Op2> BINFUNS = new HashMap<>(){{
      put("rt"    , Prim::rt    );
      put("logb"  , Prim::logb  );
      put("choose", Prim::choose);
    }};

  public static Op1 uniop ( String s ) { return UNIOPS .get(s); }
  public static Op2 binop ( String s ) { return BINOPS .get(s); }
  public static Op1 unifun( String s ) { return UNIFUNS.get(s.toLowerCase(Locale.ROOT)); }
  public static Op2 binfun( String s ) { return BINFUNS.get(s.toLowerCase(Locale.ROOT)); }

  // ----------------------------------------------------------------------
  // Trig argument in radians.  Huge arguments would need pi to thousands of
  // digits to reduce; reject them.
  private static BigDecimal trig( Val x ) {
    BigDecimal d = x.as_dec()._d;
    if( d.signum()!=0 && d.precision()-d.scale() > 100 )
      throw ErrMsg.invalid("Trigonometric argument "+x+" is too large");
    return d;
  }
  private static DecVal recip( String name, BigDecimal d ) {
    if( d.signum()==0 ) throw ErrMsg.invalid(name+" is undefined here: division by zero");
    return DecVal.make(BigDecimal.ONE.divide(d,MC));
  }
  private static BigDecimal pos_dom( String name, Val x ) {
    if( x.signum() <= 0 ) throw ErrMsg.invalid(name+" is only defined for x > 0, but x = "+x);
    return x.as_dec()._d;
  }

  private static final BigDecimal LOG10_E = BigDecimal.valueOf(Math.log10(Math.E));
  static Val exp( Val x ) {
    BigDecimal d = x.as_dec()._d;
    BigDecimal lg = d.multiply(LOG10_E);
    if( lg.compareTo(BigDecimal.valueOf(Num.MAX_EXP+1)) > 0 )
      throw ErrMsg.invalid("Decimal overflow: magnitude exceeds 10^"+(Num.MAX_EXP+1));
    if( lg.compareTo(BigDecimal.valueOf(-Num.MAX_EXP-1)) < 0 ) return DecVal.make(BigDecimal.ZERO);
    return DecVal.make(BigDecimalMath.exp(d,MC));
  }

  // n-th root; exact Integer when the root of an Integer is exact
  static Val root( Val x, int n ) {
    if( x.signum() < 0 && (n&1)==0 )
      throw ErrMsg.invalid("Even root of negative value "+x+" is undefined");
    if( x.kind()!=ValKind.DEC ) {
      BigInteger i = x.as_int()._i, a = i.abs();
      BigInteger r = Num.iroot(a,n);
      if( r.pow(n).equals(a) ) return IntVal.make(i.signum() < 0 ? r.negate() : r);
    }
    BigDecimal d = x.as_dec()._d;
    BigDecimal r = n==2 ? d.sqrt(MC) : BigDecimalMath.root(d.abs(),BigDecimal.valueOf(n),MC);
    return DecVal.make(d.signum() < 0 ? r.negate() : r);
  }

  // "n rt x": the n-th root of x
  static Val rt( Val n, Val x ) {
    if( n.kind()!=ValKind.DEC || ((DecVal)n).is_integral() ) {
      IntVal in = n.as_int();
      if( in.signum() <= 0 ) throw ErrMsg.invalid("Root degree must be positive, but is "+n);
      if( !in.fits_int() ) throw ErrMsg.invalid("Root degree "+n+" is too large");
      return root(x,in._i.intValue());
    }
    if( x.signum() < 0 ) throw ErrMsg.invalid("Fractional root of negative value "+x+" is undefined");
    return x.pow(DecVal.make(BigDecimal.ONE.divide(n.as_dec()._d,MC)));
  }

  // "x logb b": the logarithm of x to base b; exact Integer for exact powers
  static Val logb( Val x, Val b ) {
    if( x.signum() <= 0 ) throw ErrMsg.invalid("logb is only defined for x > 0, but x = "+x);
    if( b.signum() <= 0 || b.compare(IntVal.ONE)==0 )
      throw ErrMsg.invalid("logb base must be positive and not 1, but is "+b);
    if( x.kind()!=ValKind.DEC && b.kind()!=ValKind.DEC ) {
      BigInteger xi = x.as_int()._i, bi = b.as_int()._i, p = BigInteger.ONE;
      int k = 0;
      while( p.compareTo(xi) < 0 ) { p = p.multiply(bi); k++; }
      if( p.equals(xi) ) return IntVal.make(k);
    }
    BigDecimal lx = BigDecimalMath.log(x.as_dec()._d,MC);
    BigDecimal lb = BigDecimalMath.log(b.as_dec()._d,MC);
    return DecVal.make(lx.divide(lb,MC));
  }

  // "n choose k": binomial coefficient
  static Val choose( Val n, Val k ) {
    BigInteger ni = n.as_int()._i, ki = k.as_int()._i;
    if( ni.signum() < 0 ) throw ErrMsg.invalid("choose is only defined for n >= 0, but n = "+n);
    if( ki.signum() < 0 || ki.compareTo(ni) > 0 ) return IntVal.ZERO;
    if( ki.shiftLeft(1).compareTo(ni) > 0 ) ki = ni.subtract(ki);
    BigInteger r = BigInteger.ONE;
    // Each partial product is itself a binomial coefficient no larger than
    // the result, so overflow shows up early.
    for( BigInteger i = BigInteger.ZERO; i.compareTo(ki) < 0; i = i.add(BigInteger.ONE) ) {
      r = r.multiply(ni.subtract(i)).divide(i.add(BigInteger.ONE));
      if( r.bitLength() > IntVal.MAX_BITS )
        throw ErrMsg.invalid("Integer overflow: "+n+" choose "+k+" exceeds "+IntVal.MAX_BITS+" bits");
    }
    return IntVal.make(r);
  }
}
