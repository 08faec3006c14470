package com.cliffc.calc.val;

import com.cliffc.calc.ErrMsg;
import com.cliffc.calc.Pos;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/** A calculator value: exactly one of a bit-sequence ({@link BitsVal}), an
 *  arbitrary-precision integer ({@link IntVal}) or a fixed-precision decimal
 *  ({@link DecVal}).  The set of subclasses is closed; constructors are
 *  package-private.
 *
 *  <p>Values are immutable.  Conversions between variants either round-trip
 *  exactly or fail with a {@link ErrMsg.Level#Conversion} error; nothing is
 *  silently truncated.
 */
public abstract class Val {
  Val() {}

  public abstract ValKind kind();
  public final String typeName() { return kind()._name; }
  public abstract boolean is_zero();
  public abstract int signum();

  // Lossless conversions; throw a Conversion error where information would be lost
  public abstract BitsVal as_bits();
  public abstract IntVal  as_int ();
  public abstract DecVal  as_dec ();
  // Exact value, no rounding; used for cross-variant comparisons
  abstract BigDecimal exact();

  /** Convert to the given variant, exactly or not at all. */
  public final Val convert( ValKind k ) {
    return switch( k ) {
    case BITS -> as_bits();
    case INT  -> as_int ();
    case DEC  -> as_dec ();
    };
  }

  // ------------ PARSING -----------------------------------------------
  // Numeral shapes.  Digit-group separators '_' may appear between digits;
  // either '.' or ',' is the fractional separator.
  private static final Pattern BIN_INT  = Pattern.compile("0[bB][01_]*[01]");
  private static final Pattern BIN_FRAC = Pattern.compile("0[bB][01_]*[.,](?:[01_]*[01])?");
  private static final Pattern OCT_INT  = Pattern.compile("0[oO][0-7_]*[0-7]");
  private static final Pattern OCT_FRAC = Pattern.compile("0[oO][0-7_]*[.,](?:[0-7_]*[0-7])?");
  private static final Pattern DEC_INT  = Pattern.compile("(?:0[dD]_?[0-9]|[0-9])(?:[0-9_]*[0-9])?");
  private static final Pattern DEC_FRAC = Pattern.compile("(?:0[dD]_?)?(?:[0-9]*|[0-9][0-9_]*)[.,](?:[0-9]*|[0-9_]*[0-9])");
  private static final Pattern HEX_INT  = Pattern.compile("0[xX][0-9a-fA-F_]*[0-9a-fA-F]");
  private static final Pattern HEX_FRAC = Pattern.compile("0[xX][0-9a-fA-F_]*[.,](?:[0-9a-fA-F_]*[0-9a-fA-F])?");

  // Radix from the lexical shape alone, or 0 if no shape matches
  static int radix( String s ) {
    if( BIN_INT.matcher(s).matches() || BIN_FRAC.matcher(s).matches() ) return  2;
    if( OCT_INT.matcher(s).matches() || OCT_FRAC.matcher(s).matches() ) return  8;
    if( DEC_INT.matcher(s).matches() || DEC_FRAC.matcher(s).matches() ) return 10;
    if( HEX_INT.matcher(s).matches() || HEX_FRAC.matcher(s).matches() ) return 16;
    return 0;
  }
  static boolean has_frac_sep( String s ) { return s.indexOf('.')>=0 || s.indexOf(',')>=0; }
  // Drop radix prefix and group separators, ',' becomes '.'
  static String strip( String s ) {
    String t = s.replace("_","").replace(',','.');
    if( s.length()>=2 && s.charAt(0)=='0' && "bBoOdDxX".indexOf(s.charAt(1))>=0 )
      t = t.substring(2);
    return t;
  }

  /** Parse a numeral literal.  Fractional literals are Decimals in the
   *  literal's radix; binary integer literals are Bitseqs of exactly the
   *  written width; all other integer literals are Integers.
   *  @param s   the literal text, as written
   *  @param pos where the literal starts, for error reporting */
  public static @NotNull Val valueOf( String s, Pos pos ) {
    int radix = radix(s);
    if( radix==0 )
      throw ErrMsg.syntax(pos,"The pattern of the numeral \""+s+"\" is invalid");
    String norm = strip(s);
    try {
      if( has_frac_sep(s) ) return DecVal.parse(norm,radix);
      if( radix==2 ) return BitsVal.parse(norm);
      return IntVal.parse(norm,radix);
    } catch( NumberFormatException | ArithmeticException e ) {
      throw ErrMsg.syntax(pos,"Failed to parse \""+s+"\" (normalised to \""+norm+"\") into a "+
                          (has_frac_sep(s) ? "Decimal" : (radix==2 ? "Bitseq" : "Integer"))+" value");
    }
  }
  public static Val valueOf( String s ) { return valueOf(s,null); }

  // ------------ UNARY OPERATORS ---------------------------------------

  // Identity
  public Val pos() { return this; }
  // Bit-sequences have no sign; they negate as Integers
  public abstract Val neg();
  public abstract Val abs();
  // Factorial; Decimals via gamma(x+1)
  public abstract Val fact();
  // 1 if this is the additive identity of its own type, else 0
  public final IntVal lnot() { return IntVal.of(is_zero()); }
  // Flip the low len bits of a bit-sequence
  public final BitsVal bnot() {
    BitsVal b;
    try { b = as_bits(); }
    catch( ErrMsg e ) { throw ErrMsg.conversion("Bitwise negation requires a Bitseq operand: "+e._msg); }
    return b.flip();
  }

  // ------------ BINARY OPERATORS --------------------------------------

  // Arithmetic variant of a pair: Decimal if either is, else Integer
  static ValKind arith( Val a, Val b ) {
    return a.kind()==ValKind.DEC || b.kind()==ValKind.DEC ? ValKind.DEC : ValKind.INT;
  }

  public final Val add( Val b ) {
    return arith(this,b)==ValKind.INT
      ? IntVal.make(as_int()._i.add(b.as_int()._i))
      : DecVal.make(as_dec()._d.add(b.as_dec()._d));
  }
  public final Val sub( Val b ) {
    return arith(this,b)==ValKind.INT
      ? IntVal.make(as_int()._i.subtract(b.as_int()._i))
      : DecVal.make(as_dec()._d.subtract(b.as_dec()._d));
  }
  public final Val mul( Val b ) {
    return arith(this,b)==ValKind.INT
      ? IntVal.make(as_int()._i.multiply(b.as_int()._i))
      : DecVal.make(as_dec()._d.multiply(b.as_dec()._d));
  }
  // Integer when exact, else Decimal
  public final Val div( Val b ) {
    if( b.is_zero() ) throw ErrMsg.invalid("Division by zero");
    if( arith(this,b)==ValKind.INT ) {
      BigInteger[] qr = as_int()._i.divideAndRemainder(b.as_int()._i);
      if( qr[1].signum()==0 ) return IntVal.make(qr[0]);
    }
    return DecVal.make(as_dec()._d.divide(b.as_dec()._d,Num.MC));
  }
  // Truncated remainder, sign follows the dividend
  public final Val mod( Val b ) {
    if( b.is_zero() ) throw ErrMsg.invalid("Modulo by zero");
    return arith(this,b)==ValKind.INT
      ? IntVal.make(as_int()._i.remainder(b.as_int()._i))
      : DecVal.make(as_dec()._d.remainder(b.as_dec()._d));
  }

  public final Val pow( Val b ) {
    if( arith(this,b)==ValKind.INT ) {
      BigInteger x = as_int()._i, y = b.as_int()._i;
      if( y.signum() >= 0 ) return IntVal.pow(x,y);
      if( x.signum()==0 ) throw ErrMsg.invalid("Zero cannot be raised to a negative power");
    }
    return as_dec().dpow(b.as_dec());
  }

  // Shifts.  Bit-sequences keep their width; everything else shifts as an Integer.
  public final Val shl( Val b ) {
    int n = shift_count(b);
    return kind()==ValKind.BITS ? ((BitsVal)this).shl(n) : as_int().shl(n);
  }
  public final Val shr( Val b ) {
    int n = shift_count(b);
    return kind()==ValKind.BITS ? ((BitsVal)this).shr(n) : as_int().shr(n);
  }
  // Rotations only make sense within a fixed width
  public final BitsVal rotl( Val b ) { return as_bits().rot( shift_count(b)); }
  public final BitsVal rotr( Val b ) { return as_bits().rot(-shift_count(b)); }
  static int shift_count( Val b ) {
    BigInteger n = b.as_int()._i;
    if( n.signum() < 0 ) throw ErrMsg.invalid("Shift count must not be negative");
    // Anything wider than the widest value shifts everything out
    return n.compareTo(BigInteger.valueOf(4*IntVal.MAX_BITS)) > 0 ? 4*IntVal.MAX_BITS : n.intValue();
  }

  public final BitsVal and( Val b ) { return as_bits().and(b.as_bits()); }
  public final BitsVal or ( Val b ) { return as_bits().or (b.as_bits()); }
  public final BitsVal xor( Val b ) { return as_bits().xor(b.as_bits()); }

  // Numeric comparison across variants: -1, 0, 1
  public final int compare( Val b ) { return exact().compareTo(b.exact()); }
  // Approximately equal: relative difference at most 10^-20, or both zero
  private static final BigDecimal APPROX = new BigDecimal("1E-20");
  public final boolean approx( Val b ) {
    BigDecimal x = exact(), y = b.exact();
    BigDecimal max = x.abs().max(y.abs());
    if( max.signum()==0 ) return true;
    return x.subtract(y).abs().compareTo(max.multiply(APPROX)) <= 0;
  }

  // Bitseq/Integer/Decimal equality is by variant and value; see subclasses
  @Override public abstract boolean equals( Object o );
  @Override public abstract int hashCode();
  // Output rendering
  @Override public abstract String toString();
}
