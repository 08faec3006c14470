package com.cliffc.calc;

import com.cliffc.calc.util.Ary;
import com.cliffc.calc.val.DecVal;
import com.cliffc.calc.val.IntVal;
import com.cliffc.calc.val.Num;
import com.cliffc.calc.val.Val;

/** Evaluation environment: variable bindings, seeded with the builtin
 *  constants, plus the history of top-level results read by {@code mem}. */
public class Env {
  public final ValStore _vars = new ValStore("pi","tau","e");
  private final Ary<Val> _results = new Ary<>(Val.class); // Oldest first

  public Env() {
    _vars.set_readonly("pi" ,DecVal.make(Num.PI ));
    _vars.set_readonly("tau",DecVal.make(Num.TAU));
    _vars.set_readonly("e"  ,DecVal.make(Num.E  ));
  }

  // Record a completed top-level result; it becomes "mem 0"
  public void record( Val v ) { _results.add(v); }
  public int nresults() { return _results.len(); }

  /** Previous result: slot 0 is the most recent.  Slots not yet filled read
   *  as zero. */
  public Val mem( Val slot ) {
    if( slot instanceof DecVal d && !d.is_integral() )
      throw ErrMsg.invalid("Result history slot must be a whole number, but is "+slot);
    IntVal n = slot.as_int();
    if( n.signum() < 0 ) throw ErrMsg.invalid("Result history slot must not be negative, but is "+n);
    if( !n.fits_int() || n._i.intValue() >= _results.len() ) return IntVal.ZERO;
    return _results.at(_results.len()-1-n._i.intValue());
  }
}
