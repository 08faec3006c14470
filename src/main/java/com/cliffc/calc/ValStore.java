package com.cliffc.calc;

import com.cliffc.calc.val.Val;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;

/** Case-insensitive identifier bindings.  Keys are lower-cased on the way in
 *  at every public entry point.  Protected keys survive {@link #clear};
 *  readonly keys reject further writes. */
public class ValStore {
  private final HashMap<String,Val> _vals = new HashMap<>();
  private final HashSet<String> _protected = new HashSet<>();
  private final HashSet<String> _readonly  = new HashSet<>();

  public ValStore( String... protected_keys ) {
    for( String k : protected_keys ) add_protected_key(k);
  }

  private static String key( String id ) { return id.toLowerCase(Locale.ROOT); }

  public @Nullable Val get( String id ) { return _vals.get(key(id)); }

  /** Bind id to v.
   *  @return false, with no change, if id is readonly */
  public boolean set( String id, Val v ) {
    String k = key(id);
    if( _readonly.contains(k) ) return false;
    _vals.put(k,v);
    return true;
  }
  // As set, and also mark id readonly
  public boolean set_readonly( String id, Val v ) {
    if( !set(id,v) ) return false;
    _readonly.add(key(id));
    return true;
  }
  public boolean is_readonly( String id ) { return _readonly.contains(key(id)); }

  public void add_protected_key   ( String id ) { _protected.add   (key(id)); }
  public void remove_protected_key( String id ) { _protected.remove(key(id)); }
  public boolean is_protected( String id ) { return _protected.contains(key(id)); }

  // Drop every unprotected binding, and any readonly mark left without one
  public void clear() {
    _vals.keySet().retainAll(_protected);
    _readonly.retainAll(_vals.keySet());
  }
  // Drop everything, protections and readonly marks included
  public void clear_all() {
    _vals.clear();
    _protected.clear();
    _readonly.clear();
  }

  public int size() { return _vals.size(); }
}
