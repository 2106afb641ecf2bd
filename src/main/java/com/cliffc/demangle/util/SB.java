package com.cliffc.demangle.util;

/** Tight/tiny StringBuilder wrapper, used as the print sink for all Nodes.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB() { _sb = new StringBuilder(); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( long   s ) { _sb.append(s); return this; }
  public SB s() { _sb.append(' '); return this; }

  // Last char printed, or 0 if nothing printed yet.  Declarator spacing
  // depends on what came before.
  public char last() { return _sb.length()==0 ? 0 : _sb.charAt(_sb.length()-1); }

  @Override public String toString() { return _sb.toString(); }
}
