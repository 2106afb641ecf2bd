package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import org.jetbrains.annotations.NotNull;

// cv-qualifiers.  Only four possible values, all shared constants.  Order
// when printed is always volatile, then const.
public final class Qualifiers extends Node {
  final boolean _isVolatile, _isConst;

  private Qualifiers( boolean isVolatile, boolean isConst ) {
    super(Kind.Qualifiers,false,1);
    _isVolatile = isVolatile;
    _isConst = isConst;
  }

  public static final Qualifiers NONE     = new Qualifiers(false,false);
  public static final Qualifiers CONST    = new Qualifiers(false,true );
  public static final Qualifiers VOLATILE = new Qualifiers(true ,false);
  public static final Qualifiers CV       = new Qualifiers(true ,true );

  public static @NotNull Qualifiers make( boolean isVolatile, boolean isConst ) {
    return isVolatile ? (isConst ? CV : VOLATILE) : (isConst ? CONST : NONE);
  }

  public boolean isVolatile() { return _isVolatile; }
  public boolean isConst() { return _isConst; }
  public boolean isEmpty() { return !_isVolatile && !_isConst; }

  // Post-position, after a type or a parameter list: " volatile const"
  public SB printSpaceL( SB sb ) {
    if( _isVolatile ) sb.p(" volatile");
    if( _isConst    ) sb.p(" const");
    return sb;
  }

  // Pre-position, before a type: "volatile const "
  public SB printSpaceR( SB sb ) {
    if( _isVolatile ) sb.p("volatile ");
    if( _isConst    ) sb.p("const ");
    return sb;
  }

  // Standalone: "volatile const"
  @Override public SB printLeft( SB sb ) {
    if( _isVolatile ) sb.p("volatile");
    if( _isVolatile && _isConst ) sb.s();
    if( _isConst    ) sb.p("const");
    return sb;
  }
}
