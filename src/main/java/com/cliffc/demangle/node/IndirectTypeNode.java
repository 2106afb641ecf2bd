package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import com.cliffc.demangle.util.Util;

// Pointers and references.  Interned on (kind, pointee identity, qualifiers).
//
// A function or array pointee needs parens around the declarator:
// "int (*)(char)", "char (&)[4]".  Any other pointee with a right side is
// itself a wrapped pointer, and we just extend its declarator: "int (**)(char)".
public abstract class IndirectTypeNode extends Node {
  final Node _pointee;
  final Qualifiers _quals;      // Qualifies the pointer itself: "int * const"
  private final int _hash;

  IndirectTypeNode( Kind kind, Node pointee, Qualifiers quals ) {
    super(kind,pointee.hasRight(),depth(pointee));
    assert quals!=null;
    _pointee = pointee;
    _quals = quals;
    _hash = Util.mix_hash(kind.ordinal(),Util.ihash(pointee),Util.ihash(quals));
  }

  // "*", "&" or "&&"
  abstract String token();

  public Node pointee() { return _pointee; }
  public Qualifiers quals() { return _quals; }

  private boolean wrap() { return _pointee._kind==Kind.FunctionType || _pointee._kind==Kind.ArrayType; }

  @Override public SB printLeft( SB sb ) {
    if( wrap() ) {
      _pointee.printLeft(sb);
      char c = sb.last();
      if( c!=0 && c!=' ' && c!='(' ) sb.s();
      sb.p('(');
    } else {
      space(_pointee.printLeft(sb));
    }
    sb.p(token());
    return _quals.printSpaceL(sb);
  }

  @Override public SB printRight( SB sb ) {
    if( wrap() ) sb.p(')');
    return _pointee.printRight(sb);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof IndirectTypeNode t && _kind==t._kind && _pointee==t._pointee && _quals==t._quals;
  }
  @Override public int hashCode() { return _hash; }
}
