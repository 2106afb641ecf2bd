package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import com.cliffc.demangle.util.Util;
import org.jetbrains.annotations.NotNull;

// "T[N]".  The element type prints on the left, the bound on the right, so
// that a pointer can slip in between: "int (*)[4]".  Multi-dimensional
// arrays nest on the element: int[2][3] is an array of 2 int[3].
public final class ArrayTypeNode extends Node {
  final Node _elem;
  final long _size;
  private final int _hash;

  ArrayTypeNode( Node elem, long size ) {
    super(Kind.ArrayType,true,depth(elem));
    assert elem!=null && size>=0;
    _elem = elem;
    _size = size;
    _hash = Util.mix_hash(Util.ihash(elem),Long.hashCode(size));
  }

  public static @NotNull ArrayTypeNode make( Context ctx, Node elem, long size ) {
    return ctx.addArrayType(ctx.check(new ArrayTypeNode(elem,size)));
  }

  public Node elem() { return _elem; }
  public long size() { return _size; }

  @Override public SB printLeft( SB sb ) { return _elem.printLeft(sb); }
  @Override public SB printRight( SB sb ) {
    sb.p('[').p(_size).p(']');
    return _elem.printRight(sb);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof ArrayTypeNode t && _elem==t._elem && _size==t._size;
  }
  @Override public int hashCode() { return _hash; }
}
