package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import com.cliffc.demangle.util.Util;
import org.jetbrains.annotations.NotNull;

// Class, struct, union or enum type, referred to by its (possibly nested or
// templated) name.  Interned on (name identity, qualifiers).
public final class NamedTypeNode extends Node {
  final Node _name;
  final Qualifiers _quals;
  private final int _hash;

  NamedTypeNode( Node name, Qualifiers quals ) {
    super(Kind.NamedType,false,depth(name));
    assert name!=null && quals!=null;
    _name = name;
    _quals = quals;
    _hash = Util.mix_hash(Util.ihash(name),Util.ihash(quals));
  }

  public static @NotNull NamedTypeNode make( Context ctx, Node name, Qualifiers quals ) {
    return ctx.addNamedType(ctx.check(new NamedTypeNode(name,quals)));
  }
  public static @NotNull NamedTypeNode make( Context ctx, Node name ) { return make(ctx,name,Qualifiers.NONE); }

  public Node name() { return _name; }
  public Qualifiers quals() { return _quals; }

  @Override public SB printLeft( SB sb ) {
    _quals.printSpaceR(sb);
    return _name.print(sb);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof NamedTypeNode t && _name==t._name && _quals==t._quals;
  }
  @Override public int hashCode() { return _hash; }
}
