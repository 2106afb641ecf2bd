package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import com.cliffc.demangle.util.Util;
import org.jetbrains.annotations.NotNull;

// Builtin type spelled by a fixed token: "int", "unsigned char", "void",
// "long double".  Interned on (token, qualifiers).
public final class BuiltInTypeNode extends Node {
  final String _name;
  final Qualifiers _quals;
  private final int _hash;

  BuiltInTypeNode( String name, Qualifiers quals ) {
    super(Kind.BuiltInType,false,1);
    assert name!=null && !name.isEmpty() && quals!=null;
    _name = name;
    _quals = quals;
    _hash = Util.mix_hash(name.hashCode(),Util.ihash(quals));
  }

  public static @NotNull BuiltInTypeNode make( Context ctx, String name, Qualifiers quals ) {
    return ctx.addBuiltInType(new BuiltInTypeNode(name,quals));
  }
  public static @NotNull BuiltInTypeNode make( Context ctx, String name ) { return make(ctx,name,Qualifiers.NONE); }

  public String name() { return _name; }
  public Qualifiers quals() { return _quals; }

  @Override public SB printLeft( SB sb ) { return _quals.printSpaceR(sb).p(_name); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof BuiltInTypeNode t && _quals==t._quals && _name.equals(t._name);
  }
  @Override public int hashCode() { return _hash; }
}
