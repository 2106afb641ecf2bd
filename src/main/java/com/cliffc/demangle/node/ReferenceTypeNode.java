package com.cliffc.demangle.node;

import org.jetbrains.annotations.NotNull;

// "T &"
public final class ReferenceTypeNode extends IndirectTypeNode {
  ReferenceTypeNode( Node pointee ) { super(Kind.ReferenceType,pointee,Qualifiers.NONE); }

  public static @NotNull ReferenceTypeNode make( Context ctx, Node pointee ) {
    assert pointee!=null : "null pointee";
    return ctx.addReferenceType(ctx.check(new ReferenceTypeNode(pointee)));
  }

  @Override String token() { return "&"; }
}
