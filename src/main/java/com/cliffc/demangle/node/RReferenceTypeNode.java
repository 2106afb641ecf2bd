package com.cliffc.demangle.node;

import org.jetbrains.annotations.NotNull;

// "T &&"
public final class RReferenceTypeNode extends IndirectTypeNode {
  RReferenceTypeNode( Node pointee ) { super(Kind.RReferenceType,pointee,Qualifiers.NONE); }

  public static @NotNull RReferenceTypeNode make( Context ctx, Node pointee ) {
    assert pointee!=null : "null pointee";
    return ctx.addRReferenceType(ctx.check(new RReferenceTypeNode(pointee)));
  }

  @Override String token() { return "&&"; }
}
