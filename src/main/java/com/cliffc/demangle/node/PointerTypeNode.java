package com.cliffc.demangle.node;

import org.jetbrains.annotations.NotNull;

// "T *", optionally cv-qualified: "T * const"
public final class PointerTypeNode extends IndirectTypeNode {
  PointerTypeNode( Node pointee, Qualifiers quals ) { super(Kind.PointerType,pointee,quals); }

  public static @NotNull PointerTypeNode make( Context ctx, Node pointee, Qualifiers quals ) {
    assert pointee!=null : "null pointee";
    return ctx.addPointerType(ctx.check(new PointerTypeNode(pointee,quals)));
  }
  public static @NotNull PointerTypeNode make( Context ctx, Node pointee ) { return make(ctx,pointee,Qualifiers.NONE); }

  @Override String token() { return "*"; }
}
