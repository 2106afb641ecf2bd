package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import com.cliffc.demangle.util.Util;
import org.jetbrains.annotations.NotNull;

// Qualified name, printed as "super::name".  Interned on the identity of the
// two kids; since the kids are themselves interned, pointer-equality of the
// kids is the same as structural equality, just asymptotically faster.
public final class NestedNameNode extends Node {
  final Node _super;            // Enclosing scope
  final Node _name;             // Member within the scope
  private final int _hash;

  NestedNameNode( Node sup, Node name ) {
    super(Kind.NestedName,false,depth(sup,name));
    assert sup!=null && name!=null;
    _super = sup;
    _name = name;
    _hash = Util.mix_hash(Util.ihash(sup),Util.ihash(name));
  }

  public static @NotNull NestedNameNode make( Context ctx, Node sup, Node name ) {
    return ctx.addNestedName(ctx.check(new NestedNameNode(sup,name)));
  }

  public Node sup() { return _super; }
  public Node name() { return _name; }

  @Override public SB printLeft( SB sb ) {
    _super.print(sb);
    sb.p("::");
    return _name.print(sb);
  }

  // Shallow compare, using '==' on the kids
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof NestedNameNode n && _super==n._super && _name==n._name;
  }
  @Override public int hashCode() { return _hash; }
}
