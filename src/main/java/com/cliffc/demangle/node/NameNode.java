package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import org.jetbrains.annotations.NotNull;

// A plain identifier.  Interned: at most one per distinct string per Context.
public final class NameNode extends Node {
  final String _name;
  private final int _hash;

  NameNode( String name ) {
    super(Kind.Name,false,1);
    assert name!=null && !name.isEmpty() : "empty name";
    _name = name;
    _hash = name.hashCode();
  }

  public static @NotNull NameNode make( Context ctx, String name ) {
    return ctx.addName(new NameNode(name));
  }

  public String name() { return _name; }

  @Override public SB printLeft( SB sb ) { return sb.p(_name); }

  // Intern-table equality: by string value
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof NameNode n && _name.equals(n._name);
  }
  @Override public int hashCode() { return _hash; }
}
