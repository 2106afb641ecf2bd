package com.cliffc.demangle.node;

import com.cliffc.demangle.util.Ary;
import com.cliffc.demangle.util.SB;
import org.jetbrains.annotations.NotNull;

// Ordered list of nodes: function parameters, template arguments.  Order is
// positional and significant.  Never interned; each call site gets its own.
// Append-only while the parser fills it in, and frozen once a parent takes
// it: the parent's depth was computed from ours.
public final class NodeArray extends Node {
  private final Ary<Node> _nodes = new Ary<>(Node.class);
  private final Context _ctx;   // Depth limit is checked as kids arrive
  private boolean _frozen;      // Held by a parent, no more kids

  private NodeArray( Context ctx ) { super(Kind.NodeArray,false,1); _ctx = ctx; }

  public static @NotNull NodeArray make( Context ctx ) { return new NodeArray(ctx); }

  // Append, preserving order
  public NodeArray addNode( Node node ) {
    assert node != null;
    if( _frozen ) throw new IllegalStateException("Appending to a NodeArray already held by a parent");
    int d = Math.max(_depth,node._depth+1);
    _ctx.check(this,d);
    _nodes.add(node);
    _depth = d;
    return this;
  }

  // Called by the parent taking this array
  void freeze() { _frozen = true; }
  public boolean frozen() { return _frozen; }

  public boolean empty() { return _nodes.isEmpty(); }
  public int size() { return _nodes.len(); }
  // Kid at index i, or null if out of bounds.  Template-argument inspection
  // routinely probes positions that may not exist.
  public Node get( int i ) { return _nodes.atX(i); }

  @Override public SB printLeft( SB sb ) {
    for( int i=0; i<_nodes.len(); i++ ) {
      if( i>0 ) sb.p(", ");
      _nodes.at(i).print(sb);
    }
    return sb;
  }
}
