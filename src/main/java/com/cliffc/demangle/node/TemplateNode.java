package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import org.jetbrains.annotations.NotNull;

// Template instance: "name<params>".  Params may be absent or empty, both
// print as "name<>"; the distinction is kept but means nothing to printing.
public final class TemplateNode extends Node {
  final Node _name;
  final NodeArray _params;      // Nullable

  private TemplateNode( Node name, NodeArray params ) {
    super(Kind.Template,false,depth(name,params));
    assert name!=null;
    _name = name;
    _params = params;
    if( params != null ) params.freeze();
  }

  public static @NotNull TemplateNode make( Context ctx, Node name, NodeArray params ) {
    return ctx.check(new TemplateNode(name,params));
  }

  public Node name() { return _name; }
  public NodeArray params() { return _params; }

  @Override public SB printLeft( SB sb ) {
    _name.print(sb);
    sb.p('<');
    if( _params != null ) _params.print(sb);
    return sb.p('>');
  }
}
