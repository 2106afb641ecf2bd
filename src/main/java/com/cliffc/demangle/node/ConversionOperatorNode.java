package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import org.jetbrains.annotations.NotNull;

// "operator type", the name of a user-defined conversion
public final class ConversionOperatorNode extends Node {
  final Node _type;

  private ConversionOperatorNode( Node type ) {
    super(Kind.ConversionOperator,false,depth(type));
    assert type!=null;
    _type = type;
  }

  public static @NotNull ConversionOperatorNode make( Context ctx, Node type ) {
    return ctx.check(new ConversionOperatorNode(type));
  }

  public Node type() { return _type; }

  @Override public SB printLeft( SB sb ) {
    sb.p("operator ");
    return _type.print(sb);
  }
}
