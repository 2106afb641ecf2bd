package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import org.jetbrains.annotations.NotNull;

// A named function: "ReturnType Name(Params)".  The name goes between the
// function type's left and right sides.
public final class FunctionNode extends Node {
  final Node _name;             // Name, NestedName, Template or ConversionOperator
  final FunctionTypeNode _funcType;

  private FunctionNode( Node name, FunctionTypeNode funcType ) {
    super(Kind.Function,false,depth(name,funcType));
    assert name!=null && funcType!=null;
    _name = name;
    _funcType = funcType;
  }

  public static @NotNull FunctionNode make( Context ctx, Node name, FunctionTypeNode funcType ) {
    return ctx.check(new FunctionNode(name,funcType));
  }

  public Node name() { return _name; }
  public FunctionTypeNode funcType() { return _funcType; }

  @Override public SB printLeft( SB sb ) {
    _funcType.printLeft(sb);
    _name.print(sb);
    return _funcType.printRight(sb);
  }
}
