package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import org.jetbrains.annotations.NotNull;

// Function signature without a name.  Left side is the return type and
// calling convention, right side is the parameter list and member-function
// qualifiers.  A FunctionNode puts the name in between; a PointerTypeNode
// puts "(*" and ")" in between.
public final class FunctionTypeNode extends Node {
  final CallConv _conv;
  final NodeArray _params;      // Never null, may be empty
  final Node _retType;          // Null for constructors, destructors, conversions
  final Qualifiers _quals;      // Member-function cv-qualifiers
  final boolean _isVarArg;      // Trailing "..."

  private FunctionTypeNode( CallConv conv, NodeArray params, Node retType, Qualifiers quals, boolean isVarArg ) {
    super(Kind.FunctionType,true,depth(params,retType));
    assert conv!=null && params!=null && quals!=null;
    _conv = conv;
    _params = params;
    _retType = retType;
    _quals = quals;
    _isVarArg = isVarArg;
    params.freeze();
  }

  public static @NotNull FunctionTypeNode make( Context ctx, CallConv conv, NodeArray params, Node retType, Qualifiers quals, boolean isVarArg ) {
    return ctx.check(new FunctionTypeNode(conv,params,retType,quals,isVarArg));
  }
  public static @NotNull FunctionTypeNode make( Context ctx, NodeArray params, Node retType ) {
    return make(ctx,CallConv.UNKNOWN,params,retType,Qualifiers.NONE,false);
  }

  public CallConv callConv() { return _conv; }
  public NodeArray params() { return _params; }
  public Node retType() { return _retType; }
  public Qualifiers quals() { return _quals; }
  public boolean isVarArg() { return _isVarArg; }

  @Override public SB printLeft( SB sb ) {
    if( _retType != null ) space(_retType.printLeft(sb));
    if( _conv.printed() ) sb.p(_conv._str).s();
    return sb;
  }

  @Override public SB printRight( SB sb ) {
    sb.p('(');
    _params.print(sb);
    if( _isVarArg ) {
      if( !_params.empty() ) sb.p(", ");
      sb.p("...");
    }
    sb.p(')');
    _quals.printSpaceL(sb);
    // Function returning a function pointer or array: the return type's
    // right side closes around us.
    if( _retType != null && _retType.hasRight() )
      _retType.printRight(sb);
    return sb;
  }
}
