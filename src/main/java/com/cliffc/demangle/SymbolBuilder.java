package com.cliffc.demangle;

import com.cliffc.demangle.node.Context;
import com.cliffc.demangle.node.Node;

// The parser side of demangling: walks one mangled symbol and builds its tree
// through the node factories.  Throws IllegalArgumentException to reject a
// malformed symbol.
@FunctionalInterface
public interface SymbolBuilder {
  Node build( Context ctx, String mangled );
}
