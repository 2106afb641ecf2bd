package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;

// Demangled-symbol syntax tree.
//
// Nodes are immutable once built and freely shared: the name-like variants
// are interned in a Context, so the tree is really a DAG.  Nothing points
// back up, and factories only take already-built children, so no cycles.
//
// Printing is two-phase.  Declarator syntax wraps a name on both sides, e.g.
// the 'foo' in "int (*foo(char))(double)".  Each node splits its text into a
// left side (up to and including its primary content) and an optional right
// side.  A parent prints a child's left side, its own bits, then the child's
// right side, and the child never needs to know its syntactic context.
public abstract class Node {

  // Closed set of node variants
  public enum Kind {
    Name,                       // Plain identifier
    NestedName,                 // scope::name
    NodeArray,                  // Comma-separated list
    Function,                   // Named function
    FunctionType,               // Return, calling convention, params
    Template,                   // name<params>
    Qualifiers,                 // volatile, const
    ConversionOperator,         // operator type
    BuiltInType,                // int, unsigned char, ...
    NamedType,                  // Class or enum type, by name
    PointerType,                // T *
    ReferenceType,              // T &
    RReferenceType,             // T &&
    ArrayType,                  // T[N]
  }

  public final Kind _kind;      // Variant tag
  final boolean _hasRight;      // True if text continues after nested content
  int _depth;                   // Nesting depth, leaves are 1

  Node( Kind kind, boolean hasRight, int depth ) { _kind = kind; _hasRight = hasRight; _depth = depth; }

  public Kind kind() { return _kind; }
  public boolean hasRight() { return _hasRight; }
  public int depth() { return _depth; }

  // Left side of the text, up to and including the primary content.
  public abstract SB printLeft( SB sb );
  // Trailing text, printed after all nested content.  Most nodes have none.
  public SB printRight( SB sb ) { return sb; }

  // Full print
  public final SB print( SB sb ) {
    printLeft(sb);
    if( _hasRight ) printRight(sb);
    return sb;
  }

  // Single entry point for the driver: the demangled text of this tree
  public final String str() { return print(new SB()).toString(); }
  @Override public final String toString() { return str(); }

  // Separate a type from a following declarator token or name.  No space
  // after an open paren or a pointer/reference token: "int (*", "char **".
  static SB space( SB sb ) {
    char c = sb.last();
    return c==0 || c==' ' || c=='(' || c=='*' || c=='&' ? sb : sb.s();
  }

  // One deeper than the deepest kid; null kids are skipped
  static int depth( Node... kids ) {
    int d=0;
    for( Node kid : kids )
      if( kid != null ) d = Math.max(d,kid._depth);
    return d+1;
  }
}
