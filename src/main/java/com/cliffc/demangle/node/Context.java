package com.cliffc.demangle.node;

import com.cliffc.demangle.NestingTooDeepException;
import org.jctools.maps.NonBlockingHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Hash-Cons table for one demangling session.
//
// Name-like nodes (names, nested names, and the type nodes built from them)
// are interned here, so equal sub-names across all the symbols of a session
// are one shared instance.  Keys of composite nodes use the IDENTITY of
// their already-interned kids; no deep compare ever happens.  Thus an
// equality check of a (possibly very large) name is a pointer check.
//
// Every add is an atomic insert-if-absent that hands back whichever node got
// installed first, so a Context may be shared by concurrent workers.  Or give
// each worker its own Context, and lose the cross-worker sharing.  The node
// factories just build and add; a get is only for asking without inserting.
//
// Factories also run new nodes past check(), which fails the symbol being
// built when nesting exceeds maxDepth.
public class Context {
  private static final Logger LOG = LoggerFactory.getLogger(Context.class);

  // Override with -Ddemangle.max_depth=N
  public static final int DEFAULT_MAX_DEPTH = Integer.getInteger("demangle.max_depth",256);

  private final NonBlockingHashMap<Node,Node> _intern = new NonBlockingHashMap<>();
  private final int _maxDepth;

  public Context() { this(DEFAULT_MAX_DEPTH); }
  public Context( int maxDepth ) {
    if( maxDepth < 1 ) throw new IllegalArgumentException("max depth must be positive, got "+maxDepth);
    _maxDepth = maxDepth;
  }

  public int maxDepth() { return _maxDepth; }
  // Count of interned nodes
  public int size() { return _intern.size(); }
  // Drop all interned nodes.  Trees already built keep their nodes.
  public void clear() {
    LOG.debug("Dropping {} interned nodes",_intern.size());
    _intern.clear();
  }

  // ----------
  public NameNode getName( String name ) { return get(new NameNode(name)); }
  public NameNode addName( NameNode n ) { return add(n); }

  public NestedNameNode getNestedName( Node sup, Node name ) { return get(new NestedNameNode(sup,name)); }
  public NestedNameNode addNestedName( NestedNameNode n ) { return add(n); }

  public BuiltInTypeNode getBuiltInType( String name, Qualifiers quals ) { return get(new BuiltInTypeNode(name,quals)); }
  public BuiltInTypeNode addBuiltInType( BuiltInTypeNode t ) { return add(t); }

  public NamedTypeNode getNamedType( Node name, Qualifiers quals ) { return get(new NamedTypeNode(name,quals)); }
  public NamedTypeNode addNamedType( NamedTypeNode t ) { return add(t); }

  public PointerTypeNode getPointerType( Node pointee, Qualifiers quals ) { return get(new PointerTypeNode(pointee,quals)); }
  public PointerTypeNode addPointerType( PointerTypeNode t ) { return add(t); }

  public ReferenceTypeNode getReferenceType( Node pointee ) { return get(new ReferenceTypeNode(pointee)); }
  public ReferenceTypeNode addReferenceType( ReferenceTypeNode t ) { return add(t); }

  public RReferenceTypeNode getRReferenceType( Node pointee ) { return get(new RReferenceTypeNode(pointee)); }
  public RReferenceTypeNode addRReferenceType( RReferenceTypeNode t ) { return add(t); }

  public ArrayTypeNode getArrayType( Node elem, long size ) { return get(new ArrayTypeNode(elem,size)); }
  public ArrayTypeNode addArrayType( ArrayTypeNode t ) { return add(t); }

  // ----------
  // Interned nodes compare equal only to the same class, so the cast is safe
  @SuppressWarnings("unchecked")
  private <N extends Node> N get( N key ) { return (N)_intern.get(key); }

  @SuppressWarnings("unchecked")
  private <N extends Node> N add( N n ) {
    Node old = _intern.putIfAbsent(n,n);
    return old==null ? n : (N)old;
  }

  // Fail this symbol if the new node nests too deep
  <N extends Node> N check( N n ) { return check(n,n.depth()); }
  <N extends Node> N check( N n, int depth ) {
    if( depth > _maxDepth )
      throw new NestingTooDeepException(depth,_maxDepth);
    return n;
  }
}
