package com.cliffc.demangle;

import com.cliffc.demangle.node.Context;
import com.cliffc.demangle.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A demangling session: one Context shared by every symbol demangled here.
 *
 *  A symbol that fails to build (rejected by the parser, or nesting too
 *  deep) is logged and comes back as null; the rest of the session carries
 *  on with the same Context.  Use a fresh Demangler per independent batch to
 *  bound memory and keep batches from sharing names. */
public class Demangler {
  private static final Logger LOG = LoggerFactory.getLogger(Demangler.class);

  private final Context _ctx;

  public Demangler() { this(new Context()); }
  public Demangler( Context ctx ) { _ctx = ctx; }

  public Context context() { return _ctx; }

  /** @param mangled symbol as found in the symbol table
   *  @param parser  builds the tree for the symbol
   *  @return demangled text, or null if the symbol could not be built */
  public String demangle( String mangled, SymbolBuilder parser ) {
    Node root;
    try {
      root = parser.build(_ctx,mangled);
    } catch( NestingTooDeepException | IllegalArgumentException e ) {
      LOG.warn("Cannot demangle '{}': {}",mangled,e.getMessage());
      return null;
    }
    if( root==null ) {
      LOG.warn("Cannot demangle '{}': no tree",mangled);
      return null;
    }
    return root.str();
  }

  /** Demangle a batch, in input order.  Failed symbols map to null. */
  public Map<String,String> demangleAll( List<String> mangled, SymbolBuilder parser ) {
    Map<String,String> rez = new LinkedHashMap<>();
    int fails=0;
    for( String s : mangled ) {
      String d = demangle(s,parser);
      if( d==null ) fails++;
      rez.put(s,d);
    }
    LOG.debug("Demangled {} symbols, {} failed, {} interned nodes",mangled.size(),fails,_ctx.size());
    return rez;
  }
}
