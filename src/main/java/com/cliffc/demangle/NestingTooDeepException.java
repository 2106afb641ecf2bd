package com.cliffc.demangle;

// A symbol nests deeper than its Context allows.  Fails only the symbol
// being built; the Context stays usable.
public class NestingTooDeepException extends RuntimeException {
  public final int _depth, _max;
  public NestingTooDeepException( int depth, int max ) {
    super("Nesting depth "+depth+" exceeds limit "+max);
    _depth = depth;
    _max = max;
  }
}
