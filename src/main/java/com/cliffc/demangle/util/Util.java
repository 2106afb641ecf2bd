package com.cliffc.demangle.util;

public class Util {
  // Identity hash of a possibly-null reference.  Intern keys are built from
  // already-canonical children, so identity is the right notion of equality.
  public static int ihash( Object o ) { return o==null ? 0 : System.identityHashCode(o); }

  // Mix two hashes.  Borrowed from the lookup3 final-mix, order-dependent.
  private static int rot(int x, int k) { return (x<<k) | (x>>>(32-k)); }
  public static int mix_hash( int h0, int h1 ) {
    int a = h0, b = h1, c = 0xcafebabe;
    c ^= b; c -= rot(b,14);
    a ^= c; a -= rot(c,11);
    b ^= a; b -= rot(a,25);
    c ^= b; c -= rot(b,16);
    a ^= c; a -= rot(c, 4);
    b ^= a; b -= rot(a,14);
    c ^= b; c -= rot(b,24);
    return c;
  }
  public static int mix_hash( int h0, int h1, int h2 ) { return mix_hash(mix_hash(h0,h1),h2); }
}
