package com.cliffc.demangle.node;

// Borland calling conventions, as spelled in the demangled text.  UNKNOWN
// prints nothing.
public enum CallConv {
  UNKNOWN(""),
  FASTCALL("__fastcall"),
  STDCALL("__stdcall"),
  CDECL("__cdecl"),
  PASCAL("__pascal");

  public final String _str;
  CallConv( String str ) { _str = str; }
  public boolean printed() { return !_str.isEmpty(); }
}
