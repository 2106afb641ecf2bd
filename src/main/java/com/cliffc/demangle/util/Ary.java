package com.cliffc.demangle.util;

import java.lang.reflect.Array;
import java.util.Arrays;

// ArrayList with saner syntax
@SuppressWarnings("unchecked")
public class Ary<E> {
  public E[] _es;
  public int _len;
  public Ary(Class<E> clazz) { _es = (E[]) Array.newInstance(clazz, 1); _len = 0; }

  /** @return list is empty */
  public boolean isEmpty() { return _len==0; }
  /** @return active list length */
  public int len() { return _len; }
  /** @param i element index
   *  @return element being returned; throws if OOB */
  public E at( int i ) {
    range_check(i);
    return _es[i];
  }
  /** @param i element index
   *  @return element being returned, or null if OOB */
  public E atX( int i ) {
    return 0 <= i && i < _len ? _es[i] : null;
  }

  /** Add element in amortized constant time
   *  @param e Element to add at end of list
   *  @return 'this' for flow-coding */
  public Ary<E> add( E e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    _es[_len++] = e;
    return this;
  }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }

}
