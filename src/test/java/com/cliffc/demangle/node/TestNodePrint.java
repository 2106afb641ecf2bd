package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestNodePrint {
  private Context _ctx;
  private Node _int, _char, _void;

  @Before public void setUp() {
    _ctx  = new Context();
    _int  = BuiltInTypeNode.make(_ctx,"int");
    _char = BuiltInTypeNode.make(_ctx,"char");
    _void = BuiltInTypeNode.make(_ctx,"void");
  }

  private NodeArray args( Node... kids ) {
    NodeArray ary = NodeArray.make(_ctx);
    for( Node kid : kids ) ary.addNode(kid);
    return ary;
  }
  private NameNode name( String s ) { return NameNode.make(_ctx,s); }
  private Node qname( String... parts ) {
    Node n = name(parts[0]);
    for( int i=1; i<parts.length; i++ ) n = NestedNameNode.make(_ctx,n,name(parts[i]));
    return n;
  }

  // Return type, name, params: three separately printed fragments
  @Test public void testFunction() {
    FunctionTypeNode ft = FunctionTypeNode.make(_ctx,args(_int),_int);
    FunctionNode fn = FunctionNode.make(_ctx,name("foo"),ft);
    assertEquals("int foo(int)",fn.str());
    assertFalse(fn.hasRight());
    assertTrue(ft.hasRight());
    assertEquals(Node.Kind.Function,fn.kind());
  }

  @Test public void testFunctionNoReturn() {
    FunctionTypeNode ft = FunctionTypeNode.make(_ctx,args(),null);
    assertEquals("Foo::Foo()",FunctionNode.make(_ctx,qname("Foo","Foo"),ft).str());
  }

  @Test public void testMemberFunction() {
    Node charp = PointerTypeNode.make(_ctx,_char);
    FunctionTypeNode ft = FunctionTypeNode.make(_ctx,CallConv.FASTCALL,args(_int,charp),_void,Qualifiers.CONST,true);
    FunctionNode fn = FunctionNode.make(_ctx,qname("ns","Foo","bar"),ft);
    assertEquals("void __fastcall ns::Foo::bar(int, char *, ...) const",fn.str());
  }

  @Test public void testVarArgs() {
    Node cchar = BuiltInTypeNode.make(_ctx,"char",Qualifiers.CONST);
    FunctionTypeNode ft0 = FunctionTypeNode.make(_ctx,CallConv.CDECL,args(PointerTypeNode.make(_ctx,cchar)),_int,Qualifiers.NONE,true);
    assertEquals("int __cdecl printf(const char *, ...)",FunctionNode.make(_ctx,name("printf"),ft0).str());
    FunctionTypeNode ft1 = FunctionTypeNode.make(_ctx,CallConv.UNKNOWN,args(),_int,Qualifiers.NONE,true);
    assertEquals("int f(...)",FunctionNode.make(_ctx,name("f"),ft1).str());
  }

  @Test public void testNestedName() {
    assertEquals("std::vector::size",qname("std","vector","size").str());
  }

  @Test public void testTemplate() {
    Node vec = qname("std","vector");
    assertEquals("std::vector<int>",TemplateNode.make(_ctx,vec,args(_int)).str());
    assertEquals("std::map<int, char>",TemplateNode.make(_ctx,qname("std","map"),args(_int,_char)).str());
    // Absent and empty params print the same
    TemplateNode absent = TemplateNode.make(_ctx,name("Foo"),null);
    TemplateNode empty  = TemplateNode.make(_ctx,name("Foo"),NodeArray.make(_ctx));
    assertEquals("Foo<>",absent.str());
    assertEquals("Foo<>",empty .str());
    assertEquals(null,absent.params());
    assertTrue(empty.params().empty());
  }

  @Test public void testNodeArrayOrder() {
    assertEquals("a, b, c",args(name("a"),name("b"),name("c")).str());
    assertEquals("a",args(name("a")).str());
    assertEquals("",args().str());
  }

  @Test public void testQualifiers() {
    Qualifiers cv = Qualifiers.make(true,true);
    assertEquals(" volatile const",cv.printSpaceL(new SB()).toString());
    assertEquals("volatile const ",cv.printSpaceR(new SB()).toString());
    assertEquals("volatile const",cv.str());
    assertEquals("const",Qualifiers.CONST.str());
    assertEquals("volatile",Qualifiers.VOLATILE.str());
    assertEquals("",Qualifiers.NONE.str());
    assertEquals(" const",Qualifiers.CONST.printSpaceL(new SB()).toString());
    assertEquals("",Qualifiers.NONE.printSpaceR(new SB()).toString());
  }

  @Test public void testConversionOperator() {
    Node op = NestedNameNode.make(_ctx,name("Foo"),ConversionOperatorNode.make(_ctx,BuiltInTypeNode.make(_ctx,"bool")));
    FunctionTypeNode ft = FunctionTypeNode.make(_ctx,CallConv.UNKNOWN,args(),null,Qualifiers.CONST,false);
    assertEquals("Foo::operator bool() const",FunctionNode.make(_ctx,op,ft).str());
    Node charp = PointerTypeNode.make(_ctx,_char);
    assertEquals("operator char *",ConversionOperatorNode.make(_ctx,charp).str());
  }

  @Test public void testPointers() {
    Node cint = BuiltInTypeNode.make(_ctx,"int",Qualifiers.CONST);
    assertEquals("int *",PointerTypeNode.make(_ctx,_int).str());
    assertEquals("const int *",PointerTypeNode.make(_ctx,cint).str());
    assertEquals("int * const",PointerTypeNode.make(_ctx,_int,Qualifiers.CONST).str());
    assertEquals("int **",PointerTypeNode.make(_ctx,PointerTypeNode.make(_ctx,_int)).str());
    assertEquals("int * const *",PointerTypeNode.make(_ctx,PointerTypeNode.make(_ctx,_int,Qualifiers.CONST)).str());
    assertEquals("int &",ReferenceTypeNode.make(_ctx,_int).str());
    assertEquals("int &&",RReferenceTypeNode.make(_ctx,_int).str());
    Node vec = NamedTypeNode.make(_ctx,TemplateNode.make(_ctx,qname("std","vector"),args(_int)),Qualifiers.CONST);
    assertEquals("const std::vector<int> &",ReferenceTypeNode.make(_ctx,vec).str());
  }

  @Test public void testFunctionPointers() {
    FunctionTypeNode ft = FunctionTypeNode.make(_ctx,args(_char),_int);
    Node fp = PointerTypeNode.make(_ctx,ft);
    assertTrue(fp.hasRight());
    assertEquals("int (*)(char)",fp.str());
    assertEquals("int (* const)(char)",PointerTypeNode.make(_ctx,ft,Qualifiers.CONST).str());
    assertEquals("int (**)(char)",PointerTypeNode.make(_ctx,fp).str());
    assertEquals("int (&)(char)",ReferenceTypeNode.make(_ctx,ft).str());
    // Function pointer as a parameter
    FunctionTypeNode cb = FunctionTypeNode.make(_ctx,args(fp,_int),_void);
    assertEquals("void qsort(int (*)(char), int)",FunctionNode.make(_ctx,name("qsort"),cb).str());
  }

  // The name sits inside the return type's declarator
  @Test public void testFunctionReturningFunctionPointer() {
    Node fp = PointerTypeNode.make(_ctx,FunctionTypeNode.make(_ctx,args(BuiltInTypeNode.make(_ctx,"double")),_int));
    FunctionNode fn = FunctionNode.make(_ctx,name("foo"),FunctionTypeNode.make(_ctx,args(_char),fp));
    assertEquals("int (*foo(char))(double)",fn.str());
  }

  @Test public void testArrays() {
    ArrayTypeNode a4 = ArrayTypeNode.make(_ctx,_int,4);
    assertEquals("int[4]",a4.str());
    assertEquals("int (*)[4]",PointerTypeNode.make(_ctx,a4).str());
    assertEquals("char (&)[4]",ReferenceTypeNode.make(_ctx,ArrayTypeNode.make(_ctx,_char,4)).str());
    assertEquals("int[2][3]",ArrayTypeNode.make(_ctx,ArrayTypeNode.make(_ctx,_int,3),2).str());
    Node fp = PointerTypeNode.make(_ctx,FunctionTypeNode.make(_ctx,args(_char),_int));
    assertEquals("int (*[4])(char)",ArrayTypeNode.make(_ctx,fp,4).str());
  }

  @Test public void testPrintIdempotent() {
    FunctionTypeNode ft = FunctionTypeNode.make(_ctx,args(PointerTypeNode.make(_ctx,ArrayTypeNode.make(_ctx,_int,4))),_int);
    FunctionNode fn = FunctionNode.make(_ctx,qname("a","b"),ft);
    String s0 = fn.str();
    assertEquals(s0,fn.str());
    assertEquals(s0,fn.toString());
    assertEquals(s0+s0,fn.print(fn.print(new SB())).toString());
    assertEquals("int a::b(int (*)[4])",s0);
  }
}
