package opsugar;

import static opsugar.GoSyntax.addressOf;
import static opsugar.GoSyntax.binary;
import static opsugar.GoSyntax.call;
import static opsugar.GoSyntax.composite;
import static opsugar.GoSyntax.countTo;
import static opsugar.GoSyntax.define;
import static opsugar.GoSyntax.field;
import static opsugar.GoSyntax.file;
import static opsugar.GoSyntax.id;
import static opsugar.GoSyntax.iface;
import static opsugar.GoSyntax.ifaceMethod;
import static opsugar.GoSyntax.index;
import static opsugar.GoSyntax.lit;
import static opsugar.GoSyntax.main;
import static opsugar.GoSyntax.method;
import static opsugar.GoSyntax.println;
import static opsugar.GoSyntax.ret;
import static opsugar.GoSyntax.sel;
import static opsugar.GoSyntax.sliceOf;
import static opsugar.GoSyntax.star;
import static opsugar.GoSyntax.struct;
import static opsugar.GoSyntax.typeDecl;
import static opsugar.GoSyntax.varDecl;

import com.google.common.collect.ImmutableList;

/** Sample programs using overloaded operators. */
final class Fixtures {

  private Fixtures() {}

  /**
   * <pre>
   * type Point struct { X, Y int }
   * type Adder interface { +(Point) Point }
   *
   * func (a Point) +(b Point) Point { return Point{a.X + b.X, a.Y + b.Y} }
   * </pre>
   *
   * followed by {@code main}. With {@code pointerReceiver} the method is declared on {@code
   * *Point} instead.
   */
  static Ast.File points(boolean pointerReceiver, Ast.Stmt... mainBody) {
    Ast.Expr recvType = pointerReceiver ? star(id("Point")) : id("Point");
    return file(
        typeDecl("Point", struct(field(id("int"), "X", "Y"))),
        typeDecl(
            "Adder",
            iface(ifaceMethod("+", ImmutableList.of(field(id("Point"))), id("Point")))),
        method(
            field(recvType, "a"),
            "+",
            ImmutableList.of(field(id("Point"), "b")),
            id("Point"),
            ret(
                composite(
                    id("Point"),
                    binary(sel(id("a"), "X"), Token.ADD, sel(id("b"), "X")),
                    binary(sel(id("a"), "Y"), Token.ADD, sel(id("b"), "Y"))))),
        main(mainBody));
  }

  /** {@code a := Point{1, 2}} */
  static Ast.Stmt pointA() {
    return define("a", composite(id("Point"), lit(1), lit(2)));
  }

  /** {@code b := Point{3, 4}} */
  static Ast.Stmt pointB() {
    return define("b", composite(id("Point"), lit(3), lit(4)));
  }

  /** {@code println(a + b + a + b)} */
  static Ast.Stmt printChain() {
    return println(
        binary(
            binary(binary(id("a"), Token.ADD, id("b")), Token.ADD, id("a")), Token.ADD, id("b")));
  }

  /** {@code var sum Adder = a} then {@code println(sum + b)}. */
  static ImmutableList<Ast.Stmt> interfaceSum() {
    return ImmutableList.of(
        varDecl("sum", id("Adder"), id("a")), println(binary(id("sum"), Token.ADD, id("b"))));
  }

  /**
   * <pre>
   * type Vector []int
   *
   * func (v *Vector) [](i int) int { return []int(*v)[i] }
   * func (v *Vector) []=(i int, x int) { []int(*v)[i] = x }
   * func (v *Vector) *(k int) Vector {
   *   out := make([]int, len(*v))
   *   for i, x := range []int(*v) {
   *     out[i] = x * k
   *   }
   *   return Vector(out)
   * }
   * </pre>
   *
   * followed by {@code main}.
   */
  static Ast.File vectors(Ast.Stmt... mainBody) {
    return file(
        typeDecl("Vector", sliceOf(id("int"))),
        method(
            field(star(id("Vector")), "v"),
            "[]",
            ImmutableList.of(field(id("int"), "i")),
            id("int"),
            ret(index(elements(), id("i")))),
        method(
            field(star(id("Vector")), "v"),
            "[]=",
            ImmutableList.of(field(id("int"), "i"), field(id("int"), "x")),
            null,
            GoSyntax.assign(index(elements(), id("i")), id("x"))),
        method(
            field(star(id("Vector")), "v"),
            "*",
            ImmutableList.of(field(id("int"), "k")),
            id("Vector"),
            define("out", call("make", sliceOf(id("int")), call("len", star(id("v"))))),
            Ast.RangeStmt.of(
                id("i"),
                id("x"),
                Token.DEFINE,
                elements(),
                GoSyntax.block(
                    GoSyntax.assign(
                        index(id("out"), id("i")), binary(id("x"), Token.MUL, id("k"))))),
            ret(call("Vector", id("out")))),
        main(mainBody));
  }

  // []int(*v)
  private static Ast.Expr elements() {
    return call(sliceOf(id("int")), star(id("v")));
  }

  /** {@code v := &Vector{1, 2, 3}} */
  static Ast.Stmt vectorV() {
    return define("v", addressOf(composite(id("Vector"), lit(1), lit(2), lit(3))));
  }

  /**
   * <pre>
   * type T int
   * type Matrix struct { cells []T; rows, cols int }
   *
   * func (m *Matrix) [](i, j int) T { return m.cells[i*m.cols+j] }
   * func (m *Matrix) []=(i, j int, x T) { m.cells[i*m.cols+j] = x }
   * func (a *Matrix) *(b *Matrix) *Matrix {
   *   c := &Matrix{make([]T, a.rows*b.cols), a.rows, b.cols}
   *   for i := 0; i < a.rows; i++ {
   *     for j := 0; j < b.cols; j++ {
   *       var t T
   *       for k := 0; k < a.cols; k++ {
   *         t += a[i, k] * b[k, j]
   *       }
   *       c[i, j] = t
   *     }
   *   }
   *   return c
   * }
   * </pre>
   *
   * followed by {@code main}.
   */
  static Ast.File matrix(Ast.Stmt... mainBody) {
    return file(
        typeDecl("T", id("int")),
        typeDecl(
            "Matrix", struct(field(sliceOf(id("T")), "cells"), field(id("int"), "rows", "cols"))),
        method(
            field(star(id("Matrix")), "m"),
            "[]",
            ImmutableList.of(field(id("int"), "i", "j")),
            id("T"),
            ret(cell())),
        method(
            field(star(id("Matrix")), "m"),
            "[]=",
            ImmutableList.of(field(id("int"), "i", "j"), field(id("T"), "x")),
            null,
            GoSyntax.assign(cell(), id("x"))),
        method(
            field(star(id("Matrix")), "a"),
            "*",
            ImmutableList.of(field(star(id("Matrix")), "b")),
            star(id("Matrix")),
            define(
                "c",
                addressOf(
                    composite(
                        id("Matrix"),
                        call(
                            "make",
                            sliceOf(id("T")),
                            binary(sel(id("a"), "rows"), Token.MUL, sel(id("b"), "cols"))),
                        sel(id("a"), "rows"),
                        sel(id("b"), "cols")))),
            countTo(
                "i",
                sel(id("a"), "rows"),
                countTo(
                    "j",
                    sel(id("b"), "cols"),
                    varDecl("t", id("T"), null),
                    countTo(
                        "k",
                        sel(id("a"), "cols"),
                        Ast.AssignStmt.of(
                            id("t"),
                            Token.ADD_ASSIGN,
                            binary(
                                index(id("a"), id("i"), id("k")),
                                Token.MUL,
                                index(id("b"), id("k"), id("j"))))),
                    GoSyntax.assign(index(id("c"), id("i"), id("j")), id("t")))),
            ret(id("c"))),
        main(mainBody));
  }

  // m.cells[i*m.cols+j]
  private static Ast.Expr cell() {
    return index(
        sel(id("m"), "cells"),
        binary(binary(id("i"), Token.MUL, sel(id("m"), "cols")), Token.ADD, id("j")));
  }

  /** {@code a := &Matrix{make([]T, 4), 2, 2}} */
  static Ast.Stmt matrixA() {
    return define(
        "a",
        addressOf(
            composite(id("Matrix"), call("make", sliceOf(id("T")), lit(4)), lit(2), lit(2))));
  }
}
