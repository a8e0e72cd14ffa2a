/*
 * Copyright 2025 The Specinfer Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.specinfer.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExprTest {

  private static final Decl.Field NEXT = new Decl.Field("next", Type.REF);
  private static final Decl.Field VAL = new Decl.Field("val", Type.INT);

  private static final Expr.LocalVar X = new Expr.LocalVar("x", Type.REF);
  private static final Expr.LocalVar Y = new Expr.LocalVar("y", Type.REF);
  private static final Expr.LocalVar N = new Expr.LocalVar("n", Type.INT);

  @Test
  public void rendering() {
    assertThat(X.toString()).isEqualTo("x");
    assertThat(new Expr.FieldAccess(X, NEXT).toString()).isEqualTo("x.next");
    assertThat(new Expr.FieldAccess(new Expr.FieldAccess(X, NEXT), VAL).toString())
        .isEqualTo("x.next.val");
    assertThat(new Expr.Binary(Expr.Op.NE, X, Expr.NullLit.NULL).toString())
        .isEqualTo("x != null");
    Expr sum = new Expr.Binary(Expr.Op.ADD, N, new Expr.IntLit(1));
    assertThat(new Expr.Binary(Expr.Op.LT, sum, new Expr.IntLit(10)).toString())
        .isEqualTo("(n + 1) < 10");
    assertThat(new Expr.Not(new Expr.Binary(Expr.Op.EQ, X, Y)).toString())
        .isEqualTo("!(x == y)");
    assertThat(new Expr.FuncApp("len", ImmutableList.of(X, N), Type.INT).toString())
        .isEqualTo("len(x, n)");
    assertThat(Expr.BoolLit.TRUE.toString()).isEqualTo("true");
  }

  @Test
  public void permissions() {
    assertThat(Expr.PermLit.FULL.toString()).isEqualTo("write");
    assertThat(Expr.PermLit.NONE.toString()).isEqualTo("none");
    assertThat(Expr.PermLit.WILDCARD.toString()).isEqualTo("wildcard");
    assertThat(Expr.PermLit.fraction(1, 2).toString()).isEqualTo("1/2");
    assertThat(Expr.PermLit.fraction(3, 3)).isSameInstanceAs(Expr.PermLit.FULL);
    assertThat(Expr.PermLit.fraction(0, 7)).isSameInstanceAs(Expr.PermLit.NONE);
    assertThat(Expr.PermLit.fraction(1, 2)).isEqualTo(Expr.PermLit.fraction(1, 2));
    assertThrows(IllegalArgumentException.class, () -> Expr.PermLit.fraction(1, 0));
  }

  @Test
  public void accessPredicates() {
    Expr.PredicateAccessPredicate p =
        Expr.PredicateAccessPredicate.full("P", X, new Expr.FieldAccess(Y, NEXT));
    assertThat(p.toString()).isEqualTo("acc(P(x, y.next), write)");
    assertThat(p.type()).isEqualTo(Type.BOOL);
    Expr.FieldAccessPredicate f =
        new Expr.FieldAccessPredicate(new Expr.FieldAccess(X, NEXT), Expr.PermLit.fraction(1, 2));
    assertThat(f.toString()).isEqualTo("acc(x.next, 1/2)");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new Expr.PredicateAccessPredicate(
                new Expr.PredicateAccess("P", ImmutableList.of()), X));
  }

  @Test
  public void equality() {
    assertThat(new Expr.LocalVar("x", Type.REF)).isEqualTo(X);
    assertThat(new Expr.LocalVar("x", Type.INT)).isNotEqualTo(X);
    assertThat(new Expr.LocalVar("x", Type.REF).hashCode()).isEqualTo(X.hashCode());
    assertThat(new Expr.FieldAccess(X, NEXT)).isEqualTo(new Expr.FieldAccess(X, NEXT));
    assertThat(new Expr.FieldAccess(X, NEXT)).isNotEqualTo(new Expr.FieldAccess(Y, NEXT));
    assertThat(new Expr.Binary(Expr.Op.EQ, X, Y)).isNotEqualTo(new Expr.Binary(Expr.Op.NE, X, Y));
    assertThat(Expr.PredicateAccessPredicate.full("P", X))
        .isNotEqualTo(Expr.PredicateAccessPredicate.full("Q", X));
    // Same rendering, different kinds.
    assertThat(new Expr.FuncApp("P", ImmutableList.of(X), Type.BOOL))
        .isNotEqualTo(new Expr.PredicateAccess("P", ImmutableList.of(X)));
  }

  @Test
  public void withChildren() {
    Expr access = new Expr.FieldAccess(X, NEXT);
    assertThat(access.children()).containsExactly(X);
    assertThat(access.withChildren(ImmutableList.of(Y))).isEqualTo(new Expr.FieldAccess(Y, NEXT));
    assertThat(X.withChildren(ImmutableList.of())).isSameInstanceAs(X);
    assertThrows(IllegalArgumentException.class, () -> access.withChildren(ImmutableList.of()));
  }

  @Test
  public void types() {
    assertThat(X.isVariable()).isTrue();
    assertThat(new Expr.FieldAccess(X, NEXT).isVariable()).isFalse();
    assertThat(new Expr.FieldAccess(X, VAL).type()).isEqualTo(Type.INT);
    assertThat(new Expr.Binary(Expr.Op.MUL, N, N).type()).isEqualTo(Type.INT);
    assertThat(new Expr.Binary(Expr.Op.LE, N, N).type()).isEqualTo(Type.BOOL);
    assertThrows(IllegalArgumentException.class, () -> new Expr.FieldAccess(N, NEXT));
  }
}
