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

package org.specinfer.inference;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.specinfer.ast.Decl;
import org.specinfer.ast.Expr;
import org.specinfer.ast.Type;

@RunWith(JUnit4.class)
public class InstanceTest {

  private static final Decl.Field NEXT = new Decl.Field("next", Type.REF);

  private static final Expr.LocalVar A = new Expr.LocalVar("a", Type.REF);
  private static final Expr.LocalVar B = new Expr.LocalVar("b", Type.REF);
  private static final Expr.LocalVar X = new Expr.LocalVar("x", Type.REF);
  private static final Expr.LocalVar Y = new Expr.LocalVar("y", Type.REF);
  private static final Expr.LocalVar N = new Expr.LocalVar("n", Type.INT);

  /** {@code seg(a, b)} with atoms {@code a == b} and {@code a.next}. */
  private static final Specification SEG =
      new Specification(
          "seg",
          ImmutableList.of(A, B),
          ImmutableList.of(new Expr.Binary(Expr.Op.EQ, A, B), new Expr.FieldAccess(A, NEXT)));

  @Test
  public void actualAtoms() {
    Instance instance = SEG.instance(ImmutableList.of(X, Y));
    assertThat(instance.name()).isEqualTo("seg");
    assertThat(instance.arguments).containsExactly(X, Y).inOrder();
    assertThat(instance.formalAtoms()).isEqualTo(SEG.atoms);
    assertThat(instance.actualAtoms().stream().map(Object::toString))
        .containsExactly("x == y", "x.next")
        .inOrder();
    assertThat(instance.toString()).isEqualTo("seg(x, y)");
  }

  @Test
  public void argumentsMayCoincideWithParameters() {
    // Swapping the parameters must not substitute twice.
    Instance instance = SEG.instance(ImmutableList.of(B, A));
    assertThat(instance.actualAtoms().stream().map(Object::toString))
        .containsExactly("b == a", "b.next")
        .inOrder();
  }

  @Test
  public void repeatedArguments() {
    Instance instance = SEG.instance(ImmutableList.of(X, X));
    assertThat(instance.actualAtoms().get(0).toString()).isEqualTo("x == x");
  }

  @Test
  public void equality() {
    assertThat(SEG.instance(ImmutableList.of(X, Y)))
        .isEqualTo(SEG.instance(ImmutableList.of(X, Y)));
    assertThat(SEG.instance(ImmutableList.of(X, Y)))
        .isNotEqualTo(SEG.instance(ImmutableList.of(Y, X)));
  }

  @Test
  public void wrongArity() {
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> SEG.instance(ImmutableList.of(X)));
    assertThat(e).hasMessageThat().isEqualTo("seg expects 2 arguments, got 1");
  }

  @Test
  public void wrongType() {
    assertThrows(IllegalArgumentException.class, () -> SEG.instance(ImmutableList.of(X, N)));
  }

  @Test
  public void atomsMustUseParameters() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new Specification(
                "bad", ImmutableList.of(A), ImmutableList.of(new Expr.Binary(Expr.Op.EQ, A, X))));
  }

  @Test
  public void formals() {
    assertThat(SEG.formals())
        .containsExactly(new Decl.LocalVarDecl("a", Type.REF), new Decl.LocalVarDecl("b", Type.REF))
        .inOrder();
  }

  @Test
  public void hypothesis() {
    assertThat(Hypothesis.of(ImmutableMap.of())).isSameInstanceAs(Hypothesis.EMPTY);
    Hypothesis h = Hypothesis.of(ImmutableMap.of("seg", Expr.BoolLit.FALSE));
    assertThat(h.body("seg")).isEqualTo(Expr.BoolLit.FALSE);
    assertThat(h.body("other")).isNull();
    assertThat(h).isEqualTo(Hypothesis.of(ImmutableMap.of("seg", Expr.BoolLit.FALSE)));
  }
}
