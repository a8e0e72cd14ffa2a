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

package org.specinfer.check;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.specinfer.ast.Expr;
import org.specinfer.ast.Type;
import org.specinfer.inference.Instance;
import org.specinfer.inference.Specification;

@RunWith(JUnit4.class)
public class ContextTest {

  private static final Expr.LocalVar X = new Expr.LocalVar("x", Type.REF);
  private static final Expr.LocalVar Y = new Expr.LocalVar("y", Type.REF);

  private static final Specification P =
      new Specification("P", ImmutableList.of(X), ImmutableList.of());

  @Test
  public void basics() {
    Context context = new Context();
    assertThat(context.isEmpty()).isTrue();
    Instance px = P.instance(ImmutableList.of(X));
    Instance py = P.instance(ImmutableList.of(Y));
    context.addExhaled("s_1", py);
    context.addInhaled("s_0", px);
    context.addExhaled("s_1", px);
    assertThat(context.size()).isEqualTo(3);
    assertThat(context.labels()).containsExactly("s_1", "s_0").inOrder();
    assertThat(context.instances("s_1", Context.Role.EXHALED)).containsExactly(py, px).inOrder();
    assertThat(context.instances("s_1", Context.Role.INHALED)).isEmpty();
    assertThat(context.entries("s_0")).containsExactly(new Context.Entry(px, Context.Role.INHALED));
    assertThat(context.entries("unknown")).isEmpty();
    assertThat(context.toString())
        .isEqualTo("{s_1=[EXHALED P(y), EXHALED P(x)], s_0=[INHALED P(x)]}");
  }
}
