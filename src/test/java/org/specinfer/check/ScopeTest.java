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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.specinfer.ast.Stmt;

@RunWith(JUnit4.class)
public class ScopeTest {

  @Test
  public void closeReturnsStatementsInOrder() {
    Scope scope = new Scope();
    scope.add(new Stmt.Label("a"));
    scope.add(new Stmt.Label("b"));
    Stmt.Seqn seqn = scope.close();
    assertThat(seqn).isEqualTo(Stmt.Seqn.of(new Stmt.Label("a"), new Stmt.Label("b")));
    assertThat(seqn.declarations).isEmpty();
  }

  @Test
  public void closedScopeRejectsChanges() {
    Scope scope = new Scope();
    assertThat(scope.close()).isEqualTo(Stmt.Seqn.EMPTY);
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> scope.add(new Stmt.Label("late")));
    assertThat(e).hasMessageThat().isEqualTo("Adding label late to a closed scope");
    assertThrows(IllegalStateException.class, scope::close);
  }
}
