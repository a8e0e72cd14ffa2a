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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import org.specinfer.ast.Stmt;

/**
 * A Scope collects the instrumented statements for one block: a whole check, or one branch of a
 * conditional. Each block is instrumented with its own Scope, which is closed exactly once to
 * produce the resulting sequence; nothing may be added after that.
 */
final class Scope {

  private final List<Stmt> statements = new ArrayList<>();

  private boolean closed;

  /** Appends a statement to this scope. */
  void add(Stmt stmt) {
    Preconditions.checkState(!closed, "Adding %s to a closed scope", stmt);
    statements.add(stmt);
  }

  /** Closes this scope and returns its statements as a sequence without declarations. */
  Stmt.Seqn close() {
    Preconditions.checkState(!closed, "Scope closed twice");
    closed = true;
    return Stmt.Seqn.of(statements);
  }
}
