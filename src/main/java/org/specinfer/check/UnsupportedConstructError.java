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

import org.specinfer.ast.Stmt;

/**
 * Thrown when a check template contains a statement that cannot be instrumented. Currently the only
 * such statement is a method call: how its specification should be used is not decided here.
 */
public class UnsupportedConstructError extends CheckError {
  public final Stmt stmt;

  UnsupportedConstructError(String template, Stmt stmt) {
    super("Unsupported construct: " + stmt, template);
    this.stmt = stmt;
  }
}
