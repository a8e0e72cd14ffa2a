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

import org.specinfer.ast.Expr;

/** Thrown when the inference cannot provide a specification instance for a predicate access. */
public class UnresolvedInstanceError extends CheckError {
  public final Expr.PredicateAccess access;

  UnresolvedInstanceError(String template, Expr.PredicateAccess access) {
    super("No specification instance for " + access, template);
    this.access = access;
  }
}
