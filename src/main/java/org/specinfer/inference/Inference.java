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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.specinfer.ast.Decl;
import org.specinfer.ast.Expr;

/**
 * The services that the surrounding inference provides to check building. Check building never
 * looks inside a {@link Hypothesis} itself; it only asks for the predicate declarations the
 * hypothesis implies and for specification instances.
 */
public interface Inference {

  /**
   * Returns declarations for the inferred predicates as shaped by {@code hypothesis}. These are
   * added to the check program after the original program's own predicates.
   */
  ImmutableList<Decl.Predicate> predicates(Hypothesis hypothesis);

  /**
   * Returns the instance of the named specification applied to the given variables, or null if
   * {@code name} does not name a specification known to this inference.
   */
  @Nullable Instance instance(String name, ImmutableList<Expr.LocalVar> arguments);
}
