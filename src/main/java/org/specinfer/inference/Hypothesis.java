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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.specinfer.ast.Expr;

/**
 * A Hypothesis is the learner's current guess at the structure of each inferred predicate, given as
 * a body expression over the predicate's formal parameters. Predicates that the hypothesis does not
 * mention are treated by {@link Inference} implementations however they see fit (typically as
 * {@code true}).
 */
public final class Hypothesis {
  public static final Hypothesis EMPTY = new Hypothesis(ImmutableMap.of());

  private final ImmutableMap<String, Expr> bodies;

  private Hypothesis(ImmutableMap<String, Expr> bodies) {
    this.bodies = bodies;
  }

  /** Returns a hypothesis with the given predicate bodies, keyed by predicate name. */
  public static Hypothesis of(Map<String, ? extends Expr> bodies) {
    return bodies.isEmpty() ? EMPTY : new Hypothesis(ImmutableMap.copyOf(bodies));
  }

  /** Returns the hypothesized body of the named predicate, or null if there is none. */
  public @Nullable Expr body(String predicateName) {
    return bodies.get(predicateName);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Hypothesis other && bodies.equals(other.bodies);
  }

  @Override
  public int hashCode() {
    return bodies.hashCode();
  }

  @Override
  public String toString() {
    return bodies.toString();
  }
}
