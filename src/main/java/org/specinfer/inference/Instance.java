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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.specinfer.ast.Expr;
import org.specinfer.ast.Nodes;

/**
 * An Instance is a {@link Specification} applied to concrete arguments. Arguments are always plain
 * variables; callers holding compound argument expressions must first assign them to temporaries.
 */
public final class Instance {
  public final Specification specification;
  public final ImmutableList<Expr.LocalVar> arguments;

  /** The specification's atoms with the arguments substituted for the parameters. */
  private final ImmutableList<Expr> actualAtoms;

  Instance(Specification specification, List<Expr.LocalVar> arguments) {
    Preconditions.checkArgument(
        arguments.size() == specification.parameters.size(),
        "%s expects %s arguments, got %s",
        specification.name,
        specification.parameters.size(),
        arguments.size());
    this.specification = specification;
    this.arguments = ImmutableList.copyOf(arguments);
    Map<Expr.LocalVar, Expr> substitution = new HashMap<>();
    for (int i = 0; i < arguments.size(); i++) {
      Expr.LocalVar parameter = specification.parameters.get(i);
      Expr.LocalVar argument = arguments.get(i);
      Preconditions.checkArgument(
          parameter.type() == argument.type(), "%s does not match %s", argument, parameter);
      substitution.put(parameter, argument);
    }
    this.actualAtoms =
        specification.atoms.stream()
            .map(atom -> Nodes.substitute(atom, substitution))
            .collect(ImmutableList.toImmutableList());
  }

  /** The name of the instantiated predicate. */
  public String name() {
    return specification.name;
  }

  /** The specification's atoms, over its formal parameters. */
  public ImmutableList<Expr> formalAtoms() {
    return specification.atoms;
  }

  /** The specification's atoms, over this instance's arguments, in the same order. */
  public ImmutableList<Expr> actualAtoms() {
    return actualAtoms;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Instance other
        && specification.equals(other.specification)
        && arguments.equals(other.arguments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(specification, arguments);
  }

  @Override
  public String toString() {
    return new Expr.PredicateAccess(name(), arguments).toString();
  }
}
