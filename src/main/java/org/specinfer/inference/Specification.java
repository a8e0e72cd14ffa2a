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
import java.util.List;
import java.util.Objects;
import org.specinfer.ast.Decl;
import org.specinfer.ast.Expr;
import org.specinfer.ast.Nodes;

/**
 * A Specification describes a predicate whose structure is being inferred: its name, its formal
 * parameters, and the atoms (expressions over the parameters) that its candidate bodies are built
 * from. The values of the atoms at each use of the predicate are what learning examples record.
 */
public final class Specification {
  public final String name;
  public final ImmutableList<Expr.LocalVar> parameters;
  public final ImmutableList<Expr> atoms;

  public Specification(String name, List<Expr.LocalVar> parameters, List<? extends Expr> atoms) {
    this.name = Preconditions.checkNotNull(name);
    this.parameters = ImmutableList.copyOf(parameters);
    this.atoms = ImmutableList.copyOf(atoms);
    for (Expr atom : this.atoms) {
      Preconditions.checkArgument(
          this.parameters.containsAll(Nodes.localVariables(atom)),
          "atom %s of %s refers to a non-parameter",
          atom,
          name);
    }
  }

  /** Returns the formal parameters as declarations. */
  public ImmutableList<Decl.LocalVarDecl> formals() {
    return parameters.stream().map(Decl.LocalVarDecl::of).collect(ImmutableList.toImmutableList());
  }

  /** Returns an instance of this specification applied to the given variables. */
  public Instance instance(List<Expr.LocalVar> arguments) {
    return new Instance(this, arguments);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Specification other
        && name.equals(other.name)
        && parameters.equals(other.parameters)
        && atoms.equals(other.atoms);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parameters, atoms);
  }

  @Override
  public String toString() {
    return name + parameters;
  }
}
