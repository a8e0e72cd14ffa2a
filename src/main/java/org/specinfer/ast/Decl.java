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

package org.specinfer.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The Decl class is just a namespace for the top-level (and local variable) declarations that make
 * up a {@link Program}. All declarations are immutable and compared by value.
 */
public class Decl {

  // Just a namespace for the contained classes.
  private Decl() {}

  /** A field {@code field name: type}. */
  public static final class Field {
    public final String name;
    public final Type type;

    public Field(String name, Type type) {
      this.name = Preconditions.checkNotNull(name);
      this.type = Preconditions.checkNotNull(type);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Field other && name.equals(other.name) && type == other.type;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, type);
    }

    @Override
    public String toString() {
      return name + ": " + type;
    }
  }

  /** A local variable (or formal parameter) declaration. */
  public static final class LocalVarDecl {
    public final String name;
    public final Type type;

    public LocalVarDecl(String name, Type type) {
      this.name = Preconditions.checkNotNull(name);
      this.type = Preconditions.checkNotNull(type);
    }

    /** Returns a declaration for the given variable. */
    public static LocalVarDecl of(Expr.LocalVar variable) {
      return new LocalVarDecl(variable.name, variable.type());
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof LocalVarDecl other && name.equals(other.name) && type == other.type;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, type);
    }

    @Override
    public String toString() {
      return name + ": " + type;
    }
  }

  /**
   * A predicate declaration. The body is null for abstract predicates, including the placeholder
   * declarations of predicates whose structure is still being inferred.
   */
  public static final class Predicate {
    public final String name;
    public final ImmutableList<LocalVarDecl> formals;
    public final @Nullable Expr body;

    public Predicate(String name, List<LocalVarDecl> formals, @Nullable Expr body) {
      this.name = Preconditions.checkNotNull(name);
      this.formals = ImmutableList.copyOf(formals);
      this.body = body;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Predicate other
          && name.equals(other.name)
          && formals.equals(other.formals)
          && Objects.equals(body, other.body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, formals, body);
    }

    @Override
    public String toString() {
      return name + formals;
    }
  }

  /** A heap-dependent function declaration; the body is null for abstract functions. */
  public static final class Function {
    public final String name;
    public final ImmutableList<LocalVarDecl> formals;
    public final Type type;
    public final @Nullable Expr body;

    public Function(String name, List<LocalVarDecl> formals, Type type, @Nullable Expr body) {
      this.name = Preconditions.checkNotNull(name);
      this.formals = ImmutableList.copyOf(formals);
      this.type = type;
      this.body = body;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Function other
          && name.equals(other.name)
          && formals.equals(other.formals)
          && type == other.type
          && Objects.equals(body, other.body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, formals, type, body);
    }

    @Override
    public String toString() {
      return name + formals + ": " + type;
    }
  }

  /**
   * A domain declaration. Only the name is modeled; check programs never declare domains, so this
   * exists to keep the shape of a program complete.
   */
  public static final class Domain {
    public final String name;

    public Domain(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Domain other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A method (procedure) declaration; the body is null for abstract methods. */
  public static final class Method {
    public final String name;
    public final ImmutableList<LocalVarDecl> formals;
    public final ImmutableList<LocalVarDecl> returns;
    public final ImmutableList<Expr> preconditions;
    public final ImmutableList<Expr> postconditions;
    public final Stmt.@Nullable Seqn body;

    public Method(
        String name,
        List<LocalVarDecl> formals,
        List<LocalVarDecl> returns,
        List<? extends Expr> preconditions,
        List<? extends Expr> postconditions,
        Stmt.@Nullable Seqn body) {
      this.name = Preconditions.checkNotNull(name);
      this.formals = ImmutableList.copyOf(formals);
      this.returns = ImmutableList.copyOf(returns);
      this.preconditions = ImmutableList.copyOf(preconditions);
      this.postconditions = ImmutableList.copyOf(postconditions);
      this.body = body;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Method other
          && name.equals(other.name)
          && formals.equals(other.formals)
          && returns.equals(other.returns)
          && preconditions.equals(other.preconditions)
          && postconditions.equals(other.postconditions)
          && Objects.equals(body, other.body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, formals, returns, preconditions, postconditions, body);
    }

    @Override
    public String toString() {
      return name + formals;
    }
  }
}
