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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * A complete verification program: domains, fields, functions, predicates, and methods, each in
 * declaration order. Programs are immutable.
 */
public final class Program {
  public final ImmutableList<Decl.Domain> domains;
  public final ImmutableList<Decl.Field> fields;
  public final ImmutableList<Decl.Function> functions;
  public final ImmutableList<Decl.Predicate> predicates;
  public final ImmutableList<Decl.Method> methods;

  public Program(
      List<Decl.Domain> domains,
      List<Decl.Field> fields,
      List<Decl.Function> functions,
      List<Decl.Predicate> predicates,
      List<Decl.Method> methods) {
    this.domains = ImmutableList.copyOf(domains);
    this.fields = ImmutableList.copyOf(fields);
    this.functions = ImmutableList.copyOf(functions);
    this.predicates = ImmutableList.copyOf(predicates);
    this.methods = ImmutableList.copyOf(methods);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Program other
        && domains.equals(other.domains)
        && fields.equals(other.fields)
        && functions.equals(other.functions)
        && predicates.equals(other.predicates)
        && methods.equals(other.methods);
  }

  @Override
  public int hashCode() {
    return Objects.hash(domains, fields, functions, predicates, methods);
  }

  /** Returns the program in surface syntax; see {@link Printer}. */
  @Override
  public String toString() {
    return Printer.toString(this);
  }
}
