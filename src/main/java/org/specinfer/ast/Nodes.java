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
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** A static-only class with generic traversals of statement and expression trees. */
public class Nodes {

  private Nodes() {}

  /**
   * Returns the distinct local variables referenced anywhere in {@code stmt}, in order of first
   * occurrence. A statement's own expressions are visited before its substatements, and each
   * expression before its children.
   */
  public static ImmutableSet<Expr.LocalVar> localVariables(Stmt stmt) {
    Set<Expr.LocalVar> result = new LinkedHashSet<>();
    collect(stmt, result);
    return ImmutableSet.copyOf(result);
  }

  /**
   * Returns the distinct local variables referenced in {@code expr}, in order of first occurrence.
   */
  public static ImmutableSet<Expr.LocalVar> localVariables(Expr expr) {
    Set<Expr.LocalVar> result = new LinkedHashSet<>();
    collect(expr, result);
    return ImmutableSet.copyOf(result);
  }

  /** Returns the names of the labels anywhere in {@code stmt}, in order of occurrence. */
  public static ImmutableSet<String> labels(Stmt stmt) {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    collectLabels(stmt, result);
    return result.build();
  }

  /** Returns the local variable declarations of every sequence in {@code stmt}, in order. */
  public static ImmutableSet<Decl.LocalVarDecl> declarations(Stmt stmt) {
    ImmutableSet.Builder<Decl.LocalVarDecl> result = ImmutableSet.builder();
    collectDeclarations(stmt, result);
    return result.build();
  }

  private static void collectDeclarations(
      Stmt stmt, ImmutableSet.Builder<Decl.LocalVarDecl> result) {
    if (stmt instanceof Stmt.Seqn seqn) {
      result.addAll(seqn.declarations);
    }
    stmt.substatements().forEach(s -> collectDeclarations(s, result));
  }

  private static void collectLabels(Stmt stmt, ImmutableSet.Builder<String> result) {
    if (stmt instanceof Stmt.Label label) {
      result.add(label.name);
    }
    stmt.substatements().forEach(s -> collectLabels(s, result));
  }

  private static void collect(Stmt stmt, Set<Expr.LocalVar> result) {
    stmt.expressions().forEach(e -> collect(e, result));
    stmt.substatements().forEach(s -> collect(s, result));
  }

  private static void collect(Expr expr, Set<Expr.LocalVar> result) {
    if (expr instanceof Expr.LocalVar variable) {
      result.add(variable);
    }
    expr.children().forEach(e -> collect(e, result));
  }

  /**
   * Returns {@code expr} with each occurrence of a variable in {@code substitution} replaced by the
   * corresponding expression. Unchanged subtrees are shared with the original.
   */
  public static Expr substitute(Expr expr, Map<Expr.LocalVar, ? extends Expr> substitution) {
    if (expr instanceof Expr.LocalVar) {
      Expr replacement = substitution.get(expr);
      return (replacement == null) ? expr : replacement;
    }
    ImmutableList<Expr> children = expr.children();
    ImmutableList.Builder<Expr> newChildren =
        ImmutableList.builderWithExpectedSize(children.size());
    boolean changed = false;
    for (Expr child : children) {
      Expr newChild = substitute(child, substitution);
      changed |= (newChild != child);
      newChildren.add(newChild);
    }
    return changed ? expr.withChildren(newChildren.build()) : expr;
  }
}
