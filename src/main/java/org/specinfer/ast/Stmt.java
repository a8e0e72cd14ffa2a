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

/**
 * A Stmt is a statement of a verification program. Statements are immutable and compared by value.
 *
 * <p>The set of statement kinds is closed: each kind has a method in {@link Visitor}, and since
 * Visitor has no default methods, adding a kind forces every visitor to decide how to handle it.
 */
public abstract class Stmt {

  /** Calls the method of {@code visitor} corresponding to this statement's kind. */
  public abstract <T> T accept(Visitor<T> visitor);

  /** Returns the expressions directly contained in this statement, in evaluation order. */
  public abstract ImmutableList<Expr> expressions();

  /** Returns the statements nested directly inside this one. */
  public ImmutableList<Stmt> substatements() {
    return ImmutableList.of();
  }

  /** Returns whatever else distinguishes this statement from others of the same kind. */
  Object attribute() {
    return "";
  }

  @Override
  public final boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    Stmt other = (Stmt) obj;
    return attribute().equals(other.attribute())
        && expressions().equals(other.expressions())
        && substatements().equals(other.substatements());
  }

  @Override
  public final int hashCode() {
    return Objects.hash(getClass(), attribute(), expressions(), substatements());
  }

  @Override
  public String toString() {
    return Printer.toString(this);
  }

  /** One method for each kind of statement. */
  public interface Visitor<T> {
    T visitSeqn(Seqn seqn);

    T visitIf(If ifStmt);

    T visitInhale(Inhale inhale);

    T visitExhale(Exhale exhale);

    T visitFold(Fold fold);

    T visitUnfold(Unfold unfold);

    T visitMethodCall(MethodCall call);

    T visitLocalVarAssign(LocalVarAssign assign);

    T visitFieldAssign(FieldAssign assign);

    T visitLabel(Label label);

    T visitAssert(Assert assertStmt);
  }

  /** A sequence of statements, optionally with declarations of the locals it uses. */
  public static final class Seqn extends Stmt {
    public static final Seqn EMPTY = new Seqn(ImmutableList.of(), ImmutableList.of());

    public final ImmutableList<Stmt> statements;
    public final ImmutableList<Decl.LocalVarDecl> declarations;

    public Seqn(List<? extends Stmt> statements, List<Decl.LocalVarDecl> declarations) {
      this.statements = ImmutableList.copyOf(statements);
      this.declarations = ImmutableList.copyOf(declarations);
    }

    /** Returns a sequence of the given statements with no declarations. */
    public static Seqn of(List<? extends Stmt> statements) {
      return new Seqn(statements, ImmutableList.of());
    }

    /** Returns a sequence of the given statements with no declarations. */
    public static Seqn of(Stmt... statements) {
      return of(ImmutableList.copyOf(statements));
    }

    /** Returns a sequence with the same statements as this one and the given declarations. */
    public Seqn withDeclarations(List<Decl.LocalVarDecl> declarations) {
      return new Seqn(statements, declarations);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSeqn(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of();
    }

    @Override
    public ImmutableList<Stmt> substatements() {
      return statements;
    }

    @Override
    Object attribute() {
      return declarations;
    }
  }

  /** A conditional {@code if (condition) { ... } else { ... }}. */
  public static final class If extends Stmt {
    public final Expr condition;
    public final Seqn thenBody;
    public final Seqn elseBody;

    public If(Expr condition, Seqn thenBody, Seqn elseBody) {
      Preconditions.checkArgument(condition.type() == Type.BOOL, "not a condition: %s", condition);
      this.condition = condition;
      this.thenBody = thenBody;
      this.elseBody = elseBody;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(condition);
    }

    @Override
    public ImmutableList<Stmt> substatements() {
      return ImmutableList.of(thenBody, elseBody);
    }
  }

  /**
   * Assumes an assertion, obtaining any permissions it describes. An inhale of a {@link
   * Expr.PredicateAccessPredicate} is a placeholder for granting a specification.
   */
  public static final class Inhale extends Stmt {
    public final Expr expr;

    public Inhale(Expr expr) {
      this.expr = expr;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitInhale(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(expr);
    }
  }

  /**
   * Checks an assertion and gives up any permissions it describes. An exhale of a {@link
   * Expr.PredicateAccessPredicate} is a placeholder for discharging a specification.
   */
  public static final class Exhale extends Stmt {
    public final Expr expr;

    public Exhale(Expr expr) {
      this.expr = expr;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitExhale(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(expr);
    }
  }

  /** Exchanges the contents of a predicate body for the predicate instance. */
  public static final class Fold extends Stmt {
    public final Expr.PredicateAccessPredicate predicate;

    public Fold(Expr.PredicateAccessPredicate predicate) {
      this.predicate = predicate;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFold(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(predicate);
    }
  }

  /** Exchanges a predicate instance for the contents of its body. */
  public static final class Unfold extends Stmt {
    public final Expr.PredicateAccessPredicate predicate;

    public Unfold(Expr.PredicateAccessPredicate predicate) {
      this.predicate = predicate;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnfold(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(predicate);
    }
  }

  /** A call {@code targets := name(arguments)}. */
  public static final class MethodCall extends Stmt {
    public final String methodName;
    public final ImmutableList<Expr> arguments;
    public final ImmutableList<Expr.LocalVar> targets;

    public MethodCall(
        String methodName, List<? extends Expr> arguments, List<Expr.LocalVar> targets) {
      this.methodName = methodName;
      this.arguments = ImmutableList.copyOf(arguments);
      this.targets = ImmutableList.copyOf(targets);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMethodCall(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.<Expr>builder().addAll(arguments).addAll(targets).build();
    }

    @Override
    Object attribute() {
      return ImmutableList.of(methodName, targets.size());
    }
  }

  /** An assignment to a local variable. */
  public static final class LocalVarAssign extends Stmt {
    public final Expr.LocalVar target;
    public final Expr value;

    public LocalVarAssign(Expr.LocalVar target, Expr value) {
      Preconditions.checkArgument(
          target.type() == value.type(), "cannot assign %s to %s", value, target);
      this.target = target;
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLocalVarAssign(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(target, value);
    }
  }

  /** An assignment to a field location. */
  public static final class FieldAssign extends Stmt {
    public final Expr.FieldAccess target;
    public final Expr value;

    public FieldAssign(Expr.FieldAccess target, Expr value) {
      Preconditions.checkArgument(
          target.type() == value.type(), "cannot assign %s to %s", value, target);
      this.target = target;
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFieldAssign(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(target, value);
    }
  }

  /** Marks a program point with a name that later assertions (and models) can refer to. */
  public static final class Label extends Stmt {
    public final String name;

    public Label(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLabel(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of();
    }

    @Override
    Object attribute() {
      return name;
    }
  }

  /** Checks an assertion without consuming permissions. */
  public static final class Assert extends Stmt {
    public final Expr expr;

    public Assert(Expr expr) {
      this.expr = expr;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssert(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(expr);
    }
  }
}
