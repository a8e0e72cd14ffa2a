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
import java.util.stream.Collectors;

/**
 * An Expr is an expression or assertion in a verification program. Exprs are immutable and are
 * compared by value: two Exprs are equal if they are instances of the same class with equal types,
 * equal {@link #attribute}s, and equal children.
 *
 * <p>Every Expr exposes its direct subexpressions through {@link #children} and can be rebuilt
 * with different children through {@link #withChildren}; this is all that {@link Nodes} needs to
 * traverse or rewrite an expression tree without knowing each variant.
 */
public abstract class Expr {

  /** This expression's type. */
  public abstract Type type();

  /** Returns the direct subexpressions of this expression, in evaluation order. */
  public abstract ImmutableList<Expr> children();

  /**
   * Returns an expression of the same kind as this one but with the given children, which must
   * correspond one-to-one with {@link #children}.
   */
  public abstract Expr withChildren(ImmutableList<Expr> children);

  /**
   * Returns whatever distinguishes this expression from others of the same class that have the same
   * type and children (a variable's name, a literal's value, an operator, ...).
   */
  abstract Object attribute();

  /** Returns true if this is a plain variable reference. */
  public final boolean isVariable() {
    return this instanceof LocalVar;
  }

  @Override
  public final boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    Expr other = (Expr) obj;
    return type() == other.type()
        && attribute().equals(other.attribute())
        && children().equals(other.children());
  }

  @Override
  public final int hashCode() {
    return Objects.hash(getClass(), type(), attribute(), children());
  }

  /** Renders a comma-separated argument list. */
  static String join(List<? extends Expr> exprs) {
    return exprs.stream().map(Object::toString).collect(Collectors.joining(", "));
  }

  /** Renders {@code expr}, parenthesized if it is an operator application. */
  static String operand(Expr expr) {
    return (expr instanceof Binary) ? "(" + expr + ")" : expr.toString();
  }

  /** Base class for expressions without subexpressions. */
  abstract static class Leaf extends Expr {
    @Override
    public final ImmutableList<Expr> children() {
      return ImmutableList.of();
    }

    @Override
    public final Expr withChildren(ImmutableList<Expr> children) {
      Preconditions.checkArgument(children.isEmpty());
      return this;
    }
  }

  /** A reference to a local variable (or parameter) with the given name and type. */
  public static final class LocalVar extends Leaf {
    public final String name;
    private final Type type;

    public LocalVar(String name, Type type) {
      this.name = Preconditions.checkNotNull(name);
      this.type = Preconditions.checkNotNull(type);
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    Object attribute() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A boolean literal. */
  public static final class BoolLit extends Leaf {
    public static final BoolLit TRUE = new BoolLit(true);
    public static final BoolLit FALSE = new BoolLit(false);

    public final boolean value;

    private BoolLit(boolean value) {
      this.value = value;
    }

    public static BoolLit of(boolean value) {
      return value ? TRUE : FALSE;
    }

    @Override
    public Type type() {
      return Type.BOOL;
    }

    @Override
    Object attribute() {
      return value;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** An integer literal. */
  public static final class IntLit extends Leaf {
    public final long value;

    public IntLit(long value) {
      this.value = value;
    }

    @Override
    public Type type() {
      return Type.INT;
    }

    @Override
    Object attribute() {
      return value;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** The null reference. */
  public static final class NullLit extends Leaf {
    public static final NullLit NULL = new NullLit();

    private NullLit() {}

    @Override
    public Type type() {
      return Type.REF;
    }

    @Override
    Object attribute() {
      return "null";
    }

    @Override
    public String toString() {
      return "null";
    }
  }

  /** A permission amount: write (full), none, wildcard, or a fraction. */
  public static final class PermLit extends Leaf {
    public static final PermLit FULL = new PermLit(1, 1, false);
    public static final PermLit NONE = new PermLit(0, 1, false);
    public static final PermLit WILDCARD = new PermLit(0, 0, true);

    public final int numerator;
    public final int denominator;
    public final boolean isWildcard;

    private PermLit(int numerator, int denominator, boolean isWildcard) {
      this.numerator = numerator;
      this.denominator = denominator;
      this.isWildcard = isWildcard;
    }

    /** Returns the permission amount {@code numerator/denominator}. */
    public static PermLit fraction(int numerator, int denominator) {
      Preconditions.checkArgument(numerator >= 0 && denominator > 0);
      if (numerator == 0) {
        return NONE;
      } else if (numerator == denominator) {
        return FULL;
      }
      return new PermLit(numerator, denominator, false);
    }

    @Override
    public Type type() {
      return Type.PERM;
    }

    @Override
    Object attribute() {
      return toString();
    }

    @Override
    public String toString() {
      if (isWildcard) {
        return "wildcard";
      } else if (numerator == 0) {
        return "none";
      } else if (numerator == denominator) {
        return "write";
      }
      return numerator + "/" + denominator;
    }
  }

  /** A read of a field of a reference. */
  public static final class FieldAccess extends Expr {
    public final Expr receiver;
    public final Decl.Field field;

    public FieldAccess(Expr receiver, Decl.Field field) {
      Preconditions.checkArgument(
          receiver.type() == Type.REF, "receiver must be a Ref: %s", receiver);
      this.receiver = receiver;
      this.field = field;
    }

    @Override
    public Type type() {
      return field.type;
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(receiver);
    }

    @Override
    public Expr withChildren(ImmutableList<Expr> children) {
      Preconditions.checkArgument(children.size() == 1);
      return new FieldAccess(children.get(0), field);
    }

    @Override
    Object attribute() {
      return field;
    }

    @Override
    public String toString() {
      return operand(receiver) + "." + field.name;
    }
  }

  /** An application of a (program or domain) function. */
  public static final class FuncApp extends Expr {
    public final String name;
    public final ImmutableList<Expr> arguments;
    private final Type type;

    public FuncApp(String name, List<? extends Expr> arguments, Type type) {
      this.name = name;
      this.arguments = ImmutableList.copyOf(arguments);
      this.type = type;
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public ImmutableList<Expr> children() {
      return arguments;
    }

    @Override
    public Expr withChildren(ImmutableList<Expr> children) {
      Preconditions.checkArgument(children.size() == arguments.size());
      return new FuncApp(name, children, type);
    }

    @Override
    Object attribute() {
      return name;
    }

    @Override
    public String toString() {
      return name + "(" + join(arguments) + ")";
    }
  }

  /** The binary operators. */
  public enum Op {
    EQ("==", true),
    NE("!=", true),
    LT("<", true),
    LE("<=", true),
    GT(">", true),
    GE(">=", true),
    AND("&&", true),
    OR("||", true),
    IMPLIES("==>", true),
    ADD("+", false),
    SUB("-", false),
    MUL("*", false);

    final String symbol;

    /** True if the result of this operator is a Bool regardless of the operand types. */
    final boolean isBoolean;

    Op(String symbol, boolean isBoolean) {
      this.symbol = symbol;
      this.isBoolean = isBoolean;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  /** An application of a binary operator. */
  public static final class Binary extends Expr {
    public final Op op;
    public final Expr left;
    public final Expr right;

    public Binary(Op op, Expr left, Expr right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public Type type() {
      return op.isBoolean ? Type.BOOL : left.type();
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    public Expr withChildren(ImmutableList<Expr> children) {
      Preconditions.checkArgument(children.size() == 2);
      return new Binary(op, children.get(0), children.get(1));
    }

    @Override
    Object attribute() {
      return op;
    }

    @Override
    public String toString() {
      return operand(left) + " " + op + " " + operand(right);
    }
  }

  /** Boolean negation. */
  public static final class Not extends Expr {
    public final Expr operand;

    public Not(Expr operand) {
      this.operand = operand;
    }

    @Override
    public Type type() {
      return Type.BOOL;
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(operand);
    }

    @Override
    public Expr withChildren(ImmutableList<Expr> children) {
      Preconditions.checkArgument(children.size() == 1);
      return new Not(children.get(0));
    }

    @Override
    Object attribute() {
      return "!";
    }

    @Override
    public String toString() {
      return "!" + operand(operand);
    }
  }

  /** A predicate instance location {@code P(e1, ..., en)}. */
  public static final class PredicateAccess extends Expr {
    public final String predicateName;
    public final ImmutableList<Expr> arguments;

    public PredicateAccess(String predicateName, List<? extends Expr> arguments) {
      this.predicateName = predicateName;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public Type type() {
      return Type.BOOL;
    }

    @Override
    public ImmutableList<Expr> children() {
      return arguments;
    }

    @Override
    public Expr withChildren(ImmutableList<Expr> children) {
      Preconditions.checkArgument(children.size() == arguments.size());
      return new PredicateAccess(predicateName, children);
    }

    @Override
    Object attribute() {
      return predicateName;
    }

    @Override
    public String toString() {
      return predicateName + "(" + join(arguments) + ")";
    }
  }

  /** An assertion of some amount of permission to a predicate instance. */
  public static final class PredicateAccessPredicate extends Expr {
    public final PredicateAccess access;
    public final Expr permission;

    public PredicateAccessPredicate(PredicateAccess access, Expr permission) {
      Preconditions.checkArgument(permission.type() == Type.PERM);
      this.access = access;
      this.permission = permission;
    }

    /** Returns an assertion of full permission to the given predicate instance. */
    public static PredicateAccessPredicate full(String predicateName, Expr... arguments) {
      return new PredicateAccessPredicate(
          new PredicateAccess(predicateName, ImmutableList.copyOf(arguments)), PermLit.FULL);
    }

    @Override
    public Type type() {
      return Type.BOOL;
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(access, permission);
    }

    @Override
    public Expr withChildren(ImmutableList<Expr> children) {
      Preconditions.checkArgument(
          children.size() == 2 && children.get(0) instanceof PredicateAccess);
      return new PredicateAccessPredicate((PredicateAccess) children.get(0), children.get(1));
    }

    @Override
    Object attribute() {
      return "acc";
    }

    @Override
    public String toString() {
      return "acc(" + access + ", " + permission + ")";
    }
  }

  /** An assertion of some amount of permission to a field location. */
  public static final class FieldAccessPredicate extends Expr {
    public final FieldAccess access;
    public final Expr permission;

    public FieldAccessPredicate(FieldAccess access, Expr permission) {
      Preconditions.checkArgument(permission.type() == Type.PERM);
      this.access = access;
      this.permission = permission;
    }

    @Override
    public Type type() {
      return Type.BOOL;
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(access, permission);
    }

    @Override
    public Expr withChildren(ImmutableList<Expr> children) {
      Preconditions.checkArgument(children.size() == 2 && children.get(0) instanceof FieldAccess);
      return new FieldAccessPredicate((FieldAccess) children.get(0), children.get(1));
    }

    @Override
    Object attribute() {
      return "acc";
    }

    @Override
    public String toString() {
      return "acc(" + access + ", " + permission + ")";
    }
  }
}
