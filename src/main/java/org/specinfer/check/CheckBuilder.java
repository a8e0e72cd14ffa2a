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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.specinfer.ast.Decl;
import org.specinfer.ast.Expr;
import org.specinfer.ast.Nodes;
import org.specinfer.ast.Program;
import org.specinfer.ast.Stmt;
import org.specinfer.ast.Type;
import org.specinfer.inference.Hypothesis;
import org.specinfer.inference.Inference;
import org.specinfer.inference.Instance;
import org.specinfer.util.Namespace;

/**
 * A CheckBuilder turns check templates (statement sequences containing placeholder inhales and
 * exhales of inferred predicates) into a program that checks the current hypothesis, together with
 * a {@link Context} describing the states at which each specification was used.
 *
 * <p>Each placeholder {@code inhale acc(P(args))} becomes
 *
 * <pre>
 * inhale acc(P(args)); unfold acc(P(args)); s_x := x; ...; s_0 := atom0; ...; label s
 * </pre>
 *
 * <p>and each placeholder {@code exhale acc(P(args))} becomes
 *
 * <pre>
 * s_x := x; ...; s_0 := atom0; ...; label s; fold acc(P(args)); exhale acc(P(args))
 * </pre>
 *
 * <p>where {@code s} is a fresh label, the {@code s_*} variables save the values of the instance's
 * arguments and atoms, and {@code s} is recorded in the Context. Arguments that are not plain
 * variables are first assigned to fresh temporaries. Conditionals are instrumented branch by
 * branch; every other statement is copied unchanged, except method calls, which are rejected.
 *
 * <p>A CheckBuilder holds only immutable configuration. All state for a build (the namespace for
 * generated names and the context) is created by {@link #basicCheck} and discarded when it returns,
 * so a single CheckBuilder may be used for any number of builds, including concurrent ones.
 */
public final class CheckBuilder {

  /** The base names of generated procedures, temporaries, and state labels. */
  static final String CHECK_BASE = "check";

  static final String TEMPORARY_BASE = "t";
  static final String LABEL_BASE = "s";

  /** The result of a build: the check program and the context for its state labels. */
  public record Check(Program program, Context context) {}

  private final Inference inference;

  /** The program the checks were extracted from; its fields and predicates are carried over. */
  private final Program original;

  private final CheckOptions options;

  public CheckBuilder(Inference inference, Program original, CheckOptions options) {
    this.inference = Preconditions.checkNotNull(inference);
    this.original = Preconditions.checkNotNull(original);
    this.options = Preconditions.checkNotNull(options);
  }

  public CheckBuilder(Inference inference, Program original) {
    this(inference, original, CheckOptions.DEFAULT);
  }

  public CheckOptions options() {
    return options;
  }

  /**
   * Returns a program with one procedure per check template, instrumented against {@code
   * hypothesis}, and the context for its labels.
   *
   * @throws UnsupportedConstructError if a template contains a method call
   * @throws UnresolvedInstanceError if the inference has no instance for some placeholder
   */
  public Check basicCheck(List<Stmt.Seqn> checks, Hypothesis hypothesis) {
    Session session = new Session(checks);
    ImmutableList.Builder<Stmt.Seqn> instrumented = ImmutableList.builder();
    for (int i = 0; i < checks.size(); i++) {
      session.template = "check template " + i;
      instrumented.add(session.instrument(checks.get(i)));
    }
    session.template = null;
    Program program = session.buildProgram(instrumented.build(), hypothesis);
    if (options.verbose) {
      System.out.printf(
          "Built %s checks with %s state labels\n", checks.size(), session.context.labels().size());
      System.out.println(program);
    }
    return new Check(program, session.context);
  }

  /** The state of a single {@link #basicCheck} call. */
  private final class Session {
    final Namespace namespace = new Namespace();
    final Context context = new Context();

    /** Describes the template being instrumented, for error messages. */
    @Nullable String template;

    /**
     * Reserves every name that the check program may already use, so that generated names can't
     * capture them.
     */
    Session(List<Stmt.Seqn> checks) {
      for (Stmt.Seqn check : checks) {
        Nodes.localVariables(check).forEach(v -> namespace.reserve(v.name));
        Nodes.labels(check).forEach(namespace::reserve);
      }
      original.domains.forEach(d -> namespace.reserve(d.name));
      original.fields.forEach(f -> namespace.reserve(f.name));
      original.functions.forEach(f -> namespace.reserve(f.name));
      original.predicates.forEach(p -> namespace.reserve(p.name));
      original.methods.forEach(m -> namespace.reserve(m.name));
    }

    /**
     * Instruments each statement of {@code block} into a new Scope, and returns the resulting
     * sequence with the declarations of {@code block}. Generated variables are not declared here;
     * {@link #buildMethod} declares them once at the top of the procedure.
     */
    Stmt.Seqn instrument(Stmt.Seqn block) {
      Instrumenter instrumenter = new Instrumenter(new Scope());
      block.statements.forEach(s -> s.accept(instrumenter));
      return instrumenter.scope.close().withDeclarations(block.declarations);
    }

    Program buildProgram(ImmutableList<Stmt.Seqn> checks, Hypothesis hypothesis) {
      ImmutableList<Decl.Predicate> predicates =
          ImmutableList.<Decl.Predicate>builder()
              .addAll(original.predicates)
              .addAll(inference.predicates(hypothesis))
              .build();
      ImmutableList<Decl.Method> methods =
          checks.stream().map(this::buildMethod).collect(ImmutableList.toImmutableList());
      return new Program(
          ImmutableList.of(), original.fields, ImmutableList.of(), predicates, methods);
    }

    /**
     * Returns a parameterless procedure with a fresh name whose body is {@code check}, declaring
     * each local variable that {@code check} refers to, except those declared by a nested block.
     */
    Decl.Method buildMethod(Stmt.Seqn check) {
      String name = namespace.fresh(CHECK_BASE, 0);
      Set<String> nested = new HashSet<>();
      check.statements.forEach(s -> Nodes.declarations(s).forEach(d -> nested.add(d.name)));
      ImmutableList<Decl.LocalVarDecl> declarations =
          Nodes.localVariables(check).stream()
              .filter(v -> !nested.contains(v.name))
              .map(Decl.LocalVarDecl::of)
              .collect(ImmutableList.toImmutableList());
      return new Decl.Method(
          name,
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          check.withDeclarations(declarations));
    }

    /** Instruments statements into a single Scope. */
    private final class Instrumenter implements Stmt.Visitor<Void> {
      final Scope scope;

      Instrumenter(Scope scope) {
        this.scope = scope;
      }

      @Override
      public Void visitSeqn(Stmt.Seqn seqn) {
        scope.add(instrument(seqn));
        return null;
      }

      @Override
      public Void visitIf(Stmt.If ifStmt) {
        Stmt.Seqn thenBody = instrument(ifStmt.thenBody);
        Stmt.Seqn elseBody = instrument(ifStmt.elseBody);
        scope.add(new Stmt.If(ifStmt.condition, thenBody, elseBody));
        return null;
      }

      @Override
      public Void visitInhale(Stmt.Inhale inhale) {
        if (inhale.expr instanceof Expr.PredicateAccessPredicate predicate) {
          Instance instance = resolve(predicate);
          Expr.PredicateAccessPredicate adapted = adapt(predicate, instance);
          scope.add(new Stmt.Inhale(adapted));
          scope.add(new Stmt.Unfold(adapted));
          context.addInhaled(saveState(instance), instance);
        } else {
          scope.add(inhale);
        }
        return null;
      }

      @Override
      public Void visitExhale(Stmt.Exhale exhale) {
        if (exhale.expr instanceof Expr.PredicateAccessPredicate predicate) {
          Instance instance = resolve(predicate);
          Expr.PredicateAccessPredicate adapted = adapt(predicate, instance);
          // The state must be saved while the instance is still held.
          context.addExhaled(saveState(instance), instance);
          scope.add(new Stmt.Fold(adapted));
          scope.add(new Stmt.Exhale(adapted));
        } else {
          scope.add(exhale);
        }
        return null;
      }

      @Override
      public Void visitMethodCall(Stmt.MethodCall call) {
        throw new UnsupportedConstructError(template, call);
      }

      @Override
      public Void visitFold(Stmt.Fold fold) {
        scope.add(fold);
        return null;
      }

      @Override
      public Void visitUnfold(Stmt.Unfold unfold) {
        scope.add(unfold);
        return null;
      }

      @Override
      public Void visitLocalVarAssign(Stmt.LocalVarAssign assign) {
        scope.add(assign);
        return null;
      }

      @Override
      public Void visitFieldAssign(Stmt.FieldAssign assign) {
        scope.add(assign);
        return null;
      }

      @Override
      public Void visitLabel(Stmt.Label label) {
        scope.add(label);
        return null;
      }

      @Override
      public Void visitAssert(Stmt.Assert assertStmt) {
        scope.add(assertStmt);
        return null;
      }

      /**
       * Returns the specification instance for a predicate access. Each argument that is not a
       * plain variable is first assigned to a fresh temporary, which takes its place.
       */
      private Instance resolve(Expr.PredicateAccessPredicate predicate) {
        Expr.PredicateAccess access = predicate.access;
        ImmutableList.Builder<Expr.LocalVar> arguments = ImmutableList.builder();
        for (Expr argument : access.arguments) {
          if (argument instanceof Expr.LocalVar variable) {
            arguments.add(variable);
          } else {
            Expr.LocalVar temporary =
                new Expr.LocalVar(namespace.fresh(TEMPORARY_BASE, 0), argument.type());
            scope.add(new Stmt.LocalVarAssign(temporary, argument));
            arguments.add(temporary);
          }
        }
        Instance instance = inference.instance(access.predicateName, arguments.build());
        if (instance == null) {
          throw new UnresolvedInstanceError(template, access);
        }
        return instance;
      }

      /**
       * Rebuilds a predicate access with the instance's arguments, keeping the requested amount of
       * permission.
       */
      private Expr.PredicateAccessPredicate adapt(
          Expr.PredicateAccessPredicate predicate, Instance instance) {
        Expr.PredicateAccess access =
            new Expr.PredicateAccess(predicate.access.predicateName, instance.arguments);
        return new Expr.PredicateAccessPredicate(access, predicate.permission);
      }

      /**
       * Saves the values of the instance's arguments and atoms into variables named after a fresh
       * label, then marks the state with that label. Returns the label.
       */
      private String saveState(Instance instance) {
        // A repeated argument is saved once.
        ImmutableSet<Expr.LocalVar> arguments = ImmutableSet.copyOf(instance.arguments);
        ImmutableList<Expr> atoms = instance.actualAtoms();
        String label = namespace.fresh(LABEL_BASE, 0);
        while (!shadowsAvailable(label, arguments, atoms.size())) {
          label = namespace.fresh(LABEL_BASE, 0);
        }
        for (Expr.LocalVar argument : arguments) {
          saveValue(label + "_" + argument.name, argument);
        }
        for (int i = 0; i < atoms.size(); i++) {
          saveValue(label + "_" + i, atoms.get(i));
        }
        scope.add(new Stmt.Label(label));
        return label;
      }

      /** Returns true if none of the variables that {@link #saveState} would use are taken. */
      private boolean shadowsAvailable(
          String label, ImmutableSet<Expr.LocalVar> arguments, int numAtoms) {
        for (Expr.LocalVar argument : arguments) {
          if (namespace.contains(label + "_" + argument.name)) {
            return false;
          }
        }
        for (int i = 0; i < numAtoms; i++) {
          if (namespace.contains(label + "_" + i)) {
            return false;
          }
        }
        return true;
      }

      /** Saves the value of {@code value} in a new variable with the given name. */
      private void saveValue(String name, Expr value) {
        Preconditions.checkState(namespace.reserve(name), "%s is already in use", name);
        Expr.LocalVar variable = new Expr.LocalVar(name, value.type());
        if (options.useBranching && value.type() == Type.BOOL) {
          scope.add(
              new Stmt.If(
                  value,
                  Stmt.Seqn.of(new Stmt.LocalVarAssign(variable, Expr.BoolLit.TRUE)),
                  Stmt.Seqn.of(new Stmt.LocalVarAssign(variable, Expr.BoolLit.FALSE))));
        } else {
          scope.add(new Stmt.LocalVarAssign(variable, value));
        }
      }
    }
  }
}
