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

import com.google.common.base.Joiner;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Renders programs and statements in Viper-like surface syntax, two spaces per nesting level. The
 * output is deterministic, so it is also what tests compare against.
 */
public final class Printer implements Stmt.Visitor<Void> {

  private static final Joiner COMMA = Joiner.on(", ");

  private final StringBuilder sb = new StringBuilder();
  private int indent;

  private Printer() {}

  /** Returns the given program as text; each declaration is followed by a blank line. */
  public static String toString(Program program) {
    Printer printer = new Printer();
    program.domains.forEach(printer::printDomain);
    program.fields.forEach(printer::printField);
    program.functions.forEach(printer::printFunction);
    program.predicates.forEach(printer::printPredicate);
    program.methods.forEach(printer::printMethod);
    return printer.sb.toString();
  }

  /** Returns the given statement as text, without a trailing newline. */
  public static String toString(Stmt stmt) {
    Printer printer = new Printer();
    stmt.accept(printer);
    return printer.sb.toString().stripTrailing();
  }

  private void line(String text) {
    sb.append("  ".repeat(indent)).append(text).append('\n');
  }

  private static String formals(List<Decl.LocalVarDecl> formals) {
    return "(" + COMMA.join(formals) + ")";
  }

  private void printDomain(Decl.Domain domain) {
    line("domain " + domain.name + " {}");
    sb.append('\n');
  }

  private void printField(Decl.Field field) {
    line("field " + field);
    sb.append('\n');
  }

  private void printFunction(Decl.Function function) {
    printWithBody(
        "function " + function.name + formals(function.formals) + ": " + function.type,
        function.body);
  }

  private void printPredicate(Decl.Predicate predicate) {
    printWithBody("predicate " + predicate.name + formals(predicate.formals), predicate.body);
  }

  private void printWithBody(String header, @Nullable Expr body) {
    if (body == null) {
      line(header);
    } else {
      line(header + " {");
      indent++;
      line(body.toString());
      indent--;
      line("}");
    }
    sb.append('\n');
  }

  private void printMethod(Decl.Method method) {
    String header = "method " + method.name + formals(method.formals);
    if (!method.returns.isEmpty()) {
      header += " returns " + formals(method.returns);
    }
    line(header);
    indent++;
    method.preconditions.forEach(e -> line("requires " + e));
    method.postconditions.forEach(e -> line("ensures " + e));
    indent--;
    if (method.body != null) {
      line("{");
      indent++;
      printContents(method.body);
      indent--;
      line("}");
    }
    sb.append('\n');
  }

  /** Prints the declarations and statements of a sequence at the current indentation. */
  private void printContents(Stmt.Seqn seqn) {
    seqn.declarations.forEach(d -> line("var " + d));
    seqn.statements.forEach(s -> s.accept(this));
  }

  @Override
  public Void visitSeqn(Stmt.Seqn seqn) {
    line("{");
    indent++;
    printContents(seqn);
    indent--;
    line("}");
    return null;
  }

  @Override
  public Void visitIf(Stmt.If ifStmt) {
    line("if (" + ifStmt.condition + ") {");
    indent++;
    printContents(ifStmt.thenBody);
    indent--;
    if (!ifStmt.elseBody.statements.isEmpty() || !ifStmt.elseBody.declarations.isEmpty()) {
      line("} else {");
      indent++;
      printContents(ifStmt.elseBody);
      indent--;
    }
    line("}");
    return null;
  }

  @Override
  public Void visitInhale(Stmt.Inhale inhale) {
    line("inhale " + inhale.expr);
    return null;
  }

  @Override
  public Void visitExhale(Stmt.Exhale exhale) {
    line("exhale " + exhale.expr);
    return null;
  }

  @Override
  public Void visitFold(Stmt.Fold fold) {
    line("fold " + fold.predicate);
    return null;
  }

  @Override
  public Void visitUnfold(Stmt.Unfold unfold) {
    line("unfold " + unfold.predicate);
    return null;
  }

  @Override
  public Void visitMethodCall(Stmt.MethodCall call) {
    String invocation = call.methodName + "(" + COMMA.join(call.arguments) + ")";
    line(call.targets.isEmpty() ? invocation : COMMA.join(call.targets) + " := " + invocation);
    return null;
  }

  @Override
  public Void visitLocalVarAssign(Stmt.LocalVarAssign assign) {
    line(assign.target + " := " + assign.value);
    return null;
  }

  @Override
  public Void visitFieldAssign(Stmt.FieldAssign assign) {
    line(assign.target + " := " + assign.value);
    return null;
  }

  @Override
  public Void visitLabel(Stmt.Label label) {
    line("label " + label.name);
    return null;
  }

  @Override
  public Void visitAssert(Stmt.Assert assertStmt) {
    line("assert " + assertStmt.expr);
    return null;
  }
}
