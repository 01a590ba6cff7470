// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.


package com.google.devtools.build.buildifier.format;

import com.google.common.collect.ImmutableList;
import com.google.devtools.build.buildifier.syntax.Argument;
import com.google.devtools.build.buildifier.syntax.AssignmentStatement;
import com.google.devtools.build.buildifier.syntax.BinaryOperatorExpression;
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.CallExpression;
import com.google.devtools.build.buildifier.syntax.Comment;
import com.google.devtools.build.buildifier.syntax.CommentBlock;
import com.google.devtools.build.buildifier.syntax.Comprehension;
import com.google.devtools.build.buildifier.syntax.ConditionalExpression;
import com.google.devtools.build.buildifier.syntax.DictExpression;
import com.google.devtools.build.buildifier.syntax.DotExpression;
import com.google.devtools.build.buildifier.syntax.Expression;
import com.google.devtools.build.buildifier.syntax.ExpressionStatement;
import com.google.devtools.build.buildifier.syntax.FloatLiteral;
import com.google.devtools.build.buildifier.syntax.Identifier;
import com.google.devtools.build.buildifier.syntax.IndexExpression;
import com.google.devtools.build.buildifier.syntax.IntLiteral;
import com.google.devtools.build.buildifier.syntax.ListExpression;
import com.google.devtools.build.buildifier.syntax.LoadStatement;
import com.google.devtools.build.buildifier.syntax.Node;
import com.google.devtools.build.buildifier.syntax.SliceExpression;
import com.google.devtools.build.buildifier.syntax.Statement;
import com.google.devtools.build.buildifier.syntax.StringLiteral;
import com.google.devtools.build.buildifier.syntax.TokenKind;
import com.google.devtools.build.buildifier.syntax.UnaryOperatorExpression;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * A Printer renders syntax trees as canonical text into a buffer.
 *
 * <p>Layout decisions are made top-down: before a container is printed, {@link #isMultiLine}
 * decides whether it gets one element per line. Parentheses are emitted only where the precedence
 * of an operand is lower than its context requires, since the tree does not record them.
 */
final class Printer {

  private static final String INDENT = "    ";

  // Context precedences. An operand is parenthesized if its precedence is below its context's.
  private static final int PREC_TUPLE = -2;
  private static final int PREC_CONDITIONAL = -1;
  private static final int PREC_OR = 0;
  private static final int PREC_NOT = 2;
  private static final int PREC_COMPARISON = 3;
  private static final int PREC_UNARY = 10;
  private static final int PREC_PRIMARY = 11;

  private final StringBuilder buffer = new StringBuilder();
  private int depth;

  @Override
  public String toString() {
    return buffer.toString();
  }

  @CanIgnoreReturnValue
  Printer append(char c) {
    buffer.append(c);
    return this;
  }

  @CanIgnoreReturnValue
  Printer append(CharSequence s) {
    buffer.append(s);
    return this;
  }

  private void newline() {
    buffer.append('\n');
  }

  private void indent() {
    for (int i = 0; i < depth; i++) {
      buffer.append(INDENT);
    }
  }

  // ==== Files and statements ====

  void printFile(BuildFile file) {
    Statement prev = null;
    for (Statement stmt : file.getStatements()) {
      if (prev != null
          && (stmt.hasBlankLineBefore() || isMultiLineRule(prev) || isMultiLineRule(stmt))) {
        newline();
      }
      printComments(stmt.getBeforeComments());
      printStatement(stmt);
      printSuffixComments(stmt);
      newline();
      prev = stmt;
    }
  }

  private void printStatement(Statement stmt) {
    switch (stmt.kind()) {
      case ASSIGNMENT -> {
        AssignmentStatement assign = (AssignmentStatement) stmt;
        expr(assign.getLHS(), PREC_TUPLE);
        append(' ');
        if (assign.isAugmented()) {
          append(assign.getOperator().toString());
        }
        append("= ");
        expr(assign.getRHS(), PREC_TUPLE);
      }
      case EXPRESSION -> {
        CallExpression rule = ruleCall(stmt);
        if (rule != null) {
          printCall(rule, /* isRule= */ true);
        } else {
          expr(((ExpressionStatement) stmt).getExpression(), PREC_TUPLE);
        }
      }
      case LOAD -> printLoad((LoadStatement) stmt);
      case COMMENT_BLOCK -> {
        // printFile ends the last line.
        List<Comment> comments = ((CommentBlock) stmt).getComments();
        for (int i = 0; i < comments.size(); i++) {
          if (i > 0) {
            newline();
          }
          append(comments.get(i).getText());
        }
      }
    }
  }

  private void printLoad(LoadStatement load) {
    ImmutableList<Node> elements =
        ImmutableList.<Node>builder().add(load.getImport()).addAll(load.getBindings()).build();
    append("load");
    printSequence(
        '(',
        elements,
        ')',
        isMultiLineLoad(load),
        /* singleTrailingComma= */ false,
        load.getAfterComments(),
        node -> {
          if (node instanceof LoadStatement.Binding binding) {
            if (binding.getLocal() != null) {
              append(binding.getLocal().getName()).append(" = ");
            }
            append(binding.getOriginal().getRaw());
          } else {
            append(((StringLiteral) node).getRaw());
          }
        });
  }

  // Returns the call of a top-level rule statement, such as cc_library(...), or null.
  @Nullable
  private static CallExpression ruleCall(Statement stmt) {
    if (stmt instanceof ExpressionStatement exprStmt
        && exprStmt.getExpression() instanceof CallExpression call
        && call.getFunction() instanceof Identifier) {
      return call;
    }
    return null;
  }

  private static boolean isMultiLineRule(Statement stmt) {
    CallExpression call = ruleCall(stmt);
    return call != null && isMultiLineCall(call, /* isRule= */ true);
  }

  // ==== Comments ====

  private void printComments(List<Comment> comments) {
    for (Comment comment : comments) {
      indent();
      append(comment.getText());
      newline();
    }
  }

  private void printSuffixComments(Node node) {
    for (Comment comment : node.getSuffixComments()) {
      append("  ").append(comment.getText());
    }
  }

  // ==== Expressions ====

  private void expr(Expression e, int context) {
    expr(e, context, /* isAttrValue= */ false);
  }

  /**
   * Prints an expression.
   *
   * @param context the lowest precedence that may appear here without parentheses
   * @param isAttrValue whether the expression is the value of a rule attribute, or a {@code +}
   *     operand of one; such lists and dicts print one element per line
   */
  private void expr(Expression e, int context, boolean isAttrValue) {
    if (e instanceof ListExpression list && list.isTuple()) {
      printTuple(list, context);
      return;
    }
    boolean parens = precedence(e) < context;
    if (parens) {
      append('(');
    }
    switch (e.kind()) {
      case IDENTIFIER -> append(((Identifier) e).getName());
      case STRING_LITERAL -> append(((StringLiteral) e).getRaw());
      case INT_LITERAL -> append(((IntLiteral) e).getRaw());
      case FLOAT_LITERAL -> append(((FloatLiteral) e).getRaw());
      case LIST_EXPR -> {
        ListExpression list = (ListExpression) e;
        printSequence(
            '[',
            list.getElements(),
            ']',
            isMultiLineList(list, isAttrValue),
            /* singleTrailingComma= */ false,
            list.getAfterComments(),
            elem -> expr(elem, PREC_CONDITIONAL));
      }
      case DICT_EXPR -> {
        DictExpression dict = (DictExpression) e;
        printSequence(
            '{',
            dict.getEntries(),
            '}',
            isMultiLineDict(dict, isAttrValue),
            /* singleTrailingComma= */ false,
            dict.getAfterComments(),
            this::printEntry);
      }
      case CALL -> printCall((CallExpression) e, /* isRule= */ false);
      case COMPREHENSION -> printComprehension((Comprehension) e);
      case BINARY_OPERATOR -> {
        BinaryOperatorExpression binop = (BinaryOperatorExpression) e;
        int prec = binaryPrecedence(binop.getOperator());
        boolean attrOperands = isAttrValue && binop.getOperator() == TokenKind.PLUS;
        // Comparisons are not associative, so neither operand may be another comparison.
        expr(binop.getX(), prec == PREC_COMPARISON ? prec + 1 : prec, attrOperands);
        append(' ').append(binop.getOperator().toString()).append(' ');
        expr(binop.getY(), prec + 1, attrOperands);
      }
      case UNARY_OPERATOR -> {
        UnaryOperatorExpression unop = (UnaryOperatorExpression) e;
        if (unop.getOperator() == TokenKind.NOT) {
          append("not ");
          expr(unop.getX(), PREC_NOT);
        } else {
          append(unop.getOperator().toString());
          expr(unop.getX(), PREC_UNARY);
        }
      }
      case DOT -> {
        DotExpression dot = (DotExpression) e;
        expr(dot.getObject(), PREC_PRIMARY);
        append('.').append(dot.getField().getName());
      }
      case INDEX -> {
        IndexExpression index = (IndexExpression) e;
        expr(index.getObject(), PREC_PRIMARY);
        append('[');
        expr(index.getKey(), PREC_TUPLE);
        append(']');
      }
      case SLICE -> {
        SliceExpression slice = (SliceExpression) e;
        expr(slice.getObject(), PREC_PRIMARY);
        append('[');
        if (slice.getStart() != null) {
          expr(slice.getStart(), PREC_CONDITIONAL);
        }
        append(':');
        if (slice.getStop() != null) {
          expr(slice.getStop(), PREC_CONDITIONAL);
        }
        if (slice.getStep() != null) {
          append(':');
          expr(slice.getStep(), PREC_CONDITIONAL);
        }
        append(']');
      }
      case CONDITIONAL -> {
        ConditionalExpression cond = (ConditionalExpression) e;
        expr(cond.getThenCase(), PREC_OR);
        append(" if ");
        expr(cond.getCondition(), PREC_OR);
        append(" else ");
        expr(cond.getElseCase(), PREC_CONDITIONAL);
      }
    }
    if (parens) {
      append(')');
    }
  }

  private void printTuple(ListExpression tuple, int context) {
    boolean multiLine = isMultiLineList(tuple, /* isAttrValue= */ false);
    List<Expression> elems = tuple.getElements();
    if (tuple.hasParens() || context > PREC_TUPLE || elems.size() == 1 || multiLine) {
      printSequence(
          '(',
          elems,
          ')',
          multiLine,
          /* singleTrailingComma= */ true,
          tuple.getAfterComments(),
          elem -> expr(elem, PREC_CONDITIONAL));
      return;
    }
    for (int i = 0; i < elems.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      expr(elems.get(i), PREC_CONDITIONAL);
    }
  }

  private void printCall(CallExpression call, boolean isRule) {
    expr(call.getFunction(), PREC_PRIMARY);
    if (isCompactCall(call)) {
      append('(');
      printArgument(call.getArguments().get(0), isRule);
      append(')');
      return;
    }
    printSequence(
        '(',
        call.getArguments(),
        ')',
        isMultiLineCall(call, isRule),
        /* singleTrailingComma= */ false,
        call.getAfterComments(),
        arg -> printArgument(arg, isRule));
  }

  private void printArgument(Argument arg, boolean isRuleAttr) {
    if (arg instanceof Argument.Keyword) {
      append(arg.getName()).append(" = ");
      expr(arg.getValue(), PREC_CONDITIONAL, isRuleAttr);
      return;
    }
    if (arg instanceof Argument.Star) {
      append('*');
    } else if (arg instanceof Argument.StarStar) {
      append("**");
    }
    expr(arg.getValue(), PREC_CONDITIONAL);
  }

  private void printEntry(DictExpression.Entry entry) {
    expr(entry.getKey(), PREC_CONDITIONAL);
    append(": ");
    expr(entry.getValue(), PREC_CONDITIONAL);
  }

  private void printComprehension(Comprehension comp) {
    boolean multiLine = isMultiLineComprehension(comp);
    append(comp.isDict() ? '{' : '[');
    if (multiLine) {
      depth++;
      newline();
      printComprehensionPart(comp.getBody(), true);
      for (Comprehension.Clause clause : comp.getClauses()) {
        printComprehensionPart(clause, true);
      }
      printComments(comp.getAfterComments());
      depth--;
      indent();
    } else {
      printComprehensionPart(comp.getBody(), false);
      for (Comprehension.Clause clause : comp.getClauses()) {
        append(' ');
        printComprehensionPart(clause, false);
      }
    }
    append(comp.isDict() ? '}' : ']');
  }

  private void printComprehensionPart(Node part, boolean ownLine) {
    if (ownLine) {
      printComments(part.getBeforeComments());
      indent();
    }
    if (part instanceof Comprehension.For forClause) {
      append("for ");
      expr(forClause.getVars(), PREC_TUPLE);
      append(" in ");
      expr(forClause.getIterable(), PREC_OR);
    } else if (part instanceof Comprehension.If ifClause) {
      append("if ");
      expr(ifClause.getCondition(), PREC_OR);
    } else if (part instanceof DictExpression.Entry entry) {
      printEntry(entry);
    } else {
      expr((Expression) part, PREC_CONDITIONAL);
    }
    if (ownLine) {
      printSuffixComments(part);
      newline();
    }
  }

  /**
   * Prints a bracketed, comma-separated sequence.
   *
   * <p>On one line, the elements are separated by ", " and a trailing comma is added only to a
   * one-element tuple. Otherwise every element goes on its own line with a trailing comma, preceded
   * by its comments and, if the source had one, a blank line.
   */
  private <T extends Node> void printSequence(
      char open,
      List<T> elems,
      char close,
      boolean multiLine,
      boolean singleTrailingComma,
      List<Comment> afterComments,
      Consumer<T> printElement) {
    append(open);
    if (!multiLine) {
      for (int i = 0; i < elems.size(); i++) {
        if (i > 0) {
          append(", ");
        }
        printElement.accept(elems.get(i));
      }
      if (singleTrailingComma && elems.size() == 1) {
        append(',');
      }
      append(close);
      return;
    }
    depth++;
    newline();
    for (int i = 0; i < elems.size(); i++) {
      T elem = elems.get(i);
      if (i > 0 && elem.hasBlankLineBefore()) {
        newline();
      }
      printComments(elem.getBeforeComments());
      indent();
      printElement.accept(elem);
      append(',');
      printSuffixComments(elem);
      newline();
    }
    printComments(afterComments);
    depth--;
    indent();
    append(close);
  }

  // ==== Layout decisions ====

  /** Reports whether the expression will print on more than one line. */
  static boolean isMultiLine(Expression e, boolean isAttrValue) {
    return switch (e.kind()) {
      case IDENTIFIER, INT_LITERAL, FLOAT_LITERAL -> false;
      case STRING_LITERAL -> ((StringLiteral) e).getRaw().indexOf('\n') >= 0;
      case LIST_EXPR -> isMultiLineList((ListExpression) e, isAttrValue);
      case DICT_EXPR -> isMultiLineDict((DictExpression) e, isAttrValue);
      case CALL -> isMultiLineCall((CallExpression) e, /* isRule= */ false);
      case COMPREHENSION -> isMultiLineComprehension((Comprehension) e);
      case BINARY_OPERATOR -> {
        BinaryOperatorExpression binop = (BinaryOperatorExpression) e;
        boolean attrOperands = isAttrValue && binop.getOperator() == TokenKind.PLUS;
        yield isMultiLine(binop.getX(), attrOperands) || isMultiLine(binop.getY(), attrOperands);
      }
      case UNARY_OPERATOR -> isMultiLine(((UnaryOperatorExpression) e).getX(), false);
      case DOT -> isMultiLine(((DotExpression) e).getObject(), false);
      case INDEX -> {
        IndexExpression index = (IndexExpression) e;
        yield isMultiLine(index.getObject(), false) || isMultiLine(index.getKey(), false);
      }
      case SLICE -> {
        SliceExpression slice = (SliceExpression) e;
        yield isMultiLine(slice.getObject(), false)
            || isMultiLineOrNull(slice.getStart())
            || isMultiLineOrNull(slice.getStop())
            || isMultiLineOrNull(slice.getStep());
      }
      case CONDITIONAL -> {
        ConditionalExpression cond = (ConditionalExpression) e;
        yield isMultiLine(cond.getThenCase(), false)
            || isMultiLine(cond.getCondition(), false)
            || isMultiLine(cond.getElseCase(), false);
      }
    };
  }

  private static boolean isMultiLineOrNull(@Nullable Expression e) {
    return e != null && isMultiLine(e, false);
  }

  private static boolean isMultiLineList(ListExpression list, boolean isAttrValue) {
    List<Expression> elems = list.getElements();
    if (elems.isEmpty()) {
      return !list.getAfterComments().isEmpty();
    }
    if (isAttrValue && !list.isTuple() && elems.size() >= 2) {
      return true;
    }
    if (list.isForceMultiLine() || !list.getAfterComments().isEmpty()) {
      return true;
    }
    for (Expression elem : elems) {
      if (elem.hasComments() || isMultiLine(elem, false)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isMultiLineDict(DictExpression dict, boolean isAttrValue) {
    List<DictExpression.Entry> entries = dict.getEntries();
    if (entries.isEmpty()) {
      return !dict.getAfterComments().isEmpty();
    }
    if ((isAttrValue && entries.size() >= 2)
        || dict.isForceMultiLine()
        || !dict.getAfterComments().isEmpty()) {
      return true;
    }
    for (DictExpression.Entry entry : entries) {
      if (entry.hasComments() || isMultiLineEntry(entry)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isMultiLineEntry(DictExpression.Entry entry) {
    return isMultiLine(entry.getKey(), false) || isMultiLine(entry.getValue(), false);
  }

  // A call whose only argument is positional keeps it next to the parentheses, even when the
  // argument spans lines: glob([...]) and select({...}).
  private static boolean isCompactCall(CallExpression call) {
    List<Argument> args = call.getArguments();
    return args.size() == 1
        && args.get(0) instanceof Argument.Positional
        && !args.get(0).hasComments()
        && call.getAfterComments().isEmpty()
        && !call.isForceMultiLine();
  }

  static boolean isMultiLineCall(CallExpression call, boolean isRule) {
    List<Argument> args = call.getArguments();
    if (args.isEmpty()) {
      return !call.getAfterComments().isEmpty();
    }
    if ((isRule && args.size() >= 2)
        || call.isForceMultiLine()
        || !call.getAfterComments().isEmpty()) {
      return true;
    }
    for (Argument arg : args) {
      if (arg.hasComments()
          || isMultiLine(arg.getValue(), isRule && arg instanceof Argument.Keyword)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isMultiLineComprehension(Comprehension comp) {
    if (comp.isForceMultiLine() || !comp.getAfterComments().isEmpty()) {
      return true;
    }
    Node body = comp.getBody();
    if (body.hasComments()) {
      return true;
    }
    if (body instanceof DictExpression.Entry entry
        ? isMultiLineEntry(entry)
        : isMultiLine((Expression) body, false)) {
      return true;
    }
    for (Comprehension.Clause clause : comp.getClauses()) {
      if (clause.hasComments()) {
        return true;
      }
      if (clause instanceof Comprehension.For forClause
          ? isMultiLine(forClause.getVars(), false) || isMultiLine(forClause.getIterable(), false)
          : isMultiLine(((Comprehension.If) clause).getCondition(), false)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isMultiLineLoad(LoadStatement load) {
    if (load.isForceMultiLine()
        || !load.getAfterComments().isEmpty()
        || load.getImport().hasComments()) {
      return true;
    }
    for (LoadStatement.Binding binding : load.getBindings()) {
      if (binding.hasComments()) {
        return true;
      }
    }
    return false;
  }

  // ==== Precedence ====

  private static int precedence(Expression e) {
    return switch (e.kind()) {
      case BINARY_OPERATOR -> binaryPrecedence(((BinaryOperatorExpression) e).getOperator());
      case UNARY_OPERATOR ->
          ((UnaryOperatorExpression) e).getOperator() == TokenKind.NOT ? PREC_NOT : PREC_UNARY;
      case CONDITIONAL -> PREC_CONDITIONAL;
      default -> PREC_PRIMARY;
    };
  }

  private static int binaryPrecedence(TokenKind op) {
    return switch (op) {
      case OR -> 0;
      case AND -> 1;
      case EQUALS_EQUALS, NOT_EQUALS, LESS, LESS_EQUALS, GREATER, GREATER_EQUALS, IN, NOT_IN ->
          PREC_COMPARISON;
      case PIPE -> 4;
      case CARET -> 5;
      case AMPERSAND -> 6;
      case LESS_LESS, GREATER_GREATER -> 7;
      case PLUS, MINUS -> 8;
      case STAR, SLASH, SLASH_SLASH, PERCENT -> 9;
      default -> throw new IllegalStateException("not a binary operator: " + op);
    };
  }
}
