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


package com.google.devtools.build.buildifier.rewrite;

import com.google.common.collect.ImmutableList;
import com.google.devtools.build.buildifier.syntax.Argument;
import com.google.devtools.build.buildifier.syntax.AssignmentStatement;
import com.google.devtools.build.buildifier.syntax.BinaryOperatorExpression;
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.CallExpression;
import com.google.devtools.build.buildifier.syntax.ConditionalExpression;
import com.google.devtools.build.buildifier.syntax.DictExpression;
import com.google.devtools.build.buildifier.syntax.Expression;
import com.google.devtools.build.buildifier.syntax.ExpressionStatement;
import com.google.devtools.build.buildifier.syntax.IndexExpression;
import com.google.devtools.build.buildifier.syntax.ListExpression;
import com.google.devtools.build.buildifier.syntax.Statement;
import com.google.devtools.build.buildifier.syntax.StringLiteral;
import com.google.devtools.build.buildifier.syntax.TokenKind;
import com.google.devtools.build.buildifier.syntax.UnaryOperatorExpression;

/**
 * Replaces {@code "a" + "b"} with {@code "ab"}.
 *
 * <p>Both operands must be plain string literals without comments. Operands are simplified before
 * the operation that contains them, so a chain {@code "a" + "b" + "c"} collapses in one pass.
 */
final class StringConcatPass implements RewritePass {

  @Override
  public String name() {
    return "stringconcat";
  }

  @Override
  public ImmutableList<String> apply(BuildFile file, RewriteConfig config) {
    ImmutableList.Builder<String> changes = ImmutableList.builder();
    for (Statement stmt : file.getStatements()) {
      switch (stmt.kind()) {
        case ASSIGNMENT -> {
          AssignmentStatement assign = (AssignmentStatement) stmt;
          assign.setRHS(simplify(assign.getRHS(), changes));
        }
        case EXPRESSION -> {
          ExpressionStatement exprStmt = (ExpressionStatement) stmt;
          exprStmt.setExpression(simplify(exprStmt.getExpression(), changes));
        }
        case LOAD, COMMENT_BLOCK -> {}
      }
    }
    return changes.build();
  }

  // Simplifies the subexpressions of e in place and returns the replacement for e itself.
  private static Expression simplify(Expression e, ImmutableList.Builder<String> changes) {
    switch (e.kind()) {
      case BINARY_OPERATOR -> {
        BinaryOperatorExpression binop = (BinaryOperatorExpression) e;
        binop.setX(simplify(binop.getX(), changes));
        binop.setY(simplify(binop.getY(), changes));
        if (binop.getOperator() == TokenKind.PLUS
            && isJoinable(binop.getX())
            && isJoinable(binop.getY())) {
          StringLiteral left = (StringLiteral) binop.getX();
          StringLiteral right = (StringLiteral) binop.getY();
          changes.add("line " + binop.getStartLocation().line());
          left.setValue(left.getValue() + right.getValue());
          // The result takes the place of the operation, trivia included.
          left.setBeforeComments(binop.getBeforeComments());
          left.setSuffixComments(binop.getSuffixComments());
          left.setBlankLineBefore(binop.hasBlankLineBefore());
          return left;
        }
      }
      case LIST_EXPR -> {
        ListExpression list = (ListExpression) e;
        ImmutableList.Builder<Expression> elems = ImmutableList.builder();
        for (Expression elem : list.getElements()) {
          elems.add(simplify(elem, changes));
        }
        list.setElements(elems.build());
      }
      case DICT_EXPR -> {
        for (DictExpression.Entry entry : ((DictExpression) e).getEntries()) {
          entry.setKey(simplify(entry.getKey(), changes));
          entry.setValue(simplify(entry.getValue(), changes));
        }
      }
      case CALL -> {
        for (Argument arg : ((CallExpression) e).getArguments()) {
          arg.setValue(simplify(arg.getValue(), changes));
        }
      }
      case UNARY_OPERATOR -> {
        UnaryOperatorExpression unop = (UnaryOperatorExpression) e;
        unop.setX(simplify(unop.getX(), changes));
      }
      case INDEX -> {
        IndexExpression index = (IndexExpression) e;
        index.setKey(simplify(index.getKey(), changes));
      }
      case CONDITIONAL -> {
        ConditionalExpression cond = (ConditionalExpression) e;
        cond.setThenCase(simplify(cond.getThenCase(), changes));
        cond.setCondition(simplify(cond.getCondition(), changes));
        cond.setElseCase(simplify(cond.getElseCase(), changes));
      }
      // The parts of these expressions are fixed at parse time.
      case COMPREHENSION, DOT, SLICE -> {}
      case IDENTIFIER, STRING_LITERAL, INT_LITERAL, FLOAT_LITERAL -> {}
    }
    return e;
  }

  private static boolean isJoinable(Expression e) {
    return e instanceof StringLiteral str && str.isPlain() && !str.hasComments();
  }
}
