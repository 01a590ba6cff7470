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


package com.google.devtools.build.buildifier.syntax;

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order.
 *
 * <p>Comments are *not* visited by the default traversal; they are trivia attached to the nodes.
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)} or {@link #visitAll} on child fields.
 */
public class NodeVisitor {

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  // ==== Miscellaneous node types ====

  /**
   * Handles all four Argument node types uniformly. Subclasses should not add an overload for a
   * concrete Argument subclass; it won't be called.
   */
  public void visit(Argument node) {
    if (node instanceof Argument.Keyword) {
      visit(((Argument.Keyword) node).getIdentifier());
    }
    visit(node.getValue());
  }

  public void visit(@SuppressWarnings("unused") Comment node) {}

  public void visit(BuildFile node) {
    visitAll(node.getStatements());
  }

  // ==== Statement nodes ====

  public void visit(AssignmentStatement node) {
    visit(node.getLHS());
    visit(node.getRHS());
  }

  public void visit(@SuppressWarnings("unused") CommentBlock node) {}

  public void visit(ExpressionStatement node) {
    visit(node.getExpression());
  }

  public void visit(LoadStatement node) {
    visit(node.getImport());
    visitAll(node.getBindings());
  }

  public void visit(LoadStatement.Binding node) {
    if (node.getLocal() != null) {
      visit(node.getLocal());
    }
    visit(node.getOriginal());
  }

  // ==== Expression nodes ====

  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    visit(node.getY());
  }

  public void visit(CallExpression node) {
    visit(node.getFunction());
    visitAll(node.getArguments());
  }

  public void visit(Comprehension node) {
    visit(node.getBody());
    for (Comprehension.Clause clause : node.getClauses()) {
      if (clause instanceof Comprehension.For) {
        visit((Comprehension.For) clause);
      } else {
        visit((Comprehension.If) clause);
      }
    }
  }

  public void visit(Comprehension.For node) {
    visit(node.getVars());
    visit(node.getIterable());
  }

  public void visit(Comprehension.If node) {
    visit(node.getCondition());
  }

  public void visit(ConditionalExpression node) {
    visit(node.getThenCase());
    visit(node.getCondition());
    visit(node.getElseCase());
  }

  public void visit(DictExpression node) {
    visitAll(node.getEntries());
  }

  public void visit(DictExpression.Entry node) {
    visit(node.getKey());
    visit(node.getValue());
  }

  public void visit(DotExpression node) {
    visit(node.getObject());
    visit(node.getField());
  }

  public void visit(@SuppressWarnings("unused") FloatLiteral node) {}

  public void visit(@SuppressWarnings("unused") Identifier node) {}

  public void visit(IndexExpression node) {
    visit(node.getObject());
    visit(node.getKey());
  }

  public void visit(@SuppressWarnings("unused") IntLiteral node) {}

  public void visit(ListExpression node) {
    visitAll(node.getElements());
  }

  public void visit(SliceExpression node) {
    visit(node.getObject());
    if (node.getStart() != null) {
      visit(node.getStart());
    }
    if (node.getStop() != null) {
      visit(node.getStop());
    }
    if (node.getStep() != null) {
      visit(node.getStep());
    }
  }

  public void visit(@SuppressWarnings("unused") StringLiteral node) {}

  public void visit(UnaryOperatorExpression node) {
    visit(node.getX());
  }

  // ==== Helpers for sequences of nodes ====

  /** Visits a sequence of nodes (e.g. a list of arguments). */
  // Final because this method is called across completely different categories of nodes, so it is
  // usually a mistake to attempt to override it.
  public final void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }
}
