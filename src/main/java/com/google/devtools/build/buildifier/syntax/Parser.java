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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Parser is a recursive-descent parser for BUILD files.
 *
 * <p>Unlike a compiler front end, the parser keeps the layout of the file: comments are attached
 * to the nodes they belong to, and containers remember whether they spanned several lines. The
 * parser stops at the first error; a file that does not parse yields no tree.
 */
final class Parser {

  /** Combines the parser result into a single value object. */
  static final class ParseResult {
    // Maps char offsets in the file to Locations.
    final FileLocations locs;

    /** The top-level statements of the parsed file. */
    final ImmutableList<Statement> statements;

    /** The comments from the parsed file. */
    final ImmutableList<Comment> comments;

    private ParseResult(
        FileLocations locs, ImmutableList<Statement> statements, ImmutableList<Comment> comments) {
      this.locs = locs;
      this.statements = Preconditions.checkNotNull(statements);
      this.comments = Preconditions.checkNotNull(comments);
    }
  }

  // Thrown to unwind the parser once an error has been recorded.
  private static final class ParseAbort extends RuntimeException {
    ParseAbort() {
      super(null, null, false, false);
    }
  }

  // Comment and blank-line context captured before an element of a container is parsed.
  private static final class ElementStart {
    final ImmutableList<Comment> before;
    final boolean blankLineBefore;

    ElementStart(ImmutableList<Comment> before, boolean blankLineBefore) {
      this.before = before;
      this.blankLineBefore = blankLineBefore;
    }
  }

  private static final EnumSet<TokenKind> EXPR_LIST_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.EOF,
          TokenKind.NEWLINE,
          TokenKind.EQUALS,
          TokenKind.RBRACE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SEMI);

  // Python statements that have no place in a BUILD file.
  private static final EnumSet<TokenKind> UNSUPPORTED_STATEMENTS =
      EnumSet.of(
          TokenKind.BREAK,
          TokenKind.CONTINUE,
          TokenKind.DEF,
          TokenKind.FOR,
          TokenKind.IF,
          TokenKind.PASS,
          TokenKind.RETURN);

  /** Current lookahead token. May be mutated by the parser. */
  private final Lexer token; // token.kind is a prettier alias for lexer.kind

  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  // End offset of the most recently consumed token.
  private int prevEnd;

  private static final Map<TokenKind, TokenKind> augmentedAssignments =
      new ImmutableMap.Builder<TokenKind, TokenKind>()
          .put(TokenKind.PLUS_EQUALS, TokenKind.PLUS)
          .put(TokenKind.MINUS_EQUALS, TokenKind.MINUS)
          .put(TokenKind.STAR_EQUALS, TokenKind.STAR)
          .put(TokenKind.SLASH_EQUALS, TokenKind.SLASH)
          .put(TokenKind.SLASH_SLASH_EQUALS, TokenKind.SLASH_SLASH)
          .put(TokenKind.PERCENT_EQUALS, TokenKind.PERCENT)
          .put(TokenKind.AMPERSAND_EQUALS, TokenKind.AMPERSAND)
          .put(TokenKind.CARET_EQUALS, TokenKind.CARET)
          .put(TokenKind.PIPE_EQUALS, TokenKind.PIPE)
          .put(TokenKind.GREATER_GREATER_EQUALS, TokenKind.GREATER_GREATER)
          .put(TokenKind.LESS_LESS_EQUALS, TokenKind.LESS_LESS)
          .buildOrThrow();

  /**
   * Highest precedence goes last. Based on:
   * http://docs.python.org/2/reference/expressions.html#operator-precedence
   */
  static final ImmutableList<EnumSet<TokenKind>> operatorPrecedence =
      ImmutableList.of(
          EnumSet.of(TokenKind.OR),
          EnumSet.of(TokenKind.AND),
          EnumSet.of(TokenKind.NOT),
          EnumSet.of(
              TokenKind.EQUALS_EQUALS,
              TokenKind.NOT_EQUALS,
              TokenKind.LESS,
              TokenKind.LESS_EQUALS,
              TokenKind.GREATER,
              TokenKind.GREATER_EQUALS,
              TokenKind.IN,
              TokenKind.NOT_IN),
          EnumSet.of(TokenKind.PIPE),
          EnumSet.of(TokenKind.CARET),
          EnumSet.of(TokenKind.AMPERSAND),
          EnumSet.of(TokenKind.GREATER_GREATER, TokenKind.LESS_LESS),
          EnumSet.of(TokenKind.MINUS, TokenKind.PLUS),
          EnumSet.of(TokenKind.SLASH, TokenKind.SLASH_SLASH, TokenKind.STAR, TokenKind.PERCENT));

  private Parser(Lexer lexer, List<SyntaxError> errors) {
    this.lexer = lexer;
    this.locs = lexer.locs;
    this.errors = errors;
    this.token = lexer;
    nextToken();
  }

  // Returns a token's string form as used in error messages.
  private static String tokenString(TokenKind kind, @Nullable Object value) {
    return kind == TokenKind.STRING
        ? StringLiteral.quote((String) value)
        : value == null ? kind.toString() : value.toString();
  }

  // Main entry point for parsing a file.
  static ParseResult parseFile(ParserInput input) throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    ImmutableList<Statement> statements = null;
    try {
      Parser parser = new Parser(lexer, errors);
      statements = parser.parseFileInput();
    } catch (ParseAbort ex) {
      // The error has been recorded.
    } catch (StackOverflowError ex) {
      // JVM threads have very limited stack, and deeply nested inputs can
      // easily cause the parser to consume all available stack.
      errors.add(
          new SyntaxError(
              lexer.locs.getLocation(lexer.end),
              "internal error: stack overflow in parser, the input is nested too deeply"));
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return new ParseResult(lexer.locs, statements, lexer.getComments());
  }

  // Records an error and returns the exception that aborts the parse.
  @FormatMethod
  private ParseAbort reportError(int offset, String format, Object... args) {
    errors.add(new SyntaxError(locs.getLocation(offset), String.format(format, args)));
    return new ParseAbort();
  }

  private ParseAbort syntaxError(String message) {
    return reportError(
        token.start, "syntax error at '%s': %s", tokenString(token.kind, token.value), message);
  }

  // Consumes the current token and returns its position, like nextToken.
  // Reports a syntax error if the new token is not of the expected kind.
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      throw syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Keywords that exist in Python and that we don't parse.
  private static final EnumSet<TokenKind> FORBIDDEN_KEYWORDS =
      EnumSet.of(
          TokenKind.AS,
          TokenKind.ASSERT,
          TokenKind.CLASS,
          TokenKind.DEL,
          TokenKind.EXCEPT,
          TokenKind.FINALLY,
          TokenKind.FROM,
          TokenKind.GLOBAL,
          TokenKind.IMPORT,
          TokenKind.IS,
          TokenKind.NONLOCAL,
          TokenKind.RAISE,
          TokenKind.TRY,
          TokenKind.WITH,
          TokenKind.WHILE,
          TokenKind.YIELD);

  private void checkForbiddenKeywords() {
    if (!FORBIDDEN_KEYWORDS.contains(token.kind)) {
      return;
    }
    throw reportError(
        token.start,
        "%s",
        switch (token.kind) {
          case ASSERT -> "'assert' not supported, use 'fail' instead";
          case DEL ->
              "'del' not supported, use '.pop()' to delete an item from a dictionary or a list";
          case IMPORT -> "'import' not supported, use 'load' instead";
          case IS -> "'is' not supported, use '==' instead";
          case RAISE -> "'raise' not supported, use 'fail' instead";
          case TRY -> "'try' not supported, all exceptions are fatal";
          case WHILE -> "'while' not supported, use a list comprehension instead";
          default -> "keyword '" + token.kind + "' not supported";
        });
  }

  private int nextToken() {
    int prev = token.start;
    prevEnd = token.end;
    if (token.kind != TokenKind.EOF) {
      lexer.nextToken();
    }
    if (!errors.isEmpty()) {
      throw new ParseAbort();
    }
    checkForbiddenKeywords();
    return prev;
  }

  private int line(int offset) {
    return locs.getLine(Math.max(offset, 0));
  }

  // ==== Comment attachment ====

  // Removes and returns the pending comments that start before the given offset.
  private ImmutableList<Comment> takeCommentsBefore(int offset) {
    ImmutableList.Builder<Comment> result = ImmutableList.builder();
    while (!lexer.pendingComments.isEmpty()
        && lexer.pendingComments.peekFirst().getStartOffset() < offset) {
      result.add(lexer.pendingComments.removeFirst());
    }
    return result.build();
  }

  // Returns comments to the front of the pending queue, for the next element boundary to claim.
  private void restoreComments(ImmutableList<Comment> comments) {
    for (Comment comment : comments.reverse()) {
      lexer.pendingComments.addFirst(comment);
    }
  }

  // Attaches the pending comments up to the end of the node's last line: the comment on that line
  // becomes its suffix comment, and comments found inside the node join its before comments.
  private void takeTrailingComments(Node node) {
    int endLine = line(prevEnd - 1);
    ImmutableList.Builder<Comment> inner = ImmutableList.builder();
    boolean hasInner = false;
    while (!lexer.pendingComments.isEmpty()) {
      Comment comment = lexer.pendingComments.peekFirst();
      if (comment.getStartOffset() >= token.start || comment.getLine() > endLine) {
        break;
      }
      lexer.pendingComments.removeFirst();
      if (comment.getLine() == endLine) {
        node.setSuffixComments(ImmutableList.of(comment));
      } else {
        inner.add(comment);
        hasInner = true;
      }
    }
    if (hasInner) {
      node.setBeforeComments(
          ImmutableList.<Comment>builder()
              .addAll(node.getBeforeComments())
              .addAll(inner.build())
              .build());
    }
  }

  private ElementStart beginElement(boolean first) {
    int prevLine = line(prevEnd - 1);
    ImmutableList<Comment> before = takeCommentsBefore(token.start);
    int firstLine = before.isEmpty() ? line(token.start) : before.get(0).getLine();
    return new ElementStart(before, !first && firstLine - prevLine > 1);
  }

  // Attaches the captured trivia to a parsed element and consumes its optional trailing comma.
  // Returns whether there was a comma.
  private boolean endElement(Node element, ElementStart start) {
    element.setBeforeComments(
        ImmutableList.<Comment>builder()
            .addAll(start.before)
            .addAll(element.getBeforeComments())
            .build());
    element.setBlankLineBefore(start.blankLineBefore);
    boolean comma = token.kind == TokenKind.COMMA;
    if (comma) {
      nextToken();
    }
    takeTrailingComments(element);
    return comma;
  }

  // ==== Expressions ====

  // Parses every kind of expression, including unparenthesized tuples.
  //
  // In many cases we need to use parseTest() in place of parseExpr() to avoid ambiguity, e.g.:
  //
  //   f(x, y)  vs  f((x, y))
  //
  // Unlike Python, a trailing comma is disallowed in an unparenthesized tuple.
  // This prevents bugs where a one-element tuple is surprisingly created, e.g.:
  //
  //   foo = f(x),
  private Expression parseExpr() {
    Expression e = parseTest();
    if (token.kind != TokenKind.COMMA) {
      return e;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e);
    while (token.kind == TokenKind.COMMA) {
      expect(TokenKind.COMMA);
      if (EXPR_LIST_TERMINATOR_SET.contains(token.kind)) {
        throw reportError(token.start, "Trailing comma is allowed only in parenthesized tuples.");
      }
      elems.add(parseTest());
    }
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  // arg = IDENTIFIER '=' test
  //     | expr
  //     | *args
  //     | **kwargs
  private Argument parseArgument() {
    Expression expr;

    // parse **expr
    if (token.kind == TokenKind.STAR_STAR) {
      int starStarOffset = nextToken();
      expr = parseTest();
      return new Argument.StarStar(locs, starStarOffset, expr);
    }

    // parse *expr
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      expr = parseTest();
      return new Argument.Star(locs, starOffset, expr);
    }

    // IDENTIFIER  or  IDENTIFIER = test
    expr = parseTest();
    if (expr instanceof Identifier && token.kind == TokenKind.EQUALS) {
      // parse a named argument
      nextToken();
      Expression arg = parseTest();
      return new Argument.Keyword(locs, (Identifier) expr, arg);
    }

    // parse a positional argument
    return new Argument.Positional(locs, expr);
  }

  // call_suffix = '(' arg_list? ')'
  // arg_list = ( (arg ',')* arg ','? )?
  private Expression parseCallSuffix(Expression fn) {
    int lparenOffset = expect(TokenKind.LPAREN);
    List<Argument> args = new ArrayList<>();
    while (token.kind != TokenKind.RPAREN) {
      ElementStart start = beginElement(args.isEmpty());
      Argument arg = parseArgument();
      if (token.kind == TokenKind.FOR) {
        // f(expr for vars in expr) -- Python generator expression?
        throw syntaxError("generator expressions are not supported in BUILD files");
      }
      boolean comma = endElement(arg, start);
      args.add(arg);
      if (!comma) {
        break;
      }
    }
    ImmutableList<Comment> after = takeCommentsBefore(token.start);
    int rparenOffset = expect(TokenKind.RPAREN);
    CallExpression call =
        new CallExpression(locs, fn, lparenOffset, removeDuplicateKeywords(args), rparenOffset);
    call.setAfterComments(after);
    call.setForceMultiLine(
        line(lparenOffset) != line(rparenOffset) && !isCompact(lparenOffset, args, rparenOffset));
    return call;
  }

  // Reports whether the arguments start on the line of the open paren and end on the line of the
  // close paren, as in select({...}) written across several lines.
  private boolean isCompact(int lparenOffset, List<Argument> args, int rparenOffset) {
    return !args.isEmpty()
        && line(args.get(0).getStartOffset()) == line(lparenOffset)
        && line(args.get(args.size() - 1).getEndOffset() - 1) == line(rparenOffset);
  }

  // Keyword names are unique within a call: when a name repeats, the last argument wins and
  // inherits the comments of the ones it replaces.
  private static ImmutableList<Argument> removeDuplicateKeywords(List<Argument> args) {
    Map<String, Argument> last = new HashMap<>();
    int keywords = 0;
    for (Argument arg : args) {
      if (arg.getName() != null) {
        last.put(arg.getName(), arg);
        keywords++;
      }
    }
    if (last.size() == keywords) {
      return ImmutableList.copyOf(args);
    }
    // Visit the losers from last to first so that their comments keep source order.
    for (int i = args.size() - 1; i >= 0; i--) {
      Argument arg = args.get(i);
      Argument winner = arg.getName() != null ? last.get(arg.getName()) : arg;
      if (winner != arg) {
        winner.absorbComments(arg);
      }
    }
    ImmutableList.Builder<Argument> result = ImmutableList.builder();
    for (Argument arg : args) {
      if (arg.getName() == null || last.get(arg.getName()) == arg) {
        result.add(arg);
      }
    }
    return result.build();
  }

  // selector_suffix = '.' IDENTIFIER
  private Expression parseSelectorSuffix(Expression e) {
    int dotOffset = expect(TokenKind.DOT);
    if (token.kind != TokenKind.IDENTIFIER) {
      throw syntaxError("expected identifier after dot");
    }
    Identifier id = parseIdent();
    return new DotExpression(locs, e, dotOffset, id);
  }

  // dict_entry = test ':' test
  private DictExpression.Entry parseDictEntry() {
    Expression key = parseTest();
    expect(TokenKind.COLON);
    Expression value = parseTest();
    return new DictExpression.Entry(locs, key, value);
  }

  // expr = STRING
  private StringLiteral parseStringLiteral() {
    Preconditions.checkState(token.kind == TokenKind.STRING);
    StringLiteral literal =
        new StringLiteral(locs, token.start, token.raw, (String) token.value, token.end);
    nextToken();
    if (token.kind == TokenKind.STRING) {
      throw reportError(
          token.start, "Implicit string concatenation is forbidden, use the + operator");
    }
    return literal;
  }

  //  primary = INT
  //          | FLOAT
  //          | STRING
  //          | IDENTIFIER
  //          | list_expression
  //          | '(' ')'                    // a tuple with zero elements
  //          | '(' expr ')'               // a parenthesized expression
  //          | '(' expr ',' ... ')'       // a tuple
  //          | dict_expression
  //          | '-' primary_with_suffix
  private Expression parsePrimary() {
    switch (token.kind) {
      case INT:
        {
          IntLiteral literal = new IntLiteral(locs, token.raw, token.start);
          nextToken();
          return literal;
        }

      case FLOAT:
        {
          FloatLiteral literal = new FloatLiteral(locs, token.raw, token.start);
          nextToken();
          return literal;
        }

      case STRING:
        return parseStringLiteral();

      case IDENTIFIER:
        return parseIdent();

      case LBRACKET: // [...]
        return parseListMaker();

      case LBRACE: // {...}
        return parseDictExpression();

      case LPAREN:
        return parseParenthesized();

      case MINUS:
      case PLUS:
      case TILDE:
        {
          TokenKind op = token.kind;
          int offset = nextToken();
          Expression x = parsePrimaryWithSuffix();
          return new UnaryOperatorExpression(locs, op, offset, x);
        }

      case LAMBDA:
        throw reportError(token.start, "lambda expressions are not supported in BUILD files");

      default:
        throw syntaxError("expected expression");
    }
  }

  // Parses '(' ')', '(' expr ')' or a parenthesized tuple.
  private Expression parseParenthesized() {
    int lparenOffset = expect(TokenKind.LPAREN);

    // empty tuple: ()
    if (token.kind == TokenKind.RPAREN) {
      return finishTuple(lparenOffset, ImmutableList.of());
    }

    ElementStart start = beginElement(true);
    Expression e = parseTest();

    // parenthesized expression: (e)
    // The parentheses are not kept: the printer adds those that precedence requires.
    if (token.kind == TokenKind.RPAREN) {
      restoreComments(start.before);
      nextToken();
      return e;
    }

    // (expr for vars in expr) -- Python generator expression?
    if (token.kind == TokenKind.FOR) {
      throw syntaxError("generator expressions are not supported in BUILD files");
    }

    // non-empty tuple: (e,) or (e, ..., e)
    List<Expression> elems = new ArrayList<>();
    boolean comma = endElement(e, start);
    elems.add(e);
    while (comma && token.kind != TokenKind.RPAREN) {
      ElementStart next = beginElement(false);
      Expression elem = parseTest();
      comma = endElement(elem, next);
      elems.add(elem);
    }
    return finishTuple(lparenOffset, ImmutableList.copyOf(elems));
  }

  private ListExpression finishTuple(int lparenOffset, ImmutableList<Expression> elems) {
    ImmutableList<Comment> after = takeCommentsBefore(token.start);
    int rparenOffset = expect(TokenKind.RPAREN);
    ListExpression tuple =
        new ListExpression(locs, /* isTuple= */ true, lparenOffset, elems, rparenOffset);
    tuple.setAfterComments(after);
    tuple.setForceMultiLine(line(lparenOffset) != line(rparenOffset));
    return tuple;
  }

  // primary_with_suffix = primary (selector_suffix | slice_suffix | call_suffix)*
  private Expression parsePrimaryWithSuffix() {
    Expression e = parsePrimary();
    while (true) {
      if (token.kind == TokenKind.DOT) {
        e = parseSelectorSuffix(e);
      } else if (token.kind == TokenKind.LBRACKET) {
        e = parseSliceSuffix(e);
      } else if (token.kind == TokenKind.LPAREN) {
        e = parseCallSuffix(e);
      } else {
        return e;
      }
    }
  }

  // slice_suffix = '[' expr? ':' expr?  ':' expr? ']'
  //              | '[' expr? ':' expr? ']'
  //              | '[' expr ']'
  private Expression parseSliceSuffix(Expression e) {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    Expression start = null;
    Expression end = null;
    Expression step = null;

    if (token.kind != TokenKind.COLON) {
      start = parseExpr();

      // index x[i]
      if (token.kind == TokenKind.RBRACKET) {
        int rbracketOffset = expect(TokenKind.RBRACKET);
        return new IndexExpression(locs, e, lbracketOffset, start, rbracketOffset);
      }
    }

    // slice or substring x[i:j] or x[i:j:k]
    expect(TokenKind.COLON);
    if (token.kind != TokenKind.COLON && token.kind != TokenKind.RBRACKET) {
      end = parseTest();
    }
    if (token.kind == TokenKind.COLON) {
      expect(TokenKind.COLON);
      if (token.kind != TokenKind.RBRACKET) {
        step = parseTest();
      }
    }
    int rbracketOffset = expect(TokenKind.RBRACKET);
    return new SliceExpression(locs, e, lbracketOffset, start, end, step, rbracketOffset);
  }

  // Equivalent to 'exprlist' rule in Python grammar.
  // loop_variables = primary_with_suffix ( ',' primary_with_suffix )* ','?
  private Expression parseForLoopVariables() {
    // We cannot reuse parseExpr because it would parse the 'in' operator.
    // e.g.  "for i in e"  -> we want to parse only "i" here.
    Expression e1 = parsePrimaryWithSuffix();
    if (token.kind != TokenKind.COMMA) {
      return e1;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e1);
    while (token.kind == TokenKind.COMMA) {
      expect(TokenKind.COMMA);
      if (EXPR_LIST_TERMINATOR_SET.contains(token.kind)) {
        break;
      }
      elems.add(parsePrimaryWithSuffix());
    }
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  // comprehension_suffix = 'FOR' loop_variables 'IN' expr comprehension_suffix
  //                      | 'IF' expr comprehension_suffix
  //                      | ']' | '}'
  private Expression parseComprehensionSuffix(int loffset, Node body, TokenKind closingBracket) {
    ImmutableList.Builder<Comprehension.Clause> clauses = ImmutableList.builder();
    while (true) {
      ImmutableList<Comment> before = takeCommentsBefore(token.start);
      Comprehension.Clause clause;
      if (token.kind == TokenKind.FOR) {
        int forOffset = nextToken();
        Expression vars = parseForLoopVariables();
        expect(TokenKind.IN);
        // The expression cannot be a ternary expression ('x if y else z') due to
        // conflicts in Python grammar ('if' is used by the comprehension).
        Expression seq = parseTest(0);
        clause = new Comprehension.For(locs, forOffset, vars, seq);
      } else if (token.kind == TokenKind.IF) {
        int ifOffset = nextToken();
        // [x for x in li if 1, 2]  # parse error
        // [x for x in li if (1, 2)]  # ok
        Expression cond = parseTest(0);
        clause = new Comprehension.If(locs, ifOffset, cond);
      } else if (token.kind == closingBracket) {
        restoreComments(before);
        break;
      } else {
        throw syntaxError("expected '" + closingBracket + "', 'for' or 'if'");
      }
      clause.setBeforeComments(before);
      clauses.add(clause);
    }

    boolean isDict = closingBracket == TokenKind.RBRACE;
    ImmutableList<Comment> after = takeCommentsBefore(token.start);
    int roffset = expect(closingBracket);
    Comprehension comprehension =
        new Comprehension(locs, isDict, loffset, body, clauses.build(), roffset);
    comprehension.setAfterComments(after);
    comprehension.setForceMultiLine(line(loffset) != line(roffset));
    return comprehension;
  }

  // list_maker = '[' ']'
  //            | '[' expr ']'
  //            | '[' expr expr_list ']'
  //            | '[' expr comprehension_suffix ']'
  private Expression parseListMaker() {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    List<Expression> elems = new ArrayList<>();
    while (token.kind != TokenKind.RBRACKET) {
      ElementStart start = beginElement(elems.isEmpty());
      Expression elem = parseTest();
      if (elems.isEmpty() && token.kind == TokenKind.FOR) {
        // [e for x in y], list comprehension
        elem.setBeforeComments(start.before);
        return parseComprehensionSuffix(lbracketOffset, elem, TokenKind.RBRACKET);
      }
      boolean comma = endElement(elem, start);
      elems.add(elem);
      if (!comma) {
        if (token.kind != TokenKind.RBRACKET) {
          throw syntaxError("expected ',', 'for' or ']'");
        }
        break;
      }
    }
    ImmutableList<Comment> after = takeCommentsBefore(token.start);
    int rbracketOffset = expect(TokenKind.RBRACKET);
    ListExpression list =
        new ListExpression(
            locs,
            /* isTuple= */ false,
            lbracketOffset,
            ImmutableList.copyOf(elems),
            rbracketOffset);
    list.setAfterComments(after);
    list.setForceMultiLine(line(lbracketOffset) != line(rbracketOffset));
    return list;
  }

  // dict_expression = '{' '}'
  //                 | '{' dict_entry_list '}'
  //                 | '{' dict_entry comprehension_suffix '}'
  // dict_entry_list = ( (dict_entry ',')* dict_entry ','? )?
  private Expression parseDictExpression() {
    int lbraceOffset = expect(TokenKind.LBRACE);
    List<DictExpression.Entry> entries = new ArrayList<>();
    while (token.kind != TokenKind.RBRACE) {
      ElementStart start = beginElement(entries.isEmpty());
      DictExpression.Entry entry = parseDictEntry();
      if (entries.isEmpty() && token.kind == TokenKind.FOR) {
        // Dict comprehension
        entry.setBeforeComments(start.before);
        return parseComprehensionSuffix(lbraceOffset, entry, TokenKind.RBRACE);
      }
      boolean comma = endElement(entry, start);
      entries.add(entry);
      if (!comma) {
        break;
      }
    }
    ImmutableList<Comment> after = takeCommentsBefore(token.start);
    int rbraceOffset = expect(TokenKind.RBRACE);
    DictExpression dict =
        new DictExpression(locs, lbraceOffset, ImmutableList.copyOf(entries), rbraceOffset);
    dict.setAfterComments(after);
    dict.setForceMultiLine(line(lbraceOffset) != line(rbraceOffset));
    return dict;
  }

  private Identifier parseIdent() {
    if (token.kind != TokenKind.IDENTIFIER) {
      throw syntaxError("expected identifier");
    }
    String name = (String) token.value;
    int offset = nextToken();
    return new Identifier(locs, name, offset);
  }

  // binop_expression = binop_expression OP binop_expression
  //                  | parsePrimaryWithSuffix
  // This function takes care of precedence between operators (see operatorPrecedence for
  // the order), and it assumes left-to-right associativity.
  private Expression parseBinOpExpression(int prec) {
    Expression x = parseTest(prec + 1);
    // The loop is not strictly needed, but it prevents risks of stack overflow. Depth is
    // limited to number of different precedence levels (operatorPrecedence.size()).
    TokenKind lastOp = null;
    for (; ; ) {
      if (token.kind == TokenKind.NOT) {
        // If NOT appears when we expect a binary operator, it must be followed by IN.
        // Since the code expects every operator to be a single token, we push a NOT_IN token.
        expect(TokenKind.NOT);
        if (token.kind != TokenKind.IN) {
          throw syntaxError("expected 'in'");
        }
        token.kind = TokenKind.NOT_IN;
      }

      TokenKind op = token.kind;
      if (!operatorPrecedence.get(prec).contains(op)) {
        return x;
      }

      // Operator '==' and other operators of the same precedence (e.g. '<', 'in')
      // are not associative.
      if (lastOp != null && operatorPrecedence.get(prec).contains(TokenKind.EQUALS_EQUALS)) {
        throw reportError(
            token.start,
            "Operator '%s' is not associative with operator '%s'. Use parens.",
            lastOp,
            op);
      }

      int opOffset = nextToken();
      Expression y = parseTest(prec + 1);
      x = new BinaryOperatorExpression(locs, x, op, opOffset, y);
      lastOp = op;
    }
  }

  // Parses any expression except for an unparenthesized tuple.
  private Expression parseTest() {
    int start = token.start;
    Expression expr = parseTest(0);
    if (token.kind == TokenKind.IF) {
      nextToken();
      Expression condition = parseTest(0);
      if (token.kind != TokenKind.ELSE) {
        throw reportError(
            start, "missing else clause in conditional expression or semicolon before if");
      }
      nextToken();
      Expression elseClause = parseTest();
      return new ConditionalExpression(locs, expr, condition, elseClause);
    }
    return expr;
  }

  private Expression parseTest(int prec) {
    if (prec >= operatorPrecedence.size()) {
      return parsePrimaryWithSuffix();
    }
    if (token.kind == TokenKind.NOT && operatorPrecedence.get(prec).contains(TokenKind.NOT)) {
      return parseNotExpression(prec);
    }
    return parseBinOpExpression(prec);
  }

  // not_expr = 'not' expr
  private Expression parseNotExpression(int prec) {
    int notOffset = expect(TokenKind.NOT);
    Expression x = parseTest(prec);
    return new UnaryOperatorExpression(locs, TokenKind.NOT, notOffset, x);
  }

  // ==== Statements ====

  // file_input = ('\n' | stmt)* EOF
  // The terminating newline is injected by the lexer even if not present in the input.
  private ImmutableList<Statement> parseFileInput() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    int lastLine = 0; // the line on which the previous top-level item ended
    while (true) {
      while (token.kind == TokenKind.NEWLINE) {
        nextToken();
      }

      // Whole-line comments before the next statement, or before the end of the file. Only the
      // group directly above the statement is attached to it.
      ImmutableList<Comment> leading = ImmutableList.of();
      List<ImmutableList<Comment>> groups = groupAdjacentLines(takeCommentsBefore(token.start));
      for (int i = 0; i < groups.size(); i++) {
        ImmutableList<Comment> group = groups.get(i);
        int groupEnd = group.get(group.size() - 1).getLine();
        if (i == groups.size() - 1
            && token.kind != TokenKind.EOF
            && line(token.start) == groupEnd + 1) {
          leading = group;
          break;
        }
        CommentBlock block = new CommentBlock(locs, group);
        block.setBlankLineBefore(lastLine > 0 && group.get(0).getLine() - lastLine > 1);
        list.add(block);
        lastLine = groupEnd;
      }
      if (token.kind == TokenKind.EOF) {
        break;
      }

      int firstLine = leading.isEmpty() ? line(token.start) : leading.get(0).getLine();
      Statement stmt = parseSmallStatement();
      stmt.setBeforeComments(leading);
      stmt.setBlankLineBefore(lastLine > 0 && firstLine - lastLine > 1);
      list.add(stmt);

      // simple_stmt = small_stmt (';' small_stmt)* ';'? NEWLINE
      Statement last = stmt;
      while (token.kind == TokenKind.SEMI) {
        nextToken();
        if (token.kind == TokenKind.NEWLINE) {
          break;
        }
        last = parseSmallStatement();
        list.add(last);
      }
      takeTrailingComments(last);
      lastLine = line(prevEnd - 1);
      expect(TokenKind.NEWLINE);
    }
    return list.build();
  }

  // Splits comments into runs on consecutive lines.
  private static List<ImmutableList<Comment>> groupAdjacentLines(ImmutableList<Comment> comments) {
    List<ImmutableList<Comment>> groups = new ArrayList<>();
    ImmutableList.Builder<Comment> group = null;
    int prevLine = -1;
    for (Comment comment : comments) {
      if (group == null || comment.getLine() != prevLine + 1) {
        if (group != null) {
          groups.add(group.build());
        }
        group = ImmutableList.builder();
      }
      group.add(comment);
      prevLine = comment.getLine();
    }
    if (group != null) {
      groups.add(group.build());
    }
    return groups;
  }

  // load '(' STRING (COMMA [IDENTIFIER EQUALS] STRING)+ COMMA? ')'
  private Statement parseLoadStatement() {
    int loadOffset = expect(TokenKind.LOAD);
    int lparenOffset = expect(TokenKind.LPAREN);
    ElementStart moduleStart = beginElement(true);
    if (token.kind != TokenKind.STRING) {
      throw syntaxError("expected " + TokenKind.STRING);
    }
    StringLiteral module = parseStringLiteral();
    if (token.kind == TokenKind.RPAREN) {
      throw syntaxError("expected at least one symbol to load");
    }
    if (!endElement(module, moduleStart)) {
      throw syntaxError("expected " + TokenKind.COMMA);
    }

    List<LoadStatement.Binding> bindings = new ArrayList<>();
    while (token.kind != TokenKind.RPAREN) {
      ElementStart start = beginElement(false);
      LoadStatement.Binding binding = parseLoadSymbol();
      boolean comma = endElement(binding, start);
      bindings.add(binding);
      if (!comma) {
        break;
      }
    }
    if (bindings.isEmpty()) {
      throw syntaxError("expected at least one symbol to load");
    }

    ImmutableList<Comment> after = takeCommentsBefore(token.start);
    int rparenOffset = expect(TokenKind.RPAREN);
    LoadStatement load =
        new LoadStatement(locs, loadOffset, module, ImmutableList.copyOf(bindings), rparenOffset);
    load.setAfterComments(after);
    load.setForceMultiLine(line(lparenOffset) != line(rparenOffset));
    return load;
  }

  /**
   * Parses the next symbol argument of a load statement.
   *
   * <p>The symbol is either "name" (STRING) or local = "name" (IDENTIFIER EQUALS STRING).
   */
  private LoadStatement.Binding parseLoadSymbol() {
    if (token.kind == TokenKind.STRING) {
      // load(..., "name")
      return new LoadStatement.Binding(locs, null, parseStringLiteral());
    }
    if (token.kind != TokenKind.IDENTIFIER) {
      throw syntaxError("expected either a literal string or an identifier");
    }
    // load(..., local = "orig")
    Identifier local = parseIdent();
    expect(TokenKind.EQUALS);
    if (token.kind != TokenKind.STRING) {
      throw syntaxError("expected " + TokenKind.STRING);
    }
    return new LoadStatement.Binding(locs, local, parseStringLiteral());
  }

  //     small_stmt = assign_stmt
  //                | expr
  //                | load_stmt
  //
  //     assign_stmt = expr ('=' | augassign) expr
  //
  //     augassign = '+=' | '-=' | '*=' | '/=' | '%=' | '//=' | '&=' | '|=' | '^=' |'<<=' | '>>='
  private Statement parseSmallStatement() {
    if (UNSUPPORTED_STATEMENTS.contains(token.kind)) {
      throw reportError(
          token.start, "'%s' statements are not supported in BUILD files", token.kind);
    }

    // load
    if (token.kind == TokenKind.LOAD) {
      return parseLoadStatement();
    }

    Expression lhs = parseExpr();

    // lhs = rhs  or  lhs += rhs
    TokenKind op = augmentedAssignments.get(token.kind);
    if (token.kind == TokenKind.EQUALS || op != null) {
      int opOffset = nextToken();
      Expression rhs = parseExpr();
      // op == null for ordinary assignment.
      return new AssignmentStatement(locs, lhs, op, opOffset, rhs);
    } else {
      return new ExpressionStatement(locs, lhs);
    }
  }
}
