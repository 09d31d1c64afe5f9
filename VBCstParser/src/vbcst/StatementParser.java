package vbcst;

import java.util.Optional;
import java.util.function.BooleanSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Recursive-descent dispatcher for modules, declarations and statements.
 *
 * <p>Block forms recurse into a statement list that runs until a terminator predicate matches,
 * usually {@code End} followed by the block's keyword. Every list also stops at the boundary of the
 * enclosing procedure, so an unclosed block cannot swallow the rest of the file.
 */
final class StatementParser {
  private static final Logger logger = LogManager.getLogger(StatementParser.class);

  private static final ImmutableSet<SyntaxKind> MODIFIERS =
      Sets.immutableEnumSet(
          SyntaxKind.PUBLIC_KEYWORD,
          SyntaxKind.PRIVATE_KEYWORD,
          SyntaxKind.FRIEND_KEYWORD,
          SyntaxKind.GLOBAL_KEYWORD,
          SyntaxKind.STATIC_KEYWORD);

  private static final ImmutableSet<SyntaxKind> PARAMETER_MODIFIERS =
      Sets.immutableEnumSet(
          SyntaxKind.OPTIONAL_KEYWORD,
          SyntaxKind.BY_VAL_KEYWORD,
          SyntaxKind.BY_REF_KEYWORD,
          SyntaxKind.PARAM_ARRAY_KEYWORD);

  private static final ImmutableSet<SyntaxKind> DEF_TYPES =
      Sets.immutableEnumSet(
          SyntaxKind.DEF_BOOL_KEYWORD,
          SyntaxKind.DEF_BYTE_KEYWORD,
          SyntaxKind.DEF_CUR_KEYWORD,
          SyntaxKind.DEF_DATE_KEYWORD,
          SyntaxKind.DEF_DBL_KEYWORD,
          SyntaxKind.DEF_DEC_KEYWORD,
          SyntaxKind.DEF_INT_KEYWORD,
          SyntaxKind.DEF_LNG_KEYWORD,
          SyntaxKind.DEF_OBJ_KEYWORD,
          SyntaxKind.DEF_SNG_KEYWORD,
          SyntaxKind.DEF_STR_KEYWORD,
          SyntaxKind.DEF_VAR_KEYWORD);

  private static final ImmutableSet<SyntaxKind> COMPARISON_OPERATORS =
      Sets.immutableEnumSet(
          SyntaxKind.EQUALITY_OPERATOR,
          SyntaxKind.INEQUALITY_OPERATOR,
          SyntaxKind.LESS_THAN_OPERATOR,
          SyntaxKind.GREATER_THAN_OPERATOR,
          SyntaxKind.LESS_THAN_OR_EQUAL_OPERATOR,
          SyntaxKind.GREATER_THAN_OR_EQUAL_OPERATOR);

  // Keywords that form a complete statement or close a block on their own; never labels.
  private static final ImmutableSet<SyntaxKind> NEVER_LABELS =
      Sets.immutableEnumSet(
          SyntaxKind.ELSE_KEYWORD,
          SyntaxKind.END_KEYWORD,
          SyntaxKind.LOOP_KEYWORD,
          SyntaxKind.NEXT_KEYWORD,
          SyntaxKind.WEND_KEYWORD,
          SyntaxKind.DO_KEYWORD,
          SyntaxKind.RETURN_KEYWORD,
          SyntaxKind.RESUME_KEYWORD,
          SyntaxKind.BEEP_KEYWORD,
          SyntaxKind.STOP_KEYWORD,
          SyntaxKind.RESET_KEYWORD,
          SyntaxKind.RANDOMIZE_KEYWORD);

  // Tokens allowed outside parentheses on the left of an assignment.
  private static final ImmutableSet<SyntaxKind> ASSIGNMENT_TARGET_TOKENS =
      Sets.immutableEnumSet(
          SyntaxKind.WHITESPACE,
          SyntaxKind.IDENTIFIER,
          SyntaxKind.PERIOD_OPERATOR,
          SyntaxKind.EXCLAMATION_MARK,
          SyntaxKind.COMMA,
          SyntaxKind.INTEGER_LITERAL,
          SyntaxKind.LONG_LITERAL,
          SyntaxKind.SINGLE_LITERAL,
          SyntaxKind.DOUBLE_LITERAL,
          SyntaxKind.CURRENCY_LITERAL,
          SyntaxKind.DOLLAR_SIGN,
          SyntaxKind.PERCENT,
          SyntaxKind.AMPERSAND,
          SyntaxKind.OCTOTHORPE,
          SyntaxKind.AT_SIGN,
          SyntaxKind.LEFT_SQUARE_BRACKET,
          SyntaxKind.RIGHT_SQUARE_BRACKET);

  private static final ImmutableMap<SyntaxKind, SyntaxKind> BUILTINS =
      ImmutableMap.<SyntaxKind, SyntaxKind>builder()
          .put(SyntaxKind.APP_ACTIVATE_KEYWORD, SyntaxKind.APP_ACTIVATE_STATEMENT)
          .put(SyntaxKind.BEEP_KEYWORD, SyntaxKind.BEEP_STATEMENT)
          .put(SyntaxKind.CH_DIR_KEYWORD, SyntaxKind.CH_DIR_STATEMENT)
          .put(SyntaxKind.CH_DRIVE_KEYWORD, SyntaxKind.CH_DRIVE_STATEMENT)
          .put(SyntaxKind.CLOSE_KEYWORD, SyntaxKind.CLOSE_STATEMENT)
          .put(SyntaxKind.DATE_KEYWORD, SyntaxKind.DATE_STATEMENT)
          .put(SyntaxKind.DELETE_SETTING_KEYWORD, SyntaxKind.DELETE_SETTING_STATEMENT)
          .put(SyntaxKind.ERROR_KEYWORD, SyntaxKind.ERROR_STATEMENT)
          .put(SyntaxKind.FILE_COPY_KEYWORD, SyntaxKind.FILE_COPY_STATEMENT)
          .put(SyntaxKind.GET_KEYWORD, SyntaxKind.GET_STATEMENT)
          .put(SyntaxKind.PUT_KEYWORD, SyntaxKind.PUT_STATEMENT)
          .put(SyntaxKind.INPUT_KEYWORD, SyntaxKind.INPUT_STATEMENT)
          .put(SyntaxKind.KILL_KEYWORD, SyntaxKind.KILL_STATEMENT)
          .put(SyntaxKind.LOAD_KEYWORD, SyntaxKind.LOAD_STATEMENT)
          .put(SyntaxKind.UNLOAD_KEYWORD, SyntaxKind.UNLOAD_STATEMENT)
          .put(SyntaxKind.LOCK_KEYWORD, SyntaxKind.LOCK_STATEMENT)
          .put(SyntaxKind.UNLOCK_KEYWORD, SyntaxKind.UNLOCK_STATEMENT)
          .put(SyntaxKind.L_SET_KEYWORD, SyntaxKind.L_SET_STATEMENT)
          .put(SyntaxKind.R_SET_KEYWORD, SyntaxKind.R_SET_STATEMENT)
          .put(SyntaxKind.MID_KEYWORD, SyntaxKind.MID_STATEMENT)
          .put(SyntaxKind.MID_B_KEYWORD, SyntaxKind.MID_B_STATEMENT)
          .put(SyntaxKind.MK_DIR_KEYWORD, SyntaxKind.MK_DIR_STATEMENT)
          .put(SyntaxKind.RM_DIR_KEYWORD, SyntaxKind.RM_DIR_STATEMENT)
          .put(SyntaxKind.NAME_KEYWORD, SyntaxKind.NAME_STATEMENT)
          .put(SyntaxKind.OPEN_KEYWORD, SyntaxKind.OPEN_STATEMENT)
          .put(SyntaxKind.PRINT_KEYWORD, SyntaxKind.PRINT_STATEMENT)
          .put(SyntaxKind.RANDOMIZE_KEYWORD, SyntaxKind.RANDOMIZE_STATEMENT)
          .put(SyntaxKind.RESET_KEYWORD, SyntaxKind.RESET_STATEMENT)
          .put(SyntaxKind.SAVE_PICTURE_KEYWORD, SyntaxKind.SAVE_PICTURE_STATEMENT)
          .put(SyntaxKind.SAVE_SETTING_KEYWORD, SyntaxKind.SAVE_SETTING_STATEMENT)
          .put(SyntaxKind.SEEK_KEYWORD, SyntaxKind.SEEK_STATEMENT)
          .put(SyntaxKind.SEND_KEYS_KEYWORD, SyntaxKind.SEND_KEYS_STATEMENT)
          .put(SyntaxKind.SET_ATTR_KEYWORD, SyntaxKind.SET_ATTR_STATEMENT)
          .put(SyntaxKind.STOP_KEYWORD, SyntaxKind.STOP_STATEMENT)
          .put(SyntaxKind.TIME_KEYWORD, SyntaxKind.TIME_STATEMENT)
          .put(SyntaxKind.WIDTH_KEYWORD, SyntaxKind.WIDTH_STATEMENT)
          .put(SyntaxKind.WRITE_KEYWORD, SyntaxKind.WRITE_STATEMENT)
          .build();

  private final ParserState state;
  private final TreeBuilder builder;
  private final ExpressionParser expressions;

  StatementParser(ParserState state) {
    this.state = state;
    this.builder = state.builder();
    this.expressions = new ExpressionParser(state);
  }

  void parseModule() {
    builder.startNode(SyntaxKind.ROOT);
    while (!state.isAtEnd()) {
      int before = state.position();
      parseModuleItem();
      if (state.position() == before) skipUnexpected();
    }
    builder.finishNode();
  }

  private void parseModuleItem() {
    SyntaxKind kind = state.current().kind();
    if (kind.isTrivia() || kind == SyntaxKind.COLON_OPERATOR) {
      state.consume();
      return;
    }

    switch (kind) {
      case VERSION_KEYWORD:
      case OBJECT_KEYWORD:
      case BEGIN_KEYWORD:
        if (state.parsingHeader()) {
          parseHeaderItem(kind);
        } else if (isAtLabel()) {
          parseLabel();
        } else {
          // A name that collides with a header keyword cannot start a statement at module scope.
          state.addDiagnostic(
              String.format("%s is only valid in the file header", state.describeCurrent()));
          state.consumeAsUnknown();
        }
        return;
      default:
        parseStatement();
    }
  }

  private void parseHeaderItem(SyntaxKind kind) {
    switch (kind) {
      case VERSION_KEYWORD:
        parseHeaderLine(SyntaxKind.VERSION_STATEMENT);
        break;
      case OBJECT_KEYWORD:
        parseHeaderLine(SyntaxKind.OBJECT_STATEMENT);
        break;
      default:
        nested(this::parsePropertiesBlock);
    }
  }

  // Header lines keep the header flag set.
  private void parseHeaderLine(SyntaxKind kind) {
    builder.startNode(kind);
    state.consumeRestOfStatement();
    state.finishStatement();
    builder.finishNode();
  }

  /** Parses one statement starting at a significant token. */
  void parseStatement() {
    SyntaxKind kind = state.current().kind();
    if (isAtLabel()) {
      parseLabel();
      return;
    }

    switch (kind) {
      case IF_KEYWORD:
        nested(this::parseIf);
        return;
      case SELECT_KEYWORD:
        if (state.peekSignificantIs(1, SyntaxKind.CASE_KEYWORD)) {
          nested(this::parseSelectCase);
          return;
        }
        break;
      case DO_KEYWORD:
        nested(this::parseDo);
        return;
      case FOR_KEYWORD:
        if (state.peekSignificantIs(1, SyntaxKind.EACH_KEYWORD)) {
          nested(this::parseForEach);
        } else {
          nested(this::parseFor);
        }
        return;
      case WHILE_KEYWORD:
        nested(this::parseWhile);
        return;
      case WITH_KEYWORD:
        nested(this::parseWith);
        return;
      case SUB_KEYWORD:
      case FUNCTION_KEYWORD:
      case PROPERTY_KEYWORD:
        nested(this::parseProcedure);
        return;
      case PUBLIC_KEYWORD:
      case PRIVATE_KEYWORD:
      case FRIEND_KEYWORD:
      case GLOBAL_KEYWORD:
      case STATIC_KEYWORD:
        parseModifierLed();
        return;
      case DIM_KEYWORD:
        parseDeclaration(SyntaxKind.DIM_STATEMENT);
        return;
      case CONST_KEYWORD:
        parseDeclaration(SyntaxKind.CONST_STATEMENT);
        return;
      case RE_DIM_KEYWORD:
        parseReDim();
        return;
      case ERASE_KEYWORD:
        parseSimpleLine(SyntaxKind.ERASE_STATEMENT);
        return;
      case DECLARE_KEYWORD:
        parseDeclare();
        return;
      case EVENT_KEYWORD:
        parseEvent();
        return;
      case IMPLEMENTS_KEYWORD:
        parseSimpleLine(SyntaxKind.IMPLEMENTS_STATEMENT);
        return;
      case TYPE_KEYWORD:
        if (!state.peekSignificantIs(1, SyntaxKind.EQUALITY_OPERATOR)) {
          parseMemberBlock(SyntaxKind.TYPE_STATEMENT, SyntaxKind.TYPE_KEYWORD);
          return;
        }
        break;
      case ENUM_KEYWORD:
        parseMemberBlock(SyntaxKind.ENUM_STATEMENT, SyntaxKind.ENUM_KEYWORD);
        return;
      case ATTRIBUTE_KEYWORD:
        // Attribute lines may follow the header without ending it.
        parseHeaderLine(SyntaxKind.ATTRIBUTE_STATEMENT);
        return;
      case OPTION_KEYWORD:
        parseSimpleLine(SyntaxKind.OPTION_STATEMENT);
        return;
      case CALL_KEYWORD:
        parseKeywordExpression(SyntaxKind.CALL_STATEMENT);
        return;
      case RAISE_EVENT_KEYWORD:
        parseKeywordExpression(SyntaxKind.RAISE_EVENT_STATEMENT);
        return;
      case SET_KEYWORD:
        parseKeywordAssignment(SyntaxKind.SET_STATEMENT);
        return;
      case LET_KEYWORD:
        parseKeywordAssignment(SyntaxKind.LET_STATEMENT);
        return;
      case GOTO_KEYWORD:
        parseSimpleLine(SyntaxKind.GOTO_STATEMENT);
        return;
      case GO_SUB_KEYWORD:
        parseSimpleLine(SyntaxKind.GO_SUB_STATEMENT);
        return;
      case RETURN_KEYWORD:
        parseSimpleLine(SyntaxKind.RETURN_STATEMENT);
        return;
      case RESUME_KEYWORD:
        parseSimpleLine(SyntaxKind.RESUME_STATEMENT);
        return;
      case EXIT_KEYWORD:
        parseSimpleLine(SyntaxKind.EXIT_STATEMENT);
        return;
      case ON_KEYWORD:
        parseOn();
        return;
      case END_KEYWORD:
        if (state.isStatementEnd(state.significantIndex(1))) {
          parseSimpleLine(SyntaxKind.END_STATEMENT);
        } else {
          parseStrayLine("unexpected %s without a matching block");
        }
        return;
      case LINE_KEYWORD:
        if (state.peekSignificantIs(1, SyntaxKind.INPUT_KEYWORD)) {
          parseSimpleLine(SyntaxKind.LINE_INPUT_STATEMENT);
          return;
        }
        break;
      case LOOP_KEYWORD:
      case NEXT_KEYWORD:
      case WEND_KEYWORD:
      case CASE_KEYWORD:
      case ELSE_KEYWORD:
      case ELSE_IF_KEYWORD:
        parseStrayLine("unexpected %s without a matching block");
        return;
      default:
        if (DEF_TYPES.contains(kind)) {
          parseSimpleLine(SyntaxKind.DEF_TYPE_STATEMENT);
          return;
        }
    }

    if (isAtBuiltin()) {
      parseSimpleLine(BUILTINS.get(kind));
    } else if (isAtAssignment(state.position())) {
      parseAssignment();
    } else if (isAtImplicitCall()) {
      parseSimpleLine(SyntaxKind.CALL_STATEMENT);
    } else if (kind.isKeyword()) {
      parseStrayLine("unexpected %s in statement position");
    } else {
      skipUnexpected();
    }
  }

  private void startStatement(SyntaxKind kind) {
    state.leaveHeader();
    builder.startNode(kind);
  }

  /** Runs a block form, or keeps its opening line verbatim once the nesting limit is reached. */
  private void nested(Runnable block) {
    if (!state.enterNesting()) {
      state.leaveHeader();
      state.truncateLine();
      state.finishStatement();
      return;
    }
    try {
      block.run();
    } finally {
      state.exitNesting();
    }
  }

  // Statement lists

  private void parseStatementList(BooleanSupplier stop) {
    builder.startNode(SyntaxKind.STATEMENT_LIST);
    while (!state.isAtEnd()) {
      SyntaxKind kind = state.current().kind();
      if (kind == SyntaxKind.NEWLINE && state.inline()) break;
      if (kind.isTrivia() || kind == SyntaxKind.COLON_OPERATOR) {
        state.consume();
        continue;
      }
      if (stop.getAsBoolean()) break;

      int before = state.position();
      parseStatement();
      if (state.position() == before) skipUnexpected();
    }
    builder.finishNode();
  }

  private boolean atEndOf(SyntaxKind keyword) {
    return state.peekSignificantIs(0, SyntaxKind.END_KEYWORD)
        && state.peekSignificantIs(1, keyword);
  }

  /** True at the start of a Sub, Function or Property declaration, modifiers included. */
  private boolean atProcedureStart() {
    int index = state.significantIndex(0);
    while (state.kindAt(index).map(MODIFIERS::contains).orElse(false)) {
      index = state.skipWhitespace(index + 1);
    }
    Optional<SyntaxKind> kind = state.kindAt(index);
    return kind.isPresent()
        && (kind.get() == SyntaxKind.SUB_KEYWORD
            || kind.get() == SyntaxKind.FUNCTION_KEYWORD
            || kind.get() == SyntaxKind.PROPERTY_KEYWORD);
  }

  private boolean atEnclosingBoundary() {
    return atProcedureStart() || state.procedureKeyword().map(this::atEndOf).orElse(false);
  }

  private void parseEndLine() {
    state.consumeWhitespace();
    state.consume();
    state.consumeWhitespace();
    state.consume();
    state.finishStatement();
  }

  private void expectEnd(SyntaxKind keyword) {
    if (atEndOf(keyword)) {
      parseEndLine();
    } else {
      state.addDiagnostic(String.format("missing 'End %s'", keyword.text().get()));
    }
  }

  private boolean isLineEnd(int index) {
    Optional<SyntaxKind> kind = state.kindAt(index);
    return !kind.isPresent() || kind.get() == SyntaxKind.NEWLINE || kind.get().isComment();
  }

  // Ends a block's opening line when nothing else follows on it.
  private void finishHeaderLine() {
    if (isLineEnd(state.skipWhitespace(state.position()))) {
      state.finishStatement();
    } else {
      state.consumeWhitespace();
    }
  }

  private void expect(SyntaxKind kind) {
    if (state.at(kind)) {
      state.consume();
    } else {
      state.addDiagnostic(
          String.format("expected '%s', found %s", kind.text().get(), state.describeCurrent()));
    }
  }

  // Simple forms

  private void parseSimpleLine(SyntaxKind kind) {
    startStatement(kind);
    state.consumeRestOfStatement();
    state.finishStatement();
    builder.finishNode();
  }

  // Keeps the rest of the statement as unknown leaves.
  private void parseStrayLine(String format) {
    state.leaveHeader();
    state.addDiagnostic(String.format(format, state.describeCurrent()));
    state.consumeAsUnknownUntil(false);
    state.finishStatement();
  }

  private void skipUnexpected() {
    state.addDiagnostic(
        String.format("unexpected %s in statement position", state.describeCurrent()));
    state.consumeAsUnknown();
  }

  private boolean isAtLabel() {
    int pos = state.position();
    SyntaxKind kind = state.current().kind();
    boolean eligible =
        kind == SyntaxKind.IDENTIFIER
            || kind == SyntaxKind.INTEGER_LITERAL
            || (kind.isKeyword() && !state.parsingHeader() && !NEVER_LABELS.contains(kind));
    return eligible
        && state.isAt(pos + 1, SyntaxKind.COLON_OPERATOR)
        && !state.isAt(pos + 2, SyntaxKind.EQUALITY_OPERATOR);
  }

  private void parseLabel() {
    startStatement(SyntaxKind.LABEL_STATEMENT);
    state.consume();
    state.consume();
    if (isLineEnd(state.skipWhitespace(state.position()))) state.finishStatement();
    builder.finishNode();
  }

  private boolean isAtBuiltin() {
    SyntaxKind kind = state.current().kind();
    if (!BUILTINS.containsKey(kind)) return false;

    Optional<SyntaxKind> next = state.peekSignificant(1);
    if (!next.isPresent()) return true;
    switch (next.get()) {
      case PERIOD_OPERATOR:
      case EXCLAMATION_MARK:
        return false;
      case EQUALITY_OPERATOR:
        // Date = ... and Time = ... set the system clock.
        return kind == SyntaxKind.DATE_KEYWORD || kind == SyntaxKind.TIME_KEYWORD;
      default:
        return true;
    }
  }

  /**
   * Scans ahead without consuming for a top-level {@code =} that makes the statement an assignment.
   * Names, member operators, type suffixes, brackets and anything inside parentheses may precede
   * it. A keyword is allowed only first or right after a member operator.
   */
  boolean isAtAssignment(int start) {
    int depth = 0;
    boolean afterMemberOperator = false;
    int index = start;
    while (true) {
      int continued = state.continuationEnd(index);
      if (continued >= 0) {
        index = continued;
        continue;
      }

      Optional<SyntaxKind> next = state.kindAt(index);
      if (!next.isPresent()) return false;
      SyntaxKind kind = next.get();
      if (kind == SyntaxKind.NEWLINE || kind.isComment()) return false;

      if (kind == SyntaxKind.LEFT_PARENTHESIS) {
        depth++;
      } else if (kind == SyntaxKind.RIGHT_PARENTHESIS) {
        if (depth == 0) return false;
        depth--;
      } else if (depth == 0) {
        if (kind == SyntaxKind.EQUALITY_OPERATOR) return true;
        boolean allowed =
            ASSIGNMENT_TARGET_TOKENS.contains(kind)
                || (kind.isKeyword() && (index == start || afterMemberOperator));
        if (!allowed) return false;
      }

      if (kind != SyntaxKind.WHITESPACE) {
        afterMemberOperator =
            kind == SyntaxKind.PERIOD_OPERATOR || kind == SyntaxKind.EXCLAMATION_MARK;
      }
      index++;
    }
  }

  private boolean isAtImplicitCall() {
    SyntaxKind kind = state.current().kind();
    return kind == SyntaxKind.IDENTIFIER
        || kind == SyntaxKind.PERIOD_OPERATOR
        || kind == SyntaxKind.EXCLAMATION_MARK
        || kind == SyntaxKind.LEFT_SQUARE_BRACKET
        || (kind.isKeyword() && ExpressionParser.canStartExpression(kind));
  }

  private void parseAssignment() {
    startStatement(SyntaxKind.ASSIGNMENT_STATEMENT);
    expressions.parseLvalue();
    state.consumeWhitespace();
    expect(SyntaxKind.EQUALITY_OPERATOR);
    state.consumeWhitespace();
    expressions.parseExpression();
    state.finishStatement();
    builder.finishNode();
  }

  private void parseKeywordAssignment(SyntaxKind kind) {
    startStatement(kind);
    state.consume();
    state.consumeWhitespace();
    expressions.parseLvalue();
    state.consumeWhitespace();
    expect(SyntaxKind.EQUALITY_OPERATOR);
    state.consumeWhitespace();
    expressions.parseExpression();
    state.finishStatement();
    builder.finishNode();
  }

  private void parseKeywordExpression(SyntaxKind kind) {
    startStatement(kind);
    state.consume();
    state.consumeWhitespace();
    expressions.parseExpression();
    state.finishStatement();
    builder.finishNode();
  }

  private void parseOn() {
    if (state.peekSignificantIs(1, SyntaxKind.ERROR_KEYWORD)) {
      parseSimpleLine(SyntaxKind.ON_ERROR_STATEMENT);
      return;
    }

    startStatement(
        statementContains(SyntaxKind.GO_SUB_KEYWORD)
            ? SyntaxKind.ON_GO_SUB_STATEMENT
            : SyntaxKind.ON_GO_TO_STATEMENT);
    state.consume();
    state.consumeWhitespace();
    expressions.parseExpression();
    state.consumeRestOfStatement();
    state.finishStatement();
    builder.finishNode();
  }

  private boolean statementContains(SyntaxKind kind) {
    int index = state.position();
    while (!state.isStatementEnd(index)) {
      int continued = state.continuationEnd(index);
      if (continued >= 0) {
        index = continued;
        continue;
      }
      if (state.isAt(index, kind)) return true;
      index++;
    }
    return false;
  }

  // If

  private void parseIf() {
    startStatement(SyntaxKind.IF_STATEMENT);
    state.consume();
    state.consumeWhitespace();
    expressions.parseExpression();
    state.consumeWhitespace();

    boolean sawThen = state.at(SyntaxKind.THEN_KEYWORD);
    expect(SyntaxKind.THEN_KEYWORD);
    if (sawThen && !isLineEnd(state.skipWhitespace(state.position()))) {
      parseSingleLineIfBody();
    } else {
      parseBlockIfBody();
    }
    builder.finishNode();
  }

  private void parseSingleLineIfBody() {
    state.enterInline();
    try {
      parseInlineStatements();
      if (state.at(SyntaxKind.ELSE_KEYWORD)) {
        builder.startNode(SyntaxKind.ELSE_CLAUSE);
        state.consume();
        parseInlineStatements();
        builder.finishNode();
      }
    } finally {
      state.exitInline();
    }
    state.finishStatement();
  }

  private void parseInlineStatements() {
    while (!state.isAtEnd()) {
      SyntaxKind kind = state.current().kind();
      if (kind == SyntaxKind.NEWLINE || kind.isComment() || kind == SyntaxKind.ELSE_KEYWORD) {
        return;
      }
      if (kind == SyntaxKind.WHITESPACE
          || kind == SyntaxKind.COLON_OPERATOR
          || state.continuationEnd(state.position()) >= 0) {
        int end = Math.max(state.position() + 1, state.skipWhitespace(state.position()));
        while (state.position() < end) state.consume();
        continue;
      }

      int before = state.position();
      parseStatement();
      if (state.position() == before) skipUnexpected();
    }
  }

  private void parseBlockIfBody() {
    state.finishStatement();
    BooleanSupplier stop =
        () ->
            state.at(SyntaxKind.ELSE_IF_KEYWORD)
                || state.at(SyntaxKind.ELSE_KEYWORD)
                || atEndOf(SyntaxKind.IF_KEYWORD)
                || atEnclosingBoundary();
    parseStatementList(stop);

    while (state.at(SyntaxKind.ELSE_IF_KEYWORD)) {
      builder.startNode(SyntaxKind.ELSE_IF_CLAUSE);
      state.consume();
      state.consumeWhitespace();
      expressions.parseExpression();
      state.consumeWhitespace();
      expect(SyntaxKind.THEN_KEYWORD);
      state.finishStatement();
      parseStatementList(stop);
      builder.finishNode();
    }

    if (state.at(SyntaxKind.ELSE_KEYWORD)) {
      builder.startNode(SyntaxKind.ELSE_CLAUSE);
      state.consume();
      finishHeaderLine();
      parseStatementList(stop);
      builder.finishNode();
    }

    expectEnd(SyntaxKind.IF_KEYWORD);
  }

  // Select Case

  private void parseSelectCase() {
    startStatement(SyntaxKind.SELECT_CASE_STATEMENT);
    state.consume();
    state.consumeWhitespace();
    state.consume();
    state.consumeWhitespace();
    expressions.parseExpression();
    state.finishStatement();

    while (!state.isAtEnd()) {
      SyntaxKind kind = state.current().kind();
      if (kind == SyntaxKind.NEWLINE && state.inline()) break;
      if (kind.isTrivia() || kind == SyntaxKind.COLON_OPERATOR) {
        state.consume();
      } else if (kind == SyntaxKind.CASE_KEYWORD) {
        parseCaseClause();
      } else if (atEndOf(SyntaxKind.SELECT_KEYWORD) || atEnclosingBoundary()) {
        break;
      } else {
        int before = state.position();
        state.addDiagnostic(String.format("expected 'Case', found %s", state.describeCurrent()));
        state.consumeAsUnknownUntil(false);
        state.finishStatement();
        // An Else of a single-line If ends no statement here.
        if (state.position() == before) state.consumeAsUnknown();
      }
    }

    expectEnd(SyntaxKind.SELECT_KEYWORD);
    builder.finishNode();
  }

  private void parseCaseClause() {
    boolean isElse = state.peekSignificantIs(1, SyntaxKind.ELSE_KEYWORD);
    builder.startNode(isElse ? SyntaxKind.CASE_ELSE_CLAUSE : SyntaxKind.CASE_CLAUSE);
    state.consume();
    state.consumeWhitespace();
    if (isElse) {
      state.consume();
    } else {
      parseCaseItems();
    }
    finishHeaderLine();
    parseStatementList(
        () ->
            state.at(SyntaxKind.CASE_KEYWORD)
                || atEndOf(SyntaxKind.SELECT_KEYWORD)
                || atEnclosingBoundary());
    builder.finishNode();
  }

  // x, a To b, Is > y
  private void parseCaseItems() {
    while (!state.atStatementEnd()) {
      if (state.at(SyntaxKind.COMMA)) {
        state.consume();
      } else if (state.at(SyntaxKind.IS_KEYWORD)) {
        state.consume();
        state.consumeWhitespace();
        if (!state.isAtEnd() && COMPARISON_OPERATORS.contains(state.current().kind())) {
          state.consume();
          state.consumeWhitespace();
        }
        expressions.parseExpression();
      } else if (expressions.canStartExpression()) {
        expressions.parseExpression();
        if (state.peekSignificantIs(0, SyntaxKind.TO_KEYWORD)) {
          state.consumeWhitespace();
          state.consume();
          state.consumeWhitespace();
          expressions.parseExpression();
        }
      } else {
        return;
      }
      state.consumeWhitespace();
    }
  }

  // Loops

  private void parseDo() {
    startStatement(SyntaxKind.DO_STATEMENT);
    state.consume();
    parseLoopCondition();
    state.finishStatement();

    parseStatementList(() -> state.at(SyntaxKind.LOOP_KEYWORD) || atEnclosingBoundary());

    if (state.at(SyntaxKind.LOOP_KEYWORD)) {
      state.consume();
      parseLoopCondition();
      state.finishStatement();
    } else {
      state.addDiagnostic("missing 'Loop'");
    }
    builder.finishNode();
  }

  // Optional While/Until condition after Do or Loop.
  private void parseLoopCondition() {
    if (state.peekSignificantIs(0, SyntaxKind.WHILE_KEYWORD)
        || state.peekSignificantIs(0, SyntaxKind.UNTIL_KEYWORD)) {
      state.consumeWhitespace();
      state.consume();
      state.consumeWhitespace();
      expressions.parseExpression();
    }
  }

  private void parseFor() {
    startStatement(SyntaxKind.FOR_STATEMENT);
    state.consume();
    state.consumeWhitespace();
    expressions.parseLvalue();
    state.consumeWhitespace();
    expect(SyntaxKind.EQUALITY_OPERATOR);
    state.consumeWhitespace();
    expressions.parseExpression();
    state.consumeWhitespace();
    expect(SyntaxKind.TO_KEYWORD);
    state.consumeWhitespace();
    expressions.parseExpression();
    if (state.peekSignificantIs(0, SyntaxKind.STEP_KEYWORD)) {
      state.consumeWhitespace();
      state.consume();
      state.consumeWhitespace();
      expressions.parseExpression();
    }
    state.finishStatement();

    parseLoopBodyAndNext();
    builder.finishNode();
  }

  private void parseForEach() {
    startStatement(SyntaxKind.FOR_EACH_STATEMENT);
    state.consume();
    state.consumeWhitespace();
    state.consume();
    state.consumeWhitespace();
    expressions.parseLvalue();
    state.consumeWhitespace();
    expect(SyntaxKind.IN_KEYWORD);
    state.consumeWhitespace();
    expressions.parseExpression();
    state.finishStatement();

    parseLoopBodyAndNext();
    builder.finishNode();
  }

  private void parseLoopBodyAndNext() {
    parseStatementList(() -> state.at(SyntaxKind.NEXT_KEYWORD) || atEnclosingBoundary());
    if (state.at(SyntaxKind.NEXT_KEYWORD)) {
      state.consumeRestOfStatement();
      state.finishStatement();
    } else {
      state.addDiagnostic("missing 'Next'");
    }
  }

  private void parseWhile() {
    startStatement(SyntaxKind.WHILE_STATEMENT);
    state.consume();
    state.consumeWhitespace();
    expressions.parseExpression();
    state.finishStatement();

    parseStatementList(() -> state.at(SyntaxKind.WEND_KEYWORD) || atEnclosingBoundary());
    if (state.at(SyntaxKind.WEND_KEYWORD)) {
      state.consume();
      state.finishStatement();
    } else {
      state.addDiagnostic("missing 'Wend'");
    }
    builder.finishNode();
  }

  private void parseWith() {
    startStatement(SyntaxKind.WITH_STATEMENT);
    state.consume();
    state.consumeWhitespace();
    expressions.parseExpression();
    state.finishStatement();

    parseStatementList(() -> atEndOf(SyntaxKind.WITH_KEYWORD) || atEnclosingBoundary());
    expectEnd(SyntaxKind.WITH_KEYWORD);
    builder.finishNode();
  }

  // Procedures and declarations

  private void consumeModifiers() {
    while (!state.isAtEnd() && MODIFIERS.contains(state.current().kind())) {
      state.consume();
      state.consumeWhitespace();
    }
  }

  /**
   * Public, Private, Friend, Global and Static may lead a procedure, a declaration or a variable
   * list. Up to two significant tokens after the modifier decide which.
   */
  private void parseModifierLed() {
    Optional<SyntaxKind> next = state.peekSignificant(1);
    if (next.isPresent() && next.get() == SyntaxKind.STATIC_KEYWORD) {
      next = state.peekSignificant(2);
    }
    SyntaxKind kind = next.orElse(SyntaxKind.UNKNOWN);
    switch (kind) {
      case SUB_KEYWORD:
      case FUNCTION_KEYWORD:
      case PROPERTY_KEYWORD:
        nested(this::parseProcedure);
        break;
      case DECLARE_KEYWORD:
        parseDeclare();
        break;
      case EVENT_KEYWORD:
        parseEvent();
        break;
      case TYPE_KEYWORD:
        parseMemberBlock(SyntaxKind.TYPE_STATEMENT, SyntaxKind.TYPE_KEYWORD);
        break;
      case ENUM_KEYWORD:
        parseMemberBlock(SyntaxKind.ENUM_STATEMENT, SyntaxKind.ENUM_KEYWORD);
        break;
      case CONST_KEYWORD:
        parseDeclaration(SyntaxKind.CONST_STATEMENT);
        break;
      default:
        parseDeclaration(SyntaxKind.DIM_STATEMENT);
    }
  }

  private void parseProcedure() {
    int index = state.significantIndex(0);
    while (state.kindAt(index).map(MODIFIERS::contains).orElse(false)) {
      index = state.skipWhitespace(index + 1);
    }
    SyntaxKind keyword = state.kindAt(index).get();
    SyntaxKind kind;
    switch (keyword) {
      case SUB_KEYWORD:
        kind = SyntaxKind.SUB_STATEMENT;
        break;
      case FUNCTION_KEYWORD:
        kind = SyntaxKind.FUNCTION_STATEMENT;
        break;
      default:
        kind = SyntaxKind.PROPERTY_STATEMENT;
    }

    startStatement(kind);
    consumeModifiers();
    state.consume();
    state.consumeWhitespace();
    if (keyword == SyntaxKind.PROPERTY_KEYWORD
        && (state.at(SyntaxKind.GET_KEYWORD)
            || state.at(SyntaxKind.LET_KEYWORD)
            || state.at(SyntaxKind.SET_KEYWORD))) {
      state.consume();
      state.consumeWhitespace();
    }
    parseDeclaredName();
    logger.trace("{} at token {}", kind.displayName(), state.position());

    if (state.at(SyntaxKind.LEFT_PARENTHESIS)) parseParameterList();
    parseAsClauseIfPresent();
    state.finishStatement();

    Optional<SyntaxKind> enclosing = state.procedureKeyword();
    state.setProcedureKeyword(Optional.of(keyword));
    try {
      parseStatementList(() -> atEndOf(keyword) || atProcedureStart());
      expectEnd(keyword);
    } finally {
      state.setProcedureKeyword(enclosing);
    }
    builder.finishNode();
  }

  private void parseDeclaredName() {
    if (expressions.atName()) {
      expressions.consumeIdentifier();
    } else {
      state.addDiagnostic(String.format("expected name, found %s", state.describeCurrent()));
    }
  }

  private void parseParameterList() {
    builder.startNode(SyntaxKind.PARAMETER_LIST);
    state.consume();
    state.consumeWhitespace();
    while (!state.atStatementEnd() && !state.at(SyntaxKind.RIGHT_PARENTHESIS)) {
      if (state.at(SyntaxKind.COMMA)) {
        state.consume();
        state.consumeWhitespace();
        continue;
      }
      if (!expressions.atName()) break;
      parseParameter();
      state.consumeWhitespace();
    }
    expect(SyntaxKind.RIGHT_PARENTHESIS);
    builder.finishNode();
  }

  // [Optional] [ByVal|ByRef] [ParamArray] name[()] [As Type] [= default]
  private void parseParameter() {
    builder.startNode(SyntaxKind.PARAMETER);
    while (!state.isAtEnd()
        && PARAMETER_MODIFIERS.contains(state.current().kind())
        && state.kindAt(state.significantIndex(1)).map(SyntaxKind::isName).orElse(false)) {
      state.consume();
      state.consumeWhitespace();
    }
    parseDeclaredName();
    if (state.at(SyntaxKind.LEFT_PARENTHESIS)
        && state.isAt(state.position() + 1, SyntaxKind.RIGHT_PARENTHESIS)) {
      state.consume();
      state.consume();
    }
    parseAsClauseIfPresent();
    parseInitializerIfPresent();
    builder.finishNode();
  }

  private void parseAsClauseIfPresent() {
    if (!state.peekSignificantIs(0, SyntaxKind.AS_KEYWORD)) return;

    state.consumeWhitespace();
    state.consume();
    state.consumeWhitespace();
    if (state.at(SyntaxKind.NEW_KEYWORD)) {
      state.consume();
      state.consumeWhitespace();
    }
    if (!expressions.atName()) {
      state.addDiagnostic(String.format("expected type name, found %s", state.describeCurrent()));
      return;
    }
    expressions.consumeName();
    while (state.at(SyntaxKind.PERIOD_OPERATOR)
        && state.kindAt(state.position() + 1).map(SyntaxKind::isName).orElse(false)) {
      state.consume();
      expressions.consumeName();
    }
    if (state.at(SyntaxKind.LEFT_PARENTHESIS)
        && state.isAt(state.position() + 1, SyntaxKind.RIGHT_PARENTHESIS)) {
      state.consume();
      state.consume();
    }
    // String * 255
    if (state.peekSignificantIs(0, SyntaxKind.MULTIPLICATION_OPERATOR)) {
      state.consumeWhitespace();
      state.consume();
      state.consumeWhitespace();
      expressions.parseExpression(ExpressionParser.OPERAND_ONLY);
    }
  }

  private void parseInitializerIfPresent() {
    if (!state.peekSignificantIs(0, SyntaxKind.EQUALITY_OPERATOR)) return;
    state.consumeWhitespace();
    state.consume();
    state.consumeWhitespace();
    expressions.parseExpression();
  }

  private void parseDeclaration(SyntaxKind kind) {
    startStatement(kind);
    consumeModifiers();
    if (state.at(SyntaxKind.DIM_KEYWORD) || state.at(SyntaxKind.CONST_KEYWORD)) {
      state.consume();
      state.consumeWhitespace();
    }
    parseDeclarators();
    state.finishStatement();
    builder.finishNode();
  }

  // name[(bounds)] [As [New] Type] [= value], ...
  private void parseDeclarators() {
    while (!state.atStatementEnd()) {
      if (state.at(SyntaxKind.WITH_EVENTS_KEYWORD)) {
        state.consume();
        state.consumeWhitespace();
      }
      if (!expressions.atName()) return;
      expressions.consumeIdentifier();
      if (state.at(SyntaxKind.LEFT_PARENTHESIS)) parseBounds();
      parseAsClauseIfPresent();
      parseInitializerIfPresent();
      if (!state.peekSignificantIs(0, SyntaxKind.COMMA)) return;
      state.consumeWhitespace();
      state.consume();
      state.consumeWhitespace();
    }
  }

  // (10), (1 To 10, 0 To 5), ()
  private void parseBounds() {
    state.consume();
    state.consumeWhitespace();
    while (!state.atStatementEnd() && !state.at(SyntaxKind.RIGHT_PARENTHESIS)) {
      if (state.at(SyntaxKind.COMMA)) {
        state.consume();
      } else if (expressions.canStartExpression()) {
        expressions.parseExpression();
        if (state.peekSignificantIs(0, SyntaxKind.TO_KEYWORD)) {
          state.consumeWhitespace();
          state.consume();
          state.consumeWhitespace();
          expressions.parseExpression();
        }
      } else {
        break;
      }
      state.consumeWhitespace();
    }
    expect(SyntaxKind.RIGHT_PARENTHESIS);
  }

  private void parseReDim() {
    startStatement(SyntaxKind.RE_DIM_STATEMENT);
    state.consume();
    state.consumeWhitespace();
    if (state.at(SyntaxKind.PRESERVE_KEYWORD)) {
      state.consume();
      state.consumeWhitespace();
    }
    while (!state.atStatementEnd()) {
      if (!expressions.atName()) break;
      expressions.consumeName();
      while (state.at(SyntaxKind.PERIOD_OPERATOR)
          && state.kindAt(state.position() + 1).map(SyntaxKind::isName).orElse(false)) {
        state.consume();
        expressions.consumeName();
      }
      if (state.at(SyntaxKind.LEFT_PARENTHESIS)) parseBounds();
      parseAsClauseIfPresent();
      if (!state.peekSignificantIs(0, SyntaxKind.COMMA)) break;
      state.consumeWhitespace();
      state.consume();
      state.consumeWhitespace();
    }
    state.finishStatement();
    builder.finishNode();
  }

  // [Public] Declare Function Name Lib "x" [Alias "y"] (params) [As Type]
  private void parseDeclare() {
    startStatement(SyntaxKind.DECLARE_STATEMENT);
    consumeModifiers();
    while (!state.atStatementEnd() && !state.at(SyntaxKind.LEFT_PARENTHESIS)) {
      if (state.continuationEnd(state.position()) >= 0) {
        state.consumeWhitespace();
      } else {
        state.consume();
      }
    }
    if (state.at(SyntaxKind.LEFT_PARENTHESIS)) parseParameterList();
    parseAsClauseIfPresent();
    state.finishStatement();
    builder.finishNode();
  }

  private void parseEvent() {
    startStatement(SyntaxKind.EVENT_STATEMENT);
    consumeModifiers();
    state.consume();
    state.consumeWhitespace();
    parseDeclaredName();
    if (state.at(SyntaxKind.LEFT_PARENTHESIS)) parseParameterList();
    state.finishStatement();
    builder.finishNode();
  }

  /** Type and Enum blocks; member lines are kept verbatim. */
  private void parseMemberBlock(SyntaxKind kind, SyntaxKind keyword) {
    startStatement(kind);
    consumeModifiers();
    state.consume();
    state.consumeWhitespace();
    parseDeclaredName();
    state.finishStatement();

    while (!state.isAtEnd() && !atEndOf(keyword) && !atProcedureStart()) {
      SyntaxKind next = state.current().kind();
      if (next == SyntaxKind.NEWLINE && state.inline()) break;
      if (next.isTrivia() || next == SyntaxKind.COLON_OPERATOR) {
        state.consume();
      } else if (state.atStatementEnd()) {
        state.addDiagnostic(String.format("unexpected %s", state.describeCurrent()));
        state.consumeAsUnknown();
      } else {
        state.consumeRestOfStatement();
      }
    }
    expectEnd(keyword);
    builder.finishNode();
  }

  // Form and class headers

  /** {@code Begin VB.Form Form1 ... End}, or a bare {@code BEGIN ... END} in class files. */
  private void parsePropertiesBlock() {
    builder.startNode(SyntaxKind.PROPERTIES_BLOCK);
    state.consume();
    state.consumeWhitespace();
    if (expressions.atName()) {
      builder.startNode(SyntaxKind.PROPERTIES_TYPE);
      expressions.consumeName();
      while (state.at(SyntaxKind.PERIOD_OPERATOR)
          && state.kindAt(state.position() + 1).map(SyntaxKind::isName).orElse(false)) {
        state.consume();
        expressions.consumeName();
      }
      builder.finishNode();
      state.consumeWhitespace();
      if (expressions.atName()) {
        builder.startNode(SyntaxKind.PROPERTIES_NAME);
        expressions.consumeName();
        builder.finishNode();
      }
    }
    state.finishStatement();

    parsePropertiesBody();
    if (state.at(SyntaxKind.END_KEYWORD)) {
      state.consume();
      state.finishStatement();
    } else {
      state.addDiagnostic("missing 'End' for Begin block");
    }
    builder.finishNode();
  }

  // Stops before End or EndProperty.
  private void parsePropertiesBody() {
    while (!state.isAtEnd()) {
      SyntaxKind kind = state.current().kind();
      if (kind.isTrivia() || kind == SyntaxKind.COLON_OPERATOR) {
        state.consume();
      } else if (kind == SyntaxKind.END_KEYWORD || atWord("EndProperty")) {
        return;
      } else if (kind == SyntaxKind.BEGIN_KEYWORD) {
        nested(this::parsePropertiesBlock);
      } else if (atWord("BeginProperty")) {
        nested(this::parsePropertyGroup);
      } else {
        parseProperty();
      }
    }
  }

  private boolean atWord(String word) {
    return state.at(SyntaxKind.IDENTIFIER) && state.current().text().equalsIgnoreCase(word);
  }

  private void parsePropertyGroup() {
    builder.startNode(SyntaxKind.PROPERTY_GROUP);
    state.consume();
    state.consumeWhitespace();
    if (!state.atStatementEnd()) {
      builder.startNode(SyntaxKind.PROPERTY_GROUP_NAME);
      consumeUntilLineEnd();
      builder.finishNode();
    }
    state.finishStatement();

    parsePropertiesBody();
    if (atWord("EndProperty")) {
      state.consume();
      state.finishStatement();
    } else {
      state.addDiagnostic("missing 'EndProperty'");
    }
    builder.finishNode();
  }

  // Caption = "Form1", Picture = "Form1.frx":0000
  private void parseProperty() {
    builder.startNode(SyntaxKind.PROPERTY);
    builder.startNode(SyntaxKind.PROPERTY_KEY);
    while (!isLineEnd(state.position())
        && !state.at(SyntaxKind.EQUALITY_OPERATOR)
        && !(state.at(SyntaxKind.WHITESPACE)
            && state.isAt(state.skipWhitespace(state.position()), SyntaxKind.EQUALITY_OPERATOR))) {
      state.consume();
    }
    builder.finishNode();

    state.consumeWhitespace();
    if (state.at(SyntaxKind.EQUALITY_OPERATOR)) {
      state.consume();
      state.consumeWhitespace();
      builder.startNode(SyntaxKind.PROPERTY_VALUE);
      consumeUntilLineEnd();
      builder.finishNode();
    } else {
      state.addDiagnostic(String.format("expected '=', found %s", state.describeCurrent()));
    }
    state.consumeWhitespace();
    if (!isLineEnd(state.position())) {
      state.addDiagnostic(String.format("unexpected %s", state.describeCurrent()));
      state.consumeAsUnknownUntil(true);
    }
    if (!state.isAtEnd() && state.current().kind().isComment()) state.consume();
    if (state.at(SyntaxKind.NEWLINE)) state.consume();
    builder.finishNode();
  }

  // Colons do not end a property value; trailing whitespace is left out.
  private void consumeUntilLineEnd() {
    while (!isLineEnd(state.position())
        && !(state.at(SyntaxKind.WHITESPACE)
            && isLineEnd(state.skipWhitespace(state.position())))) {
      state.consume();
    }
  }
}
