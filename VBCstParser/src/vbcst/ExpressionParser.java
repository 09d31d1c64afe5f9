package vbcst;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

/**
 * Operator-precedence (Pratt) parser for expressions.
 *
 * <p>Each call starts at a significant token and leaves the cursor on the first token that is not
 * part of the expression. Whitespace after the expression is never consumed.
 */
final class ExpressionParser {

  /** Precedence levels, lowest first. */
  enum Precedence {
    IMP,
    EQV,
    XOR,
    OR,
    AND,
    NOT,
    COMPARISON,
    CONCATENATION,
    ADDITIVE,
    MODULUS,
    INTEGER_DIVISION,
    MULTIPLICATIVE,
    NEGATION,
    EXPONENTIATION;

    int leftBindingPower() {
      return (ordinal() + 1) * 2;
    }

    // Exponentiation is right-associative; everything else groups to the left.
    int rightBindingPower() {
      return this == EXPONENTIATION ? leftBindingPower() : leftBindingPower() + 1;
    }
  }

  enum BinaryOperator {
    IMP(SyntaxKind.IMP_KEYWORD, Precedence.IMP),
    EQV(SyntaxKind.EQV_KEYWORD, Precedence.EQV),
    XOR(SyntaxKind.XOR_KEYWORD, Precedence.XOR),
    OR(SyntaxKind.OR_KEYWORD, Precedence.OR),
    AND(SyntaxKind.AND_KEYWORD, Precedence.AND),
    EQUAL(SyntaxKind.EQUALITY_OPERATOR, Precedence.COMPARISON),
    NOT_EQUAL(SyntaxKind.INEQUALITY_OPERATOR, Precedence.COMPARISON),
    LESS_THAN(SyntaxKind.LESS_THAN_OPERATOR, Precedence.COMPARISON),
    GREATER_THAN(SyntaxKind.GREATER_THAN_OPERATOR, Precedence.COMPARISON),
    LESS_THAN_OR_EQUAL(SyntaxKind.LESS_THAN_OR_EQUAL_OPERATOR, Precedence.COMPARISON),
    GREATER_THAN_OR_EQUAL(SyntaxKind.GREATER_THAN_OR_EQUAL_OPERATOR, Precedence.COMPARISON),
    LIKE(SyntaxKind.LIKE_KEYWORD, Precedence.COMPARISON),
    IS(SyntaxKind.IS_KEYWORD, Precedence.COMPARISON),
    CONCATENATE(SyntaxKind.AMPERSAND, Precedence.CONCATENATION),
    ADD(SyntaxKind.ADDITION_OPERATOR, Precedence.ADDITIVE),
    SUBTRACT(SyntaxKind.SUBTRACTION_OPERATOR, Precedence.ADDITIVE),
    MOD(SyntaxKind.MOD_KEYWORD, Precedence.MODULUS),
    INTEGER_DIVIDE(SyntaxKind.BACKWARD_SLASH_OPERATOR, Precedence.INTEGER_DIVISION),
    MULTIPLY(SyntaxKind.MULTIPLICATION_OPERATOR, Precedence.MULTIPLICATIVE),
    DIVIDE(SyntaxKind.DIVISION_OPERATOR, Precedence.MULTIPLICATIVE),
    POWER(SyntaxKind.EXPONENTIATION_OPERATOR, Precedence.EXPONENTIATION);

    private final SyntaxKind kind;
    private final Precedence precedence;

    BinaryOperator(SyntaxKind kind, Precedence precedence) {
      this.kind = kind;
      this.precedence = precedence;
    }

    SyntaxKind kind() {
      return kind;
    }

    Precedence precedence() {
      return precedence;
    }

    private static final ImmutableMap<SyntaxKind, BinaryOperator> KIND_MAP =
        Maps.uniqueIndex(Arrays.asList(values()), BinaryOperator::kind);

    static Optional<BinaryOperator> of(SyntaxKind kind) {
      return Optional.ofNullable(KIND_MAP.get(kind));
    }
  }

  /** Accepts every operator. */
  static final int LOWEST = 0;

  /** Stops before any comparison, so the {@code =} of an assignment is never read as equality. */
  static final int LVALUE = Precedence.COMPARISON.leftBindingPower() + 1;

  // Binds tighter than any operator: a bare operand with its postfixes.
  static final int OPERAND_ONLY = Precedence.EXPONENTIATION.leftBindingPower() + 1;

  private static final ImmutableSet<SyntaxKind> NUMERIC_LITERALS =
      ImmutableSet.of(
          SyntaxKind.INTEGER_LITERAL,
          SyntaxKind.LONG_LITERAL,
          SyntaxKind.SINGLE_LITERAL,
          SyntaxKind.DOUBLE_LITERAL,
          SyntaxKind.CURRENCY_LITERAL);

  private static final ImmutableSet<SyntaxKind> OTHER_LITERALS =
      ImmutableSet.of(
          SyntaxKind.DATE_LITERAL,
          SyntaxKind.NOTHING_KEYWORD,
          SyntaxKind.NULL_KEYWORD,
          SyntaxKind.EMPTY_KEYWORD);

  // Keywords that delimit or join expressions and so never begin an operand.
  private static final ImmutableSet<SyntaxKind> NON_OPERAND_KEYWORDS =
      ImmutableSet.of(
          SyntaxKind.THEN_KEYWORD,
          SyntaxKind.ELSE_KEYWORD,
          SyntaxKind.ELSE_IF_KEYWORD,
          SyntaxKind.TO_KEYWORD,
          SyntaxKind.STEP_KEYWORD,
          SyntaxKind.AS_KEYWORD,
          SyntaxKind.IN_KEYWORD,
          SyntaxKind.IS_KEYWORD,
          SyntaxKind.AND_KEYWORD,
          SyntaxKind.OR_KEYWORD,
          SyntaxKind.XOR_KEYWORD,
          SyntaxKind.EQV_KEYWORD,
          SyntaxKind.IMP_KEYWORD,
          SyntaxKind.MOD_KEYWORD,
          SyntaxKind.LIKE_KEYWORD,
          SyntaxKind.EACH_KEYWORD,
          SyntaxKind.LIB_KEYWORD,
          SyntaxKind.ALIAS_KEYWORD,
          SyntaxKind.END_KEYWORD,
          SyntaxKind.LOOP_KEYWORD,
          SyntaxKind.WEND_KEYWORD,
          SyntaxKind.NEXT_KEYWORD,
          SyntaxKind.CASE_KEYWORD);

  private static final ImmutableSet<SyntaxKind> ALWAYS_FOLDED_SUFFIXES =
      ImmutableSet.of(
          SyntaxKind.DOLLAR_SIGN, SyntaxKind.PERCENT, SyntaxKind.OCTOTHORPE, SyntaxKind.AT_SIGN);

  // What a prefix term left behind, which decides whether postfixes and wrapping apply.
  private enum Term {
    BARE_NAME,
    POSTFIXABLE,
    CLOSED,
    MISSING;
  }

  private final ParserState state;
  private final TreeBuilder builder;

  ExpressionParser(ParserState state) {
    this.state = state;
    this.builder = state.builder();
  }

  boolean canStartExpression() {
    return !state.isAtEnd() && canStartExpression(state.current().kind());
  }

  static boolean canStartExpression(SyntaxKind kind) {
    switch (kind) {
      case STRING_LITERAL:
      case TRUE_KEYWORD:
      case FALSE_KEYWORD:
      case LEFT_PARENTHESIS:
      case NOT_KEYWORD:
      case SUBTRACTION_OPERATOR:
      case ADDITION_OPERATOR:
      case ADDRESS_OF_KEYWORD:
      case NEW_KEYWORD:
      case TYPE_OF_KEYWORD:
      case PERIOD_OPERATOR:
      case EXCLAMATION_MARK:
        return true;
      default:
        return NUMERIC_LITERALS.contains(kind)
            || OTHER_LITERALS.contains(kind)
            || canStartName(kind);
    }
  }

  private static boolean canStartName(SyntaxKind kind) {
    return kind.isName() && !NON_OPERAND_KEYWORDS.contains(kind);
  }

  void parseExpression() {
    parseExpression(LOWEST);
  }

  /** Parses an assignment target; emits nothing when no operand starts here. */
  void parseLvalue() {
    if (canStartExpression()) parseExpression(LVALUE);
  }

  void parseExpression(int minBindingPower) {
    if (!state.enterNesting()) {
      state.truncateLine();
      return;
    }

    try {
      TreeBuilder.Checkpoint checkpoint = builder.checkpoint();
      Term term = parsePrefix();
      if (term == Term.MISSING) return;
      if (term != Term.CLOSED) term = parsePostfix(checkpoint, term);

      while (true) {
        int next = state.skipWhitespace(state.position());
        Optional<BinaryOperator> op = state.kindAt(next).flatMap(BinaryOperator::of);
        if (!op.isPresent() || op.get().precedence().leftBindingPower() < minBindingPower) break;

        if (term == Term.BARE_NAME) {
          wrap(checkpoint, SyntaxKind.IDENTIFIER_EXPRESSION);
          term = Term.CLOSED;
        }

        builder.startNodeAt(checkpoint, SyntaxKind.BINARY_EXPRESSION);
        state.consumeWhitespace();
        state.consume();
        state.consumeWhitespace();
        parseOperand(op.get().precedence().rightBindingPower());
        builder.finishNode();
      }

      if (term == Term.BARE_NAME) wrap(checkpoint, SyntaxKind.IDENTIFIER_EXPRESSION);
    } finally {
      state.exitNesting();
    }
  }

  private void parseOperand(int minBindingPower) {
    if (canStartExpression()) {
      parseExpression(minBindingPower);
    } else {
      state.addDiagnostic(String.format("expected expression, found %s", state.describeCurrent()));
    }
  }

  private void wrap(TreeBuilder.Checkpoint checkpoint, SyntaxKind kind) {
    builder.startNodeAt(checkpoint, kind);
    builder.finishNode();
  }

  private Term parsePrefix() {
    if (!canStartExpression()) {
      state.addDiagnostic(String.format("expected expression, found %s", state.describeCurrent()));
      return Term.MISSING;
    }

    SyntaxKind kind = state.current().kind();
    if (NUMERIC_LITERALS.contains(kind)) {
      literal(SyntaxKind.NUMERIC_LITERAL_EXPRESSION);
      return Term.CLOSED;
    } else if (OTHER_LITERALS.contains(kind)) {
      literal(SyntaxKind.LITERAL_EXPRESSION);
      return Term.CLOSED;
    }

    switch (kind) {
      case STRING_LITERAL:
        literal(SyntaxKind.STRING_LITERAL_EXPRESSION);
        return Term.CLOSED;
      case TRUE_KEYWORD:
      case FALSE_KEYWORD:
        literal(SyntaxKind.BOOLEAN_LITERAL_EXPRESSION);
        return Term.CLOSED;
      case LEFT_PARENTHESIS:
        parseParenthesized();
        return Term.POSTFIXABLE;
      case NOT_KEYWORD:
        parseUnary(Precedence.NOT);
        return Term.CLOSED;
      case SUBTRACTION_OPERATOR:
      case ADDITION_OPERATOR:
        parseUnary(Precedence.NEGATION);
        return Term.CLOSED;
      case ADDRESS_OF_KEYWORD:
        parseKeywordOperand(SyntaxKind.ADDRESS_OF_EXPRESSION);
        return Term.CLOSED;
      case NEW_KEYWORD:
        parseKeywordOperand(SyntaxKind.NEW_EXPRESSION);
        return Term.CLOSED;
      case TYPE_OF_KEYWORD:
        parseTypeOf();
        return Term.CLOSED;
      case PERIOD_OPERATOR:
      case EXCLAMATION_MARK:
        // ".Member" or "!Key" inside a With block.
        if (!isMemberName(state.position() + 1)) {
          state.addDiagnostic(String.format("expected member name after %s", state.describeCurrent()));
          state.consumeAsUnknown();
          return Term.CLOSED;
        }
        builder.startNode(SyntaxKind.MEMBER_ACCESS_EXPRESSION);
        state.consume();
        consumeName();
        builder.finishNode();
        return Term.POSTFIXABLE;
      default:
        consumeName();
        return Term.BARE_NAME;
    }
  }

  private void literal(SyntaxKind kind) {
    builder.startNode(kind);
    state.consume();
    builder.finishNode();
  }

  private void parseParenthesized() {
    builder.startNode(SyntaxKind.PARENTHESIZED_EXPRESSION);
    state.consume();
    state.consumeWhitespace();
    parseOperand(LOWEST);
    state.consumeWhitespace();
    expectClosingParenthesis();
    builder.finishNode();
  }

  private void parseUnary(Precedence precedence) {
    builder.startNode(SyntaxKind.UNARY_EXPRESSION);
    state.consume();
    state.consumeWhitespace();
    parseOperand(precedence.rightBindingPower());
    builder.finishNode();
  }

  // AddressOf and New take a (possibly dotted) name.
  private void parseKeywordOperand(SyntaxKind kind) {
    builder.startNode(kind);
    state.consume();
    state.consumeWhitespace();
    parseOperand(OPERAND_ONLY);
    builder.finishNode();
  }

  // TypeOf x Is SomeType
  private void parseTypeOf() {
    builder.startNode(SyntaxKind.TYPE_OF_EXPRESSION);
    state.consume();
    state.consumeWhitespace();
    parseOperand(LVALUE);
    if (state.peekSignificantIs(0, SyntaxKind.IS_KEYWORD)) {
      state.consumeWhitespace();
      state.consume();
      state.consumeWhitespace();
      parseOperand(OPERAND_ONLY);
    } else {
      state.addDiagnostic("expected 'Is' in TypeOf expression");
    }
    builder.finishNode();
  }

  private Term parsePostfix(TreeBuilder.Checkpoint checkpoint, Term term) {
    while (!state.isAtEnd()) {
      if (isContinuedMemberAccess()) state.consumeWhitespace();
      SyntaxKind kind = state.current().kind();
      if ((kind == SyntaxKind.PERIOD_OPERATOR || kind == SyntaxKind.EXCLAMATION_MARK)
          && isMemberName(state.position() + 1)) {
        builder.startNodeAt(checkpoint, SyntaxKind.MEMBER_ACCESS_EXPRESSION);
        state.consume();
        consumeName();
        builder.finishNode();
      } else if (kind == SyntaxKind.LEFT_PARENTHESIS) {
        builder.startNodeAt(checkpoint, SyntaxKind.CALL_EXPRESSION);
        state.consume();
        parseArgumentList();
        expectClosingParenthesis();
        builder.finishNode();
      } else {
        break;
      }
      term = Term.POSTFIXABLE;
    }
    return term;
  }

  // "obj _" then ".Member" on the next line. A call's "(" never follows a continuation.
  private boolean isContinuedMemberAccess() {
    int next = state.skipWhitespace(state.position());
    if (next == state.position()) return false;
    Optional<SyntaxKind> kind = state.kindAt(next);
    if (!kind.isPresent()
        || (kind.get() != SyntaxKind.PERIOD_OPERATOR && kind.get() != SyntaxKind.EXCLAMATION_MARK)
        || !isMemberName(next + 1)) {
      return false;
    }
    for (int i = state.position(); i < next; i++) {
      if (state.isAt(i, SyntaxKind.NEWLINE)) return true;
    }
    return false;
  }

  private boolean isMemberName(int index) {
    return state.kindAt(index).map(SyntaxKind::isName).orElse(false);
  }

  private void parseArgumentList() {
    builder.startNode(SyntaxKind.ARGUMENT_LIST);
    state.consumeWhitespace();
    while (!state.isAtEnd() && !state.at(SyntaxKind.RIGHT_PARENTHESIS)) {
      if (state.at(SyntaxKind.COMMA)) {
        state.consume();
        state.consumeWhitespace();
        continue;
      }
      if (!canStartExpression()) break;

      builder.startNode(SyntaxKind.ARGUMENT);
      if (isNamedArgument()) {
        consumeName();
        state.consume();
        state.consume();
        state.consumeWhitespace();
      }
      parseOperand(LOWEST);
      builder.finishNode();

      state.consumeWhitespace();
      if (!state.at(SyntaxKind.COMMA)) break;
    }
    builder.finishNode();
  }

  // name:=value
  private boolean isNamedArgument() {
    int pos = state.position();
    return state.current().kind().isName()
        && state.isAt(pos + 1, SyntaxKind.COLON_OPERATOR)
        && state.isAt(pos + 2, SyntaxKind.EQUALITY_OPERATOR);
  }

  private void expectClosingParenthesis() {
    if (state.at(SyntaxKind.RIGHT_PARENTHESIS)) {
      state.consume();
    } else {
      state.addDiagnostic(String.format("expected ')', found %s", state.describeCurrent()));
    }
  }

  /**
   * Emits a name leaf. A type-suffix character written directly after the name is folded into the
   * same leaf, which is then an identifier.
   */
  void consumeName() {
    if (hasTypeSuffix()) {
      state.consumeMerged(2, SyntaxKind.IDENTIFIER);
    } else {
      state.consume();
    }
  }

  /** Like {@link #consumeName}, but a keyword is emitted as an identifier. */
  void consumeIdentifier() {
    if (hasTypeSuffix()) {
      state.consumeMerged(2, SyntaxKind.IDENTIFIER);
    } else {
      state.consumeAs(SyntaxKind.IDENTIFIER);
    }
  }

  boolean atName() {
    return !state.isAtEnd() && state.current().kind().isName();
  }

  private boolean hasTypeSuffix() {
    int suffix = state.position() + 1;
    Optional<SyntaxKind> kind = state.kindAt(suffix);
    if (!kind.isPresent()) return false;
    if (ALWAYS_FOLDED_SUFFIXES.contains(kind.get())) return true;

    if (kind.get() == SyntaxKind.EXCLAMATION_MARK) {
      // rs!Field is a dictionary access, x! a Single.
      return !isMemberName(suffix + 1);
    } else if (kind.get() == SyntaxKind.AMPERSAND) {
      // a&b concatenates, x& is a Long.
      return !state
          .kindAt(state.skipWhitespace(suffix + 1))
          .map(ExpressionParser::canStartExpression)
          .orElse(false);
    }
    return false;
  }
}
