package vbcst;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Per-parse mutable state: the token cursor, the tree under construction and the diagnostics
 * collected so far. Nothing here outlives one call to {@link Parser#parse}.
 */
final class ParserState {
  private static final Logger logger = LogManager.getLogger(ParserState.class);

  private final TokenStream stream;
  private final ImmutableList<Token> tokens;
  private final ParserOptions options;
  private final TreeBuilder builder = new TreeBuilder();
  private final List<ParseDiagnostic> diagnostics = new ArrayList<>();

  private int pos = 0;
  // True until the first statement that is not part of the file header.
  private boolean parsingHeader = true;
  private int nestingDepth = 0;
  // Greater than zero while parsing the body of a single-line If.
  private int inlineDepth = 0;
  private Optional<SyntaxKind> procedureKeyword = Optional.empty();
  // Token index where the last truncated line stopped; follow-on complaints there are dropped.
  private int truncatedAt = -1;

  ParserState(TokenStream stream, ParserOptions options) {
    this.stream = stream;
    this.tokens = stream.tokens();
    this.options = options;
  }

  TreeBuilder builder() {
    return builder;
  }

  ImmutableList<ParseDiagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  // Cursor

  int position() {
    return pos;
  }

  boolean isAtEnd() {
    return pos >= tokens.size();
  }

  Token current() {
    Preconditions.checkState(!isAtEnd(), "no token at end of input");
    return tokens.get(pos);
  }

  Optional<SyntaxKind> kindAt(int index) {
    if (index < 0 || index >= tokens.size()) return Optional.empty();
    return Optional.of(tokens.get(index).kind());
  }

  boolean at(SyntaxKind kind) {
    return !isAtEnd() && tokens.get(pos).kind() == kind;
  }

  boolean isAt(int index, SyntaxKind kind) {
    return kindAt(index).map(k -> k == kind).orElse(false);
  }

  // Lookahead

  /**
   * If a line continuation ({@code _}, optional whitespace, newline) starts at {@code index},
   * returns the index just past it; otherwise -1.
   */
  int continuationEnd(int index) {
    if (!isAt(index, SyntaxKind.UNDERSCORE)) return -1;
    int next = index + 1;
    if (isAt(next, SyntaxKind.WHITESPACE)) next++;
    return isAt(next, SyntaxKind.NEWLINE) ? next + 1 : -1;
  }

  /** Index of the first token at or after {@code index} that is not whitespace or continuation. */
  int skipWhitespace(int index) {
    while (true) {
      if (isAt(index, SyntaxKind.WHITESPACE)) {
        index++;
        continue;
      }
      int continued = continuationEnd(index);
      if (continued < 0) return index;
      index = continued;
    }
  }

  /**
   * Kind of the n-th significant token counting from the cursor, where the first token at or
   * after the cursor that is not whitespace is number zero.
   */
  Optional<SyntaxKind> peekSignificant(int n) {
    return kindAt(significantIndex(n));
  }

  int significantIndex(int n) {
    int index = skipWhitespace(pos);
    for (int i = 0; i < n; i++) {
      index = skipWhitespace(index + 1);
    }
    return index;
  }

  boolean peekSignificantIs(int n, SyntaxKind kind) {
    return peekSignificant(n).map(k -> k == kind).orElse(false);
  }

  // Consumption

  void consume() {
    Token token = current();
    builder.token(token.kind(), token.text());
    pos++;
  }

  /** Emits the current token under a different kind; the token itself is untouched. */
  void consumeAs(SyntaxKind kind) {
    builder.token(kind, current().text());
    pos++;
  }

  void consumeAsUnknown() {
    consumeAs(SyntaxKind.UNKNOWN);
  }

  /** Emits the next {@code count} tokens as a single leaf of the given kind. */
  void consumeMerged(int count, SyntaxKind kind) {
    Preconditions.checkArgument(pos + count <= tokens.size(), "not enough tokens to merge");
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < count; i++) {
      text.append(tokens.get(pos + i).text());
    }
    builder.token(kind, text.toString());
    pos += count;
  }

  /** Consumes whitespace and line continuations. */
  void consumeWhitespace() {
    int end = skipWhitespace(pos);
    while (pos < end) consume();
  }

  // Statement boundaries

  /**
   * True if a statement cannot extend past {@code index}: end of input, a newline, a comment, a
   * colon separator, or an Else inside a single-line If.
   */
  boolean isStatementEnd(int index) {
    Optional<SyntaxKind> kind = kindAt(index);
    if (!kind.isPresent()) return true;
    switch (kind.get()) {
      case NEWLINE:
      case END_OF_LINE_COMMENT:
      case REM_COMMENT:
        return true;
      case COLON_OPERATOR:
        // "name:=" is a named argument, not a separator.
        return !isAt(index + 1, SyntaxKind.EQUALITY_OPERATOR);
      case ELSE_KEYWORD:
        return inlineDepth > 0;
      default:
        return false;
    }
  }

  boolean atStatementEnd() {
    return isStatementEnd(pos);
  }

  /** Consumes the remaining tokens of the statement verbatim, keeping their own kinds. */
  void consumeRestOfStatement() {
    while (!atStatementEnd()) {
      int continued = continuationEnd(pos);
      if (continued >= 0) {
        while (pos < continued) consume();
      } else {
        consume();
      }
    }
  }

  /**
   * Closes off a statement: trailing whitespace, any leftover tokens as unknown leaves, a trailing
   * comment and the newline. Inside a single-line If the newline is left for the If.
   */
  void finishStatement() {
    consumeWhitespace();
    if (!atStatementEnd()) {
      addDiagnostic(String.format("unexpected %s", describeCurrent()));
      consumeAsUnknownUntil(false);
    }
    if (!isAtEnd() && current().kind().isComment()) consume();
    if (inlineDepth == 0 && at(SyntaxKind.NEWLINE)) consume();
  }

  /**
   * Emits tokens as unknown leaves up to the end of the statement, or of the physical line when
   * {@code wholeLine} is set. Whitespace and continuations keep their kinds.
   */
  void consumeAsUnknownUntil(boolean wholeLine) {
    while (!isAtEnd()) {
      if (wholeLine ? at(SyntaxKind.NEWLINE) : atStatementEnd()) return;
      int continued = continuationEnd(pos);
      if (continued >= 0) {
        while (pos < continued) consume();
      } else if (at(SyntaxKind.WHITESPACE)) {
        consume();
      } else {
        consumeAsUnknown();
      }
    }
  }

  String describeCurrent() {
    if (isAtEnd()) return "end of input";
    String text = current().text().trim();
    return text.isEmpty() ? "end of line" : String.format("'%s'", text);
  }

  // Diagnostics

  void addDiagnostic(String message) {
    if (pos == truncatedAt) return;

    int index = Math.min(pos, tokens.size() - 1);
    Tokenizer.Pos where =
        index >= 0 ? tokens.get(index).pos() : new Tokenizer.Pos(stream.fileName(), 0, 0);
    ParseDiagnostic diagnostic = ParseDiagnostic.create(where, pos, message);
    logger.debug("recovering: {}", diagnostic.format());
    diagnostics.add(diagnostic);
  }

  // Nesting

  /** Returns false, recording nothing, when the nesting limit has been reached. */
  boolean enterNesting() {
    if (nestingDepth >= options.maxNestingDepth()) return false;
    nestingDepth++;
    return true;
  }

  void exitNesting() {
    Preconditions.checkState(nestingDepth > 0, "unbalanced exitNesting()");
    nestingDepth--;
  }

  /** Keeps the rest of the physical line as unknown leaves after the nesting limit is hit. */
  void truncateLine() {
    String message =
        String.format("nesting depth limit of %d exceeded", options.maxNestingDepth());
    logger.warn("{}: {}", stream.fileName(), message);
    addDiagnostic(message);
    consumeAsUnknownUntil(true);
    truncatedAt = pos;
  }

  // Context flags

  boolean parsingHeader() {
    return parsingHeader;
  }

  void leaveHeader() {
    parsingHeader = false;
  }

  boolean inline() {
    return inlineDepth > 0;
  }

  void enterInline() {
    inlineDepth++;
  }

  void exitInline() {
    Preconditions.checkState(inlineDepth > 0, "unbalanced exitInline()");
    inlineDepth--;
  }

  Optional<SyntaxKind> procedureKeyword() {
    return procedureKeyword;
  }

  void setProcedureKeyword(Optional<SyntaxKind> keyword) {
    procedureKeyword = keyword;
  }
}
