package vbcst;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;

/**
 * Produces a lossless tokenization of VB6 source text. Every character of the input lands in
 * exactly one token; characters that fit no rule become {@link SyntaxKind#UNKNOWN} tokens.
 */
public class Tokenizer {
  public static class Pos {
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Pos)) return false;
      Pos p = (Pos) o;
      return file.equals(p.file) && lineNumber == p.lineNumber && column == p.column;
    }

    @Override
    public int hashCode() {
      return Objects.hash(file, lineNumber, column);
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  // #1/2/2000#, #2000-01-02 10:30:00 PM#, #10:30 AM#, #January 1, 2000#
  private static final Pattern DATE_LITERAL =
      Pattern.compile(
          "\\s*(\\d{1,4}[-/]\\d{1,2}([-/]\\d{1,4})?|[A-Za-z]{3,9}\\s+\\d{1,2},?\\s+\\d{2,4})?"
              + "(\\s*\\d{1,2}(:\\d{1,2}){1,2}(\\s*[AaPp][Mm])?|\\s*\\d{1,2}\\s*[AaPp][Mm])?\\s*");

  private final String file;
  private final String content;
  private int offset = 0;
  private int line = 0;
  private int col = 0;

  private final List<Token> tokens = new ArrayList<>();
  private final List<ParseDiagnostic> diagnostics = new ArrayList<>();

  public Tokenizer(String file, String content) {
    this.file = file;
    this.content = content;
  }

  public TokenStream tokenize() {
    while (canPeek(0)) {
      char ch = peek(0);
      if (ch == '\r' || ch == '\n') {
        readNewline();
      } else if (isBlank(ch)) {
        take(countWhile(0, Tokenizer::isBlank), SyntaxKind.WHITESPACE);
      } else if (ch == '\'') {
        take(countUntilNewline(0), SyntaxKind.END_OF_LINE_COMMENT);
      } else if (ch == '"') {
        readStringLiteral();
      } else if (ch == '#' && readDateLiteral()) {
        continue;
      } else if (isDigit(ch)) {
        readNumericLiteral();
      } else if (ch == '&' && readRadixLiteral()) {
        continue;
      } else if (Character.isLetter(ch)) {
        readWord();
      } else if (!readSymbol()) {
        diagnostics.add(
            ParseDiagnostic.create(
                pos(), tokens.size(), String.format("unrecognized character '%c'", ch)));
        take(1, SyntaxKind.UNKNOWN);
      }
    }

    return TokenStream.create(file, tokens, diagnostics);
  }

  private static boolean isBlank(char ch) {
    return ch != '\r' && ch != '\n' && Character.isWhitespace(ch);
  }

  private static boolean isDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isWordChar(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_';
  }

  private boolean canPeek(int ahead) {
    return offset + ahead < content.length();
  }

  private char peek(int ahead) {
    return content.charAt(offset + ahead);
  }

  private int countWhile(int from, CharPredicate predicate) {
    int n = from;
    while (canPeek(n) && predicate.test(peek(n))) n++;
    return n;
  }

  private int countUntilNewline(int from) {
    return countWhile(from, c -> c != '\r' && c != '\n');
  }

  private Pos pos() {
    return new Pos(file, line, col);
  }

  // Emits the next `length` characters as one token and advances past them.
  private void take(int length, SyntaxKind kind) {
    String text = content.substring(offset, offset + length);
    tokens.add(Token.create(text, kind, pos()));
    offset += length;
    if (kind == SyntaxKind.NEWLINE) {
      line++;
      col = 0;
    } else {
      col += length;
    }
  }

  private void readNewline() {
    if (peek(0) == '\r' && canPeek(1) && peek(1) == '\n') {
      take(2, SyntaxKind.NEWLINE);
    } else {
      take(1, SyntaxKind.NEWLINE);
    }
  }

  // Doubled quotes are escapes; an unterminated string runs to the end of the line.
  private void readStringLiteral() {
    int n = 1;
    while (canPeek(n) && peek(n) != '\r' && peek(n) != '\n') {
      if (peek(n) == '"') {
        if (canPeek(n + 1) && peek(n + 1) == '"') {
          n += 2;
          continue;
        }
        n++;
        take(n, SyntaxKind.STRING_LITERAL);
        return;
      }
      n++;
    }

    diagnostics.add(ParseDiagnostic.create(pos(), tokens.size(), "unterminated string literal"));
    take(n, SyntaxKind.STRING_LITERAL);
  }

  private boolean readDateLiteral() {
    int end = 1;
    while (canPeek(end) && peek(end) != '#' && peek(end) != '\r' && peek(end) != '\n') end++;
    if (!canPeek(end) || peek(end) != '#' || end == 1) return false;

    String body = content.substring(offset + 1, offset + end);
    if (body.chars().noneMatch(c -> isDigit((char) c))) return false;
    if (!DATE_LITERAL.matcher(body).matches()) return false;

    take(end + 1, SyntaxKind.DATE_LITERAL);
    return true;
  }

  private void readNumericLiteral() {
    int n = countWhile(0, Tokenizer::isDigit);
    boolean fractional = false;
    if (canPeek(n + 1) && peek(n) == '.' && isDigit(peek(n + 1))) {
      n = countWhile(n + 1, Tokenizer::isDigit);
      fractional = true;
    }

    if (canPeek(n) && (peek(n) == 'E' || peek(n) == 'e' || peek(n) == 'D' || peek(n) == 'd')) {
      int exp = n + 1;
      if (canPeek(exp) && (peek(exp) == '+' || peek(exp) == '-')) exp++;
      if (canPeek(exp) && isDigit(peek(exp))) {
        n = countWhile(exp, Tokenizer::isDigit);
        fractional = true;
      }
    }

    Optional<SyntaxKind> suffix = canPeek(n) ? typeSuffix(peek(n)) : Optional.empty();
    if (suffix.isPresent() && !(canPeek(n + 1) && isWordChar(peek(n + 1)))) {
      take(n + 1, suffix.get());
    } else {
      take(n, fractional ? SyntaxKind.SINGLE_LITERAL : SyntaxKind.INTEGER_LITERAL);
    }
  }

  private static Optional<SyntaxKind> typeSuffix(char ch) {
    switch (ch) {
      case '%':
        return Optional.of(SyntaxKind.INTEGER_LITERAL);
      case '&':
        return Optional.of(SyntaxKind.LONG_LITERAL);
      case '!':
        return Optional.of(SyntaxKind.SINGLE_LITERAL);
      case '#':
        return Optional.of(SyntaxKind.DOUBLE_LITERAL);
      case '@':
        return Optional.of(SyntaxKind.CURRENCY_LITERAL);
      default:
        return Optional.empty();
    }
  }

  // &HFF, &O17, optionally followed by & or %.
  private boolean readRadixLiteral() {
    if (!canPeek(2)) return false;

    char radix = Character.toUpperCase(peek(1));
    CharPredicate digit;
    if (radix == 'H') {
      digit = c -> Character.digit(c, 16) >= 0;
    } else if (radix == 'O') {
      digit = c -> c >= '0' && c <= '7';
    } else {
      return false;
    }

    if (!digit.test(peek(2))) return false;

    int n = countWhile(2, digit);
    if (canPeek(n) && (peek(n) == '&' || peek(n) == '%')) {
      take(n + 1, peek(n) == '&' ? SyntaxKind.LONG_LITERAL : SyntaxKind.INTEGER_LITERAL);
    } else {
      take(n, SyntaxKind.INTEGER_LITERAL);
    }
    return true;
  }

  private void readWord() {
    int n = countWhile(0, Tokenizer::isWordChar);
    String word = content.substring(offset, offset + n);
    if (word.equalsIgnoreCase("Rem")) {
      take(countUntilNewline(n), SyntaxKind.REM_COMMENT);
      return;
    }

    take(n, SyntaxKind.keyword(word).orElse(SyntaxKind.IDENTIFIER));
  }

  private boolean readSymbol() {
    if (canPeek(1)) {
      Optional<SyntaxKind> pair = SyntaxKind.symbol(content.substring(offset, offset + 2));
      if (pair.isPresent()) {
        take(2, pair.get());
        return true;
      }
    }

    Optional<SyntaxKind> single = SyntaxKind.symbol(String.valueOf(peek(0)));
    if (single.isPresent()) {
      take(1, single.get());
      return true;
    }
    return false;
  }

  @FunctionalInterface
  private interface CharPredicate {
    boolean test(char ch);
  }

  /** Convenience for callers that only want the tokens. */
  public static ImmutableList<Token> tokenize(String file, String content) {
    return new Tokenizer(file, content).tokenize().tokens();
  }
}
