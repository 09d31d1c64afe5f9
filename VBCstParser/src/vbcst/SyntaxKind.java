package vbcst;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.base.CaseFormat;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The closed set of kinds shared by tokens and tree nodes.
 *
 * <p>Token kinds are leaf-only; node kinds are composite-only. The ordinal doubles as the raw tag
 * value, so tokens and nodes live in one numeric space.
 */
public enum SyntaxKind {
  // Structure
  ROOT(Category.NODE),
  STATEMENT_LIST(Category.NODE),

  // Module header
  VERSION_STATEMENT(Category.NODE),
  OBJECT_STATEMENT(Category.NODE),
  ATTRIBUTE_STATEMENT(Category.NODE),
  OPTION_STATEMENT(Category.NODE),
  PROPERTIES_BLOCK(Category.NODE),
  PROPERTIES_TYPE(Category.NODE),
  PROPERTIES_NAME(Category.NODE),
  PROPERTY(Category.NODE),
  PROPERTY_KEY(Category.NODE),
  PROPERTY_VALUE(Category.NODE),
  PROPERTY_GROUP(Category.NODE),
  PROPERTY_GROUP_NAME(Category.NODE),

  // Declarations
  SUB_STATEMENT(Category.NODE),
  FUNCTION_STATEMENT(Category.NODE),
  PROPERTY_STATEMENT(Category.NODE),
  DECLARE_STATEMENT(Category.NODE),
  EVENT_STATEMENT(Category.NODE),
  IMPLEMENTS_STATEMENT(Category.NODE),
  DEF_TYPE_STATEMENT(Category.NODE),
  DIM_STATEMENT(Category.NODE),
  RE_DIM_STATEMENT(Category.NODE),
  ERASE_STATEMENT(Category.NODE),
  CONST_STATEMENT(Category.NODE),
  TYPE_STATEMENT(Category.NODE),
  ENUM_STATEMENT(Category.NODE),
  PARAMETER_LIST(Category.NODE),
  PARAMETER(Category.NODE),

  // Control flow
  IF_STATEMENT(Category.NODE),
  ELSE_IF_CLAUSE(Category.NODE),
  ELSE_CLAUSE(Category.NODE),
  FOR_STATEMENT(Category.NODE),
  FOR_EACH_STATEMENT(Category.NODE),
  WHILE_STATEMENT(Category.NODE),
  DO_STATEMENT(Category.NODE),
  SELECT_CASE_STATEMENT(Category.NODE),
  CASE_CLAUSE(Category.NODE),
  CASE_ELSE_CLAUSE(Category.NODE),
  WITH_STATEMENT(Category.NODE),
  GOTO_STATEMENT(Category.NODE),
  GO_SUB_STATEMENT(Category.NODE),
  RETURN_STATEMENT(Category.NODE),
  RESUME_STATEMENT(Category.NODE),
  EXIT_STATEMENT(Category.NODE),
  END_STATEMENT(Category.NODE),
  ON_ERROR_STATEMENT(Category.NODE),
  ON_GO_TO_STATEMENT(Category.NODE),
  ON_GO_SUB_STATEMENT(Category.NODE),
  LABEL_STATEMENT(Category.NODE),

  // Simple statements
  CALL_STATEMENT(Category.NODE),
  RAISE_EVENT_STATEMENT(Category.NODE),
  SET_STATEMENT(Category.NODE),
  LET_STATEMENT(Category.NODE),
  ASSIGNMENT_STATEMENT(Category.NODE),

  // Built-in library statements
  APP_ACTIVATE_STATEMENT(Category.NODE),
  BEEP_STATEMENT(Category.NODE),
  CH_DIR_STATEMENT(Category.NODE),
  CH_DRIVE_STATEMENT(Category.NODE),
  CLOSE_STATEMENT(Category.NODE),
  DATE_STATEMENT(Category.NODE),
  DELETE_SETTING_STATEMENT(Category.NODE),
  ERROR_STATEMENT(Category.NODE),
  FILE_COPY_STATEMENT(Category.NODE),
  GET_STATEMENT(Category.NODE),
  PUT_STATEMENT(Category.NODE),
  INPUT_STATEMENT(Category.NODE),
  LINE_INPUT_STATEMENT(Category.NODE),
  KILL_STATEMENT(Category.NODE),
  LOAD_STATEMENT(Category.NODE),
  UNLOAD_STATEMENT(Category.NODE),
  LOCK_STATEMENT(Category.NODE),
  UNLOCK_STATEMENT(Category.NODE),
  L_SET_STATEMENT(Category.NODE),
  R_SET_STATEMENT(Category.NODE),
  MID_STATEMENT(Category.NODE),
  MID_B_STATEMENT(Category.NODE),
  MK_DIR_STATEMENT(Category.NODE),
  RM_DIR_STATEMENT(Category.NODE),
  NAME_STATEMENT(Category.NODE),
  OPEN_STATEMENT(Category.NODE),
  PRINT_STATEMENT(Category.NODE),
  RANDOMIZE_STATEMENT(Category.NODE),
  RESET_STATEMENT(Category.NODE),
  SAVE_PICTURE_STATEMENT(Category.NODE),
  SAVE_SETTING_STATEMENT(Category.NODE),
  SEEK_STATEMENT(Category.NODE),
  SEND_KEYS_STATEMENT(Category.NODE),
  SET_ATTR_STATEMENT(Category.NODE),
  STOP_STATEMENT(Category.NODE),
  TIME_STATEMENT(Category.NODE),
  WIDTH_STATEMENT(Category.NODE),
  WRITE_STATEMENT(Category.NODE),

  // Expressions
  BINARY_EXPRESSION(Category.NODE),
  UNARY_EXPRESSION(Category.NODE),
  LITERAL_EXPRESSION(Category.NODE),
  NUMERIC_LITERAL_EXPRESSION(Category.NODE),
  STRING_LITERAL_EXPRESSION(Category.NODE),
  BOOLEAN_LITERAL_EXPRESSION(Category.NODE),
  IDENTIFIER_EXPRESSION(Category.NODE),
  MEMBER_ACCESS_EXPRESSION(Category.NODE),
  CALL_EXPRESSION(Category.NODE),
  PARENTHESIZED_EXPRESSION(Category.NODE),
  ADDRESS_OF_EXPRESSION(Category.NODE),
  TYPE_OF_EXPRESSION(Category.NODE),
  NEW_EXPRESSION(Category.NODE),
  ARGUMENT_LIST(Category.NODE),
  ARGUMENT(Category.NODE),

  // Trivia
  WHITESPACE(Category.TRIVIA),
  NEWLINE(Category.TRIVIA),
  END_OF_LINE_COMMENT(Category.TRIVIA),
  REM_COMMENT(Category.TRIVIA),

  // Keywords
  ACCESS_KEYWORD("Access"),
  ADDRESS_OF_KEYWORD("AddressOf"),
  ALIAS_KEYWORD("Alias"),
  AND_KEYWORD("And"),
  ANY_KEYWORD("Any"),
  APP_ACTIVATE_KEYWORD("AppActivate"),
  APPEND_KEYWORD("Append"),
  AS_KEYWORD("As"),
  ATTRIBUTE_KEYWORD("Attribute"),
  BASE_KEYWORD("Base"),
  BEEP_KEYWORD("Beep"),
  BEGIN_KEYWORD("Begin"),
  BINARY_KEYWORD("Binary"),
  BOOLEAN_KEYWORD("Boolean"),
  BY_REF_KEYWORD("ByRef"),
  BYTE_KEYWORD("Byte"),
  BY_VAL_KEYWORD("ByVal"),
  CALL_KEYWORD("Call"),
  CASE_KEYWORD("Case"),
  CH_DIR_KEYWORD("ChDir"),
  CH_DRIVE_KEYWORD("ChDrive"),
  CLASS_KEYWORD("Class"),
  CLOSE_KEYWORD("Close"),
  COMPARE_KEYWORD("Compare"),
  CONST_KEYWORD("Const"),
  CURRENCY_KEYWORD("Currency"),
  DATABASE_KEYWORD("Database"),
  DATE_KEYWORD("Date"),
  DECIMAL_KEYWORD("Decimal"),
  DECLARE_KEYWORD("Declare"),
  DEF_BOOL_KEYWORD("DefBool"),
  DEF_BYTE_KEYWORD("DefByte"),
  DEF_CUR_KEYWORD("DefCur"),
  DEF_DATE_KEYWORD("DefDate"),
  DEF_DBL_KEYWORD("DefDbl"),
  DEF_DEC_KEYWORD("DefDec"),
  DEF_INT_KEYWORD("DefInt"),
  DEF_LNG_KEYWORD("DefLng"),
  DEF_OBJ_KEYWORD("DefObj"),
  DEF_SNG_KEYWORD("DefSng"),
  DEF_STR_KEYWORD("DefStr"),
  DEF_VAR_KEYWORD("DefVar"),
  DELETE_SETTING_KEYWORD("DeleteSetting"),
  DIM_KEYWORD("Dim"),
  DO_KEYWORD("Do"),
  DOUBLE_KEYWORD("Double"),
  EACH_KEYWORD("Each"),
  ELSE_KEYWORD("Else"),
  ELSE_IF_KEYWORD("ElseIf"),
  EMPTY_KEYWORD("Empty"),
  END_KEYWORD("End"),
  ENUM_KEYWORD("Enum"),
  EQV_KEYWORD("Eqv"),
  ERASE_KEYWORD("Erase"),
  ERROR_KEYWORD("Error"),
  EVENT_KEYWORD("Event"),
  EXIT_KEYWORD("Exit"),
  EXPLICIT_KEYWORD("Explicit"),
  FALSE_KEYWORD("False"),
  FILE_COPY_KEYWORD("FileCopy"),
  FOR_KEYWORD("For"),
  FRIEND_KEYWORD("Friend"),
  FUNCTION_KEYWORD("Function"),
  GET_KEYWORD("Get"),
  GLOBAL_KEYWORD("Global"),
  GO_SUB_KEYWORD("GoSub"),
  GOTO_KEYWORD("GoTo"),
  IF_KEYWORD("If"),
  IMP_KEYWORD("Imp"),
  IMPLEMENTS_KEYWORD("Implements"),
  IN_KEYWORD("In"),
  INPUT_KEYWORD("Input"),
  INTEGER_KEYWORD("Integer"),
  IS_KEYWORD("Is"),
  KILL_KEYWORD("Kill"),
  LEN_KEYWORD("Len"),
  LET_KEYWORD("Let"),
  LIB_KEYWORD("Lib"),
  LIKE_KEYWORD("Like"),
  LINE_KEYWORD("Line"),
  LOAD_KEYWORD("Load"),
  LOCK_KEYWORD("Lock"),
  LONG_KEYWORD("Long"),
  LOOP_KEYWORD("Loop"),
  L_SET_KEYWORD("LSet"),
  ME_KEYWORD("Me"),
  MID_KEYWORD("Mid"),
  MID_B_KEYWORD("MidB"),
  MK_DIR_KEYWORD("MkDir"),
  MOD_KEYWORD("Mod"),
  MODULE_KEYWORD("Module"),
  NAME_KEYWORD("Name"),
  NEW_KEYWORD("New"),
  NEXT_KEYWORD("Next"),
  NOT_KEYWORD("Not"),
  NOTHING_KEYWORD("Nothing"),
  NULL_KEYWORD("Null"),
  OBJECT_KEYWORD("Object"),
  OFF_KEYWORD("Off"),
  ON_KEYWORD("On"),
  OPEN_KEYWORD("Open"),
  OPTION_KEYWORD("Option"),
  OPTIONAL_KEYWORD("Optional"),
  OR_KEYWORD("Or"),
  OUTPUT_KEYWORD("Output"),
  PARAM_ARRAY_KEYWORD("ParamArray"),
  PRESERVE_KEYWORD("Preserve"),
  PRINT_KEYWORD("Print"),
  PRIVATE_KEYWORD("Private"),
  PROPERTY_KEYWORD("Property"),
  PUBLIC_KEYWORD("Public"),
  PUT_KEYWORD("Put"),
  RAISE_EVENT_KEYWORD("RaiseEvent"),
  RANDOM_KEYWORD("Random"),
  RANDOMIZE_KEYWORD("Randomize"),
  READ_KEYWORD("Read"),
  RE_DIM_KEYWORD("ReDim"),
  RESET_KEYWORD("Reset"),
  RESUME_KEYWORD("Resume"),
  RETURN_KEYWORD("Return"),
  RM_DIR_KEYWORD("RmDir"),
  R_SET_KEYWORD("RSet"),
  SAVE_PICTURE_KEYWORD("SavePicture"),
  SAVE_SETTING_KEYWORD("SaveSetting"),
  SEEK_KEYWORD("Seek"),
  SELECT_KEYWORD("Select"),
  SEND_KEYS_KEYWORD("SendKeys"),
  SET_KEYWORD("Set"),
  SET_ATTR_KEYWORD("SetAttr"),
  SINGLE_KEYWORD("Single"),
  STATIC_KEYWORD("Static"),
  STEP_KEYWORD("Step"),
  STOP_KEYWORD("Stop"),
  STRING_KEYWORD("String"),
  SUB_KEYWORD("Sub"),
  TEXT_KEYWORD("Text"),
  THEN_KEYWORD("Then"),
  TIME_KEYWORD("Time"),
  TO_KEYWORD("To"),
  TRUE_KEYWORD("True"),
  TYPE_KEYWORD("Type"),
  TYPE_OF_KEYWORD("TypeOf"),
  UNLOAD_KEYWORD("Unload"),
  UNLOCK_KEYWORD("Unlock"),
  UNTIL_KEYWORD("Until"),
  VARIANT_KEYWORD("Variant"),
  VERSION_KEYWORD("Version"),
  WEND_KEYWORD("Wend"),
  WHILE_KEYWORD("While"),
  WIDTH_KEYWORD("Width"),
  WITH_KEYWORD("With"),
  WITH_EVENTS_KEYWORD("WithEvents"),
  WRITE_KEYWORD("Write"),
  XOR_KEYWORD("Xor"),

  // Names and literals
  IDENTIFIER(Category.IDENTIFIER),
  STRING_LITERAL(Category.LITERAL),
  INTEGER_LITERAL(Category.LITERAL),
  LONG_LITERAL(Category.LITERAL),
  SINGLE_LITERAL(Category.LITERAL),
  DOUBLE_LITERAL(Category.LITERAL),
  CURRENCY_LITERAL(Category.LITERAL),
  DATE_LITERAL(Category.LITERAL),

  // Punctuation
  DOLLAR_SIGN(Category.PUNCTUATION, "$"),
  UNDERSCORE(Category.PUNCTUATION, "_"),
  AMPERSAND(Category.PUNCTUATION, "&"),
  PERCENT(Category.PUNCTUATION, "%"),
  OCTOTHORPE(Category.PUNCTUATION, "#"),
  LEFT_PARENTHESIS(Category.PUNCTUATION, "("),
  RIGHT_PARENTHESIS(Category.PUNCTUATION, ")"),
  LEFT_CURLY_BRACE(Category.PUNCTUATION, "{"),
  RIGHT_CURLY_BRACE(Category.PUNCTUATION, "}"),
  LEFT_SQUARE_BRACKET(Category.PUNCTUATION, "["),
  RIGHT_SQUARE_BRACKET(Category.PUNCTUATION, "]"),
  COMMA(Category.PUNCTUATION, ","),
  SEMICOLON(Category.PUNCTUATION, ";"),
  AT_SIGN(Category.PUNCTUATION, "@"),
  EXCLAMATION_MARK(Category.PUNCTUATION, "!"),

  // Operators
  EQUALITY_OPERATOR(Category.OPERATOR, "="),
  INEQUALITY_OPERATOR(Category.OPERATOR, "<>"),
  LESS_THAN_OR_EQUAL_OPERATOR(Category.OPERATOR, "<="),
  GREATER_THAN_OR_EQUAL_OPERATOR(Category.OPERATOR, ">="),
  LESS_THAN_OPERATOR(Category.OPERATOR, "<"),
  GREATER_THAN_OPERATOR(Category.OPERATOR, ">"),
  MULTIPLICATION_OPERATOR(Category.OPERATOR, "*"),
  SUBTRACTION_OPERATOR(Category.OPERATOR, "-"),
  ADDITION_OPERATOR(Category.OPERATOR, "+"),
  DIVISION_OPERATOR(Category.OPERATOR, "/"),
  BACKWARD_SLASH_OPERATOR(Category.OPERATOR, "\\"),
  PERIOD_OPERATOR(Category.OPERATOR, "."),
  COLON_OPERATOR(Category.OPERATOR, ":"),
  EXPONENTIATION_OPERATOR(Category.OPERATOR, "^"),

  // Anything the tokenizer or parser could not classify.
  UNKNOWN(Category.ERROR);

  public enum Category {
    NODE,
    TRIVIA,
    KEYWORD,
    IDENTIFIER,
    LITERAL,
    PUNCTUATION,
    OPERATOR,
    ERROR;
  }

  private final Category category;
  private final Optional<String> text;

  SyntaxKind(Category category) {
    this.category = category;
    this.text = Optional.empty();
  }

  SyntaxKind(String keyword) {
    this(Category.KEYWORD, keyword);
  }

  SyntaxKind(Category category, String text) {
    this.category = category;
    this.text = Optional.of(text);
  }

  public Category category() {
    return category;
  }

  /** The canonical spelling, for keywords, punctuation and operators. */
  public Optional<String> text() {
    return text;
  }

  public boolean isToken() {
    return category != Category.NODE;
  }

  public boolean isNode() {
    return category == Category.NODE;
  }

  public boolean isKeyword() {
    return category == Category.KEYWORD;
  }

  public boolean isTrivia() {
    return category == Category.TRIVIA;
  }

  public boolean isComment() {
    return this == END_OF_LINE_COMMENT || this == REM_COMMENT;
  }

  public boolean isLiteral() {
    return category == Category.LITERAL;
  }

  /** True for identifiers and for keywords, which may stand in for identifiers. */
  public boolean isName() {
    return category == Category.IDENTIFIER || category == Category.KEYWORD;
  }

  public int raw() {
    return ordinal();
  }

  public String displayName() {
    return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name());
  }

  private static final ImmutableList<SyntaxKind> VALUES = ImmutableList.copyOf(values());

  public static SyntaxKind fromRaw(int raw) {
    return VALUES.get(raw);
  }

  private static final ImmutableMap<String, SyntaxKind> KEYWORDS =
      Arrays.stream(values())
          .filter(SyntaxKind::isKeyword)
          .collect(ImmutableMap.toImmutableMap(k -> k.text.get().toLowerCase(), k -> k));

  private static final ImmutableMap<String, SyntaxKind> SYMBOLS =
      Arrays.stream(values())
          .filter(
              k -> k.category == Category.PUNCTUATION || k.category == Category.OPERATOR)
          .collect(ImmutableMap.toImmutableMap(k -> k.text.get(), k -> k));

  static {
    // Node kinds are declared ahead of every token kind.
    Verify.verify(
        Arrays.stream(values()).filter(SyntaxKind::isKeyword).allMatch(k -> k.text.isPresent()));
    Verify.verify(
        Arrays.stream(values())
            .filter(SyntaxKind::isNode)
            .allMatch(k -> k.ordinal() < WHITESPACE.ordinal()));
  }

  /** Looks up a keyword case-insensitively. */
  public static Optional<SyntaxKind> keyword(String word) {
    return Optional.ofNullable(KEYWORDS.get(word.toLowerCase()));
  }

  public static Optional<SyntaxKind> symbol(String symbol) {
    return Optional.ofNullable(SYMBOLS.get(symbol));
  }
}
