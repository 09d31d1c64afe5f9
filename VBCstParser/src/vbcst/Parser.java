package vbcst;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;

/** Entry point: turns a token stream into a {@link ConcreteSyntaxTree}. Never throws on input. */
public final class Parser {
  private static final Logger logger = LogManager.getLogger(Parser.class);

  private Parser() {}

  public static ConcreteSyntaxTree parse(TokenStream tokens) {
    return parse(tokens, ParserOptions.defaults());
  }

  public static ConcreteSyntaxTree parse(TokenStream tokens, ParserOptions options) {
    logger.debug("parsing {}: {} tokens", tokens.fileName(), tokens.size());

    ParserState state = new ParserState(tokens, options);
    new StatementParser(state).parseModule();
    CstNode root = state.builder().finish();

    ImmutableList<ParseDiagnostic> diagnostics =
        ImmutableList.<ParseDiagnostic>builder()
            .addAll(tokens.diagnostics())
            .addAll(state.diagnostics())
            .build();
    logger.debug("parsed {}: {} diagnostics", tokens.fileName(), diagnostics.size());
    return ConcreteSyntaxTree.create(root, diagnostics);
  }
}
