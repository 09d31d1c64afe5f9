package vbcst;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

@AutoValue
public abstract class ParserOptions {
  public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

  /**
   * The deepest combined block and expression nesting the parser descends into. Deeper input is
   * kept verbatim as unknown tokens.
   */
  public abstract int maxNestingDepth();

  public static ParserOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_ParserOptions.Builder().setMaxNestingDepth(DEFAULT_MAX_NESTING_DEPTH);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMaxNestingDepth(int maxNestingDepth);

    abstract ParserOptions doBuild();

    public ParserOptions build() {
      ParserOptions options = doBuild();
      Preconditions.checkArgument(
          options.maxNestingDepth() > 0, "maxNestingDepth must be positive");
      return options;
    }
  }
}
