package vbcst;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Files;

public class ParserMain {

  private static final String STRICT_FLAG = "--strict";

  public static void main(String[] args) throws IOException {
    boolean strict = args.length == 2 && args[1].equals(STRICT_FLAG);
    if (args.length != 1 && !strict) {
      System.err.println("Usage: $PARSER vb_file [" + STRICT_FLAG + "]");
      System.exit(1);
    }

    File file = new File(args[0]);
    ConcreteSyntaxTree tree = ConcreteSyntaxTree.fromSource(file.toString(), read(file));
    System.out.print(tree.debugTree());
    if (!strict) {
      tree.diagnostics().forEach(ParseDiagnostic::print);
      return;
    }

    try {
      tree.verifyNoDiagnostics();
    } catch (ParseException ex) {
      ex.print();
      System.out.println("Parse failed.  See error above.");
      System.exit(1);
    }
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}
