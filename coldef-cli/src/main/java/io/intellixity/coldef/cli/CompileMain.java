package io.intellixity.coldef.cli;

import io.intellixity.coldef.ddl.TableDdlRenderer;
import io.intellixity.coldef.json.TableSpecs;
import io.intellixity.coldef.model.TableSpec;
import io.intellixity.coldef.spi.sql.DiscoveredDialectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * CLI:
 *   CompileMain <dialectId> <tableSpec.json>...
 *
 * Prints one CREATE TABLE statement per table found in the given files.
 */
public final class CompileMain {
  private static final Logger log = LoggerFactory.getLogger(CompileMain.class);

  static final int EXIT_USAGE = 2;

  private CompileMain() {}

  public static void main(String[] args) throws IOException {
    int code = run(args, new DiscoveredDialectRegistry(), System.out, System.err);
    if (code != 0) System.exit(code);
  }

  static int run(String[] args, DiscoveredDialectRegistry dialects, PrintStream out, PrintStream err) throws IOException {
    if (args.length < 2) {
      err.println("Usage: CompileMain <dialectId> <tableSpec.json>...");
      err.println("Known dialects: " + dialects.ids());
      return EXIT_USAGE;
    }

    TableDdlRenderer ddl;
    try {
      ddl = new TableDdlRenderer(dialects.compiler(args[0]));
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println("Usage: CompileMain <dialectId> <tableSpec.json>...");
      err.println("Known dialects: " + dialects.ids());
      return EXIT_USAGE;
    }
    int tables = 0;
    for (int i = 1; i < args.length; i++) {
      Path file = Paths.get(args[i]);
      List<TableSpec> specs = TableSpecs.readAll(file);
      for (TableSpec t : specs) {
        out.println(ddl.createTable(t, true) + ";");
        out.println();
        tables++;
      }
    }

    log.info("coldef.cli dialect={} files={} tables={}", args[0], args.length - 1, tables);
    return 0;
  }
}
