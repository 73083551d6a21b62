/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed;

import com.luisppb16.xmlseed.action.GenerateXmlAction;
import com.luisppb16.xmlseed.action.GenerateXmlAction.GenerationRequest;
import com.luisppb16.xmlseed.action.GenerateXmlAction.Outcome;
import com.luisppb16.xmlseed.config.GenerationConfig;
import com.luisppb16.xmlseed.config.GenerationConfigLoader;
import com.luisppb16.xmlseed.util.XmlSeedException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Command line: {@code xml-seed [options] <schema.xsd | directory>}.
 *
 * <p>Exit codes: 0 success, 1 generation error, 2 usage error, 3 generated document failed
 * validation. In directory mode the worst code of the batch wins.
 */
@Slf4j
public final class Main {

  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE = "xml-seed [options] <schema.xsd | directory>";

  private Main() {}

  public static void main(final String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(final String[] args, final PrintStream out, final PrintStream err) {
    final Options options = options();
    final CommandLine cmd;
    try {
      cmd = new DefaultParser().parse(options, args);
    } catch (final ParseException e) {
      err.println(e.getMessage());
      printHelp(options, err);
      return EXIT_USAGE;
    }
    if (cmd.hasOption('h')) {
      printHelp(options, out);
      return EXIT_OK;
    }
    if (cmd.getArgList().size() != 1) {
      err.println("Expected exactly one schema file or directory.");
      printHelp(options, err);
      return EXIT_USAGE;
    }

    final GenerationConfig config;
    try {
      config = config(cmd);
    } catch (final IllegalArgumentException e) {
      err.println(e.getMessage());
      return EXIT_USAGE;
    }

    final Path input = Path.of(cmd.getArgList().get(0));
    final Path output = cmd.hasOption('o') ? Path.of(cmd.getOptionValue('o')) : null;
    final GenerationRequest request =
        GenerationRequest.builder()
            .schema(input)
            .rootName(cmd.getOptionValue('r'))
            .output(output)
            .config(config)
            .validate(cmd.hasOption('v'))
            .build();
    final GenerateXmlAction action = new GenerateXmlAction();

    try {
      if (Files.isDirectory(input)) {
        final List<Outcome> outcomes = action.runBatch(input, output, request);
        int exitCode = EXIT_OK;
        for (final Outcome outcome : outcomes) {
          report(outcome, out, err, false);
          exitCode = Math.max(exitCode, outcome.exitCode());
        }
        return exitCode;
      }
      final Outcome outcome = action.run(request);
      report(outcome, out, err, output == null);
      return outcome.exitCode();
    } catch (final XmlSeedException e) {
      err.println(e.getMessage());
      return EXIT_ERROR;
    }
  }

  private static GenerationConfig config(final CommandLine cmd) {
    GenerationConfig config =
        cmd.hasOption('c')
            ? GenerationConfigLoader.load(Path.of(cmd.getOptionValue('c')))
            : GenerationConfig.defaults();
    if (cmd.hasOption('s')) {
      final String seed = cmd.getOptionValue('s');
      try {
        config = config.toBuilder().seed(Long.parseLong(seed.trim())).build();
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException("Seed must be a whole number, got '" + seed + "'", e);
      }
    }
    log.debug("Effective configuration: {}", config);
    return config;
  }

  private static void report(
      final Outcome outcome, final PrintStream out, final PrintStream err, final boolean printXml) {
    if (outcome.report() != null) {
      outcome.report().warnings().forEach(w -> err.println(outcome.schema() + ": warning: " + w));
    }
    switch (outcome.status()) {
      case GENERATED -> {
        if (printXml) {
          out.print(outcome.xml());
          out.flush();
        } else if (outcome.output() != null) {
          out.println(outcome.schema() + " -> " + outcome.output());
        }
      }
      case INVALID -> {
        if (printXml) {
          out.print(outcome.xml());
          out.flush();
        }
        err.println(outcome.schema() + ": " + outcome.message());
      }
      case FAILED -> err.println(outcome.schema() + ": " + outcome.message());
    }
  }

  private static Options options() {
    final Options options = new Options();
    options.addOption(
        Option.builder("r").longOpt("root").hasArg().argName("name")
            .desc("element to use as document root (default: chosen from the schema)").build());
    options.addOption(
        Option.builder("o").longOpt("output").hasArg().argName("path")
            .desc("output file, or output directory when the input is a directory").build());
    options.addOption(
        Option.builder("s").longOpt("seed").hasArg().argName("long")
            .desc("seed for reproducible output").build());
    options.addOption(
        Option.builder("c").longOpt("config").hasArg().argName("file.json")
            .desc("generation settings in JSON").build());
    options.addOption(
        Option.builder("v").longOpt("validate")
            .desc("validate every generated document against its schema").build());
    options.addOption(Option.builder("h").longOpt("help").desc("print this help").build());
    return options;
  }

  private static void printHelp(final Options options, final PrintStream stream) {
    final PrintWriter writer = new PrintWriter(stream);
    new HelpFormatter()
        .printHelp(
            writer,
            HelpFormatter.DEFAULT_WIDTH,
            USAGE,
            null,
            options,
            HelpFormatter.DEFAULT_LEFT_PAD,
            HelpFormatter.DEFAULT_DESC_PAD,
            null);
    writer.flush();
  }
}
