/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.action;

import com.luisppb16.xmlseed.config.GenerationConfig;
import com.luisppb16.xmlseed.output.XmlDocumentWriter;
import com.luisppb16.xmlseed.util.SchemaNotFoundException;
import com.luisppb16.xmlseed.util.XmlSeedException;
import com.luisppb16.xmlseed.validate.ValidationReport;
import com.luisppb16.xmlseed.validate.XsdValidator;
import com.luisppb16.xmlseed.xml.XmlGenerator;
import com.luisppb16.xmlseed.xml.XmlGenerator.GenerationParameters;
import com.luisppb16.xmlseed.xml.XmlGenerator.GenerationResult;
import com.luisppb16.xmlseed.xml.XmlSchemaSession;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One schema file in, one document out: load, generate, serialize, optionally write and validate.
 * Failures are reported in the {@link Outcome} rather than thrown, so a batch keeps going.
 */
@Slf4j
public final class GenerateXmlAction {

  private static final String SCHEMA_EXTENSION = ".xsd";
  private static final String DOCUMENT_EXTENSION = ".xml";

  public Outcome run(final GenerationRequest request) {
    Objects.requireNonNull(request, "Generation request cannot be null");
    final Path schema = Objects.requireNonNull(request.schema(), "Schema path cannot be null");
    try {
      final XmlSchemaSession session = XmlGenerator.load(schema);
      final GenerationResult result =
          XmlGenerator.generate(
              GenerationParameters.builder()
                  .session(session)
                  .rootName(request.rootName())
                  .config(request.config())
                  .build());
      final String xml = XmlDocumentWriter.toString(result.document());
      if (request.output() != null) {
        XmlDocumentWriter.write(result.document(), request.output());
        log.info("Wrote {} for schema {}", request.output(), schema);
      }

      if (!request.validate()) {
        return new Outcome(schema, request.output(), xml, Status.GENERATED, null, null);
      }
      final ValidationReport report = XsdValidator.validate(xml, schema);
      return report.isValid()
          ? new Outcome(schema, request.output(), xml, Status.GENERATED, null, report)
          : new Outcome(
              schema,
              request.output(),
              xml,
              Status.INVALID,
              "Generated document is not valid: " + String.join("; ", report.violations()),
              report);
    } catch (final XmlSeedException | UncheckedIOException e) {
      log.warn("Generation failed for {}: {}", schema, e.getMessage());
      return new Outcome(schema, request.output(), null, Status.FAILED, e.getMessage(), null);
    }
  }

  /**
   * Runs {@code template} once per {@code *.xsd} file directly inside {@code directory}, in name
   * order. Each document goes to {@code outputDirectory} (or next to its schema) under the
   * schema's base name with an {@code .xml} extension.
   */
  public List<Outcome> runBatch(
      final Path directory, final Path outputDirectory, final GenerationRequest template) {
    final List<Path> schemas;
    try (final Stream<Path> files = Files.list(directory)) {
      schemas =
          files
              .filter(Files::isRegularFile)
              .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(SCHEMA_EXTENSION))
              .sorted()
              .toList();
    } catch (final IOException e) {
      throw new SchemaNotFoundException("Unable to list schema directory " + directory, e);
    }
    if (schemas.isEmpty()) {
      throw new SchemaNotFoundException("No " + SCHEMA_EXTENSION + " files found in " + directory);
    }

    final List<Outcome> outcomes = new ArrayList<>();
    for (final Path schema : schemas) {
      final Path targetDirectory = outputDirectory != null ? outputDirectory : schema.getParent();
      outcomes.add(
          run(
              template.toBuilder()
                  .schema(schema)
                  .output(targetDirectory.resolve(documentName(schema)))
                  .build()));
    }
    final long failed = outcomes.stream().filter(o -> o.status() != Status.GENERATED).count();
    log.info("Batch over {}: {} schemas, {} failed", directory, outcomes.size(), failed);
    return outcomes;
  }

  private static String documentName(final Path schema) {
    final String fileName = schema.getFileName().toString();
    return fileName.substring(0, fileName.length() - SCHEMA_EXTENSION.length())
        + DOCUMENT_EXTENSION;
  }

  /**
   * @param rootName element to instantiate, {@code null} to let the generator choose
   * @param output file to write, {@code null} to only return the text
   */
  @Builder(toBuilder = true)
  public record GenerationRequest(
      Path schema, String rootName, Path output, GenerationConfig config, boolean validate) {}

  /**
   * @param xml the serialized document, {@code null} when generation failed
   * @param message failure description, {@code null} on success
   * @param report validation result, {@code null} when validation did not run
   */
  public record Outcome(
      Path schema,
      Path output,
      String xml,
      Status status,
      String message,
      ValidationReport report) {

    public int exitCode() {
      return status.getExitCode();
    }
  }

  @Getter
  @RequiredArgsConstructor
  public enum Status {
    GENERATED(0),
    FAILED(1),
    INVALID(3);

    private final int exitCode;
  }
}
