/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.output;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.dom4j.Document;
import org.dom4j.io.OutputFormat;
import org.dom4j.io.XMLWriter;

/** Serializes generated documents: XML declaration, UTF-8, two-space indentation. */
@Slf4j
@UtilityClass
public class XmlDocumentWriter {

  public static String toString(final Document document) {
    final StringWriter out = new StringWriter();
    try {
      final XMLWriter writer = new XMLWriter(out, format());
      writer.write(document);
      writer.flush();
    } catch (final IOException e) {
      throw new UncheckedIOException("Unable to serialize document", e);
    }
    return out.toString();
  }

  /** Writes {@code document} to {@code target}, creating missing parent directories. */
  public static void write(final Document document, final Path target) {
    try {
      final Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (final OutputStream out = Files.newOutputStream(target)) {
        final XMLWriter writer = new XMLWriter(out, format());
        writer.write(document);
        writer.flush();
      }
      log.debug("Document written to {}", target);
    } catch (final IOException e) {
      throw new UncheckedIOException("Unable to write document to " + target, e);
    }
  }

  private static OutputFormat format() {
    final OutputFormat format = OutputFormat.createPrettyPrint();
    format.setIndentSize(2);
    format.setEncoding(StandardCharsets.UTF_8.name());
    format.setTrimText(false);
    format.setNewLineAfterDeclaration(false);
    return format;
  }
}
