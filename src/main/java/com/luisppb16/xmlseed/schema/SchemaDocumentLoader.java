/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.schema;

import com.luisppb16.xmlseed.util.SchemaNotFoundException;
import com.luisppb16.xmlseed.util.SchemaParseException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.io.SAXReader;
import org.jetbrains.annotations.NotNull;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/** Parses schema markup into a namespace-aware dom4j tree. DOCTYPE declarations are rejected. */
@Slf4j
@UtilityClass
public class SchemaDocumentLoader {

  private static final String DISALLOW_DOCTYPE_FEATURE =
      "http://apache.org/xml/features/disallow-doctype-decl";

  @NotNull
  public static Document parse(@NotNull final Path path) {
    if (!Files.isRegularFile(path)) {
      throw new SchemaNotFoundException("Schema file not found: " + path);
    }
    try (final InputStream in = Files.newInputStream(path)) {
      final Document document = newReader().read(in, path.toUri().toString());
      log.debug("Parsed schema document {}", path);
      return document;
    } catch (final DocumentException e) {
      throw new SchemaParseException("Malformed schema " + path + ": " + describe(e), e);
    } catch (final IOException e) {
      throw new SchemaNotFoundException("Unable to read schema file " + path, e);
    }
  }

  @NotNull
  public static Document parse(@NotNull final String markup) {
    try {
      return newReader().read(new StringReader(markup));
    } catch (final DocumentException e) {
      throw new SchemaParseException("Malformed schema: " + describe(e), e);
    }
  }

  private static SAXReader newReader() {
    final SAXReader reader = new SAXReader();
    try {
      reader.setFeature(DISALLOW_DOCTYPE_FEATURE, true);
    } catch (final SAXException e) {
      throw new IllegalStateException("XML parser does not support " + DISALLOW_DOCTYPE_FEATURE, e);
    }
    return reader;
  }

  private static String describe(final DocumentException e) {
    Throwable cause = e;
    while (cause != null) {
      if (cause instanceof SAXParseException spe) {
        return "line %d, column %d: %s"
            .formatted(spe.getLineNumber(), spe.getColumnNumber(), spe.getMessage());
      }
      cause = cause.getCause();
    }
    return e.getMessage();
  }
}
