/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.validate;

import com.luisppb16.xmlseed.util.SchemaNotFoundException;
import com.luisppb16.xmlseed.util.XmlSeedException;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Validates XML text against an XML Schema file with JAXP. Every problem is collected instead of
 * stopping at the first one.
 */
@Slf4j
@UtilityClass
public class XsdValidator {

  public static ValidationReport validate(final String xml, final Path schemaPath) {
    if (!Files.isRegularFile(schemaPath)) {
      throw new SchemaNotFoundException("Schema file not found: " + schemaPath);
    }
    final Schema schema;
    try {
      schema =
          SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI)
              .newSchema(schemaPath.toFile());
    } catch (final SAXException e) {
      throw new XmlSeedException("Schema " + schemaPath + " cannot be compiled: " + e.getMessage(), e);
    }

    final List<String> violations = new ArrayList<>();
    final List<String> warnings = new ArrayList<>();
    final Validator validator = schema.newValidator();
    validator.setErrorHandler(
        new ErrorHandler() {
          @Override
          public void warning(final SAXParseException e) {
            warnings.add(describe(e));
          }

          @Override
          public void error(final SAXParseException e) {
            violations.add(describe(e));
          }

          @Override
          public void fatalError(final SAXParseException e) {
            violations.add(describe(e));
          }
        });

    try {
      validator.validate(new StreamSource(new StringReader(xml)));
    } catch (final SAXParseException e) {
      // already reported through the error handler
      log.debug("Validation stopped at line {}", e.getLineNumber());
    } catch (final SAXException e) {
      violations.add(e.getMessage());
    } catch (final IOException e) {
      throw new UncheckedIOException("Unable to read document under validation", e);
    }
    if (!violations.isEmpty()) {
      log.warn("Document is not valid against {}: {} violation(s)", schemaPath, violations.size());
    }
    return new ValidationReport(violations, warnings);
  }

  private static String describe(final SAXParseException e) {
    return "line " + e.getLineNumber() + ": " + e.getMessage();
  }
}
