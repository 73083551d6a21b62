/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.luisppb16.xmlseed.SchemaFixtures;
import com.luisppb16.xmlseed.util.SchemaNotFoundException;
import com.luisppb16.xmlseed.util.SchemaParseException;
import java.nio.file.Path;
import org.dom4j.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaDocumentLoaderTest {

  @Test
  void parsesFileNamespaceAware() {
    final Document document = SchemaDocumentLoader.parse(SchemaFixtures.path("person.xsd"));

    assertThat(document.getRootElement().getName()).isEqualTo("schema");
    assertThat(document.getRootElement().getNamespaceURI())
        .isEqualTo(SchemaFormat.XSD_NAMESPACE);
    assertThat(SchemaFormat.detect(document.getRootElement())).isEqualTo(SchemaFormat.XSD);
  }

  @Test
  void missingFile(@TempDir final Path dir) {
    final Path missing = dir.resolve("nope.xsd");
    assertThatThrownBy(() -> SchemaDocumentLoader.parse(missing))
        .isInstanceOf(SchemaNotFoundException.class)
        .hasMessageContaining("nope.xsd");
  }

  @Test
  void malformedMarkupReportsPosition() {
    assertThatThrownBy(() -> SchemaDocumentLoader.parse("<xs:schema>\n  <unclosed>\n</xs:schema>"))
        .isInstanceOf(SchemaParseException.class)
        .hasMessageContaining("line");
  }

  @Test
  void doctypeIsRejected() {
    final String markup =
        "<!DOCTYPE schema [<!ENTITY x \"y\">]>"
            + "<schema xmlns=\"http://www.w3.org/2001/XMLSchema\"/>";
    assertThatThrownBy(() -> SchemaDocumentLoader.parse(markup))
        .isInstanceOf(SchemaParseException.class);
  }

  @Test
  void relaxNgIsDetected() {
    final Document document = SchemaDocumentLoader.parse(SchemaFixtures.path("address.rng"));
    assertThat(SchemaFormat.detect(document.getRootElement())).isEqualTo(SchemaFormat.RELAX_NG);
  }
}
