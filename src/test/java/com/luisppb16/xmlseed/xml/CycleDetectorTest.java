/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml;

import static com.luisppb16.xmlseed.SchemaFixtures.index;
import static com.luisppb16.xmlseed.SchemaFixtures.xs;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.luisppb16.xmlseed.SchemaFixtures;
import com.luisppb16.xmlseed.schema.SchemaDocumentLoader;
import com.luisppb16.xmlseed.schema.SchemaIndexBuilder;
import com.luisppb16.xmlseed.util.CircularReferenceException;
import com.luisppb16.xmlseed.xml.CycleDetector.CycleCheckResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CycleDetectorTest {

  @Test
  @DisplayName("Element whose type refers back to the element: Node -> type:NodeType -> Node")
  void directCycleThroughRef() {
    final CycleCheckResult result =
        CycleDetector.check(
            SchemaIndexBuilder.build(SchemaDocumentLoader.parse(SchemaFixtures.path("cyclic.xsd"))));

    assertThat(result.isAcyclic()).isFalse();
    assertThat(result.cyclePath()).containsExactly("element:Node", "type:NodeType", "element:Node");
    assertThatThrownBy(result::orThrow)
        .isInstanceOf(CircularReferenceException.class)
        .hasMessage("Circular reference detected: element:Node -> type:NodeType -> element:Node")
        .satisfies(
            e ->
                assertThat(((CircularReferenceException) e).getPath())
                    .containsExactly("element:Node", "type:NodeType", "element:Node"));
  }

  @Test
  void cycleThroughIntermediateNamedType() {
    final CycleCheckResult result = CycleDetector.check(index(xs(
        "<xs:element name=\"A\" type=\"AType\"/>"
            + "<xs:complexType name=\"AType\"><xs:sequence>"
            + "<xs:element name=\"b\" type=\"BType\"/>"
            + "</xs:sequence></xs:complexType>"
            + "<xs:complexType name=\"BType\"><xs:choice>"
            + "<xs:element name=\"leaf\" type=\"xs:string\"/>"
            + "<xs:element ref=\"A\" minOccurs=\"0\"/>"
            + "</xs:choice></xs:complexType>")));

    assertThat(result.cyclePath())
        .containsExactly("element:A", "type:AType", "type:BType", "element:A");
  }

  @Test
  void cycleThroughTypeOnlyWithoutGlobalElements() {
    final CycleCheckResult result = CycleDetector.check(index(xs(
        "<xs:complexType name=\"Tree\"><xs:sequence>"
            + "<xs:element name=\"child\" type=\"Tree\" minOccurs=\"0\" maxOccurs=\"unbounded\"/>"
            + "</xs:sequence></xs:complexType>")));

    assertThat(result.cyclePath()).containsExactly("type:Tree", "type:Tree");
  }

  @Test
  void cycleInsideInlineType() {
    final CycleCheckResult result = CycleDetector.check(index(xs(
        "<xs:element name=\"folder\"><xs:complexType><xs:sequence>"
            + "<xs:element ref=\"folder\" minOccurs=\"0\"/>"
            + "</xs:sequence></xs:complexType></xs:element>")));

    assertThat(result.cyclePath())
        .containsExactly("element:folder", "inline-in:folder", "element:folder");
  }

  @Test
  void cycleThroughDerivationAndSimpleTypes() {
    assertThat(CycleDetector.check(index(xs(
            "<xs:complexType name=\"A\"><xs:complexContent><xs:extension base=\"B\"/>"
                + "</xs:complexContent></xs:complexType>"
                + "<xs:complexType name=\"B\"><xs:complexContent><xs:extension base=\"A\"/>"
                + "</xs:complexContent></xs:complexType>")))
            .cyclePath())
        .containsExactly("type:A", "type:B", "type:A");

    assertThat(CycleDetector.check(index(xs(
            "<xs:simpleType name=\"S\"><xs:restriction base=\"S\"/></xs:simpleType>")))
            .cyclePath())
        .containsExactly("type:S", "type:S");
  }

  @Test
  @DisplayName("Reaching the same type through two different paths is not a cycle")
  void diamondIsAcyclic() {
    final CycleCheckResult result = CycleDetector.check(index(xs(
        "<xs:element name=\"root\"><xs:complexType><xs:sequence>"
            + "<xs:element name=\"home\" type=\"Address\"/>"
            + "<xs:element name=\"work\" type=\"Address\"/>"
            + "<xs:element ref=\"note\"/><xs:element ref=\"note\"/>"
            + "</xs:sequence></xs:complexType></xs:element>"
            + "<xs:element name=\"note\" type=\"xs:string\"/>"
            + "<xs:complexType name=\"Address\"><xs:sequence>"
            + "<xs:element name=\"street\" type=\"xs:string\"/>"
            + "</xs:sequence></xs:complexType>")));

    assertThat(result.isAcyclic()).isTrue();
    assertThat(result.cyclePath()).isEmpty();
    assertThat(result.orThrow()).isSameAs(result);
  }

  @Test
  void danglingReferencesAreNotCycles() {
    final CycleCheckResult result = CycleDetector.check(index(xs(
        "<xs:element name=\"root\" type=\"Missing\"/>"
            + "<xs:complexType name=\"T\"><xs:sequence><xs:element ref=\"ghost\"/>"
            + "</xs:sequence></xs:complexType>")));

    assertThat(result.isAcyclic()).isTrue();
  }

  @Test
  @DisplayName("Unprefixed user types under a default XML Schema namespace are followed")
  void cycleUnderDefaultSchemaNamespace() {
    final String schema =
        "<schema xmlns=\"http://www.w3.org/2001/XMLSchema\">"
            + "<element name=\"Node\" type=\"NodeType\"/>"
            + "<complexType name=\"NodeType\"><sequence>"
            + "<element ref=\"Node\" minOccurs=\"0\"/>"
            + "</sequence></complexType></schema>";

    final CycleCheckResult result = CycleDetector.check(index(schema));

    assertThat(result.isAcyclic()).isFalse();
    assertThat(result.cyclePath()).containsExactly("element:Node", "type:NodeType", "element:Node");
    assertThatThrownBy(() -> XmlGenerator.fromString(schema))
        .isInstanceOf(CircularReferenceException.class);
  }

  @Test
  void schemasUsedByGenerationTestsAreAcyclic() {
    for (final String name : new String[] {"person.xsd", "catalog.xsd", "extension.xsd", "default-namespace.xsd"}) {
      assertThat(
              CycleDetector.check(
                      SchemaIndexBuilder.build(
                          SchemaDocumentLoader.parse(SchemaFixtures.path(name))))
                  .isAcyclic())
          .as(name)
          .isTrue();
    }
  }
}
