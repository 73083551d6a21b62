/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml;

import static com.luisppb16.xmlseed.SchemaFixtures.xs;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.luisppb16.xmlseed.SchemaFixtures;
import com.luisppb16.xmlseed.config.GenerationConfig;
import com.luisppb16.xmlseed.util.CircularReferenceException;
import com.luisppb16.xmlseed.util.GenerationDepthExceededException;
import com.luisppb16.xmlseed.util.NoRootElementException;
import com.luisppb16.xmlseed.xml.XmlGenerator.GenerationParameters;
import com.luisppb16.xmlseed.xml.XmlGenerator.GenerationResult;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.dom4j.Document;
import org.dom4j.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class XmlGeneratorTest {

  private static final int TRIALS = 100;

  private Random random;

  @BeforeEach
  void setUp() {
    random = new Random(20_240_317L);
  }

  private Document generate(final XmlSchemaSession session, final String root) {
    return XmlGenerator.generate(
            GenerationParameters.builder().session(session).rootName(root).random(random).build())
        .document();
  }

  @Nested
  @DisplayName("Person scenario")
  class PersonScenario {

    @Test
    void everyDocumentMatchesThePersonContract() {
      final XmlSchemaSession session = XmlGenerator.load(SchemaFixtures.path("person.xsd"));
      final Set<Integer> ageCounts = new HashSet<>();

      for (int i = 0; i < TRIALS; i++) {
        final Element person = generate(session, null).getRootElement();

        assertThat(person.getName()).isEqualTo("Person");
        assertThat(Long.parseLong(person.attributeValue("id"))).isBetween(1L, 1000L);
        final List<Element> names = person.elements("Name");
        assertThat(names).hasSize(1);
        assertThat(names.get(0).getText()).isNotBlank();
        final List<Element> ages = person.elements("Age");
        assertThat(ages).hasSizeLessThanOrEqualTo(1);
        ages.forEach(age -> assertThat(Long.parseLong(age.getText())).isPositive());
        ageCounts.add(ages.size());
      }
      assertThat(ageCounts).containsExactlyInAnyOrder(0, 1);
    }

    @Test
    void resultReportsCounts() {
      final XmlSchemaSession session = XmlGenerator.load(SchemaFixtures.path("person.xsd"));
      final GenerationResult result =
          XmlGenerator.generate(
              GenerationParameters.builder().session(session).random(random).build());

      assertThat(result.rootName()).isEqualTo("Person");
      assertThat(result.attributeCount()).isEqualTo(1);
      assertThat(result.elementCount())
          .isEqualTo(1 + result.document().getRootElement().elements().size());
    }
  }

  @Nested
  class Occurrences {

    @Test
    @DisplayName("minOccurs=2 maxOccurs=4 always yields 2 to 4 instances")
    void boundedRange() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"list\"><xs:complexType><xs:sequence>"
              + "<xs:element name=\"entry\" type=\"xs:string\" minOccurs=\"2\" maxOccurs=\"4\"/>"
              + "</xs:sequence></xs:complexType></xs:element>"));
      final Set<Integer> seen = new HashSet<>();

      for (int i = 0; i < TRIALS; i++) {
        final int count = generate(session, "list").getRootElement().elements("entry").size();
        assertThat(count).isBetween(2, 4);
        seen.add(count);
      }
      assertThat(seen).containsExactlyInAnyOrder(2, 3, 4);
    }

    @Test
    @DisplayName("maxOccurs=unbounded stays within the configured ceiling")
    void unboundedIsCapped() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"list\"><xs:complexType><xs:sequence>"
              + "<xs:element name=\"entry\" type=\"xs:int\" minOccurs=\"1\" maxOccurs=\"unbounded\"/>"
              + "</xs:sequence></xs:complexType></xs:element>"));

      for (int i = 0; i < TRIALS; i++) {
        assertThat(generate(session, "list").getRootElement().elements("entry").size())
            .isBetween(1, GenerationConfig.DEFAULT_UNBOUNDED_MAX_OCCURS);
      }
    }

    @Test
    void unboundedCeilingFollowsConfiguration() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"list\"><xs:complexType><xs:sequence>"
              + "<xs:element name=\"entry\" type=\"xs:int\" minOccurs=\"7\" maxOccurs=\"unbounded\"/>"
              + "</xs:sequence></xs:complexType></xs:element>"));
      final GenerationConfig config =
          GenerationConfig.builder().unboundedMinOccurs(1).unboundedMaxOccurs(2).build();

      for (int i = 0; i < 20; i++) {
        final Document document =
            XmlGenerator.generate(
                    GenerationParameters.builder()
                        .session(session)
                        .random(random)
                        .config(config)
                        .build())
                .document();
        assertThat(document.getRootElement().elements("entry")).hasSize(7);
      }
    }

    @Test
    void groupOccurrenceRepeatsTheWholeGroup() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"pairs\"><xs:complexType>"
              + "<xs:sequence minOccurs=\"3\" maxOccurs=\"3\">"
              + "<xs:element name=\"key\" type=\"xs:string\"/>"
              + "<xs:element name=\"value\" type=\"xs:int\"/>"
              + "</xs:sequence></xs:complexType></xs:element>"));

      final List<Element> children = generate(session, null).getRootElement().elements();

      assertThat(children).extracting(Element::getName)
          .containsExactly("key", "value", "key", "value", "key", "value");
    }
  }

  @Nested
  class ContentModels {

    @Test
    void choicePicksExactlyOneBranch() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"payment\"><xs:complexType><xs:choice>"
              + "<xs:element name=\"card\" type=\"xs:string\"/>"
              + "<xs:element name=\"cash\" type=\"xs:decimal\"/>"
              + "<xs:element name=\"voucher\" type=\"xs:string\"/>"
              + "</xs:choice></xs:complexType></xs:element>"));
      final Set<String> branches = new HashSet<>();

      for (int i = 0; i < TRIALS; i++) {
        final List<Element> children = generate(session, null).getRootElement().elements();
        assertThat(children).hasSize(1);
        branches.add(children.get(0).getName());
      }
      assertThat(branches).containsExactlyInAnyOrder("card", "cash", "voucher");
    }

    @Test
    @DisplayName("All-group children are emitted in document order")
    void allGroupKeepsDocumentOrder() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"root\"><xs:complexType><xs:all>"
              + "<xs:element name=\"x\" type=\"xs:string\"/>"
              + "<xs:element name=\"y\" type=\"xs:boolean\"/>"
              + "<xs:element name=\"z\" type=\"xs:date\"/>"
              + "</xs:all></xs:complexType></xs:element>"));

      for (int i = 0; i < 10; i++) {
        assertThat(generate(session, "root").getRootElement().elements())
            .extracting(Element::getName)
            .containsExactly("x", "y", "z");
      }
    }

    @Test
    void nestedChoiceInsideSequence() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"root\"><xs:complexType><xs:sequence>"
              + "<xs:element name=\"head\" type=\"xs:string\"/>"
              + "<xs:choice><xs:element name=\"left\" type=\"xs:string\"/>"
              + "<xs:element name=\"right\" type=\"xs:string\"/></xs:choice>"
              + "<xs:element name=\"tail\" type=\"xs:string\"/>"
              + "</xs:sequence></xs:complexType></xs:element>"));

      for (int i = 0; i < 20; i++) {
        final List<String> names =
            generate(session, null).getRootElement().elements().stream()
                .map(Element::getName)
                .toList();
        assertThat(names).hasSize(3).startsWith("head").endsWith("tail");
        assertThat(names.get(1)).isIn("left", "right");
      }
    }

    @Test
    void extensionEmitsBaseContentFirst() {
      final XmlSchemaSession session = XmlGenerator.load(SchemaFixtures.path("extension.xsd"));

      final Element employee = generate(session, null).getRootElement();

      assertThat(employee.getName()).isEqualTo("employee");
      assertThat(employee.elements())
          .extracting(Element::getName)
          .containsExactly("firstName", "lastName", "department", "skill", "skill");
      assertThat(employee.attributeValue("id")).isNotNull();
      assertThat(employee.attributeValue("badge")).isNotNull();
    }

    @Test
    void elementWithoutTypeIsPresentButEmpty() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"root\"><xs:complexType><xs:sequence>"
              + "<xs:element name=\"marker\"/>"
              + "</xs:sequence></xs:complexType></xs:element>"));

      final Element marker = generate(session, null).getRootElement().element("marker");

      assertThat(marker).isNotNull();
      assertThat(marker.getText()).isEmpty();
    }

    @Test
    void fixedValuesAreUsedVerbatim() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"root\"><xs:complexType><xs:sequence>"
              + "<xs:element name=\"version\" type=\"xs:string\" fixed=\"2.1\"/>"
              + "</xs:sequence>"
              + "<xs:attribute name=\"kind\" type=\"xs:string\" fixed=\"demo\" use=\"required\"/>"
              + "</xs:complexType></xs:element>"));

      final Element root = generate(session, null).getRootElement();

      assertThat(root.elementText("version")).isEqualTo("2.1");
      assertThat(root.attributeValue("kind")).isEqualTo("demo");
    }
  }

  @Nested
  class Constraints {

    @Test
    @DisplayName("Enumerated values are always one of the declared literals")
    void enumerationContainment() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:simpleType name=\"Grade\"><xs:restriction base=\"xs:string\">"
              + "<xs:enumeration value=\"A\"/><xs:enumeration value=\"B\"/>"
              + "<xs:enumeration value=\"C\"/></xs:restriction></xs:simpleType>"
              + "<xs:element name=\"report\"><xs:complexType><xs:sequence>"
              + "<xs:element name=\"grade\" type=\"Grade\"/>"
              + "<xs:element name=\"inline\"><xs:simpleType><xs:restriction base=\"xs:string\">"
              + "<xs:enumeration value=\"A\"/><xs:enumeration value=\"B\"/>"
              + "<xs:enumeration value=\"C\"/></xs:restriction></xs:simpleType></xs:element>"
              + "</xs:sequence>"
              + "<xs:attribute name=\"level\" type=\"Grade\" use=\"required\"/>"
              + "</xs:complexType></xs:element>"));

      for (int i = 0; i < TRIALS; i++) {
        final Element report = generate(session, null).getRootElement();
        assertThat(report.elementText("grade")).isIn("A", "B", "C");
        assertThat(report.elementText("inline")).isIn("A", "B", "C");
        assertThat(report.attributeValue("level")).isIn("A", "B", "C");
      }
    }

    @Test
    void restrictedIntegersStayInRange() {
      final XmlSchemaSession session = XmlGenerator.load(SchemaFixtures.path("catalog.xsd"));

      for (int i = 0; i < TRIALS; i++) {
        for (final Element item : generate(session, null).getRootElement().elements("item")) {
          assertThat(Integer.parseInt(item.elementText("quantity"))).isBetween(5, 9);
          assertThat(item.elementText("sku")).matches("\\d{8}");
          assertThat(item.elementText("title")).hasSizeBetween(3, 20);
        }
      }
    }
  }

  private static final String ATTRIBUTE_SCHEMA = xs(
        "<xs:element name=\"tag\"><xs:complexType>"
            + "<xs:attribute name=\"key\" type=\"xs:string\" use=\"required\"/>"
            + "<xs:attribute name=\"note\" type=\"xs:string\"/>"
            + "<xs:attribute name=\"hidden\" type=\"xs:string\" use=\"prohibited\"/>"
            + "</xs:complexType></xs:element>");

  @Nested
  class Attributes {

    @Test
    @DisplayName("Required attributes are always present, optional ones sometimes")
    void presenceRates() {
      final XmlSchemaSession session = XmlGenerator.fromString(ATTRIBUTE_SCHEMA);
      int optionalPresent = 0;

      for (int i = 0; i < 200; i++) {
        final Element tag = generate(session, null).getRootElement();
        assertThat(tag.attribute("key")).isNotNull();
        assertThat(tag.attribute("hidden")).isNull();
        if (tag.attribute("note") != null) {
          optionalPresent++;
        }
      }
      assertThat(optionalPresent).isStrictlyBetween(0, 200);
    }

    @Test
    void optionalProbabilityIsConfigurable() {
      final XmlSchemaSession session = XmlGenerator.fromString(ATTRIBUTE_SCHEMA);
      final GenerationConfig never =
          GenerationConfig.builder().optionalAttributeProbability(0.0).build();

      for (int i = 0; i < 50; i++) {
        final Element tag =
            XmlGenerator.generate(
                    GenerationParameters.builder()
                        .session(session)
                        .random(random)
                        .config(never)
                        .build())
                .document()
                .getRootElement();
        assertThat(tag.attribute("note")).isNull();
      }
    }
  }

  @Nested
  class Roots {

    @Test
    void explicitRootIsHonoured() {
      final XmlSchemaSession session = XmlGenerator.load(SchemaFixtures.path("catalog.xsd"));

      final Document document = XmlGenerator.generateDocument(session, "note");

      assertThat(document.getRootElement().getName()).isEqualTo("note");
      assertThat(document.getRootElement().getNamespaceURI()).isEqualTo("urn:example:catalog");
    }

    @Test
    void unknownRootIsRejected() {
      final XmlSchemaSession session = XmlGenerator.load(SchemaFixtures.path("person.xsd"));

      assertThatThrownBy(() -> XmlGenerator.generateDocument(session, "Animal"))
          .isInstanceOf(NoRootElementException.class)
          .hasMessageContaining("Animal");
    }

    @Test
    void typesOnlySchemaHasNoRoot() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:simpleType name=\"Code\"><xs:restriction base=\"xs:string\"/></xs:simpleType>"));

      assertThatThrownBy(() -> XmlGenerator.generateDocument(session, null))
          .isInstanceOf(NoRootElementException.class);
    }
  }

  @Nested
  class Safety {

    @Test
    void cyclicSchemaNeverGenerates() {
      assertThatThrownBy(() -> XmlGenerator.load(SchemaFixtures.path("cyclic.xsd")))
          .isInstanceOf(CircularReferenceException.class)
          .hasMessageContaining("element:Node -> type:NodeType -> element:Node");
    }

    @Test
    void indexEntryPointRunsTheCycleCheck() {
      assertThatThrownBy(
              () ->
                  XmlGenerator.generateDocument(
                      SchemaFixtures.index(xs(
                          "<xs:element name=\"loop\"><xs:complexType><xs:sequence>"
                              + "<xs:element ref=\"loop\" minOccurs=\"0\"/>"
                              + "</xs:sequence></xs:complexType></xs:element>")),
                      null))
          .isInstanceOf(CircularReferenceException.class);
    }

    @Test
    @DisplayName("Depth guard reports an internal error instead of truncating")
    void depthGuard() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"a\"><xs:complexType><xs:sequence>"
              + "<xs:element name=\"b\"><xs:complexType><xs:sequence>"
              + "<xs:element name=\"c\" type=\"xs:string\"/>"
              + "</xs:sequence></xs:complexType></xs:element>"
              + "</xs:sequence></xs:complexType></xs:element>"));
      final GenerationConfig shallow = GenerationConfig.builder().maxDepth(2).build();

      assertThatThrownBy(
              () ->
                  XmlGenerator.generate(
                      GenerationParameters.builder()
                          .session(session)
                          .random(random)
                          .config(shallow)
                          .build()))
          .isInstanceOf(GenerationDepthExceededException.class)
          .hasMessageContaining("maximum depth of 2");
    }

    @Test
    void danglingReferencesDegradeToTextLeaves() {
      final XmlSchemaSession session = XmlGenerator.fromString(xs(
          "<xs:element name=\"root\"><xs:complexType><xs:sequence>"
              + "<xs:element ref=\"ghost\"/>"
              + "<xs:element name=\"odd\" type=\"UnknownType\"/>"
              + "</xs:sequence>"
              + "<xs:attribute ref=\"xml:lang\" use=\"required\"/>"
              + "</xs:complexType></xs:element>"));

      final Element root = generate(session, null).getRootElement();

      assertThat(root.elementText("ghost")).isNotBlank();
      assertThat(root.elementText("odd")).isNotBlank();
      assertThat(root.attributeValue("lang")).isNotBlank();
    }

    @Test
    void sameSessionServesRepeatedCalls() {
      final XmlSchemaSession session = XmlGenerator.load(SchemaFixtures.path("catalog.xsd"));

      for (int i = 0; i < TRIALS; i++) {
        assertThat(generate(session, null).getRootElement().getName()).isEqualTo("catalog");
      }
    }
  }

  @Test
  void seededConfigurationIsReproducible() {
    final XmlSchemaSession session = XmlGenerator.load(SchemaFixtures.path("person.xsd"));
    final GenerationConfig config = GenerationConfig.builder().seed(99L).build();

    final String first =
        XmlGenerator.generate(GenerationParameters.builder().session(session).config(config).build())
            .document().asXML();
    final String second =
        XmlGenerator.generate(GenerationParameters.builder().session(session).config(config).build())
            .document().asXML();

    assertThat(first).isEqualTo(second);
  }
}
