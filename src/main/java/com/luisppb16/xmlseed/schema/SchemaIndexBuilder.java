/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.schema;

import com.luisppb16.xmlseed.model.AttributeDecl;
import com.luisppb16.xmlseed.model.AttributeUse;
import com.luisppb16.xmlseed.model.ComplexTypeDef;
import com.luisppb16.xmlseed.model.ComplexTypeDef.Derivation;
import com.luisppb16.xmlseed.model.ElementDecl;
import com.luisppb16.xmlseed.model.Facet;
import com.luisppb16.xmlseed.model.FacetKind;
import com.luisppb16.xmlseed.model.GroupKind;
import com.luisppb16.xmlseed.model.ModelGroup;
import com.luisppb16.xmlseed.model.Occurrence;
import com.luisppb16.xmlseed.model.Particle;
import com.luisppb16.xmlseed.model.Restriction;
import com.luisppb16.xmlseed.model.SimpleTypeDef;
import com.luisppb16.xmlseed.model.SimpleTypeDef.Variety;
import com.luisppb16.xmlseed.model.TypeName;
import com.luisppb16.xmlseed.util.SchemaStructureException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.dom4j.Document;
import org.dom4j.Element;
import org.dom4j.Namespace;
import org.jetbrains.annotations.NotNull;

/**
 * Builds a {@link SchemaIndex} from a parsed XML Schema document.
 *
 * <p>Schema constructs are matched by namespace URI rather than by prefix, so {@code xs:},
 * {@code xsd:}, any other prefix and an unprefixed default namespace are all handled the same
 * way. QName-valued attributes ({@code type}, {@code base}, {@code ref}, ...) are resolved
 * against the in-scope namespace declarations of the element carrying them, once, here.
 */
@Slf4j
@UtilityClass
public class SchemaIndexBuilder {

  @NotNull
  public static SchemaIndex build(@NotNull final Document document) {
    Objects.requireNonNull(document, "Schema document cannot be null.");
    final Element root = document.getRootElement();
    final SchemaFormat format = SchemaFormat.detect(root);
    if (format == SchemaFormat.RELAX_NG) {
      throw new SchemaStructureException(
          "RELAX NG schemas are not supported; convert the grammar to XML Schema first.");
    }
    if (format != SchemaFormat.XSD) {
      throw new SchemaStructureException(
          "Not an XML Schema document: root element is <%s> in namespace '%s'"
              .formatted(root.getQualifiedName(), root.getNamespaceURI()));
    }

    final Collector collector = new Collector(root);
    collector.collectGlobals();
    final SchemaIndex index = collector.toIndex();

    if (index.elements().isEmpty()
        && index.complexTypes().isEmpty()
        && index.simpleTypes().isEmpty()) {
      throw new SchemaStructureException(
          "Schema defines no elements, complex types or simple types.");
    }
    log.info(
        "Indexed schema: {} elements, {} complex types, {} simple types, {} attributes",
        index.elements().size(),
        index.complexTypes().size(),
        index.simpleTypes().size(),
        index.attributes().size());
    return index;
  }

  private static final class Collector {

    private final Element root;
    private final boolean elementsQualifiedByDefault;
    private final String targetNamespace;
    private final Map<String, ElementDecl> elements = new LinkedHashMap<>();
    private final List<ElementDecl> localElements = new ArrayList<>();
    private final Map<String, ComplexTypeDef> complexTypes = new LinkedHashMap<>();
    private final Map<String, SimpleTypeDef> simpleTypes = new LinkedHashMap<>();
    private final Map<String, AttributeDecl> attributes = new LinkedHashMap<>();
    private final Set<String> referencedElementNames = new LinkedHashSet<>();

    Collector(final Element root) {
      this.root = root;
      this.elementsQualifiedByDefault =
          "qualified".equals(root.attributeValue("elementFormDefault"));
      final String tns = root.attributeValue("targetNamespace");
      this.targetNamespace = tns == null || tns.isBlank() ? null : tns.trim();
    }

    void collectGlobals() {
      for (final Element child : schemaChildren(root)) {
        final String name = child.attributeValue("name");
        switch (child.getName()) {
          case "element" -> {
            final ElementDecl decl = parseElement(child, true);
            if (decl != null) {
              putUnique(elements, decl.name(), decl, "element");
            }
          }
          case "complexType" -> {
            if (name == null) {
              log.warn("Skipping global complexType without a name");
            } else {
              putUnique(complexTypes, name, parseComplexType(child, name), "complexType");
            }
          }
          case "simpleType" -> {
            if (name == null) {
              log.warn("Skipping global simpleType without a name");
            } else {
              putUnique(simpleTypes, name, parseSimpleType(child, name), "simpleType");
            }
          }
          case "attribute" -> {
            final AttributeDecl decl = parseAttribute(child, true);
            if (decl != null && decl.name() != null) {
              putUnique(attributes, decl.name(), decl, "attribute");
            }
          }
          case "annotation" -> {
            // documentation only
          }
          default -> log.warn("Unsupported schema construct <{}> skipped", child.getName());
        }
      }
      // Globals take precedence; a local declaration only fills a name nothing else claims.
      for (final ElementDecl local : localElements) {
        elements.putIfAbsent(local.name(), local);
      }
    }

    SchemaIndex toIndex() {
      return SchemaIndex.builder()
          .elements(elements)
          .complexTypes(complexTypes)
          .simpleTypes(simpleTypes)
          .attributes(attributes)
          .referencedElementNames(referencedElementNames)
          .schemaPrefix(root.getNamespacePrefix())
          .targetNamespace(targetNamespace)
          .build();
    }

    private ElementDecl parseElement(final Element source, final boolean global) {
      final String name = trimmed(source.attributeValue("name"));
      final String ref = trimmed(source.attributeValue("ref"));
      if (name == null && (ref == null || global)) {
        log.warn("Skipping <element> without a {}", global ? "name" : "name or ref");
        return null;
      }

      ComplexTypeDef inlineComplex = null;
      SimpleTypeDef inlineSimple = null;
      for (final Element child : schemaChildren(source)) {
        switch (child.getName()) {
          case "complexType" -> inlineComplex = parseComplexType(child, null);
          case "simpleType" -> inlineSimple = parseSimpleType(child, null);
          default -> {
            // annotations and identity constraints are not modelled
          }
        }
      }

      final String refName = ref == null ? null : TypeName.localPart(ref);
      if (refName != null) {
        referencedElementNames.add(refName);
      }
      final ElementDecl decl =
          ElementDecl.builder()
              .name(name)
              .ref(name == null ? refName : null)
              .type(typeName(source, "type"))
              .inlineComplexType(inlineComplex)
              .inlineSimpleType(inlineSimple)
              .occurrence(global ? Occurrence.ONCE : parseOccurrence(source))
              .global(global)
              .qualified(isQualified(source, global || name == null))
              .fixedValue(source.attributeValue("fixed"))
              .build();
      if (!global && name != null) {
        localElements.add(decl);
      }
      return decl;
    }

    private boolean isQualified(final Element source, final boolean globalOrRef) {
      if (targetNamespace == null) {
        return false;
      }
      if (globalOrRef) {
        return true;
      }
      final String form = source.attributeValue("form");
      return form == null ? elementsQualifiedByDefault : "qualified".equals(form);
    }

    private ComplexTypeDef parseComplexType(final Element source, final String name) {
      final ComplexTypeDef.ComplexTypeDefBuilder builder = ComplexTypeDef.builder().name(name);
      final List<AttributeDecl> attrs = new ArrayList<>();
      final List<ModelGroup> groups = new ArrayList<>();

      for (final Element child : schemaChildren(source)) {
        switch (child.getName()) {
          case "complexContent" -> {
            final Element derivation = firstDerivation(child);
            if (derivation == null) {
              log.warn("complexContent without extension or restriction in {}", owner(name));
              continue;
            }
            if ("extension".equals(derivation.getName())) {
              builder.derivation(Derivation.COMPLEX_EXTENSION);
              builder.contentBase(typeName(derivation, "base"));
            }
            collectContent(derivation, attrs, groups, name);
          }
          case "simpleContent" -> {
            final Element derivation = firstDerivation(child);
            if (derivation == null) {
              log.warn("simpleContent without extension or restriction in {}", owner(name));
              continue;
            }
            builder.derivation(Derivation.SIMPLE_CONTENT);
            builder.contentBase(typeName(derivation, "base"));
            if ("restriction".equals(derivation.getName())) {
              builder.simpleContentRestriction(parseRestriction(derivation));
            }
            collectContent(derivation, attrs, groups, name);
          }
          default -> collectContentChild(child, attrs, groups, name);
        }
      }
      return builder.attributes(attrs).groups(groups).build();
    }

    private void collectContent(
        final Element container,
        final List<AttributeDecl> attrs,
        final List<ModelGroup> groups,
        final String typeName) {
      for (final Element child : schemaChildren(container)) {
        collectContentChild(child, attrs, groups, typeName);
      }
    }

    private void collectContentChild(
        final Element child,
        final List<AttributeDecl> attrs,
        final List<ModelGroup> groups,
        final String typeName) {
      final String localName = child.getName();
      final Optional<GroupKind> groupKind = GroupKind.fromLocalName(localName);
      if (groupKind.isPresent()) {
        groups.add(parseGroup(child, groupKind.get()));
        return;
      }
      switch (localName) {
        case "attribute" -> {
          final AttributeDecl attr = parseAttribute(child, false);
          if (attr != null) {
            attrs.add(attr);
          }
        }
        case "group", "attributeGroup", "anyAttribute" ->
            log.warn("Unsupported <{}> in {} skipped", localName, owner(typeName));
        default -> {
          // annotations, and facets already read by parseRestriction
        }
      }
    }

    private ModelGroup parseGroup(final Element source, final GroupKind kind) {
      final List<Particle> particles = new ArrayList<>();
      for (final Element child : schemaChildren(source)) {
        final Optional<GroupKind> nested = GroupKind.fromLocalName(child.getName());
        if (nested.isPresent()) {
          particles.add(parseGroup(child, nested.get()));
        } else if ("element".equals(child.getName())) {
          final ElementDecl decl = parseElement(child, false);
          if (decl != null) {
            particles.add(decl);
          }
        } else if (!"annotation".equals(child.getName())) {
          log.warn("Unsupported <{}> inside <{}> skipped", child.getName(), kind.getLocalName());
        }
      }
      return new ModelGroup(kind, particles, parseOccurrence(source));
    }

    private AttributeDecl parseAttribute(final Element source, final boolean global) {
      final String name = trimmed(source.attributeValue("name"));
      final String ref = trimmed(source.attributeValue("ref"));
      if (name == null && ref == null) {
        log.warn("Skipping <attribute> without a name or ref");
        return null;
      }
      SimpleTypeDef inline = null;
      for (final Element child : schemaChildren(source)) {
        if ("simpleType".equals(child.getName())) {
          inline = parseSimpleType(child, null);
        }
      }
      return AttributeDecl.builder()
          .name(name)
          .ref(name == null ? ref : null)
          .type(typeName(source, "type"))
          .inlineSimpleType(inline)
          .use(AttributeUse.parse(source.attributeValue("use")))
          .fixedValue(source.attributeValue("fixed"))
          .defaultValue(source.attributeValue("default"))
          .global(global)
          .build();
    }

    private SimpleTypeDef parseSimpleType(final Element source, final String name) {
      final SimpleTypeDef.SimpleTypeDefBuilder builder = SimpleTypeDef.builder().name(name);
      for (final Element child : schemaChildren(source)) {
        switch (child.getName()) {
          case "restriction" ->
              builder.variety(Variety.ATOMIC).restriction(parseRestriction(child));
          case "list" -> {
            builder.variety(Variety.LIST).itemType(typeName(child, "itemType"));
            for (final Element inner : schemaChildren(child)) {
              if ("simpleType".equals(inner.getName())) {
                builder.inlineItemType(parseSimpleType(inner, null));
              }
            }
          }
          case "union" -> {
            final List<TypeName> members = new ArrayList<>();
            final String memberTypes = child.attributeValue("memberTypes");
            if (memberTypes != null) {
              for (final String raw : memberTypes.trim().split("\\s+")) {
                if (!raw.isEmpty()) {
                  members.add(resolveTypeName(child, raw));
                }
              }
            }
            final List<SimpleTypeDef> inlineMembers = new ArrayList<>();
            for (final Element inner : schemaChildren(child)) {
              if ("simpleType".equals(inner.getName())) {
                inlineMembers.add(parseSimpleType(inner, null));
              }
            }
            builder.variety(Variety.UNION).memberTypes(members).inlineMemberTypes(inlineMembers);
          }
          default -> {
            // annotation
          }
        }
      }
      return builder.build();
    }

    private Restriction parseRestriction(final Element source) {
      SimpleTypeDef inlineBase = null;
      final List<Facet> facets = new ArrayList<>();
      for (final Element child : schemaChildren(source)) {
        final String localName = child.getName();
        if ("simpleType".equals(localName)) {
          inlineBase = parseSimpleType(child, null);
          continue;
        }
        final Optional<FacetKind> facetKind = FacetKind.fromLocalName(localName);
        if (facetKind.isPresent()) {
          facets.add(new Facet(facetKind.get(), child.attributeValue("value")));
        } else if (!isContentConstruct(localName)) {
          log.debug("Ignoring facet <{}>", localName);
        }
      }
      return new Restriction(typeName(source, "base"), inlineBase, facets);
    }

    private static boolean isContentConstruct(final String localName) {
      return switch (localName) {
        case "annotation", "attribute", "attributeGroup", "anyAttribute", "sequence", "choice",
            "all", "group" -> true;
        default -> false;
      };
    }

    private Occurrence parseOccurrence(final Element source) {
      final int min = parseOccursValue(source, "minOccurs", 1);
      final String rawMax = trimmed(source.attributeValue("maxOccurs"));
      if ("unbounded".equals(rawMax)) {
        return Occurrence.unbounded(min);
      }
      return new Occurrence(min, parseOccursValue(source, "maxOccurs", 1));
    }

    private int parseOccursValue(final Element source, final String attribute, final int fallback) {
      final String raw = trimmed(source.attributeValue(attribute));
      if (raw == null) {
        return fallback;
      }
      try {
        final int value = Integer.parseInt(raw);
        if (value >= 0) {
          return value;
        }
      } catch (final NumberFormatException e) {
        // reported below
      }
      log.warn(
          "Malformed {}='{}' on <{} {}>, using {}",
          attribute,
          raw,
          source.getName(),
          Objects.requireNonNullElse(
              source.attributeValue("name"), Objects.toString(source.attributeValue("ref"), "")),
          fallback);
      return fallback;
    }

    private TypeName typeName(final Element source, final String attribute) {
      final String raw = trimmed(source.attributeValue(attribute));
      return raw == null ? null : resolveTypeName(source, raw);
    }

    /**
     * Resolves a QName against the namespaces in scope at {@code context}. The local part is
     * built-in when the prefix (or the default namespace, for an unprefixed name) is bound to the
     * XML Schema namespace.
     */
    private static TypeName resolveTypeName(final Element context, final String raw) {
      final int colon = raw.indexOf(':');
      final String prefix = colon >= 0 ? raw.substring(0, colon) : "";
      final Namespace namespace = context.getNamespaceForPrefix(prefix);
      final boolean builtin =
          namespace != null && SchemaFormat.XSD_NAMESPACE.equals(namespace.getURI());
      return new TypeName(raw, TypeName.localPart(raw), builtin);
    }

    private static Element firstDerivation(final Element content) {
      for (final Element child : schemaChildren(content)) {
        if ("extension".equals(child.getName()) || "restriction".equals(child.getName())) {
          return child;
        }
      }
      return null;
    }

    private static List<Element> schemaChildren(final Element parent) {
      final List<Element> result = new ArrayList<>();
      for (final Element child : parent.elements()) {
        if (SchemaFormat.XSD_NAMESPACE.equals(child.getNamespaceURI())) {
          result.add(child);
        }
      }
      return result;
    }

    private static <V> void putUnique(
        final Map<String, V> target, final String name, final V value, final String kind) {
      if (target.putIfAbsent(name, value) != null) {
        log.warn("Duplicate global {} '{}' ignored; the first declaration is kept", kind, name);
      }
    }

    private static String owner(final String typeName) {
      return typeName == null ? "an inline type" : "type '" + typeName + "'";
    }

    private static String trimmed(final String value) {
      if (value == null) {
        return null;
      }
      final String trimmed = value.trim();
      return trimmed.isEmpty() ? null : trimmed;
    }
  }
}
