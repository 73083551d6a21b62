/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml.generator;

import com.luisppb16.xmlseed.config.GenerationConfig;
import com.luisppb16.xmlseed.model.AttributeDecl;
import com.luisppb16.xmlseed.model.AttributeUse;
import com.luisppb16.xmlseed.model.ComplexTypeDef;
import com.luisppb16.xmlseed.model.ComplexTypeDef.Derivation;
import com.luisppb16.xmlseed.model.ElementDecl;
import com.luisppb16.xmlseed.model.GroupKind;
import com.luisppb16.xmlseed.model.ModelGroup;
import com.luisppb16.xmlseed.model.Occurrence;
import com.luisppb16.xmlseed.model.Particle;
import com.luisppb16.xmlseed.model.Restriction;
import com.luisppb16.xmlseed.model.SchemaNode;
import com.luisppb16.xmlseed.model.SimpleTypeDef;
import com.luisppb16.xmlseed.model.TypeName;
import com.luisppb16.xmlseed.model.ValueConstraint;
import com.luisppb16.xmlseed.schema.SchemaIndex;
import com.luisppb16.xmlseed.util.GenerationDepthExceededException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.dom4j.Branch;
import org.dom4j.Document;
import org.dom4j.Element;
import org.dom4j.Namespace;
import org.dom4j.QName;

/**
 * Recursive engine that expands schema nodes into an output tree.
 *
 * <p>Every element instance is populated independently: occurrence counts, choice branches,
 * optional attributes and leaf values are re-rolled per instance. Content is dispatched in this
 * order, first match wins:
 *
 * <ol>
 *   <li>a {@code fixed} value, used verbatim;
 *   <li>a built-in type, resolved to a leaf value;
 *   <li>a named complex type, expanded;
 *   <li>a named simple type, resolved through its restriction chain;
 *   <li>an inline complex or simple type;
 *   <li>nothing: the element stays, with empty text.
 * </ol>
 *
 * <p>Dangling references and unresolved type names degrade to generic text. The depth guard is an
 * assertion: the cycle check runs first, so tripping it is an internal error, never a cut-off.
 * Instances are single-use and not thread-safe.
 */
@Slf4j
public final class ContentGenerator {

  static final String TARGET_NAMESPACE_PREFIX = "ns";
  private static final int MAX_LIST_ITEMS = 3;

  private final SchemaIndex index;
  private final ValueResolver resolver;
  private final Random random;
  private final GenerationConfig config;
  private final Namespace targetNamespace;

  @Getter private int elementCount;
  @Getter private int attributeCount;

  public ContentGenerator(
      final SchemaIndex index,
      final ValueResolver resolver,
      final Random random,
      final GenerationConfig config) {
    this.index = Objects.requireNonNull(index, "Schema index cannot be null");
    this.resolver = Objects.requireNonNull(resolver, "Value resolver cannot be null");
    this.random = Objects.requireNonNull(random, "Random cannot be null");
    this.config = Objects.requireNonNullElse(config, GenerationConfig.defaults());
    this.targetNamespace =
        index.targetNamespace() == null
            ? null
            : Namespace.get(TARGET_NAMESPACE_PREFIX, index.targetNamespace());
  }

  /**
   * Adds exactly one instance of {@code root} to {@code document}, whatever its declared
   * occurrence bounds.
   */
  public Element generateRoot(final ElementDecl root, final Document document) {
    final ElementDecl definition = resolveReference(root).orElse(root);
    final Element element = addElement(document, definition.displayName(), definition.qualified());
    populate(definition, element, 1);
    return element;
  }

  /**
   * Generates {@code node} under {@code parent}. Elements and groups expand to their occurrence
   * count; attributes and types write into {@code parent}, which must then be an element.
   */
  public void generate(final SchemaNode node, final Branch parent, final int depth) {
    switch (node.kind()) {
      case ELEMENT -> element((ElementDecl) node, parent, depth);
      case MODEL_GROUP -> group((ModelGroup) node, asElement(parent, node), depth);
      case ATTRIBUTE -> attribute((AttributeDecl) node, asElement(parent, node));
      case COMPLEX_TYPE -> expandComplexType((ComplexTypeDef) node, asElement(parent, node), depth);
      case SIMPLE_TYPE ->
          asElement(parent, node)
              .setText(resolveSimpleType((SimpleTypeDef) node, ValueConstraint.empty(), 0));
      case RESTRICTION ->
          asElement(parent, node)
              .setText(resolveRestriction((Restriction) node, ValueConstraint.empty(), 0));
    }
  }

  private static Element asElement(final Branch parent, final SchemaNode node) {
    if (parent instanceof Element element) {
      return element;
    }
    throw new IllegalArgumentException(
        node.kind() + " content can only be generated inside an element");
  }

  // Elements

  private void element(final ElementDecl declaration, final Branch parent, final int depth) {
    final int count = occurrences(declaration.occurrence());
    if (declaration.isReference() && resolveReference(declaration).isEmpty()) {
      log.warn("Dangling element ref '{}', generating text leaves", declaration.ref());
      for (int i = 0; i < count; i++) {
        addElement(parent, declaration.ref(), declaration.qualified())
            .setText(resolver.resolve(null, ValueConstraint.empty()));
      }
      return;
    }
    // A ref keeps its own occurrence bounds but takes everything else from the target.
    final ElementDecl definition = resolveReference(declaration).orElse(declaration);
    for (int i = 0; i < count; i++) {
      final Element instance =
          addElement(parent, definition.displayName(), definition.qualified());
      populate(definition, instance, depth + 1);
    }
  }

  private Optional<ElementDecl> resolveReference(final ElementDecl declaration) {
    if (!declaration.isReference()) {
      return Optional.of(declaration);
    }
    return index.element(declaration.ref()).filter(target -> !target.isReference());
  }

  private void populate(final ElementDecl definition, final Element target, final int depth) {
    checkDepth(depth, definition.displayName());
    if (definition.fixedValue() != null) {
      target.setText(definition.fixedValue());
      return;
    }
    final TypeName type = definition.type();
    if (type != null) {
      final Optional<ComplexTypeDef> complex =
          isBuiltin(type) ? Optional.empty() : index.complexType(type.localName());
      if (complex.isPresent()) {
        expandComplexType(complex.get(), target, depth);
      } else {
        target.setText(
            resolveTypeName(
                type, ConstraintExtractor.extract(definition), 0, definition.displayName()));
      }
      return;
    }
    if (definition.inlineComplexType() != null) {
      expandComplexType(definition.inlineComplexType(), target, depth);
    } else if (definition.inlineSimpleType() != null) {
      target.setText(
          resolveSimpleType(definition.inlineSimpleType(), ValueConstraint.empty(), 0));
    } else {
      target.setText("");
    }
  }

  private Element addElement(final Branch parent, final String name, final boolean qualified) {
    elementCount++;
    final QName qName =
        qualified && targetNamespace != null ? QName.get(name, targetNamespace) : QName.get(name);
    return parent.addElement(qName);
  }

  // Complex types

  private void expandComplexType(
      final ComplexTypeDef type, final Element target, final int depth) {
    checkDepth(depth, target.getName());
    final List<ComplexTypeDef> chain = derivationChain(type);

    final Map<String, AttributeDecl> attributes = new LinkedHashMap<>();
    for (final ComplexTypeDef link : chain) {
      for (final AttributeDecl attribute : link.attributes()) {
        attributes.put(attribute.displayName(), attribute);
      }
    }
    attributes.values().forEach(attribute -> attribute(attribute, target));

    if (type.derivation() == Derivation.SIMPLE_CONTENT) {
      target.setText(simpleContent(type, ValueConstraint.empty(), 0));
      return;
    }
    for (final ComplexTypeDef link : chain) {
      for (final GroupKind kind : GroupKind.values()) {
        for (final ModelGroup group : link.groups(kind)) {
          group(group, target, depth);
        }
      }
    }
  }

  /** The type and its complex bases, most basic first. */
  private List<ComplexTypeDef> derivationChain(final ComplexTypeDef type) {
    final List<ComplexTypeDef> chain = new ArrayList<>();
    ComplexTypeDef current = type;
    while (current != null) {
      checkDepth(chain.size(), "base of " + Objects.toString(type.name(), "an inline type"));
      chain.add(0, current);
      final TypeName base = current.contentBase();
      current =
          current.derivation() == Derivation.NONE || base == null || isBuiltin(base)
              ? null
              : index.complexType(base.localName()).orElse(null);
    }
    return chain;
  }

  private String simpleContent(
      final ComplexTypeDef type, final ValueConstraint outer, final int hops) {
    checkDepth(hops, "simple content of " + Objects.toString(type.name(), "an inline type"));
    final ValueConstraint constraint = ConstraintExtractor.extract(type).overlaidBy(outer);
    final TypeName base = type.contentBase();
    if (base != null && !isBuiltin(base)) {
      final Optional<ComplexTypeDef> complexBase = index.complexType(base.localName());
      if (complexBase.isPresent()) {
        return simpleContent(complexBase.get(), constraint, hops + 1);
      }
    }
    return resolveTypeName(base, constraint, hops, type.name());
  }

  // Groups

  private void group(final ModelGroup group, final Element target, final int depth) {
    final int repetitions = occurrences(group.occurrence());
    for (int i = 0; i < repetitions; i++) {
      if (group.groupKind() == GroupKind.CHOICE) {
        if (!group.particles().isEmpty()) {
          particle(resolver.pick(group.particles()), target, depth);
        }
      } else {
        for (final Particle particle : group.particles()) {
          particle(particle, target, depth);
        }
      }
    }
  }

  private void particle(final Particle particle, final Element target, final int depth) {
    if (particle instanceof ElementDecl element) {
      element(element, target, depth);
    } else if (particle instanceof ModelGroup nested) {
      group(nested, target, depth);
    }
  }

  /** Count for one particle: uniform in {@code [min, max]}, unbounded capped by a small ceiling. */
  int occurrences(final Occurrence occurrence) {
    final int min = occurrence.min();
    final int max;
    if (occurrence.isUnbounded()) {
      final int ceiling = uniform(config.unboundedMinOccurs(), config.unboundedMaxOccurs());
      max = Math.max(min, ceiling);
    } else {
      max = Math.max(min, occurrence.max());
    }
    return uniform(min, max);
  }

  // Attributes

  private void attribute(final AttributeDecl declaration, final Element target) {
    final AttributeUse use = declaration.use();
    if (use == AttributeUse.PROHIBITED) {
      return;
    }
    if (use == AttributeUse.OPTIONAL
        && random.nextDouble() >= config.optionalAttributeProbability()) {
      return;
    }

    String value;
    final AttributeDecl definition;
    if (declaration.ref() != null) {
      definition = index.attribute(TypeName.localPart(declaration.ref())).orElse(null);
      if (definition == null) {
        log.warn("Dangling attribute ref '{}', using generic text", declaration.ref());
        addAttribute(target, declaration.displayName(), false, resolver.resolve(null, null));
        return;
      }
    } else {
      definition = declaration;
    }

    if (declaration.fixedValue() != null) {
      value = declaration.fixedValue();
    } else if (definition.fixedValue() != null) {
      value = definition.fixedValue();
    } else if (definition.type() != null) {
      value =
          resolveTypeName(
              definition.type(),
              ConstraintExtractor.extract(definition),
              0,
              "@" + definition.displayName());
    } else if (definition.inlineSimpleType() != null) {
      value = resolveSimpleType(definition.inlineSimpleType(), ValueConstraint.empty(), 0);
    } else {
      value = resolver.resolve(null, null);
    }
    addAttribute(target, definition.displayName(), definition.global(), value);
  }

  private void addAttribute(
      final Element target, final String name, final boolean global, final String value) {
    attributeCount++;
    if (global && targetNamespace != null) {
      target.addAttribute(QName.get(name, targetNamespace), value);
    } else {
      target.addAttribute(name, value);
    }
  }

  // Simple values

  private String resolveTypeName(
      final TypeName type, final ValueConstraint constraint, final int hops, final String owner) {
    if (type == null) {
      return resolver.resolve(null, constraint);
    }
    if (isBuiltin(type)) {
      return resolver.resolve(type.localName(), constraint);
    }
    final Optional<SimpleTypeDef> simple = index.simpleType(type.localName());
    if (simple.isPresent()) {
      return resolveSimpleType(simple.get(), constraint, hops + 1);
    }
    final Optional<ComplexTypeDef> complex = index.complexType(type.localName());
    if (complex.isPresent() && complex.get().derivation() == Derivation.SIMPLE_CONTENT) {
      return simpleContent(complex.get(), constraint, hops + 1);
    }
    log.warn("Unresolved type '{}' on {}, using generic text", type.raw(), owner);
    return resolver.resolve(null, constraint);
  }

  private String resolveSimpleType(
      final SimpleTypeDef type, final ValueConstraint outer, final int hops) {
    final String owner = Objects.toString(type.name(), "an inline simple type");
    checkDepth(hops, owner);
    return switch (type.variety()) {
      case LIST -> {
        final int items = 1 + random.nextInt(MAX_LIST_ITEMS);
        final List<String> values = new ArrayList<>(items);
        for (int i = 0; i < items; i++) {
          values.add(
              type.inlineItemType() != null
                  ? resolveSimpleType(type.inlineItemType(), ValueConstraint.empty(), hops + 1)
                  : resolveTypeName(type.itemType(), ValueConstraint.empty(), hops, owner));
        }
        yield String.join(" ", values);
      }
      case UNION -> {
        final List<Object> members = new ArrayList<>(type.memberTypes());
        members.addAll(type.inlineMemberTypes());
        if (members.isEmpty()) {
          yield resolver.resolve(null, outer);
        }
        final Object member = resolver.pick(members);
        yield member instanceof SimpleTypeDef inline
            ? resolveSimpleType(inline, ValueConstraint.empty(), hops + 1)
            : resolveTypeName((TypeName) member, ValueConstraint.empty(), hops, owner);
      }
      case ATOMIC -> {
        final ValueConstraint constraint = ConstraintExtractor.extract(type).overlaidBy(outer);
        yield type.restriction() == null
            ? resolver.resolve(null, constraint)
            : resolveRestriction(type.restriction(), constraint, hops);
      }
    };
  }

  /** Follows the base chain of a restriction; {@code constraint} already holds its facets. */
  private String resolveRestriction(
      final Restriction restriction, final ValueConstraint constraint, final int hops) {
    if (restriction.base() != null) {
      return resolveTypeName(restriction.base(), constraint, hops, "restriction");
    }
    if (restriction.inlineBase() != null) {
      return resolveSimpleType(restriction.inlineBase(), constraint, hops + 1);
    }
    return resolver.resolve(null, constraint);
  }

  // Helpers

  private boolean isBuiltin(final TypeName type) {
    return index.isBuiltin(type);
  }

  private void checkDepth(final int depth, final String where) {
    if (depth > config.maxDepth()) {
      throw new GenerationDepthExceededException(
          ("Generation exceeded the maximum depth of %d at %s; "
                  + "the schema graph has a cycle the cycle check did not report")
              .formatted(config.maxDepth(), where));
    }
  }

  private int uniform(final int min, final int max) {
    return min + random.nextInt(max - min + 1);
  }
}
