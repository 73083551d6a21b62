/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml.generator;

import com.luisppb16.xmlseed.model.AttributeDecl;
import com.luisppb16.xmlseed.model.ComplexTypeDef;
import com.luisppb16.xmlseed.model.ElementDecl;
import com.luisppb16.xmlseed.model.Facet;
import com.luisppb16.xmlseed.model.Restriction;
import com.luisppb16.xmlseed.model.SchemaNode;
import com.luisppb16.xmlseed.model.SimpleTypeDef;
import com.luisppb16.xmlseed.model.ValueConstraint;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects the facets attached to a schema node into a {@link ValueConstraint}.
 *
 * <p>Restrictions are read at every nesting level reachable without leaving the node: an
 * element's or attribute's inline simple type, a simple type's restriction and any inline base it
 * declares, a complex type's {@code simpleContent} restriction. Named types are not followed;
 * the caller resolves those. An inline base is read before the restriction that declares it, so
 * a facet on the outermost restriction wins. Within one level the last facet of a kind wins,
 * except enumeration values, which accumulate. Malformed length facets are ignored.
 */
@Slf4j
@UtilityClass
public class ConstraintExtractor {

  public static ValueConstraint extract(final SchemaNode node) {
    if (node == null) {
      return ValueConstraint.empty();
    }
    final Accumulator accumulator = new Accumulator();
    switch (node.kind()) {
      case ELEMENT -> accumulator.simpleType(((ElementDecl) node).inlineSimpleType());
      case ATTRIBUTE -> accumulator.simpleType(((AttributeDecl) node).inlineSimpleType());
      case SIMPLE_TYPE -> accumulator.simpleType((SimpleTypeDef) node);
      case RESTRICTION -> accumulator.restriction((Restriction) node);
      case COMPLEX_TYPE -> accumulator.restriction(((ComplexTypeDef) node).simpleContentRestriction());
      case MODEL_GROUP -> {
        // content models carry no value facets
      }
    }
    return accumulator.build();
  }

  private static final class Accumulator {
    private final ValueConstraint.ValueConstraintBuilder builder = ValueConstraint.builder();
    private List<String> enumeration = List.of();

    void simpleType(final SimpleTypeDef type) {
      if (type != null && type.restriction() != null) {
        restriction(type.restriction());
      }
    }

    void restriction(final Restriction restriction) {
      if (restriction == null) {
        return;
      }
      simpleType(restriction.inlineBase());
      final List<String> levelEnumeration = new ArrayList<>();
      for (final Facet facet : restriction.facets()) {
        final String value = facet.value().trim();
        switch (facet.kind()) {
          case ENUMERATION -> levelEnumeration.add(facet.value());
          case PATTERN -> builder.pattern(facet.value());
          case LENGTH -> parseLength(facet, value).ifPresent(builder::length);
          case MIN_LENGTH -> parseLength(facet, value).ifPresent(builder::minLength);
          case MAX_LENGTH -> parseLength(facet, value).ifPresent(builder::maxLength);
          case MIN_INCLUSIVE -> builder.minInclusive(value);
          case MAX_INCLUSIVE -> builder.maxInclusive(value);
          case MIN_EXCLUSIVE -> builder.minExclusive(value);
          case MAX_EXCLUSIVE -> builder.maxExclusive(value);
        }
      }
      if (!levelEnumeration.isEmpty()) {
        enumeration = levelEnumeration;
      }
    }

    private Optional<Integer> parseLength(final Facet facet, final String value) {
      try {
        final int parsed = Integer.parseInt(value);
        if (parsed >= 0) {
          return Optional.of(parsed);
        }
      } catch (final NumberFormatException e) {
        // reported below
      }
      log.warn("Ignoring malformed {} facet value '{}'", facet.kind().getLocalName(), value);
      return Optional.empty();
    }

    ValueConstraint build() {
      return builder.enumeration(enumeration).build();
    }
  }
}
