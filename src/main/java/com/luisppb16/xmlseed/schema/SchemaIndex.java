/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.schema;

import com.luisppb16.xmlseed.model.AttributeDecl;
import com.luisppb16.xmlseed.model.ComplexTypeDef;
import com.luisppb16.xmlseed.model.ElementDecl;
import com.luisppb16.xmlseed.model.SimpleTypeDef;
import com.luisppb16.xmlseed.model.TypeName;
import com.luisppb16.xmlseed.registry.BuiltinTypeRegistry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;

/**
 * Lookup tables of one loaded schema, keyed by local name. Immutable once built; maps keep document
 * order so that iteration is stable.
 *
 * @param elements every declared element name; a global declaration wins over local ones
 * @param referencedElementNames names used as an element {@code ref} target
 * @param schemaPrefix prefix the document binds to the XML Schema namespace, {@code ""} when it is
 *     the default namespace
 * @param targetNamespace the schema's {@code targetNamespace}, or {@code null}
 */
@Builder(toBuilder = true)
public record SchemaIndex(
    Map<String, ElementDecl> elements,
    Map<String, ComplexTypeDef> complexTypes,
    Map<String, SimpleTypeDef> simpleTypes,
    Map<String, AttributeDecl> attributes,
    Set<String> referencedElementNames,
    String schemaPrefix,
    String targetNamespace) {

  public SchemaIndex {
    elements = frozen(elements);
    complexTypes = frozen(complexTypes);
    simpleTypes = frozen(simpleTypes);
    attributes = frozen(attributes);
    referencedElementNames =
        referencedElementNames == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(referencedElementNames));
    schemaPrefix = Objects.requireNonNullElse(schemaPrefix, "");
  }

  private static <V> Map<String, V> frozen(final Map<String, V> map) {
    return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }

  public Optional<ElementDecl> element(final String name) {
    return Optional.ofNullable(elements.get(name));
  }

  public Optional<ComplexTypeDef> complexType(final String name) {
    return Optional.ofNullable(complexTypes.get(name));
  }

  public Optional<SimpleTypeDef> simpleType(final String name) {
    return Optional.ofNullable(simpleTypes.get(name));
  }

  public Optional<AttributeDecl> attribute(final String name) {
    return Optional.ofNullable(attributes.get(name));
  }

  /** Whether {@code name} is a user-defined complex or simple type. */
  public boolean definesType(final String name) {
    return complexTypes.containsKey(name) || simpleTypes.containsKey(name);
  }

  /**
   * Whether {@code type} denotes an XML Schema built-in rather than a type defined here. The
   * registry must know the name, and either its prefix is bound to the XML Schema namespace or
   * no user-defined type shadows it. An unprefixed name under a default XML Schema namespace is
   * therefore still a user type when the registry does not know it.
   */
  public boolean isBuiltin(final TypeName type) {
    return type != null
        && BuiltinTypeRegistry.isBuiltin(type.localName())
        && (type.builtin() || !definesType(type.localName()));
  }

  public List<ElementDecl> globalElements() {
    return elements.values().stream().filter(ElementDecl::global).toList();
  }

  public boolean isReferenced(final String elementName) {
    return referencedElementNames.contains(elementName);
  }
}
