/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml;

import com.luisppb16.xmlseed.model.AttributeDecl;
import com.luisppb16.xmlseed.model.ComplexTypeDef;
import com.luisppb16.xmlseed.model.ElementDecl;
import com.luisppb16.xmlseed.model.ModelGroup;
import com.luisppb16.xmlseed.model.Particle;
import com.luisppb16.xmlseed.model.Restriction;
import com.luisppb16.xmlseed.model.SimpleTypeDef;
import com.luisppb16.xmlseed.model.TypeName;
import com.luisppb16.xmlseed.schema.SchemaIndex;
import com.luisppb16.xmlseed.util.CircularReferenceException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Depth-first search for self-reaching definitions in a {@link SchemaIndex}.
 *
 * <p>One search starts from every global element, every named complex type and every named simple
 * type. Only nodes on the current path count as a repeat; reaching a node again through a
 * different path is legal. Nodes are identified as {@code element:Name}, {@code type:Name}, or
 * {@code inline-in:Owner} for an anonymous type declared inside {@code Owner}. Edges followed:
 *
 * <ul>
 *   <li>element to its named type, its inline type and its {@code ref} target;
 *   <li>complex type to its derivation base, the types of its attributes and every element of
 *       its model groups at any nesting depth;
 *   <li>simple type to its restriction base, list item type and union member types.
 * </ul>
 *
 * <p>Optional particles ({@code minOccurs="0"}) are followed like any other: a recursive content
 * model is rejected even when an instance could stop recursing.
 */
@Slf4j
@UtilityClass
public class CycleDetector {

  public static CycleCheckResult check(final SchemaIndex index) {
    Objects.requireNonNull(index, "Schema index cannot be null.");
    final Traversal traversal = new Traversal(index);
    final List<String> cycle = traversal.run();
    if (cycle.isEmpty()) {
      log.debug("Cycle check passed over {} definitions", traversal.completed.size());
    } else {
      log.debug("Cycle check failed: {}", String.join(" -> ", cycle));
    }
    return new CycleCheckResult(cycle);
  }

  /**
   * Outcome of a {@link #check}.
   *
   * @param cyclePath identities from the search start to the repeated node; empty when acyclic
   */
  public record CycleCheckResult(List<String> cyclePath) {

    public CycleCheckResult {
      cyclePath = cyclePath == null ? List.of() : List.copyOf(cyclePath);
    }

    public boolean isAcyclic() {
      return cyclePath.isEmpty();
    }

    /** Throws {@link CircularReferenceException} carrying the path when a cycle was found. */
    public CycleCheckResult orThrow() {
      if (!isAcyclic()) {
        throw new CircularReferenceException(cyclePath);
      }
      return this;
    }
  }

  private static final class Traversal {
    private final SchemaIndex index;
    private final List<String> path = new ArrayList<>();
    private final Set<String> onPath = new HashSet<>();
    private final Set<String> completed = new HashSet<>();
    private List<String> cycle = List.of();

    Traversal(final SchemaIndex index) {
      this.index = index;
    }

    List<String> run() {
      for (final ElementDecl element : index.globalElements()) {
        visitElement(element);
        if (found()) {
          return cycle;
        }
      }
      for (final String name : index.complexTypes().keySet()) {
        visitType(name);
        if (found()) {
          return cycle;
        }
      }
      for (final String name : index.simpleTypes().keySet()) {
        visitType(name);
        if (found()) {
          return cycle;
        }
      }
      return cycle;
    }

    private boolean found() {
      return !cycle.isEmpty();
    }

    /** Pushes a named node, runs {@code body} unless the node repeats or is already cleared. */
    private void visitNamed(final String label, final Runnable body) {
      if (found() || completed.contains(label)) {
        return;
      }
      if (onPath.contains(label)) {
        final List<String> result = new ArrayList<>(path);
        result.add(label);
        cycle = result;
        return;
      }
      path.add(label);
      onPath.add(label);
      body.run();
      path.remove(path.size() - 1);
      onPath.remove(label);
      if (!found()) {
        completed.add(label);
      }
    }

    private void visitInline(final String owner, final Runnable body) {
      if (found()) {
        return;
      }
      path.add("inline-in:" + owner);
      body.run();
      path.remove(path.size() - 1);
    }

    private void visitElement(final ElementDecl element) {
      if (element.isReference()) {
        index
            .element(element.ref())
            .ifPresent(target -> visitNamed("element:" + element.ref(), () -> elementBody(target)));
      } else if (element.global()) {
        visitNamed("element:" + element.name(), () -> elementBody(element));
      } else {
        elementBody(element);
      }
    }

    private void elementBody(final ElementDecl element) {
      final String owner = element.displayName();
      visitTypeName(element.type());
      if (element.inlineComplexType() != null) {
        visitInline(owner, () -> complexBody(element.inlineComplexType(), owner));
      }
      if (element.inlineSimpleType() != null) {
        visitInline(owner, () -> simpleBody(element.inlineSimpleType(), owner));
      }
    }

    private void visitTypeName(final TypeName type) {
      if (type == null || index.isBuiltin(type)) {
        return;
      }
      if (index.definesType(type.localName())) {
        visitType(type.localName());
      }
    }

    private void visitType(final String name) {
      visitNamed(
          "type:" + name,
          () -> {
            final ComplexTypeDef complex = index.complexTypes().get(name);
            if (complex != null) {
              complexBody(complex, name);
            } else {
              simpleBody(index.simpleTypes().get(name), name);
            }
          });
    }

    private void complexBody(final ComplexTypeDef type, final String owner) {
      visitTypeName(type.contentBase());
      for (final AttributeDecl attribute : type.attributes()) {
        attributeBody(attribute);
      }
      if (type.simpleContentRestriction() != null) {
        restrictionBody(type.simpleContentRestriction(), owner);
      }
      for (final ModelGroup group : type.groups()) {
        groupBody(group);
      }
    }

    private void attributeBody(final AttributeDecl attribute) {
      final AttributeDecl resolved =
          attribute.ref() != null
              ? index.attribute(TypeName.localPart(attribute.ref())).orElse(null)
              : attribute;
      if (resolved == null) {
        return;
      }
      visitTypeName(resolved.type());
      if (resolved.inlineSimpleType() != null) {
        final String owner = "@" + resolved.displayName();
        visitInline(owner, () -> simpleBody(resolved.inlineSimpleType(), owner));
      }
    }

    private void groupBody(final ModelGroup group) {
      for (final Particle particle : group.particles()) {
        if (found()) {
          return;
        }
        if (particle instanceof ElementDecl element) {
          visitElement(element);
        } else if (particle instanceof ModelGroup nested) {
          groupBody(nested);
        }
      }
    }

    private void simpleBody(final SimpleTypeDef type, final String owner) {
      if (type == null) {
        return;
      }
      if (type.restriction() != null) {
        restrictionBody(type.restriction(), owner);
      }
      visitTypeName(type.itemType());
      if (type.inlineItemType() != null) {
        visitInline(owner, () -> simpleBody(type.inlineItemType(), owner));
      }
      type.memberTypes().forEach(this::visitTypeName);
      for (final SimpleTypeDef member : type.inlineMemberTypes()) {
        visitInline(owner, () -> simpleBody(member, owner));
      }
    }

    private void restrictionBody(final Restriction restriction, final String owner) {
      visitTypeName(restriction.base());
      if (restriction.inlineBase() != null) {
        visitInline(owner, () -> simpleBody(restriction.inlineBase(), owner));
      }
    }
  }
}
