/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import java.util.List;
import java.util.Objects;

/** A {@code sequence}, {@code choice} or {@code all} group with its particles in document order. */
public record ModelGroup(GroupKind groupKind, List<Particle> particles, Occurrence occurrence)
    implements Particle {

  public ModelGroup {
    Objects.requireNonNull(groupKind, "Group kind cannot be null.");
    particles = particles == null ? List.of() : List.copyOf(particles);
    occurrence = occurrence == null ? Occurrence.ONCE : occurrence;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.MODEL_GROUP;
  }
}
