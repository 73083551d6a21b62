/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

/** A member of a content model: either an element declaration or a nested group. */
public sealed interface Particle extends SchemaNode permits ElementDecl, ModelGroup {

  Occurrence occurrence();
}
