/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

/**
 * Closed set of indexed schema constructs. Namespace prefixes are already resolved when a node is
 * built, so consumers only ever look at structural fields.
 */
public sealed interface SchemaNode
    permits Particle, AttributeDecl, ComplexTypeDef, SimpleTypeDef, Restriction {

  NodeKind kind();
}
