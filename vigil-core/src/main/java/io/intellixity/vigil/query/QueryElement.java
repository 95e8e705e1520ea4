package io.intellixity.vigil.query;

/** Node of a compiled filter tree. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
