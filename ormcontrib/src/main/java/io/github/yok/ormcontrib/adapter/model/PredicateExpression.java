package io.github.yok.ormcontrib.adapter.model;

/**
 * A composite filter built from one or more predicates.
 */
public interface PredicateExpression extends Predicate {
}
