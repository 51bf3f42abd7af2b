package io.github.yok.ormcontrib.adapter.model;

/**
 * A single filter condition.
 */
public interface Predicate {
}
