package io.github.yok.ormcontrib.adapter.model;

/**
 * Uniquing context: guarantees that one database row maps to one entity instance within its
 * scope.
 */
public interface Context {
}
