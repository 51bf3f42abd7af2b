package io.github.yok.ormcontrib.adapter.model;

/**
 * Fields to exclude from (or, in include mode, to restrict) an entity fetch.
 */
public interface ExcludeIncludeFieldsList {
}
