package io.github.yok.ormcontrib.adapter.model;

/**
 * Row-selection filter together with the relations (joins) it needs.
 */
public interface RelationPredicateBucket {
}
