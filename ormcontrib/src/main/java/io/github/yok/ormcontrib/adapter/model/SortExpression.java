package io.github.yok.ormcontrib.adapter.model;

/** Ordering applied to a fetch. */
public interface SortExpression {
}
