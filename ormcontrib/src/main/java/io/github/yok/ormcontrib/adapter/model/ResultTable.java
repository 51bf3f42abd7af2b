package io.github.yok.ormcontrib.adapter.model;

/**
 * Untyped tabular result filled by typed-list and typed-view fetches over raw field sets.
 */
public interface ResultTable {
}
