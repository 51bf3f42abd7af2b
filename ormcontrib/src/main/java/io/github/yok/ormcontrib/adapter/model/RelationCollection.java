package io.github.yok.ormcontrib.adapter.model;

/** Relations (joins) used by a scalar query. */
public interface RelationCollection {
}
