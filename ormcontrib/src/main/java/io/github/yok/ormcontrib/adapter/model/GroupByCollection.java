package io.github.yok.ormcontrib.adapter.model;

/** Group-by clause of an aggregate query. */
public interface GroupByCollection {
}
