package io.github.yok.ormcontrib.adapter.model;

/**
 * Bundled parameters of a collection, typed-list or typed-view fetch (filter, sort, paging,
 * prefetch path and so on).
 */
public interface QueryParameters {
}
