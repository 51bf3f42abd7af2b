package io.github.yok.ormcontrib.adapter.model;

/**
 * Declarative description of the related-entity graph to load together with the primary fetch.
 */
public interface PrefetchPath {
}
