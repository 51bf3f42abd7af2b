package io.github.yok.ormcontrib.adapter.model;

/**
 * Pre-defined projection of one or more entities into a flat result.
 */
public interface TypedList {
}
