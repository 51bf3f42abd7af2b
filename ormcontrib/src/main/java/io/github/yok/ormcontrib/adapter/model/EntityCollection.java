package io.github.yok.ormcontrib.adapter.model;

/**
 * A collection of entities that carries the factory used to materialize fetched rows.
 *
 * @param <E> entity type held by the collection
 */
public interface EntityCollection<E extends Entity> extends Iterable<E> {
}
