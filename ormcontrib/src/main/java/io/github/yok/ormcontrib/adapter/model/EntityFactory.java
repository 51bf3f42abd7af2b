package io.github.yok.ormcontrib.adapter.model;

/**
 * Creates empty entity instances of one entity type.
 */
public interface EntityFactory {

    /**
     * Creates a new, empty entity.
     *
     * @return new entity instance
     */
    Entity create();
}
