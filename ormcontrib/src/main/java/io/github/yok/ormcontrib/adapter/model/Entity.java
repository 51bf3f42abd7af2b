package io.github.yok.ormcontrib.adapter.model;

/**
 * An entity instance managed by the ORM runtime.
 *
 * <p>
 * Opaque to this library: entities are handed to the adapter unchanged and mutated by it (fetch
 * fills them, save may refetch them).
 * </p>
 */
public interface Entity {
}
