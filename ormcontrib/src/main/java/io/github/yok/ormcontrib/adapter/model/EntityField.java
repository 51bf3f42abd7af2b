package io.github.yok.ormcontrib.adapter.model;

/** A single entity field. */
public interface EntityField {
}
