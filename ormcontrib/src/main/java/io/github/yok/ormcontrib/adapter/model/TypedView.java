package io.github.yok.ormcontrib.adapter.model;

/**
 * Result holder mapped onto a database view or table-valued source.
 */
public interface TypedView {
}
