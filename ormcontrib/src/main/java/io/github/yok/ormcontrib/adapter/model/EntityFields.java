package io.github.yok.ormcontrib.adapter.model;

/** Ordered set of fields forming a dynamic projection or a count/scalar source. */
public interface EntityFields {
}
