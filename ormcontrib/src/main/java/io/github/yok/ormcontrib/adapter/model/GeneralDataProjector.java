package io.github.yok.ormcontrib.adapter.model;

/** Receives projected rows produced by a projection fetch. */
public interface GeneralDataProjector {
}
