package io.github.yok.ormcontrib.adapter.model;

/** Maps one value of a result row onto a projection target. */
public interface DataValueProjector {
}
