package io.github.yok.ormcontrib.adapter.model;

/** A query that has already been generated and is ready for execution. */
public interface RetrievalQuery {
}
