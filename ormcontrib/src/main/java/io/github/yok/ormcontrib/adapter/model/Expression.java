package io.github.yok.ormcontrib.adapter.model;

/** Arithmetic or function expression evaluated by the database. */
public interface Expression {
}
