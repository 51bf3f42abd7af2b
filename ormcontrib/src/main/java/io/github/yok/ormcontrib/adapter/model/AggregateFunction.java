package io.github.yok.ormcontrib.adapter.model;

/**
 * Aggregate functions applicable to a scalar query.
 */
public enum AggregateFunction {
    NONE,
    AVG,
    AVG_DISTINCT,
    COUNT,
    COUNT_DISTINCT,
    COUNT_ROW,
    COUNT_BIG,
    COUNT_BIG_DISTINCT,
    COUNT_BIG_ROW,
    MAX,
    MIN,
    SUM,
    SUM_DISTINCT,
    STDEV,
    STDEV_DISTINCT,
    VARIANCE,
    VARIANCE_DISTINCT
}
