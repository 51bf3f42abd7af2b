package io.github.yok.ormcontrib.adapter;

import io.github.yok.ormcontrib.adapter.model.AggregateFunction;
import io.github.yok.ormcontrib.adapter.model.EntityCollection;
import io.github.yok.ormcontrib.adapter.model.EntityField;
import io.github.yok.ormcontrib.adapter.model.EntityFields;
import io.github.yok.ormcontrib.adapter.model.Expression;
import io.github.yok.ormcontrib.adapter.model.GroupByCollection;
import io.github.yok.ormcontrib.adapter.model.Predicate;
import io.github.yok.ormcontrib.adapter.model.RelationCollection;
import io.github.yok.ormcontrib.adapter.model.RelationPredicateBucket;

/**
 * Row-count and scalar queries.
 *
 * @author Yasuharu.Okawauchi
 */
public interface AggregateOperations {

    /**
     * Counts the rows a dynamic list over {@code fields} would return.
     *
     * @param fields fields forming the select list
     * @param filter filter and relations, may be {@code null}
     * @param groupByClause grouping, may be {@code null}
     * @param allowDuplicates {@code false} to count distinct rows only
     * @return number of rows
     */
    int getDbCount(EntityFields fields, RelationPredicateBucket filter,
            GroupByCollection groupByClause, boolean allowDuplicates);

    int getDbCount(EntityFields fields, RelationPredicateBucket filter,
            GroupByCollection groupByClause);

    int getDbCount(EntityFields fields, RelationPredicateBucket filter);

    /**
     * Counts the entities of the collection's type matching the filter.
     *
     * @param collection collection whose factory determines the entity type
     * @param filter filter and relations, may be {@code null}
     * @param groupByClause grouping, may be {@code null}
     * @return number of entities
     */
    int getDbCount(EntityCollection<?> collection, RelationPredicateBucket filter,
            GroupByCollection groupByClause);

    int getDbCount(EntityCollection<?> collection, RelationPredicateBucket filter);

    /**
     * Executes a scalar query over the first field of {@code fields}.
     *
     * @param fields field set, only the first field is used
     * @param filter filter, may be {@code null}
     * @param groupByClause grouping, may be {@code null}
     * @param relations relations for the filter, may be {@code null}
     * @return scalar value, {@code null} for a database {@code NULL}
     */
    Object getScalar(EntityFields fields, Predicate filter, GroupByCollection groupByClause,
            RelationCollection relations);

    Object getScalar(EntityFields fields, Predicate filter, GroupByCollection groupByClause);

    /**
     * Executes a scalar query over a single field.
     *
     * @param field field to aggregate
     * @param expressionToExecute expression replacing the field, may be {@code null}
     * @param aggregateToApply aggregate function
     * @param filter filter, may be {@code null}
     * @param groupByClause grouping, may be {@code null}
     * @param relations relations for the filter, may be {@code null}
     * @return scalar value, {@code null} for a database {@code NULL}
     */
    Object getScalar(EntityField field, Expression expressionToExecute,
            AggregateFunction aggregateToApply, Predicate filter, GroupByCollection groupByClause,
            RelationCollection relations);

    Object getScalar(EntityField field, Expression expressionToExecute,
            AggregateFunction aggregateToApply, Predicate filter, GroupByCollection groupByClause);

    Object getScalar(EntityField field, Expression expressionToExecute,
            AggregateFunction aggregateToApply, Predicate filter);

    Object getScalar(EntityField field, Expression expressionToExecute,
            AggregateFunction aggregateToApply);

    Object getScalar(EntityField field, AggregateFunction aggregateToApply);
}
