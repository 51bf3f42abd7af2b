package io.github.yok.ormcontrib.adapter;

import io.github.yok.ormcontrib.adapter.model.Context;
import io.github.yok.ormcontrib.adapter.model.Entity;
import io.github.yok.ormcontrib.adapter.model.EntityCollection;
import io.github.yok.ormcontrib.adapter.model.EntityFactory;
import io.github.yok.ormcontrib.adapter.model.ExcludeIncludeFieldsList;
import io.github.yok.ormcontrib.adapter.model.PredicateExpression;
import io.github.yok.ormcontrib.adapter.model.PrefetchPath;
import io.github.yok.ormcontrib.adapter.model.QueryParameters;
import io.github.yok.ormcontrib.adapter.model.RelationPredicateBucket;
import io.github.yok.ormcontrib.adapter.model.SortExpression;

/**
 * Entity and entity-collection fetch operations.
 *
 * <p>
 * Paging arguments follow the runtime's convention: the first page is {@code 1}, and a page
 * number or page size of {@code 0} disables paging. A {@code maxNumberOfItemsToReturn} of
 * {@code 0} returns every matching row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface EntityFetchOperations {

    /**
     * Fetches an entity by the primary key values already set on it.
     *
     * @param entityToFetch entity with its primary key fields set
     * @param prefetchPath related entities to load, may be {@code null}
     * @param contextToUse uniquing context, may be {@code null}
     * @param excludedIncludedFields fields to exclude or include, may be {@code null}
     * @return {@code true} if the entity was found
     */
    boolean fetchEntity(Entity entityToFetch, PrefetchPath prefetchPath, Context contextToUse,
            ExcludeIncludeFieldsList excludedIncludedFields);

    boolean fetchEntity(Entity entityToFetch, PrefetchPath prefetchPath, Context contextToUse);

    boolean fetchEntity(Entity entityToFetch, Context contextToUse);

    boolean fetchEntity(Entity entityToFetch, PrefetchPath prefetchPath);

    boolean fetchEntity(Entity entityToFetch);

    /**
     * Fetches an entity using a filter on one of its unique constraints.
     *
     * @param entityToFetch entity to fill
     * @param uniqueConstraintFilter filter on the unique constraint fields
     * @param prefetchPath related entities to load, may be {@code null}
     * @param contextToUse uniquing context, may be {@code null}
     * @param excludedIncludedFields fields to exclude or include, may be {@code null}
     * @return {@code true} if exactly one row matched
     */
    boolean fetchEntityUsingUniqueConstraint(Entity entityToFetch,
            PredicateExpression uniqueConstraintFilter, PrefetchPath prefetchPath,
            Context contextToUse, ExcludeIncludeFieldsList excludedIncludedFields);

    boolean fetchEntityUsingUniqueConstraint(Entity entityToFetch,
            PredicateExpression uniqueConstraintFilter, PrefetchPath prefetchPath,
            Context contextToUse);

    boolean fetchEntityUsingUniqueConstraint(Entity entityToFetch,
            PredicateExpression uniqueConstraintFilter, Context contextToUse);

    boolean fetchEntityUsingUniqueConstraint(Entity entityToFetch,
            PredicateExpression uniqueConstraintFilter, PrefetchPath prefetchPath);

    boolean fetchEntityUsingUniqueConstraint(Entity entityToFetch,
            PredicateExpression uniqueConstraintFilter);

    /**
     * Fetches a new entity of the given type matching the filter.
     *
     * <p>
     * When the filter matches zero or more than one row, an empty (new) entity is returned.
     * </p>
     *
     * @param <E> entity type
     * @param entityType entity class, instantiable by the runtime
     * @param filterBucket filter selecting a single row
     * @param prefetchPath related entities to load, may be {@code null}
     * @param contextToUse uniquing context, may be {@code null}
     * @param excludedIncludedFields fields to exclude or include, may be {@code null}
     * @return fetched entity, never {@code null}
     */
    <E extends Entity> E fetchNewEntity(Class<E> entityType, RelationPredicateBucket filterBucket,
            PrefetchPath prefetchPath, Context contextToUse,
            ExcludeIncludeFieldsList excludedIncludedFields);

    <E extends Entity> E fetchNewEntity(Class<E> entityType, RelationPredicateBucket filterBucket,
            PrefetchPath prefetchPath, Context contextToUse);

    <E extends Entity> E fetchNewEntity(Class<E> entityType, RelationPredicateBucket filterBucket,
            PrefetchPath prefetchPath);

    <E extends Entity> E fetchNewEntity(Class<E> entityType, RelationPredicateBucket filterBucket,
            Context contextToUse);

    <E extends Entity> E fetchNewEntity(Class<E> entityType, RelationPredicateBucket filterBucket);

    /**
     * Fetches a new entity created by the given factory and matching the filter.
     *
     * @param entityFactoryToUse factory producing the entity instance
     * @param filterBucket filter selecting a single row
     * @param prefetchPath related entities to load, may be {@code null}
     * @param contextToUse uniquing context, may be {@code null}
     * @param excludedIncludedFields fields to exclude or include, may be {@code null}
     * @return fetched entity, never {@code null}
     */
    Entity fetchNewEntity(EntityFactory entityFactoryToUse, RelationPredicateBucket filterBucket,
            PrefetchPath prefetchPath, Context contextToUse,
            ExcludeIncludeFieldsList excludedIncludedFields);

    Entity fetchNewEntity(EntityFactory entityFactoryToUse, RelationPredicateBucket filterBucket,
            PrefetchPath prefetchPath, Context contextToUse);

    Entity fetchNewEntity(EntityFactory entityFactoryToUse, RelationPredicateBucket filterBucket,
            Context contextToUse);

    Entity fetchNewEntity(EntityFactory entityFactoryToUse, RelationPredicateBucket filterBucket,
            PrefetchPath prefetchPath);

    Entity fetchNewEntity(EntityFactory entityFactoryToUse, RelationPredicateBucket filterBucket);

    /**
     * Fetches the entities matching the filter into the given collection.
     *
     * @param collectionToFill collection carrying the entity factory
     * @param filterBucket filter, {@code null} for all rows
     * @param maxNumberOfItemsToReturn row limit, {@code 0} for no limit
     * @param sortClauses ordering, may be {@code null}
     * @param prefetchPath related entities to load, may be {@code null}
     * @param excludedIncludedFields fields to exclude or include, may be {@code null}
     * @param pageNumber page to fetch, first page is {@code 1}
     * @param pageSize page size
     */
    void fetchEntityCollection(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, PrefetchPath prefetchPath,
            ExcludeIncludeFieldsList excludedIncludedFields, int pageNumber, int pageSize);

    void fetchEntityCollection(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, PrefetchPath prefetchPath, int pageNumber, int pageSize);

    void fetchEntityCollection(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, int pageNumber, int pageSize);

    void fetchEntityCollection(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, PrefetchPath prefetchPath,
            ExcludeIncludeFieldsList excludedIncludedFields);

    void fetchEntityCollection(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, PrefetchPath prefetchPath);

    void fetchEntityCollection(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses);

    void fetchEntityCollection(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn);

    void fetchEntityCollection(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, PrefetchPath prefetchPath);

    void fetchEntityCollection(EntityCollection<?> collectionToFill,
            ExcludeIncludeFieldsList excludedIncludedFields, RelationPredicateBucket filterBucket);

    void fetchEntityCollection(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket);

    /**
     * Fetches an entity collection described entirely by a parameter object.
     *
     * @param parameters query parameters, including the collection to fill
     */
    void fetchEntityCollection(QueryParameters parameters);

    /**
     * Loads the excluded fields of entities fetched earlier with an exclusion list.
     *
     * @param entities entities to complete
     * @param excludedIncludedFields the list used for the original fetch
     */
    void fetchExcludedFields(EntityCollection<?> entities,
            ExcludeIncludeFieldsList excludedIncludedFields);

    void fetchExcludedFields(Entity entity, ExcludeIncludeFieldsList excludedIncludedFields);
}
