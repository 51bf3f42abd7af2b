package io.github.yok.ormcontrib.async;

import io.github.yok.ormcontrib.adapter.DataAccessAdapter;
import io.github.yok.ormcontrib.adapter.model.AggregateFunction;
import io.github.yok.ormcontrib.adapter.model.Context;
import io.github.yok.ormcontrib.adapter.model.DataValueProjector;
import io.github.yok.ormcontrib.adapter.model.Entity;
import io.github.yok.ormcontrib.adapter.model.EntityCollection;
import io.github.yok.ormcontrib.adapter.model.EntityFactory;
import io.github.yok.ormcontrib.adapter.model.EntityField;
import io.github.yok.ormcontrib.adapter.model.EntityFields;
import io.github.yok.ormcontrib.adapter.model.ExcludeIncludeFieldsList;
import io.github.yok.ormcontrib.adapter.model.Expression;
import io.github.yok.ormcontrib.adapter.model.GeneralDataProjector;
import io.github.yok.ormcontrib.adapter.model.GroupByCollection;
import io.github.yok.ormcontrib.adapter.model.Predicate;
import io.github.yok.ormcontrib.adapter.model.PredicateExpression;
import io.github.yok.ormcontrib.adapter.model.PrefetchPath;
import io.github.yok.ormcontrib.adapter.model.QueryParameters;
import io.github.yok.ormcontrib.adapter.model.RelationCollection;
import io.github.yok.ormcontrib.adapter.model.RelationPredicateBucket;
import io.github.yok.ormcontrib.adapter.model.ResultTable;
import io.github.yok.ormcontrib.adapter.model.RetrievalQuery;
import io.github.yok.ormcontrib.adapter.model.SortExpression;
import io.github.yok.ormcontrib.adapter.model.TypedList;
import io.github.yok.ormcontrib.adapter.model.TypedView;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.transaction.annotation.Isolation;

/**
 * Makes it possible to call a synchronous {@link DataAccessAdapter} without blocking the calling
 * thread.
 *
 * <p>
 * The wrapper does not make the ORM runtime asynchronous. Every operation borrows a thread from
 * the worker pool, creates a new adapter there, runs the synchronous adapter operation, closes the
 * adapter and completes the returned {@link CompletableFuture}. The work done by the runtime is
 * exactly as blocking as before; only the caller is freed.
 * </p>
 *
 * <p>
 * <strong>Stateless per call:</strong> the wrapper keeps no adapter between calls. Two calls never
 * share an adapter, a connection or a transaction, and they may complete in any order. Work that
 * has to run in one transaction must be written as a single {@link AdapterCall} and passed to a
 * subclass through {@link #call(AdapterCall)}, or be coordinated outside this class.
 * </p>
 *
 * <p>
 * By default each adapter keeps the connection string it would normally use. A connection string
 * passed to the constructor replaces it. {@link #setCommandTimeOut(int)},
 * {@link #setParameterisedPrefetchPathThreshold(int)} and
 * {@link #setTransactionIsolationLevel(Isolation)} are applied to each new adapter only when set
 * to a non-default value. These settings are plain fields; configure them before issuing
 * concurrent calls.
 * </p>
 *
 * <p>
 * <strong>Failures:</strong> whatever the adapter (or the adapter factory) throws completes the
 * returned future exceptionally with that same throwable. Nothing is retried or translated.
 * Calls cannot be cancelled once dispatched and there is no deadline other than the adapter's own
 * command timeout.
 * </p>
 *
 * <p>
 * The default worker pool is {@link ForkJoinPool#commonPool()}. Hosts that already keep that pool
 * busy (for example with request handling) should pass a dedicated {@link Executor}; the wrapper
 * does not guard against pool starvation.
 * </p>
 *
 * <p>
 * Operations that depend on a call sequence against one adapter (data readers, explicit
 * transactions) are not offered.
 * </p>
 *
 * @param <A> adapter type
 * @author Yasuharu.Okawauchi
 */
public class AsyncAdapterWrapper<A extends DataAccessAdapter> {

    // Creates one new adapter per call
    private final Supplier<? extends A> adapterFactory;

    // Worker pool running the synchronous adapter calls
    private final Executor executor;

    /**
     * Connection string applied to every adapter; empty keeps the adapter's own.
     */
    @Getter
    private final String alternativeConnectionString;

    /**
     * Command timeout in seconds. Applied to each new adapter when greater than {@code 0}.
     */
    @Getter
    @Setter
    private int commandTimeOut;

    /**
     * Parameterised prefetch-path threshold. Applied to each new adapter when greater than
     * {@code 0}.
     */
    @Getter
    @Setter
    private int parameterisedPrefetchPathThreshold;

    /**
     * Transaction isolation level. Applied to each new adapter when not
     * {@link Isolation#DEFAULT}.
     */
    @Getter
    @Setter
    private Isolation transactionIsolationLevel = Isolation.DEFAULT;

    /**
     * Creates a wrapper whose adapters keep their default connection string.
     *
     * @param adapterFactory creates a new adapter on each call
     */
    public AsyncAdapterWrapper(Supplier<? extends A> adapterFactory) {
        this(adapterFactory, StringUtils.EMPTY);
    }

    /**
     * Creates a wrapper whose adapters use the given connection string.
     *
     * @param adapterFactory creates a new adapter on each call
     * @param connectionString connection string for every adapter; {@code null} or empty keeps the
     *        adapter's own
     */
    public AsyncAdapterWrapper(Supplier<? extends A> adapterFactory, String connectionString) {
        this(adapterFactory, connectionString, ForkJoinPool.commonPool());
    }

    /**
     * Creates a wrapper running its calls on the given executor.
     *
     * @param adapterFactory creates a new adapter on each call
     * @param connectionString connection string for every adapter; {@code null} or empty keeps the
     *        adapter's own
     * @param executor worker pool for the synchronous adapter calls
     * @throws NullPointerException if {@code adapterFactory} or {@code executor} is {@code null}
     */
    public AsyncAdapterWrapper(Supplier<? extends A> adapterFactory, String connectionString,
            Executor executor) {
        this.adapterFactory = Objects.requireNonNull(adapterFactory, "adapterFactory");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.alternativeConnectionString = StringUtils.defaultString(connectionString);
    }

    /**
     * Runs {@code operation} against a new adapter on the worker pool.
     *
     * <p>
     * Returns immediately. The adapter is created on the worker thread and closed there on every
     * exit path; a failure of the factory, the operation or {@code close()} completes the future
     * with the original throwable. A rejected submission completes the future with the
     * {@link RejectedExecutionException}.
     * </p>
     *
     * @param <R> result type
     * @param operation work to run
     * @return future completed with the operation's result
     */
    protected <R> CompletableFuture<R> call(AdapterCall<A, R> operation) {
        Objects.requireNonNull(operation, "operation");
        CompletableFuture<R> future = new CompletableFuture<>();
        try {
            executor.execute(() -> execute(operation, future));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Runs {@code operation} against a new adapter on the worker pool.
     *
     * @param operation work to run
     * @return future completed with {@code null} once the operation has returned
     * @see #call(AdapterCall)
     */
    protected CompletableFuture<Void> run(AdapterAction<A> operation) {
        Objects.requireNonNull(operation, "operation");
        return call(adapter -> {
            operation.accept(adapter);
            return null;
        });
    }

    /**
     * Creates the adapter for one call and applies the wrapper settings that differ from their
     * defaults.
     *
     * @return new adapter, owned by the calling operation
     */
    protected A createAdapterInstance() {
        A adapter = adapterFactory.get();
        if (StringUtils.isNotEmpty(alternativeConnectionString)) {
            adapter.setConnectionString(alternativeConnectionString);
        }
        if (commandTimeOut > 0) {
            adapter.setCommandTimeOut(commandTimeOut);
        }
        if (parameterisedPrefetchPathThreshold > 0) {
            adapter.setParameterisedPrefetchPathThreshold(parameterisedPrefetchPathThreshold);
        }
        if (transactionIsolationLevel != null && transactionIsolationLevel != Isolation.DEFAULT) {
            adapter.setTransactionIsolationLevel(transactionIsolationLevel);
        }
        return adapter;
    }

    private <R> void execute(AdapterCall<A, R> operation, CompletableFuture<R> future) {
        R result;
        try (A adapter = createAdapterInstance()) {
            result = operation.apply(adapter);
        } catch (Throwable t) {
            future.completeExceptionally(t);
            return;
        }
        future.complete(result);
    }

    /**
     * Asynchronous variant of {@code fetchEntity}. Fetches an entity by the primary key values
     * already set on it.
     *
     * @return future completed with {@code true} if the entity was found
     */
    public CompletableFuture<Boolean> fetchEntityAsync(Entity entityToFetch,
            PrefetchPath prefetchPath, Context contextToUse,
            ExcludeIncludeFieldsList excludedIncludedFields) {
        return call(adapter -> adapter.fetchEntity(entityToFetch, prefetchPath, contextToUse,
                excludedIncludedFields));
    }

    /**
     * Asynchronous variant of {@code fetchEntity}.
     */
    public CompletableFuture<Boolean> fetchEntityAsync(Entity entityToFetch,
            PrefetchPath prefetchPath, Context contextToUse) {
        return call(adapter -> adapter.fetchEntity(entityToFetch, prefetchPath, contextToUse));
    }

    /**
     * Asynchronous variant of {@code fetchEntity}.
     */
    public CompletableFuture<Boolean> fetchEntityAsync(Entity entityToFetch, Context contextToUse) {
        return call(adapter -> adapter.fetchEntity(entityToFetch, contextToUse));
    }

    /**
     * Asynchronous variant of {@code fetchEntity}.
     */
    public CompletableFuture<Boolean> fetchEntityAsync(Entity entityToFetch,
            PrefetchPath prefetchPath) {
        return call(adapter -> adapter.fetchEntity(entityToFetch, prefetchPath));
    }

    /**
     * Asynchronous variant of {@code fetchEntity}.
     */
    public CompletableFuture<Boolean> fetchEntityAsync(Entity entityToFetch) {
        return call(adapter -> adapter.fetchEntity(entityToFetch));
    }

    /**
     * Asynchronous variant of {@code fetchEntityUsingUniqueConstraint}. Fetches an entity using a
     * filter on one of its unique constraints.
     *
     * @return future completed with {@code true} if exactly one row matched
     */
    public CompletableFuture<Boolean> fetchEntityUsingUniqueConstraintAsync(Entity entityToFetch,
            PredicateExpression uniqueConstraintFilter, PrefetchPath prefetchPath,
            Context contextToUse, ExcludeIncludeFieldsList excludedIncludedFields) {
        return call(adapter -> adapter.fetchEntityUsingUniqueConstraint(entityToFetch,
                uniqueConstraintFilter, prefetchPath, contextToUse, excludedIncludedFields));
    }

    /**
     * Asynchronous variant of {@code fetchEntityUsingUniqueConstraint}.
     */
    public CompletableFuture<Boolean> fetchEntityUsingUniqueConstraintAsync(Entity entityToFetch,
            PredicateExpression uniqueConstraintFilter, PrefetchPath prefetchPath,
            Context contextToUse) {
        return call(adapter -> adapter.fetchEntityUsingUniqueConstraint(entityToFetch,
                uniqueConstraintFilter, prefetchPath, contextToUse));
    }

    /**
     * Asynchronous variant of {@code fetchEntityUsingUniqueConstraint}.
     */
    public CompletableFuture<Boolean> fetchEntityUsingUniqueConstraintAsync(Entity entityToFetch,
            PredicateExpression uniqueConstraintFilter, Context contextToUse) {
        return call(adapter -> adapter.fetchEntityUsingUniqueConstraint(entityToFetch,
                uniqueConstraintFilter, contextToUse));
    }

    /**
     * Asynchronous variant of {@code fetchEntityUsingUniqueConstraint}.
     */
    public CompletableFuture<Boolean> fetchEntityUsingUniqueConstraintAsync(Entity entityToFetch,
            PredicateExpression uniqueConstraintFilter, PrefetchPath prefetchPath) {
        return call(adapter -> adapter.fetchEntityUsingUniqueConstraint(entityToFetch,
                uniqueConstraintFilter, prefetchPath));
    }

    /**
     * Asynchronous variant of {@code fetchEntityUsingUniqueConstraint}.
     */
    public CompletableFuture<Boolean> fetchEntityUsingUniqueConstraintAsync(Entity entityToFetch,
            PredicateExpression uniqueConstraintFilter) {
        return call(adapter -> adapter.fetchEntityUsingUniqueConstraint(entityToFetch,
                uniqueConstraintFilter));
    }

    /**
     * Asynchronous variant of {@code fetchNewEntity}. Fetches a new entity of the given type
     * matching the filter.
     *
     * @param <E> entity type
     * @return future completed with the fetched entity, empty when the filter did not match exactly
     *         one row
     */
    public <E extends Entity> CompletableFuture<E> fetchNewEntityAsync(Class<E> entityType,
            RelationPredicateBucket filterBucket, PrefetchPath prefetchPath, Context contextToUse,
            ExcludeIncludeFieldsList excludedIncludedFields) {
        return call(adapter -> adapter.fetchNewEntity(entityType, filterBucket, prefetchPath,
                contextToUse, excludedIncludedFields));
    }

    /**
     * Asynchronous variant of {@code fetchNewEntity}.
     */
    public <E extends Entity> CompletableFuture<E> fetchNewEntityAsync(Class<E> entityType,
            RelationPredicateBucket filterBucket, PrefetchPath prefetchPath, Context contextToUse) {
        return call(adapter -> adapter.fetchNewEntity(entityType, filterBucket, prefetchPath,
                contextToUse));
    }

    /**
     * Asynchronous variant of {@code fetchNewEntity}.
     */
    public <E extends Entity> CompletableFuture<E> fetchNewEntityAsync(Class<E> entityType,
            RelationPredicateBucket filterBucket, PrefetchPath prefetchPath) {
        return call(adapter -> adapter.fetchNewEntity(entityType, filterBucket, prefetchPath));
    }

    /**
     * Asynchronous variant of {@code fetchNewEntity}.
     */
    public <E extends Entity> CompletableFuture<E> fetchNewEntityAsync(Class<E> entityType,
            RelationPredicateBucket filterBucket, Context contextToUse) {
        return call(adapter -> adapter.fetchNewEntity(entityType, filterBucket, contextToUse));
    }

    /**
     * Asynchronous variant of {@code fetchNewEntity}.
     */
    public <E extends Entity> CompletableFuture<E> fetchNewEntityAsync(Class<E> entityType,
            RelationPredicateBucket filterBucket) {
        return call(adapter -> adapter.fetchNewEntity(entityType, filterBucket));
    }

    /**
     * Asynchronous variant of {@code fetchNewEntity}. Fetches a new entity created by the given
     * factory and matching the filter.
     *
     * @return future completed with the fetched entity, empty when the filter did not match exactly
     *         one row
     */
    public CompletableFuture<Entity> fetchNewEntityAsync(EntityFactory entityFactoryToUse,
            RelationPredicateBucket filterBucket, PrefetchPath prefetchPath, Context contextToUse,
            ExcludeIncludeFieldsList excludedIncludedFields) {
        return call(adapter -> adapter.fetchNewEntity(entityFactoryToUse, filterBucket,
                prefetchPath, contextToUse, excludedIncludedFields));
    }

    /**
     * Asynchronous variant of {@code fetchNewEntity}.
     */
    public CompletableFuture<Entity> fetchNewEntityAsync(EntityFactory entityFactoryToUse,
            RelationPredicateBucket filterBucket, PrefetchPath prefetchPath, Context contextToUse) {
        return call(adapter -> adapter.fetchNewEntity(entityFactoryToUse, filterBucket,
                prefetchPath, contextToUse));
    }

    /**
     * Asynchronous variant of {@code fetchNewEntity}.
     */
    public CompletableFuture<Entity> fetchNewEntityAsync(EntityFactory entityFactoryToUse,
            RelationPredicateBucket filterBucket, Context contextToUse) {
        return call(adapter -> adapter.fetchNewEntity(entityFactoryToUse, filterBucket,
                contextToUse));
    }

    /**
     * Asynchronous variant of {@code fetchNewEntity}.
     */
    public CompletableFuture<Entity> fetchNewEntityAsync(EntityFactory entityFactoryToUse,
            RelationPredicateBucket filterBucket, PrefetchPath prefetchPath) {
        return call(adapter -> adapter.fetchNewEntity(entityFactoryToUse, filterBucket,
                prefetchPath));
    }

    /**
     * Asynchronous variant of {@code fetchNewEntity}.
     */
    public CompletableFuture<Entity> fetchNewEntityAsync(EntityFactory entityFactoryToUse,
            RelationPredicateBucket filterBucket) {
        return call(adapter -> adapter.fetchNewEntity(entityFactoryToUse, filterBucket));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}. Fetches the entities matching the
     * filter into the given collection.
     *
     * @return future completed with no value once the adapter call has returned
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, PrefetchPath prefetchPath,
            ExcludeIncludeFieldsList excludedIncludedFields, int pageNumber, int pageSize) {
        return run(adapter -> adapter.fetchEntityCollection(collectionToFill, filterBucket,
                maxNumberOfItemsToReturn, sortClauses, prefetchPath, excludedIncludedFields,
                pageNumber, pageSize));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}.
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, PrefetchPath prefetchPath, int pageNumber, int pageSize) {
        return run(adapter -> adapter.fetchEntityCollection(collectionToFill, filterBucket,
                maxNumberOfItemsToReturn, sortClauses, prefetchPath, pageNumber, pageSize));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}.
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, int pageNumber, int pageSize) {
        return run(adapter -> adapter.fetchEntityCollection(collectionToFill, filterBucket,
                maxNumberOfItemsToReturn, sortClauses, pageNumber, pageSize));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}.
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, PrefetchPath prefetchPath,
            ExcludeIncludeFieldsList excludedIncludedFields) {
        return run(adapter -> adapter.fetchEntityCollection(collectionToFill, filterBucket,
                maxNumberOfItemsToReturn, sortClauses, prefetchPath, excludedIncludedFields));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}.
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, PrefetchPath prefetchPath) {
        return run(adapter -> adapter.fetchEntityCollection(collectionToFill, filterBucket,
                maxNumberOfItemsToReturn, sortClauses, prefetchPath));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}.
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses) {
        return run(adapter -> adapter.fetchEntityCollection(collectionToFill, filterBucket,
                maxNumberOfItemsToReturn, sortClauses));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}.
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn) {
        return run(adapter -> adapter.fetchEntityCollection(collectionToFill, filterBucket,
                maxNumberOfItemsToReturn));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}.
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket, PrefetchPath prefetchPath) {
        return run(adapter -> adapter.fetchEntityCollection(collectionToFill, filterBucket,
                prefetchPath));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}.
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(EntityCollection<?> collectionToFill,
            ExcludeIncludeFieldsList excludedIncludedFields, RelationPredicateBucket filterBucket) {
        return run(adapter -> adapter.fetchEntityCollection(collectionToFill,
                excludedIncludedFields, filterBucket));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}.
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(EntityCollection<?> collectionToFill,
            RelationPredicateBucket filterBucket) {
        return run(adapter -> adapter.fetchEntityCollection(collectionToFill, filterBucket));
    }

    /**
     * Asynchronous variant of {@code fetchEntityCollection}.
     */
    public CompletableFuture<Void> fetchEntityCollectionAsync(QueryParameters parameters) {
        return run(adapter -> adapter.fetchEntityCollection(parameters));
    }

    /**
     * Asynchronous variant of {@code fetchExcludedFields}. Loads the excluded fields of entities
     * fetched earlier with an exclusion list.
     *
     * @return future completed with no value once the adapter call has returned
     */
    public CompletableFuture<Void> fetchExcludedFieldsAsync(EntityCollection<?> entities,
            ExcludeIncludeFieldsList excludedIncludedFields) {
        return run(adapter -> adapter.fetchExcludedFields(entities, excludedIncludedFields));
    }

    /**
     * Asynchronous variant of {@code fetchExcludedFields}.
     */
    public CompletableFuture<Void> fetchExcludedFieldsAsync(Entity entity,
            ExcludeIncludeFieldsList excludedIncludedFields) {
        return run(adapter -> adapter.fetchExcludedFields(entity, excludedIncludedFields));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}. Fills a typed list, or a result table from a
     * field set.
     *
     * @return future completed with no value once the adapter call has returned
     */
    public CompletableFuture<Void> fetchTypedListAsync(TypedList typedListToFill,
            PredicateExpression additionalFilter, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates, int pageNumber, int pageSize) {
        return run(adapter -> adapter.fetchTypedList(typedListToFill, additionalFilter,
                maxNumberOfItemsToReturn, sortClauses, allowDuplicates, pageNumber, pageSize));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}.
     */
    public CompletableFuture<Void> fetchTypedListAsync(TypedList typedListToFill,
            PredicateExpression additionalFilter, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedList(typedListToFill, additionalFilter,
                maxNumberOfItemsToReturn, sortClauses, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}.
     */
    public CompletableFuture<Void> fetchTypedListAsync(TypedList typedListToFill,
            PredicateExpression additionalFilter) {
        return run(adapter -> adapter.fetchTypedList(typedListToFill, additionalFilter));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}.
     */
    public CompletableFuture<Void> fetchTypedListAsync(TypedList typedListToFill) {
        return run(adapter -> adapter.fetchTypedList(typedListToFill));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}.
     */
    public CompletableFuture<Void> fetchTypedListAsync(ResultTable tableToFill,
            QueryParameters parameters) {
        return run(adapter -> adapter.fetchTypedList(tableToFill, parameters));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}.
     */
    public CompletableFuture<Void> fetchTypedListAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates,
            GroupByCollection groupByClause, int pageNumber, int pageSize) {
        return run(adapter -> adapter.fetchTypedList(fieldCollectionToFetch, tableToFill,
                filterBucket, maxNumberOfItemsToReturn, sortClauses, allowDuplicates, groupByClause,
                pageNumber, pageSize));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}.
     */
    public CompletableFuture<Void> fetchTypedListAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates,
            GroupByCollection groupByClause) {
        return run(adapter -> adapter.fetchTypedList(fieldCollectionToFetch, tableToFill,
                filterBucket, maxNumberOfItemsToReturn, sortClauses, allowDuplicates,
                groupByClause));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}.
     */
    public CompletableFuture<Void> fetchTypedListAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedList(fieldCollectionToFetch, tableToFill,
                filterBucket, maxNumberOfItemsToReturn, sortClauses, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}.
     */
    public CompletableFuture<Void> fetchTypedListAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedList(fieldCollectionToFetch, tableToFill,
                filterBucket, maxNumberOfItemsToReturn, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}.
     */
    public CompletableFuture<Void> fetchTypedListAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket,
            boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedList(fieldCollectionToFetch, tableToFill,
                filterBucket, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedList}.
     */
    public CompletableFuture<Void> fetchTypedListAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket) {
        return run(adapter -> adapter.fetchTypedList(fieldCollectionToFetch, tableToFill,
                filterBucket));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}. Fills a typed view, or a result table from a
     * field set.
     *
     * @return future completed with no value once the adapter call has returned
     */
    public CompletableFuture<Void> fetchTypedViewAsync(TypedView typedViewToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates, GroupByCollection groupByClause) {
        return run(adapter -> adapter.fetchTypedView(typedViewToFill, filterBucket,
                maxNumberOfItemsToReturn, sortClauses, allowDuplicates, groupByClause));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(TypedView typedViewToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedView(typedViewToFill, filterBucket,
                maxNumberOfItemsToReturn, sortClauses, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(TypedView typedViewToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedView(typedViewToFill, filterBucket,
                maxNumberOfItemsToReturn, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(TypedView typedViewToFill,
            RelationPredicateBucket filterBucket, boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedView(typedViewToFill, filterBucket,
                allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(TypedView typedViewToFill,
            boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedView(typedViewToFill, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(TypedView typedViewToFill) {
        return run(adapter -> adapter.fetchTypedView(typedViewToFill));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(TypedView typedViewToFill,
            RetrievalQuery queryToUse) {
        return run(adapter -> adapter.fetchTypedView(typedViewToFill, queryToUse));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(ResultTable tableToFill,
            QueryParameters parameters) {
        return run(adapter -> adapter.fetchTypedView(tableToFill, parameters));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates,
            GroupByCollection groupByClause, int pageNumber, int pageSize) {
        return run(adapter -> adapter.fetchTypedView(fieldCollectionToFetch, tableToFill,
                filterBucket, maxNumberOfItemsToReturn, sortClauses, allowDuplicates, groupByClause,
                pageNumber, pageSize));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates,
            GroupByCollection groupByClause) {
        return run(adapter -> adapter.fetchTypedView(fieldCollectionToFetch, tableToFill,
                filterBucket, maxNumberOfItemsToReturn, sortClauses, allowDuplicates,
                groupByClause));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedView(fieldCollectionToFetch, tableToFill,
                filterBucket, maxNumberOfItemsToReturn, sortClauses, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedView(fieldCollectionToFetch, tableToFill,
                filterBucket, maxNumberOfItemsToReturn, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, RelationPredicateBucket filterBucket,
            boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedView(fieldCollectionToFetch, tableToFill,
                filterBucket, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill, boolean allowDuplicates) {
        return run(adapter -> adapter.fetchTypedView(fieldCollectionToFetch, tableToFill,
                allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchTypedView}.
     */
    public CompletableFuture<Void> fetchTypedViewAsync(EntityFields fieldCollectionToFetch,
            ResultTable tableToFill) {
        return run(adapter -> adapter.fetchTypedView(fieldCollectionToFetch, tableToFill));
    }

    /**
     * Asynchronous variant of {@code fetchProjection}. Runs a projection and hands each projected
     * row to {@code projector}.
     *
     * @return future completed with no value once the adapter call has returned
     */
    public CompletableFuture<Void> fetchProjectionAsync(List<DataValueProjector> valueProjectors,
            GeneralDataProjector projector, EntityFields fields, RelationPredicateBucket filter,
            int maxNumberOfItemsToReturn, SortExpression sortClauses,
            GroupByCollection groupByClause, boolean allowDuplicates, int pageNumber,
            int pageSize) {
        return run(adapter -> adapter.fetchProjection(valueProjectors, projector, fields, filter,
                maxNumberOfItemsToReturn, sortClauses, groupByClause, allowDuplicates, pageNumber,
                pageSize));
    }

    /**
     * Asynchronous variant of {@code fetchProjection}.
     */
    public CompletableFuture<Void> fetchProjectionAsync(List<DataValueProjector> valueProjectors,
            GeneralDataProjector projector, EntityFields fields, RelationPredicateBucket filter,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates,
            int pageNumber, int pageSize) {
        return run(adapter -> adapter.fetchProjection(valueProjectors, projector, fields, filter,
                maxNumberOfItemsToReturn, sortClauses, allowDuplicates, pageNumber, pageSize));
    }

    /**
     * Asynchronous variant of {@code fetchProjection}.
     */
    public CompletableFuture<Void> fetchProjectionAsync(List<DataValueProjector> valueProjectors,
            GeneralDataProjector projector, EntityFields fields, RelationPredicateBucket filter,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates) {
        return run(adapter -> adapter.fetchProjection(valueProjectors, projector, fields, filter,
                maxNumberOfItemsToReturn, sortClauses, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchProjection}.
     */
    public CompletableFuture<Void> fetchProjectionAsync(List<DataValueProjector> valueProjectors,
            GeneralDataProjector projector, EntityFields fields, RelationPredicateBucket filter,
            int maxNumberOfItemsToReturn, boolean allowDuplicates) {
        return run(adapter -> adapter.fetchProjection(valueProjectors, projector, fields, filter,
                maxNumberOfItemsToReturn, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code fetchProjection}.
     */
    public CompletableFuture<Void> fetchProjectionAsync(List<DataValueProjector> valueProjectors,
            GeneralDataProjector projector, QueryParameters parameters) {
        return run(adapter -> adapter.fetchProjection(valueProjectors, projector, parameters));
    }

    /**
     * Asynchronous variant of {@code fetchProjection}.
     */
    public CompletableFuture<Void> fetchProjectionAsync(List<DataValueProjector> valueProjectors,
            GeneralDataProjector projector, RetrievalQuery queryToExecute) {
        return run(adapter -> adapter.fetchProjection(valueProjectors, projector, queryToExecute));
    }

    /**
     * Asynchronous variant of {@code getDbCount}. Counts the rows a dynamic list over {@code
     * fields} would return.
     *
     * @return future completed with the number of rows
     */
    public CompletableFuture<Integer> getDbCountAsync(EntityFields fields,
            RelationPredicateBucket filter, GroupByCollection groupByClause,
            boolean allowDuplicates) {
        return call(adapter -> adapter.getDbCount(fields, filter, groupByClause, allowDuplicates));
    }

    /**
     * Asynchronous variant of {@code getDbCount}.
     */
    public CompletableFuture<Integer> getDbCountAsync(EntityFields fields,
            RelationPredicateBucket filter, GroupByCollection groupByClause) {
        return call(adapter -> adapter.getDbCount(fields, filter, groupByClause));
    }

    /**
     * Asynchronous variant of {@code getDbCount}.
     */
    public CompletableFuture<Integer> getDbCountAsync(EntityFields fields,
            RelationPredicateBucket filter) {
        return call(adapter -> adapter.getDbCount(fields, filter));
    }

    /**
     * Asynchronous variant of {@code getDbCount}. Counts the entities of the collection's type
     * matching the filter.
     *
     * @return future completed with the number of entities
     */
    public CompletableFuture<Integer> getDbCountAsync(EntityCollection<?> collection,
            RelationPredicateBucket filter, GroupByCollection groupByClause) {
        return call(adapter -> adapter.getDbCount(collection, filter, groupByClause));
    }

    /**
     * Asynchronous variant of {@code getDbCount}.
     */
    public CompletableFuture<Integer> getDbCountAsync(EntityCollection<?> collection,
            RelationPredicateBucket filter) {
        return call(adapter -> adapter.getDbCount(collection, filter));
    }

    /**
     * Asynchronous variant of {@code getScalar}. Executes a scalar query.
     *
     * @return future completed with the scalar value, {@code null} for a database {@code NULL}
     */
    public CompletableFuture<Object> getScalarAsync(EntityFields fields, Predicate filter,
            GroupByCollection groupByClause, RelationCollection relations) {
        return call(adapter -> adapter.getScalar(fields, filter, groupByClause, relations));
    }

    /**
     * Asynchronous variant of {@code getScalar}.
     */
    public CompletableFuture<Object> getScalarAsync(EntityFields fields, Predicate filter,
            GroupByCollection groupByClause) {
        return call(adapter -> adapter.getScalar(fields, filter, groupByClause));
    }

    /**
     * Asynchronous variant of {@code getScalar}.
     */
    public CompletableFuture<Object> getScalarAsync(EntityField field,
            Expression expressionToExecute, AggregateFunction aggregateToApply, Predicate filter,
            GroupByCollection groupByClause, RelationCollection relations) {
        return call(adapter -> adapter.getScalar(field, expressionToExecute, aggregateToApply,
                filter, groupByClause, relations));
    }

    /**
     * Asynchronous variant of {@code getScalar}.
     */
    public CompletableFuture<Object> getScalarAsync(EntityField field,
            Expression expressionToExecute, AggregateFunction aggregateToApply, Predicate filter,
            GroupByCollection groupByClause) {
        return call(adapter -> adapter.getScalar(field, expressionToExecute, aggregateToApply,
                filter, groupByClause));
    }

    /**
     * Asynchronous variant of {@code getScalar}.
     */
    public CompletableFuture<Object> getScalarAsync(EntityField field,
            Expression expressionToExecute, AggregateFunction aggregateToApply, Predicate filter) {
        return call(adapter -> adapter.getScalar(field, expressionToExecute, aggregateToApply,
                filter));
    }

    /**
     * Asynchronous variant of {@code getScalar}.
     */
    public CompletableFuture<Object> getScalarAsync(EntityField field,
            Expression expressionToExecute, AggregateFunction aggregateToApply) {
        return call(adapter -> adapter.getScalar(field, expressionToExecute, aggregateToApply));
    }

    /**
     * Asynchronous variant of {@code getScalar}.
     */
    public CompletableFuture<Object> getScalarAsync(EntityField field,
            AggregateFunction aggregateToApply) {
        return call(adapter -> adapter.getScalar(field, aggregateToApply));
    }

    /**
     * Asynchronous variant of {@code saveEntity}. Saves (inserts or updates) an entity.
     *
     * @return future completed with {@code true} if the save succeeded
     */
    public CompletableFuture<Boolean> saveEntityAsync(Entity entityToSave, boolean refetchAfterSave,
            PredicateExpression updateRestriction, boolean recurse) {
        return call(adapter -> adapter.saveEntity(entityToSave, refetchAfterSave, updateRestriction,
                recurse));
    }

    /**
     * Asynchronous variant of {@code saveEntity}.
     */
    public CompletableFuture<Boolean> saveEntityAsync(Entity entityToSave, boolean refetchAfterSave,
            PredicateExpression updateRestriction) {
        return call(adapter -> adapter.saveEntity(entityToSave, refetchAfterSave,
                updateRestriction));
    }

    /**
     * Asynchronous variant of {@code saveEntity}.
     */
    public CompletableFuture<Boolean> saveEntityAsync(Entity entityToSave, boolean refetchAfterSave,
            boolean recurse) {
        return call(adapter -> adapter.saveEntity(entityToSave, refetchAfterSave, recurse));
    }

    /**
     * Asynchronous variant of {@code saveEntity}.
     */
    public CompletableFuture<Boolean> saveEntityAsync(Entity entityToSave,
            boolean refetchAfterSave) {
        return call(adapter -> adapter.saveEntity(entityToSave, refetchAfterSave));
    }

    /**
     * Asynchronous variant of {@code saveEntity}.
     */
    public CompletableFuture<Boolean> saveEntityAsync(Entity entityToSave) {
        return call(adapter -> adapter.saveEntity(entityToSave));
    }

    /**
     * Asynchronous variant of {@code saveEntityCollection}. Saves every dirty entity in the
     * collection.
     *
     * @return future completed with the number of persisted entities
     */
    public CompletableFuture<Integer> saveEntityCollectionAsync(
            EntityCollection<?> collectionToSave, boolean refetchSavedEntitiesAfterSave,
            boolean recurse) {
        return call(adapter -> adapter.saveEntityCollection(collectionToSave,
                refetchSavedEntitiesAfterSave, recurse));
    }

    /**
     * Asynchronous variant of {@code saveEntityCollection}.
     */
    public CompletableFuture<Integer> saveEntityCollectionAsync(
            EntityCollection<?> collectionToSave) {
        return call(adapter -> adapter.saveEntityCollection(collectionToSave));
    }

    /**
     * Asynchronous variant of {@code deleteEntity}. Deletes an entity.
     *
     * @return future completed with {@code true} if the delete succeeded
     */
    public CompletableFuture<Boolean> deleteEntityAsync(Entity entityToDelete,
            PredicateExpression deleteRestriction) {
        return call(adapter -> adapter.deleteEntity(entityToDelete, deleteRestriction));
    }

    /**
     * Asynchronous variant of {@code deleteEntity}.
     */
    public CompletableFuture<Boolean> deleteEntityAsync(Entity entityToDelete) {
        return call(adapter -> adapter.deleteEntity(entityToDelete));
    }

    /**
     * Asynchronous variant of {@code deleteEntityCollection}. Deletes every entity in the
     * collection.
     *
     * @return future completed with the number of deleted entities
     */
    public CompletableFuture<Integer> deleteEntityCollectionAsync(
            EntityCollection<?> collectionToDelete) {
        return call(adapter -> adapter.deleteEntityCollection(collectionToDelete));
    }

    /**
     * Asynchronous variant of {@code deleteEntitiesDirectly}. Deletes the rows of an entity type
     * that match a filter, without fetching them first.
     *
     * @return future completed with the number of deleted rows
     */
    public CompletableFuture<Integer> deleteEntitiesDirectlyAsync(
            Class<? extends Entity> entityType, RelationPredicateBucket filterBucket) {
        return call(adapter -> adapter.deleteEntitiesDirectly(entityType, filterBucket));
    }

    /**
     * Asynchronous variant of {@code deleteEntitiesDirectly}.
     */
    public CompletableFuture<Integer> deleteEntitiesDirectlyAsync(String entityName,
            RelationPredicateBucket filterBucket) {
        return call(adapter -> adapter.deleteEntitiesDirectly(entityName, filterBucket));
    }

    /**
     * Asynchronous variant of {@code updateEntitiesDirectly}. Updates the matching rows with the
     * changed field values of {@code entityWithNewValues}.
     *
     * @return future completed with the number of updated rows
     */
    public CompletableFuture<Integer> updateEntitiesDirectlyAsync(Entity entityWithNewValues,
            RelationPredicateBucket filterBucket) {
        return call(adapter -> adapter.updateEntitiesDirectly(entityWithNewValues, filterBucket));
    }
}
