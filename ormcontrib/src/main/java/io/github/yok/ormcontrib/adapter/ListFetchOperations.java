package io.github.yok.ormcontrib.adapter;

import io.github.yok.ormcontrib.adapter.model.DataValueProjector;
import io.github.yok.ormcontrib.adapter.model.EntityFields;
import io.github.yok.ormcontrib.adapter.model.GeneralDataProjector;
import io.github.yok.ormcontrib.adapter.model.GroupByCollection;
import io.github.yok.ormcontrib.adapter.model.PredicateExpression;
import io.github.yok.ormcontrib.adapter.model.QueryParameters;
import io.github.yok.ormcontrib.adapter.model.RelationPredicateBucket;
import io.github.yok.ormcontrib.adapter.model.ResultTable;
import io.github.yok.ormcontrib.adapter.model.RetrievalQuery;
import io.github.yok.ormcontrib.adapter.model.SortExpression;
import io.github.yok.ormcontrib.adapter.model.TypedList;
import io.github.yok.ormcontrib.adapter.model.TypedView;
import java.util.List;

/**
 * Flat-result fetches: typed lists, typed views and projections.
 *
 * @author Yasuharu.Okawauchi
 */
public interface ListFetchOperations {

    /**
     * Fills a typed list, optionally narrowed by an additional filter.
     *
     * @param typedListToFill typed list to fill
     * @param additionalFilter filter appended to the typed list's own filter, may be {@code null}
     * @param maxNumberOfItemsToReturn row limit, {@code 0} for no limit
     * @param sortClauses ordering, may be {@code null}
     * @param allowDuplicates {@code false} to emit {@code DISTINCT}
     * @param pageNumber page to fetch, first page is {@code 1}
     * @param pageSize page size
     */
    void fetchTypedList(TypedList typedListToFill, PredicateExpression additionalFilter,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates,
            int pageNumber, int pageSize);

    void fetchTypedList(TypedList typedListToFill, PredicateExpression additionalFilter,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates);

    void fetchTypedList(TypedList typedListToFill, PredicateExpression additionalFilter);

    void fetchTypedList(TypedList typedListToFill);

    void fetchTypedList(ResultTable tableToFill, QueryParameters parameters);

    /**
     * Fetches a dynamic list built from a field set into an untyped table.
     *
     * @param fieldCollectionToFetch fields forming the select list
     * @param tableToFill target table
     * @param filterBucket filter and relations, may be {@code null}
     * @param maxNumberOfItemsToReturn row limit, {@code 0} for no limit
     * @param sortClauses ordering, may be {@code null}
     * @param allowDuplicates {@code false} to emit {@code DISTINCT}
     * @param groupByClause grouping, may be {@code null}
     * @param pageNumber page to fetch, first page is {@code 1}
     * @param pageSize page size
     */
    void fetchTypedList(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates, GroupByCollection groupByClause,
            int pageNumber, int pageSize);

    void fetchTypedList(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates, GroupByCollection groupByClause);

    void fetchTypedList(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates);

    void fetchTypedList(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            boolean allowDuplicates);

    void fetchTypedList(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket, boolean allowDuplicates);

    void fetchTypedList(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket);

    /**
     * Fills a typed view.
     *
     * @param typedViewToFill typed view to fill
     * @param filterBucket filter, may be {@code null}
     * @param maxNumberOfItemsToReturn row limit, {@code 0} for no limit
     * @param sortClauses ordering, may be {@code null}
     * @param allowDuplicates {@code false} to emit {@code DISTINCT}
     * @param groupByClause grouping, may be {@code null}
     */
    void fetchTypedView(TypedView typedViewToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates,
            GroupByCollection groupByClause);

    void fetchTypedView(TypedView typedViewToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, SortExpression sortClauses, boolean allowDuplicates);

    void fetchTypedView(TypedView typedViewToFill, RelationPredicateBucket filterBucket,
            int maxNumberOfItemsToReturn, boolean allowDuplicates);

    void fetchTypedView(TypedView typedViewToFill, RelationPredicateBucket filterBucket,
            boolean allowDuplicates);

    void fetchTypedView(TypedView typedViewToFill, boolean allowDuplicates);

    void fetchTypedView(TypedView typedViewToFill);

    void fetchTypedView(TypedView typedViewToFill, RetrievalQuery queryToUse);

    void fetchTypedView(ResultTable tableToFill, QueryParameters parameters);

    void fetchTypedView(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates, GroupByCollection groupByClause,
            int pageNumber, int pageSize);

    void fetchTypedView(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates, GroupByCollection groupByClause);

    void fetchTypedView(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates);

    void fetchTypedView(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket, int maxNumberOfItemsToReturn,
            boolean allowDuplicates);

    void fetchTypedView(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            RelationPredicateBucket filterBucket, boolean allowDuplicates);

    void fetchTypedView(EntityFields fieldCollectionToFetch, ResultTable tableToFill,
            boolean allowDuplicates);

    void fetchTypedView(EntityFields fieldCollectionToFetch, ResultTable tableToFill);

    /**
     * Runs a projection and hands each projected row to {@code projector}.
     *
     * @param valueProjectors per-column projectors
     * @param projector receiver of projected rows
     * @param fields fields forming the select list
     * @param filter filter and relations, may be {@code null}
     * @param maxNumberOfItemsToReturn row limit, {@code 0} for no limit
     * @param sortClauses ordering, may be {@code null}
     * @param groupByClause grouping, may be {@code null}
     * @param allowDuplicates {@code false} to emit {@code DISTINCT}
     * @param pageNumber page to fetch, first page is {@code 1}
     * @param pageSize page size
     */
    void fetchProjection(List<DataValueProjector> valueProjectors, GeneralDataProjector projector,
            EntityFields fields, RelationPredicateBucket filter, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, GroupByCollection groupByClause, boolean allowDuplicates,
            int pageNumber, int pageSize);

    void fetchProjection(List<DataValueProjector> valueProjectors, GeneralDataProjector projector,
            EntityFields fields, RelationPredicateBucket filter, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates, int pageNumber, int pageSize);

    void fetchProjection(List<DataValueProjector> valueProjectors, GeneralDataProjector projector,
            EntityFields fields, RelationPredicateBucket filter, int maxNumberOfItemsToReturn,
            SortExpression sortClauses, boolean allowDuplicates);

    void fetchProjection(List<DataValueProjector> valueProjectors, GeneralDataProjector projector,
            EntityFields fields, RelationPredicateBucket filter, int maxNumberOfItemsToReturn,
            boolean allowDuplicates);

    void fetchProjection(List<DataValueProjector> valueProjectors, GeneralDataProjector projector,
            QueryParameters parameters);

    void fetchProjection(List<DataValueProjector> valueProjectors, GeneralDataProjector projector,
            RetrievalQuery queryToExecute);
}
