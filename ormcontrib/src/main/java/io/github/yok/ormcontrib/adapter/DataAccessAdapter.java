package io.github.yok.ormcontrib.adapter;

/**
 * Aggregate interface of a synchronous data-access adapter.
 *
 * <p>
 * An adapter is a short-lived handle on one connection/session of the persistence layer. It is
 * not safe for concurrent use and must be closed when the unit of work ends. The operation groups
 * are kept in separate contracts: settings, entity fetches, flat-result fetches, aggregates and
 * persistence.
 * </p>
 *
 * <p>
 * Operations that depend on a call sequence against one instance (open data readers, explicit
 * transaction control) are not part of this contract.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DataAccessAdapter extends AdapterSettings, EntityFetchOperations,
        ListFetchOperations, AggregateOperations, PersistenceOperations, AutoCloseable {

    /**
     * Releases the connection and any other resources held by this adapter.
     */
    @Override
    void close();
}
