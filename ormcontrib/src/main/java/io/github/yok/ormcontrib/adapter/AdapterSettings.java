package io.github.yok.ormcontrib.adapter;

import org.springframework.transaction.annotation.Isolation;

/**
 * Per-instance settings of a data-access adapter.
 *
 * <p>
 * Every adapter starts with its own defaults (typically taken from the generated code or from the
 * connection strings registered at startup). Callers may override them right after construction
 * and before the first operation.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface AdapterSettings {

    /**
     * Returns the connection string used to open connections.
     *
     * @return connection string
     */
    String getConnectionString();

    /**
     * Overrides the connection string used to open connections.
     *
     * @param connectionString connection string
     */
    void setConnectionString(String connectionString);

    /**
     * Returns the command timeout in seconds.
     *
     * @return command timeout in seconds
     */
    int getCommandTimeOut();

    /**
     * Sets the command timeout in seconds applied to every command the adapter executes.
     *
     * @param commandTimeOut timeout in seconds
     */
    void setCommandTimeOut(int commandTimeOut);

    /**
     * Returns the threshold below which prefetch-path subqueries are replaced by parameterised
     * {@code IN} lists.
     *
     * @return parameterised prefetch-path threshold
     */
    int getParameterisedPrefetchPathThreshold();

    /**
     * Sets the parameterised prefetch-path threshold.
     *
     * @param threshold threshold value
     */
    void setParameterisedPrefetchPathThreshold(int threshold);

    /**
     * Returns the isolation level used for transactions the adapter starts itself.
     *
     * @return isolation level, {@link Isolation#DEFAULT} when unspecified
     */
    Isolation getTransactionIsolationLevel();

    /**
     * Sets the isolation level used for transactions the adapter starts itself.
     *
     * @param isolationLevel isolation level
     */
    void setTransactionIsolationLevel(Isolation isolationLevel);
}
