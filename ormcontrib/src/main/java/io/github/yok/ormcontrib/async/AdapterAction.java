package io.github.yok.ormcontrib.async;

import io.github.yok.ormcontrib.adapter.DataAccessAdapter;

/**
 * Unit of work executed against a freshly created adapter, without a result.
 *
 * @param <A> adapter type
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface AdapterAction<A extends DataAccessAdapter> {

    /**
     * Runs the work.
     *
     * @param adapter adapter owned by this call, closed by the caller afterwards
     * @throws Exception any failure of the work, delivered unchanged through the returned future
     */
    void accept(A adapter) throws Exception;
}
