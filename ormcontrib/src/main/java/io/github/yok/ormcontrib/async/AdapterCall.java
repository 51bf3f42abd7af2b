package io.github.yok.ormcontrib.async;

import io.github.yok.ormcontrib.adapter.DataAccessAdapter;

/**
 * Unit of work executed against a freshly created adapter, producing a result.
 *
 * @param <A> adapter type
 * @param <R> result type
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface AdapterCall<A extends DataAccessAdapter, R> {

    /**
     * Runs the work.
     *
     * @param adapter adapter owned by this call, closed by the caller afterwards
     * @return result of the work
     * @throws Exception any failure of the work, delivered unchanged through the returned future
     */
    R apply(A adapter) throws Exception;
}
