/**
 * Contract of the synchronous data-access adapter supplied by the ORM runtime.
 *
 * <p>
 * {@link io.github.yok.ormcontrib.adapter.DataAccessAdapter} is implemented outside this library.
 * {@code io.github.yok.ormcontrib.async} builds on it.
 * </p>
 */
package io.github.yok.ormcontrib.adapter;
