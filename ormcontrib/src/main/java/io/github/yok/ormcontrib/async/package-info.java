/**
 * Non-blocking facade over the synchronous data-access adapter.
 *
 * <p>
 * The work itself stays synchronous: each call borrows a worker thread, creates its own adapter,
 * runs one adapter operation and closes the adapter. Only the caller's thread is freed.
 * </p>
 */
package io.github.yok.ormcontrib.async;
