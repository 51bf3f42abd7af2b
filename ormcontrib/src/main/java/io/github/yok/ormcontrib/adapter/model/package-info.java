/**
 * Payload types accepted by {@link io.github.yok.ormcontrib.adapter.DataAccessAdapter}
 * operations.
 *
 * <p>
 * These types are implemented by the ORM runtime. This library never inspects them; it only
 * passes them through to the adapter.
 * </p>
 */
package io.github.yok.ormcontrib.adapter.model;
