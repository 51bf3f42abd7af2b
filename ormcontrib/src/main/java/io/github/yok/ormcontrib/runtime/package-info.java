/**
 * Runtime settings context and the applier that fills it from settings files.
 *
 * <p>
 * A {@link io.github.yok.ormcontrib.runtime.RuntimeConfiguration} is an ordinary object: create
 * it, apply a document with {@link io.github.yok.ormcontrib.runtime.ConfigurationApplier} and
 * pass it on.
 * </p>
 */
package io.github.yok.ormcontrib.runtime;
