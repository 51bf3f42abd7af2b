/**
 * Hierarchical configuration source.
 *
 * <p>
 * Reads layered YAML/JSON settings files with SnakeYAML and exposes the merged document as a tree
 * of {@link io.github.yok.ormcontrib.config.ConfigurationSection}s. Applying the settings is done
 * in {@code io.github.yok.ormcontrib.runtime}.
 * </p>
 */
package io.github.yok.ormcontrib.config;
