package io.github.yok.ormcontrib.runtime;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Named connection strings made available to adapters.
 *
 * <p>
 * Backed by a {@link ConcurrentHashMap}; registering an existing name replaces its value.
 * Connection string values are never logged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionStringRegistry {

    private final ConcurrentHashMap<String, String> registry = new ConcurrentHashMap<>();

    /**
     * Registers a connection string.
     *
     * @param name registry key, e.g. {@code Main.ConnectionString}
     * @param connectionString connection string
     * @throws NullPointerException if any argument is {@code null}
     */
    public void register(String name, String connectionString) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(connectionString, "connectionString");
        String previous = registry.put(name, connectionString);
        log.debug("register: name={}, replaced={}", name, previous != null);
    }

    /**
     * Finds a connection string.
     *
     * @param name registry key
     * @return connection string, or empty if none
     */
    public Optional<String> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registry.get(name));
    }

    /**
     * Returns an immutable copy of all entries.
     *
     * @return registry snapshot
     */
    public Map<String, String> snapshot() {
        return ImmutableMap.copyOf(registry);
    }

    /**
     * Returns the number of registered connection strings.
     *
     * @return entry count
     */
    public int size() {
        return registry.size();
    }
}
