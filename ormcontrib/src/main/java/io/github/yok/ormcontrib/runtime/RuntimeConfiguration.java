package io.github.yok.ormcontrib.runtime;

import java.util.Objects;
import java.util.function.Consumer;
import lombok.Getter;

/**
 * Runtime settings shared by the components of one application: tracing, connection strings
 * and the query engine.
 *
 * <p>
 * Create one instance at startup, fill it with {@link ConfigurationApplier} and hand it to the
 * code that needs it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RuntimeConfiguration {

    private final TracingConfiguration tracing = new TracingConfiguration();

    private final ConnectionStringRegistry connectionStrings = new ConnectionStringRegistry();

    private final DqeConfiguration dqe = new DqeConfiguration();

    /**
     * Registers a connection string.
     *
     * @param name registry key
     * @param connectionString connection string
     */
    public void addConnectionString(String name, String connectionString) {
        connectionStrings.register(name, connectionString);
    }

    /**
     * Runs a configuration step against the query engine settings.
     *
     * @param configurer step to run
     */
    public void configureDqe(Consumer<DqeConfiguration> configurer) {
        Objects.requireNonNull(configurer, "configurer").accept(dqe);
    }
}
