package io.github.yok.ormcontrib.runtime;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;

/**
 * Settings of the SQL Server dynamic query engine (DQE).
 *
 * @author Yasuharu.Okawauchi
 */
public class DqeConfiguration {

    private final Set<String> driverClassNames = new LinkedHashSet<>();

    private final Map<String, String> catalogNameOverwrites = new LinkedHashMap<>();

    @Getter
    @Setter
    private SqlServerCompatibilityLevel defaultCompatibilityLevel =
            SqlServerCompatibilityLevel.SQL_SERVER_2005;

    @Getter
    @Setter
    private TraceLevel traceLevel = TraceLevel.OFF;

    /**
     * Adds a JDBC driver class the engine may use. Adding a known name again has no effect.
     *
     * @param driverClassName fully qualified class name
     * @return this configuration
     */
    public synchronized DqeConfiguration addDriverClassName(String driverClassName) {
        Preconditions.checkArgument(StringUtils.isNotBlank(driverClassName),
                "driverClassName must not be blank");
        driverClassNames.add(driverClassName);
        return this;
    }

    /**
     * Maps a catalog name used in the mappings to the one used at runtime. Re-adding a catalog
     * name replaces its overwrite.
     *
     * @param catalogName catalog name in the mappings
     * @param overwrite catalog name to use, {@code null} treated as empty
     * @return this configuration
     * @throws NullPointerException if {@code catalogName} is {@code null}
     */
    public synchronized DqeConfiguration addCatalogNameOverwrite(String catalogName,
            String overwrite) {
        Preconditions.checkNotNull(catalogName, "catalogName must not be null");
        catalogNameOverwrites.put(catalogName, StringUtils.defaultString(overwrite));
        return this;
    }

    /**
     * Returns the registered driver class names.
     *
     * @return driver class names in insertion order
     */
    public synchronized Set<String> getDriverClassNames() {
        return ImmutableSet.copyOf(driverClassNames);
    }

    /**
     * Returns the catalog name overwrites.
     *
     * @return catalog name to overwrite, in insertion order
     */
    public synchronized Map<String, String> getCatalogNameOverwrites() {
        return ImmutableMap.copyOf(catalogNameOverwrites);
    }
}
