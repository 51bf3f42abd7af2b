package io.github.yok.ormcontrib.runtime;

import io.github.yok.ormcontrib.config.ConfigurationEnvironment;
import io.github.yok.ormcontrib.config.ConfigurationSection;
import io.github.yok.ormcontrib.config.LayeredConfigurationLoader;
import io.github.yok.ormcontrib.runtime.trace.ConsoleTraceListener;
import io.github.yok.ormcontrib.runtime.trace.DebugTraceListener;
import io.github.yok.ormcontrib.runtime.trace.FileTraceListener;
import io.github.yok.ormcontrib.runtime.trace.TraceListenerCollection;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.OptionalInt;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Applies a settings document to a {@link RuntimeConfiguration}.
 *
 * <p>
 * Recognized layout (keys are case-insensitive):
 * </p>
 *
 * <pre>
 * ConnectionStrings:
 *   Main: "jdbc:sqlserver://db;databaseName=Main"
 * LLBLGen:
 *   Tracing:
 *     Switches:
 *       EntityFetch: 2
 *       SqlServerDQE: 1
 *     Listeners:
 *       Console: true
 *       File: logs/trace.log
 *   SqlServerCatalogNameOverwrites:
 *     - CatalogName: Northwind
 *       Overwrite: NorthwindTest
 * </pre>
 *
 * <p>
 * {@code LLBLGen:ConnectionStrings} is read only when the root {@code ConnectionStrings} section
 * has no entries. Absent sections leave the corresponding settings untouched. Trace switch values
 * that are not integers are skipped. Trace listeners are replaced only when the document itself
 * sets a switch above {@code 0} and has a {@code Listeners} section; a trace flag already set on
 * the target does not count. Applying the same document again yields the same state.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConfigurationApplier {

    /** Section holding the trace switches. */
    public static final String SWITCHES_SECTION = "LLBLGen:Tracing:Switches";

    /** Section holding the trace listener flags. */
    public static final String LISTENERS_SECTION = "LLBLGen:Tracing:Listeners";

    /** Root-level connection strings section. */
    public static final String CONNECTION_STRINGS_SECTION = "ConnectionStrings";

    /** Connection strings section used when the root-level one is empty. */
    public static final String FALLBACK_CONNECTION_STRINGS_SECTION = "LLBLGen:ConnectionStrings";

    /** Section holding the catalog name overwrites. */
    public static final String CATALOG_OVERWRITES_SECTION =
            "LLBLGen:SqlServerCatalogNameOverwrites";

    /** Switch that sets the trace level of the query engine itself. */
    public static final String DQE_SWITCH = "SqlServerDQE";

    /** Suffix appended to each connection string name on registration. */
    public static final String CONNECTION_STRING_SUFFIX = ".ConnectionString";

    /** JDBC driver registered with the query engine. */
    public static final String SQL_SERVER_DRIVER = "com.microsoft.sqlserver.jdbc.SQLServerDriver";

    /**
     * Applies the layered {@code appsettings} files found in the current directory, selected by
     * the process environment.
     *
     * @param target configuration to fill
     */
    public static void configureFromAppSettings(RuntimeConfiguration target) {
        configureFromAppSettings(target, currentDirectory(), ConfigurationEnvironment.system());
    }

    /**
     * Applies the layered {@code appsettings} files found in {@code baseDirectory}.
     *
     * @param target configuration to fill
     * @param baseDirectory directory holding the settings files
     * @param environment source of the environment and machine names
     * @throws IllegalStateException if an existing file cannot be read or parsed
     */
    public static void configureFromAppSettings(RuntimeConfiguration target, Path baseDirectory,
            ConfigurationEnvironment environment) {
        Objects.requireNonNull(environment, "environment");
        LayeredConfigurationLoader loader = new LayeredConfigurationLoader(baseDirectory);
        environment.settingsFileNames().forEach(loader::addOptionalFile);
        configure(target, loader.load());
    }

    /**
     * Applies a single settings file from the current directory. A missing file applies an empty
     * document.
     *
     * @param target configuration to fill
     * @param fileName settings file name
     */
    public static void configureFromFile(RuntimeConfiguration target, String fileName) {
        configureFromFile(target, fileName, currentDirectory());
    }

    /**
     * Applies a single settings file. A missing file applies an empty document.
     *
     * @param target configuration to fill
     * @param fileName settings file name, relative to {@code directory}
     * @param directory directory holding the file
     * @throws IllegalStateException if the file exists but cannot be read or parsed
     */
    public static void configureFromFile(RuntimeConfiguration target, String fileName,
            Path directory) {
        configure(target,
                new LayeredConfigurationLoader(directory).addOptionalFile(fileName).load());
    }

    /**
     * Applies a parsed settings document.
     *
     * @param target configuration to fill
     * @param root root section of the document
     */
    public static void configure(RuntimeConfiguration target, ConfigurationSection root) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(root, "root");

        // 1) Trace switches
        TracingConfiguration tracing = target.getTracing();
        ConfigurationSection switches = root.getSection(SWITCHES_SECTION);
        int switchCount = applyTraceSwitches(tracing, switches);
        boolean traceRequested = isTraceRequested(switches);
        if (traceRequested) {
            tracing.setTraceEnabled(true);
        }

        // 2) Connection strings
        int connectionStringCount = applyConnectionStrings(target, root);

        // 3) Query engine
        applyDqe(target, root);

        // 4) Trace listeners, only when this document requests tracing
        boolean listenersApplied = applyTraceListeners(tracing,
                root.getSection(LISTENERS_SECTION), traceRequested);

        log.info("Configuration applied: switches={}, connectionStrings={}, traceRequested={},"
                + " listenersApplied={}", switchCount, connectionStringCount, traceRequested,
                listenersApplied);
    }

    private static int applyTraceSwitches(TracingConfiguration tracing,
            ConfigurationSection switches) {
        int applied = 0;
        for (ConfigurationSection traceSwitch : switches.getChildren()) {
            if (DQE_SWITCH.equalsIgnoreCase(traceSwitch.getKey())) {
                continue;
            }
            OptionalInt level = traceSwitch.getIntValue();
            if (level.isEmpty()) {
                log.debug("Trace switch skipped, not an integer: {}={}", traceSwitch.getKey(),
                        traceSwitch.getValue());
                continue;
            }
            tracing.setTraceLevel(traceSwitch.getKey(), TraceLevel.fromValue(level.getAsInt()));
            log.debug("Trace switch: {} = {}", traceSwitch.getKey(),
                    tracing.getTraceLevel(traceSwitch.getKey()));
            applied++;
        }
        return applied;
    }

    // True when any switch of this document, the DQE switch included, is above 0
    private static boolean isTraceRequested(ConfigurationSection switches) {
        for (ConfigurationSection traceSwitch : switches.getChildren()) {
            OptionalInt level = traceSwitch.getIntValue();
            if (level.isPresent() && level.getAsInt() > 0) {
                return true;
            }
        }
        return false;
    }

    private static int applyConnectionStrings(RuntimeConfiguration target,
            ConfigurationSection root) {
        ConfigurationSection section = root.getSection(CONNECTION_STRINGS_SECTION);
        if (!section.hasChildren()) {
            section = root.getSection(FALLBACK_CONNECTION_STRINGS_SECTION);
        }
        int registered = 0;
        for (ConfigurationSection entry : section.getChildren()) {
            String connectionString = entry.getValue();
            if (connectionString == null) {
                log.debug("Connection string skipped, no value: {}", entry.getKey());
                continue;
            }
            target.addConnectionString(entry.getKey() + CONNECTION_STRING_SUFFIX,
                    connectionString);
            registered++;
        }
        log.debug("Connection strings registered from {}: {}", section.getPath(), registered);
        return registered;
    }

    private static void applyDqe(RuntimeConfiguration target, ConfigurationSection root) {
        ConfigurationSection dqeSwitch = root.getSection(SWITCHES_SECTION).getSection(DQE_SWITCH);
        ConfigurationSection overwrites = root.getSection(CATALOG_OVERWRITES_SECTION);
        target.configureDqe(dqe -> {
            dqe.addDriverClassName(SQL_SERVER_DRIVER);
            dqe.setDefaultCompatibilityLevel(SqlServerCompatibilityLevel.SQL_SERVER_2012);
            log.debug("DQE: driver = {}, compatibility level = {}", SQL_SERVER_DRIVER,
                    dqe.getDefaultCompatibilityLevel());

            OptionalInt level = dqeSwitch.getIntValue();
            if (level.isPresent()) {
                dqe.setTraceLevel(TraceLevel.fromValue(level.getAsInt()));
                log.debug("DQE: trace level = {}", dqe.getTraceLevel());
            }

            for (ConfigurationSection overwrite : overwrites.getChildren()) {
                String catalogName = overwrite.getString("CatalogName");
                if (catalogName == null) {
                    log.debug("DQE: catalog name overwrite skipped, no CatalogName: {}",
                            overwrite.getPath());
                    continue;
                }
                String replacement = StringUtils.defaultString(overwrite.getString("Overwrite"));
                dqe.addCatalogNameOverwrite(catalogName, replacement);
                log.debug("DQE: catalog name overwrite {} -> '{}'", catalogName, replacement);
            }
        });
    }

    private static boolean applyTraceListeners(TracingConfiguration tracing,
            ConfigurationSection listenerSettings, boolean traceRequested) {
        if (!traceRequested || !listenerSettings.hasChildren()) {
            log.debug("Trace listeners left unchanged: traceRequested={}, listeners configured={}",
                    traceRequested, listenerSettings.hasChildren());
            return false;
        }
        TraceListenerCollection listeners = tracing.getListeners();
        listeners.clear();
        if (listenerSettings.getBoolean("Console")) {
            listeners.add(new ConsoleTraceListener());
            log.debug("Trace listener added: {}", ConsoleTraceListener.NAME);
        }
        String fileName = StringUtils.trimToEmpty(listenerSettings.getString("File"));
        if (listenerSettings.getBoolean("Debug")) {
            listeners.add(new DebugTraceListener(fileName));
            log.debug("Trace listener added: {}, file = '{}'", DebugTraceListener.NAME, fileName);
            return true;
        }
        if (!fileName.isEmpty()) {
            listeners.add(new FileTraceListener(Paths.get(fileName)));
            log.debug("Trace listener added: {}, file = {}", FileTraceListener.NAME, fileName);
        }
        return true;
    }

    private static Path currentDirectory() {
        return Paths.get("").toAbsolutePath();
    }
}
