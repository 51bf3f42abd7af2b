package io.github.yok.ormcontrib.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves the environment and machine names that select the layered {@code appsettings} files.
 *
 * <p>
 * Environment name: {@value #ENVIRONMENT_VARIABLE}, then {@value #FALLBACK_ENVIRONMENT_VARIABLE},
 * then {@value #DEFAULT_ENVIRONMENT}. Machine name: {@code COMPUTERNAME}, then {@code HOSTNAME},
 * then the local host name.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConfigurationEnvironment {

    /** Variable holding the environment name. */
    public static final String ENVIRONMENT_VARIABLE = "ORMCONTRIB_ENVIRONMENT";

    /** Variable consulted when {@value #ENVIRONMENT_VARIABLE} is not set. */
    public static final String FALLBACK_ENVIRONMENT_VARIABLE = "APP_ENVIRONMENT";

    /** Environment name used when no variable is set. */
    public static final String DEFAULT_ENVIRONMENT = "Production";

    /** Base name of the settings files. */
    public static final String SETTINGS_BASE_NAME = "appsettings";

    private static final List<String> EXTENSIONS = ImmutableList.of("json", "yml");

    private final UnaryOperator<String> variables;

    /**
     * Creates an environment reading variables through the given lookup.
     *
     * @param variables variable lookup returning {@code null} for unset variables
     */
    public ConfigurationEnvironment(UnaryOperator<String> variables) {
        this.variables = Preconditions.checkNotNull(variables, "variables must not be null");
    }

    /**
     * Returns an environment backed by the process environment variables.
     *
     * @return system environment
     */
    public static ConfigurationEnvironment system() {
        return new ConfigurationEnvironment(System::getenv);
    }

    /**
     * Resolves the environment name.
     *
     * @return environment name, never blank
     */
    public String resolveEnvironmentName() {
        String name = variables.apply(ENVIRONMENT_VARIABLE);
        if (StringUtils.isEmpty(name)) {
            name = variables.apply(FALLBACK_ENVIRONMENT_VARIABLE);
        }
        if (StringUtils.isEmpty(name)) {
            name = DEFAULT_ENVIRONMENT;
        }
        return name;
    }

    /**
     * Resolves the machine name.
     *
     * @return machine name, or an empty string when it cannot be determined
     */
    public String resolveMachineName() {
        String name = variables.apply("COMPUTERNAME");
        if (StringUtils.isEmpty(name)) {
            name = variables.apply("HOSTNAME");
        }
        if (StringUtils.isNotEmpty(name)) {
            return name;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Local host name could not be resolved; machine settings are skipped", e);
            return StringUtils.EMPTY;
        }
    }

    /**
     * Returns the settings file names in merge order: base, environment, machine. Each level
     * lists the JSON file before the YAML file.
     *
     * @return file names
     */
    public List<String> settingsFileNames() {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        addLevel(names, SETTINGS_BASE_NAME);
        addLevel(names, SETTINGS_BASE_NAME + "." + resolveEnvironmentName());
        String machineName = resolveMachineName();
        if (StringUtils.isNotEmpty(machineName)) {
            addLevel(names, SETTINGS_BASE_NAME + "." + machineName);
        }
        return names.build();
    }

    private static void addLevel(ImmutableList.Builder<String> names, String stem) {
        for (String extension : EXTENSIONS) {
            names.add(stem + "." + extension);
        }
    }
}
