package io.github.yok.ormcontrib.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Builds one configuration document from several optional YAML or JSON files.
 *
 * <p>
 * Files are read in the order they were added, relative to the base directory. A missing file is
 * skipped. Files ending in {@code .json} are parsed with Jackson, all others with SnakeYAML.
 * Each file is merged over the result of the previous ones:
 * </p>
 * <ul>
 * <li>mappings are merged key by key, keys compared case-insensitively;</li>
 * <li>scalars and lists of a later file replace those of an earlier file.</li>
 * </ul>
 *
 * <pre>
 * ConfigurationSection root = new LayeredConfigurationLoader(Paths.get("conf"))
 *         .addOptionalFile("appsettings.yml")
 *         .addOptionalFile("appsettings.Development.yml")
 *         .load();
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LayeredConfigurationLoader {

    // Directory against which relative file names are resolved
    private final Path baseDirectory;

    // File names in merge order
    private final List<String> fileNames = new ArrayList<>();

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Creates a loader resolving files against {@code baseDirectory}.
     *
     * @param baseDirectory base directory
     * @throws NullPointerException if {@code baseDirectory} is {@code null}
     */
    public LayeredConfigurationLoader(Path baseDirectory) {
        this.baseDirectory =
                Preconditions.checkNotNull(baseDirectory, "baseDirectory must not be null");
    }

    /**
     * Adds a file that is read if it exists. Files added later take precedence.
     *
     * @param fileName file name, relative to the base directory or absolute
     * @return this loader
     * @throws IllegalArgumentException if {@code fileName} is blank
     */
    public LayeredConfigurationLoader addOptionalFile(String fileName) {
        Preconditions.checkArgument(fileName != null && !fileName.isBlank(),
                "fileName must not be blank");
        fileNames.add(fileName);
        return this;
    }

    /**
     * Reads and merges all files.
     *
     * @return root section of the merged document; empty when no file exists
     * @throws IllegalStateException if an existing file cannot be read or parsed, or its root is
     *         not a mapping
     */
    public ConfigurationSection load() {
        Map<String, Object> merged = new LinkedHashMap<>();
        int loaded = 0;
        for (String fileName : fileNames) {
            Path file = baseDirectory.resolve(fileName);
            if (!Files.isRegularFile(file)) {
                log.debug("Configuration file not found, skipped: {}", file.toAbsolutePath());
                continue;
            }
            merge(merged, read(file));
            loaded++;
            log.debug("Configuration file merged: {}", file.toAbsolutePath());
        }
        log.debug("Configuration loaded from {} of {} candidate file(s) in {}", loaded,
                fileNames.size(), baseDirectory.toAbsolutePath());
        return ConfigurationSection.root(merged);
    }

    /**
     * Parses one file into a mapping.
     *
     * @param file YAML or JSON file
     * @return parsed mapping; empty for an empty file
     */
    Map<String, Object> read(Path file) {
        if (StringUtils.endsWithIgnoreCase(file.getFileName().toString(), ".json")) {
            return readJson(file);
        }
        return readYaml(file);
    }

    private Map<String, Object> readJson(Path file) {
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse configuration file: " + file, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration file: " + file, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!root.isObject()) {
            throw new IllegalStateException(
                    "Configuration file root must be a mapping: " + file);
        }
        return copyMapping(mapper.convertValue(root, Map.class));
    }

    private Map<String, Object> readYaml(Path file) {
        Object document;
        try (InputStream in = Files.newInputStream(file)) {
            document = new Yaml().load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration file: " + file, e);
        } catch (YAMLException e) {
            throw new IllegalStateException("Failed to parse configuration file: " + file, e);
        }
        if (document == null) {
            return new LinkedHashMap<>();
        }
        if (!(document instanceof Map)) {
            throw new IllegalStateException(
                    "Configuration file root must be a mapping: " + file);
        }
        return copyMapping((Map<?, ?>) document);
    }

    /**
     * Merges {@code source} into {@code target}.
     *
     * @param target mapping receiving the values
     * @param source mapping whose values win
     */
    static void merge(Map<String, Object> target, Map<?, ?> source) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String existingKey = findKey(target, key);
            Object incoming = entry.getValue();
            if (existingKey == null) {
                target.put(key, incoming);
                continue;
            }
            Object current = target.get(existingKey);
            if (current instanceof Map && incoming instanceof Map) {
                Map<String, Object> merged = copyMapping((Map<?, ?>) current);
                merge(merged, (Map<?, ?>) incoming);
                target.put(existingKey, merged);
            } else {
                target.put(existingKey, incoming);
            }
        }
    }

    private static String findKey(Map<String, Object> map, String key) {
        for (String candidate : map.keySet()) {
            if (candidate.equalsIgnoreCase(key)) {
                return candidate;
            }
        }
        return null;
    }

    // Deep copy with string keys so merging never mutates a parsed document
    private static Map<String, Object> copyMapping(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copyNode(entry.getValue()));
        }
        return copy;
    }

    private static Object copyNode(Object node) {
        if (node instanceof Map) {
            return copyMapping((Map<?, ?>) node);
        }
        if (node instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) node) {
                copy.add(copyNode(item));
            }
            return copy;
        }
        return node;
    }
}
