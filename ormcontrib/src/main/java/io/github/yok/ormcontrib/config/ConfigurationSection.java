package io.github.yok.ormcontrib.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.apache.commons.lang3.StringUtils;

/**
 * Read-only node of a hierarchical configuration document.
 *
 * <p>
 * A section is either a mapping (it has children), a list (children keyed {@code 0}, {@code 1},
 * ...), a scalar (it has a value) or missing. Keys are matched case-insensitively and a nested key
 * can be addressed with a colon-separated path such as {@code LLBLGen:Tracing:Switches}.
 * </p>
 *
 * <p>
 * Lookups never return {@code null}: a missing key yields a section for which {@link #exists()}
 * is {@code false}, {@link #getValue()} is {@code null} and {@link #getChildren()} is empty.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ConfigurationSection {

    /** Separator of nested keys in a section path. */
    public static final String KEY_DELIMITER = ":";

    private final String key;
    private final String path;
    // Map<String, Object>, List<Object>, a scalar, or null when missing
    private final Object node;

    private ConfigurationSection(String key, String path, Object node) {
        this.key = key;
        this.path = path;
        this.node = node;
    }

    /**
     * Creates the root section of a parsed document.
     *
     * @param document parsed document, {@code null} for an empty one
     * @return root section with an empty key and path
     */
    public static ConfigurationSection root(Map<String, Object> document) {
        return new ConfigurationSection(StringUtils.EMPTY, StringUtils.EMPTY, document);
    }

    /**
     * Returns the last key of this section's path.
     *
     * @return key, empty for the root
     */
    public String getKey() {
        return key;
    }

    /**
     * Returns the full colon-separated path of this section.
     *
     * @return path, empty for the root
     */
    public String getPath() {
        return path;
    }

    /**
     * Returns the scalar value of this section.
     *
     * @return value as a string, or {@code null} for mappings, lists, missing sections and
     *         explicit nulls
     */
    public String getValue() {
        if (node == null || node instanceof Map || node instanceof List) {
            return null;
        }
        return String.valueOf(node);
    }

    /**
     * Returns whether this section is present in the document with a value or children.
     *
     * @return {@code true} if present
     */
    public boolean exists() {
        return node != null;
    }

    /**
     * Returns the section at the given key or colon-separated path.
     *
     * @param sectionKey key or path relative to this section
     * @return the section; a missing section when not present
     * @throws NullPointerException if {@code sectionKey} is {@code null}
     */
    public ConfigurationSection getSection(String sectionKey) {
        Preconditions.checkNotNull(sectionKey, "sectionKey must not be null");
        ConfigurationSection current = this;
        for (String part : StringUtils.split(sectionKey, KEY_DELIMITER)) {
            current = current.child(part);
        }
        return current;
    }

    /**
     * Returns the direct children of this section in document order.
     *
     * @return children; empty for scalars and missing sections
     */
    public List<ConfigurationSection> getChildren() {
        ImmutableList.Builder<ConfigurationSection> children = ImmutableList.builder();
        if (node instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) node).entrySet()) {
                String childKey = String.valueOf(entry.getKey());
                children.add(new ConfigurationSection(childKey, childPath(childKey),
                        entry.getValue()));
            }
        } else if (node instanceof List) {
            List<?> items = (List<?>) node;
            for (int i = 0; i < items.size(); i++) {
                String childKey = Integer.toString(i);
                children.add(new ConfigurationSection(childKey, childPath(childKey), items.get(i)));
            }
        }
        return children.build();
    }

    /**
     * Returns whether this section has at least one child.
     *
     * @return {@code true} if there are children
     */
    public boolean hasChildren() {
        return !getChildren().isEmpty();
    }

    /**
     * Returns the scalar value at the given key.
     *
     * @param sectionKey key or path relative to this section
     * @return value, or {@code null} when absent
     */
    public String getString(String sectionKey) {
        return getSection(sectionKey).getValue();
    }

    /**
     * Parses this section's value as an integer.
     *
     * <p>
     * Surrounding whitespace is ignored. Anything else that is not a plain decimal integer yields
     * an empty result instead of an exception.
     * </p>
     *
     * @return parsed value, or empty when absent or not an integer
     */
    public OptionalInt getIntValue() {
        String value = StringUtils.trimToNull(getValue());
        if (value == null) {
            return OptionalInt.empty();
        }
        Integer parsed = Ints.tryParse(value);
        return parsed == null ? OptionalInt.empty() : OptionalInt.of(parsed);
    }

    /**
     * Parses the value at the given key as an integer.
     *
     * @param sectionKey key or path relative to this section
     * @return parsed value, or empty when absent or not an integer
     * @see #getIntValue()
     */
    public OptionalInt getInt(String sectionKey) {
        return getSection(sectionKey).getIntValue();
    }

    /**
     * Reads the value at the given key as a flag.
     *
     * <p>
     * Only {@code true} (any case, surrounding whitespace ignored) is {@code true}; everything
     * else, including an absent key, is {@code false}.
     * </p>
     *
     * @param sectionKey key or path relative to this section
     * @return flag value
     */
    public boolean getBoolean(String sectionKey) {
        return Boolean.parseBoolean(StringUtils.trim(getString(sectionKey)));
    }

    @Override
    public String toString() {
        return "ConfigurationSection[" + path + "]";
    }

    private ConfigurationSection child(String childKey) {
        Object childNode = null;
        if (node instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) node).entrySet()) {
                if (childKey.equalsIgnoreCase(String.valueOf(entry.getKey()))) {
                    childNode = entry.getValue();
                    break;
                }
            }
        } else if (node instanceof List) {
            Integer index = Ints.tryParse(childKey);
            List<?> items = (List<?>) node;
            if (index != null && index >= 0 && index < items.size()) {
                childNode = items.get(index);
            }
        }
        return new ConfigurationSection(childKey, childPath(childKey), childNode);
    }

    private String childPath(String childKey) {
        return path.isEmpty() ? childKey : path + KEY_DELIMITER + childKey;
    }
}
