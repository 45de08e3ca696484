package io.txnbox.core.config;

import io.txnbox.core.error.ConfigSyntaxException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;

/**
 * Helpers over SnakeYAML's node graph: composing documents, rendering marks, reading tags and
 * quoting style, and splitting {@code name<arg>} keys.
 *
 * <p>Thread-safe and stateless.
 */
public final class YamlNodes {

    /** Opens an argument in a key or extractor name. */
    public static final char ARG_PREFIX = '<';

    /** Closes an argument in a key or extractor name. */
    public static final char ARG_SUFFIX = '>';

    /**
     * A key split into name and optional argument.
     *
     * @param name the name
     * @param arg  the argument, or {@code null} if the key had none
     */
    public record KeyArg(String name, String arg) {}

    private YamlNodes() {}

    /**
     * Composes a single YAML document into a node graph.
     *
     * @return the root node, or {@code null} for an empty document
     * @throws ConfigSyntaxException if the text is not valid YAML
     */
    public static Node compose(String text) {
        return compose(new StringReader(text), "<string>");
    }

    /**
     * Reads and composes the YAML file at {@code path}.
     *
     * @throws ConfigSyntaxException if the file is not valid YAML
     * @throws UncheckedIOException  if the file cannot be read
     */
    public static Node load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return compose(reader, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration file " + path, e);
        }
    }

    private static Node compose(Reader reader, String source) {
        try {
            return new Yaml(new LoaderOptions()).compose(reader);
        } catch (YAMLException e) {
            throw new ConfigSyntaxException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /** Renders the start of {@code node} for diagnostics, e.g. {@code line 12}. */
    public static String mark(Node node) {
        int line = line(node);
        return line > 0 ? "line " + line : "<unknown position>";
    }

    /** 1-based start line of {@code node}, or 0 if unknown. */
    public static int line(Node node) {
        if (node == null) {
            return 0;
        }
        Mark mark = node.getStartMark();
        return mark == null ? 0 : mark.getLine() + 1;
    }

    /** {@code true} for a missing node or an explicit YAML null. */
    public static boolean isNull(Node node) {
        return node == null || (node instanceof ScalarNode && Tag.NULL.equals(node.getTag()));
    }

    /** {@code true} for a scalar written without quotes (the {@code ?} tag). */
    public static boolean isPlain(ScalarNode node) {
        return node.getScalarStyle() == DumperOptions.ScalarStyle.PLAIN;
    }

    /**
     * The explicit local tag of {@code node}, e.g. {@code !literal}, or {@code null} if the node
     * carries only a standard (resolved or {@code !!} style) tag.
     */
    public static String explicitTag(Node node) {
        Tag tag = node.getTag();
        if (tag == null) {
            return null;
        }
        String value = tag.getValue();
        return value.startsWith(Tag.PREFIX) ? null : value;
    }

    /** Value of the first entry with scalar key {@code key}, or {@code null}. */
    public static Node get(MappingNode map, String key) {
        for (NodeTuple entry : map.getValue()) {
            if (entry.getKeyNode() instanceof ScalarNode k && key.equals(k.getValue())) {
                return entry.getValueNode();
            }
        }
        return null;
    }

    /** Text of a scalar, or {@code null} for anything else. */
    public static String text(Node node) {
        return node instanceof ScalarNode s && !isNull(node) ? s.getValue() : null;
    }

    /**
     * Splits {@code name<arg>} into name and argument.
     *
     * @throws ConfigSyntaxException if the argument is not terminated by {@code '>'}
     */
    public static KeyArg parseArg(String key) {
        int open = key.indexOf(ARG_PREFIX);
        if (open < 0) {
            return new KeyArg(key, null);
        }
        String name = key.substring(0, open);
        if (key.length() == open + 1 || key.charAt(key.length() - 1) != ARG_SUFFIX) {
            throw new ConfigSyntaxException(String.format(
                    "Argument for \"%s\" is not properly terminated with '%c'.", name, ARG_SUFFIX));
        }
        return new KeyArg(name, key.substring(open + 1, key.length() - 1));
    }
}
