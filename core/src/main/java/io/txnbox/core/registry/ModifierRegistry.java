package io.txnbox.core.registry;

import io.txnbox.core.config.Config;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.error.ConfigStructureException;
import io.txnbox.core.error.UnknownNameException;
import io.txnbox.core.model.ActiveType;
import io.txnbox.core.spi.Modifier;
import io.txnbox.core.spi.ModifierLoader;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;

/**
 * Registry of modifier loaders by key. A modifier is written as a single key map following the
 * base expression, e.g. {@code [ pre-remap-query, { url-encode: } ]}.
 *
 * <p>Thread-safe. Read-only once sealed.
 */
public final class ModifierRegistry {

    private final Map<String, ModifierLoader> loaders = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    /**
     * Defines a modifier.
     *
     * @throws IllegalArgumentException if the name is empty or already defined
     * @throws IllegalStateException    if the registry is sealed
     */
    public void define(String name, ModifierLoader loader) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("modifier name must not be null or empty");
        }
        if (loader == null) {
            throw new NullPointerException("loader must not be null");
        }
        if (sealed) {
            throw new IllegalStateException("Cannot define modifier '" + name + "' after configurations have been compiled");
        }
        if (loaders.putIfAbsent(name, loader) != null) {
            throw new IllegalArgumentException("Modifier '" + name + "' is already defined");
        }
    }

    public boolean hasModifier(String name) {
        return loaders.containsKey(name);
    }

    public int size() {
        return loaders.size();
    }

    /**
     * Loads the modifier described by {@code node} for a value of type {@code inputType}.
     *
     * @throws ConfigStructureException if the node is not a non-empty map
     * @throws UnknownNameException     if the key is not a defined modifier
     */
    public Modifier load(Config cfg, Node node, ActiveType inputType) {
        if (!(node instanceof MappingNode map) || map.getValue().isEmpty()) {
            throw new ConfigStructureException(
                    String.format("Modifier at %s is not an object with a single key as required.", YamlNodes.mark(node)));
        }
        NodeTuple entry = map.getValue().get(0);
        if (!(entry.getKeyNode() instanceof ScalarNode keyNode)) {
            throw new ConfigStructureException(
                    String.format("Modifier key at %s is not a string.", YamlNodes.mark(entry.getKeyNode())));
        }
        YamlNodes.KeyArg key = YamlNodes.parseArg(keyNode.getValue());
        ModifierLoader loader = loaders.get(key.name());
        if (loader == null) {
            throw new UnknownNameException(
                    String.format("Modifier \"%s\" at %s is not recognized.", key.name(), YamlNodes.mark(node)));
        }
        return loader.load(cfg, map, key.name(), key.arg(), entry.getValueNode(), inputType);
    }

    void seal() {
        sealed = true;
    }
}
