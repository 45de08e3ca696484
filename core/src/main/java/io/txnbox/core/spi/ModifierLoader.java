package io.txnbox.core.spi;

import io.txnbox.core.config.Config;
import io.txnbox.core.model.ActiveType;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;

/** Loads one modifier type from its YAML map. */
@FunctionalInterface
public interface ModifierLoader {

    /**
     * @param cfg       the compiler instance
     * @param node      the whole modifier map
     * @param key       the modifier name, argument stripped
     * @param arg       the bracketed argument, or {@code null}
     * @param value     the value of the modifier key
     * @param inputType type of the value the modifier will receive
     * @return the loaded modifier
     * @throws io.txnbox.core.error.TypeCheckException if the modifier cannot accept {@code inputType}
     */
    Modifier load(Config cfg, MappingNode node, String key, CharSequence arg, Node value, ActiveType inputType);
}
