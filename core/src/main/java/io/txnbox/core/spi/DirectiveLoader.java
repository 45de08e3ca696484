package io.txnbox.core.spi;

import io.txnbox.core.config.Config;
import io.txnbox.core.directive.Directive;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;

/** Builds a directive instance from its YAML map. */
@FunctionalInterface
public interface DirectiveLoader {

    /**
     * @param cfg      the compiler instance
     * @param drtvNode the whole directive map, including unrelated keys
     * @param name     the directive key, argument stripped
     * @param arg      the bracketed argument, or {@code null}
     * @param keyValue the value of the directive key
     * @return the directive instance
     * @throws io.txnbox.core.error.ConfigException if the directive is not valid
     */
    Directive load(Config cfg, MappingNode drtvNode, String name, CharSequence arg, Node keyValue);
}
