package io.txnbox.core.config;

import io.txnbox.core.directive.CfgInfo;
import io.txnbox.core.directive.Directive;
import io.txnbox.core.directive.DirectiveList;
import io.txnbox.core.directive.DirectiveType;
import io.txnbox.core.directive.NilDirective;
import io.txnbox.core.directive.When;
import io.txnbox.core.error.ConfigException;
import io.txnbox.core.error.ConfigStructureException;
import io.txnbox.core.error.HookPolicyException;
import io.txnbox.core.error.UnknownNameException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

/** Resolves directive nodes against the directive factory of one {@link Config}. */
final class DirectiveCompiler {

    private final Config cfg;

    DirectiveCompiler(Config cfg) {
        this.cfg = cfg;
    }

    Directive loadDirective(MappingNode drtvNode) {
        for (NodeTuple entry : drtvNode.getValue()) {
            if (!(entry.getKeyNode() instanceof ScalarNode keyNode)) {
                continue;
            }
            YamlNodes.KeyArg key = YamlNodes.parseArg(keyNode.getValue());
            if (When.DO_KEY.equals(key.name())) {
                continue;
            }
            DirectiveType type = cfg.registry().directives().find(key.name());
            if (type == null) {
                continue;
            }

            if (!type.hooks().allows(cfg.currentHook())) {
                throw new HookPolicyException(String.format(
                        "Directive \"%s\" at %s is not allowed on hook \"%s\".",
                        type.name(),
                        YamlNodes.mark(drtvNode),
                        cfg.currentHook()));
            }

            CfgInfo info = cfg.info(type);
            cfg.noteUse(info);
            Directive directive;
            try (ParseState.Scope scope = cfg.state().withDirective(info)) {
                directive = type.loader().load(
                        cfg, drtvNode, key.name(), cfg.localize(key.arg()), entry.getValueNode());
            } catch (ConfigException e) {
                e.addContext("While parsing directive at %s.", YamlNodes.mark(drtvNode));
                throw e;
            }
            if (directive == null) {
                throw new IllegalStateException("Loader for directive '" + type.name() + "' returned null");
            }
            directive.bind(info);
            return directive;
        }
        throw new UnknownNameException(
                String.format("Directive at %s has no recognized tag.", YamlNodes.mark(drtvNode)));
    }

    Directive parseDirective(Node node) {
        if (YamlNodes.isNull(node)) {
            return new NilDirective();
        }
        if (node instanceof MappingNode map) {
            return loadDirective(map);
        }
        if (node instanceof SequenceNode seq) {
            DirectiveList list = new DirectiveList();
            for (Node child : seq.getValue()) {
                if (!(child instanceof MappingNode childMap)) {
                    throw new ConfigStructureException(String.format(
                                    "Directive at %s is not an object as required.", YamlNodes.mark(child)))
                            .addContext("While loading directives at %s.", YamlNodes.mark(seq));
                }
                try {
                    list.add(loadDirective(childMap));
                } catch (ConfigException e) {
                    e.addContext("While loading directives at %s.", YamlNodes.mark(seq));
                    throw e;
                }
            }
            return list;
        }
        throw new ConfigStructureException(String.format(
                "Directive at %s is not an object or a sequence as required.", YamlNodes.mark(node)));
    }
}
