package io.txnbox.core.config;

import io.txnbox.core.arena.Arena;
import io.txnbox.core.arena.ArenaText;
import io.txnbox.core.directive.CfgInfo;
import io.txnbox.core.directive.Directive;
import io.txnbox.core.directive.DirectiveType;
import io.txnbox.core.directive.When;
import io.txnbox.core.error.ConfigException;
import io.txnbox.core.error.ConfigLoadException;
import io.txnbox.core.error.ConfigStructureException;
import io.txnbox.core.error.UnknownNameException;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.model.Feature;
import io.txnbox.core.model.Hook;
import io.txnbox.core.registry.Registry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

/**
 * One compiled configuration. Holds the arena every compiled string lives in, a runtime record per
 * directive type, the root directives attached to each hook, the parse state of the compile pass
 * and the finalizers to run when the configuration is discarded.
 *
 * <p>Typical use:
 *
 * <pre>
 * try (Config cfg = new Config(registry)) {
 *     cfg.parseYaml(YamlNodes.load(path), Config.ROOT_PATH, Hook.INVALID);
 *     List&lt;Directive&gt; creq = cfg.roots(Hook.CREQ);
 * }
 * </pre>
 *
 * <p>Compiling is single-threaded: one instance must not be used by more than one thread while it
 * compiles. Independent instances over the same sealed {@link Registry} may compile concurrently.
 * After compiling, the tree is read-only and may be shared.
 */
public final class Config implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Config.class);

    /** Key path meaning "use the document root". */
    public static final String ROOT_PATH = ".";

    private final Registry registry;
    private final Arena arena = new Arena();
    private final CfgInfo[] drtvInfo;
    private final Map<Hook, List<Directive>> roots = new EnumMap<>(Hook.class);
    private final ParseState state = new ParseState();
    private final List<Runnable> finalizers = new ArrayList<>();
    private final ExprCompiler exprCompiler = new ExprCompiler(this);
    private final DirectiveCompiler directiveCompiler = new DirectiveCompiler(this);
    private boolean hasTopLevelDirective;
    private boolean closed;

    /** Creates an empty configuration and seals {@code registry}. */
    public Config(Registry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        registry.seal();
        List<DirectiveType> types = registry.directives().types();
        this.drtvInfo = new CfgInfo[types.size()];
        for (DirectiveType type : types) {
            drtvInfo[type.index()] = new CfgInfo(type);
        }
    }

    public Registry registry() {
        return registry;
    }

    public Arena arena() {
        return arena;
    }

    /** Mutable context of the compile pass. */
    public ParseState state() {
        return state;
    }

    /** Hook the directives being compiled will run on. */
    public Hook currentHook() {
        return state.hook();
    }

    /** Copies {@code text} into this configuration's arena. {@code null} stays {@code null}. */
    public ArenaText localize(CharSequence text) {
        return text == null ? null : arena.localize(text);
    }

    /** Copies every text held by {@code feature} into the arena. */
    public Feature localize(Feature feature) {
        if (feature instanceof Feature.Text t) {
            return new Feature.Text(localize(t.text()), t.literal());
        }
        if (feature instanceof Feature.ListValue l) {
            List<Feature> items = new ArrayList<>(l.items().size());
            for (Feature item : l.items()) {
                items.add(localize(item));
            }
            return new Feature.ListValue(items);
        }
        return feature;
    }

    /**
     * Compiles a feature expression.
     *
     * @throws ConfigException if the expression is not valid here
     */
    public Expr parseExpr(Node node) {
        return exprCompiler.parseExpr(node);
    }

    /**
     * Compiles a directive, a sequence of directives or a null node.
     *
     * @throws ConfigException if the node is not a valid directive here
     */
    public Directive parseDirective(Node node) {
        return directiveCompiler.parseDirective(node);
    }

    /**
     * Compiles a directive map; the first key naming a directive type selects the type.
     *
     * @throws ConfigException if no key names a type or the directive is not valid here
     */
    public Directive loadDirective(MappingNode node) {
        return directiveCompiler.loadDirective(node);
    }

    /**
     * Compiles the directives under {@code path} in {@code root}.
     *
     * <p>For {@link Hook#REMAP} each top level directive is attached to the remap root list as is.
     * For any other hook each top level directive must be a {@code when} directive; its body is
     * attached to the root list of the hook it names. All top level directives in a sequence are
     * compiled, and every failure is reported in one {@link ConfigLoadException}.
     *
     * @param root the document root
     * @param path dot separated key path, or {@link #ROOT_PATH}
     * @param hook {@link Hook#REMAP} for a remap rule, otherwise the hook active at top level
     * @return this configuration
     * @throws UnknownNameException if a key in {@code path} is missing
     * @throws ConfigException      if compiling fails
     */
    public Config parseYaml(Node root, String path, Hook hook) {
        Objects.requireNonNull(path, "path must not be null");
        Node node = resolvePath(root, path);
        boolean remap = hook == Hook.REMAP;
        int before = rootCount();

        try (ParseState.Scope scope = state.withHook(Objects.requireNonNull(hook, "hook must not be null"))) {
            if (YamlNodes.isNull(node)) {
                LOG.warn("No directives found at key \"{}\"", path);
                return this;
            }
            if (node instanceof SequenceNode seq) {
                List<ConfigException> problems = new ArrayList<>();
                for (Node child : seq.getValue()) {
                    try {
                        loadTopLevel(child, remap);
                    } catch (ConfigException e) {
                        problems.add(e);
                    }
                }
                if (!problems.isEmpty()) {
                    ConfigLoadException failure = new ConfigLoadException(
                            String.format("%d top level directive(s) failed to load.", problems.size()), problems);
                    failure.addContext(
                            "While loading list of top level directives for \"%s\" at %s.", path, YamlNodes.mark(seq));
                    throw failure;
                }
            } else if (node instanceof MappingNode) {
                loadTopLevel(node, remap);
            } else {
                throw new ConfigStructureException(String.format(
                        "Configuration at %s for \"%s\" is not a directive object or a list of them.",
                        YamlNodes.mark(node),
                        path));
            }
        }

        LOG.info("Loaded {} root directive(s) from \"{}\" for hook {}", rootCount() - before, path, hook);
        return this;
    }

    private Node resolvePath(Node root, String path) {
        if (ROOT_PATH.equals(path) || path.isEmpty()) {
            return root;
        }
        Node node = root;
        for (String key : path.split("\\.")) {
            Node next = node instanceof MappingNode map ? YamlNodes.get(map, key) : null;
            if (next == null) {
                throw new UnknownNameException(String.format("Key \"%s\" not found - no such key \"%s\".", path, key));
            }
            node = next;
        }
        return node;
    }

    private void loadTopLevel(Node node, boolean remap) {
        if (remap) {
            loadRemapDirective(node);
        } else {
            loadTopLevelDirective(node);
        }
    }

    /**
     * Loads one top level {@code when} directive and attaches its body to the named hook.
     *
     * @throws ConfigStructureException if the node is not a {@code when} directive map
     */
    void loadTopLevelDirective(Node node) {
        if (!(node instanceof MappingNode map)) {
            throw new ConfigStructureException(
                    String.format("Top level directive at %s is not an object as required.", YamlNodes.mark(node)));
        }
        Node hookValue = YamlNodes.get(map, When.KEY);
        if (hookValue == null) {
            throw new ConfigStructureException(String.format(
                    "Top level directive at %s is not a \"%s\" directive as required.", YamlNodes.mark(node), When.KEY));
        }
        DirectiveType whenType = registry.directives().find(When.KEY);
        CfgInfo info = info(whenType);
        When when;
        try (ParseState.Scope scope = state.withDirective(info)) {
            when = When.load(this, map, When.KEY, null, hookValue);
        } catch (ConfigException e) {
            e.addContext("While loading top level directive at %s.", YamlNodes.mark(node));
            throw e;
        }
        noteUse(info);
        roots.computeIfAbsent(when.hook(), h -> new ArrayList<>()).add(when.directive());
        if (when.hook() != Hook.POST_LOAD) {
            hasTopLevelDirective = true;
        }
    }

    /** Loads one remap directive and attaches it to the remap root list, {@code when} included. */
    void loadRemapDirective(Node node) {
        if (!(node instanceof MappingNode map)) {
            throw new ConfigStructureException(
                    String.format("Configuration at %s is not a directive object as required.", YamlNodes.mark(node)));
        }
        Directive directive = loadDirective(map);
        roots.computeIfAbsent(Hook.REMAP, h -> new ArrayList<>()).add(directive);
        hasTopLevelDirective = true;
    }

    /** Root directives attached to {@code hook}, in load order. */
    public List<Directive> roots(Hook hook) {
        return Collections.unmodifiableList(roots.getOrDefault(hook, List.of()));
    }

    /** Hooks that have at least one root directive. */
    public List<Hook> hooks() {
        return List.copyOf(roots.keySet());
    }

    /**
     * {@code true} if a remap directive was attached or a top level directive was attached to a
     * hook other than post-load; the host needs to subscribe to transaction events only in that case.
     */
    public boolean hasTopLevelDirective() {
        return hasTopLevelDirective;
    }

    /** Runtime record of the directive type named {@code name}, or {@code null} if there is none. */
    public CfgInfo directiveInfo(String name) {
        DirectiveType type = registry.directives().find(name);
        return type == null ? null : info(type);
    }

    CfgInfo info(DirectiveType type) {
        return drtvInfo[type.index()];
    }

    /** Counts a use of a directive type, running its initializer on the first one. */
    void noteUse(CfgInfo info) {
        if (info.recordUse()) {
            LOG.debug("Initializing directive type \"{}\" for configuration", info.type().name());
            try (ParseState.Scope scope = state.withDirective(info)) {
                info.type().typeInit().init(this);
            }
        }
    }

    /** Registers cleanup to run when this configuration is closed. Finalizers run in registration order. */
    public void addFinalizer(Runnable finalizer) {
        Objects.requireNonNull(finalizer, "finalizer must not be null");
        if (closed) {
            throw new IllegalStateException("Config is already closed");
        }
        finalizers.add(finalizer);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Runs the finalizers and releases the arena. Every finalizer runs even if an earlier one
     * fails; the first failure is rethrown with later ones suppressed. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        RuntimeException first = null;
        for (Runnable finalizer : finalizers) {
            try {
                finalizer.run();
            } catch (RuntimeException e) {
                LOG.error("Configuration finalizer failed: {}", e.getMessage(), e);
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        finalizers.clear();
        arena.release();
        if (first != null) {
            throw first;
        }
    }

    private int rootCount() {
        int count = 0;
        for (List<Directive> list : roots.values()) {
            count += list.size();
        }
        return count;
    }
}
