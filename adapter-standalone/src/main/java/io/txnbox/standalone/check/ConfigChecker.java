package io.txnbox.standalone.check;

import io.txnbox.core.builtin.Builtins;
import io.txnbox.core.config.Config;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.diag.TreeDumper;
import io.txnbox.core.error.ConfigException;
import io.txnbox.core.error.ConfigLoadException;
import io.txnbox.core.model.Hook;
import io.txnbox.core.registry.Registry;
import io.txnbox.standalone.config.CheckerSettings;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.nodes.Node;

/**
 * Compiles one configuration file the way the proxy would and reports the
 * outcome.
 *
 * <p>
 * Each run builds its own {@link Registry}, so runs are independent.
 */
public final class ConfigChecker {

    /** The configuration compiled. */
    public static final int EXIT_OK = 0;

    /** The configuration has errors; every diagnostic was logged. */
    public static final int EXIT_INVALID = 1;

    /** The checker was used incorrectly. */
    public static final int EXIT_USAGE = 2;

    private static final Logger LOG = LoggerFactory.getLogger(ConfigChecker.class);

    private final PrintStream out;
    private final Function<String, String> envLookup;

    /**
     * @param out where the summary and the tree dump are written
     */
    public ConfigChecker(PrintStream out) {
        this(out, System::getenv);
    }

    /**
     * @param out       where the summary and the tree dump are written
     * @param envLookup environment seen by {@code env<NAME>} in the configuration
     */
    public ConfigChecker(PrintStream out, Function<String, String> envLookup) {
        this.out = out;
        this.envLookup = envLookup;
    }

    /**
     * Checks the configuration named by {@code settings}.
     *
     * @return {@link #EXIT_OK}, {@link #EXIT_INVALID} or {@link #EXIT_USAGE}
     */
    public int run(CheckerSettings settings) {
        Path path = Path.of(settings.configFile());
        if (!Files.isRegularFile(path)) {
            LOG.error("Configuration file not found: {}", path);
            return EXIT_USAGE;
        }

        Registry registry = Builtins.install(Registry.create(), envLookup);
        Hook hook = settings.remap() ? Hook.REMAP : Hook.INVALID;
        try (Config cfg = new Config(registry)) {
            Node root = YamlNodes.load(path);
            cfg.parseYaml(root, settings.keyPath(), hook);
            printSummary(path, cfg);
            if (settings.dump()) {
                out.println(TreeDumper.dump(cfg));
            }
            return EXIT_OK;
        } catch (ConfigLoadException e) {
            LOG.error("{} has {} error(s):", path, e.problems().size());
            for (ConfigException problem : e.problems()) {
                LOG.error("{}", problem.getMessage());
            }
            e.context().forEach(frame -> LOG.error("  {}", frame));
            return EXIT_INVALID;
        } catch (ConfigException e) {
            LOG.error("{} has 1 error(s):", path);
            LOG.error("{}", e.getMessage());
            return EXIT_INVALID;
        } catch (UncheckedIOException e) {
            LOG.error("Failed to read {}: {}", path, e.getMessage());
            return EXIT_USAGE;
        }
    }

    private void printSummary(Path path, Config cfg) {
        out.println(path + ": OK");
        for (Hook hook : cfg.hooks()) {
            out.println("  " + hook + ": " + cfg.roots(hook).size() + " directive(s)");
        }
        out.println("  stage callbacks needed: " + (cfg.hasTopLevelDirective() ? "yes" : "no"));
    }
}
