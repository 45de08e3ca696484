package io.txnbox.standalone;

import io.txnbox.standalone.check.ConfigChecker;
import io.txnbox.standalone.config.CheckerSettings;
import io.txnbox.standalone.config.SettingsLoadException;
import io.txnbox.standalone.config.SettingsLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone configuration checker.
 *
 * <p>
 * Loads the settings, configures logging and delegates to
 * {@link ConfigChecker#run(CheckerSettings)}. The process exit status is
 * the checker's result; settings errors exit with
 * {@link ConfigChecker#EXIT_USAGE}.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g.
     *             {@code --config txn_box.yaml --key meta.txn_box.global})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the checker and returns the exit status. */
    static int run(String[] args) {
        CheckerSettings settings;
        try {
            settings = SettingsLoader.load(args);
        } catch (SettingsLoadException e) {
            LOG.error("Invalid settings: {}", e.getMessage(), e);
            return ConfigChecker.EXIT_USAGE;
        }
        LogbackConfigurator.configure(settings.loggingFormat(), settings.loggingLevel());
        return new ConfigChecker(System.out).run(settings);
    }
}
