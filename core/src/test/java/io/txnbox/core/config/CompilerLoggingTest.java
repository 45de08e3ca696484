package io.txnbox.core.config;

import static io.txnbox.core.testkit.Fixtures.yaml;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.txnbox.core.model.Hook;
import io.txnbox.core.testkit.Fixtures;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("Compiler logging")
class CompilerLoggingTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger configLogger;
    private Level savedLevel;

    @BeforeEach
    void setUp() {
        configLogger = (Logger) LoggerFactory.getLogger(Config.class);
        savedLevel = configLogger.getLevel();
        configLogger.setLevel(Level.DEBUG);
        logAppender = new ListAppender<>();
        logAppender.start();
        configLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        configLogger.detachAppender(logAppender);
        configLogger.setLevel(savedLevel);
        logAppender.stop();
    }

    private List<ILoggingEvent> at(Level level) {
        return logAppender.list.stream().filter(e -> e.getLevel() == level).toList();
    }

    @Test
    @DisplayName("a successful load is logged at INFO with the root count")
    void loadSummary() {
        try (Config cfg = new Config(Fixtures.registry())) {
            cfg.parseYaml(yaml("""
                    - when: ua-req
                      do: ~
                    - when: proxy-req
                      do: ~
                    """), Config.ROOT_PATH, Hook.INVALID);
        }

        assertThat(at(Level.INFO)).singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .isEqualTo("Loaded 2 root directive(s) from \".\" for hook invalid");
    }

    @Test
    @DisplayName("an empty key is logged at WARN")
    void emptyKeyWarns() {
        try (Config cfg = new Config(Fixtures.registry())) {
            cfg.parseYaml(yaml("txn_box: ~\n"), "txn_box", Hook.INVALID);
        }

        assertThat(at(Level.WARN)).singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .isEqualTo("No directives found at key \"txn_box\"");
        assertThat(at(Level.INFO)).isEmpty();
    }

    @Test
    @DisplayName("the first use of a directive type is logged at DEBUG once")
    void typeInitLoggedOnce() {
        try (Config cfg = new Config(Fixtures.registry())) {
            cfg.parseYaml(yaml("""
                    - with: ua-req-path
                      select:
                      - prefix: "a"
                    - with: ua-req-host
                      select:
                      - suffix: ".ex"
                    """), Config.ROOT_PATH, Hook.REMAP);
        }

        assertThat(at(Level.DEBUG))
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsOnlyOnce("Initializing directive type \"with\" for configuration");
    }

    @Test
    @DisplayName("a failing finalizer is logged at ERROR with its exception")
    void finalizerFailureLogged() {
        Config cfg = new Config(Fixtures.registry());
        cfg.addFinalizer(() -> {
            throw new IllegalStateException("cleanup broke");
        });

        Throwable thrown = catchThrowable(cfg::close);

        assertThat(thrown).hasMessage("cleanup broke");
        assertThat(at(Level.ERROR)).singleElement().satisfies(event -> {
            assertThat(event.getFormattedMessage()).isEqualTo("Configuration finalizer failed: cleanup broke");
            assertThat(event.getThrowableProxy().getMessage()).isEqualTo("cleanup broke");
        });
    }
}
