package io.txnbox.standalone;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import io.txnbox.standalone.check.ConfigChecker;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class StandaloneMainTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void restoreLogging() {
        LogbackConfigurator.configure("text", "WARN");
    }

    @SuppressWarnings("unchecked")
    private static ConsoleAppender<ILoggingEvent> rootAppender() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return (ConsoleAppender<ILoggingEvent>) context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDERR");
    }

    @Test
    void settingsErrorIsUsageError() {
        assertThat(StandaloneMain.run(new String[] {"--config"})).isEqualTo(ConfigChecker.EXIT_USAGE);
    }

    @Test
    void checksTheNamedFile() throws Exception {
        Path config = tempDir.resolve("txn_box.yaml");
        Files.writeString(config, "- when: proxy-req\n  do:\n  - proxy-req-field<X-Checked>: \"yes\"\n");

        assertThat(StandaloneMain.run(new String[] {"--config", config.toString()})).isEqualTo(ConfigChecker.EXIT_OK);
    }

    @Test
    void invalidFileExitsWithOne() throws Exception {
        Path config = tempDir.resolve("txn_box.yaml");
        Files.writeString(config, "- when: proxy-req\n  do:\n  - ua-req-field<X>: \"no\"\n");

        assertThat(StandaloneMain.run(new String[] {"--config", config.toString()}))
                .isEqualTo(ConfigChecker.EXIT_INVALID);
    }

    @Test
    void jsonLogging() {
        LogbackConfigurator.configure("json", "DEBUG");

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(rootAppender().getEncoder()).isInstanceOf(JsonEncoder.class);
        assertThat(rootAppender().getTarget()).isEqualTo("System.err");
    }

    @Test
    void textLoggingFallsBackToInfo() {
        LogbackConfigurator.configure("text", "chatty");

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
        assertThat(((PatternLayoutEncoder) rootAppender().getEncoder()).getPattern())
                .isEqualTo(LogbackConfigurator.TEXT_PATTERN);
    }
}
