package io.txnbox.standalone.check;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.txnbox.standalone.config.CheckerSettings;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

@DisplayName("Configuration checker")
class ConfigCheckerTest {

    private static final String RULES = """
            meta:
              txn_box:
                global:
                - when: ua-req
                  do:
                  - ua-req-field<X-Stage>: "{env<STAGE>}"
                - when: post-load
                  do: ~
                remap:
                - with: pre-remap-path
                  select:
                  - prefix: "old/"
                    do:
                    - redirect: "http://new.ex/{0}"
                broken:
                - when: ua-req
                  do:
                  - proxy-req-field<X>: "x"
                - when: no-such-hook
                  do: ~
                scalar: "not directives"
            """;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private ListAppender<ILoggingEvent> logAppender;
    private Logger checkerLogger;
    private ConfigChecker checker;

    @TempDir
    Path tempDir;

    private Path configFile;

    @BeforeEach
    void setUp() throws Exception {
        configFile = tempDir.resolve("txn_box.yaml");
        Files.writeString(configFile, RULES);
        checker = new ConfigChecker(new PrintStream(stdout, true, StandardCharsets.UTF_8), Map.of("STAGE", "blue")::get);

        checkerLogger = (Logger) LoggerFactory.getLogger(ConfigChecker.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        checkerLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        checkerLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private CheckerSettings.Builder settings(String key) {
        return CheckerSettings.builder().configFile(configFile.toString()).keyPath(key);
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private long errors() {
        return logAppender.list.stream().filter(e -> e.getLevel() == Level.ERROR).count();
    }

    @Test
    @DisplayName("a valid configuration prints a summary")
    void validConfiguration() {
        int status = checker.run(settings("meta.txn_box.global").build());

        assertThat(status).isEqualTo(ConfigChecker.EXIT_OK);
        assertThat(output().lines()).containsExactly(
                configFile + ": OK",
                "  post-load: 1 directive(s)",
                "  ua-req: 1 directive(s)",
                "  stage callbacks needed: yes");
        assertThat(errors()).isZero();
    }

    @Test
    @DisplayName("remap rules are checked on the remap hook")
    void remapRule() {
        int status = checker.run(settings("meta.txn_box.remap").remap(true).build());

        assertThat(status).isEqualTo(ConfigChecker.EXIT_OK);
        assertThat(output()).contains("  remap: 1 directive(s)").contains("stage callbacks needed: yes");
    }

    @Test
    @DisplayName("remap rules fail outside the remap hook")
    void remapRuleAsGlobal() {
        int status = checker.run(settings("meta.txn_box.remap").build());

        assertThat(status).isEqualTo(ConfigChecker.EXIT_INVALID);
        assertThat(output()).isEmpty();
    }

    @Test
    @DisplayName("every error of a list is logged")
    void invalidConfiguration() {
        int status = checker.run(settings("meta.txn_box.broken").build());

        assertThat(status).isEqualTo(ConfigChecker.EXIT_INVALID);
        assertThat(logAppender.list.get(0).getFormattedMessage()).isEqualTo(configFile + " has 2 error(s):");
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(m -> m.startsWith("Directive \"proxy-req-field\" at line 18 is not allowed on hook \"ua-req\"."))
                .anyMatch(m -> m.startsWith("Invalid hook name \"no-such-hook\""));
        assertThat(output()).isEmpty();
    }

    @Test
    void singleFailure() {
        int status = checker.run(settings("meta.txn_box.scalar").build());

        assertThat(status).isEqualTo(ConfigChecker.EXIT_INVALID);
        assertThat(logAppender.list.get(0).getFormattedMessage()).isEqualTo(configFile + " has 1 error(s):");
    }

    @Test
    void missingKey() {
        int status = checker.run(settings("meta.txn_box.nope").build());

        assertThat(status).isEqualTo(ConfigChecker.EXIT_INVALID);
        assertThat(logAppender.list).extracting(ILoggingEvent::getFormattedMessage)
                .contains("Key \"meta.txn_box.nope\" not found - no such key \"nope\".");
    }

    @Test
    void missingFile() {
        int status = checker.run(CheckerSettings.builder()
                .configFile(tempDir.resolve("absent.yaml").toString())
                .build());

        assertThat(status).isEqualTo(ConfigChecker.EXIT_USAGE);
        assertThat(errors()).isEqualTo(1);
    }

    @Test
    void invalidYaml() throws Exception {
        Files.writeString(configFile, "meta: [unclosed\n");

        int status = checker.run(settings(".").build());

        assertThat(status).isEqualTo(ConfigChecker.EXIT_INVALID);
        assertThat(logAppender.list).extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(m -> m.startsWith("Invalid YAML in "));
    }

    @Test
    @DisplayName("--dump prints the compiled tree as JSON")
    void dump() throws Exception {
        int status = checker.run(settings("meta.txn_box.global").dump(true).build());

        assertThat(status).isEqualTo(ConfigChecker.EXIT_OK);
        String text = output();
        JsonNode tree = new ObjectMapper().readTree(text.substring(text.indexOf('{')));
        assertThat(tree.get("hasTopLevelDirective").asBoolean()).isTrue();
        assertThat(tree.at("/hooks/ua-req/0/children/0/expressions/value/shape").asText())
                .isEqualTo("constant(\"blue\")");
    }
}
