package io.txnbox.core.config;

import static io.txnbox.core.testkit.Fixtures.yaml;
import static org.assertj.core.api.Assertions.assertThat;

import io.txnbox.core.diag.TreeDumper;
import io.txnbox.core.model.Hook;
import io.txnbox.core.registry.Registry;
import io.txnbox.core.testkit.Fixtures;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Independent configurations over one sealed registry compile in parallel. */
@DisplayName("Concurrent compilation")
class ConcurrentCompileTest {

    private static final String RULES = """
            - when: ua-req
              do:
              - with: ua-req-path
                select:
                - rxp: "^v(\\\\d+)/(.*)$"
                  do:
                  - ua-req-field<X-Version>: "{1}"
                  - redirect: "http://{ua-req-host}/{2}"
                - prefix: "static/"
                  do:
                    proxy-reply: 404
            - when: proxy-req
              do:
              - proxy-req-field<X-Home>: "{env<HOME_HOST>}"
            """;

    @Test
    void sharedRegistryCompilesInParallel() throws Exception {
        Registry registry = Fixtures.registry();
        registry.seal();
        String expected;
        try (Config reference = new Config(registry)) {
            expected = TreeDumper.dump(reference.parseYaml(yaml(RULES), Config.ROOT_PATH, Hook.INVALID));
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> jobs = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                jobs.add(() -> {
                    try (Config cfg = new Config(registry)) {
                        return TreeDumper.dump(cfg.parseYaml(yaml(RULES), Config.ROOT_PATH, Hook.INVALID));
                    }
                });
            }
            for (Future<String> result : pool.invokeAll(jobs)) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
