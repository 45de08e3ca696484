package io.txnbox.core.builtin;

import io.txnbox.core.model.ActiveType;
import io.txnbox.core.model.ValueType;
import io.txnbox.core.registry.ExtractorRegistry;
import io.txnbox.core.registry.Registry;
import java.util.function.Function;

/** Installs the built-in directives, extractors and modifiers into a {@link Registry}. */
public final class Builtins {

    private static final ActiveType STRING = ActiveType.of(ValueType.STRING);
    private static final ActiveType INTEGER = ActiveType.of(ValueType.INTEGER);

    private Builtins() {}

    /** Installs everything, reading {@code env<NAME>} from the process environment. */
    public static Registry install(Registry registry) {
        return install(registry, System::getenv);
    }

    /**
     * Installs everything.
     *
     * @param envLookup environment lookup used by {@code env<NAME>}
     * @throws IllegalStateException if the registry is already sealed
     */
    public static Registry install(Registry registry, Function<String, String> envLookup) {
        WithDirective.define(registry.directives());
        FieldDirective.define(registry.directives());
        ProxyReplyDirective.define(registry.directives());
        RedirectDirective.define(registry.directives());

        ExtractorRegistry extractors = registry.extractors();
        extractors.register(ContextExtractor.plain("ua-req-method", STRING));
        extractors.register(ContextExtractor.plain("ua-req-host", STRING));
        extractors.register(ContextExtractor.plain("ua-req-path", STRING));
        extractors.register(ContextExtractor.plain("ua-req-query", STRING));
        extractors.register(ContextExtractor.plain("ua-req-url", STRING));
        extractors.register(ContextExtractor.plain("pre-remap-path", STRING));
        extractors.register(ContextExtractor.plain("pre-remap-query", STRING));
        extractors.register(ContextExtractor.plain("proxy-req-host", STRING));
        extractors.register(ContextExtractor.plain("proxy-req-path", STRING));
        extractors.register(ContextExtractor.plain("proxy-rsp-status", INTEGER));
        extractors.register(ContextExtractor.plain("upstream-rsp-status", INTEGER));
        extractors.register(ContextExtractor.plain("proxy-rsp-reason", STRING));
        extractors.register(ContextExtractor.plain("inbound-addr-remote", ActiveType.of(ValueType.IP_ADDR)));

        // A missing field is nil.
        ActiveType field = ActiveType.of(ValueType.STRING, ValueType.NIL);
        extractors.register(ContextExtractor.withArg("ua-req-field", field));
        extractors.register(ContextExtractor.withArg("proxy-req-field", field));
        extractors.register(ContextExtractor.withArg("upstream-rsp-field", field));
        extractors.register(ContextExtractor.withArg("proxy-rsp-field", field));
        extractors.register(new EnvExtractor(envLookup));

        ElseModifier.define(registry.modifiers());
        UrlCodecModifier.define(registry.modifiers());
        AsIntegerModifier.define(registry.modifiers());
        return registry;
    }
}
