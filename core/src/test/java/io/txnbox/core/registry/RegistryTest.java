package io.txnbox.core.registry;

import static io.txnbox.core.testkit.Fixtures.yaml;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.txnbox.core.config.Config;
import io.txnbox.core.directive.DirectiveType;
import io.txnbox.core.directive.NilDirective;
import io.txnbox.core.error.ConfigStructureException;
import io.txnbox.core.error.UnknownNameException;
import io.txnbox.core.expr.ExtractorSpec;
import io.txnbox.core.model.ActiveType;
import io.txnbox.core.model.Hook;
import io.txnbox.core.model.HookMask;
import io.txnbox.core.model.ValueType;
import io.txnbox.core.spi.DirectiveLoader;
import io.txnbox.core.spi.Extractor;
import io.txnbox.core.spi.Modifier;
import io.txnbox.core.spi.ModifierLoader;
import io.txnbox.core.spi.TypeInitializer;
import io.txnbox.core.testkit.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Registry")
class RegistryTest {

    private static final DirectiveLoader NIL_LOADER = (cfg, node, name, arg, value) -> new NilDirective();

    private Registry registry;

    @BeforeEach
    void setUp() {
        registry = Registry.create();
    }

    private static Extractor extractor(String name) {
        return new Extractor() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ActiveType validate(Config cfg, ExtractorSpec spec, CharSequence arg) {
                return ActiveType.of(ValueType.STRING);
            }
        };
    }

    private static ModifierLoader modifier(String name) {
        Modifier mod = new Modifier() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ActiveType resultType(ActiveType input) {
                return input;
            }
        };
        return (cfg, node, key, arg, value, input) -> mod;
    }

    @Nested
    @DisplayName("directives")
    class Directives {

        @Test
        void createHasOnlyWhen() {
            assertThat(registry.directives().size()).isEqualTo(1);
            assertThat(registry.directives().find("when")).isNotNull();
            assertThat(registry.directives().find("when").index()).isZero();
        }

        @Test
        void indicesAreSequential() {
            DirectiveType a = registry.directives().define("a", HookMask.all(), NIL_LOADER, TypeInitializer.NONE);
            DirectiveType b = registry.directives().define("b", HookMask.of(Hook.PREQ), NIL_LOADER, TypeInitializer.NONE);

            assertThat(a.index()).isEqualTo(1);
            assertThat(b.index()).isEqualTo(2);
            assertThat(registry.directives().types()).extracting(DirectiveType::name).containsExactly("when", "a", "b");
        }

        @Test
        void duplicateNameIsRejected() {
            registry.directives().define("a", HookMask.all(), NIL_LOADER, TypeInitializer.NONE);

            assertThatThrownBy(() -> registry.directives().define("a", HookMask.all(), NIL_LOADER, TypeInitializer.NONE))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Directive 'a' is already defined");
            assertThat(registry.directives().size()).isEqualTo(2);
        }

        @Test
        void emptyNameIsRejected() {
            assertThatThrownBy(() -> registry.directives().define("", HookMask.all(), NIL_LOADER, TypeInitializer.NONE))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void nullLoaderIsRejected() {
            assertThatThrownBy(() -> registry.directives().define("a", HookMask.all(), null, TypeInitializer.NONE))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        void unknownNameIsNull() {
            assertThat(registry.directives().find("nope")).isNull();
        }
    }

    @Nested
    @DisplayName("sealing")
    class Sealing {

        @Test
        void firstConfigSeals() {
            new Config(registry).close();

            assertThat(registry.isSealed()).isTrue();
            assertThatThrownBy(() -> registry.directives().define("late", HookMask.all(), NIL_LOADER, TypeInitializer.NONE))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("after configurations have been compiled");
            assertThatThrownBy(() -> registry.extractors().register(extractor("late")))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> registry.modifiers().define("late", modifier("late")))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void sealIsIdempotent() {
            registry.seal();
            registry.seal();

            assertThat(registry.isSealed()).isTrue();
            assertThat(registry.directives().find("when")).isNotNull();
        }
    }

    @Nested
    @DisplayName("extractors and modifiers")
    class Named {

        @Test
        void duplicateExtractorIsRejected() {
            registry.extractors().register(extractor("x"));

            assertThatThrownBy(() -> registry.extractors().register(extractor("x")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Extractor 'x' is already registered");
            assertThat(registry.extractors().hasExtractor("x")).isTrue();
            assertThat(registry.extractors().size()).isEqualTo(1);
        }

        @Test
        void duplicateModifierIsRejected() {
            registry.modifiers().define("m", modifier("m"));

            assertThatThrownBy(() -> registry.modifiers().define("m", modifier("m")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Modifier 'm' is already defined");
            assertThat(registry.modifiers().hasModifier("m")).isTrue();
        }

        @Test
        void builtinsRegisterEverything() {
            Registry full = Fixtures.registry();

            assertThat(full.directives().find("with")).isNotNull();
            assertThat(full.directives().find("redirect")).isNotNull();
            assertThat(full.extractors().hasExtractor("env")).isTrue();
            assertThat(full.extractors().hasExtractor("ua-req-field")).isTrue();
            assertThat(full.modifiers().hasModifier("else")).isTrue();
            assertThat(full.modifiers().hasModifier("as-integer")).isTrue();
        }

        @Test
        void modifierNodeMustBeAMap() {
            Registry full = Fixtures.registry();
            try (Config cfg = new Config(full)) {
                assertThatThrownBy(() -> full.modifiers().load(cfg, yaml("- a\n"), ActiveType.of(ValueType.STRING)))
                        .isInstanceOf(ConfigStructureException.class)
                        .hasMessageContaining("is not an object with a single key");
            }
        }

        @Test
        void unknownModifierIsNamed() {
            Registry full = Fixtures.registry();
            try (Config cfg = new Config(full)) {
                assertThatThrownBy(() -> full.modifiers().load(cfg, yaml("shout: ~\n"), ActiveType.of(ValueType.STRING)))
                        .isInstanceOf(UnknownNameException.class)
                        .hasMessage("Modifier \"shout\" at line 1 is not recognized.");
            }
        }
    }
}
