package io.txnbox.core.registry;

import io.txnbox.core.spi.Extractor;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of extractors by name. Read-only once sealed.
 *
 * <p>Thread-safe.
 */
public final class ExtractorRegistry {

    private final Map<String, Extractor> extractors = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    /**
     * Registers an extractor under {@link Extractor#name()}.
     *
     * @throws NullPointerException     if extractor is null
     * @throws IllegalArgumentException if the name is null, empty or already registered
     * @throws IllegalStateException    if the registry is sealed
     */
    public void register(Extractor extractor) {
        if (extractor == null) {
            throw new NullPointerException("extractor must not be null");
        }
        String name = extractor.name();
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("extractor name must not be null or empty");
        }
        if (sealed) {
            throw new IllegalStateException("Cannot register extractor '" + name + "' after configurations have been compiled");
        }
        if (extractors.putIfAbsent(name, extractor) != null) {
            throw new IllegalArgumentException("Extractor '" + name + "' is already registered");
        }
    }

    /** Looks up an extractor, returning {@code null} if there is none. */
    public Extractor find(String name) {
        return extractors.get(name);
    }

    public boolean hasExtractor(String name) {
        return extractors.containsKey(name);
    }

    public int size() {
        return extractors.size();
    }

    void seal() {
        sealed = true;
    }
}
