package io.txnbox.core.error;

import java.util.List;

/**
 * Aggregate failure for a list of top-level directives. Every defective entry contributes one
 * problem, so a single load reports every defect of the list.
 */
public final class ConfigLoadException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final List<ConfigException> problems;

    public ConfigLoadException(String message, List<ConfigException> problems) {
        super(message, Category.AGGREGATE);
        if (problems.isEmpty()) {
            throw new IllegalArgumentException("an aggregate failure needs at least one problem");
        }
        this.problems = List.copyOf(problems);
        problems.forEach(this::addSuppressed);
    }

    /** The individual failures, in configuration order. */
    public List<ConfigException> problems() {
        return problems;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        for (ConfigException problem : problems) {
            sb.append(System.lineSeparator()).append("- ").append(problem.getMessage().replace("\n", "\n  "));
        }
        return sb.toString();
    }
}
