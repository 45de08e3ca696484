package io.txnbox.core.directive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** An ordered list of directives, executed in sequence. */
public final class DirectiveList extends Directive {

    private final List<Directive> directives = new ArrayList<>();

    public void add(Directive directive) {
        directives.add(directive);
    }

    public int size() {
        return directives.size();
    }

    @Override
    public String typeName() {
        return "list";
    }

    @Override
    public List<Directive> children() {
        return Collections.unmodifiableList(directives);
    }
}
