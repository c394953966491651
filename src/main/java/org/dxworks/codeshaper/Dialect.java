package org.dxworks.codeshaper;

import java.util.List;

/**
 * Source dialect hint. Each dialect lists the grammars tried in order; the first one that
 * parses the file without syntax errors is used.
 */
public enum Dialect {
    JAVASCRIPT("javascript", List.of(Grammar.JAVASCRIPT, Grammar.TYPESCRIPT)),
    TYPESCRIPT("typescript", List.of(Grammar.TYPESCRIPT, Grammar.JAVASCRIPT)),
    AUTO("auto", List.of(Grammar.TYPESCRIPT, Grammar.JAVASCRIPT));

    private final String name;
    private final List<Grammar> candidates;

    Dialect(String name, List<Grammar> candidates) {
        this.name = name;
        this.candidates = candidates;
    }

    public String getName() {
        return name;
    }

    public List<Grammar> getCandidates() {
        return candidates;
    }

    /**
     * The JavaScript grammar understands JSX; the TypeScript grammar does not.
     */
    public enum Grammar {
        JAVASCRIPT,
        TYPESCRIPT
    }
}
