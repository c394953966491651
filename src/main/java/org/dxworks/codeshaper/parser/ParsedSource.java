package org.dxworks.codeshaper.parser;

import org.dxworks.codeshaper.Dialect;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A syntax tree together with the text it was parsed from. The tree is kept referenced
 * because its nodes point into memory owned by it.
 */
public final class ParsedSource {

    private final SourceText source;
    private final TSTree tree;
    private final Dialect dialect;
    private final Dialect.Grammar grammar;

    ParsedSource(SourceText source, TSTree tree, Dialect dialect, Dialect.Grammar grammar) {
        this.source = source;
        this.tree = tree;
        this.dialect = dialect;
        this.grammar = grammar;
    }

    public SourceText getSource() {
        return source;
    }

    public String getText() {
        return source.getText();
    }

    public TSNode getRootNode() {
        return tree.getRootNode();
    }

    public Dialect getDialect() {
        return dialect;
    }

    public Dialect.Grammar getGrammar() {
        return grammar;
    }
}
