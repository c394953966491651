package org.dxworks.codeshaper.parser;

import org.dxworks.codeshaper.Deadline;
import org.dxworks.codeshaper.Dialect;
import org.dxworks.codeshaper.model.ProgramSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTypescript;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

import static org.dxworks.codeshaper.parser.TreeSitterHelper.isPresent;
import static org.dxworks.codeshaper.parser.TreeSitterHelper.normalizeInline;

/**
 * Parses JavaScript/TypeScript sources with tree-sitter and builds program summaries.
 * A source that contains any syntax error is rejected; no partial summary is produced.
 */
public class StructuralParser {

    private static final Logger log = LoggerFactory.getLogger(StructuralParser.class);

    private static final Map<Dialect.Grammar, TSLanguage> TREE_SITTER_LANGUAGES = new EnumMap<>(Dialect.Grammar.class);
    private static final int EXCERPT_LENGTH = 40;

    static {
        TREE_SITTER_LANGUAGES.put(Dialect.Grammar.JAVASCRIPT, new TreeSitterJavascript());
        TREE_SITTER_LANGUAGES.put(Dialect.Grammar.TYPESCRIPT, new TreeSitterTypescript());
    }

    private final DeclarationScope declarationScope;

    public StructuralParser() {
        this(DeclarationScope.MODULE);
    }

    public StructuralParser(DeclarationScope declarationScope) {
        this.declarationScope = declarationScope;
    }

    public ProgramSummary parse(String sourceCode) {
        return parse(sourceCode, Dialect.AUTO, Deadline.none());
    }

    public ProgramSummary parse(String sourceCode, Dialect dialect, Deadline deadline) {
        return summarize(parseTree(sourceCode, dialect), deadline);
    }

    public ProgramSummary summarize(ParsedSource parsed, Deadline deadline) {
        return new SummaryCollector(parsed.getSource(), declarationScope, deadline).collect(parsed.getRootNode());
    }

    /**
     * Parses with the grammars of the dialect in order and returns the first error-free tree.
     */
    public ParsedSource parseTree(String sourceCode, Dialect dialect) {
        Dialect effective = dialect != null ? dialect : Dialect.AUTO;
        SourceText source = new SourceText(sourceCode);
        ParseException firstFailure = null;

        for (Dialect.Grammar grammar : effective.getCandidates()) {
            TSLanguage language = TREE_SITTER_LANGUAGES.get(grammar);
            TSParser parser = new TSParser();
            parser.setLanguage(language);
            TSTree tree = parser.parseString(null, sourceCode);
            if (tree == null) {
                throw new ParseException("Parser produced no tree for " + effective.getName() + " source", 0, 0);
            }
            TSNode rootNode = tree.getRootNode();
            if (!rootNode.hasError()) {
                log.debug("Parsed {} bytes as {}", source.length(), grammar);
                return new ParsedSource(source, tree, effective, grammar);
            }
            ParseException failure = diagnose(source, rootNode, grammar);
            log.debug("Grammar {} rejected source: {}", grammar, failure.getMessage());
            if (firstFailure == null) {
                firstFailure = failure;
            }
        }

        throw firstFailure;
    }

    private ParseException diagnose(SourceText source, TSNode rootNode, Dialect.Grammar grammar) {
        TSNode offending = findFirstProblem(rootNode);
        if (offending == null) {
            return new ParseException("Syntax error (" + grammar.name().toLowerCase() + ")", 0, 0);
        }
        int offset = offending.getStartByte();
        int line = source.lineOf(offset);
        int column = source.columnOf(offset);
        String message;
        if (offending.isMissing()) {
            message = "Missing '" + offending.getType() + "' at line " + line + ", column " + column;
        } else {
            String excerpt = normalizeInline(source.text(offending));
            if (excerpt.length() > EXCERPT_LENGTH) {
                excerpt = excerpt.substring(0, EXCERPT_LENGTH) + "...";
            }
            message = "Unexpected '" + excerpt + "' at line " + line + ", column " + column;
        }
        return new ParseException(message, line, column);
    }

    private static TSNode findFirstProblem(TSNode root) {
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (!isPresent(node)) continue;
            if ("ERROR".equals(node.getType()) || node.isMissing()) {
                return node;
            }
            if (!node.hasError()) continue;
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                stack.push(node.getChild(i));
            }
        }
        return null;
    }
}
