package org.dxworks.codeshaper.format;

import org.dxworks.codeshaper.Deadline;
import org.dxworks.codeshaper.Dialect;
import org.dxworks.codeshaper.model.FormatResult;
import org.dxworks.codeshaper.model.LineChange;
import org.dxworks.codeshaper.modify.EditApplier;
import org.dxworks.codeshaper.modify.TextEdit;
import org.dxworks.codeshaper.parser.ParsedSource;
import org.dxworks.codeshaper.parser.SourceText;
import org.dxworks.codeshaper.parser.StructuralParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.dxworks.codeshaper.parser.TreeSitterHelper.*;

/**
 * Whitespace-level normalizer driven by the syntax tree. Indentation is recomputed from
 * bracket nesting; content inside multi-line strings, templates, comments and JSX text
 * is never touched. Formatting its own output changes nothing.
 */
public class SourceFormatter {

    private static final Logger log = LoggerFactory.getLogger(SourceFormatter.class);

    static final String INDENTATION_NORMALIZED = "Indentation normalized";
    static final String TRAILING_WHITESPACE_REMOVED = "Trailing whitespace removed";
    static final String LINE_FORMATTED = "Line formatted";
    static final String BLANK_LINE_REMOVED = "Blank line removed";
    static final String LINE_ENDINGS_NORMALIZED = "Line endings normalized";
    static final String FINAL_NEWLINE_NORMALIZED = "Final newline normalized";

    private static final String[] TERMINATED_STATEMENTS = {
            "expression_statement", "lexical_declaration", "variable_declaration", "return_statement",
            "throw_statement", "break_statement", "continue_statement", "import_statement",
            "debugger_statement", "export_statement"
    };

    private static final String[] CONTAINERS = {
            "statement_block", "class_body", "object", "object_pattern", "array", "array_pattern",
            "arguments", "formal_parameters", "parenthesized_expression", "switch_body", "switch_case",
            "switch_default", "named_imports", "export_clause", "enum_body", "interface_body",
            "object_type", "tuple_type", "type_arguments", "type_parameters", "jsx_element",
            "jsx_opening_element", "jsx_self_closing_element", "jsx_expression"
    };

    private static final String[] BODY_OWNERS = {
            "if_statement", "else_clause", "for_statement", "for_in_statement", "while_statement", "do_statement"
    };

    private static final String[] PRESERVED = {
            "template_string", "string", "comment", "jsx_text", "regex"
    };

    private static final String[] CONTINUATION_PREFIXES = {"?.", "??", "&&", "||", ".", "?", ":"};

    private final StructuralParser parser;
    private final String indentUnit;

    public SourceFormatter(StructuralParser parser, int indentSize) {
        this.parser = parser;
        this.indentUnit = " ".repeat(Math.max(1, indentSize));
    }

    public FormatResult format(String sourceCode, Dialect dialect, Deadline deadline) {
        String normalized = sourceCode.replace("\r\n", "\n").replace('\r', '\n');

        ParsedSource parsed = parser.parseTree(normalized, dialect);
        String terminated = EditApplier.apply(parsed.getSource(), missingSemicolons(parsed, deadline));
        if (!terminated.equals(normalized)) {
            parsed = parser.parseTree(terminated, dialect);
        }

        List<String> lines = layOut(parsed, deadline);
        String formatted = join(lines);
        boolean modified = !formatted.equals(sourceCode);

        List<LineChange> changes = modified
                ? describeChanges(sourceCode, normalized, lines, formatted)
                : List.of();
        log.debug("Formatted {} lines, {} changed", lines.size(), changes.size());
        return new FormatResult(modified, changes, formatted);
    }

    // ---- semicolons ----

    private List<TextEdit> missingSemicolons(ParsedSource parsed, Deadline deadline) {
        List<TextEdit> edits = new ArrayList<>();
        for (TSNode statement : findAllDescendantsOfTypes(parsed.getRootNode(), deadline, TERMINATED_STATEMENTS)) {
            if (isLoopHeader(statement)) continue;
            if ("export_statement".equals(statement.getType()) && !needsTerminator(statement)) continue;

            TSNode last = lastSignificantChild(statement);
            if (last == null) continue;
            if (";".equals(last.getType()) && last.getEndByte() > last.getStartByte()) continue;
            edits.add(TextEdit.insert(last.getEndByte(), ";"));
        }
        return edits;
    }

    /**
     * Initializer and condition of a classic {@code for} carry their own {@code ;}.
     */
    private static boolean isLoopHeader(TSNode statement) {
        TSNode parent = statement.getParent();
        return isNodeTypeOneOf(parent, "for_statement")
                && (isField(parent, "initializer", statement) || isField(parent, "condition", statement));
    }

    private static boolean needsTerminator(TSNode exportStmt) {
        if (isPresent(getChildByFieldName(exportStmt, "declaration"))) {
            return false;
        }
        TSNode value = getChildByFieldName(exportStmt, "value");
        return !isNodeTypeOneOf(value, "class", "function", "function_expression", "generator_function");
    }

    private static TSNode lastSignificantChild(TSNode node) {
        for (int i = node.getChildCount() - 1; i >= 0; i--) {
            TSNode child = node.getChild(i);
            if (isPresent(child) && !"comment".equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    // ---- layout ----

    private List<String> layOut(ParsedSource parsed, Deadline deadline) {
        SourceText source = parsed.getSource();
        int lineCount = source.getLineCount();
        String[] raw = new String[lineCount + 1];
        int[] firstToken = new int[lineCount + 1];
        for (int line = 1; line <= lineCount; line++) {
            raw[line] = source.text(source.lineStart(line), source.lineEnd(line));
            firstToken[line] = source.lineStart(line) + leadingWhitespace(raw[line]);
        }

        boolean[] preserved = new boolean[lineCount + 2];
        boolean[] keepTail = new boolean[lineCount + 2];
        for (TSNode node : findAllDescendantsOfTypes(parsed.getRootNode(), deadline, PRESERVED)) {
            int startLine = source.lineOf(node.getStartByte());
            int endLine = source.lineOf(node.getEndByte());
            if (startLine == endLine) continue;
            if ("jsx_text".equals(node.getType()) && source.text(node).isBlank()) continue;
            keepTail[startLine] = true;
            for (int line = startLine + 1; line <= endLine; line++) {
                preserved[line] = true;
            }
        }

        int[] depth = nestingDepths(parsed, raw, firstToken, deadline);

        List<String> out = new ArrayList<>(lineCount);
        for (int line = 1; line <= lineCount; line++) {
            if (preserved[line]) {
                out.add(raw[line]);
                continue;
            }
            String content = keepTail[line] ? raw[line].stripLeading() : raw[line].strip();
            if (content.isEmpty()) {
                out.add("");
                continue;
            }
            int level = depth[line] + (isContinuation(content) ? 1 : 0);
            out.add(indentUnit.repeat(level) + content);
        }
        return collapseBlankLines(out, preserved);
    }

    /**
     * A line is one level deeper for every container that opened on an earlier line and is
     * still open at the line's first token. Containers opening on the same line count once.
     */
    private int[] nestingDepths(ParsedSource parsed, String[] raw, int[] firstToken, Deadline deadline) {
        SourceText source = parsed.getSource();
        int lineCount = source.getLineCount();
        int[] delta = new int[lineCount + 2];
        int[] extra = new int[lineCount + 2];

        Map<Integer, List<int[]>> byStartLine = new HashMap<>();
        for (TSNode container : findAllDescendantsOfTypes(parsed.getRootNode(), deadline, CONTAINERS)) {
            int close = closingOffset(container);
            if (close < 0) continue;
            int startLine = source.lineOf(container.getStartByte());
            int closeLine = source.lineOf(close);
            if (closeLine <= startLine) continue;
            byStartLine.computeIfAbsent(startLine, k -> new ArrayList<>()).add(new int[]{closeLine, close});
        }

        for (Map.Entry<Integer, List<int[]>> group : byStartLine.entrySet()) {
            int startLine = group.getKey();
            int fullUntil = startLine;
            for (int[] range : group.getValue()) {
                fullUntil = Math.max(fullUntil, range[0] - 1);
            }
            if (fullUntil > startLine) {
                delta[startLine + 1]++;
                delta[fullUntil + 1]--;
            }
            int countedBoundary = -1;
            for (int[] range : group.getValue()) {
                int closeLine = range[0];
                if (closeLine <= fullUntil || closeLine == countedBoundary) continue;
                if (effectiveFirstToken(raw[closeLine], firstToken[closeLine]) < range[1]) {
                    extra[closeLine]++;
                    countedBoundary = closeLine;
                }
            }
        }

        for (TSNode owner : findAllDescendantsOfTypes(parsed.getRootNode(), deadline, BODY_OWNERS)) {
            TSNode body = unbracedBody(owner);
            if (body == null) continue;
            int bodyStart = source.lineOf(body.getStartByte());
            if (bodyStart <= source.lineOf(owner.getStartByte())) continue;
            delta[bodyStart]++;
            delta[source.lineOf(body.getEndByte()) + 1]--;
        }

        int[] depth = new int[lineCount + 1];
        int running = 0;
        for (int line = 1; line <= lineCount; line++) {
            running += delta[line];
            depth[line] = running + extra[line];
        }
        return depth;
    }

    /**
     * Body of an {@code if}, {@code else} or loop when it is a single statement without braces.
     */
    private static TSNode unbracedBody(TSNode owner) {
        TSNode body;
        switch (owner.getType()) {
            case "if_statement":
                body = getChildByFieldName(owner, "consequence");
                break;
            case "else_clause":
                body = namedChild(owner, 0);
                break;
            default:
                body = getChildByFieldName(owner, "body");
                break;
        }
        return isPresent(body) && !isNodeTypeOneOf(body, "statement_block") ? body : null;
    }

    private static int closingOffset(TSNode container) {
        String type = container.getType();
        if ("switch_case".equals(type) || "switch_default".equals(type)) {
            return container.getEndByte();
        }
        if ("jsx_self_closing_element".equals(type)) {
            for (int i = container.getChildCount() - 1; i >= 0; i--) {
                TSNode child = container.getChild(i);
                if (isNodeTypeOneOf(child, "/")) return child.getStartByte();
            }
        }
        TSNode last = lastChild(container);
        return isPresent(last) ? last.getStartByte() : -1;
    }

    /**
     * The line's first token, moved to the last bracket of a leading run of closers so that
     * {@code })} sits at the depth of the outermost bracket it closes.
     */
    private static int effectiveFirstToken(String line, int firstToken) {
        int i = leadingWhitespace(line);
        int run = 0;
        while (i + run < line.length() && "})]".indexOf(line.charAt(i + run)) >= 0) run++;
        return run > 0 ? firstToken + run - 1 : firstToken;
    }

    private static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) i++;
        return i;
    }

    private static boolean isContinuation(String content) {
        if (content.startsWith("...")) return false;
        for (String prefix : CONTINUATION_PREFIXES) {
            if (content.startsWith(prefix)) return true;
        }
        return false;
    }

    /**
     * Replaces dropped lines with {@code null} so indexes still match source lines.
     */
    private static List<String> collapseBlankLines(List<String> lines, boolean[] preserved) {
        List<String> out = new ArrayList<>(lines.size());
        boolean previousBlank = true; // leading blank lines go
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean blank = !preserved[i + 1] && line.isEmpty();
            if (blank && previousBlank) {
                out.add(null);
                continue;
            }
            out.add(line);
            previousBlank = blank;
        }
        for (int i = out.size() - 1; i >= 0; i--) {
            String line = out.get(i);
            if (line == null) continue;
            if (!line.isEmpty() || preserved[i + 1]) break;
            out.set(i, null);
        }
        return out;
    }

    private static String join(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            if (line == null) continue;
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    // ---- change report ----

    private static List<LineChange> describeChanges(String original, String normalized,
                                                    List<String> lines, String formatted) {
        List<LineChange> changes = new ArrayList<>();
        if (!original.equals(normalized)) {
            changes.add(new LineChange(1, LINE_ENDINGS_NORMALIZED));
        }
        String[] before = normalized.split("\n", -1);
        for (int i = 0; i < lines.size() && i < before.length; i++) {
            String after = lines.get(i);
            String was = before[i];
            if (after == null) {
                if (i < before.length - 1 || !was.isEmpty()) {
                    changes.add(new LineChange(i + 1, BLANK_LINE_REMOVED));
                }
            } else if (!after.equals(was)) {
                changes.add(new LineChange(i + 1, describe(was, after)));
            }
        }
        if (changes.isEmpty() && !formatted.equals(normalized)) {
            changes.add(new LineChange(Math.max(1, before.length - 1), FINAL_NEWLINE_NORMALIZED));
        }
        return changes;
    }

    private static String describe(String was, String after) {
        if (was.strip().equals(after.strip())) {
            return was.stripTrailing().equals(after) ? TRAILING_WHITESPACE_REMOVED : INDENTATION_NORMALIZED;
        }
        return LINE_FORMATTED;
    }
}
