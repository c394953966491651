package org.dxworks.codeshaper.modify;

import org.dxworks.codeshaper.Deadline;
import org.dxworks.codeshaper.parser.ParseException;
import org.dxworks.codeshaper.parser.ParsedSource;
import org.dxworks.codeshaper.parser.SourceText;
import org.dxworks.codeshaper.parser.StructuralParser;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.codeshaper.parser.TreeSitterHelper.*;

/**
 * Resolves requests against one parsed tree. Every visit is read-only: it returns the byte
 * edits that realize the request, and the caller applies them and re-parses.
 */
class TreeEditor implements ModificationVisitor<EditPlan> {

    private static final String[] FUNCTION_DECLARATIONS = {
            "function_declaration", "generator_function_declaration"
    };
    private static final String[] CLASS_DECLARATIONS = {
            "class_declaration", "abstract_class_declaration", "class"
    };
    private static final String[] JSX_ELEMENTS = {
            "jsx_opening_element", "jsx_closing_element", "jsx_self_closing_element"
    };

    private final ParsedSource parsed;
    private final SourceText source;
    private final StructuralParser parser;
    private final boolean renameDeclarations;
    private final String indentUnit;
    private final Deadline deadline;

    TreeEditor(ParsedSource parsed, StructuralParser parser, boolean renameDeclarations,
               int indentSize, Deadline deadline) {
        this.parsed = parsed;
        this.source = parsed.getSource();
        this.parser = parser;
        this.renameDeclarations = renameDeclarations;
        this.indentUnit = " ".repeat(Math.max(1, indentSize));
        this.deadline = deadline;
    }

    // ---- rename ----

    @Override
    public EditPlan visitRename(RenameRequest request) {
        List<TextEdit> edits = new ArrayList<>();
        List<TSNode> candidates = findAllDescendantsOfTypes(parsed.getRootNode(), deadline,
                "identifier", "shorthand_property_identifier", "shorthand_property_identifier_pattern");

        for (TSNode node : candidates) {
            if (!request.target.equals(source.text(node))) continue;
            TextEdit edit = renameEdit(node, request.target, request.newName);
            if (edit != null) edits.add(edit);
        }

        if (edits.isEmpty()) {
            return EditPlan.unmatched(renameDeclarations
                    ? "no identifier named '" + request.target + "'"
                    : "no references to '" + request.target + "'");
        }
        return EditPlan.applied("Renamed " + request.target + " to " + request.newName, edits);
    }

    private TextEdit renameEdit(TSNode node, String target, String newName) {
        String type = node.getType();
        if ("shorthand_property_identifier".equals(type)) {
            // { a } keeps its key
            return TextEdit.replace(node, target + ": " + newName);
        }
        if ("shorthand_property_identifier_pattern".equals(type)) {
            return renameDeclarations ? TextEdit.replace(node, target + ": " + newName) : null;
        }

        TSNode parent = node.getParent();
        if (isNodeTypeOneOf(parent, "export_specifier")) {
            return renameExportSpecifier(parent, node, target, newName);
        }
        if (isNodeTypeOneOf(parent, "import_specifier")) {
            return renameDeclarations ? renameImportSpecifier(parent, node, target, newName) : null;
        }
        if (isJsxTagName(node)) {
            return null;
        }
        if (isReference(node) || renameDeclarations) {
            return TextEdit.replace(node, newName);
        }
        return null;
    }

    private TextEdit renameExportSpecifier(TSNode specifier, TSNode node, String target, String newName) {
        if (!isField(specifier, "name", node)) {
            return null; // the exported alias is part of the module interface
        }
        TSNode exportStmt = specifier.getParent() != null ? specifier.getParent().getParent() : null;
        if (isPresent(getChildByFieldName(exportStmt, "source"))) {
            return null; // re-export of another module's binding
        }
        TSNode alias = getChildByFieldName(specifier, "alias");
        if (isPresent(alias)) {
            return TextEdit.replace(node, newName);
        }
        return TextEdit.replace(node, newName + " as " + target);
    }

    private TextEdit renameImportSpecifier(TSNode specifier, TSNode node, String target, String newName) {
        TSNode alias = getChildByFieldName(specifier, "alias");
        if (isPresent(alias)) {
            return sameNode(alias, node) ? TextEdit.replace(node, newName) : null;
        }
        return TextEdit.replace(node, target + " as " + newName);
    }

    /**
     * True when the identifier reads a binding rather than introducing one.
     */
    static boolean isReference(TSNode node) {
        TSNode parent = node.getParent();
        if (!isPresent(parent)) return true;

        switch (parent.getType()) {
            case "variable_declarator":
            case "function_declaration":
            case "generator_function_declaration":
            case "function_expression":
            case "function":
            case "generator_function":
            case "class_declaration":
            case "abstract_class_declaration":
            case "class":
            case "enum_declaration":
            case "internal_module":
            case "module":
                return !isField(parent, "name", node);
            case "formal_parameters":
            case "rest_pattern":
            case "array_pattern":
            case "import_clause":
            case "namespace_import":
            case "import_specifier":
                return false;
            case "required_parameter":
            case "optional_parameter":
                return !isField(parent, "pattern", node);
            case "assignment_pattern":
                return !isField(parent, "left", node);
            case "pair_pattern":
                return !isField(parent, "value", node);
            case "arrow_function":
            case "catch_clause":
                return !isField(parent, "parameter", node);
            case "for_in_statement":
                return !(isField(parent, "left", node) && isPresent(getChildByFieldName(parent, "kind")));
            case "jsx_opening_element":
            case "jsx_closing_element":
            case "jsx_self_closing_element":
                return false;
            default:
                return true;
        }
    }

    private static boolean isJsxTagName(TSNode node) {
        TSNode current = node;
        TSNode parent = node.getParent();
        while (isNodeTypeOneOf(parent, "member_expression", "nested_identifier")) {
            current = parent;
            parent = parent.getParent();
        }
        return isNodeTypeOneOf(parent, JSX_ELEMENTS)
                && (sameNode(current, node) || isField(parent, "name", current));
    }

    // ---- imports ----

    @Override
    public EditPlan visitAddImport(AddImportRequest request) {
        char quote = importQuote();
        String path = request.importPath.replace("\\", "\\\\").replace(String.valueOf(quote), "\\" + quote);
        String statement = "import " + request.importName + " from " + quote + path + quote + ";\n";

        int offset = 0;
        TSNode prologueEnd = leadingPrologueEnd();
        if (prologueEnd != null) {
            int line = source.lineOf(prologueEnd.getEndByte());
            if (line < source.getLineCount()) {
                offset = source.lineStart(line + 1);
            } else {
                offset = source.length();
                statement = "\n" + statement;
            }
        }
        return EditPlan.applied("Added import " + request.importName + " from " + request.importPath,
                List.of(TextEdit.insert(offset, statement)));
    }

    /**
     * Last node of the hash bang line and directive prologue ({@code 'use strict';}), which
     * must stay ahead of any import.
     */
    private TSNode leadingPrologueEnd() {
        TSNode end = null;
        for (TSNode child : namedChildren(parsed.getRootNode())) {
            if ("comment".equals(child.getType())) continue;
            if ("hash_bang_line".equals(child.getType()) || isDirective(child)) {
                end = child;
                continue;
            }
            break;
        }
        return end;
    }

    private static boolean isDirective(TSNode statement) {
        if (!"expression_statement".equals(statement.getType())) return false;
        List<TSNode> children = namedChildren(statement);
        return children.size() == 1 && "string".equals(children.get(0).getType());
    }

    private char importQuote() {
        for (TSNode child : namedChildren(parsed.getRootNode())) {
            if (!"import_statement".equals(child.getType())) continue;
            String literal = source.text(getChildByFieldName(child, "source"));
            if (literal != null && literal.startsWith("'")) return '\'';
            return '"';
        }
        return '"';
    }

    @Override
    public EditPlan visitRemoveImport(RemoveImportRequest request) {
        List<TextEdit> edits = new ArrayList<>();
        for (TSNode child : namedChildren(parsed.getRootNode())) {
            if (!"import_statement".equals(child.getType())) continue;
            TSNode sourceNode = getChildByFieldName(child, "source");
            if (!isPresent(sourceNode) || !request.importPath.equals(unquote(source.text(sourceNode)))) continue;
            edits.add(wholeLineDeletion(child));
        }
        int count = edits.size();
        return EditPlan.applied("Removed " + count + (count == 1 ? " import" : " imports")
                + " from " + request.importPath, edits);
    }

    /**
     * Deletes the node together with its line when nothing else shares that line.
     */
    private TextEdit wholeLineDeletion(TSNode node) {
        byte[] bytes = source.getBytes();
        int start = node.getStartByte();
        int end = node.getEndByte();
        int lineStart = source.lineStart(source.lineOf(start));
        if (source.text(lineStart, start).isBlank()) {
            start = lineStart;
        }
        int cursor = end;
        while (cursor < bytes.length && (bytes[cursor] == ' ' || bytes[cursor] == '\t')) cursor++;
        if (cursor < bytes.length && bytes[cursor] == '\r') cursor++;
        if (cursor < bytes.length && bytes[cursor] == '\n') {
            end = cursor + 1;
        } else if (cursor == bytes.length) {
            end = cursor;
        }
        return TextEdit.delete(start, end);
    }

    // ---- functions ----

    @Override
    public EditPlan visitAddFunction(AddFunctionRequest request) {
        Fragment fragment = parseFragment(request, request.functionCode);
        TSNode statement = fragment.firstStatement();
        if (!isNodeTypeOneOf(statement, FUNCTION_DECLARATIONS)) {
            return EditPlan.unmatched("functionCode does not start with a function declaration");
        }

        String text = source.getText();
        StringBuilder insertion = new StringBuilder();
        if (!text.isEmpty()) {
            if (!text.endsWith("\n")) insertion.append('\n');
            if (!text.endsWith("\n\n")) insertion.append('\n');
        }
        insertion.append(fragment.source.text(statement)).append('\n');

        String name = fragment.source.text(getChildByFieldName(statement, "name"));
        return EditPlan.applied("Added function " + name,
                List.of(TextEdit.insert(source.length(), insertion.toString())));
    }

    @Override
    public EditPlan visitUpdateFunction(UpdateFunctionRequest request) {
        Fragment fragment = parseFragment(request, request.functionCode);
        TSNode statement = fragment.firstStatement();
        if (statement == null) {
            throw new InvalidModificationException(request.typeName() + ": functionCode contains no statement");
        }
        String replacement = fragment.source.text(statement);

        List<TextEdit> edits = new ArrayList<>();
        int coveredUntil = -1;
        for (TSNode function : findAllDescendantsOfTypes(parsed.getRootNode(), deadline, FUNCTION_DECLARATIONS)) {
            if (function.getStartByte() < coveredUntil) continue; // nested in an earlier match
            if (!request.target.equals(source.text(getChildByFieldName(function, "name")))) continue;
            edits.add(TextEdit.replace(function, reindent(replacement, lineIndent(function.getStartByte()))));
            coveredUntil = function.getEndByte();
        }

        if (edits.isEmpty()) {
            return EditPlan.unmatched("no function named '" + request.target + "'");
        }
        return EditPlan.applied("Updated function " + request.target, edits);
    }

    private Fragment parseFragment(ModificationRequest request, String code) {
        try {
            return new Fragment(parser.parseTree(code, parsed.getDialect()));
        } catch (ParseException e) {
            throw new InvalidModificationException(request.typeName() + ": functionCode does not parse: "
                    + e.getMessage(), e);
        }
    }

    private static String reindent(String code, String indent) {
        if (indent.isEmpty()) return code;
        String[] lines = code.split("\n", -1);
        StringBuilder sb = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            sb.append('\n');
            if (!lines[i].isBlank()) sb.append(indent);
            sb.append(lines[i]);
        }
        return sb.toString();
    }

    // ---- classes ----

    @Override
    public EditPlan visitAddProperty(AddPropertyRequest request) {
        String declaration = request.propertyName + " = " + request.propertyValue + ";";
        List<TextEdit> edits = new ArrayList<>();

        for (TSNode cls : findAllDescendantsOfTypes(parsed.getRootNode(), deadline, CLASS_DECLARATIONS)) {
            if (!request.target.equals(source.text(getChildByFieldName(cls, "name")))) continue;
            TSNode body = getChildByFieldName(cls, "body");
            TSNode closing = lastChild(body);
            if (!isNodeTypeOneOf(closing, "}")) continue;

            String classIndent = lineIndent(cls.getStartByte());
            String memberIndent = memberIndent(body, classIndent);
            int closeAt = closing.getStartByte();
            int lineStart = source.lineStart(source.lineOf(closeAt));
            if (source.text(lineStart, closeAt).isBlank()) {
                edits.add(TextEdit.insert(lineStart, memberIndent + declaration + "\n"));
            } else {
                edits.add(TextEdit.insert(closeAt, "\n" + memberIndent + declaration + "\n" + classIndent));
            }
        }

        if (edits.isEmpty()) {
            return EditPlan.unmatched("no class named '" + request.target + "'");
        }
        return EditPlan.applied("Added property " + request.propertyName + " to " + request.target, edits);
    }

    private String memberIndent(TSNode body, String classIndent) {
        for (TSNode member : namedChildren(body)) {
            int start = member.getStartByte();
            int lineStart = source.lineStart(source.lineOf(start));
            String before = source.text(lineStart, start);
            if (before.isBlank() && source.lineOf(start) != source.lineOf(body.getStartByte())) {
                return before;
            }
        }
        return classIndent + indentUnit;
    }

    private String lineIndent(int offset) {
        int lineStart = source.lineStart(source.lineOf(offset));
        String line = source.text(lineStart, source.lineEnd(source.lineOf(offset)));
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) i++;
        return line.substring(0, i);
    }

    private static final class Fragment {
        final ParsedSource parsed;
        final SourceText source;

        Fragment(ParsedSource parsed) {
            this.parsed = parsed;
            this.source = parsed.getSource();
        }

        TSNode firstStatement() {
            for (TSNode child : namedChildren(parsed.getRootNode())) {
                if (!isNodeTypeOneOf(child, "comment", "hash_bang_line")) return child;
            }
            return null;
        }
    }
}
