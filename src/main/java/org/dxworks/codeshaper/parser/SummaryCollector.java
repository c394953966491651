package org.dxworks.codeshaper.parser;

import org.dxworks.codeshaper.Deadline;
import org.dxworks.codeshaper.model.*;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.dxworks.codeshaper.parser.TreeSitterHelper.*;

/**
 * Single pre-order walk over a syntax tree that feeds one {@link ProgramSummary.Builder}.
 * The builder never escapes the walk; callers only see the built summary.
 */
class SummaryCollector {

    private static final int DEADLINE_CHECK_INTERVAL = 256;

    private final SourceText source;
    private final DeclarationScope scope;
    private final Deadline deadline;

    SummaryCollector(SourceText source, DeclarationScope scope, Deadline deadline) {
        this.source = source;
        this.scope = scope;
        this.deadline = deadline;
    }

    ProgramSummary collect(TSNode rootNode) {
        ProgramSummary.Builder summary = ProgramSummary.builder();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(rootNode, false, false));
        int visited = 0;

        while (!stack.isEmpty()) {
            if (++visited % DEADLINE_CHECK_INTERVAL == 0) deadline.check();
            Frame frame = stack.pop();
            TSNode node = frame.node;
            String type = node.getType();

            switch (type) {
                case "program":
                    pushChildren(stack, node, true, false);
                    continue;
                case "import_statement":
                    collectImport(node, summary);
                    continue;
                case "export_statement":
                    collectExports(node, summary);
                    pushChildren(stack, node, frame.moduleLevel, true);
                    continue;
                case "function_declaration":
                case "generator_function_declaration":
                    if (isRecorded(frame)) {
                        collectFunction(node, summary);
                    }
                    break;
                case "class_declaration":
                case "abstract_class_declaration":
                    if (isRecorded(frame)) {
                        collectClass(node, frame, summary);
                    }
                    break;
                case "lexical_declaration":
                case "variable_declaration":
                    if (isRecorded(frame)) {
                        collectVariables(node, summary);
                    }
                    break;
                default:
                    break;
            }
            pushChildren(stack, node, false, false);
        }

        return summary.build();
    }

    private boolean isRecorded(Frame frame) {
        return scope == DeclarationScope.ALL || frame.moduleLevel;
    }

    private static void pushChildren(Deque<Frame> stack, TSNode node, boolean moduleLevel, boolean exported) {
        List<TSNode> children = namedChildren(node);
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Frame(children.get(i), moduleLevel, exported));
        }
    }

    private void collectImport(TSNode importStmt, ProgramSummary.Builder summary) {
        TSNode sourceNode = getChildByFieldName(importStmt, "source");
        if (!isPresent(sourceNode)) {
            return; // import x = require('y')
        }
        List<ImportSpecifier> specifiers = new ArrayList<>();
        TSNode clause = findFirstChild(importStmt, "import_clause");
        for (TSNode child : namedChildren(clause)) {
            switch (child.getType()) {
                case "identifier":
                    specifiers.add(new ImportSpecifier(SpecifierKind.DEFAULT, source.text(child), null));
                    break;
                case "namespace_import": {
                    TSNode local = findFirstChild(child, "identifier");
                    specifiers.add(new ImportSpecifier(SpecifierKind.NAMESPACE, source.text(local), null));
                    break;
                }
                case "named_imports":
                    for (TSNode spec : findAllChildren(child, "import_specifier")) {
                        String name = unquote(source.text(getChildByFieldName(spec, "name")));
                        TSNode aliasNode = getChildByFieldName(spec, "alias");
                        String alias = isPresent(aliasNode) ? source.text(aliasNode) : null;
                        specifiers.add(new ImportSpecifier(SpecifierKind.NAMED, name, alias));
                    }
                    break;
                default:
                    break;
            }
        }
        summary.addImport(new ImportInfo(unquote(source.text(sourceNode)), specifiers, source.lineOf(importStmt)));
    }

    private void collectExports(TSNode exportStmt, ProgramSummary.Builder summary) {
        if (hasChildOfType(exportStmt, "default")) {
            summary.addExport(new ExportInfo(ExportKind.DEFAULT, "default", null));
            return;
        }

        TSNode declaration = getChildByFieldName(exportStmt, "declaration");
        if (isPresent(declaration)) {
            String declType = declaration.getType();
            if (isTypeOneOf(declType, "lexical_declaration", "variable_declaration")) {
                for (TSNode declarator : findAllChildren(declaration, "variable_declarator")) {
                    TSNode name = getChildByFieldName(declarator, "name");
                    if (isNodeTypeOneOf(name, "identifier")) {
                        summary.addExport(new ExportInfo(ExportKind.NAMED, source.text(name), null));
                    }
                }
            } else if (isTypeOneOf(declType, "function_declaration", "generator_function_declaration",
                    "class_declaration", "abstract_class_declaration")) {
                TSNode name = getChildByFieldName(declaration, "name");
                if (isPresent(name)) {
                    summary.addExport(new ExportInfo(ExportKind.NAMED, source.text(name), null));
                }
            }
            return;
        }

        TSNode clause = findFirstChild(exportStmt, "export_clause");
        for (TSNode spec : findAllChildren(clause, "export_specifier")) {
            String name = unquote(source.text(getChildByFieldName(spec, "name")));
            TSNode aliasNode = getChildByFieldName(spec, "alias");
            String alias = isPresent(aliasNode) ? unquote(source.text(aliasNode)) : null;
            summary.addExport(new ExportInfo(ExportKind.NAMED, name, alias));
        }
    }

    private void collectFunction(TSNode funcDecl, ProgramSummary.Builder summary) {
        TSNode nameNode = getChildByFieldName(funcDecl, "name");
        if (!isPresent(nameNode)) {
            return;
        }
        boolean generator = "generator_function_declaration".equals(funcDecl.getType())
                || hasChildOfType(funcDecl, "*");
        summary.addFunction(new FunctionInfo(
                source.text(nameNode),
                renderParameters(getChildByFieldName(funcDecl, "parameters")),
                hasChildOfType(funcDecl, "async"),
                generator,
                source.lineOf(funcDecl)));
    }

    private List<String> renderParameters(TSNode paramsNode) {
        List<String> params = new ArrayList<>();
        for (TSNode param : namedChildren(paramsNode)) {
            if (isNodeTypeOneOf(param, "comment", "decorator")) continue;
            params.add(renderParameter(param));
        }
        return params;
    }

    private String renderParameter(TSNode param) {
        switch (param.getType()) {
            case "identifier":
                return source.text(param);
            case "required_parameter":
            case "optional_parameter": {
                TSNode pattern = getChildByFieldName(param, "pattern");
                return isPresent(pattern) ? renderParameter(pattern) : normalizeInline(source.text(param));
            }
            case "assignment_pattern": {
                TSNode left = getChildByFieldName(param, "left");
                return isPresent(left) ? renderParameter(left) : normalizeInline(source.text(param));
            }
            case "rest_pattern": {
                TSNode target = namedChild(param, 0);
                return "..." + (isPresent(target) ? renderParameter(target) : "");
            }
            default:
                return normalizeInline(source.text(param));
        }
    }

    private void collectClass(TSNode classDecl, Frame frame, ProgramSummary.Builder summary) {
        TSNode nameNode = getChildByFieldName(classDecl, "name");
        if (!isPresent(nameNode)) {
            return;
        }

        List<MethodInfo> methods = new ArrayList<>();
        TSNode body = getChildByFieldName(classDecl, "body");
        for (TSNode method : findAllChildren(body, "method_definition")) {
            TSNode methodName = getChildByFieldName(method, "name");
            if (!isNodeTypeOneOf(methodName, "property_identifier")) {
                continue;
            }
            methods.add(new MethodInfo(
                    source.text(methodName),
                    hasChildOfType(method, "static"),
                    hasChildOfType(method, "async"),
                    source.lineOf(method)));
        }

        summary.addClass(new ClassInfo(
                source.text(nameNode),
                superclassName(classDecl),
                methods,
                source.lineOf(classDecl),
                frame.exported,
                frame.moduleLevel));
    }

    private String superclassName(TSNode classDecl) {
        TSNode heritage = findFirstChild(classDecl, "class_heritage");
        if (!isPresent(heritage)) {
            return null;
        }
        TSNode superclass;
        TSNode extendsClause = findFirstChild(heritage, "extends_clause");
        if (isPresent(extendsClause)) {
            // TypeScript wraps the superclass in an extends clause
            superclass = getChildByFieldName(extendsClause, "value");
            if (!isPresent(superclass)) {
                superclass = namedChild(extendsClause, 0);
            }
        } else {
            superclass = namedChild(heritage, 0);
        }
        return isNodeTypeOneOf(superclass, "identifier") ? source.text(superclass) : null;
    }

    private void collectVariables(TSNode declaration, ProgramSummary.Builder summary) {
        TSNode kindNode = getChildByFieldName(declaration, "kind");
        if (!isPresent(kindNode)) {
            kindNode = declaration.getChild(0);
        }
        DeclarationKind kind = "variable_declaration".equals(declaration.getType())
                ? DeclarationKind.VAR
                : DeclarationKind.fromKeyword(source.text(kindNode));
        int line = source.lineOf(declaration);
        for (TSNode declarator : findAllChildren(declaration, "variable_declarator")) {
            TSNode name = getChildByFieldName(declarator, "name");
            if (isNodeTypeOneOf(name, "identifier")) {
                summary.addVariable(new VariableInfo(source.text(name), kind, line));
            }
        }
    }

    private static final class Frame {
        final TSNode node;
        final boolean moduleLevel;
        final boolean exported;

        Frame(TSNode node, boolean moduleLevel, boolean exported) {
            this.node = node;
            this.moduleLevel = moduleLevel;
            this.exported = exported;
        }
    }
}
