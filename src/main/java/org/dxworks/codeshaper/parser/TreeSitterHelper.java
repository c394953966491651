package org.dxworks.codeshaper.parser;

import org.dxworks.codeshaper.Deadline;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    private static final int DEADLINE_CHECK_INTERVAL = 512;

    public static boolean isPresent(TSNode node) {
        return node != null && !node.isNull();
    }

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static TSNode findFirstChild(TSNode parent, String nodeType) {
        for (TSNode child : namedChildren(parent)) {
            if (nodeType.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    public static List<TSNode> findAllChildren(TSNode parent, String nodeType) {
        List<TSNode> result = new ArrayList<>();
        for (TSNode child : namedChildren(parent)) {
            if (nodeType.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Named children in source order. Walks every child and filters on {@code isNamed()}:
     * the binding's {@code getNamedChild(i)} returns the first named child for any index.
     */
    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(parent)) return result;
        int count = parent.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getChild(i);
            if (isPresent(child) && child.isNamed()) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * The {@code index}-th named child, or {@code null} when there are fewer.
     */
    public static TSNode namedChild(TSNode parent, int index) {
        if (!isPresent(parent) || index < 0) return null;
        int seen = 0;
        for (int i = 0; i < parent.getChildCount(); i++) {
            TSNode child = parent.getChild(i);
            if (isPresent(child) && child.isNamed() && seen++ == index) {
                return child;
            }
        }
        return null;
    }

    /**
     * True if one of the direct children (named or anonymous) has the given type.
     * Keywords such as {@code async}, {@code static} and {@code default} are anonymous nodes.
     */
    public static boolean hasChildOfType(TSNode parent, String nodeType) {
        if (!isPresent(parent)) return false;
        for (int i = 0; i < parent.getChildCount(); i++) {
            TSNode child = parent.getChild(i);
            if (isPresent(child) && nodeType.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    public static TSNode lastChild(TSNode parent) {
        if (!isPresent(parent) || parent.getChildCount() == 0) return null;
        return parent.getChild(parent.getChildCount() - 1);
    }

    public static List<TSNode> findAllDescendantsOfTypes(TSNode root, Deadline deadline, String... types) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(root)) return result;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        int visited = 0;
        while (!stack.isEmpty()) {
            if (++visited % DEADLINE_CHECK_INTERVAL == 0) deadline.check();
            TSNode node = stack.pop();
            if (isTypeOneOf(node.getType(), types)) result.add(node);
            List<TSNode> children = namedChildren(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (!isPresent(parent)) return null;
        // getFieldNameForChild expects the total child index (anonymous tokens included),
        // not the named child index
        for (int i = 0; i < parent.getChildCount(); i++) {
            String fn = parent.getFieldNameForChild(i);
            if (fieldName.equals(fn)) return parent.getChild(i);
        }
        return null;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (!isPresent(node)) return false;
        return isTypeOneOf(node.getType(), types);
    }

    public static boolean sameNode(TSNode a, TSNode b) {
        if (!isPresent(a) || !isPresent(b)) return false;
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    /**
     * True if {@code node} is the child stored under {@code fieldName} of its parent.
     */
    public static boolean isField(TSNode parent, String fieldName, TSNode node) {
        return sameNode(getChildByFieldName(parent, fieldName), node);
    }

    /**
     * Checks if a string is a valid identifier (for JS/TS style identifiers).
     */
    public static boolean isValidIdentifier(String name) {
        return name != null && name.matches("[a-zA-Z_$][a-zA-Z0-9_$]*");
    }

    /**
     * Strips the quotes of a string literal node's text.
     */
    public static String unquote(String literal) {
        if (literal == null || literal.length() < 2) return literal;
        char first = literal.charAt(0);
        if ((first == '"' || first == '\'' || first == '`') && literal.charAt(literal.length() - 1) == first) {
            return literal.substring(1, literal.length() - 1);
        }
        return literal;
    }
}
