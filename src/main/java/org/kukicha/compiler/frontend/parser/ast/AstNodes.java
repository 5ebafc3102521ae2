package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Generic traversal over the record-based AST.
 */
public final class AstNodes {

    private AstNodes() {
    }

    /**
     * Lists the direct child nodes of a node, in declaration order. Nested helper records
     * such as string parts, map entries and struct field values are looked through.
     */
    public static List<AstNode> children(AstNode node) {
        List<AstNode> result = new ArrayList<>();
        collect(node, result);
        return result;
    }

    /**
     * Visits a node and all of its descendants, parents before children.
     */
    public static void walk(AstNode node, Consumer<AstNode> visitor) {
        if (node == null) {
            return;
        }
        visitor.accept(node);
        for (AstNode child : children(node)) {
            walk(child, visitor);
        }
    }

    private static void collect(Record record, List<AstNode> out) {
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            addValue(read(record, component), out);
        }
    }

    private static void collect(AstNode node, List<AstNode> out) {
        if (node instanceof Record record) {
            collect(record, out);
        }
    }

    private static void addValue(Object value, List<AstNode> out) {
        if (value instanceof AstNode child) {
            out.add(child);
        } else if (value instanceof List<?> list) {
            for (Object element : list) {
                addValue(element, out);
            }
        } else if (value instanceof Record nested && !(value instanceof Token)) {
            collect(nested, out);
        }
    }

    private static Object read(Record record, RecordComponent component) {
        try {
            return component.getAccessor().invoke(record);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read " + component.getName() + " of " + record.getClass().getSimpleName(), e);
        }
    }
}
