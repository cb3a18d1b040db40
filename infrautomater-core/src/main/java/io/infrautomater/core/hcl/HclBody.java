package io.infrautomater.core.hcl;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Ordered sequence of attributes and nested blocks.
///
/// Values are rendered by type: {@link String} as an escaped literal,
/// {@link Number} and {@link Boolean} bare, {@link HclExpression} verbatim,
/// {@link Map} as an object and {@link Collection} as a tuple. Anything else is
/// rejected, so request data can only ever reach the output as a quoted literal.
///
/// @see HclDocument
/// @see HclBlock
public abstract class HclBody {

    private static final String INDENT = "  ";

    private final List<Object> items = new ArrayList<>();

    /// Adds an attribute assignment.
    ///
    /// @param name attribute name, must be a valid identifier
    /// @param value attribute value, not null
    /// @return this body for chaining
    public HclBody attribute(String name, Object value) {
        HclStrings.requireIdentifier(name);
        Objects.requireNonNull(value, () -> "value of '" + name + "' must not be null");
        items.add(new Attribute(name, value));
        return this;
    }

    /// Adds a nested block and returns it for population.
    ///
    /// @param type block type, must be a valid identifier
    /// @param labels block labels, each rendered as a quoted string
    /// @return the new block, never null
    public HclBlock block(String type, String... labels) {
        HclBlock block = new HclBlock(type, labels);
        items.add(block);
        return block;
    }

    void renderItems(StringBuilder out, int depth) {
        for (Object item : items) {
            if (item instanceof Attribute attribute) {
                indent(out, depth);
                out.append(attribute.name()).append(" = ");
                renderValue(out, attribute.value(), depth);
                out.append('\n');
            } else if (item instanceof HclBlock block) {
                block.render(out, depth);
            }
        }
    }

    static void indent(StringBuilder out, int depth) {
        out.append(INDENT.repeat(depth));
    }

    static void renderValue(StringBuilder out, Object value, int depth) {
        if (value instanceof String s) {
            out.append(HclStrings.quote(s));
        } else if (value instanceof Boolean b) {
            out.append(b);
        } else if (value instanceof BigDecimal d) {
            out.append(d.toPlainString());
        } else if (value instanceof Number n) {
            out.append(n);
        } else if (value instanceof HclExpression e) {
            out.append(e.source());
        } else if (value instanceof Map<?, ?> map) {
            renderObject(out, map, depth);
        } else if (value instanceof Collection<?> list) {
            renderTuple(out, list, depth);
        } else {
            throw new IllegalArgumentException(
                    "Unsupported HCL value type: " + value.getClass().getName());
        }
    }

    private static void renderObject(StringBuilder out, Map<?, ?> map, int depth) {
        if (map.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            indent(out, depth + 1);
            out.append(HclStrings.isIdentifier(key) ? key : HclStrings.quote(key)).append(" = ");
            renderValue(out, Objects.requireNonNull(entry.getValue()), depth + 1);
            out.append('\n');
        }
        indent(out, depth);
        out.append('}');
    }

    private static void renderTuple(StringBuilder out, Collection<?> list, int depth) {
        out.append('[');
        Iterator<?> it = list.iterator();
        while (it.hasNext()) {
            renderValue(out, Objects.requireNonNull(it.next()), depth);
            if (it.hasNext()) {
                out.append(", ");
            }
        }
        out.append(']');
    }

    private record Attribute(String name, Object value) {}
}
