package jtat.core;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/// Placeholder naming: `_<digits>` binds one node or scalar, `__<digits>` binds a run of list
/// elements.
public final class Placeholders {

    private static final Pattern SIMPLE = Pattern.compile("_\\d+");
    private static final Pattern VARIADIC = Pattern.compile("__\\d+");

    private Placeholders() {}

    public static boolean isSimple(String name) {
        return name != null && SIMPLE.matcher(name).matches();
    }

    public static boolean isVariadic(String name) {
        return name != null && VARIADIC.matcher(name).matches();
    }

    /// The simple placeholder a node stands for, or null.
    static String simpleName(TreeSyntax syntax, Node node) {
        final var id = syntax.identifierOf(node);
        return isSimple(id) ? id : null;
    }

    /// The variadic placeholder a node stands for, or null.
    static String variadicName(TreeSyntax syntax, Node node) {
        final var id = syntax.identifierOf(node);
        return isVariadic(id) ? id : null;
    }

    /// The placeholder-shaped attribute name of an attribute-like node, or null.
    static String attributeName(TreeSyntax syntax, Node node) {
        final var fields = syntax.attributeFields(node.kind());
        if (fields.isEmpty()) {
            return null;
        }
        return node.field(fields.get().attribute()) instanceof FieldValue.Scalar s
                && s.value() instanceof String name && isSimple(name) ? name : null;
    }

    /// Index of the variadic placeholder in a list, or -1.
    ///
    /// @throws PatternException if the list holds more than one
    static int variadicIndex(TreeSyntax syntax, List<Node> elements) {
        var found = -1;
        for (int i = 0; i < elements.size(); i++) {
            if (variadicName(syntax, elements.get(i)) != null) {
                if (found >= 0) {
                    throw new PatternException("only one variadic placeholder may be used in a list, found "
                            + variadicName(syntax, elements.get(found)) + " and " + variadicName(syntax, elements.get(i)));
                }
                found = i;
            }
        }
        return found;
    }

    /// Validates a pattern or template and returns every placeholder name it uses, in order of
    /// first appearance.
    ///
    /// @throws PatternException for two variadic placeholders in one list, or a variadic
    ///         placeholder outside a list field
    public static Set<String> scan(TreeSyntax syntax, Node root) {
        final var names = new LinkedHashSet<String>();
        final var variadic = variadicName(syntax, root);
        if (variadic != null) {
            throw new PatternException("variadic placeholder " + variadic + " can only be used inside a list");
        }
        scanNode(syntax, root, names);
        return names;
    }

    private static void scanNode(TreeSyntax syntax, Node node, Set<String> names) {
        final var simple = simpleName(syntax, node);
        if (simple != null) {
            names.add(simple);
            return;
        }
        final var attribute = attributeName(syntax, node);
        if (attribute != null) {
            names.add(attribute);
        }
        for (final var value : node.fields().values()) {
            if (value instanceof FieldValue.NodeValue nv) {
                final var variadic = variadicName(syntax, nv.node());
                if (variadic != null) {
                    throw new PatternException("variadic placeholder " + variadic + " can only be used inside a list");
                }
                scanNode(syntax, nv.node(), names);
            } else if (value instanceof FieldValue.ListValue lv) {
                final var index = variadicIndex(syntax, lv.nodes());
                for (int i = 0; i < lv.nodes().size(); i++) {
                    if (i == index) {
                        names.add(variadicName(syntax, lv.nodes().get(i)));
                    } else {
                        scanNode(syntax, lv.nodes().get(i), names);
                    }
                }
            }
        }
    }
}
