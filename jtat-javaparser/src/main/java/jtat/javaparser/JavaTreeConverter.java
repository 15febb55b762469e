package jtat.javaparser;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.modules.ModuleDeclaration;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.metamodel.BaseNodeMetaModel;
import com.github.javaparser.metamodel.JavaParserMetaModel;
import com.github.javaparser.metamodel.PropertyMetaModel;
import jtat.core.FieldValue;
import jtat.core.NodeKind;
import jtat.core.RewriteException;
import jtat.core.SourceRange;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Converts between JavaParser's AST and generic [jtat.core.Node] trees, driven by JavaParser's
/// metamodel.
///
/// A node's kind is its JavaParser class name; its fields are the metamodel properties in
/// declaration order, without `comment`. `SimpleName` properties become identifier scalars, so
/// `NameExpr`, `MethodCallExpr` and `FieldAccessExpr` carry their names directly. Enums, strings
/// and booleans are scalars; an unset optional property is absent.
///
/// The way back goes through each kind's all-fields constructor. Positions are not carried back;
/// rendered code does not need them.
public final class JavaTreeConverter {

    private static final Logger LOG = Logger.getLogger(JavaTreeConverter.class.getName());

    private static final String COMMENT = "comment";

    private static final List<Class<? extends Node>> STATEMENT_TYPES = List.of(
            Statement.class,
            BodyDeclaration.class,
            ImportDeclaration.class,
            PackageDeclaration.class,
            ModuleDeclaration.class,
            SwitchEntry.class,
            CatchClause.class);

    private final Map<String, BaseNodeMetaModel> metaModels;

    public JavaTreeConverter() {
        final var byName = new HashMap<String, BaseNodeMetaModel>();
        for (final var metaModel : JavaParserMetaModel.getNodeMetaModels()) {
            byName.put(metaModel.getTypeName(), metaModel);
        }
        this.metaModels = Map.copyOf(byName);
    }

    /// Whether nodes of this JavaParser type bound a region of source that can be replaced.
    public static boolean isStatementType(Class<?> type) {
        for (final var statementType : STATEMENT_TYPES) {
            if (statementType.isAssignableFrom(type)) {
                return true;
            }
        }
        return false;
    }

    /// The expression body of a lambda is held in an `ExpressionStmt` that has no `;` in the source,
    /// so it is not a statement: a rewrite inside it re-renders the statement holding the lambda.
    static boolean isStatement(Node node) {
        if (node instanceof ExpressionStmt && node.getParentNode().orElse(null) instanceof LambdaExpr) {
            return false;
        }
        return isStatementType(node.getClass());
    }

    public jtat.core.Node toGeneric(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        final var metaModel = node.getMetaModel();
        final var kind = new NodeKind(metaModel.getTypeName(), isStatement(node));
        final var fields = new LinkedHashMap<String, FieldValue>();
        for (final var property : metaModel.getAllPropertyMetaModels()) {
            if (COMMENT.equals(property.getName())) {
                continue;
            }
            fields.put(property.getName(), toGenericValue(property.getValue(node)));
        }
        final var range = node.getRange()
                .map(r -> SourceRange.of(r.begin.line, r.begin.column, r.end.line, r.end.column))
                .orElse(null);
        return new jtat.core.Node(kind, fields, range);
    }

    private FieldValue toGenericValue(Object value) {
        if (value == null) {
            return FieldValue.Absent.INSTANCE;
        }
        if (value instanceof SimpleName name) {
            return FieldValue.scalar(name.getIdentifier());
        }
        if (value instanceof NodeList<?> list) {
            final var elements = new ArrayList<jtat.core.Node>(list.size());
            for (final Node element : list) {
                elements.add(toGeneric(element));
            }
            return FieldValue.of(elements);
        }
        if (value instanceof Node node) {
            return FieldValue.of(toGeneric(node));
        }
        return FieldValue.scalar(value);
    }

    /// Builds the JavaParser node for a generic tree.
    ///
    /// @throws RewriteException if the tree does not describe valid JavaParser nodes, for example
    ///         an expression where a statement is required
    public Node toJava(jtat.core.Node node) {
        Objects.requireNonNull(node, "node must not be null");
        final var metaModel = metaModels.get(node.kind().name());
        if (metaModel == null || metaModel.isAbstract()) {
            throw new RewriteException("no JavaParser node type " + node.kind());
        }
        final var parameters = new HashMap<String, Object>();
        for (final var property : metaModel.getConstructorParameters()) {
            parameters.put(property.getName(), toJavaValue(node, property, node.field(property.getName())));
        }
        try {
            return metaModel.construct(parameters);
        } catch (RuntimeException e) {
            LOG.fine(() -> "cannot construct " + node.kind() + " from " + parameters + ": " + e);
            throw new RewriteException("cannot build " + node.kind() + " from " + node, e);
        }
    }

    private Object toJavaValue(jtat.core.Node owner, PropertyMetaModel property, FieldValue value) {
        final var type = property.getType();
        if (value instanceof FieldValue.ListValue list) {
            final var elements = new NodeList<Node>();
            for (final var element : list.nodes()) {
                elements.add(toJava(element));
            }
            return elements;
        }
        if (value instanceof FieldValue.NodeValue nested) {
            if (type == SimpleName.class) {
                return new SimpleName(identifierIn(owner, property, nested.node()));
            }
            return toJava(nested.node());
        }
        if (value instanceof FieldValue.Scalar scalar) {
            if (type == SimpleName.class) {
                return new SimpleName(String.valueOf(scalar.value()));
            }
            return scalar.value();
        }
        if (property.isNodeList()) {
            return new NodeList<>();
        }
        if (type == boolean.class || type == Boolean.class) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static String identifierIn(jtat.core.Node owner, PropertyMetaModel property, jtat.core.Node value) {
        final var id = JavaTreeSyntax.INSTANCE.identifierOf(value);
        if (id != null) {
            return id;
        }
        throw new RewriteException(owner.kind() + "." + property.getName() + " needs a name, got " + value.kind());
    }
}
