package com.seriesfilter.reads.converter;

import com.google.protobuf.ByteString;
import com.seriesfilter.expression.BinaryExpression;
import com.seriesfilter.expression.BinaryExpression.Operator;
import com.seriesfilter.expression.Expression;
import com.seriesfilter.expression.ExpressionUtils;
import com.seriesfilter.expression.Literal;
import com.seriesfilter.expression.ParenExpression;
import com.seriesfilter.expression.PseudoReferences;
import com.seriesfilter.expression.VarRef;
import com.seriesfilter.reads.config.ReadFilterConfig;
import com.seriesfilter.reads.converter.TranslationException.ErrorKind;
import com.seriesfilter.reads.proto.Node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;

/**
 * Converts a storage read filter tree ({@link Node}) into an {@link Expression}.
 *
 * <p>Every filter node maps to one expression node:
 * <ul>
 *   <li>literal: {@link Literal} of the same type, no numeric coercion</li>
 *   <li>tag reference: {@code key::tag}, after applying the tag key remap</li>
 *   <li>field reference: {@code "$"} for the field value, {@code _field::tag}
 *       for the field key, {@code name::field} otherwise</li>
 *   <li>comparison: {@link BinaryExpression} with the matching operator</li>
 *   <li>paren: {@link ParenExpression}</li>
 *   <li>logical: a left-associative chain of binary AND/OR expressions</li>
 * </ul>
 *
 * <p>A logical node with children {@code c0, c1, c2} becomes
 * {@code AND(AND(c0, c1), c2)}, which renders as {@code c0 AND c1 AND c2}.
 * The depth limit applies to the folded chain, so a logical node with more
 * children than the limit is rejected. Comparison operands must be
 * references or literals.
 *
 * <p>Malformed trees are rejected with a {@link TranslationException}; the
 * converter never guesses a mapping for a node it does not understand.
 * Instances hold no mutable state and may be shared between threads.
 */
public class FilterNodeConverter {
    private static final Logger logger = LoggerFactory.getLogger(FilterNodeConverter.class);

    private static final String ROOT_PATH = "root";

    private final int maxDepth;

    public FilterNodeConverter() {
        this(ReadFilterConfig.DEFAULT_MAX_NODE_DEPTH);
    }

    /**
     * Creates a converter that rejects trees nested deeper than the limit.
     *
     * @param maxDepth the maximum nesting depth, at least 1
     */
    public FilterNodeConverter(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Converts a filter tree without renaming tag keys.
     *
     * @param node the root of the filter tree
     * @return the converted expression
     * @throws TranslationException if the tree is malformed
     */
    public Expression convert(Node node) {
        return convert(node, Map.of());
    }

    /**
     * Converts a filter tree.
     *
     * @param node the root of the filter tree
     * @param tagKeyRemap tag keys to rename, e.g. {@code _measurement -> _name}; may be null
     * @return the converted expression
     * @throws TranslationException if the tree is malformed
     */
    public Expression convert(Node node, Map<String, String> tagKeyRemap) {
        Objects.requireNonNull(node, "node must not be null");
        Map<String, String> remap = tagKeyRemap != null ? tagKeyRemap : Map.of();
        return convertNode(node, remap, ROOT_PATH, 1);
    }

    private Expression convertNode(Node node, Map<String, String> remap, String path, int depth) {
        if (depth > maxDepth) {
            throw new TranslationException(ErrorKind.MAX_DEPTH_EXCEEDED,
                "Filter tree exceeds maximum depth of " + maxDepth, path);
        }
        logger.trace("Converting node type: {} at {}", node.getNodeType(), path);

        switch (node.getNodeType()) {
            case TYPE_LOGICAL_EXPRESSION:
                return convertLogical(node, remap, path, depth);
            case TYPE_COMPARISON_EXPRESSION:
                return convertComparison(node, remap, path, depth);
            case TYPE_PAREN_EXPRESSION:
                return convertParen(node, remap, path, depth);
            case TYPE_TAG_REF:
                return convertTagRef(node, remap, path);
            case TYPE_FIELD_REF:
                return convertFieldRef(node, path);
            case TYPE_LITERAL:
                return convertLiteral(node, path);
            default:
                throw new TranslationException(ErrorKind.UNKNOWN_NODE_TYPE,
                    "Unsupported node type: " + node.getNodeTypeValue(), path);
        }
    }

    /**
     * Converts a logical node, folding its children left to right.
     */
    private Expression convertLogical(Node node, Map<String, String> remap, String path, int depth) {
        Operator operator = logicalOperator(node, path);
        int count = node.getChildrenCount();
        if (count == 0) {
            throw new TranslationException(ErrorKind.EMPTY_LOGICAL_NODE,
                "Logical " + operator.symbol() + " node has no children", path);
        }

        // n children fold into a chain n - 1 binary nodes deep
        if (depth + count - 1 > maxDepth) {
            throw new TranslationException(ErrorKind.MAX_DEPTH_EXCEEDED,
                "Logical " + operator.symbol() + " node with " + count +
                " children exceeds maximum depth of " + maxDepth, path);
        }

        Expression result = convertNode(node.getChildren(0), remap, childPath(path, 0), chainDepth(depth, count, 0));
        for (int i = 1; i < count; i++) {
            Expression next = convertNode(node.getChildren(i), remap, childPath(path, i), chainDepth(depth, count, i));
            result = new BinaryExpression(result, operator, next);
        }
        return result;
    }

    /**
     * Returns the depth at which child {@code index} of a folded logical node
     * ends up. The first two children sit at the bottom of the chain.
     */
    private static int chainDepth(int depth, int count, int index) {
        return depth + Math.max(1, count - Math.max(index, 1));
    }

    private Operator logicalOperator(Node node, String path) {
        if (node.getValueCase() != Node.ValueCase.LOGICAL) {
            throw new TranslationException(ErrorKind.UNKNOWN_OPERATOR,
                "Logical node carries no combinator (value: " + node.getValueCase() + ")", path);
        }
        switch (node.getLogical()) {
            case LOGICAL_AND:
                return Operator.AND;
            case LOGICAL_OR:
                return Operator.OR;
            default:
                throw new TranslationException(ErrorKind.UNKNOWN_OPERATOR,
                    "Unsupported logical operator: " + node.getLogicalValue(), path);
        }
    }

    private Expression convertComparison(Node node, Map<String, String> remap, String path, int depth) {
        if (node.getChildrenCount() != 2) {
            throw new TranslationException(ErrorKind.MALFORMED_COMPARISON,
                "Comparison expects two children, got " + node.getChildrenCount(), path);
        }
        Operator operator = comparisonOperator(node, path);
        Expression left = convertNode(node.getChildren(0), remap, childPath(path, 0), depth + 1);
        Expression right = convertNode(node.getChildren(1), remap, childPath(path, 1), depth + 1);
        checkOperandKinds(operator, left, right, path);
        return new BinaryExpression(left, operator, right);
    }

    private Operator comparisonOperator(Node node, String path) {
        if (node.getValueCase() != Node.ValueCase.COMPARISON) {
            throw new TranslationException(ErrorKind.UNKNOWN_OPERATOR,
                "Comparison node carries no operator (value: " + node.getValueCase() + ")", path);
        }
        switch (node.getComparison()) {
            case COMPARISON_EQUAL:
                return Operator.EQUAL;
            case COMPARISON_NOT_EQUAL:
                return Operator.NOT_EQUAL;
            case COMPARISON_REGEX:
                return Operator.REGEX_MATCH;
            case COMPARISON_NOT_REGEX:
                return Operator.REGEX_NOT_MATCH;
            case COMPARISON_LESS:
                return Operator.LESS_THAN;
            case COMPARISON_LESS_EQUAL:
                return Operator.LESS_THAN_OR_EQUAL;
            case COMPARISON_GREATER:
                return Operator.GREATER_THAN;
            case COMPARISON_GREATER_EQUAL:
                return Operator.GREATER_THAN_OR_EQUAL;
            case COMPARISON_STARTS_WITH:
                throw new TranslationException(ErrorKind.UNKNOWN_OPERATOR,
                    "STARTS_WITH comparisons are not supported", path);
            default:
                throw new TranslationException(ErrorKind.UNKNOWN_OPERATOR,
                    "Unsupported comparison operator: " + node.getComparisonValue(), path);
        }
    }

    /**
     * Rejects operands that are not references or literals, and literals
     * that cannot be used with the operator.
     */
    private static void checkOperandKinds(Operator operator, Expression left, Expression right, String path) {
        if (!isOperand(left) || !isOperand(right)) {
            throw new TranslationException(ErrorKind.TYPE_MISMATCH,
                "Comparison operands must be references or literals, got " + left + " and " + right, path);
        }
        if (operator.isRegex()) {
            if (!isLiteralOfKind(right, Literal.Kind.REGEX)) {
                throw new TranslationException(ErrorKind.TYPE_MISMATCH,
                    "Operator " + operator.symbol() + " requires a regex on the right, got " + right, path);
            }
            if (isLiteralOfKind(left, Literal.Kind.REGEX)) {
                throw new TranslationException(ErrorKind.TYPE_MISMATCH,
                    "Operator " + operator.symbol() + " cannot have a regex on the left", path);
            }
            return;
        }
        if (isLiteralOfKind(left, Literal.Kind.REGEX) || isLiteralOfKind(right, Literal.Kind.REGEX)) {
            throw new TranslationException(ErrorKind.TYPE_MISMATCH,
                "Regex literal used with non-regex operator " + operator.symbol(), path);
        }
        if (operator.isOrdering() &&
            (isLiteralOfKind(left, Literal.Kind.BOOLEAN) || isLiteralOfKind(right, Literal.Kind.BOOLEAN))) {
            throw new TranslationException(ErrorKind.TYPE_MISMATCH,
                "Boolean literal used with ordering operator " + operator.symbol(), path);
        }
    }

    private static boolean isOperand(Expression expr) {
        Expression unwrapped = ExpressionUtils.unwrapParens(expr);
        return unwrapped instanceof VarRef || unwrapped instanceof Literal;
    }

    private static boolean isLiteralOfKind(Expression expr, Literal.Kind kind) {
        return expr instanceof Literal lit && lit.kind() == kind;
    }

    private Expression convertParen(Node node, Map<String, String> remap, String path, int depth) {
        if (node.getChildrenCount() != 1) {
            throw new TranslationException(ErrorKind.MALFORMED_PAREN_EXPRESSION,
                "Paren expression expects one child, got " + node.getChildrenCount(), path);
        }
        return new ParenExpression(convertNode(node.getChildren(0), remap, childPath(path, 0), depth + 1));
    }

    private Expression convertTagRef(Node node, Map<String, String> remap, String path) {
        requireNoChildren(node, path);
        if (node.getValueCase() != Node.ValueCase.TAG_REF_VALUE) {
            throw new TranslationException(ErrorKind.TYPE_MISMATCH,
                "Tag reference carries no tag key (value: " + node.getValueCase() + ")", path);
        }
        ByteString bytes = node.getTagRefValue();
        if (!bytes.isValidUtf8()) {
            throw new TranslationException(ErrorKind.TYPE_MISMATCH, "Tag reference key is not valid UTF-8", path);
        }
        String key = bytes.toStringUtf8();
        if (key.isEmpty()) {
            throw new TranslationException(ErrorKind.TYPE_MISMATCH, "Tag reference has an empty key", path);
        }
        return VarRef.tag(remap.getOrDefault(key, key));
    }

    /**
     * Converts a field reference. An unnamed reference or {@code $} stands for
     * the value of the field being read; {@code _field} is the field key,
     * which the series key stores as a tag; any other name becomes
     * {@code name::field}.
     */
    private Expression convertFieldRef(Node node, String path) {
        requireNoChildren(node, path);
        Node.ValueCase valueCase = node.getValueCase();
        if (valueCase != Node.ValueCase.FIELD_REF_VALUE && valueCase != Node.ValueCase.VALUE_NOT_SET) {
            throw new TranslationException(ErrorKind.TYPE_MISMATCH,
                "Field reference carries a " + valueCase + " value", path);
        }
        String name = valueCase == Node.ValueCase.FIELD_REF_VALUE ? node.getFieldRefValue() : "";
        if (name.isEmpty() || name.equals(PseudoReferences.FIELD_VALUE)) {
            return VarRef.of(PseudoReferences.FIELD_VALUE);
        }
        if (name.equals(PseudoReferences.FIELD_KEY)) {
            return VarRef.tag(PseudoReferences.FIELD_KEY);
        }
        return VarRef.field(name);
    }

    private Expression convertLiteral(Node node, String path) {
        requireNoChildren(node, path);
        switch (node.getValueCase()) {
            case STRING_VALUE:
                return Literal.of(node.getStringValue());
            case BOOL_VALUE:
                return Literal.of(node.getBoolValue());
            case INT_VALUE:
                return Literal.of(node.getIntValue());
            case UINT_VALUE:
                return Literal.unsigned(node.getUintValue());
            case FLOAT_VALUE:
                return Literal.of(node.getFloatValue());
            case DURATION_VALUE:
                return Literal.of(Duration.ofNanos(node.getDurationValue()));
            case REGEX_VALUE:
                try {
                    return Literal.regex(node.getRegexValue());
                } catch (PatternSyntaxException e) {
                    throw new TranslationException(ErrorKind.INVALID_REGEX,
                        "Invalid regex /" + node.getRegexValue() + "/", e, path);
                }
            default:
                throw new TranslationException(ErrorKind.TYPE_MISMATCH,
                    "Literal node carries no literal value (value: " + node.getValueCase() + ")", path);
        }
    }

    private static void requireNoChildren(Node node, String path) {
        if (node.getChildrenCount() != 0) {
            throw new TranslationException(ErrorKind.UNEXPECTED_CHILDREN,
                node.getNodeType() + " node cannot have children, got " + node.getChildrenCount(), path);
        }
    }

    private static String childPath(String path, int index) {
        return path + ".children[" + index + "]";
    }

    public int maxDepth() {
        return maxDepth;
    }
}
