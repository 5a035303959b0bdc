package com.seriesfilter.reads.converter;

import java.util.Objects;

/**
 * Exception thrown when a filter tree cannot be translated into an
 * expression.
 *
 * <p>A malformed filter tree means the remote planner sent something this
 * side does not understand. Translation stops at the first problem; no
 * partial expression is returned.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       Expression expr = converter.convert(node);
 *   } catch (TranslationException e) {
 *       log.warn(e.getUserMessage());
 *       log.debug(e.getTechnicalMessage());
 *   }
 * </pre>
 *
 * @see FilterNodeConverter
 */
public class TranslationException extends RuntimeException {

    /**
     * Categories of translation failures.
     */
    public enum ErrorKind {
        /** A comparison node does not have exactly two children. */
        MALFORMED_COMPARISON,
        /** A logical node has no children. */
        EMPTY_LOGICAL_NODE,
        /** A paren node does not have exactly one child. */
        MALFORMED_PAREN_EXPRESSION,
        /** A reference or literal node has children. */
        UNEXPECTED_CHILDREN,
        /** The node type code is not recognized. */
        UNKNOWN_NODE_TYPE,
        /** The comparison or logical operator is missing, unrecognized or unsupported. */
        UNKNOWN_OPERATOR,
        /** A node carries a value of the wrong kind for its position. */
        TYPE_MISMATCH,
        /** A regex literal does not compile. */
        INVALID_REGEX,
        /** The tree is nested deeper than the configured limit. */
        MAX_DEPTH_EXCEEDED
    }

    private final ErrorKind kind;
    private final String nodePath;

    /**
     * Creates a translation exception.
     *
     * @param kind the failure category
     * @param message the error message
     * @param nodePath the path of the offending node, e.g. {@code root.children[1]}
     */
    public TranslationException(ErrorKind kind, String message, String nodePath) {
        super(message + " (at " + nodePath + ")");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.nodePath = nodePath;
    }

    /**
     * Creates a translation exception with a cause.
     *
     * @param kind the failure category
     * @param message the error message
     * @param cause the underlying cause
     * @param nodePath the path of the offending node
     */
    public TranslationException(ErrorKind kind, String message, Throwable cause, String nodePath) {
        super(message + " (at " + nodePath + ")", cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.nodePath = nodePath;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the path from the root to the node that failed.
     *
     * @return the node path
     */
    public String getNodePath() {
        return nodePath;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        switch (kind) {
            case MALFORMED_COMPARISON:
                return "Invalid read filter: a comparison must have exactly two operands.";
            case EMPTY_LOGICAL_NODE:
                return "Invalid read filter: an AND/OR group must have at least one operand.";
            case MALFORMED_PAREN_EXPRESSION:
                return "Invalid read filter: a parenthesized group must have exactly one operand.";
            case UNEXPECTED_CHILDREN:
                return "Invalid read filter: tag references, field references and literals cannot have operands.";
            case UNKNOWN_NODE_TYPE:
                return "Unsupported read filter: the filter contains a node type this server does not know. " +
                       "Check that client and server versions match.";
            case UNKNOWN_OPERATOR:
                return "Unsupported read filter: the filter uses an operator this server does not support.";
            case TYPE_MISMATCH:
                return "Invalid read filter: a value has the wrong type for the operator it is used with.";
            case INVALID_REGEX:
                return "Invalid read filter: a regular expression does not compile.";
            case MAX_DEPTH_EXCEEDED:
                return "Read filter is nested too deeply. Simplify the predicate.";
            default:
                return "Invalid read filter: " + getMessage();
        }
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Filter Translation Failed\n");
        sb.append("Kind: ").append(kind).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        sb.append("Node Path: ").append(nodePath).append("\n");

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
