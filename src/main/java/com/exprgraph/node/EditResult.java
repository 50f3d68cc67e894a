package com.exprgraph.node;

import java.util.Optional;

import com.exprgraph.binding.Reconciliation;
import com.exprgraph.parse.ExpressionParseException;
import com.exprgraph.parse.ParseErrorKind;

/**
 * Outcome of {@link ExpressionNode#applyTextEdit}.
 *
 * <p>
 * An applied edit carries the reconciliation that was committed and the number
 * of connection-store commands it issued. A rejected edit carries the parse
 * failure; the node's semantic state and its connections are unchanged.
 */
public final class EditResult {
    private final Reconciliation reconciliation;
    private final int commands;
    private final ExpressionParseException failure;

    private EditResult(Reconciliation reconciliation, int commands, ExpressionParseException failure) {
        this.reconciliation = reconciliation;
        this.commands = commands;
        this.failure = failure;
    }

    public static EditResult applied(Reconciliation reconciliation, int commands) {
        return new EditResult(reconciliation, commands, null);
    }

    public static EditResult rejected(ExpressionParseException failure) {
        return new EditResult(null, 0, failure);
    }

    public boolean isApplied() {
        return failure == null;
    }

    /** The parse error kind of a rejected edit. */
    public Optional<ParseErrorKind> error() {
        return failure == null ? Optional.empty() : Optional.of(failure.kind());
    }

    public Optional<ExpressionParseException> failure() {
        return Optional.ofNullable(failure);
    }

    public Optional<Reconciliation> reconciliation() {
        return Optional.ofNullable(reconciliation);
    }

    /** Connection-store commands issued by this edit. Always 0 when rejected. */
    public int commands() {
        return commands;
    }

    @Override
    public String toString() {
        return isApplied() ? "Applied{commands=" + commands + "}" : "Rejected{" + failure.getMessage() + "}";
    }
}
