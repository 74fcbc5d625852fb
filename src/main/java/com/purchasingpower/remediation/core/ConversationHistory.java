package com.purchasingpower.remediation.core;

import com.purchasingpower.remediation.model.Finding;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejected attempts of a single request, oldest first.
 *
 * <p>Immutable: {@link #append(Attempt)} returns a new history. Indices are contiguous
 * from 0.
 */
public final class ConversationHistory {

    private static final ConversationHistory EMPTY = new ConversationHistory(List.of());

    private final List<Attempt> attempts;

    private ConversationHistory(List<Attempt> attempts) {
        this.attempts = attempts;
    }

    public static ConversationHistory empty() {
        return EMPTY;
    }

    public ConversationHistory append(Attempt attempt) {
        if (attempt.index() != attempts.size()) {
            throw new IllegalArgumentException(
                    "Expected attempt " + attempts.size() + " but got " + attempt.index());
        }
        List<Attempt> next = new ArrayList<>(attempts.size() + 1);
        next.addAll(attempts);
        next.add(attempt);
        return new ConversationHistory(List.copyOf(next));
    }

    public List<Attempt> attempts() {
        return attempts;
    }

    public int size() {
        return attempts.size();
    }

    public boolean isEmpty() {
        return attempts.isEmpty();
    }

    /**
     * Findings of the most recent attempt, or an empty list if there is none.
     */
    public List<Finding> lastFindings() {
        return attempts.isEmpty() ? List.of() : attempts.get(attempts.size() - 1).findings();
    }
}
