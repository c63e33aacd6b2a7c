package com.superteacher.intent;

import com.superteacher.models.Session;
import com.superteacher.models.UserIntent;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * One entry in the classifier's ordered rule list. The message handed to the
 * predicate is already trimmed and lowercased.
 */
public final class IntentRule {
    private final String name;
    private final UserIntent intent;
    private final BiPredicate<String, Session> condition;

    public IntentRule(String name, UserIntent intent, BiPredicate<String, Session> condition) {
        this.name = Objects.requireNonNull(name, "name");
        this.intent = Objects.requireNonNull(intent, "intent");
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public boolean matches(String normalizedMessage, Session session) {
        return condition.test(normalizedMessage, session);
    }

    public String getName() {
        return name;
    }

    public UserIntent getIntent() {
        return intent;
    }

    @Override
    public String toString() {
        return name + " -> " + intent;
    }
}
