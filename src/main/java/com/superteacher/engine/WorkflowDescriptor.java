package com.superteacher.engine;

import com.superteacher.models.ConversationStep;
import com.superteacher.models.WorkflowKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A workflow as data: the steps it declares, the edges between them, the
 * handlers for text and image messages per step, and the steps used to start,
 * reset and recover a conversation.
 *
 * <p>Staying in the current step and moving to the reset or recovery step are
 * always allowed. Every other move must be declared with
 * {@link Builder#edge}.
 */
public final class WorkflowDescriptor {
    private final WorkflowKind kind;
    private final Set<ConversationStep> steps;
    private final Map<ConversationStep, Set<ConversationStep>> edges;
    private final Map<ConversationStep, StepHandler> textHandlers;
    private final Map<ConversationStep, StepHandler> imageHandlers;
    private final ConversationStep startStep;
    private final ConversationStep resetStep;
    private final ConversationStep recoveryStep;
    private final String greeting;

    private WorkflowDescriptor(Builder builder) {
        this.kind = builder.kind;
        this.steps = Collections.unmodifiableSet(EnumSet.copyOf(builder.steps));
        Map<ConversationStep, Set<ConversationStep>> edgeCopy = new EnumMap<>(ConversationStep.class);
        builder.edges.forEach((from, targets) -> edgeCopy.put(from, Collections.unmodifiableSet(EnumSet.copyOf(targets))));
        this.edges = Collections.unmodifiableMap(edgeCopy);
        this.textHandlers = Collections.unmodifiableMap(new EnumMap<>(builder.textHandlers));
        this.imageHandlers = Collections.unmodifiableMap(new EnumMap<>(builder.imageHandlers));
        this.startStep = builder.startStep;
        this.resetStep = builder.resetStep;
        this.recoveryStep = builder.recoveryStep;
        this.greeting = builder.greeting;
    }

    public static Builder builder(WorkflowKind kind) {
        return new Builder(kind);
    }

    public WorkflowKind getKind() {
        return kind;
    }

    public Set<ConversationStep> getSteps() {
        return steps;
    }

    public boolean declares(ConversationStep step) {
        return step != null && steps.contains(step);
    }

    public boolean isAllowed(ConversationStep from, ConversationStep to) {
        if (!declares(from) || !declares(to)) {
            return false;
        }
        if (from == to || to == resetStep || to == recoveryStep) {
            return true;
        }
        Set<ConversationStep> targets = edges.get(from);
        return targets != null && targets.contains(to);
    }

    public StepHandler textHandler(ConversationStep step) {
        return textHandlers.get(step);
    }

    public StepHandler imageHandler(ConversationStep step) {
        return imageHandlers.get(step);
    }

    public ConversationStep getStartStep() {
        return startStep;
    }

    public ConversationStep getResetStep() {
        return resetStep;
    }

    public ConversationStep getRecoveryStep() {
        return recoveryStep;
    }

    public String getGreeting() {
        return greeting;
    }

    public static final class Builder {
        private final WorkflowKind kind;
        private final Set<ConversationStep> steps = EnumSet.noneOf(ConversationStep.class);
        private final Map<ConversationStep, Set<ConversationStep>> edges = new EnumMap<>(ConversationStep.class);
        private final Map<ConversationStep, StepHandler> textHandlers = new EnumMap<>(ConversationStep.class);
        private final Map<ConversationStep, StepHandler> imageHandlers = new EnumMap<>(ConversationStep.class);
        private ConversationStep startStep;
        private ConversationStep resetStep;
        private ConversationStep recoveryStep;
        private String greeting;

        private Builder(WorkflowKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder steps(ConversationStep... declared) {
            Collections.addAll(steps, declared);
            return this;
        }

        public Builder edge(ConversationStep from, ConversationStep... to) {
            Set<ConversationStep> targets = edges.computeIfAbsent(from, step -> EnumSet.noneOf(ConversationStep.class));
            Collections.addAll(targets, to);
            return this;
        }

        public Builder onText(ConversationStep step, StepHandler handler) {
            textHandlers.put(step, handler);
            return this;
        }

        public Builder onImage(ConversationStep step, StepHandler handler) {
            imageHandlers.put(step, handler);
            return this;
        }

        public Builder startStep(ConversationStep step) {
            this.startStep = step;
            return this;
        }

        public Builder resetStep(ConversationStep step) {
            this.resetStep = step;
            return this;
        }

        public Builder recoveryStep(ConversationStep step) {
            this.recoveryStep = step;
            return this;
        }

        public Builder greeting(String text) {
            this.greeting = text;
            return this;
        }

        public WorkflowDescriptor build() {
            Objects.requireNonNull(startStep, "startStep");
            Objects.requireNonNull(resetStep, "resetStep");
            Objects.requireNonNull(recoveryStep, "recoveryStep");
            Objects.requireNonNull(greeting, "greeting");
            for (ConversationStep step : EnumSet.of(startStep, resetStep, recoveryStep)) {
                if (!steps.contains(step)) {
                    throw new IllegalStateException(step + " is not declared in the " + kind + " workflow");
                }
            }
            edges.forEach((from, targets) -> {
                if (!steps.contains(from) || !steps.containsAll(targets)) {
                    throw new IllegalStateException("edge from " + from + " uses a step not declared in " + kind);
                }
            });
            for (ConversationStep step : textHandlers.keySet()) {
                if (!steps.contains(step)) {
                    throw new IllegalStateException("text handler for undeclared step " + step);
                }
            }
            for (ConversationStep step : imageHandlers.keySet()) {
                if (!steps.contains(step)) {
                    throw new IllegalStateException("image handler for undeclared step " + step);
                }
            }
            return new WorkflowDescriptor(this);
        }
    }
}
