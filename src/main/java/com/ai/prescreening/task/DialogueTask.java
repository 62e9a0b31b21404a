package com.ai.prescreening.task;

import com.ai.prescreening.conversation.SessionState;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.conversation.ToolHandler;
import com.ai.prescreening.service.CallSession;
import com.ai.prescreening.service.TurnSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A bounded sub-conversation that runs to exactly one typed result.
 * <p>
 * Lifecycle: {@link Phase#AWAITING_ENTRY} while the entry utterance plays, {@link Phase#AWAITING_TURN}
 * while waiting for candidate turns, {@link Phase#COMPLETED} once a result is assigned. Every candidate
 * turn counts towards {@code maxTurns}; reaching it force-completes with {@link #turnCapResult()}.
 * Completion is idempotent and tool calls after completion are ignored.
 *
 * @param <R> result type
 */
public abstract class DialogueTask<R> implements ToolHandler {

    private static final Logger log = LoggerFactory.getLogger(DialogueTask.class);

    public enum Phase {
        AWAITING_ENTRY,
        AWAITING_TURN,
        COMPLETED
    }

    private final String name;
    private final int maxTurns;

    private Phase phase = Phase.AWAITING_ENTRY;
    private int turnCount;
    private R result;
    private Consumer<R> onComplete;
    private List<String> revisitableIds = List.of();
    private Consumer<String> revisitHandler;

    protected CallSession session;

    protected DialogueTask(String name, int maxTurns) {
        this.name = name;
        this.maxTurns = maxTurns;
    }

    /**
     * Called by {@link CallSession#runTask} once this task is the active tool handler.
     */
    public final void start(CallSession session, Consumer<R> onComplete) {
        this.session = session;
        this.onComplete = onComplete;
        log.info("[{}] Task {} started", session.getCallId(), name);
        onEnter().whenComplete((v, e) -> {
            if (e != null) {
                log.warn("[{}] Entry of task {} failed: {}", session.getCallId(), name, e.getMessage());
            }
            if (phase == Phase.AWAITING_ENTRY) {
                phase = Phase.AWAITING_TURN;
            }
        });
    }

    protected abstract CompletableFuture<Void> onEnter();

    /** Result assigned when the turn cap is reached without a terminal decision. */
    protected abstract R turnCapResult();

    protected abstract List<ToolDefinition> taskTools();

    protected abstract CompletableFuture<String> handle(ToolCall call);

    public abstract TurnSettings turnSettings();

    /**
     * Counts one completed candidate turn.
     *
     * @return true if this turn hit the cap and force-completed the task
     */
    public final boolean userTurnCompleted() {
        if (phase == Phase.COMPLETED) {
            return false;
        }
        turnCount++;
        if (turnCount >= maxTurns) {
            log.info("[{}] Task {} reached {} turns, force-completing", session.getCallId(), name, maxTurns);
            return complete(turnCapResult());
        }
        return false;
    }

    /**
     * Assigns the terminal result. A second call is a no-op.
     *
     * @return true if this call completed the task
     */
    protected final boolean complete(R value) {
        if (phase == Phase.COMPLETED) {
            log.debug("[{}] Task {} already completed, ignoring {}", session.getCallId(), name, value);
            return false;
        }
        phase = Phase.COMPLETED;
        result = value;
        log.info("[{}] Task {} completed: {}", session.getCallId(), name, value);
        session.taskCompleted(this, () -> onComplete.accept(value));
        return true;
    }

    /**
     * Stops this task without a result, e.g. when the candidate goes back to an earlier question.
     */
    public final void abandon() {
        if (phase == Phase.COMPLETED) {
            return;
        }
        phase = Phase.COMPLETED;
        log.info("[{}] Task {} abandoned", session.getCallId(), name);
        session.taskAbandoned(this);
    }

    void allowRevisit(List<String> questionIds, Consumer<String> handler) {
        this.revisitableIds = List.copyOf(questionIds);
        this.revisitHandler = handler;
    }

    @Override
    public final CompletableFuture<String> invoke(ToolCall call) {
        if (phase == Phase.COMPLETED) {
            log.debug("[{}] Ignoring {} on completed task {}", session.getCallId(), call.getName(), name);
            return noReply();
        }
        if (revisitHandler != null && GroupTool.REVISIT_QUESTION.functionName().equals(call.getName())) {
            return revisit(call.getString("question_id"));
        }
        return handle(call);
    }

    private CompletableFuture<String> revisit(String questionId) {
        if (!revisitableIds.contains(questionId)) {
            return reply("Unknown question id '" + questionId + "'. Earlier questions: " + String.join(", ", revisitableIds));
        }
        log.info("[{}] Task {} revisiting {}", session.getCallId(), name, questionId);
        revisitHandler.accept(questionId);
        return noReply();
    }

    @Override
    public final List<ToolDefinition> tools() {
        List<ToolDefinition> tools = new ArrayList<>(taskTools());
        if (revisitHandler != null && !revisitableIds.isEmpty()) {
            tools.add(GroupTool.REVISIT_QUESTION);
        }
        return tools;
    }

    @Override
    public String handlerName() {
        return name;
    }

    protected SessionState state() {
        return session.getState();
    }

    protected CompletableFuture<String> unknownTool(ToolCall call) {
        log.warn("[{}] Unknown tool {} for task {}", session.getCallId(), call.getName(), name);
        return reply("Unknown tool " + call.getName());
    }

    protected static CompletableFuture<String> reply(String output) {
        return CompletableFuture.completedFuture(output);
    }

    protected static CompletableFuture<String> noReply() {
        return CompletableFuture.completedFuture(null);
    }

    public Phase getPhase() {
        return phase;
    }

    public boolean isDone() {
        return phase == Phase.COMPLETED;
    }

    public int getTurnCount() {
        return turnCount;
    }

    public R getResult() {
        return result;
    }

    /** Tools added by a {@link TaskGroup} to the tasks it runs. */
    enum GroupTool implements ToolDefinition {
        REVISIT_QUESTION("revisit_question",
                "The candidate wants to go back to an earlier question and change the answer.", "question_id");

        private final String functionName;
        private final String description;
        private final List<String> parameters;

        GroupTool(String functionName, String description, String... parameters) {
            this.functionName = functionName;
            this.description = description;
            this.parameters = List.of(parameters);
        }

        @Override
        public String functionName() {
            return functionName;
        }

        @Override
        public String description() {
            return description;
        }

        @Override
        public List<String> parameters() {
            return parameters;
        }
    }
}
