package com.ai.prescreening.service;

import com.ai.prescreening.agent.StageAgent;
import com.ai.prescreening.agent.StageAgentFactory;
import com.ai.prescreening.agent.StageTransition;
import com.ai.prescreening.component.ResponsePhrases;
import com.ai.prescreening.conversation.SessionState;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolHandler;
import com.ai.prescreening.conversation.Transcript;
import com.ai.prescreening.conversation.UserState;
import com.ai.prescreening.task.DialogueTask;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runtime of one call: owns the session state, the single active stage agent and the dialogue task
 * it is running, and serializes every inbound event on the call's own executor.
 * <p>
 * All mutating methods must run on that executor. Inbound entry points ({@link #onUserTurn},
 * {@link #onUserState}, {@link #onToolCall}, {@link #onStreamStopped}) may be called from any thread.
 */
public class CallSession {

    private static final Logger log = LoggerFactory.getLogger(CallSession.class);

    /** Interpreter rounds per turn: the reply plus follow-ups on tool outputs. */
    static final int MAX_TOOL_ROUNDS = 3;
    static final int HISTORY_SIZE = 20;

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final String callId;
    private final SessionState state;
    private final SpeechChannel channel;
    private final TurnInterpreter interpreter;
    private final ResponsePhrases phrases;
    private final StageAgentFactory agentFactory;
    private final Transcript transcript;
    private final UsageCollector usage;
    private final Executor executor;
    private final Duration drainTimeout;

    private Consumer<UserState> userStateListener = s -> { };
    private Consumer<CallSession> closeListener = s -> { };

    private StageAgent activeAgent;
    private DialogueTask<?> activeTask;
    /** Bumped on every agent or task change; stale tool loops compare against it. */
    private int activation;
    private boolean draining;
    private boolean closed;
    private CompletableFuture<Void> pendingSpeech = DONE;
    /** Side effects whose outcome belongs in the result, e.g. a calendar booking. */
    private CompletableFuture<Void> pendingWork = DONE;

    public CallSession(SessionState state, SpeechChannel channel, TurnInterpreter interpreter,
                       ResponsePhrases phrases, StageAgentFactory agentFactory, Executor executor,
                       Duration drainTimeout) {
        this.callId = state.getInput().getCallId();
        this.state = state;
        this.channel = channel;
        this.interpreter = interpreter;
        this.phrases = phrases;
        this.agentFactory = agentFactory;
        this.executor = executor;
        this.drainTimeout = drainTimeout;
        this.transcript = new Transcript(callId);
        this.usage = new UsageCollector();
    }

    // ---- inbound events ----

    public void onUserTurn(String text) {
        execute(() -> handleUserTurn(text));
    }

    public void onUserState(UserState newState) {
        execute(() -> {
            if (!closed) {
                userStateListener.accept(newState);
            }
        });
    }

    /** A tool call issued by the speech pipeline itself rather than by our interpreter. */
    public void onToolCall(ToolCall call) {
        execute(() -> {
            ToolHandler handler = currentHandler();
            if (closed || draining || handler == null) {
                log.debug("[{}] Ignoring external tool call {}", callId, call.getName());
                return;
            }
            int seq = activation;
            invokeTool(handler, call).thenAccept(output -> {
                if (output != null && seq == activation && !draining && !closed) {
                    runInterpreter(ReplyRequest.instructions(null),
                            List.of(new TurnRequest.ToolOutput(call, output)), 1);
                }
            });
        });
    }

    /** The remote side hung up. No drain: there is nobody left to hear it. */
    public void onStreamStopped() {
        execute(this::close);
    }

    public void execute(Runnable action) {
        try {
            executor.execute(() -> {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.error("[{}] Error while handling call event", callId, e);
                }
            });
        } catch (RuntimeException e) {
            log.debug("[{}] Call executor rejected event: {}", callId, e.getMessage());
        }
    }

    private void handleUserTurn(String text) {
        if (closed || draining || StringUtils.isBlank(text)) {
            return;
        }
        transcript.appendUser(text);
        DialogueTask<?> task = activeTask;
        if (task != null && task.userTurnCompleted()) {
            return;
        }
        generateReply(ReplyRequest.userTurn(text));
    }

    // ---- speech ----

    public CompletableFuture<Void> say(String text, boolean allowInterruptions) {
        if (closed || draining || StringUtils.isBlank(text)) {
            return DONE;
        }
        transcript.appendAssistant(text);
        usage.addTtsCharacters(text.length());
        CompletableFuture<Void> playout;
        try {
            playout = channel.speak(text, allowInterruptions);
        } catch (RuntimeException e) {
            log.warn("[{}] Speech channel failed: {}", callId, e.getMessage());
            playout = DONE;
        }
        CompletableFuture<Void> finished = playout.handle((v, e) -> {
            if (e != null) {
                log.warn("[{}] Playout failed: {}", callId, e.getMessage());
            }
            return (Void) null;
        });
        pendingSpeech = CompletableFuture.allOf(pendingSpeech, finished);
        return finished.thenRunAsync(() -> { }, executor);
    }

    /**
     * Runs system-initiated speech with the silence handler muted, so the candidate listening to
     * a long question does not count as being away.
     */
    public CompletableFuture<Void> withSilenceSuppressed(Supplier<CompletableFuture<Void>> speech) {
        state.setSuppressSilence(true);
        return speech.get().whenComplete((v, e) -> state.setSuppressSilence(false));
    }

    public void clearUserTurn() {
        channel.clearUserTurn();
    }

    public void setUserAwayTimeout(Duration timeout) {
        channel.setUserAwayTimeout(timeout);
    }

    public void switchLanguage(String language) {
        state.setLanguage(language);
        channel.switchLanguage(language);
    }

    /**
     * Asks the interpreter for a reply using the instructions and tools of whoever is active, then runs
     * the requested tools. Tool outputs are fed back for at most {@link #MAX_TOOL_ROUNDS} rounds; the
     * loop stops as soon as the active agent or task changes.
     */
    public CompletableFuture<Void> generateReply(ReplyRequest request) {
        return runInterpreter(request, List.of(), 0);
    }

    private CompletableFuture<Void> runInterpreter(ReplyRequest request, List<TurnRequest.ToolOutput> outputs, int round) {
        ToolHandler handler = currentHandler();
        if (closed || draining || handler == null) {
            return DONE;
        }
        int seq = activation;
        String instructions = handler.instructions();
        if (StringUtils.isNotBlank(request.instructions())) {
            instructions = instructions + "\n\n# Now\n" + request.instructions();
        }
        TurnDecision decision;
        try {
            decision = interpreter.interpret(new TurnRequest(callId, state.getLanguage(), instructions,
                    handler.tools(), transcript.recent(HISTORY_SIZE), request.userText(), outputs));
        } catch (RuntimeException e) {
            log.error("[{}] Interpreter failed", callId, e);
            return DONE;
        }
        if (decision == null) {
            return DONE;
        }
        usage.addLlmTokens(decision.promptTokens(), decision.completionTokens());

        CompletableFuture<Void> spoken = say(decision.reply(), request.allowInterruptions());
        if (decision.toolCalls() == null || decision.toolCalls().isEmpty()) {
            return spoken;
        }
        return spoken
                .thenCompose(v -> invokeAll(handler, seq, decision.toolCalls()))
                .thenCompose(results -> {
                    if (results.isEmpty() || round + 1 >= MAX_TOOL_ROUNDS || seq != activation) {
                        return DONE;
                    }
                    return runInterpreter(request.followUp(), results, round + 1);
                });
    }

    private CompletableFuture<List<TurnRequest.ToolOutput>> invokeAll(ToolHandler handler, int seq, List<ToolCall> calls) {
        CompletableFuture<List<TurnRequest.ToolOutput>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (ToolCall call : calls) {
            chain = chain.thenCompose(outputs -> {
                if (seq != activation || closed || draining) {
                    log.debug("[{}] Skipping {}: {} is no longer active", callId, call.getName(), handler.handlerName());
                    return CompletableFuture.completedFuture(outputs);
                }
                return invokeTool(handler, call).thenApply(output -> {
                    if (output != null) {
                        outputs.add(new TurnRequest.ToolOutput(call, output));
                    }
                    return outputs;
                });
            });
        }
        return chain;
    }

    private CompletableFuture<String> invokeTool(ToolHandler handler, ToolCall call) {
        log.info("[{}] Tool {} -> {}", callId, call, handler.handlerName());
        try {
            return handler.invoke(call).exceptionally(e -> {
                log.error("[{}] Tool {} failed", callId, call.getName(), e);
                return null;
            });
        } catch (RuntimeException e) {
            log.error("[{}] Tool {} failed", callId, call.getName(), e);
            return CompletableFuture.completedFuture(null);
        }
    }

    private ToolHandler currentHandler() {
        return activeTask != null ? activeTask : activeAgent;
    }

    // ---- stage agents and tasks ----

    /**
     * Replaces the active stage agent. A spoken transition plays its closing line first.
     */
    public void handOff(StageTransition transition) {
        if (closed || draining) {
            return;
        }
        if (transition.isSpoken()) {
            say(transition.closingUtterance(), false).thenRun(() -> activate(transition.next()));
        } else {
            activate(transition.next());
        }
    }

    public void start(StageAgent initial) {
        execute(() -> activate(initial));
    }

    private void activate(StageAgent next) {
        if (closed || draining) {
            return;
        }
        if (activeTask != null) {
            activeTask.abandon();
        }
        StageAgent previous = activeAgent;
        activeAgent = next;
        activation++;
        log.info("[{}] Stage {} -> {}", callId, previous == null ? "-" : previous.getName().getKey(), next.getName().getKey());
        channel.configureTurnDetection(next.turnSettings());
        next.onEnter();
    }

    public <R> void runTask(DialogueTask<R> task, Consumer<R> onComplete) {
        if (closed || draining) {
            return;
        }
        if (activeTask != null && activeTask != task) {
            activeTask.abandon();
        }
        activeTask = task;
        activation++;
        channel.configureTurnDetection(task.turnSettings());
        task.start(this, onComplete);
    }

    /**
     * Called by a task on completion. The continuation is queued so it runs after the current tool
     * loop has unwound.
     */
    public void taskCompleted(DialogueTask<?> task, Runnable continuation) {
        releaseTask(task);
        execute(() -> {
            if (!closed && !draining) {
                continuation.run();
            }
        });
    }

    public void taskAbandoned(DialogueTask<?> task) {
        releaseTask(task);
    }

    private void releaseTask(DialogueTask<?> task) {
        if (activeTask == task) {
            activeTask = null;
            activation++;
            if (activeAgent != null && !closed) {
                channel.configureTurnDetection(activeAgent.turnSettings());
            }
        }
    }

    // ---- shutdown ----

    /** Speaks a closing line and ends the call once it has played. */
    public CompletableFuture<Void> sayAndShutdown(String closingLine) {
        CompletableFuture<Void> spoken = say(closingLine, false);
        shutdown();
        return spoken;
    }

    /**
     * Makes the drain also wait for {@code work}, so its write-back lands before teardown.
     * Failures of the work are ignored here; the caller logs them.
     */
    public void holdShutdownFor(CompletableFuture<?> work) {
        CompletableFuture<Void> settled = work.handle((v, e) -> (Void) null);
        pendingWork = CompletableFuture.allOf(pendingWork, settled);
    }

    /**
     * Graceful end: lets in-flight utterances and held work finish, bounded by the drain timeout,
     * then closes.
     */
    public void shutdown() {
        if (draining || closed) {
            return;
        }
        draining = true;
        log.info("[{}] Draining call", callId);
        CompletableFuture.allOf(pendingSpeech, pendingWork)
                .completeOnTimeout(null, drainTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((v, e) -> execute(this::close));
    }

    private void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (activeTask != null) {
            activeTask.abandon();
        }
        log.info("[{}] Call closed in stage {}", callId, activeAgent == null ? "-" : activeAgent.getName().getKey());
        closeListener.accept(this);
    }

    void hangup() {
        channel.hangup();
    }

    // ---- accessors ----

    public void setUserStateListener(Consumer<UserState> listener) {
        this.userStateListener = listener;
    }

    public void setCloseListener(Consumer<CallSession> listener) {
        this.closeListener = listener;
    }

    public String getCallId() {
        return callId;
    }

    public SessionState getState() {
        return state;
    }

    public String language() {
        return state.getLanguage();
    }

    public ResponsePhrases getPhrases() {
        return phrases;
    }

    public StageAgentFactory getAgentFactory() {
        return agentFactory;
    }

    public Transcript getTranscript() {
        return transcript;
    }

    public UsageCollector getUsage() {
        return usage;
    }

    public StageAgent getActiveAgent() {
        return activeAgent;
    }

    public DialogueTask<?> getActiveTask() {
        return activeTask;
    }

    public boolean isDraining() {
        return draining;
    }

    public boolean isClosed() {
        return closed;
    }
}
