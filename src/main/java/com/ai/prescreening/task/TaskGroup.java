package com.ai.prescreening.task;

import com.ai.prescreening.service.CallSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs an ordered list of dialogue tasks one after the other.
 * <p>
 * Tasks are created lazily so entries never reached leave no trace. While a task runs, the candidate
 * may go back to an already answered entry; that entry is asked again and the interrupted one is
 * restarted afterwards. A result matching {@link #abortWhen} stops the group before the remaining
 * entries start.
 */
public class TaskGroup<R> {

    private static final Logger log = LoggerFactory.getLogger(TaskGroup.class);

    private record Entry<R>(String id, String description, Supplier<? extends DialogueTask<R>> factory) {
    }

    private final List<Entry<R>> entries = new ArrayList<>();
    private final Map<String, R> results = new LinkedHashMap<>();
    private Predicate<R> abortWhen = r -> false;
    private boolean regression = true;

    private CallSession session;
    private Consumer<TaskGroupResult<R>> onComplete;
    private boolean finished;

    public TaskGroup<R> add(String id, String description, Supplier<? extends DialogueTask<R>> factory) {
        entries.add(new Entry<>(id, description, factory));
        return this;
    }

    public TaskGroup<R> abortWhen(Predicate<R> predicate) {
        this.abortWhen = predicate;
        return this;
    }

    public TaskGroup<R> withoutRegression() {
        this.regression = false;
        return this;
    }

    public void run(CallSession session, Consumer<TaskGroupResult<R>> onComplete) {
        this.session = session;
        this.onComplete = onComplete;
        if (entries.isEmpty()) {
            finish(false);
            return;
        }
        runEntry(0, 1);
    }

    /**
     * @param continueAt entry to run once this one completes
     */
    private void runEntry(int index, int continueAt) {
        Entry<R> entry = entries.get(index);
        DialogueTask<R> task = entry.factory().get();

        if (regression) {
            List<String> answered = new ArrayList<>();
            for (int i = 0; i < index; i++) {
                if (results.containsKey(entries.get(i).id())) {
                    answered.add(entries.get(i).id());
                }
            }
            if (!answered.isEmpty()) {
                task.allowRevisit(answered, targetId -> {
                    task.abandon();
                    runEntry(indexOf(targetId), index);
                });
            }
        }

        log.debug("[{}] Group entry {} ({})", session.getCallId(), entry.id(), entry.description());
        session.runTask(task, result -> {
            results.put(entry.id(), result);
            if (abortWhen.test(result)) {
                log.info("[{}] Group aborted at {}", session.getCallId(), entry.id());
                finish(true);
                return;
            }
            if (continueAt >= entries.size()) {
                finish(false);
            } else {
                runEntry(continueAt, continueAt + 1);
            }
        });
    }

    private int indexOf(String id) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).id().equals(id)) {
                return i;
            }
        }
        throw new IllegalArgumentException("No group entry " + id);
    }

    private void finish(boolean aborted) {
        if (finished) {
            return;
        }
        finished = true;
        onComplete.accept(new TaskGroupResult<>(new LinkedHashMap<>(results), aborted));
    }
}
