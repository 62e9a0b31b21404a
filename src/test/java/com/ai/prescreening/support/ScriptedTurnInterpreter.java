package com.ai.prescreening.support;

import com.ai.prescreening.service.TurnDecision;
import com.ai.prescreening.service.TurnInterpreter;
import com.ai.prescreening.service.TurnRequest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Replays queued decisions in order and records every request. Says nothing once the script runs out.
 */
public class ScriptedTurnInterpreter implements TurnInterpreter {

    public final List<TurnRequest> requests = new ArrayList<>();
    private final Deque<TurnDecision> script = new ArrayDeque<>();

    public ScriptedTurnInterpreter then(TurnDecision decision) {
        script.add(decision);
        return this;
    }

    @Override
    public TurnDecision interpret(TurnRequest request) {
        requests.add(request);
        TurnDecision next = script.poll();
        return next == null ? TurnDecision.empty() : next;
    }
}
