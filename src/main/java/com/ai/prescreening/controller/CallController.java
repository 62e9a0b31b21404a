package com.ai.prescreening.controller;

import com.ai.prescreening.service.ConversationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/calls")
public class CallController {

    private static final Logger log = LoggerFactory.getLogger(CallController.class);

    private final ConversationOrchestrator orchestrator;

    public CallController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping
    public Map<String, List<String>> activeCalls() {
        return Map.of("calls", orchestrator.activeCallIds());
    }

    /**
     * The recruiter finished talking to the candidate; the agent says goodbye and ends the call.
     */
    @PostMapping("/{callId}/recruiter/finished")
    public ResponseEntity<Void> recruiterFinished(@PathVariable String callId) {
        if (!orchestrator.recruiterFinished(callId)) {
            log.warn("[{}] Recruiter finish for unknown call", callId);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().build();
    }
}
