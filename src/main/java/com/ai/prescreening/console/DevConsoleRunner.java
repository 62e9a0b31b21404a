package com.ai.prescreening.console;

import com.ai.prescreening.conversation.DevSessionInputs;
import com.ai.prescreening.conversation.UserState;
import com.ai.prescreening.service.CallSession;
import com.ai.prescreening.service.ConversationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Interactive call against the development input. Each line typed is a candidate turn;
 * {@code /away} and {@code /present} simulate the presence signal, {@code /quit} hangs up.
 */
@Component
@ConditionalOnProperty(name = "prescreening.dev.console.enabled", havingValue = "true")
public class DevConsoleRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DevConsoleRunner.class);

    private final ConversationOrchestrator orchestrator;

    @Value("${prescreening.dev.start-agent:}")
    private String startAgent;

    public DevConsoleRunner(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(String... args) throws IOException {
        ConsoleSpeechChannel channel = new ConsoleSpeechChannel(System.out);
        CallSession call = orchestrator.startCall(DevSessionInputs.defaultInput(startAgent), channel);
        log.info("[{}] Console call started. Say something to begin (/quit to hang up)", call.getCallId());

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while (!channel.isHungUp() && (line = in.readLine()) != null) {
            switch (line.trim()) {
                case "/quit":
                    call.onStreamStopped();
                    return;
                case "/away":
                    call.onUserState(UserState.AWAY);
                    break;
                case "/present":
                    call.onUserState(UserState.PRESENT);
                    break;
                default:
                    call.onUserTurn(line);
                    break;
            }
        }
    }
}
