package com.ai.prescreening.config;

import com.ai.prescreening.service.LlmService;
import com.ai.prescreening.service.RuleBasedTurnInterpreter;
import com.ai.prescreening.service.TurnInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class InterpreterConfig {

    private static final Logger log = LoggerFactory.getLogger(InterpreterConfig.class);

    /**
     * The LLM when an API key is configured, otherwise the offline rule-based interpreter.
     */
    @Bean
    @Primary
    public TurnInterpreter turnInterpreter(LlmService llmService, RuleBasedTurnInterpreter ruleBased) {
        if (llmService.isConfigured()) {
            log.info("Using OpenAI turn interpreter");
            return llmService;
        }
        log.warn("openai.api-key not set, using the offline rule-based interpreter");
        return ruleBased;
    }
}
