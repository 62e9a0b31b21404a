package com.ai.prescreening.service;

import com.ai.prescreening.conversation.ChatMessage;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.conversation.YesNoResult;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Offline interpreter for local development and for running without an LLM key.
 * Picks tools from the active tool set with the yes/no classifier and a few keyword rules,
 * and reads questions straight from the active instructions. Dutch only.
 */
@Service
public class RuleBasedTurnInterpreter implements TurnInterpreter {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedTurnInterpreter.class);

    private static final Pattern QUESTION = Pattern.compile("Question: \"([^\"]+)\"");
    private static final Pattern SLOT_LINE = Pattern.compile("- (.+) \\(slot_date=([0-9-]+), slot_time=([^)]+)\\)");
    private static final Pattern RECRUITER_REQUEST = Pattern.compile(
            "\\b(recruiter|echte persoon|een mens|medewerker|real person|human)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern GOODBYE = Pattern.compile(
            "\\b(dag|daag|doei|tot ziens|bedankt|dank je|bye|goodbye|thanks)\\b", Pattern.CASE_INSENSITIVE);

    static final String GREETING = "Hallo, met Anna, de digitale assistent van Its You. Heb je even tijd voor een paar korte vragen?";
    static final String CONSENT_GREETING = "Hallo, met Anna, de digitale assistent van Its You. Is het ok dat dit gesprek wordt opgenomen, en heb je even tijd voor een paar korte vragen?";
    static final String ASK_YES_NO = "Sorry, kan je gewoon met ja of nee antwoorden?";
    static final String REPEAT = "Sorry, dat heb ik niet goed begrepen. Kan je dat herhalen?";
    static final String ALTERNATIVES = "Dat is jammer. We hebben wel nog andere vacatures. Heb je daar interesse in?";
    static final String RECRUITER_NOTED = "Ik noteer dat, en ik zorg dat je het antwoord krijgt.";

    private final YesNoClassifier classifier;

    public RuleBasedTurnInterpreter(YesNoClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public TurnDecision interpret(TurnRequest request) {
        Set<String> tools = request.tools().stream()
                .map(ToolDefinition::functionName)
                .collect(Collectors.toSet());

        if (!request.toolOutputs().isEmpty()) {
            return afterTools(request, tools);
        }
        if (!request.hasUserText()) {
            return initiate(request, tools);
        }

        String text = request.userText().trim();
        if (tools.contains("escalate_to_recruiter") && RECRUITER_REQUEST.matcher(text).find()) {
            return TurnDecision.call(ToolCall.of("escalate_to_recruiter"));
        }
        YesNoResult yesNo = classifier.classify(text);
        log.debug("[{}] Offline interpreter: '{}' classified as {}", request.callId(), text, yesNo);

        if (tools.contains("candidate_ready")) {
            return greeting(request, tools, yesNo);
        }
        if (tools.contains("mark_pass")) {
            return knockout(text, yesNo);
        }
        if (tools.contains("record_answer")) {
            return TurnDecision.call(ToolCall.of("record_answer", Map.of("answer_summary", text)));
        }
        if (tools.contains("confirm_ready")) {
            return readyCheck(text, yesNo);
        }
        if (tools.contains("confirm_timeslot")) {
            return yesNo == YesNoResult.NO
                    ? TurnDecision.call(ToolCall.of("schedule_with_recruiter", Map.of("preference", text)))
                    : TurnDecision.call(ToolCall.of("get_available_timeslots"));
        }
        if (tools.contains("candidate_interested")) {
            return alternative(yesNo);
        }
        if (tools.contains("end_conversation")) {
            return GOODBYE.matcher(text).find() || yesNo == YesNoResult.NO
                    ? TurnDecision.call(ToolCall.of("end_conversation"))
                    : TurnDecision.say(RECRUITER_NOTED);
        }
        return TurnDecision.say(REPEAT);
    }

    private TurnDecision initiate(TurnRequest request, Set<String> tools) {
        Matcher question = QUESTION.matcher(request.instructions());
        if (question.find()) {
            return TurnDecision.say(question.group(1));
        }
        if (tools.contains("get_available_timeslots")) {
            return TurnDecision.call(ToolCall.of("get_available_timeslots"));
        }
        if (tools.contains("candidate_interested")) {
            return TurnDecision.say(ALTERNATIVES);
        }
        return TurnDecision.empty();
    }

    private TurnDecision greeting(TurnRequest request, Set<String> tools, YesNoResult yesNo) {
        boolean greeted = request.history().stream().anyMatch(m -> "assistant".equals(m.getRole()));
        if (!greeted) {
            return TurnDecision.say(tools.contains("record_consent") ? CONSENT_GREETING : GREETING);
        }
        switch (yesNo) {
            case YES:
                return tools.contains("record_consent")
                        ? TurnDecision.call(ToolCall.of("record_consent"), ToolCall.of("candidate_ready"))
                        : TurnDecision.call(ToolCall.of("candidate_ready"));
            case NO:
                return TurnDecision.call(ToolCall.of("candidate_not_available"));
            default:
                return TurnDecision.say(REPEAT);
        }
    }

    private TurnDecision knockout(String text, YesNoResult yesNo) {
        switch (yesNo) {
            case YES:
                return TurnDecision.call(ToolCall.of("mark_pass", Map.of("answer_summary", text)));
            case NO:
                return TurnDecision.call(ToolCall.of("confirm_fail", Map.of("answer_summary", text)));
            default:
                return TurnDecision.say(ASK_YES_NO);
        }
    }

    private TurnDecision readyCheck(String text, YesNoResult yesNo) {
        switch (yesNo) {
            case YES:
                return TurnDecision.call(ToolCall.of("confirm_ready"));
            case NO:
                return TurnDecision.call(ToolCall.of("mark_irrelevant", Map.of("answer_summary", text)));
            default:
                return TurnDecision.say(ASK_YES_NO);
        }
    }

    private TurnDecision alternative(YesNoResult yesNo) {
        switch (yesNo) {
            case YES:
                return TurnDecision.call(ToolCall.of("candidate_interested"));
            case NO:
                return TurnDecision.call(ToolCall.of("candidate_not_interested"));
            default:
                return TurnDecision.say(ASK_YES_NO);
        }
    }

    /**
     * Follow-up round: system warnings are turned into a re-ask, slot lists into a proposal or,
     * when the candidate already named a day, a confirmation.
     */
    private TurnDecision afterTools(TurnRequest request, Set<String> tools) {
        TurnRequest.ToolOutput last = request.toolOutputs().get(request.toolOutputs().size() - 1);
        String output = StringUtils.defaultString(last.output());
        if (output.startsWith("[SYSTEM]")) {
            Matcher question = QUESTION.matcher(request.instructions());
            return TurnDecision.say(question.find() ? REPEAT + " " + question.group(1) : REPEAT);
        }
        if (tools.contains("confirm_timeslot")) {
            return proposeOrConfirm(request, output);
        }
        return TurnDecision.empty();
    }

    private TurnDecision proposeOrConfirm(TurnRequest request, String output) {
        Matcher slots = SLOT_LINE.matcher(output);
        String lastUser = pendingUserMessage(request.history()).toLowerCase();
        String first = null;
        StringBuilder proposal = new StringBuilder();
        while (slots.find()) {
            String label = slots.group(1);
            String day = label.replace("morgen ", "").split(" ")[0];
            if (lastUser.contains(day)) {
                return TurnDecision.call(ToolCall.of("confirm_timeslot", Map.of(
                        "timeslot", label, "slot_date", slots.group(2), "slot_time", slots.group(3))));
            }
            if (first == null) {
                first = label;
            } else {
                proposal.append(", ");
            }
            proposal.append(label);
        }
        if (first == null) {
            return TurnDecision.say(REPEAT);
        }
        return TurnDecision.say("Ik kan je de volgende momenten voorstellen: " + proposal + ". Welke dag past jou?");
    }

    /** The candidate's last utterance, if nothing was said after it. */
    private static String pendingUserMessage(List<ChatMessage> history) {
        if (history.isEmpty()) {
            return "";
        }
        ChatMessage last = history.get(history.size() - 1);
        return "user".equals(last.getRole()) ? last.getContent() : "";
    }
}
