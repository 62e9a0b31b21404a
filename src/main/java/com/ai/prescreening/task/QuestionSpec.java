package com.ai.prescreening.task;

/**
 * @param responseMessage fixed line spoken after the answer is recorded, empty for none
 */
public record QuestionSpec(String id, String text, String description, String responseMessage) {
}
