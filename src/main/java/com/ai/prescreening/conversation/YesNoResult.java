package com.ai.prescreening.conversation;

/**
 * Result of YES/NO intent classification.
 * Maps all user variations (ja, yes, yeah, nee, no, nope, not now) into a boolean or unknown.
 */
public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}
