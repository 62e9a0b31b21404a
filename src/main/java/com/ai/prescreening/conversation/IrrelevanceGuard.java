package com.ai.prescreening.conversation;

/**
 * Shared irrelevance counter contract. Every stage and task reports an off-topic turn here;
 * the counter lives on the {@link SessionState} so it survives phase changes.
 */
public final class IrrelevanceGuard {

    public static final String DEFAULT_SUFFIX = "to answer the question";

    private IrrelevanceGuard() {
    }

    public static Check check(SessionState state) {
        return check(state, DEFAULT_SUFFIX);
    }

    /**
     * Counts one irrelevant turn. Below the cap the result carries a system note telling the
     * model to warn the candidate; at the cap the caller must force a terminal outcome.
     */
    public static Check check(SessionState state, String suffix) {
        int count = state.incrementIrrelevant();
        if (count >= SessionState.MAX_IRRELEVANT) {
            return Check.LIMIT_REACHED;
        }
        int remaining = SessionState.MAX_IRRELEVANT - count;
        return Check.warning("[SYSTEM] Irrelevant answer " + count + "/" + SessionState.MAX_IRRELEVANT
                + ". " + remaining + " chance(s) left. Politely but clearly ask the candidate " + suffix + ".");
    }

    public static final class Check {

        static final Check LIMIT_REACHED = new Check(true, null);

        private final boolean limitReached;
        private final String warning;

        private Check(boolean limitReached, String warning) {
            this.limitReached = limitReached;
            this.warning = warning;
        }

        static Check warning(String text) {
            return new Check(false, text);
        }

        public boolean isLimitReached() {
            return limitReached;
        }

        public String getWarning() {
            return warning;
        }
    }
}
