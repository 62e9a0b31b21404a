package com.ai.prescreening.agent;

public enum StageName {
    GREETING("greeting"),
    SCREENING("screening"),
    OPEN_QUESTIONS("open_questions"),
    SCHEDULING("scheduling"),
    ALTERNATIVE("alternative"),
    RECRUITER("recruiter");

    private final String key;

    StageName(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return the stage for a debug start override, or null when the key is blank or unknown
     */
    public static StageName fromKey(String key) {
        if (key == null) {
            return null;
        }
        String normalized = key.trim().toLowerCase();
        for (StageName s : values()) {
            if (s.key.equals(normalized)) {
                return s;
            }
        }
        return null;
    }
}
