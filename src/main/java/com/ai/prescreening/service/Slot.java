package com.ai.prescreening.service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An interview moment with its TTS-friendly Dutch label, e.g. "morgen dinsdag 3 maart om 10 uur".
 * {@code spokenTime} is the calendar's Dutch time ("10 uur", "half 10") and is what gets booked.
 */
public record Slot(LocalDate date, String spokenTime, String label) {

    private static final String[] DAY_NAMES = {
            "maandag", "dinsdag", "woensdag", "donderdag", "vrijdag", "zaterdag", "zondag"
    };
    private static final String[] MONTH_NAMES = {
            "januari", "februari", "maart", "april", "mei", "juni",
            "juli", "augustus", "september", "oktober", "november", "december"
    };

    private static final Pattern FULL_HOUR = Pattern.compile("(\\d{1,2}) uur");
    private static final Pattern HALF_HOUR = Pattern.compile("half (\\d{1,2})");
    private static final Pattern CLOCK_TIME = Pattern.compile("(\\d{1,2})[:.](\\d{2})");

    public static Slot of(LocalDate date, String spokenTime, LocalDate today) {
        return new Slot(date, spokenTime, label(date, spokenTime, "nl", today));
    }

    /**
     * The label in the call's language: "tomorrow Tuesday 3 March at 9:30", "demain mardi 3 mars à 9h30".
     * Unsupported languages get the Dutch label.
     */
    public String labelIn(String language, LocalDate today) {
        return label(date, spokenTime, language, today);
    }

    private static String label(LocalDate date, String spokenTime, String language, LocalDate today) {
        boolean tomorrow = date.equals(today.plusDays(1));
        switch (language == null ? "nl" : language) {
            case "en":
                return (tomorrow ? "tomorrow " : "") + dateLabel(date, language) + " at " + clockTime(spokenTime, language);
            case "fr":
                return (tomorrow ? "demain " : "") + dateLabel(date, language) + " à " + clockTime(spokenTime, language);
            case "de":
                return (tomorrow ? "morgen " : "") + dateLabel(date, language) + " um " + clockTime(spokenTime, language);
            default:
                return (tomorrow ? "morgen " : "") + dateLabel(date) + " om " + spokenTime;
        }
    }

    /** "dinsdag 3 maart" */
    public static String dateLabel(LocalDate date) {
        return dayName(date.getDayOfWeek()) + " " + date.getDayOfMonth() + " " + MONTH_NAMES[date.getMonthValue() - 1];
    }

    /** "Tuesday 3 March", "mardi 3 mars", "Dienstag 3. März"; Dutch for anything else. */
    public static String dateLabel(LocalDate date, String language) {
        if (language == null) {
            return dateLabel(date);
        }
        switch (language) {
            case "en":
            case "fr":
                return date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.forLanguageTag(language))
                        + " " + date.getDayOfMonth() + " "
                        + date.getMonth().getDisplayName(TextStyle.FULL, Locale.forLanguageTag(language));
            case "de":
                return date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.GERMAN)
                        + " " + date.getDayOfMonth() + ". "
                        + date.getMonth().getDisplayName(TextStyle.FULL, Locale.GERMAN);
            default:
                return dateLabel(date);
        }
    }

    static String dayName(DayOfWeek day) {
        return DAY_NAMES[day.getValue() - 1];
    }

    /**
     * Reads the Dutch spoken time as a clock time; "half 10" is 9:30. Unknown formats are kept as is.
     */
    static String clockTime(String spokenTime, String language) {
        String t = spokenTime == null ? "" : spokenTime.trim().toLowerCase();
        int hour;
        int minute;
        Matcher m;
        if ((m = FULL_HOUR.matcher(t)).matches()) {
            hour = Integer.parseInt(m.group(1));
            minute = 0;
        } else if ((m = HALF_HOUR.matcher(t)).matches()) {
            hour = Integer.parseInt(m.group(1)) - 1;
            minute = 30;
        } else if ((m = CLOCK_TIME.matcher(t)).matches()) {
            hour = Integer.parseInt(m.group(1));
            minute = Integer.parseInt(m.group(2));
        } else {
            return spokenTime;
        }
        switch (language) {
            case "fr":
                return minute == 0 ? hour + "h" : hour + "h" + String.format("%02d", minute);
            case "de":
                return hour + ":" + String.format("%02d", minute) + " Uhr";
            default:
                return hour + ":" + String.format("%02d", minute);
        }
    }
}
