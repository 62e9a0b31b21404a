package com.ai.prescreening.component;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed spoken lines the orchestrator says itself, without going through the interpreter.
 * Lookup falls back to Dutch for unknown languages or keys.
 */
@Component
public class ResponsePhrases {

    public static final String DEFAULT_LANGUAGE = "nl";
    public static final List<String> SUPPORTED_LANGUAGES = List.of("nl", "en", "fr", "de");

    private static final Map<String, Map<String, String>> MESSAGES = new HashMap<>();

    static {
        MESSAGES.put("nl", Map.ofEntries(
                Map.entry("irrelevant_shutdown", "Sorry, ik denk dat dit gesprek niet helemaal vlot verloopt. Als je later toch geinteresseerd bent, neem dan gerust contact op. Nog een fijne dag."),
                Map.entry("recruiter_handoff", "Natuurlijk, ik verbind je door met de recruiter. Een moment."),
                Map.entry("silence_prompt", "Sorry, ik heb je niet goed gehoord. Kan je dat nog eens zeggen?"),
                Map.entry("silence_shutdown", "Ik hoor je helaas niet meer. Als je later toch geinteresseerd bent, neem dan gerust contact op. Nog een fijne dag."),
                Map.entry("screening_unclear", "Geen probleem. Zonder antwoord op deze vraag kan ik helaas niet verder met de screening. Neem gerust later contact op als je geinteresseerd bent. Nog een fijne dag."),
                Map.entry("ready_check", "Ok super, bedankt voor de korte ja en nee vragen. Nu wil ik je graag nog een paar open vragen stellen over je motivatie en ervaring. Neem gerust je tijd om te antwoorden. Ben je er klaar voor?"),
                Map.entry("ready_check_decline", "Geen probleem. Neem gerust later contact op als je geinteresseerd bent. Nog een fijne dag."),
                Map.entry("open_questions_thanks", "Super, bedankt voor je antwoorden."),
                Map.entry("existing_booking", "Je hebt al een afspraak staan op {date}. Je kan dit dan meteen bespreken tijdens dat gesprek. Bedankt voor je tijd en nog een fijne dag."),
                Map.entry("scheduling_invite", "We willen je graag uitnodigen voor een kort gesprek met de recruiter op ons kantoor in {location}. Even kijken wanneer dat zou passen."),
                Map.entry("scheduling_confirm", "Super, dan staat je gesprek gepland op {timeslot}, met de recruiter op ons kantoor in {location} aan de {address}. {followup} Bedankt voor het gesprek, veel succes en nog een fijne dag."),
                Map.entry("scheduling_followup_tomorrow", "Je ontvangt zo meteen nog een bevestiging via WhatsApp."),
                Map.entry("scheduling_followup_later", "Je ontvangt een bevestiging en later ook een reminder via WhatsApp."),
                Map.entry("scheduling_preference", "Ik noteer je voorkeur en geef dit door aan de recruiter. Die neemt zo snel mogelijk contact met je op om een geschikt moment te vinden. Bedankt voor je tijd en nog een fijne dag."),
                Map.entry("recruiter_greeting", "Hallo {name}, je spreekt nu met de recruiter. Hoe kan ik je helpen?"),
                Map.entry("recruiter_goodbye", "Bedankt voor het gesprek. Ik neem alles mee en we nemen zo snel mogelijk contact op. Nog een fijne dag."),
                Map.entry("alternative_thanks", "Bedankt voor je antwoorden. Ik geef dit door aan de recruiter en die neemt zo snel mogelijk contact met je op. Nog een fijne dag."),
                Map.entry("alternative_not_interested", "Helemaal oke, geen probleem. Als je in de toekomst toch interesse hebt, neem dan gerust contact op. Nog een fijne dag."),
                Map.entry("voicemail_with_name", "Hallo {name}, je spreekt met Anna van Its You. We belden je in verband met je sollicitatie. Bel ons gerust terug wanneer het je past. Nog een fijne dag."),
                Map.entry("voicemail_without_name", "Hallo, je spreekt met Anna van Its You. We belden je in verband met je sollicitatie. Bel ons gerust terug wanneer het je past. Nog een fijne dag."),
                Map.entry("proxy_detected", "Ah oke, geen probleem. Dit gesprek is bedoeld voor de kandidaat persoonlijk. Zou je kunnen vragen of zij of hij ons terugbelt wanneer het past? Bedankt en nog een fijne dag."),
                Map.entry("candidate_not_available", "Helemaal oke. Neem gerust contact op als je even tijd hebt. Nog een fijne dag.")));
        MESSAGES.put("en", Map.ofEntries(
                Map.entry("irrelevant_shutdown", "Sorry, I don't think this conversation is going very smoothly. If you're interested later, feel free to get in touch. Have a nice day."),
                Map.entry("recruiter_handoff", "Of course, let me transfer you to the recruiter. One moment."),
                Map.entry("silence_prompt", "Sorry, I didn't catch that. Could you say that again?"),
                Map.entry("silence_shutdown", "I can't hear you anymore unfortunately. If you're interested later, feel free to get in touch. Have a nice day."),
                Map.entry("screening_unclear", "No problem. Without an answer to this question I unfortunately can't continue with the screening. Feel free to get in touch later if you're interested. Have a nice day."),
                Map.entry("ready_check", "Great, thanks for the short yes and no questions. Now I'd like to ask you a few open questions about your motivation and experience. Take your time to answer. Are you ready?"),
                Map.entry("ready_check_decline", "No problem. Feel free to get in touch later if you're interested. Have a nice day."),
                Map.entry("open_questions_thanks", "Great, thanks for your answers."),
                Map.entry("existing_booking", "You already have an appointment on {date}. You can discuss this during that meeting. Thanks for your time and have a nice day."),
                Map.entry("scheduling_invite", "We'd like to invite you for a short interview with the recruiter at our office in {location}. Let's see when that would work."),
                Map.entry("scheduling_confirm", "Great, your interview is scheduled for {timeslot}, with the recruiter at our office in {location} at {address}. {followup} Thanks for the conversation, good luck and have a nice day."),
                Map.entry("scheduling_followup_tomorrow", "You'll receive a confirmation via WhatsApp shortly."),
                Map.entry("scheduling_followup_later", "You'll receive a confirmation and later a reminder via WhatsApp."),
                Map.entry("scheduling_preference", "I'll note your preference and pass it on to the recruiter. They'll get in touch as soon as possible to find a suitable time. Thanks for your time and have a nice day."),
                Map.entry("recruiter_greeting", "Hello {name}, you're now speaking with the recruiter. How can I help you?"),
                Map.entry("recruiter_goodbye", "Thanks for the conversation. I'll take everything along and we'll get in touch as soon as possible. Have a nice day."),
                Map.entry("alternative_thanks", "Thanks for your answers. I'll pass this on to the recruiter and they'll get in touch as soon as possible. Have a nice day."),
                Map.entry("alternative_not_interested", "Totally fine, no problem. If you're interested in the future, feel free to get in touch. Have a nice day."),
                Map.entry("voicemail_with_name", "Hello {name}, this is Anna from Its You. We called you regarding your application. Feel free to call us back when it suits you. Have a nice day."),
                Map.entry("voicemail_without_name", "Hello, this is Anna from Its You. We called you regarding your application. Feel free to call us back when it suits you. Have a nice day."),
                Map.entry("proxy_detected", "Ah okay, no problem. This conversation is meant for the candidate personally. Could you ask them to call us back when it suits them? Thanks and have a nice day."),
                Map.entry("candidate_not_available", "Totally fine. Feel free to get in touch when you have a moment. Have a nice day.")));
        MESSAGES.put("fr", Map.ofEntries(
                Map.entry("irrelevant_shutdown", "Désolé, je pense que cette conversation ne se passe pas très bien. Si vous êtes intéressé plus tard, n'hésitez pas à nous contacter. Bonne journée."),
                Map.entry("recruiter_handoff", "Bien sûr, je vous transfère au recruteur. Un instant."),
                Map.entry("silence_prompt", "Désolé, je n'ai pas bien entendu. Pouvez-vous répéter ?"),
                Map.entry("silence_shutdown", "Je ne vous entends plus malheureusement. Si vous êtes intéressé plus tard, n'hésitez pas à nous contacter. Bonne journée."),
                Map.entry("screening_unclear", "Pas de problème. Sans réponse à cette question, je ne peux malheureusement pas continuer la sélection. N'hésitez pas à nous contacter plus tard si vous êtes intéressé. Bonne journée."),
                Map.entry("ready_check", "Super, merci pour les courtes questions oui ou non. Maintenant j'aimerais vous poser quelques questions ouvertes sur votre motivation et votre expérience. Prenez votre temps pour répondre. Êtes-vous prêt ?"),
                Map.entry("ready_check_decline", "Pas de problème. N'hésitez pas à nous contacter plus tard si vous êtes intéressé. Bonne journée."),
                Map.entry("open_questions_thanks", "Super, merci pour vos réponses."),
                Map.entry("existing_booking", "Vous avez déjà un rendez-vous le {date}. Vous pourrez en discuter lors de cette rencontre. Merci pour votre temps et bonne journée."),
                Map.entry("scheduling_invite", "Nous aimerions vous inviter pour un court entretien avec le recruteur dans notre bureau à {location}. Voyons quand cela vous conviendrait."),
                Map.entry("scheduling_confirm", "Super, votre entretien est prévu le {timeslot}, avec le recruteur dans notre bureau à {location}, {address}. {followup} Merci pour la conversation, bonne chance et bonne journée."),
                Map.entry("scheduling_followup_tomorrow", "Vous recevrez une confirmation par WhatsApp sous peu."),
                Map.entry("scheduling_followup_later", "Vous recevrez une confirmation et plus tard un rappel par WhatsApp."),
                Map.entry("scheduling_preference", "Je note votre préférence et je la transmets au recruteur. Il vous contactera dès que possible pour trouver un moment qui convient. Merci pour votre temps et bonne journée."),
                Map.entry("recruiter_greeting", "Bonjour {name}, vous parlez maintenant avec le recruteur. Comment puis-je vous aider ?"),
                Map.entry("recruiter_goodbye", "Merci pour la conversation. Je prends tout en note et nous vous contacterons dès que possible. Bonne journée."),
                Map.entry("alternative_thanks", "Merci pour vos réponses. Je transmets cela au recruteur et il vous contactera dès que possible. Bonne journée."),
                Map.entry("alternative_not_interested", "Tout à fait, pas de problème. Si vous êtes intéressé à l'avenir, n'hésitez pas à nous contacter. Bonne journée."),
                Map.entry("voicemail_with_name", "Bonjour {name}, c'est Anna de Its You. Nous vous avons appelé au sujet de votre candidature. N'hésitez pas à nous rappeler quand cela vous convient. Bonne journée."),
                Map.entry("voicemail_without_name", "Bonjour, c'est Anna de Its You. Nous vous avons appelé au sujet de votre candidature. N'hésitez pas à nous rappeler quand cela vous convient. Bonne journée."),
                Map.entry("proxy_detected", "Ah d'accord, pas de problème. Cette conversation est destinée au candidat personnellement. Pourriez-vous lui demander de nous rappeler quand cela lui convient ? Merci et bonne journée."),
                Map.entry("candidate_not_available", "Tout à fait. N'hésitez pas à nous contacter quand vous avez un moment. Bonne journée.")));
        MESSAGES.put("de", Map.ofEntries(
                Map.entry("irrelevant_shutdown", "Tut mir leid, ich glaube dieses Gespräch läuft nicht ganz reibungslos. Wenn Sie später Interesse haben, melden Sie sich gerne. Einen schönen Tag noch."),
                Map.entry("recruiter_handoff", "Natürlich, ich verbinde Sie mit dem Recruiter. Einen Moment bitte."),
                Map.entry("silence_prompt", "Entschuldigung, ich habe Sie nicht verstanden. Könnten Sie das noch einmal sagen?"),
                Map.entry("silence_shutdown", "Ich kann Sie leider nicht mehr hören. Wenn Sie später Interesse haben, melden Sie sich gerne. Einen schönen Tag noch."),
                Map.entry("screening_unclear", "Kein Problem. Ohne eine Antwort auf diese Frage kann ich leider nicht mit dem Screening fortfahren. Melden Sie sich gerne später, wenn Sie interessiert sind. Einen schönen Tag noch."),
                Map.entry("ready_check", "Super, danke für die kurzen Ja- und Nein-Fragen. Jetzt möchte ich Ihnen gerne ein paar offene Fragen zu Ihrer Motivation und Erfahrung stellen. Nehmen Sie sich ruhig Zeit zum Antworten. Sind Sie bereit?"),
                Map.entry("ready_check_decline", "Kein Problem. Melden Sie sich gerne später, wenn Sie interessiert sind. Einen schönen Tag noch."),
                Map.entry("open_questions_thanks", "Super, danke für Ihre Antworten."),
                Map.entry("existing_booking", "Sie haben bereits einen Termin am {date}. Sie können das dann direkt in diesem Gespräch besprechen. Danke für Ihre Zeit und einen schönen Tag noch."),
                Map.entry("scheduling_invite", "Wir möchten Sie gerne zu einem kurzen Gespräch mit dem Recruiter in unserem Büro in {location} einladen. Schauen wir mal, wann das passen würde."),
                Map.entry("scheduling_confirm", "Super, Ihr Gespräch ist geplant für {timeslot}, mit dem Recruiter in unserem Büro in {location}, {address}. {followup} Danke für das Gespräch, viel Erfolg und einen schönen Tag noch."),
                Map.entry("scheduling_followup_tomorrow", "Sie erhalten in Kürze eine Bestätigung per WhatsApp."),
                Map.entry("scheduling_followup_later", "Sie erhalten eine Bestätigung und später auch eine Erinnerung per WhatsApp."),
                Map.entry("scheduling_preference", "Ich notiere Ihre Präferenz und gebe sie an den Recruiter weiter. Er wird sich so schnell wie möglich bei Ihnen melden, um einen passenden Termin zu finden. Danke für Ihre Zeit und einen schönen Tag noch."),
                Map.entry("recruiter_greeting", "Hallo {name}, Sie sprechen jetzt mit dem Recruiter. Wie kann ich Ihnen helfen?"),
                Map.entry("recruiter_goodbye", "Danke für das Gespräch. Ich nehme alles mit und wir melden uns so schnell wie möglich. Einen schönen Tag noch."),
                Map.entry("alternative_thanks", "Danke für Ihre Antworten. Ich gebe das an den Recruiter weiter und er wird sich so schnell wie möglich bei Ihnen melden. Einen schönen Tag noch."),
                Map.entry("alternative_not_interested", "Völlig in Ordnung, kein Problem. Wenn Sie in Zukunft Interesse haben, melden Sie sich gerne. Einen schönen Tag noch."),
                Map.entry("voicemail_with_name", "Hallo {name}, hier spricht Anna von Its You. Wir haben Sie wegen Ihrer Bewerbung angerufen. Rufen Sie uns gerne zurück, wenn es Ihnen passt. Einen schönen Tag noch."),
                Map.entry("voicemail_without_name", "Hallo, hier spricht Anna von Its You. Wir haben Sie wegen Ihrer Bewerbung angerufen. Rufen Sie uns gerne zurück, wenn es Ihnen passt. Einen schönen Tag noch."),
                Map.entry("proxy_detected", "Ah okay, kein Problem. Dieses Gespräch ist für den Kandidaten persönlich gedacht. Könnten Sie ihn oder sie bitten, uns zurückzurufen, wenn es passt? Danke und einen schönen Tag noch."),
                Map.entry("candidate_not_available", "Völlig in Ordnung. Melden Sie sich gerne, wenn Sie einen Moment Zeit haben. Einen schönen Tag noch.")));
    }

    public static boolean isSupported(String language) {
        return SUPPORTED_LANGUAGES.contains(language);
    }

    public String irrelevantShutdown(String language) {
        return message(language, "irrelevant_shutdown");
    }

    public String recruiterHandoff(String language) {
        return message(language, "recruiter_handoff");
    }

    public String silencePrompt(String language) {
        return message(language, "silence_prompt");
    }

    public String silenceShutdown(String language) {
        return message(language, "silence_shutdown");
    }

    public String screeningUnclear(String language) {
        return message(language, "screening_unclear");
    }

    public String readyCheck(String language) {
        return message(language, "ready_check");
    }

    public String readyCheckDecline(String language) {
        return message(language, "ready_check_decline");
    }

    public String openQuestionsThanks(String language) {
        return message(language, "open_questions_thanks");
    }

    public String existingBooking(String language, String date) {
        return message(language, "existing_booking").replace("{date}", nullToEmpty(date));
    }

    public String schedulingInvite(String language, String location) {
        return message(language, "scheduling_invite").replace("{location}", nullToEmpty(location));
    }

    public String schedulingConfirm(String language, String timeslot, String location, String address, boolean tomorrow) {
        String followup = message(language, tomorrow ? "scheduling_followup_tomorrow" : "scheduling_followup_later");
        return message(language, "scheduling_confirm")
                .replace("{timeslot}", nullToEmpty(timeslot))
                .replace("{location}", nullToEmpty(location))
                .replace("{address}", nullToEmpty(address))
                .replace("{followup}", followup);
    }

    public String schedulingPreference(String language) {
        return message(language, "scheduling_preference");
    }

    public String recruiterGreeting(String language, String name) {
        return message(language, "recruiter_greeting").replace("{name}", nullToEmpty(name));
    }

    public String recruiterGoodbye(String language) {
        return message(language, "recruiter_goodbye");
    }

    public String alternativeThanks(String language) {
        return message(language, "alternative_thanks");
    }

    public String alternativeNotInterested(String language) {
        return message(language, "alternative_not_interested");
    }

    public String voicemail(String language, String name) {
        if (name == null || name.isBlank()) {
            return message(language, "voicemail_without_name");
        }
        return message(language, "voicemail_with_name").replace("{name}", name);
    }

    public String proxyDetected(String language) {
        return message(language, "proxy_detected");
    }

    public String candidateNotAvailable(String language) {
        return message(language, "candidate_not_available");
    }

    String message(String language, String key) {
        Map<String, String> messages = MESSAGES.getOrDefault(language, MESSAGES.get(DEFAULT_LANGUAGE));
        String template = messages.get(key);
        if (template == null) {
            template = MESSAGES.get(DEFAULT_LANGUAGE).getOrDefault(key, key);
        }
        return template;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
