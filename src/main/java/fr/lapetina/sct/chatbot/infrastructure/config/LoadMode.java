package fr.lapetina.sct.chatbot.infrastructure.config;

/**
 * How the loader reacts to field failures.
 */
public enum LoadMode {
    /** Stop at the first failing field in declaration order */
    FAIL_FAST,

    /** Evaluate every field and report all failures together */
    COLLECT_ALL
}
