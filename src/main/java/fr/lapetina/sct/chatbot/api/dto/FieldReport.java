package fr.lapetina.sct.chatbot.api.dto;

/**
 * One field of a settings report. Secret values are already masked.
 */
public record FieldReport(
        String name,
        String type,
        boolean required,
        boolean secret,
        String source,
        Object value,
        String description
) {
}
