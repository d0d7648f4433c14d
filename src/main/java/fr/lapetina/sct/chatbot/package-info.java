/**
 * SCT Chatbot Service - typed settings layer of the chatbot back end.
 *
 * <p>Settings are read from the process environment and an optional local override file,
 * coerced into typed values, validated and frozen into one immutable
 * {@link fr.lapetina.sct.chatbot.infrastructure.config.Settings} object at process entry.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Settings settings = SettingsLoader.builder()
 *         .overrideFile(Path.of(".env"))
 *         .build()
 *         .load(ChatbotSettingsSchema.definition());
 *
 * int port = settings.server().port();
 * boolean production = settings.isProduction();
 * }</pre>
 *
 * @see fr.lapetina.sct.chatbot.ChatbotServiceApplication
 * @see fr.lapetina.sct.chatbot.infrastructure.config.SettingsLoader
 */
package fr.lapetina.sct.chatbot;
