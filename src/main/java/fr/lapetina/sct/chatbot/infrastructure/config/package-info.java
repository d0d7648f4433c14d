/**
 * Settings loading.
 *
 * <p>This package turns the process environment and an optional override file into an
 * immutable {@link fr.lapetina.sct.chatbot.infrastructure.config.Settings} instance.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.sct.chatbot.infrastructure.config.SettingsLoader} - Schema-driven loading pipeline</li>
 *   <li>{@link fr.lapetina.sct.chatbot.infrastructure.config.ValueCoercer} - Text to typed value conversion</li>
 *   <li>{@link fr.lapetina.sct.chatbot.infrastructure.config.OverrideFileReader} - dotenv and YAML override files</li>
 *   <li>{@link fr.lapetina.sct.chatbot.infrastructure.config.SettingsLoadListener} - Callback for load outcomes</li>
 * </ul>
 *
 * <h2>Precedence</h2>
 * <p>Environment variables win over the override file, which wins over declared defaults.
 */
package fr.lapetina.sct.chatbot.infrastructure.config;
