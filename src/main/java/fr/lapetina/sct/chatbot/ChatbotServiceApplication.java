package fr.lapetina.sct.chatbot;

import fr.lapetina.sct.chatbot.api.SettingsReport;
import fr.lapetina.sct.chatbot.infrastructure.config.Settings;
import fr.lapetina.sct.chatbot.infrastructure.config.SettingsLoader;
import fr.lapetina.sct.chatbot.infrastructure.config.exception.OverrideFileException;
import fr.lapetina.sct.chatbot.infrastructure.config.exception.SettingsLoadException;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.ChatbotSettingsSchema;
import fr.lapetina.sct.chatbot.infrastructure.metrics.SettingsMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point for the SCT chatbot service.
 *
 * Loads the settings exactly once and hands them to the components that need them.
 * Invalid settings abort startup.
 */
public class ChatbotServiceApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChatbotServiceApplication.class);

    static final String METRICS_PREFIX = "sct_chatbot";

    private final Settings settings;
    private final SettingsMetrics metrics;

    public ChatbotServiceApplication(Path overrideFile) {
        this(overrideFile, System.getenv(), new SettingsMetrics(METRICS_PREFIX));
    }

    ChatbotServiceApplication(Path overrideFile, Map<String, String> env, SettingsMetrics metrics) {
        log.info("Starting SCT chatbot service...");

        SettingsLoader loader = SettingsLoader.builder()
                .overrideFile(overrideFile)
                .listener(metrics)
                .build();

        try {
            this.settings = loader.load(ChatbotSettingsSchema.definition(), env);
        } catch (RuntimeException e) {
            metrics.close();
            throw e;
        }

        if (settings.monitoring().metricsEnabled()) {
            this.metrics = metrics;
        } else {
            log.info("Metrics disabled, closing metrics registry");
            metrics.close();
            this.metrics = null;
        }

        log.info("Loaded settings for {} v{} (environment={}, production={})",
                settings.app().name(), settings.app().version(),
                settings.app().environment(), settings.isProduction());
        if (log.isDebugEnabled()) {
            log.debug("Effective settings:\n{}", new SettingsReport().toJson(settings));
        }
    }

    /**
     * Returns the settings of this process.
     */
    public Settings getSettings() {
        return settings;
    }

    public Optional<SettingsMetrics> getMetrics() {
        return Optional.ofNullable(metrics);
    }

    @Override
    public void close() {
        if (metrics != null) {
            metrics.close();
        }
        log.info("SCT chatbot service shut down");
    }

    public static void main(String[] args) {
        Path overrideFile = Paths.get(args.length > 0 ? args[0] : ".env");

        try (ChatbotServiceApplication app = new ChatbotServiceApplication(overrideFile)) {
            log.info("SCT chatbot service configured on {}:{}",
                    app.getSettings().server().host(), app.getSettings().server().port());
        } catch (SettingsLoadException e) {
            log.error("Invalid settings, aborting startup\n{}", e.getMessage());
            System.exit(1);
        } catch (OverrideFileException e) {
            log.error("Unusable override file, aborting startup", e);
            System.exit(1);
        }
    }
}
