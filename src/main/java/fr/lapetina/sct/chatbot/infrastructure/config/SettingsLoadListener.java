package fr.lapetina.sct.chatbot.infrastructure.config;

import fr.lapetina.sct.chatbot.infrastructure.config.exception.OverrideFileException;
import fr.lapetina.sct.chatbot.infrastructure.config.exception.SettingsLoadException;

import java.time.Duration;

/**
 * Listener interface for settings load outcomes.
 */
public interface SettingsLoadListener {

    /**
     * Called once settings have been loaded and validated.
     *
     * @param settings The loaded settings
     * @param elapsed Time spent loading
     */
    void onLoaded(Settings settings, Duration elapsed);

    /**
     * Called when loading fails, before the failure is thrown to the caller.
     */
    default void onLoadFailed(SettingsLoadException failure, Duration elapsed) {
    }

    /**
     * Called when the override file exists but cannot be read, before the failure is thrown.
     */
    default void onOverrideFileFailed(OverrideFileException failure, Duration elapsed) {
    }
}
