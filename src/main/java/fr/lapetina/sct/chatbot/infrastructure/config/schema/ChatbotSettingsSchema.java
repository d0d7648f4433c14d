package fr.lapetina.sct.chatbot.infrastructure.config.schema;

import java.util.List;

import static fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldSpec.optionalString;
import static fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldSpec.required;
import static fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldSpec.withDefault;
import static fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldType.BOOLEAN;
import static fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldType.FLOAT;
import static fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldType.INTEGER;
import static fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldType.STRING;
import static fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldType.STRING_LIST;

/**
 * Settings schema of the SCT chatbot service.
 *
 * Field names are the environment variable names. Fields are grouped by concern:
 * application identity, server binding, API routing, CORS policy, Azure credentials,
 * Redis connection, JWT validation, rate limits, conversation tunables, logging,
 * monitoring, feature flags and test overrides.
 */
public final class ChatbotSettingsSchema {

    public static final List<String> LOG_LEVELS = List.of("DEBUG", "INFO", "WARNING", "ERROR", "CRITICAL");

    private static final SettingsSchema DEFINITION = SettingsSchema.builder()
            // Application
            .field(withDefault("APP_NAME", STRING, "sct-chatbot-service", "Application name"))
            .field(withDefault("APP_VERSION", STRING, "1.0.0", "Application version"))
            .field(withDefault("APP_DESCRIPTION", STRING,
                    "SCT Chatbot Microservice - AI-Powered Security Assistant", "Application description"))
            .field(withDefault("ENVIRONMENT", STRING, "development", "Environment name"))
            .field(withDefault("DEBUG", BOOLEAN, false, "Debug mode"))

            // Server
            .field(withDefault("HOST", STRING, "0.0.0.0", "Server host"))
            .field(withDefault("PORT", INTEGER, 8000, "Server port"))
            .field(withDefault("WORKERS", INTEGER, 4, "Number of worker processes"))
            .field(withDefault("RELOAD", BOOLEAN, false, "Enable auto-reload"))

            // API
            .field(withDefault("API_V1_PREFIX", STRING, "/api/v1", "API version 1 prefix"))

            // CORS
            .field(withDefault("CORS_ORIGINS", STRING_LIST, List.of("http://localhost:4200"),
                    "Allowed CORS origins")
                    .validatedBy(Validators.trimmedList()))
            .field(withDefault("CORS_ALLOW_CREDENTIALS", BOOLEAN, true, "Allow credentials"))
            .field(withDefault("CORS_ALLOW_METHODS", STRING_LIST,
                    List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"), "Allowed HTTP methods"))
            .field(withDefault("CORS_ALLOW_HEADERS", STRING_LIST, List.of("*"), "Allowed headers"))

            // Azure AD
            .field(required("AZURE_TENANT_ID", STRING, "Azure AD tenant ID"))
            .field(required("AZURE_CLIENT_ID", STRING, "Azure AD client ID"))
            .field(required("AZURE_CLIENT_SECRET", STRING, "Azure AD client secret").asSecret())

            // Azure OpenAI
            .field(required("AZURE_OPENAI_ENDPOINT", STRING, "Azure OpenAI endpoint"))
            .field(required("AZURE_OPENAI_API_KEY", STRING, "Azure OpenAI API key").asSecret())
            .field(withDefault("AZURE_OPENAI_DEPLOYMENT", STRING, "gpt-4o", "Model deployment name"))
            .field(withDefault("AZURE_OPENAI_API_VERSION", STRING, "2024-02-15-preview",
                    "Azure OpenAI API version"))
            .field(withDefault("AZURE_OPENAI_TEMPERATURE", FLOAT, 0.7, "Model temperature"))
            .field(withDefault("AZURE_OPENAI_MAX_TOKENS", INTEGER, 2000, "Max tokens"))

            // Microsoft Sentinel
            .field(required("AZURE_WORKSPACE_ID", STRING, "Log Analytics workspace ID"))
            .field(withDefault("AZURE_LOG_ANALYTICS_ENDPOINT", STRING, "https://api.loganalytics.io/v1",
                    "Log Analytics endpoint"))

            // Redis
            .field(required("REDIS_HOST", STRING, "Redis host"))
            .field(withDefault("REDIS_PORT", INTEGER, 6380, "Redis port"))
            .field(optionalString("REDIS_PASSWORD", "Redis password").asSecret())
            .field(withDefault("REDIS_SSL", BOOLEAN, true, "Use SSL for Redis"))
            .field(withDefault("REDIS_DB", INTEGER, 0, "Redis database number"))
            .field(withDefault("REDIS_MAX_CONNECTIONS", INTEGER, 50, "Max Redis connections"))

            // Security
            .field(withDefault("JWT_ALGORITHM", STRING, "RS256", "JWT algorithm"))
            .field(withDefault("JWT_AUDIENCE", STRING, "api://chatbot-service", "JWT audience"))
            .field(required("JWT_ISSUER", STRING, "JWT issuer"))
            .field(withDefault("JWT_LEEWAY", INTEGER, 10, "JWT validation leeway in seconds"))

            // Rate limiting
            .field(withDefault("RATE_LIMIT_ENABLED", BOOLEAN, true, "Enable rate limiting"))
            .field(withDefault("RATE_LIMIT_PER_MINUTE", INTEGER, 60, "Requests per minute"))
            .field(withDefault("RATE_LIMIT_PER_HOUR", INTEGER, 1000, "Requests per hour"))

            // Conversation
            .field(withDefault("CONVERSATION_TIMEOUT_MINUTES", INTEGER, 60, "Conversation timeout in minutes"))
            .field(withDefault("MAX_CONVERSATION_HISTORY", INTEGER, 100, "Max messages in conversation history"))
            .field(withDefault("MAX_MESSAGE_LENGTH", INTEGER, 2000, "Max message length in characters"))
            .field(withDefault("CONTEXT_WINDOW_SIZE", INTEGER, 10, "Context window size for AI processing"))

            // Logging
            .field(withDefault("LOG_LEVEL", STRING, "INFO", "Logging level")
                    .validatedBy(Validators.oneOfIgnoreCase(LOG_LEVELS.toArray(new String[0]))))
            .field(withDefault("LOG_FORMAT", STRING, "json", "Log format (json or text)"))

            // Monitoring
            .field(optionalString("APPLICATIONINSIGHTS_CONNECTION_STRING",
                    "Application Insights connection string").asSecret())
            .field(withDefault("METRICS_ENABLED", BOOLEAN, true, "Enable metrics"))
            .field(withDefault("ENABLE_TRACING", BOOLEAN, true, "Enable distributed tracing"))

            // Feature flags
            .field(withDefault("FEATURE_WEBSOCKET_ENABLED", BOOLEAN, true, "Enable WebSocket support"))

            // Testing
            .field(withDefault("MOCK_OPENAI", BOOLEAN, false, "Mock Azure OpenAI for testing"))
            .field(withDefault("MOCK_SENTINEL", BOOLEAN, false, "Mock Sentinel for testing"))
            .field(withDefault("TEST_MODE", BOOLEAN, false, "Enable test mode"))
            .build();

    private ChatbotSettingsSchema() {
        // Utility class
    }

    public static SettingsSchema definition() {
        return DEFINITION;
    }
}
