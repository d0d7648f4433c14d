package fr.lapetina.sct.chatbot.infrastructure.config;

import fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldSpec;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldType;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.SettingsSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Loaded, validated and immutable runtime settings.
 *
 * Only {@link SettingsLoader} creates instances. One instance is built at process
 * entry and handed to every component that needs it; it is never mutated, so it can
 * be read from any number of threads without synchronization.
 *
 * Grouped views such as {@link #server()} and the derived predicates
 * {@link #isProduction()} / {@link #isDevelopment()} are computed on each call and
 * expect the fields of the chatbot service schema.
 */
public final class Settings {

    private static final String ENVIRONMENT = "ENVIRONMENT";

    private final SettingsSchema schema;
    private final Map<String, Object> values;
    private final Map<String, ValueSource> sources;

    Settings(SettingsSchema schema, Map<String, Object> values, Map<String, ValueSource> sources) {
        this.schema = schema;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    public SettingsSchema getSchema() {
        return schema;
    }

    /**
     * Returns all values by field name, in schema order.
     */
    public Map<String, Object> asMap() {
        return values;
    }

    public Object get(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown settings field: " + name);
        }
        return value;
    }

    public ValueSource getSource(String name) {
        ValueSource source = sources.get(name);
        if (source == null) {
            throw new IllegalArgumentException("Unknown settings field: " + name);
        }
        return source;
    }

    public String getString(String name) {
        return typed(name, FieldType.STRING, String.class);
    }

    public int getInt(String name) {
        return typed(name, FieldType.INTEGER, Integer.class);
    }

    public double getDouble(String name) {
        return typed(name, FieldType.FLOAT, Double.class);
    }

    public boolean getBoolean(String name) {
        return typed(name, FieldType.BOOLEAN, Boolean.class);
    }

    @SuppressWarnings("unchecked")
    public List<String> getList(String name) {
        return typed(name, FieldType.STRING_LIST, List.class);
    }

    @SuppressWarnings("unchecked")
    public Optional<String> getOptional(String name) {
        return typed(name, FieldType.OPTIONAL_STRING, Optional.class);
    }

    private <T> T typed(String name, FieldType expected, Class<T> javaType) {
        FieldSpec field = schema.getField(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown settings field: " + name));
        if (field.type() != expected) {
            throw new IllegalArgumentException("Field " + name + " is a " + field.type().getDisplayName()
                    + ", not a " + expected.getDisplayName());
        }
        return javaType.cast(values.get(name));
    }

    // ==================== DERIVED PROPERTIES ====================

    /**
     * True when the environment name is "production", ignoring case.
     */
    public boolean isProduction() {
        return getString(ENVIRONMENT).equalsIgnoreCase("production");
    }

    /**
     * True when the environment name is "development", ignoring case.
     */
    public boolean isDevelopment() {
        return getString(ENVIRONMENT).equalsIgnoreCase("development");
    }

    // ==================== GROUPED VIEWS ====================

    public AppSettings app() {
        return new AppSettings(
                getString("APP_NAME"),
                getString("APP_VERSION"),
                getString("APP_DESCRIPTION"),
                getString(ENVIRONMENT),
                getBoolean("DEBUG")
        );
    }

    public ServerSettings server() {
        return new ServerSettings(
                getString("HOST"),
                getInt("PORT"),
                getInt("WORKERS"),
                getBoolean("RELOAD"),
                getString("API_V1_PREFIX")
        );
    }

    public CorsSettings cors() {
        return new CorsSettings(
                getList("CORS_ORIGINS"),
                getBoolean("CORS_ALLOW_CREDENTIALS"),
                getList("CORS_ALLOW_METHODS"),
                getList("CORS_ALLOW_HEADERS")
        );
    }

    public AzureAdSettings azureAd() {
        return new AzureAdSettings(
                getString("AZURE_TENANT_ID"),
                getString("AZURE_CLIENT_ID"),
                getString("AZURE_CLIENT_SECRET")
        );
    }

    public AzureOpenAiSettings azureOpenAi() {
        return new AzureOpenAiSettings(
                getString("AZURE_OPENAI_ENDPOINT"),
                getString("AZURE_OPENAI_API_KEY"),
                getString("AZURE_OPENAI_DEPLOYMENT"),
                getString("AZURE_OPENAI_API_VERSION"),
                getDouble("AZURE_OPENAI_TEMPERATURE"),
                getInt("AZURE_OPENAI_MAX_TOKENS")
        );
    }

    public SentinelSettings sentinel() {
        return new SentinelSettings(
                getString("AZURE_WORKSPACE_ID"),
                getString("AZURE_LOG_ANALYTICS_ENDPOINT")
        );
    }

    public RedisSettings redis() {
        return new RedisSettings(
                getString("REDIS_HOST"),
                getInt("REDIS_PORT"),
                getOptional("REDIS_PASSWORD"),
                getBoolean("REDIS_SSL"),
                getInt("REDIS_DB"),
                getInt("REDIS_MAX_CONNECTIONS")
        );
    }

    public JwtSettings jwt() {
        return new JwtSettings(
                getString("JWT_ALGORITHM"),
                getString("JWT_AUDIENCE"),
                getString("JWT_ISSUER"),
                getInt("JWT_LEEWAY")
        );
    }

    public RateLimitSettings rateLimit() {
        return new RateLimitSettings(
                getBoolean("RATE_LIMIT_ENABLED"),
                getInt("RATE_LIMIT_PER_MINUTE"),
                getInt("RATE_LIMIT_PER_HOUR")
        );
    }

    public ConversationSettings conversation() {
        return new ConversationSettings(
                getInt("CONVERSATION_TIMEOUT_MINUTES"),
                getInt("MAX_CONVERSATION_HISTORY"),
                getInt("MAX_MESSAGE_LENGTH"),
                getInt("CONTEXT_WINDOW_SIZE")
        );
    }

    public LoggingSettings logging() {
        return new LoggingSettings(getString("LOG_LEVEL"), getString("LOG_FORMAT"));
    }

    public MonitoringSettings monitoring() {
        return new MonitoringSettings(
                getOptional("APPLICATIONINSIGHTS_CONNECTION_STRING"),
                getBoolean("METRICS_ENABLED"),
                getBoolean("ENABLE_TRACING")
        );
    }

    public FeatureSettings features() {
        return new FeatureSettings(getBoolean("FEATURE_WEBSOCKET_ENABLED"));
    }

    public TestingSettings testing() {
        return new TestingSettings(
                getBoolean("MOCK_OPENAI"),
                getBoolean("MOCK_SENTINEL"),
                getBoolean("TEST_MODE")
        );
    }

    /**
     * Equality is field-for-field over values; where a value came from is not compared.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Settings)) {
            return false;
        }
        return values.equals(((Settings) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "Settings{", "}");
        for (FieldSpec field : schema.getFields()) {
            joiner.add(field.name() + "=" + field.display(values.get(field.name())));
        }
        return joiner.toString();
    }

    /**
     * Application identity.
     */
    public record AppSettings(String name, String version, String description, String environment, boolean debug) {

        public boolean isProduction() {
            return environment.equalsIgnoreCase("production");
        }

        public boolean isDevelopment() {
            return environment.equalsIgnoreCase("development");
        }
    }

    /**
     * HTTP server binding and API routing.
     */
    public record ServerSettings(String host, int port, int workers, boolean reload, String apiV1Prefix) {
    }

    /**
     * CORS policy.
     */
    public record CorsSettings(
            List<String> origins,
            boolean allowCredentials,
            List<String> allowMethods,
            List<String> allowHeaders
    ) {
    }

    /**
     * Azure AD application identity.
     */
    public record AzureAdSettings(String tenantId, String clientId, String clientSecret) {

        @Override
        public String toString() {
            return "AzureAdSettings[tenantId=" + tenantId + ", clientId=" + clientId
                    + ", clientSecret=" + FieldSpec.MASKED_VALUE + "]";
        }
    }

    /**
     * Azure OpenAI model access.
     */
    public record AzureOpenAiSettings(
            String endpoint,
            String apiKey,
            String deployment,
            String apiVersion,
            double temperature,
            int maxTokens
    ) {

        @Override
        public String toString() {
            return "AzureOpenAiSettings[endpoint=" + endpoint + ", apiKey=" + FieldSpec.MASKED_VALUE
                    + ", deployment=" + deployment + ", apiVersion=" + apiVersion
                    + ", temperature=" + temperature + ", maxTokens=" + maxTokens + "]";
        }
    }

    /**
     * Microsoft Sentinel / Log Analytics access.
     */
    public record SentinelSettings(String workspaceId, String logAnalyticsEndpoint) {
    }

    /**
     * Redis connection.
     */
    public record RedisSettings(
            String host,
            int port,
            Optional<String> password,
            boolean ssl,
            int db,
            int maxConnections
    ) {

        @Override
        public String toString() {
            return "RedisSettings[host=" + host + ", port=" + port
                    + ", password=" + (password.isPresent() ? FieldSpec.MASKED_VALUE : "<unset>")
                    + ", ssl=" + ssl + ", db=" + db + ", maxConnections=" + maxConnections + "]";
        }
    }

    /**
     * JWT validation parameters.
     */
    public record JwtSettings(String algorithm, String audience, String issuer, int leewaySeconds) {
    }

    public record RateLimitSettings(boolean enabled, int perMinute, int perHour) {
    }

    public record ConversationSettings(
            int timeoutMinutes,
            int maxHistory,
            int maxMessageLength,
            int contextWindowSize
    ) {
    }

    public record LoggingSettings(String level, String format) {
    }

    public record MonitoringSettings(
            Optional<String> applicationInsightsConnectionString,
            boolean metricsEnabled,
            boolean tracingEnabled
    ) {

        @Override
        public String toString() {
            return "MonitoringSettings[applicationInsightsConnectionString="
                    + (applicationInsightsConnectionString.isPresent() ? FieldSpec.MASKED_VALUE : "<unset>")
                    + ", metricsEnabled=" + metricsEnabled + ", tracingEnabled=" + tracingEnabled + "]";
        }
    }

    public record FeatureSettings(boolean websocketEnabled) {
    }

    public record TestingSettings(boolean mockOpenAi, boolean mockSentinel, boolean testMode) {
    }
}
