package fr.lapetina.sct.chatbot.infrastructure.config;

import fr.lapetina.sct.chatbot.infrastructure.config.exception.OverrideFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the optional local override file.
 *
 * Supports:
 * - dotenv files ({@code KEY=VALUE} lines, the default format)
 * - flat YAML mappings ({@code .yaml} / {@code .yml}), where sequences become structural lists
 *
 * A missing file yields no overrides. The file is always closed before returning.
 */
public final class OverrideFileReader {

    private static final Logger log = LoggerFactory.getLogger(OverrideFileReader.class);

    private static final String EXPORT_PREFIX = "export ";

    /**
     * Reads all key/value pairs of the file.
     *
     * @param path The override file location
     * @return Raw values by key, empty if the file does not exist
     * @throws OverrideFileException if the file exists but cannot be read or parsed
     */
    public Map<String, RawValue> read(Path path) {
        if (!Files.exists(path)) {
            log.debug("No override file at {}", path);
            return Map.of();
        }
        if (!Files.isRegularFile(path)) {
            throw new OverrideFileException("Override file is not a regular file: " + path);
        }

        Map<String, RawValue> values;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            values = isYaml(path) ? readYaml(path, reader) : readDotenv(path, reader);
        } catch (IOException e) {
            throw new OverrideFileException("Failed to read override file: " + path, e);
        }

        log.info("Loaded {} entries from override file: {}", values.size(), path);
        return values;
    }

    private static boolean isYaml(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString().toLowerCase(Locale.ROOT) : "";
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    // ==================== YAML ====================

    private Map<String, RawValue> readYaml(Path path, Reader reader) {
        Object document;
        try {
            document = newYaml().load(reader);
        } catch (YAMLException e) {
            throw new OverrideFileException("Invalid YAML in override file: " + path, e);
        }

        if (document == null) {
            return Map.of();
        }
        if (!(document instanceof Map)) {
            throw new OverrideFileException("Override file must contain a mapping of keys to values: " + path);
        }

        Map<String, RawValue> values = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) document).entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();

            if (value == null) {
                // "KEY:" with nothing after it leaves the field to its default
                continue;
            }
            if (value instanceof Map) {
                throw new OverrideFileException("Nested mapping for key " + key + " in override file: " + path);
            }
            if (value instanceof List) {
                values.put(key, RawValue.ofList(toElements(path, key, (List<?>) value)));
            } else {
                values.put(key, RawValue.ofText(String.valueOf(value)));
            }
        }
        return values;
    }

    /**
     * Plain scalars stay text ({@code 1.10}, {@code 0123}, {@code off}, dates); only an empty
     * plain scalar resolves to null. Typing is left to {@link ValueCoercer}.
     */
    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        Resolver resolver = new Resolver() {
            @Override
            protected void addImplicitResolvers() {
                addImplicitResolver(Tag.NULL, EMPTY, null);
            }
        };
        return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
                dumperOptions, loaderOptions, resolver);
    }

    private static List<String> toElements(Path path, String key, List<?> sequence) {
        List<String> elements = new ArrayList<>(sequence.size());
        for (Object element : sequence) {
            if (element instanceof Map || element instanceof List) {
                throw new OverrideFileException("Nested structure in list " + key + " of override file: " + path);
            }
            elements.add(element == null ? "" : String.valueOf(element));
        }
        return elements;
    }

    // ==================== DOTENV ====================

    private Map<String, RawValue> readDotenv(Path path, BufferedReader reader) throws IOException {
        Map<String, RawValue> values = new LinkedHashMap<>();
        String line;
        int lineNumber = 0;

        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 && line.startsWith("\uFEFF")) {
                line = line.substring(1);
            }

            String entry = line.strip();
            if (entry.isEmpty() || entry.startsWith("#")) {
                continue;
            }
            if (entry.startsWith(EXPORT_PREFIX)) {
                entry = entry.substring(EXPORT_PREFIX.length()).stripLeading();
            }

            int separator = entry.indexOf('=');
            if (separator <= 0) {
                log.warn("Ignoring malformed line {} in override file {}", lineNumber, path);
                continue;
            }

            String key = entry.substring(0, separator).strip();
            String value = parseValue(entry.substring(separator + 1).strip());
            // Later assignments win, as with a shell sourcing the file
            values.put(key, RawValue.ofText(value));
        }
        return values;
    }

    static String parseValue(String value) {
        if (value.isEmpty()) {
            return value;
        }

        char quote = value.charAt(0);
        if (quote == '"') {
            return parseDoubleQuoted(value);
        }
        if (quote == '\'') {
            int end = value.indexOf('\'', 1);
            if (end > 0) {
                return value.substring(1, end);
            }
        }

        int comment = value.indexOf(" #");
        return comment >= 0 ? value.substring(0, comment).stripTrailing() : value;
    }

    private static String parseDoubleQuoted(String value) {
        StringBuilder result = new StringBuilder(value.length());
        for (int i = 1; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"') {
                return result.toString();
            }
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(++i);
                switch (next) {
                    case 'n' -> result.append('\n');
                    case 't' -> result.append('\t');
                    case 'r' -> result.append('\r');
                    case '"' -> result.append('"');
                    case '\\' -> result.append('\\');
                    default -> result.append('\\').append(next);
                }
            } else {
                result.append(c);
            }
        }
        // No closing quote: keep the text as written
        return value;
    }
}
