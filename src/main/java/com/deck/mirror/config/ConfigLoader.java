package com.deck.mirror.config;

import com.deck.mirror.similarity.SimilarityIndexes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Builds a {@link MirrorConfig} from {@code ~/.deck-mirror/config} ({@code KEY=value}
 * lines) with environment variables of the same name taking precedence.
 *
 * <p>A missing file is not an error. An unreadable file is logged and ignored.
 * A value that does not parse is an {@link IllegalArgumentException} naming the key.</p>
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String REMOTE_API_KEY = "MOCHI_API_KEY";
    public static final String LLM_API_KEY = "OPENROUTER_API_KEY";
    public static final String REMOTE_BASE_URL = "DECK_MIRROR_REMOTE_URL";
    public static final String REMOTE_TIMEOUT_SECONDS = "DECK_MIRROR_REMOTE_TIMEOUT_SECONDS";
    public static final String PAGE_SIZE = "DECK_MIRROR_PAGE_SIZE";
    public static final String LLM_BASE_URL = "DECK_MIRROR_LLM_URL";
    public static final String LLM_TIMEOUT_SECONDS = "DECK_MIRROR_LLM_TIMEOUT_SECONDS";
    public static final String CHAT_MODEL = "DECK_MIRROR_CHAT_MODEL";
    public static final String EMBEDDING_MODEL = "DECK_MIRROR_EMBEDDING_MODEL";
    public static final String EMBEDDING_BATCH_SIZE = "DECK_MIRROR_EMBEDDING_BATCH_SIZE";
    public static final String WINDOW_SIZE = "DECK_MIRROR_WINDOW_SIZE";
    public static final String SIMILARITY_THRESHOLD = "DECK_MIRROR_SIMILARITY_THRESHOLD";
    public static final String SIMILARITY_BACKEND = "DECK_MIRROR_SIMILARITY_BACKEND";
    public static final String APPROXIMATE_MIN_CARDS = "DECK_MIRROR_APPROXIMATE_MIN_CARDS";
    public static final String NEIGHBOR_CAP = "DECK_MIRROR_NEIGHBOR_CAP";
    public static final String QUALITY_THRESHOLD = "DECK_MIRROR_QUALITY_THRESHOLD";
    public static final String CACHE_DIR = "DECK_MIRROR_CACHE_DIR";
    public static final String CACHE_ENABLED = "DECK_MIRROR_CACHE_ENABLED";

    private final Path configFile;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(MirrorConfig.defaultHome().resolve("config"), System.getenv());
    }

    public ConfigLoader(Path configFile, Map<String, String> environment) {
        this.configFile = configFile;
        this.environment = environment;
    }

    public Path getConfigFile() {
        return configFile;
    }

    public MirrorConfig load() {
        Properties values = readFile();
        environment.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                values.setProperty(key, value);
            }
        });

        MirrorConfig.Builder builder = MirrorConfig.builder();
        apply(values, REMOTE_API_KEY, builder::remoteApiKey);
        apply(values, LLM_API_KEY, builder::llmApiKey);
        apply(values, REMOTE_BASE_URL, builder::remoteBaseUrl);
        apply(values, REMOTE_TIMEOUT_SECONDS, v -> builder.remoteTimeout(Duration.ofSeconds(parseInt(REMOTE_TIMEOUT_SECONDS, v))));
        apply(values, PAGE_SIZE, v -> builder.pageSize(parseInt(PAGE_SIZE, v)));
        apply(values, LLM_BASE_URL, builder::llmBaseUrl);
        apply(values, LLM_TIMEOUT_SECONDS, v -> builder.llmTimeout(Duration.ofSeconds(parseInt(LLM_TIMEOUT_SECONDS, v))));
        apply(values, CHAT_MODEL, builder::chatModel);
        apply(values, EMBEDDING_MODEL, builder::embeddingModel);
        apply(values, EMBEDDING_BATCH_SIZE, v -> builder.embeddingBatchSize(parseInt(EMBEDDING_BATCH_SIZE, v)));
        apply(values, WINDOW_SIZE, v -> builder.windowSize(parseInt(WINDOW_SIZE, v)));
        apply(values, SIMILARITY_THRESHOLD, v -> builder.similarityThreshold(parseDouble(SIMILARITY_THRESHOLD, v)));
        apply(values, SIMILARITY_BACKEND, v -> builder.similarityBackend(parseBackend(v)));
        apply(values, APPROXIMATE_MIN_CARDS, v -> builder.approximateMinCards(parseInt(APPROXIMATE_MIN_CARDS, v)));
        apply(values, NEIGHBOR_CAP, v -> builder.neighborCap(parseInt(NEIGHBOR_CAP, v)));
        apply(values, QUALITY_THRESHOLD, v -> builder.qualityThreshold(parseInt(QUALITY_THRESHOLD, v)));
        apply(values, CACHE_DIR, v -> builder.cacheDir(Path.of(v)));
        apply(values, CACHE_ENABLED, v -> builder.cacheEnabled(Boolean.parseBoolean(v)));

        MirrorConfig config = builder.build();
        log.debug("config.loaded file={} config={}", configFile, config);
        return config;
    }

    /**
     * Stores one value in the config file, keeping the other entries.
     *
     * @return true when the file was written
     */
    public boolean save(String key, String value) {
        Properties values = readFile();
        values.setProperty(key, value);
        try {
            Files.createDirectories(configFile.toAbsolutePath().getParent());
            try (Writer writer = Files.newBufferedWriter(configFile, StandardCharsets.UTF_8)) {
                values.store(writer, "deck-mirror configuration");
            }
            log.info("config.saved file={} key={}", configFile, key);
            return true;
        } catch (IOException e) {
            log.warn("config.save_failed file={} error={}", configFile, e.getMessage());
            return false;
        }
    }

    private Properties readFile() {
        Properties values = new Properties();
        if (!Files.exists(configFile)) {
            return values;
        }
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            values.load(reader);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("config.load_failed file={} error={}", configFile, e.getMessage());
            return new Properties();
        }
        return values;
    }

    private static void apply(Properties values, String key, Consumer<String> setter) {
        String value = values.getProperty(key);
        if (value != null && !value.isBlank()) {
            setter.accept(value.strip());
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'");
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'");
        }
    }

    private static SimilarityIndexes.Backend parseBackend(String value) {
        try {
            return SimilarityIndexes.Backend.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(SIMILARITY_BACKEND + " must be one of AUTO, EXACT, APPROXIMATE, got '" + value + "'");
        }
    }
}
