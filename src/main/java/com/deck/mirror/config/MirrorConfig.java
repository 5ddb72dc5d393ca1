package com.deck.mirror.config;

import com.deck.mirror.similarity.SimilarityIndexes;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration passed explicitly to each component at construction.
 * Validated on {@link Builder#build()}.
 */
public class MirrorConfig {

    public static final String DEFAULT_REMOTE_BASE_URL = "https://app.mochi.cards/api";
    public static final String DEFAULT_LLM_BASE_URL = "https://openrouter.ai/api/v1";
    public static final String DEFAULT_CHAT_MODEL = "google/gemini-2.5-flash";
    public static final String DEFAULT_EMBEDDING_MODEL = "openai/text-embedding-3-small";

    private static final Duration DEFAULT_REMOTE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_LLM_TIMEOUT = Duration.ofSeconds(60);
    private static final int DEFAULT_PAGE_SIZE = 100;
    private static final int DEFAULT_EMBEDDING_BATCH_SIZE = 100;
    private static final int DEFAULT_WINDOW_SIZE = 10;
    private static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;
    private static final int DEFAULT_APPROXIMATE_MIN_CARDS = 2000;
    private static final int DEFAULT_NEIGHBOR_CAP = 100;
    private static final int DEFAULT_QUALITY_THRESHOLD = 7;

    private final String remoteBaseUrl;
    private final String remoteApiKey;
    private final Duration remoteTimeout;
    private final int pageSize;
    private final String llmBaseUrl;
    private final String llmApiKey;
    private final Duration llmTimeout;
    private final String chatModel;
    private final String embeddingModel;
    private final int embeddingBatchSize;
    private final int windowSize;
    private final double similarityThreshold;
    private final SimilarityIndexes.Backend similarityBackend;
    private final int approximateMinCards;
    private final int neighborCap;
    private final int qualityThreshold;
    private final Path cacheDir;
    private final boolean cacheEnabled;

    private MirrorConfig(Builder builder) {
        this.remoteBaseUrl = builder.remoteBaseUrl;
        this.remoteApiKey = builder.remoteApiKey;
        this.remoteTimeout = builder.remoteTimeout;
        this.pageSize = builder.pageSize;
        this.llmBaseUrl = builder.llmBaseUrl;
        this.llmApiKey = builder.llmApiKey;
        this.llmTimeout = builder.llmTimeout;
        this.chatModel = builder.chatModel;
        this.embeddingModel = builder.embeddingModel;
        this.embeddingBatchSize = builder.embeddingBatchSize;
        this.windowSize = builder.windowSize;
        this.similarityThreshold = builder.similarityThreshold;
        this.similarityBackend = builder.similarityBackend;
        this.approximateMinCards = builder.approximateMinCards;
        this.neighborCap = builder.neighborCap;
        this.qualityThreshold = builder.qualityThreshold;
        this.cacheDir = builder.cacheDir;
        this.cacheEnabled = builder.cacheEnabled;
    }

    public static MirrorConfig defaults() {
        return builder().build();
    }

    public static Path defaultHome() {
        return Path.of(System.getProperty("user.home"), ".deck-mirror");
    }

    public String getRemoteBaseUrl() {
        return remoteBaseUrl;
    }

    /**
     * May be null; remote commands require it.
     */
    public String getRemoteApiKey() {
        return remoteApiKey;
    }

    public Duration getRemoteTimeout() {
        return remoteTimeout;
    }

    public int getPageSize() {
        return pageSize;
    }

    public String getLlmBaseUrl() {
        return llmBaseUrl;
    }

    /**
     * May be null; dedupe and curate require it.
     */
    public String getLlmApiKey() {
        return llmApiKey;
    }

    public Duration getLlmTimeout() {
        return llmTimeout;
    }

    public String getChatModel() {
        return chatModel;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public int getEmbeddingBatchSize() {
        return embeddingBatchSize;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public SimilarityIndexes.Backend getSimilarityBackend() {
        return similarityBackend;
    }

    public int getApproximateMinCards() {
        return approximateMinCards;
    }

    public int getNeighborCap() {
        return neighborCap;
    }

    public int getQualityThreshold() {
        return qualityThreshold;
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public Builder toBuilder() {
        return builder()
                .remoteBaseUrl(remoteBaseUrl)
                .remoteApiKey(remoteApiKey)
                .remoteTimeout(remoteTimeout)
                .pageSize(pageSize)
                .llmBaseUrl(llmBaseUrl)
                .llmApiKey(llmApiKey)
                .llmTimeout(llmTimeout)
                .chatModel(chatModel)
                .embeddingModel(embeddingModel)
                .embeddingBatchSize(embeddingBatchSize)
                .windowSize(windowSize)
                .similarityThreshold(similarityThreshold)
                .similarityBackend(similarityBackend)
                .approximateMinCards(approximateMinCards)
                .neighborCap(neighborCap)
                .qualityThreshold(qualityThreshold)
                .cacheDir(cacheDir)
                .cacheEnabled(cacheEnabled);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "MirrorConfig{" +
                "remoteBaseUrl='" + remoteBaseUrl + '\'' +
                ", remoteApiKey=" + (remoteApiKey != null ? "***" : "null") +
                ", llmBaseUrl='" + llmBaseUrl + '\'' +
                ", llmApiKey=" + (llmApiKey != null ? "***" : "null") +
                ", chatModel='" + chatModel + '\'' +
                ", embeddingModel='" + embeddingModel + '\'' +
                ", windowSize=" + windowSize +
                ", similarityThreshold=" + similarityThreshold +
                ", similarityBackend=" + similarityBackend +
                ", qualityThreshold=" + qualityThreshold +
                ", cacheDir=" + cacheDir +
                ", cacheEnabled=" + cacheEnabled +
                '}';
    }

    public static class Builder {
        private String remoteBaseUrl = DEFAULT_REMOTE_BASE_URL;
        private String remoteApiKey;
        private Duration remoteTimeout = DEFAULT_REMOTE_TIMEOUT;
        private int pageSize = DEFAULT_PAGE_SIZE;
        private String llmBaseUrl = DEFAULT_LLM_BASE_URL;
        private String llmApiKey;
        private Duration llmTimeout = DEFAULT_LLM_TIMEOUT;
        private String chatModel = DEFAULT_CHAT_MODEL;
        private String embeddingModel = DEFAULT_EMBEDDING_MODEL;
        private int embeddingBatchSize = DEFAULT_EMBEDDING_BATCH_SIZE;
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private SimilarityIndexes.Backend similarityBackend = SimilarityIndexes.Backend.AUTO;
        private int approximateMinCards = DEFAULT_APPROXIMATE_MIN_CARDS;
        private int neighborCap = DEFAULT_NEIGHBOR_CAP;
        private int qualityThreshold = DEFAULT_QUALITY_THRESHOLD;
        private Path cacheDir = defaultHome().resolve("cache");
        private boolean cacheEnabled = true;

        public Builder remoteBaseUrl(String remoteBaseUrl) {
            this.remoteBaseUrl = Objects.requireNonNull(remoteBaseUrl, "remoteBaseUrl");
            return this;
        }

        public Builder remoteApiKey(String remoteApiKey) {
            this.remoteApiKey = blankToNull(remoteApiKey);
            return this;
        }

        public Builder remoteTimeout(Duration remoteTimeout) {
            this.remoteTimeout = requirePositive(remoteTimeout, "remoteTimeout");
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = requirePositive(pageSize, "pageSize");
            return this;
        }

        public Builder llmBaseUrl(String llmBaseUrl) {
            this.llmBaseUrl = Objects.requireNonNull(llmBaseUrl, "llmBaseUrl");
            return this;
        }

        public Builder llmApiKey(String llmApiKey) {
            this.llmApiKey = blankToNull(llmApiKey);
            return this;
        }

        public Builder llmTimeout(Duration llmTimeout) {
            this.llmTimeout = requirePositive(llmTimeout, "llmTimeout");
            return this;
        }

        public Builder chatModel(String chatModel) {
            this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
            return this;
        }

        public Builder embeddingModel(String embeddingModel) {
            this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel");
            return this;
        }

        public Builder embeddingBatchSize(int embeddingBatchSize) {
            this.embeddingBatchSize = requirePositive(embeddingBatchSize, "embeddingBatchSize");
            return this;
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = requirePositive(windowSize, "windowSize");
            return this;
        }

        public Builder similarityThreshold(double similarityThreshold) {
            if (similarityThreshold < -1.0 || similarityThreshold > 1.0) {
                throw new IllegalArgumentException("similarityThreshold must be between -1.0 and 1.0");
            }
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder similarityBackend(SimilarityIndexes.Backend similarityBackend) {
            this.similarityBackend = Objects.requireNonNull(similarityBackend, "similarityBackend");
            return this;
        }

        public Builder approximateMinCards(int approximateMinCards) {
            this.approximateMinCards = requirePositive(approximateMinCards, "approximateMinCards");
            return this;
        }

        public Builder neighborCap(int neighborCap) {
            this.neighborCap = requirePositive(neighborCap, "neighborCap");
            return this;
        }

        public Builder qualityThreshold(int qualityThreshold) {
            if (qualityThreshold < 0 || qualityThreshold > 10) {
                throw new IllegalArgumentException("qualityThreshold must be between 0 and 10");
            }
            this.qualityThreshold = qualityThreshold;
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir");
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public MirrorConfig build() {
            return new MirrorConfig(this);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.strip();
        }
    }
}
