package com.deck.mirror.cli;

import com.deck.mirror.cache.CacheConfig;
import com.deck.mirror.cache.CurationCaches;
import com.deck.mirror.codec.DeckFile;
import com.deck.mirror.codec.ValidationException;
import com.deck.mirror.config.ConfigLoader;
import com.deck.mirror.config.MirrorConfig;
import com.deck.mirror.console.StandardConsole;
import com.deck.mirror.console.UserConsole;
import com.deck.mirror.core.model.Card;
import com.deck.mirror.curation.CardImprover;
import com.deck.mirror.curation.CurationOptions;
import com.deck.mirror.curation.DeckCurator;
import com.deck.mirror.curation.DeckDeduplicator;
import com.deck.mirror.curation.PairClassifier;
import com.deck.mirror.curation.ProgressCallback;
import com.deck.mirror.curation.QualityGrader;
import com.deck.mirror.curation.WindowedBatchExecutor;
import com.deck.mirror.llm.LLMException;
import com.deck.mirror.llm.LLMProvider;
import com.deck.mirror.llm.OpenAiCompatibleProvider;
import com.deck.mirror.logging.LogContext;
import com.deck.mirror.metrics.MetricsService;
import com.deck.mirror.metrics.MicrometerMetricsService;
import com.deck.mirror.reconcile.DeckSynchronizer;
import com.deck.mirror.reconcile.InconsistencyException;
import com.deck.mirror.reconcile.PullReport;
import com.deck.mirror.reconcile.SyncOptions;
import com.deck.mirror.reconcile.SyncReport;
import com.deck.mirror.remote.HttpRemoteClient;
import com.deck.mirror.remote.RemoteClient;
import com.deck.mirror.remote.RemoteDeck;
import com.deck.mirror.remote.RemoteException;
import com.deck.mirror.review.ConsoleDecisionSource;
import com.deck.mirror.review.DecisionSource;
import com.deck.mirror.review.PolicyDecisionSource;
import com.deck.mirror.similarity.CardEmbedder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Command-line entry point.
 *
 * <pre>
 *   deck-mirror decks
 *   deck-mirror pull &lt;deck-id-or-name&gt; [--dir DIR] [--yes]
 *   deck-mirror push [FILE] [--force] [--yes]
 *   deck-mirror sync FILE [--force] [--yes]
 *   deck-mirror dedupe FILE [--threshold X] [--auto]
 *   deck-mirror curate FILE [--min-score N] [--auto]
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 operation failed, 2 usage error.</p>
 */
public final class DeckMirrorCli {
    private static final Logger log = LoggerFactory.getLogger(DeckMirrorCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join("\n",
            "Usage: deck-mirror <command> [options]",
            "",
            "Commands:",
            "  decks                                   List remote decks",
            "  pull <deck-id-or-name> [--dir DIR]      Download a deck, merging into an existing file",
            "  push [FILE] [--force]                   Push one deck file, or every deck-*.md file",
            "  sync FILE [--force]                     Push local changes and drop cards deleted remotely",
            "  dedupe FILE [--threshold X] [--auto]    Find and remove near-duplicate cards",
            "  curate FILE [--min-score N] [--auto]    Grade cards and review rewrites of weak ones",
            "",
            "Options:",
            "  --yes, -y   Do not ask for confirmation",
            "  --force     Create cards even when identical content exists remotely",
            "  --auto      Resolve reviews with the built-in policy instead of prompting");

    private final UserConsole console;
    private final ConfigLoader configLoader;
    private final BiFunction<MirrorConfig, MetricsService, RemoteClient> remoteClients;
    private final BiFunction<MirrorConfig, MetricsService, LLMProvider> llmProviders;

    DeckMirrorCli(UserConsole console, ConfigLoader configLoader,
                  BiFunction<MirrorConfig, MetricsService, RemoteClient> remoteClients,
                  BiFunction<MirrorConfig, MetricsService, LLMProvider> llmProviders) {
        this.console = console;
        this.configLoader = configLoader;
        this.remoteClients = remoteClients;
        this.llmProviders = llmProviders;
    }

    public static void main(String[] args) {
        DeckMirrorCli cli = new DeckMirrorCli(new StandardConsole(), new ConfigLoader(),
                DeckMirrorCli::httpRemoteClient, DeckMirrorCli::openAiProvider);
        System.exit(cli.run(args));
    }

    int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            console.println(e.getMessage());
            console.println(USAGE);
            return EXIT_USAGE;
        }
        if (arguments.command() == null || arguments.command().equals("help")) {
            console.println(USAGE);
            return arguments.command() == null ? EXIT_USAGE : EXIT_OK;
        }

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsService metrics = new MicrometerMetricsService(registry);
        try (LogContext ctx = LogContext.forCommand(arguments.command(), arguments.positional(0))) {
            MirrorConfig config = configLoader.load();
            return dispatch(arguments, config, metrics);
        } catch (IllegalArgumentException e) {
            console.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (InconsistencyException e) {
            console.println("Error: " + e.getMessage());
            for (Card card : e.getMissingCards()) {
                console.println("  [" + card.id() + "] " + card.preview(60));
            }
            console.println("These cards were deleted remotely. Run 'sync' to remove them locally.");
            return EXIT_FAILED;
        } catch (ValidationException | RemoteException | LLMException | UncheckedIOException e) {
            log.debug("command.failed command={}", arguments.command(), e);
            console.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        } finally {
            log.debug("command.metrics meters={}", registry.getMeters().size());
            registry.close();
        }
    }

    private int dispatch(Arguments arguments, MirrorConfig config, MetricsService metrics) {
        switch (arguments.command()) {
            case "decks":
                return decks(config, metrics);
            case "pull":
                return pull(arguments, config, metrics);
            case "push":
                return push(arguments, config, metrics);
            case "sync":
                return sync(arguments, config, metrics);
            case "dedupe":
                return dedupe(arguments, config, metrics);
            case "curate":
                return curate(arguments, config, metrics);
            default:
                console.println("Unknown command: " + arguments.command());
                console.println(USAGE);
                return EXIT_USAGE;
        }
    }

    // ========== Remote commands ==========

    private int decks(MirrorConfig config, MetricsService metrics) {
        List<RemoteDeck> decks = synchronizer(config, metrics).listDecks();
        if (decks.isEmpty()) {
            console.println("No decks found.");
        }
        for (RemoteDeck deck : decks) {
            console.println(deck.name() + " (" + deck.id() + ")");
        }
        return EXIT_OK;
    }

    private int pull(Arguments arguments, MirrorConfig config, MetricsService metrics) {
        String query = arguments.requirePositional(0, "pull needs a deck id or name");
        DeckSynchronizer synchronizer = synchronizer(config, metrics);
        Optional<RemoteDeck> deck = synchronizer.findDeck(query);
        if (deck.isEmpty()) {
            console.println("Deck not found: " + query);
            return EXIT_FAILED;
        }
        Path directory = Path.of(arguments.option("--dir").orElse("."));
        PullReport report = synchronizer.pull(deck.get().id(), directory, syncOptions(arguments));
        if (report.hasConflicts()) {
            console.println(report.conflicts().size() + " conflict(s) kept the local version; review them before pushing.");
        }
        return EXIT_OK;
    }

    private int push(Arguments arguments, MirrorConfig config, MetricsService metrics) {
        DeckSynchronizer synchronizer = synchronizer(config, metrics);
        if (arguments.positionalCount() == 0) {
            Path directory = Path.of(arguments.option("--dir").orElse("."));
            List<SyncReport> reports = synchronizer.pushAll(directory, syncOptions(arguments));
            long failed = reports.stream()
                    .filter(r -> r.status() == SyncReport.Status.FAILED)
                    .count();
            return failed == 0 ? EXIT_OK : EXIT_FAILED;
        }
        SyncReport report = synchronizer.push(Path.of(arguments.positional(0)), syncOptions(arguments));
        return report.status() == SyncReport.Status.BLOCKED_BY_DUPLICATES ? EXIT_FAILED : EXIT_OK;
    }

    private int sync(Arguments arguments, MirrorConfig config, MetricsService metrics) {
        Path file = Path.of(arguments.requirePositional(0, "sync needs a deck file"));
        SyncReport report = synchronizer(config, metrics).sync(file, syncOptions(arguments));
        return report.status() == SyncReport.Status.BLOCKED_BY_DUPLICATES ? EXIT_FAILED : EXIT_OK;
    }

    private DeckSynchronizer synchronizer(MirrorConfig config, MetricsService metrics) {
        MirrorConfig withKey = ensureKey(config, ConfigLoader.REMOTE_API_KEY, config.getRemoteApiKey(), "Mochi");
        return DeckSynchronizer.builder()
                .remoteClient(remoteClients.apply(withKey, metrics))
                .deckFile(new DeckFile())
                .console(console)
                .metricsService(metrics)
                .build();
    }

    private static SyncOptions syncOptions(Arguments arguments) {
        return new SyncOptions(arguments.flag("--force"), arguments.flag("--yes") || arguments.flag("-y"));
    }

    // ========== Curation commands ==========

    private int dedupe(Arguments arguments, MirrorConfig config, MetricsService metrics) {
        Path file = Path.of(arguments.requirePositional(0, "dedupe needs a deck file"));
        CurationOptions options = CurationOptions.from(config);
        Optional<String> threshold = arguments.option("--threshold");
        if (threshold.isPresent()) {
            options = options.withSimilarityThreshold(parseDouble("--threshold", threshold.get()));
        }
        MirrorConfig withKey = ensureKey(config, ConfigLoader.LLM_API_KEY, config.getLlmApiKey(), "OpenRouter");
        LLMProvider provider = languageModel(withKey, metrics);

        try (CurationCaches caches = CurationCaches.open(cacheConfig(withKey), metrics);
             WindowedBatchExecutor executor = new WindowedBatchExecutor(withKey.getWindowSize(), metrics)) {
            DeckDeduplicator deduplicator = new DeckDeduplicator(
                    new CardEmbedder(provider, caches.embeddings(), options.embeddingModel(), options.embeddingBatchSize()),
                    new PairClassifier(provider, caches.classifications(), executor, options.chatModel()),
                    new DeckFile(), console, options, metrics);
            deduplicator.dedupe(file, decisionSource(arguments), progress("classified"));
            logCacheStats(caches);
        }
        return EXIT_OK;
    }

    private int curate(Arguments arguments, MirrorConfig config, MetricsService metrics) {
        Path file = Path.of(arguments.requirePositional(0, "curate needs a deck file"));
        CurationOptions options = CurationOptions.from(config);
        Optional<String> minScore = arguments.option("--min-score");
        if (minScore.isPresent()) {
            options = options.withQualityThreshold(parseInt("--min-score", minScore.get()));
        }
        MirrorConfig withKey = ensureKey(config, ConfigLoader.LLM_API_KEY, config.getLlmApiKey(), "OpenRouter");
        LLMProvider provider = languageModel(withKey, metrics);

        try (CurationCaches caches = CurationCaches.open(cacheConfig(withKey), metrics);
             WindowedBatchExecutor executor = new WindowedBatchExecutor(withKey.getWindowSize(), metrics)) {
            DeckCurator curator = new DeckCurator(
                    new QualityGrader(provider, caches.gradings(), executor, options.chatModel()),
                    new CardImprover(provider, executor, options.chatModel()),
                    new DeckFile(), console, options);
            curator.curate(file, decisionSource(arguments), progress("done"));
            logCacheStats(caches);
        }
        return EXIT_OK;
    }

    private LLMProvider languageModel(MirrorConfig config, MetricsService metrics) {
        LLMProvider provider = llmProviders.apply(config, metrics);
        if (!provider.isAvailable()) {
            throw new ValidationException(provider.getProviderName() + " is not configured");
        }
        log.debug("llm.provider name={}", provider.getProviderName());
        return provider;
    }

    private DecisionSource decisionSource(Arguments arguments) {
        return arguments.flag("--auto") ? new PolicyDecisionSource() : new ConsoleDecisionSource(console);
    }

    private ProgressCallback progress(String verb) {
        return (processed, total, message) -> console.println("  " + processed + "/" + total + " " + verb);
    }

    private static CacheConfig cacheConfig(MirrorConfig config) {
        return config.isCacheEnabled() ? CacheConfig.defaults(config.getCacheDir()) : CacheConfig.disabled();
    }

    private static void logCacheStats(CurationCaches caches) {
        log.debug("cache.summary embeddings={} classifications={} gradings={}",
                caches.embeddings().getStats(), caches.classifications().getStats(), caches.gradings().getStats());
    }

    // ========== Configuration ==========

    /**
     * Asks once for a missing API key and saves it to the config file.
     */
    private MirrorConfig ensureKey(MirrorConfig config, String key, String current, String service) {
        if (current != null) {
            return config;
        }
        console.println(service + " API key not found in " + configLoader.getConfigFile() + " or " + key + ".");
        String entered = console.prompt("Enter your " + service + " API key: ");
        if (entered == null || entered.isBlank()) {
            throw new ValidationException(service + " API key is required");
        }
        if (configLoader.save(key, entered)) {
            console.println("API key saved to " + configLoader.getConfigFile());
        }
        return key.equals(ConfigLoader.REMOTE_API_KEY)
                ? config.toBuilder().remoteApiKey(entered).build()
                : config.toBuilder().llmApiKey(entered).build();
    }

    static RemoteClient httpRemoteClient(MirrorConfig config, MetricsService metrics) {
        return HttpRemoteClient.builder()
                .baseUrl(config.getRemoteBaseUrl())
                .apiKey(config.getRemoteApiKey())
                .timeout(config.getRemoteTimeout())
                .pageSize(config.getPageSize())
                .build();
    }

    static LLMProvider openAiProvider(MirrorConfig config, MetricsService metrics) {
        return OpenAiCompatibleProvider.builder()
                .baseUrl(config.getLlmBaseUrl())
                .apiKey(config.getLlmApiKey())
                .timeout(config.getLlmTimeout())
                .metricsService(metrics)
                .build();
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects an integer, got '" + value + "'");
        }
    }

    private static double parseDouble(String option, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects a number, got '" + value + "'");
        }
    }

    /**
     * Parsed command line: command, positional arguments, boolean flags and valued options.
     */
    record Arguments(String command, List<String> positionals, List<String> flags, Map<String, String> options) {

        private static final List<String> VALUED = List.of("--threshold", "--min-score", "--dir");
        private static final List<String> FLAGS = List.of("--force", "--yes", "-y", "--auto");

        static Arguments parse(String[] args) {
            String command = null;
            List<String> positionals = new ArrayList<>();
            List<String> flags = new ArrayList<>();
            Map<String, String> options = new HashMap<>();
            for (int i = 0; i < (args == null ? 0 : args.length); i++) {
                String arg = args[i];
                if (arg == null || arg.isBlank()) {
                    continue;
                }
                if (VALUED.contains(arg)) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException(arg + " needs a value");
                    }
                    options.put(arg, args[++i]);
                } else if (FLAGS.contains(arg)) {
                    flags.add(arg);
                } else if (arg.startsWith("-")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else if (command == null) {
                    command = arg;
                } else {
                    positionals.add(arg);
                }
            }
            return new Arguments(command, positionals, flags, options);
        }

        boolean flag(String name) {
            return flags.contains(name);
        }

        Optional<String> option(String name) {
            return Optional.ofNullable(options.get(name));
        }

        int positionalCount() {
            return positionals.size();
        }

        String positional(int index) {
            return index < positionals.size() ? positionals.get(index) : null;
        }

        String requirePositional(int index, String message) {
            String value = positional(index);
            if (value == null) {
                throw new IllegalArgumentException(message);
            }
            return value;
        }
    }
}
