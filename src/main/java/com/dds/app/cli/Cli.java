package com.dds.app.cli;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dds.app.cache.CacheStats;
import com.dds.app.cache.DirectoryCache;
import com.dds.app.config.Config;
import com.dds.app.database.Database;
import com.dds.app.session.Session;
import com.dds.app.session.SessionFailedException;
import com.dds.app.session.SessionRegistry;
import com.dds.app.sweep.CancellationToken;
import com.dds.app.sweep.ProgressReporter;
import com.dds.app.sweep.SweepConfig;
import com.dds.app.sweep.SweepOrchestrator;
import com.dds.app.sweep.SweepResult;
import com.dds.app.sweep.SweepStats;
import com.dds.app.sweep.SweepStats.StatsSnapshot;
import com.dds.app.sweep.Verbosity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

public final class Cli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_INTERRUPTED = 130;

    private static final Logger logger = LoggerFactory.getLogger(Cli.class);
    private static final Duration PROGRESS_PERIOD = Duration.ofSeconds(2);
    private static final ObjectMapper JSON = new ObjectMapper();

    private Cli() {}

    public static void main(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public static int execute(String[] args) {
        if (args == null || args.length == 0) {
            return runSweep(new String[0]);
        }

        String cmd = StringUtils.lowerCase(StringUtils.trimToEmpty(args[0]), Locale.ROOT);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (cmd) {
                case "sweep" -> runSweep(rest);
                case "status" -> runStatus(rest);
                case "stats" -> runStats(rest);
                case "clear-incomplete" -> runClearIncomplete(rest);
                case "prune" -> runPrune(rest);
                case "help", "-h", "--help" -> {
                    printUsage();
                    yield EXIT_OK;
                }
                // no command: the arguments are sweep arguments
                default -> runSweep(args);
            };
        } catch (Exception e) {
            System.err.println("Fatal error: " + safeMsg(e));
            logger.debug("Fatal error", e);
            return EXIT_FAILURE;
        }
    }

    // ----------------- sweep -----------------

    private static int runSweep(String[] args) {
        ParseResult<SweepArgs> parsed = SweepArgs.parse(args);
        if (parsed.help()) {
            printSweepUsage();
            return EXIT_OK;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printSweepUsage();
            return EXIT_USAGE;
        }

        SweepArgs a = parsed.value();
        Path root;
        try {
            root = Path.of(StringUtils.defaultIfBlank(a.root(), ".")).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            System.err.println("Invalid path: " + safeMsg(e));
            return EXIT_USAGE;
        }
        if (!Files.isDirectory(root)) {
            System.err.println("Directory not found: " + root);
            return EXIT_USAGE;
        }

        SweepConfig cfg;
        try {
            cfg = a.toConfig(root);
        } catch (IllegalArgumentException e) {
            System.err.println(safeMsg(e));
            return EXIT_USAGE;
        }
        applyVerbosity(cfg.verbosity());

        CancellationToken token = CancellationToken.create();
        CountDownLatch finished = new CountDownLatch(1);
        long hookWaitMs = cfg.taskTimeout().toMillis() + TimeUnit.SECONDS.toMillis(10);

        // Ctrl+C / kill: stop dispatching and give the session time to persist its state
        Thread cancelHook = new Thread(() -> {
            if (token.cancel()) {
                System.err.println("Cancellation requested at " + Instant.now() + "; saving progress...");
            }
            try {
                finished.await(hookWaitMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "dds-cli-cancel");
        Runtime.getRuntime().addShutdownHook(cancelHook);

        SweepStats stats = new SweepStats();
        try (Database db = Database.open();
             ProgressReporter reporter = new ProgressReporter(stats, PROGRESS_PERIOD)) {
            if (cfg.verbosity() != Verbosity.QUIET) reporter.start();

            SweepResult result = new SweepOrchestrator(db).run(cfg, token, stats);
            printSummary(cfg, result);

            if (result.interrupted()) return EXIT_INTERRUPTED;
            return EXIT_OK;
        } catch (SessionFailedException e) {
            System.err.println("Sweep failed: " + safeMsg(e));
            return EXIT_FAILURE;
        } finally {
            finished.countDown();
            removeHook(cancelHook);
        }
    }

    private static void printSummary(SweepConfig cfg, SweepResult result) {
        StatsSnapshot s = result.stats();
        if (cfg.verbosity() != Verbosity.QUIET) {
            log(ProgressReporter.format(s));
        }
        String verb = cfg.dryRun() ? "would be deleted (dry run)" : "deleted";
        log(String.format("Session %s %s%s: %d %s files found, %d %s, %d directories skipped, %d errors",
                result.sessionId(),
                result.status().name().toLowerCase(Locale.ROOT),
                result.resumed() ? " (resumed)" : "",
                s.filesFound(),
                cfg.targetName(),
                cfg.dryRun() ? s.filesFound() : s.filesDeleted(),
                verb,
                s.dirsSkipped(),
                s.errors()));
        if (result.interrupted()) {
            log("Run the same command again to resume.");
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is running
            logger.debug("Shutdown in progress, cancel hook stays registered");
        }
    }

    // ----------------- status -----------------

    private static int runStatus(String[] args) {
        ParseResult<LimitArgs> parsed = LimitArgs.parse(args, 20);
        if (parsed.help()) {
            printStatusUsage();
            return EXIT_OK;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printStatusUsage();
            return EXIT_USAGE;
        }
        int limit = parsed.value().limit();

        try (Database db = Database.open()) {
            DirectoryCache cache = new DirectoryCache(db.jdbi(), Config.getCacheWindow(), false, Clock.systemUTC());
            SessionRegistry sessions = new SessionRegistry(db.jdbi(), Clock.systemUTC());

            List<String> incomplete = cache.incompletePaths();
            if (incomplete.isEmpty()) {
                log("No incomplete directories in the cache.");
            } else {
                log("Incomplete directories (" + incomplete.size() + "):");
                incomplete.stream().limit(limit).forEach(p -> log("  " + p));
                if (incomplete.size() > limit) log("  ... and " + (incomplete.size() - limit) + " more");
            }

            List<Session> open = sessions.listIncomplete();
            if (open.isEmpty()) {
                log("No resumable sessions.");
            } else {
                log("Resumable sessions:");
                log("id | status | root | recursive | dry run | created | dirs | files");
                for (Session s : open.subList(0, Math.min(limit, open.size()))) {
                    System.out.printf("%s | %s | %s | %s | %s | %s | %d | %d%n",
                            s.id(),
                            s.status(),
                            s.root(),
                            s.recursive(),
                            s.dryRun(),
                            s.createdAt(),
                            s.dirsNew() + s.dirsResumed(),
                            s.filesFound());
                }
            }
        }
        return EXIT_OK;
    }

    // ----------------- stats -----------------

    private static int runStats(String[] args) throws JsonProcessingException {
        boolean json = false;
        for (String t : args) {
            switch (t) {
                case "-h", "--help" -> {
                    printStatsUsage();
                    return EXIT_OK;
                }
                case "--json" -> json = true;
                default -> {
                    System.err.println("Invalid option: " + t);
                    printStatsUsage();
                    return EXIT_USAGE;
                }
            }
        }

        CacheStats stats;
        Path file;
        try (Database db = Database.open()) {
            stats = new DirectoryCache(db.jdbi(), Config.getCacheWindow(), false, Clock.systemUTC()).stats();
            file = db.file();
        }

        if (json) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("database", file.toString());
            out.put("totalEntries", stats.totalEntries());
            out.put("completed", stats.completed());
            out.put("incomplete", stats.incomplete());
            out.put("withMatches", stats.withMatches());
            out.put("errors", stats.errors());
            out.put("hitRate", stats.hitRate());
            System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(out));
        } else {
            log("Cache database: " + file);
            log("  total entries:  " + stats.totalEntries());
            log("  completed:      " + stats.completed());
            log("  incomplete:     " + stats.incomplete());
            log("  with matches:   " + stats.withMatches());
            log("  with errors:    " + stats.errors());
            log(String.format(Locale.ROOT, "  hit rate:       %.1f%%", stats.hitRate()));
        }
        return EXIT_OK;
    }

    // ----------------- maintenance -----------------

    private static int runClearIncomplete(String[] args) {
        if (args.length > 0) {
            if (isHelp(args[0])) {
                log("Usage: dds clear-incomplete");
                return EXIT_OK;
            }
            System.err.println("Invalid option: " + args[0]);
            return EXIT_USAGE;
        }
        try (Database db = Database.open()) {
            int cleared = new DirectoryCache(db.jdbi(), Config.getCacheWindow(), false, Clock.systemUTC()).clearIncomplete();
            int closed = new SessionRegistry(db.jdbi(), Clock.systemUTC()).closeAbandoned();
            log("Cleared " + cleared + " incomplete cache entries; closed " + closed + " interrupted sessions.");
        }
        return EXIT_OK;
    }

    private static int runPrune(String[] args) {
        if (args.length > 0) {
            if (isHelp(args[0])) {
                log("Usage: dds prune   (removes cache entries and unfinished sessions older than twice the cache window)");
                return EXIT_OK;
            }
            System.err.println("Invalid option: " + args[0]);
            return EXIT_USAGE;
        }
        Duration horizon = Config.getCacheWindow().multipliedBy(2);
        Instant cutoff = Instant.now().minus(horizon);
        try (Database db = Database.open()) {
            int pruned = new DirectoryCache(db.jdbi(), Config.getCacheWindow(), false, Clock.systemUTC()).prune(cutoff);
            int stale = new SessionRegistry(db.jdbi(), Clock.systemUTC()).cleanupStale(cutoff);
            if (pruned + stale > 0) db.checkpoint();
            log("Pruned " + pruned + " cache entries and " + stale + " stale sessions older than " + cutoff + ".");
        }
        return EXIT_OK;
    }

    // ----------------- logging -----------------

    static void applyVerbosity(Verbosity verbosity) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext ctx)) return;
        Level level = switch (verbosity) {
            case VERBOSE -> Level.DEBUG;
            case QUIET -> Level.WARN;
            case NORMAL -> Level.INFO;
        };
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
    }

    // ----------------- usage -----------------

    private static void printUsage() {
        System.out.println("""
                dds: finds and deletes .DS_Store files, remembering what it already swept
                Commands:
                  [sweep] [<path>] [options]   sweep a directory tree (default command)
                  status [--limit <n>]         incomplete directories and resumable sessions
                  stats [--json]               cache statistics
                  clear-incomplete             forget incomplete cache entries and interrupted sessions
                  prune                        remove old cache entries and stale sessions
                  help
                """);
    }

    private static void printSweepUsage() {
        System.out.println("""
                Usage:
                  dds [sweep] [<path>] [options]

                Options:
                  -n, --dry-run            report matches without deleting them
                  -f, --force              ignore the cache and rescan everything
                  --no-recursive           only scan <path> itself
                  -v, --verbose            debug logging
                  -q, --quiet              warnings and errors only
                  --root <path>            directory to sweep (same as <path>)
                  --concurrency <n>        directories scanned at once (default %d)
                  --timeout <seconds>      per-directory scan timeout (default %d)
                  --cache-hours <h>        cache window in hours (default %d)
                  --target <name>          file name to remove (default %s)
                  --exclude <glob>         skip matching directories (repeatable)

                Examples:
                  dds ~/Projects --dry-run
                  dds sweep /Volumes/Shared --force --exclude "**/node_modules"
                """.formatted(Config.DEFAULT_CONCURRENCY, Config.DEFAULT_TASK_TIMEOUT_SECONDS,
                Config.DEFAULT_CACHE_WINDOW_HOURS, Config.DEFAULT_TARGET_NAME));
    }

    private static void printStatusUsage() {
        System.out.println("""
                Usage:
                  dds status [--limit <n>]
                """);
    }

    private static void printStatsUsage() {
        System.out.println("""
                Usage:
                  dds stats [--json]
                """);
    }

    // ----------------- parsing -----------------

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Missing value for " + opt);
            return next();
        }

        int requireInt(String opt, int min) {
            String v = requireNext(opt);
            int n;
            try {
                n = Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + opt + ": " + v);
            }
            if (n < min) throw new IllegalArgumentException(opt + " must be >= " + min);
            return n;
        }
    }

    private record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    record SweepArgs(
            String root,
            boolean dryRun,
            boolean force,
            boolean recursive,
            Verbosity verbosity,
            Integer concurrency,
            Integer timeoutSeconds,
            Integer cacheHours,
            String target,
            List<String> excludes
    ) {
        static ParseResult<SweepArgs> parse(String[] args) {
            String root = null;
            String target = null;
            boolean dryRun = false, force = false, recursive = true, verbose = false, quiet = false;
            Integer concurrency = null, timeout = null, cacheHours = null;
            List<String> excludes = new ArrayList<>();

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "-n", "--dry-run" -> dryRun = true;
                        case "-f", "--force" -> force = true;
                        case "--no-recursive" -> recursive = false;
                        case "-v", "--verbose" -> verbose = true;
                        case "-q", "--quiet" -> quiet = true;
                        case "--root" -> root = c.requireNext("--root");
                        case "--concurrency" -> concurrency = c.requireInt("--concurrency", 1);
                        case "--timeout" -> timeout = c.requireInt("--timeout", 1);
                        case "--cache-hours" -> cacheHours = c.requireInt("--cache-hours", 0);
                        case "--target" -> target = c.requireNext("--target");
                        case "--exclude" -> excludes.add(c.requireNext("--exclude"));
                        default -> {
                            if (t.startsWith("-")) return ParseResult.errorResult("Invalid option: " + t);
                            if (root != null) return ParseResult.errorResult("Only one path may be given: " + t);
                            root = t;
                        }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }

            if (verbose && quiet) {
                return ParseResult.errorResult("--verbose and --quiet cannot be combined");
            }
            return ParseResult.okResult(new SweepArgs(root, dryRun, force, recursive,
                    Verbosity.fromFlags(verbose, quiet), concurrency, timeout, cacheHours, target,
                    List.copyOf(excludes)));
        }

        SweepConfig toConfig(Path rootPath) {
            SweepConfig cfg = SweepConfig.defaults(rootPath)
                    .withRecursive(recursive)
                    .withDryRun(dryRun)
                    .withForceRefresh(force)
                    .withVerbosity(verbosity)
                    .withExcludeGlobs(excludes);
            if (concurrency != null) cfg = cfg.withConcurrency(concurrency);
            if (timeoutSeconds != null) cfg = cfg.withTaskTimeout(Duration.ofSeconds(timeoutSeconds));
            if (cacheHours != null) cfg = cfg.withCacheWindow(Duration.ofHours(cacheHours));
            if (StringUtils.isNotBlank(target)) {
                cfg = new SweepConfig(cfg.root(), cfg.recursive(), cfg.dryRun(), cfg.forceRefresh(),
                        cfg.cacheWindow(), cfg.verbosity(), cfg.concurrencyLimit(), cfg.taskTimeout(),
                        cfg.flushInterval(), cfg.flushThreshold(), cfg.deleteParallelism(), target.trim(),
                        cfg.excludeGlobs());
            }
            return cfg;
        }
    }

    private record LimitArgs(int limit) {
        static ParseResult<LimitArgs> parse(String[] args, int defaultLimit) {
            int limit = defaultLimit;
            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--limit" -> limit = c.requireInt("--limit", 1);
                        default -> { return ParseResult.errorResult("Invalid option: " + t); }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            return ParseResult.okResult(new LimitArgs(limit));
        }
    }

    // ----------------- misc -----------------

    private static boolean isHelp(String arg) {
        return "-h".equals(arg) || "--help".equals(arg);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return StringUtils.isBlank(m)
                ? (t == null ? "Error" : t.getClass().getSimpleName())
                : m;
    }

    private static void log(String msg) {
        if (StringUtils.isNotBlank(msg)) System.out.println(msg);
    }
}
