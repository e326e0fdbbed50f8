package ai.iacgraph.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.emit.DialectEmitter;
import ai.iacgraph.emit.EmissionResult;
import ai.iacgraph.emit.EmissionWarning;
import ai.iacgraph.emit.EmitOptions;
import ai.iacgraph.emit.EmitterRegistry;
import ai.iacgraph.model.AdvisoryHint;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.NormalizationResult;
import ai.iacgraph.normalize.NormalizationWarning;
import ai.iacgraph.normalize.Normalizer;
import ai.iacgraph.optimize.GraphOptimizer;
import ai.iacgraph.optimize.OptimizationChange;
import ai.iacgraph.optimize.OptimizationResult;
import ai.iacgraph.parse.DialectParser;
import ai.iacgraph.parse.ParseError;
import ai.iacgraph.parse.ParseResult;
import ai.iacgraph.parse.ParserRegistry;
import ai.iacgraph.scan.DialectDetector;
import ai.iacgraph.scan.SourceFile;
import ai.iacgraph.scan.SourceFinder;
import ai.iacgraph.scan.SourceTree;
import ai.iacgraph.validate.GraphValidator;
import ai.iacgraph.validate.RuleRegistry;
import ai.iacgraph.validate.Severity;
import ai.iacgraph.validate.ValidationFinding;

/**
 * Runs commands through the stage chain
 * {@code PARSING -> NORMALIZING -> VALIDATING -> (OPTIMIZING) -> EMITTING -> DONE}.
 * <p>
 * {@code analyze} and {@code validate} stop after validating; {@code optimize} emits back into the
 * source dialect; {@code generate} and {@code convert} emit into the target dialect and optimize
 * only when passes are configured explicitly. A {@link FatalError} at any stage ends the invocation
 * in {@link Stage#FAILED} with a report; every other problem is collected into the report.
 * <p>
 * Invocations share nothing but the worker pool. Close the orchestrator to release it.
 */
public final class ConversionOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConversionOrchestrator.class);

    private final EngineConfig config;
    private final HintProvider hintProvider;
    private final ParserRegistry parsers;
    private final EmitterRegistry emitters;
    private final SourceFinder finder;
    private final DialectDetector detector = new DialectDetector();
    private final GraphValidator validator;
    private final GraphOptimizer optimizer;
    private final Normalizer normalizer;
    private final ExecutorService executor;

    public ConversionOrchestrator(EngineConfig config, HintProvider hintProvider) {
        this(config, hintProvider, ParserRegistry.defaults(), RuleRegistry.defaults(), EmitterRegistry.defaults());
    }

    public ConversionOrchestrator(EngineConfig config, HintProvider hintProvider, ParserRegistry parsers,
                                  RuleRegistry rules, EmitterRegistry emitters) {
        this.config = Objects.requireNonNull(config, "config");
        this.hintProvider = hintProvider == null ? HintProvider.NONE : hintProvider;
        this.parsers = Objects.requireNonNull(parsers, "parsers");
        this.emitters = Objects.requireNonNull(emitters, "emitters");
        this.finder = new SourceFinder(config.ignoredDirectories());
        this.executor = Executors.newFixedThreadPool(config.parallelism(), workerThreads());
        this.validator = new GraphValidator(rules.without(config.disabledRules()), executor);
        this.optimizer = GraphOptimizer.withDefaultPasses(config.hoistThreshold());
        this.normalizer = Normalizer.withDefaultMappers(executor);
    }

    public InvocationReport analyze(Path sourcePath, Dialect dialectHint) throws IOException {
        return run(new InvocationRequest(Command.ANALYZE, sourcePath, tag(dialectHint), null));
    }

    public InvocationReport validate(Path sourcePath, Dialect dialectHint) throws IOException {
        return run(new InvocationRequest(Command.VALIDATE, sourcePath, tag(dialectHint), null));
    }

    public InvocationReport optimize(Path sourcePath, Dialect dialectHint) throws IOException {
        return run(new InvocationRequest(Command.OPTIMIZE, sourcePath, tag(dialectHint), null));
    }

    public InvocationReport generate(Path sourcePath, Dialect target) throws IOException {
        return run(new InvocationRequest(Command.GENERATE, sourcePath, null, tag(target)));
    }

    public InvocationReport convert(Path sourcePath, Dialect source, Dialect target) throws IOException {
        return run(new InvocationRequest(Command.CONVERT, sourcePath, tag(source), tag(target)));
    }

    /**
     * Runs one command. Only I/O failures reading the source tree are thrown; everything else ends
     * up in the report.
     */
    public InvocationReport run(InvocationRequest request) throws IOException {
        Objects.requireNonNull(request, "request");
        final Invocation inv = new Invocation(request);
        try {
            inv.execute();
        } catch (FatalError ex) {
            inv.fail(ex);
        }
        return inv.report();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static String tag(Dialect d) {
        return d == null ? null : d.tag();
    }

    private static ThreadFactory workerThreads() {
        final AtomicInteger counter = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, "iacgraph-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * State of one invocation. Owns its graph from normalization through emission.
     */
    private final class Invocation {

        private final InvocationRequest request;
        private final Command command;
        private Stage stage = Stage.PARSING;
        private Stage failedAt;
        private String failure;

        private Dialect source;
        private Dialect target;
        private final List<String> files = new ArrayList<>();
        private final List<ParseError> parseErrors = new ArrayList<>();
        private final List<NormalizationWarning> warnings = new ArrayList<>();
        private final List<ValidationFinding> findings = new ArrayList<>();
        private final List<OptimizationChange> changes = new ArrayList<>();
        private final List<EmissionWarning> emissionWarnings = new ArrayList<>();
        private final SortedMap<String, String> artifacts = new TreeMap<>();
        private final List<AdvisoryHint> hints = new ArrayList<>();
        private ResourceGraph graph;
        private CompletableFuture<List<AdvisoryHint>> pendingHints;

        Invocation(InvocationRequest request) {
            this.request = request;
            this.command = request.command();
        }

        void execute() throws IOException {
            log.info("{} {}", command.tag(), request.sourcePath());
            final DialectEmitter emitter = checkRequest();

            // Step 1: discover and parse
            final SourceTree tree = finder.find(request.sourcePath());
            final DialectDetector.Inference inference = detector.detect(tree);
            source = chooseDialect(inference);
            final SourceTree selected = inference.select(source);
            selected.files().stream().map(SourceFile::path).forEach(files::add);
            final DialectParser parser = parsers.forDialect(source)
                    .orElseThrow(() -> new FatalError(stage, "no parser for dialect " + source.tag()));
            final ParseResult parsed = parser.parse(selected, executor);
            tree.unreadable().forEach((path, reason) -> parseErrors.add(new ParseError(path, 0, null, reason)));
            parseErrors.addAll(parsed.errors());
            log.info("Parsed {} {} files: {} blocks, {} errors",
                    files.size(), source.tag(), parsed.blockCount(), parsed.errors().size());

            // Step 2: normalize
            enter(Stage.NORMALIZING);
            final NormalizationResult normalized = normalizer.normalize(parsed.ast(), source);
            parseErrors.addAll(normalized.failures());
            warnings.addAll(normalized.warnings());
            graph = normalized.graph();
            if (graph.nodeCount() == 0) {
                throw new FatalError(stage, "no resources discovered under " + request.sourcePath());
            }
            requestHints();

            // Step 3: validate
            enter(Stage.VALIDATING);
            findings.addAll(validator.validate(graph));
            if (command == Command.ANALYZE || command == Command.VALIDATE) {
                takeHints(false);
                enter(Stage.DONE);
                return;
            }

            // Step 4: optimize
            if (command == Command.OPTIMIZE || !config.passes().isEmpty()) {
                enter(Stage.OPTIMIZING);
                final OptimizationResult optimized = optimizer.optimize(graph, config.passes());
                graph = optimized.graph();
                changes.addAll(optimized.changes());
            }

            // Step 5: emit
            enter(Stage.EMITTING);
            takeHints(true);
            final long errors = findings.stream().filter(f -> f.severity() == Severity.ERROR).count();
            final EmissionResult emitted = emitter == null
                    ? emitterFor(source).emit(graph, new EmitOptions((int) errors))
                    : emitter.emit(graph, new EmitOptions((int) errors));
            artifacts.putAll(emitted.artifacts());
            emissionWarnings.addAll(emitted.warnings());
            log.info("Emitted {} {} artifacts with {} warnings",
                    emitted.artifacts().size(), target.tag(), emitted.warnings().size());
            enter(Stage.DONE);
        }

        /**
         * Fails fast on requests that cannot succeed whatever the sources contain.
         */
        private DialectEmitter checkRequest() {
            for (String pass : config.passes()) {
                if (!optimizer.passIds().contains(pass)) {
                    throw new FatalError(stage, "unknown optimization pass '" + pass + "', expected one of "
                            + optimizer.passIds());
                }
            }
            if (command != Command.GENERATE && command != Command.CONVERT) {
                return null;
            }
            if (request.targetDialect() == null || request.targetDialect().isBlank()) {
                throw new FatalError(stage, command.tag() + " needs a target dialect");
            }
            target = Dialect.fromTag(request.targetDialect())
                    .orElseThrow(() -> new FatalError(stage, "unknown target dialect '" + request.targetDialect() + "'"));
            return emitterFor(target);
        }

        private DialectEmitter emitterFor(Dialect dialect) {
            target = dialect;
            return emitters.forDialect(dialect)
                    .orElseThrow(() -> new FatalError(stage, "no emitter for dialect " + dialect.tag()));
        }

        private Dialect chooseDialect(DialectDetector.Inference inference) {
            if (request.sourceDialect() != null) {
                return Dialect.fromTag(request.sourceDialect())
                        .orElseThrow(() -> new FatalError(stage, "unknown source dialect '" + request.sourceDialect() + "'"));
            }
            if (inference.isAmbiguous()) {
                final String found = inference.candidates().stream().map(Dialect::tag).sorted()
                        .collect(Collectors.joining(", "));
                throw new FatalError(stage, "ambiguous dialect inference (" + found + "); pass an explicit source dialect");
            }
            return inference.inferred()
                    .orElseThrow(() -> new FatalError(stage, "no infrastructure sources found under " + request.sourcePath()));
        }

        private void requestHints() {
            try {
                pendingHints = hintProvider.requestHints(graph.copy().seal());
            } catch (RuntimeException ex) {
                log.warn("Hint request failed: {}", ex.toString());
            }
        }

        /**
         * Takes hints that are already available without waiting; anything later is discarded.
         */
        private void takeHints(boolean attach) {
            final CompletableFuture<List<AdvisoryHint>> future = pendingHints;
            pendingHints = null;
            if (future == null) {
                return;
            }
            if (!future.isDone()) {
                future.cancel(true);
                log.debug("Advisory hints not ready, discarded");
                return;
            }
            if (future.isCompletedExceptionally()) {
                log.debug("Advisory hints failed, discarded");
                return;
            }
            final List<AdvisoryHint> available = future.join();
            if (available == null) {
                return;
            }
            final Map<String, List<AdvisoryHint>> byNode = new LinkedHashMap<>();
            for (AdvisoryHint h : available) {
                final String id = graph.resolve(h.nodeId());
                if (graph.hasNode(id)) {
                    final AdvisoryHint hint = new AdvisoryHint(id, h.text());
                    hints.add(hint);
                    byNode.computeIfAbsent(id, k -> new ArrayList<>()).add(hint);
                }
            }
            if (attach) {
                byNode.forEach((id, list) -> {
                    final ResourceNode node = graph.node(id).orElseThrow();
                    final List<AdvisoryHint> merged = new ArrayList<>(node.hints());
                    merged.addAll(list);
                    graph.putNode(node.withHints(merged));
                });
            }
            log.debug("Took {} advisory hints", hints.size());
        }

        private void enter(Stage next) {
            log.debug("{}: {} -> {}", command.tag(), stage, next);
            stage = next;
        }

        void fail(FatalError ex) {
            failedAt = stage;
            failure = ex.getMessage();
            stage = Stage.FAILED;
            if (pendingHints != null) {
                pendingHints.cancel(true);
                pendingHints = null;
            }
            log.error("{} failed while {}: {}", command.tag(), failedAt, failure);
        }

        InvocationReport report() {
            final AnalysisReport analysis = source == null ? null
                    : AnalysisReport.summarize(source, files, graph, parseErrors, warnings, findings, hints);
            return new InvocationReport(command, stage, failedAt, failure, target, analysis, graph,
                    changes, emissionWarnings, artifacts);
        }
    }
}
