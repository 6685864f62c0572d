package com.quill.orchestrator;

import com.quill.config.QuillConfig;
import com.quill.ledger.LedgerStore;
import com.quill.ledger.NoOpLedgerStore;
import com.quill.ledger.RunLedger;
import com.quill.planner.Decision;
import com.quill.planner.PlanTranslator;
import com.quill.planner.ReplanningOracle;
import com.quill.quality.QualityEvaluator;
import com.quill.quality.QualityGate;
import com.quill.resolver.ArgumentResolver;
import com.quill.resolver.ResolverTables;
import com.quill.tools.RegistryToolInvoker;
import com.quill.tools.ToolCatalog;
import com.quill.tools.ToolInvoker;
import com.quill.tools.ToolRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a plan step by step: resolves arguments, runs each tool with retry and timeout,
 * inserts one clarification when required arguments are missing, applies the quality gate
 * to drafts, and consults the re-planning oracle between steps until the queue drains or a
 * budget is hit.
 * <p>
 * Thread-safe: each {@link #run} call works on its own queue, history and context. Close the
 * orchestrator to release the tool executor it created (a caller-supplied executor is left alone).
 */
public final class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final QuillConfig config;
    private final ToolCatalog catalog;
    private final ArgumentResolver resolver;
    private final PlanTranslator translator;
    private final StepExecutor stepExecutor;
    private final ReplanningOracle oracle;
    private final QualityGate qualityGate;
    private final MemoryStore memoryStore;
    private final RunLedger ledger;
    private final RunMetrics metrics;
    private final Clock clock;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private Orchestrator(Builder b) {
        this.config = b.config != null ? b.config : QuillConfig.defaults();
        this.catalog = Objects.requireNonNull(b.catalog, "catalog (or tools) is required");
        ToolInvoker invoker = Objects.requireNonNull(b.toolInvoker, "toolInvoker (or tools) is required");
        ResolverTables tables = b.resolverTables != null ? b.resolverTables : ResolverTables.loadDefault();
        this.resolver = new ArgumentResolver(catalog, tables, config.isShowResolvedArgs());
        this.translator = new PlanTranslator(catalog);
        this.ownsExecutor = b.executor == null;
        this.executor = b.executor != null ? b.executor : Executors.newCachedThreadPool(daemonThreads());
        this.metrics = new RunMetrics(b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry());
        this.stepExecutor = new StepExecutor(invoker, executor, config.getMaxRetries(), config.getToolTimeoutMs(),
                config.getRetryInitialIntervalMs(), config.getRetryBackoffCoefficient(), config.getMaxRetryIntervalMs(),
                metrics);
        this.oracle = b.oracle;
        this.qualityGate = QualityGate.builder()
                .evaluator(b.qualityEvaluator)
                .timeoutMs(config.getQualityTimeoutMs())
                .minQualityScore(config.getMinQualityScore())
                .maxQualitySteps(config.getMaxQualitySteps())
                .executor(executor)
                .build();
        this.memoryStore = b.memoryStore != null ? b.memoryStore : MemoryStore.empty();
        if (config.isRunLedgerEnabled()) {
            this.ledger = new RunLedger(b.ledgerStore != null ? b.ledgerStore : new NoOpLedgerStore());
        } else {
            this.ledger = RunLedger.disabled();
        }
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        log.info("Orchestrator ready | tools={} | tablesVersion={} | maxSteps={} | maxRetries={} | oracle={} | ledger={}",
                catalog.toolNames().size(), tables.getVersion(), config.getMaxSteps(), config.getMaxRetries(),
                oracle != null, config.isRunLedgerEnabled());
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Runs the plan with no deadline. */
    public RunResult run(Decision planHint, String userInput, Map<String, ?> contextSnapshot) {
        return run(planHint, userInput, contextSnapshot, null);
    }

    /**
     * Runs the plan. The deadline is checked between steps, once at least one step has run;
     * a step in flight is never interrupted by it.
     *
     * @param deadline null for none
     */
    public RunResult run(Decision planHint, String userInput, Map<String, ?> contextSnapshot, Instant deadline) {
        String runId = UUID.randomUUID().toString();
        WorkingContext ctx = WorkingContext.seed(contextSnapshot, config.getMemoryKeys(), memoryStore);
        RunSession session = new RunSession(this, runId, userInput, ctx, deadline);
        return session.execute(planHint);
    }

    QuillConfig config() {
        return config;
    }

    ToolCatalog catalog() {
        return catalog;
    }

    ArgumentResolver resolver() {
        return resolver;
    }

    PlanTranslator translator() {
        return translator;
    }

    StepExecutor stepExecutor() {
        return stepExecutor;
    }

    ReplanningOracle oracle() {
        return oracle;
    }

    QualityGate qualityGate() {
        return qualityGate;
    }

    RunLedger ledger() {
        return ledger;
    }

    RunMetrics metrics() {
        return metrics;
    }

    Clock clock() {
        return clock;
    }

    public MeterRegistry getMeterRegistry() {
        return metrics.getRegistry();
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "quill-tool-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {
        private QuillConfig config;
        private ToolCatalog catalog;
        private ToolInvoker toolInvoker;
        private ResolverTables resolverTables;
        private ReplanningOracle oracle;
        private QualityEvaluator qualityEvaluator;
        private MemoryStore memoryStore;
        private LedgerStore ledgerStore;
        private MeterRegistry meterRegistry;
        private ExecutorService executor;
        private Clock clock;

        private Builder() {
        }

        public Builder config(QuillConfig config) {
            this.config = config;
            return this;
        }

        /** Uses the registry for both the catalog (annotation introspection) and invocation. */
        public Builder tools(ToolRegistry registry) {
            Objects.requireNonNull(registry, "registry");
            this.catalog = ToolCatalog.fromRegistry(registry);
            this.toolInvoker = new RegistryToolInvoker(registry);
            return this;
        }

        public Builder catalog(ToolCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder toolInvoker(ToolInvoker toolInvoker) {
            this.toolInvoker = toolInvoker;
            return this;
        }

        public Builder resolverTables(ResolverTables resolverTables) {
            this.resolverTables = resolverTables;
            return this;
        }

        /** Optional; without an oracle the run ends once the initial plan drains. */
        public Builder oracle(ReplanningOracle oracle) {
            this.oracle = oracle;
            return this;
        }

        /** Optional; the heuristic scorer is used when absent. */
        public Builder qualityEvaluator(QualityEvaluator qualityEvaluator) {
            this.qualityEvaluator = qualityEvaluator;
            return this;
        }

        public Builder memoryStore(MemoryStore memoryStore) {
            this.memoryStore = memoryStore;
            return this;
        }

        /** Used only when the run ledger is enabled in config. */
        public Builder ledgerStore(LedgerStore ledgerStore) {
            this.ledgerStore = ledgerStore;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Orchestrator build() {
            return new Orchestrator(this);
        }
    }
}
