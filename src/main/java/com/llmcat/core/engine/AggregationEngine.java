package com.llmcat.core.engine;

import com.llmcat.core.aggregate.ResultAggregator;
import com.llmcat.core.dispatch.TaskProcessor;
import com.llmcat.core.dispatch.TaskQueue;
import com.llmcat.core.dispatch.WorkerPool;
import com.llmcat.core.filter.ExclusionFilter;
import com.llmcat.core.logging.MdcContext;
import com.llmcat.core.metrics.AggregationMetrics;
import com.llmcat.core.model.AggregationRequest;
import com.llmcat.core.model.AggregationResult;
import com.llmcat.core.model.ExpansionResult;
import com.llmcat.core.model.FileTask;
import com.llmcat.core.scanner.TargetExpander;
import com.llmcat.core.source.ContentReader;
import com.llmcat.core.source.UrlFetcher;
import com.llmcat.core.tokens.TokenAccountant;
import com.llmcat.core.tokens.TokenAccountantProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Runs one aggregation: validate, open the tokenizer, expand targets, dispatch the
 * tasks and collect the document.
 * <p>
 * Fatal problems (no targets, a thread count below 1, an unusable encoding) are
 * raised as {@link AggregationException}s before any task is dispatched. The
 * tokenizer is closed exactly once on every path out of {@link #aggregate}.
 */
@Service
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final TokenAccountantProvider tokenizers;
    private final ContentReader reader;
    private final UrlFetcher fetcher;
    private final WorkerPool workerPool;
    private final AggregationMetrics metrics;

    @Autowired
    public AggregationEngine(TokenAccountantProvider tokenizers, ContentReader reader, UrlFetcher fetcher,
                             @Autowired(required = false) AggregationMetrics metrics) {
        this(tokenizers, reader, fetcher, new WorkerPool(), metrics);
    }

    AggregationEngine(TokenAccountantProvider tokenizers, ContentReader reader, UrlFetcher fetcher,
                      WorkerPool workerPool, AggregationMetrics metrics) {
        this.tokenizers = tokenizers;
        this.reader = reader;
        this.fetcher = fetcher;
        this.workerPool = workerPool;
        this.metrics = metrics;
    }

    /**
     * Aggregates every target of the request into one document.
     *
     * @return the document, token total and task counters
     * @throws NoTargetsException            if the request has no targets
     * @throws InvalidConfigurationException if the thread count is below 1
     * @throws com.llmcat.core.tokens.TokenizerInitException if the encoding cannot be loaded
     */
    public AggregationResult aggregate(AggregationRequest request) {
        if (request.targets().isEmpty()) {
            throw new NoTargetsException();
        }
        if (request.threads() < 1) {
            throw new InvalidConfigurationException(
                    "Thread count must be at least 1, got " + request.threads());
        }

        String runId = generateRunId();
        MdcContext.setRun(runId);
        long startMs = System.currentTimeMillis();
        try (TokenAccountant tokens = tokenizers.open(request.encoding())) {
            log.info("Run {}: {} targets, {} exclusions, {} threads, encoding {}",
                    runId, request.targets().size(), request.exclusions().size(),
                    request.threads(), tokens.encoding());

            var expander = new TargetExpander(request.baseDirectory(), ExclusionFilter.of(request.exclusions()));
            ExpansionResult expansion = expander.expand(request.targets());

            var aggregator = new ResultAggregator(expansion.listing().render());
            var processor = new TaskProcessor(request.baseDirectory(), reader, fetcher,
                    tokens, aggregator, runId, metrics);

            int workers = workerPool.execute(new TaskQueue<FileTask>(expansion.tasks()),
                    request.threads(), processor);
            AggregationResult result = aggregator.result(workers);

            long elapsedMs = System.currentTimeMillis() - startMs;
            if (metrics != null) {
                metrics.recordRunDuration(elapsedMs);
                metrics.recordTokens(result.tokenTotal());
                metrics.recordWorkers(workers);
            }
            log.info("Run {} finished in {}ms: {} tasks ({} failed), {} tokens",
                    runId, elapsedMs, result.taskCount(), result.failedTasks(), result.tokenTotal());
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    private static String generateRunId() {
        return "RUN-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
