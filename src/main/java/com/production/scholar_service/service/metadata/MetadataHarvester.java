package com.production.scholar_service.service.metadata;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.exception.SourceUnavailableException;
import com.production.scholar_service.model.Metadata;
import com.production.scholar_service.model.MetadataCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Queries the selected bibliographic sources in parallel, all bounded by the same timeout.
 * A source that errors or times out is recorded and otherwise ignored; the harvest never fails.
 */
@Service
@Slf4j
public class MetadataHarvester {

    private final Map<String, MetadataSource> sources = new LinkedHashMap<>();
    private final AsyncTaskExecutor executor;
    private final AppConfig appConfig;

    public MetadataHarvester(List<MetadataSource> sources,
                             @Qualifier("metadataExecutor") AsyncTaskExecutor executor,
                             AppConfig appConfig) {
        for (MetadataSource source : sources) {
            this.sources.put(source.name(), source);
        }
        this.executor = executor;
        this.appConfig = appConfig;
        log.info("Metadata sources registered: {}", this.sources.keySet());
    }

    /**
     * @param hints     locally derived metadata used to build the queries
     * @param requested source names to consult; empty means every enabled source
     */
    public HarvestResult harvest(Metadata hints, List<String> requested) {
        long start = System.currentTimeMillis();
        var config = appConfig.getMetadata();
        List<String> selected = select(requested);

        Map<String, Future<SourceRun>> runs = new TreeMap<>();
        Map<String, SourceOutcome> outcomes = new TreeMap<>();
        for (String name : selected) {
            MetadataSource source = sources.get(name);
            if (source == null || !source.supports(hints)) {
                outcomes.put(name, SourceOutcome.SKIPPED);
                continue;
            }
            try {
                runs.put(name, executor.submit(() -> query(source, hints)));
            } catch (TaskRejectedException e) {
                log.warn("No free metadata thread for {}: {}", name, e.getMessage());
                outcomes.put(name, SourceOutcome.UNAVAILABLE);
            }
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.getSourceTimeoutSeconds());
        List<MetadataCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, Future<SourceRun>> entry : runs.entrySet()) {
            SourceRun run = await(entry.getKey(), entry.getValue(), deadline);
            List<MetadataCandidate> usable = run.candidates().stream()
                    .filter(c -> c.isIdentifierMatch() || c.getConfidence() >= config.getSimilarityFloor())
                    .toList();
            SourceOutcome outcome = run.outcome() == SourceOutcome.OK && usable.isEmpty() ? SourceOutcome.EMPTY : run.outcome();
            outcomes.put(entry.getKey(), outcome);
            candidates.addAll(usable);
        }
        candidates.sort(Comparator.comparing(MetadataCandidate::getSource).thenComparingInt(MetadataCandidate::getRank));

        log.info("[TIMING] Metadata harvest: {} candidates from {} sources in {}ms - {}",
                candidates.size(), runs.size(), System.currentTimeMillis() - start, outcomes);
        return new HarvestResult(candidates, outcomes);
    }

    public List<String> availableSources() {
        return new ArrayList<>(sources.keySet());
    }

    private List<String> select(List<String> requested) {
        List<String> enabled = appConfig.getMetadata().getEnabledSources().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
        if (requested == null || requested.isEmpty()) {
            return enabled;
        }
        List<String> selected = new ArrayList<>();
        for (String name : requested) {
            String normalized = name.toLowerCase(Locale.ROOT).trim();
            if (!selected.contains(normalized)) {
                selected.add(normalized);
            }
        }
        return selected;
    }

    /**
     * Waits for one lookup until the shared deadline. A lookup still running then is cancelled,
     * which interrupts its HTTP request and frees the thread.
     */
    private SourceRun await(String name, Future<SourceRun> run, long deadline) {
        try {
            return run.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            run.cancel(true);
            log.warn("Metadata source {} timed out", name);
            return SourceRun.timedOut();
        } catch (ExecutionException e) {
            log.warn("Metadata source {} failed: {}", name, e.getCause().getMessage(), e.getCause());
            return new SourceRun(SourceOutcome.UNAVAILABLE, List.of());
        } catch (InterruptedException e) {
            run.cancel(true);
            Thread.currentThread().interrupt();
            return SourceRun.timedOut();
        }
    }

    private SourceRun query(MetadataSource source, Metadata hints) {
        long start = System.currentTimeMillis();
        try {
            List<MetadataCandidate> candidates = source.lookup(hints);
            log.debug("{} answered with {} candidates in {}ms", source.name(), candidates.size(),
                    System.currentTimeMillis() - start);
            return new SourceRun(candidates.isEmpty() ? SourceOutcome.EMPTY : SourceOutcome.OK, candidates);
        } catch (SourceUnavailableException e) {
            log.warn("Metadata source unavailable: {}", e.getMessage());
            return new SourceRun(SourceOutcome.UNAVAILABLE, List.of());
        } catch (RuntimeException e) {
            log.warn("Metadata source {} failed: {}", source.name(), e.getMessage(), e);
            return new SourceRun(SourceOutcome.UNAVAILABLE, List.of());
        }
    }

    private record SourceRun(SourceOutcome outcome, List<MetadataCandidate> candidates) {
        static SourceRun timedOut() {
            return new SourceRun(SourceOutcome.TIMEOUT, List.of());
        }
    }
}
