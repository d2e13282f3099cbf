package com.panwatch.datasource;

import com.panwatch.config.DataSourceProperties;
import com.panwatch.core.concurrent.BoundedCall;
import com.panwatch.domain.enums.DataSourceType;
import com.panwatch.domain.model.ConnectionTestResult;
import com.panwatch.domain.model.DataSourceBinding;
import com.panwatch.domain.model.ExecutionLogEntry;
import com.panwatch.domain.model.Instrument;
import com.panwatch.exception.NoProviderAvailableException;
import com.panwatch.observability.AgentMetricsService;
import com.panwatch.observability.ExecutionTrail;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Priority-ordered fallback over the data source bindings of one type.
 *
 * <p>Candidates are the enabled bindings of the requested type ordered by priority, then id,
 * then name, so the trial order is reproducible. Providers are tried one at a time until one
 * returns; every attempt leaves a start entry and a success or error entry in the trail. When
 * all candidates fail the whole trail travels with the {@link NoProviderAvailableException}.
 *
 * <p>Batching is the caller's concern: the router passes the request through unchanged.
 */
@Service
public class DataSourceRouter {

    private static final Logger log = LoggerFactory.getLogger(DataSourceRouter.class);

    public static final Comparator<DataSourceBinding> TRIAL_ORDER = Comparator.comparingInt(DataSourceBinding::getPriority)
            .thenComparing(DataSourceBinding::getId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(DataSourceBinding::getName, Comparator.nullsLast(Comparator.naturalOrder()));

    private final DataProviderRegistry dataProviderRegistry;
    private final DataSourceProperties dataSourceProperties;
    private final Executor providerExecutor;
    private final AgentMetricsService agentMetricsService;
    private final Clock clock;

    public DataSourceRouter(
            DataProviderRegistry dataProviderRegistry,
            DataSourceProperties dataSourceProperties,
            @Qualifier("providerExecutor") Executor providerExecutor,
            AgentMetricsService agentMetricsService,
            Clock clock) {
        this.dataProviderRegistry = dataProviderRegistry;
        this.dataSourceProperties = dataSourceProperties;
        this.providerExecutor = providerExecutor;
        this.agentMetricsService = agentMetricsService;
        this.clock = clock;
    }

    /** Enabled bindings of {@code type} in trial order. */
    public List<DataSourceBinding> candidates(DataSourceType type, List<DataSourceBinding> bindings) {
        return bindings.stream()
                .filter(DataSourceBinding::isEnabled)
                .filter(b -> b.getType() == type)
                .sorted(TRIAL_ORDER)
                .toList();
    }

    /**
     * Fetches {@code type} from the first binding that succeeds.
     *
     * @throws NoProviderAvailableException when no candidate produced data
     */
    public FetchResult fetch(DataSourceType type, FetchRequest request, List<DataSourceBinding> bindings) {
        ExecutionTrail trail = ExecutionTrail.newRun(clock);
        long started = System.currentTimeMillis();

        List<DataSourceBinding> candidates = candidates(type, bindings);
        if (candidates.isEmpty()) {
            trail.error("datasource:" + type, "No enabled data source for " + type, 0);
        }

        for (DataSourceBinding binding : candidates) {
            Optional<List<DataItem>> items = attempt(type, request, binding, trail);
            if (items.isPresent()) {
                return FetchResult.builder()
                        .binding(binding)
                        .items(items.get())
                        .logs(trail.entries())
                        .durationMs(System.currentTimeMillis() - started)
                        .build();
            }
            agentMetricsService.recordFallback();
        }

        log.warn("All {} providers failed for {} {}", candidates.size(), type, request.symbols());
        throw new NoProviderAvailableException(type, trail.entries());
    }

    /**
     * Runs one binding against its test symbols, for the data source "test" button.
     * Never throws; failures come back in the result.
     */
    public ConnectionTestResult test(DataSourceBinding binding) {
        ExecutionTrail trail = ExecutionTrail.newRun(clock);
        long started = System.currentTimeMillis();

        List<Instrument> instruments = binding.getTestSymbols().stream()
                .map(symbol -> Instrument.builder().symbol(symbol).name(symbol).enabled(true).build())
                .toList();
        Optional<List<DataItem>> items =
                attempt(binding.getType(), FetchRequest.of(instruments), binding, trail);

        List<ExecutionLogEntry> logs = trail.entries();
        return ConnectionTestResult.builder()
                .success(items.isPresent())
                .count(items.map(List::size).orElse(0))
                .durationMs(System.currentTimeMillis() - started)
                .error(items.isPresent() ? null : logs.get(logs.size() - 1).getMessage())
                .logs(logs)
                .build();
    }

    private Optional<List<DataItem>> attempt(
            DataSourceType type, FetchRequest request, DataSourceBinding binding, ExecutionTrail trail) {
        String actor = "datasource:" + binding.getName();
        trail.start(actor, String.format("Fetching %s via %s for %s", type, binding.getProvider(), request.symbols()));
        long started = System.currentTimeMillis();

        Optional<DataProvider> provider = dataProviderRegistry.find(type, binding.getProvider());
        if (provider.isEmpty()) {
            log.error("No DataProvider registered for provider={} type={}", binding.getProvider(), type);
            trail.error(actor, "No provider implementation registered for '" + binding.getProvider() + "'", 0);
            return Optional.empty();
        }

        long timeoutMs = dataSourceProperties.getTimeout().toMillis();
        BoundedCall<List<DataItem>> call;
        try {
            call = BoundedCall.submit(
                    providerExecutor, () -> provider.get().fetch(type, request, binding), dataSourceProperties.getTimeout());
        } catch (RejectedExecutionException e) {
            log.warn("Provider pool saturated, skipping {} for {}", binding.getName(), type);
            trail.error(actor, "Rejected: provider pool is saturated", System.currentTimeMillis() - started);
            return Optional.empty();
        }
        try {
            List<DataItem> items = call.await();
            List<DataItem> result = items == null ? List.of() : List.copyOf(items);
            long duration = System.currentTimeMillis() - started;
            trail.success(actor, "Fetched " + result.size() + " items", duration, result.size());
            return Optional.of(result);
        } catch (TimeoutException e) {
            log.warn("Provider {} timed out after {}ms for {}, cancelled", binding.getName(), timeoutMs, type);
            trail.error(actor, "Timed out after " + timeoutMs + "ms", System.currentTimeMillis() - started);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Provider {} failed for {}: {}", binding.getName(), type, cause.getMessage());
            trail.error(actor, describe(cause), System.currentTimeMillis() - started);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            trail.error(actor, "Interrupted", System.currentTimeMillis() - started);
        }
        return Optional.empty();
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
