package com.panwatch.agent;

import com.panwatch.datasource.DataSourceRouter;
import com.panwatch.datasource.FetchRequest;
import com.panwatch.datasource.FetchResult;
import com.panwatch.domain.enums.DataSourceType;
import com.panwatch.domain.model.DataSourceBinding;
import com.panwatch.domain.model.Instrument;
import com.panwatch.exception.DataUnavailableException;
import com.panwatch.observability.ExecutionTrail;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetching phase of a run: every required and optional data type of the agent, through the
 * router.
 *
 * <p>One request carries all instruments only when every candidate binding of the type
 * supports batch; otherwise each instrument is fetched on its own. A required type fails
 * the run only when no instrument got any data for it; optional types are skipped with a
 * trail entry.
 */
@Component
public class AgentDataCollector {

    private static final Logger log = LoggerFactory.getLogger(AgentDataCollector.class);

    private final DataSourceRouter dataSourceRouter;

    public AgentDataCollector(DataSourceRouter dataSourceRouter) {
        this.dataSourceRouter = dataSourceRouter;
    }

    public CollectedData collect(
            BuiltinAgent agent,
            List<Instrument> instruments,
            List<DataSourceBinding> bindings,
            Map<String, Object> options,
            ExecutionTrail trail) {
        CollectedData data = new CollectedData();
        for (DataSourceType type : agent.getRequiredData()) {
            fetchType(type, instruments, bindings, options, trail, data, true);
        }
        for (DataSourceType type : agent.getOptionalData()) {
            fetchType(type, instruments, bindings, options, trail, data, false);
        }
        return data;
    }

    /**
     * Fetches one type outside of an agent run, with the same batching as a run.
     *
     * @throws DataUnavailableException if no instrument got any data
     */
    public CollectedData collect(
            DataSourceType type, List<Instrument> instruments, List<DataSourceBinding> bindings, ExecutionTrail trail) {
        CollectedData data = new CollectedData();
        fetchType(type, instruments, bindings, Map.of(), trail, data, true);
        return data;
    }

    private void fetchType(
            DataSourceType type,
            List<Instrument> instruments,
            List<DataSourceBinding> bindings,
            Map<String, Object> options,
            ExecutionTrail trail,
            CollectedData data,
            boolean required) {
        List<DataSourceBinding> candidates = dataSourceRouter.candidates(type, bindings);
        boolean batchable = !candidates.isEmpty() && candidates.stream().allMatch(DataSourceBinding::isSupportsBatch);
        List<List<Instrument>> requests = batchable || instruments.size() <= 1
                ? List.of(instruments)
                : instruments.stream().map(List::of).toList();

        DataUnavailableException lastFailure = null;
        int succeeded = 0;
        for (List<Instrument> group : requests) {
            FetchRequest request = FetchRequest.builder().instruments(group).options(options).build();
            try {
                FetchResult result = dataSourceRouter.fetch(type, request, bindings);
                trail.appendAll(result.getLogs());
                data.add(type, result.getItems());
                succeeded++;
            } catch (DataUnavailableException e) {
                trail.appendAll(e.getLogs());
                lastFailure = e;
            }
        }

        if (succeeded > 0 || lastFailure == null) {
            return;
        }
        if (required) {
            throw lastFailure;
        }
        log.info("Optional data {} unavailable, continuing without it", type);
        trail.error("datasource:" + type, "Optional data " + type + " unavailable; continuing without it", 0);
    }
}
