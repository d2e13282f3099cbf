package com.panwatch.api.controller;

import com.panwatch.api.dto.request.InstrumentAgentRequest;
import com.panwatch.api.dto.request.InstrumentRequest;
import com.panwatch.api.dto.request.InstrumentUpdateRequest;
import com.panwatch.api.dto.response.AgentRunResponse;
import com.panwatch.domain.model.Instrument;
import com.panwatch.domain.model.InstrumentAgentBinding;
import com.panwatch.mapper.AgentRunResultMapper;
import com.panwatch.service.InstrumentService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the watchlist and per-instrument agent enrolment.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET    /api/instruments} -- list instruments</li>
 *   <li>{@code POST   /api/instruments} -- add an instrument</li>
 *   <li>{@code PUT    /api/instruments/{id}} -- rename or enable/disable</li>
 *   <li>{@code DELETE /api/instruments/{id}} -- delete with its bindings</li>
 *   <li>{@code GET    /api/instruments/{id}/agents} -- agent bindings</li>
 *   <li>{@code PUT    /api/instruments/{id}/agents} -- replace agent bindings</li>
 *   <li>{@code POST   /api/instruments/{id}/agents/{agentName}/trigger} -- run one agent now</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/instruments")
public class InstrumentController {

    private final InstrumentService instrumentService;
    private final AgentRunResultMapper agentRunResultMapper;

    public InstrumentController(InstrumentService instrumentService, AgentRunResultMapper agentRunResultMapper) {
        this.instrumentService = instrumentService;
        this.agentRunResultMapper = agentRunResultMapper;
    }

    @GetMapping
    public List<Instrument> getAll() {
        return instrumentService.getAll();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Instrument create(@RequestBody @Valid InstrumentRequest request) {
        Instrument instrument = Instrument.builder()
                .symbol(request.getSymbol())
                .name(request.getName())
                .market(request.getMarket())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .build();
        return instrumentService.create(instrument);
    }

    @PutMapping("/{id}")
    public Instrument update(@PathVariable Long id, @RequestBody @Valid InstrumentUpdateRequest request) {
        return instrumentService.update(id, request.getName(), request.getEnabled());
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable Long id) {
        instrumentService.delete(id);
        return Map.of("message", "Instrument deleted");
    }

    @GetMapping("/{id}/agents")
    public List<InstrumentAgentBinding> getAgents(@PathVariable Long id) {
        return instrumentService.getBindings(id);
    }

    @PutMapping("/{id}/agents")
    public List<InstrumentAgentBinding> replaceAgents(
            @PathVariable Long id, @RequestBody @Valid List<InstrumentAgentRequest> requests) {
        return instrumentService.replaceBindings(id, requests);
    }

    @PostMapping("/{id}/agents/{agentName}/trigger")
    public AgentRunResponse trigger(
            @PathVariable Long id,
            @PathVariable String agentName,
            @RequestParam(defaultValue = "true") boolean bypassThrottle) {
        return agentRunResultMapper.toResponse(instrumentService.trigger(id, agentName, bypassThrottle));
    }
}
