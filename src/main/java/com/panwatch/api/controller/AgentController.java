package com.panwatch.api.controller;

import com.panwatch.agent.IntradayScanner;
import com.panwatch.api.dto.request.AgentUpdateRequest;
import com.panwatch.api.dto.response.AgentRunResponse;
import com.panwatch.api.dto.response.IntradayScanResponse;
import com.panwatch.domain.model.AgentDefinition;
import com.panwatch.domain.model.AgentRun;
import com.panwatch.mapper.AgentRunResultMapper;
import com.panwatch.service.AgentService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for agents.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET  /api/agents} -- list agents with their defaults</li>
 *   <li>{@code PUT  /api/agents/{name}} -- toggle, reschedule, change model, channels or parameters</li>
 *   <li>{@code POST /api/agents/{name}/trigger} -- run now over all enrolled instruments</li>
 *   <li>{@code GET  /api/agents/{name}/history} -- recent runs, newest first</li>
 *   <li>{@code POST /api/agents/intraday/scan?analyze=false} -- sweep the intraday watchlist for sharp moves</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final AgentService agentService;
    private final AgentRunResultMapper agentRunResultMapper;
    private final IntradayScanner intradayScanner;

    public AgentController(
            AgentService agentService, AgentRunResultMapper agentRunResultMapper, IntradayScanner intradayScanner) {
        this.agentService = agentService;
        this.agentRunResultMapper = agentRunResultMapper;
        this.intradayScanner = intradayScanner;
    }

    @GetMapping
    public List<AgentDefinition> getAll() {
        return agentService.getAll();
    }

    @GetMapping("/{name}")
    public AgentDefinition get(@PathVariable String name) {
        return agentService.get(name);
    }

    @PutMapping("/{name}")
    public AgentDefinition update(@PathVariable String name, @RequestBody @Valid AgentUpdateRequest request) {
        return agentService.update(name, request);
    }

    @PostMapping("/{name}/trigger")
    public List<AgentRunResponse> trigger(
            @PathVariable String name, @RequestParam(defaultValue = "true") boolean bypassThrottle) {
        return agentRunResultMapper.toResponseList(agentService.trigger(name, bypassThrottle));
    }

    @GetMapping("/{name}/history")
    public List<AgentRun> history(@PathVariable String name, @RequestParam(defaultValue = "20") int limit) {
        return agentService.history(name, limit);
    }

    @PostMapping("/intraday/scan")
    public IntradayScanResponse scanIntraday(@RequestParam(defaultValue = "false") boolean analyze) {
        return intradayScanner.scan(analyze);
    }
}
