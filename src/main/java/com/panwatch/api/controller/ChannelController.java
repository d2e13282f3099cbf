package com.panwatch.api.controller;

import com.panwatch.api.dto.request.ChannelRequest;
import com.panwatch.domain.model.ConnectionTestResult;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.service.ChannelService;
import jakarta.validation.Valid;
import java.util.HashMap;
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
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for notification channels.
 *
 * <p>{@code POST /api/channels/{id}/test} sends a test message to that channel only and never
 * touches notification throttling.
 */
@RestController
@RequestMapping("/api/channels")
public class ChannelController {

    private final ChannelService channelService;

    public ChannelController(ChannelService channelService) {
        this.channelService = channelService;
    }

    @GetMapping
    public List<NotifyChannel> getAll() {
        return channelService.getAll();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public NotifyChannel create(@RequestBody @Valid ChannelRequest request) {
        return channelService.create(toDomain(request));
    }

    @PutMapping("/{id}")
    public NotifyChannel update(@PathVariable Long id, @RequestBody @Valid ChannelRequest request) {
        return channelService.update(id, toDomain(request));
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable Long id) {
        channelService.delete(id);
        return Map.of("message", "Channel deleted");
    }

    @PostMapping("/{id}/default")
    public NotifyChannel setDefault(@PathVariable Long id) {
        return channelService.setDefault(id);
    }

    @PostMapping("/{id}/test")
    public ConnectionTestResult test(@PathVariable Long id) {
        return channelService.test(id);
    }

    private static NotifyChannel toDomain(ChannelRequest request) {
        return NotifyChannel.builder()
                .name(request.getName())
                .type(request.getType())
                .config(request.getConfig() != null ? new HashMap<>(request.getConfig()) : new HashMap<>())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .defaultChannel(request.isDefaultChannel())
                .build();
    }
}
