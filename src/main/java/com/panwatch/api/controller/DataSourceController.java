package com.panwatch.api.controller;

import com.panwatch.api.dto.request.DataSourceRequest;
import com.panwatch.domain.model.ConnectionTestResult;
import com.panwatch.domain.model.DataSourceBinding;
import com.panwatch.service.DataSourceService;
import jakarta.validation.Valid;
import java.util.ArrayList;
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

/** REST API for data source bindings, listed in trial order. */
@RestController
@RequestMapping("/api/datasources")
public class DataSourceController {

    private final DataSourceService dataSourceService;

    public DataSourceController(DataSourceService dataSourceService) {
        this.dataSourceService = dataSourceService;
    }

    @GetMapping
    public List<DataSourceBinding> getAll() {
        return dataSourceService.getAll();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DataSourceBinding create(@RequestBody @Valid DataSourceRequest request) {
        return dataSourceService.create(toDomain(request));
    }

    @PutMapping("/{id}")
    public DataSourceBinding update(@PathVariable Long id, @RequestBody @Valid DataSourceRequest request) {
        return dataSourceService.update(id, toDomain(request));
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable Long id) {
        dataSourceService.delete(id);
        return Map.of("message", "Data source deleted");
    }

    @PostMapping("/{id}/test")
    public ConnectionTestResult test(@PathVariable Long id) {
        return dataSourceService.test(id);
    }

    private static DataSourceBinding toDomain(DataSourceRequest request) {
        return DataSourceBinding.builder()
                .name(request.getName())
                .type(request.getType())
                .provider(request.getProvider())
                .priority(request.getPriority())
                .supportsBatch(request.isSupportsBatch())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .testSymbols(request.getTestSymbols() != null ? new ArrayList<>(request.getTestSymbols()) : new ArrayList<>())
                .config(request.getConfig() != null ? new HashMap<>(request.getConfig()) : new HashMap<>())
                .build();
    }
}
