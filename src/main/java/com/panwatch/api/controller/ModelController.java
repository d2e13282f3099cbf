package com.panwatch.api.controller;

import com.panwatch.api.dto.request.ModelRequest;
import com.panwatch.domain.model.AiModel;
import com.panwatch.domain.model.ConnectionTestResult;
import com.panwatch.service.ModelService;
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
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/models")
public class ModelController {

    private final ModelService modelService;

    public ModelController(ModelService modelService) {
        this.modelService = modelService;
    }

    @GetMapping
    public List<AiModel> getAll() {
        return modelService.getAll();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AiModel create(@RequestBody @Valid ModelRequest request) {
        return modelService.create(toDomain(request));
    }

    @PutMapping("/{id}")
    public AiModel update(@PathVariable Long id, @RequestBody @Valid ModelRequest request) {
        return modelService.update(id, toDomain(request));
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable Long id) {
        modelService.delete(id);
        return Map.of("message", "Model deleted");
    }

    @PostMapping("/{id}/default")
    public AiModel setDefault(@PathVariable Long id) {
        return modelService.setDefault(id);
    }

    @PostMapping("/{id}/test")
    public ConnectionTestResult test(@PathVariable Long id) {
        return modelService.test(id);
    }

    private static AiModel toDomain(ModelRequest request) {
        return AiModel.builder()
                .name(request.getName())
                .providerId(request.getProviderId())
                .model(request.getModel())
                .defaultModel(request.isDefaultModel())
                .build();
    }
}
