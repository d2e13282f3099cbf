package com.panwatch.service;

import com.panwatch.agent.AnalysisService;
import com.panwatch.domain.model.AiModel;
import com.panwatch.domain.model.ConnectionTestResult;
import com.panwatch.entity.AiModelEntity;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.AiModelMapper;
import com.panwatch.repository.jpa.AiModelJpaRepository;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** AI model CRUD; default handling mirrors {@link ChannelService}. */
@Service
public class ModelService {

    private static final Logger log = LoggerFactory.getLogger(ModelService.class);

    private final AiModelJpaRepository aiModelJpaRepository;
    private final AiModelMapper aiModelMapper;
    private final AnalysisService analysisService;

    public ModelService(AiModelJpaRepository aiModelJpaRepository, AiModelMapper aiModelMapper, AnalysisService analysisService) {
        this.aiModelJpaRepository = aiModelJpaRepository;
        this.aiModelMapper = aiModelMapper;
        this.analysisService = analysisService;
    }

    @Transactional(readOnly = true)
    public List<AiModel> getAll() {
        return aiModelMapper.toDomainList(aiModelJpaRepository.findAll()).stream()
                .sorted(Comparator.comparing(AiModel::getId))
                .toList();
    }

    @Transactional
    public AiModel create(AiModel model) {
        model.setId(null);
        boolean promote = model.isDefaultModel();
        model.setDefaultModel(false);
        AiModelEntity saved = aiModelJpaRepository.save(aiModelMapper.toEntity(model));
        if (promote) {
            saved = promote(saved.getId());
        }
        log.info("AI model created: id={}, provider={}, model={}", saved.getId(), saved.getProviderId(), saved.getModel());
        return aiModelMapper.toDomain(saved);
    }

    @Transactional
    public AiModel update(Long id, AiModel updates) {
        find(id);
        boolean promote = updates.isDefaultModel();
        updates.setDefaultModel(false);
        updates.setId(id);
        AiModelEntity saved = aiModelJpaRepository.save(aiModelMapper.toEntity(updates));
        if (promote) {
            saved = promote(id);
        }
        log.info("AI model updated: id={}, provider={}, model={}", saved.getId(), saved.getProviderId(), saved.getModel());
        return aiModelMapper.toDomain(saved);
    }

    @Transactional
    public void delete(Long id) {
        find(id);
        aiModelJpaRepository.deleteById(id);
        log.info("AI model deleted: id={}", id);
    }

    @Transactional
    public AiModel setDefault(Long id) {
        find(id);
        AiModelEntity saved = promote(id);
        log.info("Default AI model set: id={}, name={}", saved.getId(), saved.getName());
        return aiModelMapper.toDomain(saved);
    }

    public ConnectionTestResult test(Long id) {
        return analysisService.testModel(id);
    }

    private AiModelEntity promote(Long id) {
        aiModelJpaRepository.makeDefault(id);
        return find(id);
    }

    private AiModelEntity find(Long id) {
        return aiModelJpaRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("AI model", id));
    }
}
