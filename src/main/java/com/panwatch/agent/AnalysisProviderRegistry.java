package com.panwatch.agent;

import java.util.Optional;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class AnalysisProviderRegistry {

    private final ObjectProvider<AnalysisProvider> analysisProviders;

    public AnalysisProviderRegistry(ObjectProvider<AnalysisProvider> analysisProviders) {
        this.analysisProviders = analysisProviders;
    }

    public Optional<AnalysisProvider> find(String providerId) {
        return analysisProviders.orderedStream()
                .filter(p -> p.providerId().equalsIgnoreCase(providerId))
                .findFirst();
    }
}
