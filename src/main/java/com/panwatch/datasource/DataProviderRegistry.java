package com.panwatch.datasource;

import com.panwatch.domain.enums.DataSourceType;
import java.util.Optional;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Finds the provider implementation for a binding. Providers are optional beans; a binding
 * that names an unregistered provider simply fails its attempt.
 */
@Component
public class DataProviderRegistry {

    private final ObjectProvider<DataProvider> dataProviders;

    public DataProviderRegistry(ObjectProvider<DataProvider> dataProviders) {
        this.dataProviders = dataProviders;
    }

    public Optional<DataProvider> find(DataSourceType type, String providerId) {
        return dataProviders.orderedStream()
                .filter(p -> p.providerId().equalsIgnoreCase(providerId))
                .filter(p -> p.supportedTypes().contains(type))
                .findFirst();
    }
}
