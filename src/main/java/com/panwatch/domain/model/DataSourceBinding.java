package com.panwatch.domain.model;

import com.panwatch.domain.enums.DataSourceType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Binds a data provider implementation to a capability with a fallback priority.
 *
 * <p>Several bindings may serve the same type; DataSourceRouter tries the enabled ones
 * in ascending priority (ties broken by id, then name).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceBinding {

    private Long id;
    private String name;
    private DataSourceType type;

    /** Provider identifier, matched against DataProvider#providerId(). */
    private String provider;

    /** Lower is tried first. */
    private int priority;

    /** Whether the provider accepts many symbols in one call. */
    private boolean supportsBatch;

    private boolean enabled;

    @Builder.Default
    private List<String> testSymbols = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> config = new HashMap<>();
}
