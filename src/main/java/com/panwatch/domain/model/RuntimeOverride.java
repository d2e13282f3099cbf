package com.panwatch.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-invocation overrides supplied by a manual trigger. Highest precedence layer;
 * null/blank/empty fields do not override.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuntimeOverride {

    public static final RuntimeOverride NONE = new RuntimeOverride();

    private boolean bypassThrottle;
    private String schedule;
    private Long aiModelId;
    private List<Long> notifyChannelIds;

    public static RuntimeOverride manual(boolean bypassThrottle) {
        return RuntimeOverride.builder().bypassThrottle(bypassThrottle).build();
    }
}
