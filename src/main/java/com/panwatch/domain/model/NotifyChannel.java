package com.panwatch.domain.model;

import com.panwatch.domain.enums.ChannelType;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A configured push destination. At most one channel is the installation default,
 * used whenever an agent resolves to no channels of its own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotifyChannel {

    private Long id;
    private String name;
    private ChannelType type;

    /** Type-specific keys (tokens, webhook keys, endpoints). */
    @Builder.Default
    private Map<String, String> config = new HashMap<>();

    private boolean enabled;
    private boolean defaultChannel;
}
