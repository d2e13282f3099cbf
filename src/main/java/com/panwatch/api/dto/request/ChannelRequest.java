package com.panwatch.api.dto.request;

import com.panwatch.domain.enums.ChannelType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Type is required")
    private ChannelType type;

    /** Type-specific keys, e.g. bot_token and chat_id for telegram. */
    private Map<String, String> config;

    private Boolean enabled;

    private boolean defaultChannel;
}
