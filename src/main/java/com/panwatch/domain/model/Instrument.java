package com.panwatch.domain.model;

import com.panwatch.domain.enums.Market;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A watched stock. Disabled instruments are never scheduled. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Instrument {

    private Long id;
    private String symbol;
    private String name;
    private Market market;
    private boolean enabled;
    private LocalDateTime createdAt;
}
