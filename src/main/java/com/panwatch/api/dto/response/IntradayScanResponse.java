package com.panwatch.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IntradayScanResponse {

    @Builder.Default
    private List<MoveAlert> alerts = List.of();

    private String message;
    private int scannedCount;
    private int alertCount;
    private boolean hasWatchlist;
    private boolean trading;
}
