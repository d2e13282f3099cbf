package com.panwatch.datasource;

import com.panwatch.domain.model.Instrument;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Instruments (one, or many for batch-capable providers) to fetch one data type for. */
@Value
@Builder
public class FetchRequest {

    List<Instrument> instruments;

    /** Agent parameters such as news lookback hours; providers ignore what they do not know. */
    @Builder.Default
    Map<String, Object> options = Map.of();

    public static FetchRequest of(List<Instrument> instruments) {
        return FetchRequest.builder().instruments(List.copyOf(instruments)).build();
    }

    public List<String> symbols() {
        return instruments.stream().map(Instrument::getSymbol).toList();
    }
}
