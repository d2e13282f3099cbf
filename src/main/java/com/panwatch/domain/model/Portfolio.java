package com.panwatch.domain.model;

import java.util.List;
import java.util.Objects;

/** Holdings of the enabled accounts in a set of instruments, ordered by account. */
public final class Portfolio {

    private static final Portfolio EMPTY = new Portfolio(List.of());

    private final List<Holding> holdings;

    public Portfolio(List<Holding> holdings) {
        this.holdings = List.copyOf(holdings);
    }

    public static Portfolio empty() {
        return EMPTY;
    }

    public List<Holding> holdings() {
        return holdings;
    }

    public List<Holding> holdingsFor(Long instrumentId) {
        return holdings.stream().filter(h -> Objects.equals(h.getInstrumentId(), instrumentId)).toList();
    }

    public boolean isEmpty() {
        return holdings.isEmpty();
    }
}
