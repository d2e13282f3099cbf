package com.panwatch.calendar;

import com.panwatch.domain.enums.Market;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Arrays;
import org.springframework.stereotype.Service;

/**
 * Market hours awareness for agents that only make sense while a market is trading.
 *
 * <p>Each market is evaluated in its own zone, so one instant can be inside the US session and
 * outside both Asian ones. Weekends are closed; exchange holidays are not modelled.
 */
@Service
public class TradingCalendarService {

    public boolean isTrading(Market market, Instant instant) {
        ZonedDateTime local = instant.atZone(market.getZone());
        DayOfWeek dow = local.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        return market.getSessions().stream().anyMatch(s -> s.contains(local.toLocalTime()));
    }

    public boolean isAnyMarketTrading(Instant instant) {
        return Arrays.stream(Market.values()).anyMatch(m -> isTrading(m, instant));
    }
}
