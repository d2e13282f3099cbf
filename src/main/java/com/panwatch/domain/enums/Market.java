package com.panwatch.domain.enums;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Exchanges a watched stock trades on, with their local zone and continuous-trading sessions.
 * Session ends are exclusive.
 */
public enum Market {
    CN("Asia/Shanghai", List.of(
            new Session(LocalTime.of(9, 30), LocalTime.of(11, 30)),
            new Session(LocalTime.of(13, 0), LocalTime.of(15, 0)))),
    HK("Asia/Hong_Kong", List.of(
            new Session(LocalTime.of(9, 30), LocalTime.of(12, 0)),
            new Session(LocalTime.of(13, 0), LocalTime.of(16, 0)))),
    US("America/New_York", List.of(
            new Session(LocalTime.of(9, 30), LocalTime.of(16, 0))));

    private final ZoneId zone;
    private final List<Session> sessions;

    Market(String zone, List<Session> sessions) {
        this.zone = ZoneId.of(zone);
        this.sessions = sessions;
    }

    public ZoneId getZone() {
        return zone;
    }

    public List<Session> getSessions() {
        return sessions;
    }

    public record Session(LocalTime start, LocalTime end) {

        public boolean contains(LocalTime time) {
            return !time.isBefore(start) && time.isBefore(end);
        }
    }
}
