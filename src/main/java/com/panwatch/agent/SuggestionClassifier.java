package com.panwatch.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.panwatch.domain.enums.SuggestionAction;
import com.panwatch.domain.model.Instrument;
import com.panwatch.domain.model.Suggestion;
import com.panwatch.mapper.JsonHelper;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Maps free-form analysis output onto the fixed action taxonomy.
 *
 * <p>The action is taken from the first source that yields one:
 * <ol>
 *   <li>a JSON object with an {@code action} (or {@code suggestion}) field</li>
 *   <li>a labelled line such as {@code 建议: 减仓} or {@code Action: sell}</li>
 *   <li>the earliest action keyword anywhere in the text, English or Chinese</li>
 * </ol>
 * Unrecognised output is WATCH without an alert, never an error.
 *
 * <p>{@code [无需提醒]} / {@code [no alert]} force no alert, {@code [提醒]} / {@code [alert]} force
 * one; otherwise BUY, ADD, REDUCE and SELL alert.
 */
@Component
public class SuggestionClassifier {

    private static final Pattern NO_ALERT_MARKER = Pattern.compile("\\[(无需提醒|no[ _-]?alert)]", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALERT_MARKER = Pattern.compile("\\[(提醒|alert)]", Pattern.CASE_INSENSITIVE);

    private static final Pattern LABELLED_LINE = Pattern.compile(
            "^[\\s>#*-]*(?:\\*\\*)?(action|suggestion|建议|操作|操作建议)(?:\\*\\*)?\\s*[:：]\\s*(.+)$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final int REASON_LIMIT = 200;

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> JSON_ARRAY = new TypeReference<>() {};

    private static final Map<Pattern, SuggestionAction> KEYWORDS = new LinkedHashMap<>();

    static {
        // Chinese first so "加仓" wins over a later English word at the same index
        keyword("加仓|增持", SuggestionAction.ADD);
        keyword("减仓|减持", SuggestionAction.REDUCE);
        keyword("买入|建仓", SuggestionAction.BUY);
        keyword("卖出|清仓", SuggestionAction.SELL);
        keyword("持有|持仓不动", SuggestionAction.HOLD);
        keyword("观望|继续关注", SuggestionAction.WATCH);
        keyword("\\bbuy\\b", SuggestionAction.BUY);
        keyword("\\b(?:add|accumulate)\\b", SuggestionAction.ADD);
        keyword("\\b(?:reduce|trim)\\b", SuggestionAction.REDUCE);
        keyword("\\b(?:sell|exit)\\b", SuggestionAction.SELL);
        keyword("\\bhold\\b", SuggestionAction.HOLD);
        keyword("\\b(?:watch|wait)\\b", SuggestionAction.WATCH);
    }

    private static void keyword(String regex, SuggestionAction action) {
        KEYWORDS.put(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), action);
    }

    public Suggestion classify(String raw) {
        if (raw == null || raw.isBlank()) {
            return Suggestion.watch(raw);
        }
        Optional<Map<String, Object>> json = jsonObject(raw);
        if (json.isPresent()) {
            Optional<Suggestion> fromJson = fromJson(json.get(), raw);
            if (fromJson.isPresent()) {
                return fromJson.get();
            }
        }
        return fromText(raw);
    }

    /**
     * Splits a batch analysis into one suggestion per instrument. Accepts a JSON array of
     * objects carrying a {@code symbol}, or plain text where each instrument's section starts
     * at the first mention of its symbol or name. Instruments without a section get WATCH.
     */
    public Map<Long, Suggestion> classifyBatch(String raw, List<Instrument> instruments) {
        Map<Long, Suggestion> result = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            instruments.forEach(i -> result.put(i.getId(), Suggestion.watch(null)));
            return result;
        }

        Optional<List<Map<String, Object>>> array = jsonArray(raw);
        if (array.isPresent()) {
            Map<String, Map<String, Object>> bySymbol = new HashMap<>();
            for (Map<String, Object> item : array.get()) {
                Object symbol = item.get("symbol");
                if (symbol != null) {
                    bySymbol.putIfAbsent(String.valueOf(symbol).trim().toUpperCase(Locale.ROOT), item);
                }
            }
            for (Instrument instrument : instruments) {
                Map<String, Object> item = bySymbol.get(instrument.getSymbol().toUpperCase(Locale.ROOT));
                String itemRaw = item == null ? null : JsonHelper.toJson(item);
                result.put(
                        instrument.getId(),
                        item == null ? Suggestion.watch(null) : fromJson(item, itemRaw).orElse(Suggestion.watch(itemRaw)));
            }
            return result;
        }

        List<Segment> starts = new ArrayList<>();
        for (Instrument instrument : instruments) {
            int at = firstMention(raw, instrument);
            if (at >= 0) {
                starts.add(new Segment(instrument.getId(), at));
            }
        }
        starts.sort(Comparator.comparingInt(Segment::start));

        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1).start() : raw.length();
            String section = raw.substring(starts.get(i).start(), end);
            result.put(starts.get(i).instrumentId(), fromText(section));
        }
        for (Instrument instrument : instruments) {
            result.putIfAbsent(instrument.getId(), Suggestion.watch(null));
        }
        return result;
    }

    private record Segment(Long instrumentId, int start) {}

    private static int firstMention(String raw, Instrument instrument) {
        int bySymbol = instrument.getSymbol() == null ? -1 : raw.indexOf(instrument.getSymbol());
        int byName = instrument.getName() == null || instrument.getName().isBlank() ? -1 : raw.indexOf(instrument.getName());
        if (bySymbol < 0) {
            return byName;
        }
        return byName < 0 ? bySymbol : Math.min(bySymbol, byName);
    }

    private Suggestion fromText(String raw) {
        Matcher labelled = LABELLED_LINE.matcher(raw);
        SuggestionAction action = null;
        while (action == null && labelled.find()) {
            action = earliestKeyword(labelled.group(2)).orElse(null);
        }
        if (action == null) {
            action = earliestKeyword(raw).orElse(null);
        }
        if (action == null) {
            return Suggestion.builder()
                    .action(SuggestionAction.WATCH)
                    .shouldAlert(alertOverride(raw).orElse(false))
                    .reason(reason(raw))
                    .raw(raw)
                    .build();
        }
        return Suggestion.builder()
                .action(action)
                .shouldAlert(alertOverride(raw).orElse(action.isActionable()))
                .reason(reason(raw))
                .raw(raw)
                .build();
    }

    private Optional<Suggestion> fromJson(Map<String, Object> json, String raw) {
        Object actionValue = json.getOrDefault("action", json.get("suggestion"));
        if (actionValue == null) {
            return Optional.empty();
        }
        Optional<SuggestionAction> action = parseAction(String.valueOf(actionValue));
        if (action.isEmpty()) {
            return Optional.empty();
        }

        Optional<Boolean> override = alertOverride(raw);
        Object flag = json.containsKey("should_alert") ? json.get("should_alert") : json.get("shouldAlert");
        boolean shouldAlert = override.orElseGet(
                () -> flag != null ? Boolean.parseBoolean(String.valueOf(flag)) : action.get().isActionable());

        Object reason = json.get("reason");
        return Optional.of(Suggestion.builder()
                .action(action.get())
                .shouldAlert(shouldAlert)
                .reason(reason != null ? truncate(String.valueOf(reason)) : null)
                .raw(raw)
                .build());
    }

    /** Exact enum name or label first ("SELL", "卖出"), then keyword search. */
    private static Optional<SuggestionAction> parseAction(String value) {
        String trimmed = value.trim();
        for (SuggestionAction action : SuggestionAction.values()) {
            if (action.name().equalsIgnoreCase(trimmed) || action.getLabel().equals(trimmed)) {
                return Optional.of(action);
            }
        }
        return earliestKeyword(trimmed);
    }

    private static Optional<SuggestionAction> earliestKeyword(String text) {
        SuggestionAction best = null;
        int bestIndex = Integer.MAX_VALUE;
        for (Map.Entry<Pattern, SuggestionAction> entry : KEYWORDS.entrySet()) {
            Matcher matcher = entry.getKey().matcher(text);
            if (matcher.find() && matcher.start() < bestIndex) {
                bestIndex = matcher.start();
                best = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    private static Optional<Boolean> alertOverride(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (NO_ALERT_MARKER.matcher(raw).find()) {
            return Optional.of(false);
        }
        if (ALERT_MARKER.matcher(raw).find()) {
            return Optional.of(true);
        }
        return Optional.empty();
    }

    private static String reason(String raw) {
        String cleaned = NO_ALERT_MARKER.matcher(raw).replaceAll("");
        cleaned = ALERT_MARKER.matcher(cleaned).replaceAll("").strip();
        int newline = cleaned.indexOf('\n');
        return truncate(newline > 0 ? cleaned.substring(0, newline).strip() : cleaned);
    }

    private static String truncate(String text) {
        return text.length() <= REASON_LIMIT ? text : text.substring(0, REASON_LIMIT) + "...";
    }

    private static Optional<Map<String, Object>> jsonObject(String raw) {
        int open = raw.indexOf('{');
        int close = raw.lastIndexOf('}');
        if (open < 0 || close <= open) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonHelper.mapper().readValue(raw.substring(open, close + 1), JSON_OBJECT));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static Optional<List<Map<String, Object>>> jsonArray(String raw) {
        int open = raw.indexOf('[');
        int close = raw.lastIndexOf(']');
        if (open < 0 || close <= open) {
            return Optional.empty();
        }
        try {
            List<Map<String, Object>> items =
                    JsonHelper.mapper().readValue(raw.substring(open, close + 1), JSON_ARRAY);
            return items.isEmpty() ? Optional.empty() : Optional.of(items);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
