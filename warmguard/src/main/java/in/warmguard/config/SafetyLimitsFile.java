package in.warmguard.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.warmguard.domain.health.AccountPhase;
import in.warmguard.domain.health.ActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * JSON override document for the quota tables.
 *
 * <pre>
 * {
 *   "hourlyLimits": { "mature": { "like": 25 } },
 *   "dailyTaskLimits": { "follow": 15 }
 * }
 * </pre>
 * Keys are case-insensitive phase and action names; entries not listed keep their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SafetyLimitsFile(
    @JsonProperty("hourlyLimits")
    Map<String, Map<String, Integer>> hourlyLimits,

    @JsonProperty("dailyTaskLimits")
    Map<String, Integer> dailyTaskLimits
) {
    private static final Logger log = LoggerFactory.getLogger(SafetyLimitsFile.class);

    public static SafetyLimitsFile load(Path path, ObjectMapper mapper) {
        try (InputStream in = Files.newInputStream(path)) {
            SafetyLimitsFile file = mapper.readValue(in, SafetyLimitsFile.class);
            log.info("[CONFIG] Loaded safety limits from {}", path);
            return file;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read safety limits file " + path + ": " + e.getMessage(), e);
        }
    }

    public HourlyLimitTable applyTo(HourlyLimitTable base) {
        if (hourlyLimits == null || hourlyLimits.isEmpty()) {
            return base;
        }
        Map<AccountPhase, Map<ActionType, Integer>> overrides = new EnumMap<>(AccountPhase.class);
        hourlyLimits.forEach((phaseName, row) -> {
            AccountPhase phase = parse(() -> AccountPhase.fromDbValue(phaseName), "phase", phaseName);
            Map<ActionType, Integer> typed = new EnumMap<>(ActionType.class);
            row.forEach((typeName, limit) ->
                typed.put(parse(() -> ActionType.fromWireName(typeName), "action type", typeName), limit));
            overrides.put(phase, typed);
        });
        return base.withOverrides(overrides);
    }

    public DailyTaskLimits applyTo(DailyTaskLimits base) {
        if (dailyTaskLimits == null || dailyTaskLimits.isEmpty()) {
            return base;
        }
        Map<ActionType, Integer> overrides = new EnumMap<>(ActionType.class);
        dailyTaskLimits.forEach((typeName, limit) ->
            overrides.put(parse(() -> ActionType.fromWireName(typeName), "action type", typeName), limit));
        return base.withOverrides(overrides);
    }

    private static <T> T parse(Supplier<T> parser, String what, String raw) {
        try {
            return parser.get();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + what + " in safety limits file: " + raw, e);
        }
    }
}
