package org.zwolang.validate;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zwolang.error.ValidationError;
import org.zwolang.error.ZwomError;
import org.zwolang.model.Block;
import org.zwolang.model.Tag;
import org.zwolang.model.Value;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.zwolang.model.Tag.AUTHOR;
import static org.zwolang.model.Tag.CADENCE;
import static org.zwolang.model.Tag.COOLDOWN;
import static org.zwolang.model.Tag.DESCRIPTION;
import static org.zwolang.model.Tag.DURATION;
import static org.zwolang.model.Tag.END_REPEAT;
import static org.zwolang.model.Tag.FREE;
import static org.zwolang.model.Tag.INTERVALS;
import static org.zwolang.model.Tag.NAME;
import static org.zwolang.model.Tag.POWER;
import static org.zwolang.model.Tag.RAMP;
import static org.zwolang.model.Tag.REPEAT;
import static org.zwolang.model.Tag.SEGMENT;
import static org.zwolang.model.Tag.START_REPEAT;
import static org.zwolang.model.Tag.WARMUP;

/**
 * Per-kind checks applied to a single block. Value rules for POWER and CADENCE run first, then the
 * required-key schema, then the structural typing of each used parameter.
 */
final class BlockRules {
    private static final Logger log = LoggerFactory.getLogger(BlockRules.class);

    static final String FTP_REQUIRED = "An FTP must be specified in the META block to use absolute watts.";

    static final List<Tag> META_KEYS = List.of(NAME, AUTHOR, DESCRIPTION);

    private static final Map<Tag, List<Tag>> REQUIRED = new EnumMap<>(Map.of(
        FREE, List.of(DURATION),
        SEGMENT, List.of(DURATION, POWER),
        RAMP, List.of(DURATION, POWER),
        WARMUP, List.of(DURATION, POWER),
        COOLDOWN, List.of(DURATION, POWER),
        INTERVALS, List.of(REPEAT, DURATION, POWER),
        START_REPEAT, List.of(REPEAT),
        END_REPEAT, List.of()));

    private static final Map<Tag, Set<Tag>> USED = new EnumMap<>(Map.of(
        FREE, EnumSet.of(DURATION, CADENCE),
        SEGMENT, EnumSet.of(DURATION, POWER, CADENCE),
        RAMP, EnumSet.of(DURATION, POWER, CADENCE),
        WARMUP, EnumSet.of(DURATION, POWER, CADENCE),
        COOLDOWN, EnumSet.of(DURATION, POWER, CADENCE),
        INTERVALS, EnumSet.of(REPEAT, DURATION, POWER, CADENCE),
        START_REPEAT, EnumSet.of(REPEAT),
        END_REPEAT, EnumSet.noneOf(Tag.class)));

    private BlockRules() {}

    static boolean isKnownKind(Tag kind) {
        return REQUIRED.containsKey(kind);
    }

    static Either<ZwomError, Block> check(Block block, Option<Integer> ftp) {
        return checkValues(block, ftp)
            .flatMap(checked -> requireKeys(checked, REQUIRED.get(checked.kind())))
            .flatMap(BlockRules::checkStructure)
            .peek(BlockRules::logIgnoredKeys);
    }

    // === Value rules ===

    static Either<ZwomError, Block> checkValues(Block block, Option<Integer> ftp) {
        for (var entry : block.params().entrySet()) {
            var violation = entry.getKey() == POWER
                            ? powerViolation(entry.getValue(), ftp)
                            : entry.getKey() == CADENCE
                              ? cadenceViolation(block.kind(), entry.getValue())
                              : Option.<String>none();
            if (violation.isDefined()) {
                return fail(violation.get());
            }
        }
        return Either.right(block);
    }

    static Option<String> powerViolation(Value power, Option<Integer> ftp) {
        if (power instanceof Value.Range range) {
            return powerPointViolation(range.left(), ftp)
                .orElse(() -> powerPointViolation(range.right(), ftp));
        }
        return powerPointViolation(power, ftp);
    }

    private static Option<String> powerPointViolation(Value power, Option<Integer> ftp) {
        if (power instanceof Value.Number watts) {
            if (watts.value() == 0) {
                return Option.some("Power must be > 0, received: " + watts.value());
            }
            return ftp.isEmpty()
                   ? Option.some(FTP_REQUIRED)
                   : Option.none();
        }
        if (Value.isRelativePower(power)) {
            return Option.none();
        }
        return Option.some("POWER must be a percentage, power zone or absolute watts, received: '" + power.format() + "'");
    }

    static Option<String> cadenceViolation(Tag kind, Value cadence) {
        if (cadence instanceof Value.Range && kind != INTERVALS) {
            return Option.some("Cadence ranges are only valid for Interval blocks.");
        }
        if (kind == INTERVALS && !(cadence instanceof Value.Range)) {
            return Option.some("Cadence spec for Interval blocks must be a range.");
        }
        return Option.none();
    }

    // === Required keys ===

    static Either<ZwomError, Block> requireKeys(Block block, List<Tag> required) {
        var missing = required.stream()
                              .filter(key -> !block.has(key))
                              .map(Tag::name)
                              .collect(Collectors.joining(", "));
        if (!missing.isEmpty()) {
            return fail(block.kind() + " block missing required keys: " + missing);
        }
        return Either.right(block);
    }

    // === Structure ===

    static Either<ZwomError, Block> checkStructure(Block block) {
        var kind = block.kind();
        var used = USED.get(kind);
        for (var entry : block.params().entrySet()) {
            if (!used.contains(entry.getKey())) {
                continue;
            }
            var value = entry.getValue();
            var violation = switch (entry.getKey()) {
                case DURATION -> durationShape(kind, value);
                case POWER -> powerShape(kind, value);
                case REPEAT -> repeatShape(kind, value);
                case CADENCE -> cadenceShape(value);
                default -> Option.<String>none();
            };
            if (violation.isDefined()) {
                return fail(violation.get());
            }
        }
        return Either.right(block);
    }

    private static Option<String> durationShape(Tag kind, Value duration) {
        if (kind == INTERVALS) {
            return duration instanceof Value.Range range
                   && range.left() instanceof Value.Duration
                   && range.right() instanceof Value.Duration
                   ? Option.none()
                   : Option.some("INTERVALS DURATION must be a range of durations, received: '" + duration.format() + "'");
        }
        return duration instanceof Value.Duration
               ? Option.none()
               : Option.some(kind + " DURATION must be a duration, received: '" + duration.format() + "'");
    }

    private static Option<String> powerShape(Tag kind, Value power) {
        if ((kind.isRampLike() || kind == INTERVALS) && !(power instanceof Value.Range)) {
            return Option.some(kind + " POWER must be a range, received: '" + power.format() + "'");
        }
        return Option.none();
    }

    static Option<String> repeatShape(Tag kind, Value repeat) {
        if (!(repeat instanceof Value.Number count)) {
            return Option.some(kind + " must have an integer REPEAT value.");
        }
        return count.value() == 0
               ? Option.some("REPEAT must be > 0.")
               : Option.none();
    }

    private static Option<String> cadenceShape(Value cadence) {
        var integral = cadence instanceof Value.Range range
                       ? range.left() instanceof Value.Number && range.right() instanceof Value.Number
                       : cadence instanceof Value.Number;
        return integral
               ? Option.none()
               : Option.some("CADENCE must be an integer rpm, received: '" + cadence.format() + "'");
    }

    private static void logIgnoredKeys(Block block) {
        var used = USED.get(block.kind());
        for (var key : block.params().keySet()) {
            if (!used.contains(key)) {
                log.debug("Ignoring {} in {} block", key, block.kind());
            }
        }
    }

    static <T> Either<ZwomError, T> fail(String reason) {
        return Either.left(ValidationError.of(reason));
    }
}
