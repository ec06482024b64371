package org.zwolang.model;

import io.vavr.control.Option;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Recognised ZWOM keywords. Spelling in source text is the constant name, case-sensitive.
 */
public enum Tag {
    META,
    FREE,
    SEGMENT,
    RAMP,
    WARMUP,
    COOLDOWN,
    INTERVALS,
    START_REPEAT,
    END_REPEAT,

    NAME,
    AUTHOR,
    DESCRIPTION,
    FTP,
    TAGS,
    DURATION,
    POWER,
    CADENCE,
    REPEAT,

    /** Internal marker for a block's message list, never written in source text. */
    MESSAGES;

    private static final Set<Tag> BLOCK_KINDS =
        EnumSet.of(META, FREE, SEGMENT, RAMP, WARMUP, COOLDOWN, INTERVALS, START_REPEAT, END_REPEAT);

    private static final Set<Tag> RAMP_LIKE = EnumSet.of(RAMP, WARMUP, COOLDOWN);

    public static Option<Tag> fromKeyword(String keyword) {
        for (var tag : values()) {
            if (tag != MESSAGES && tag.name().equals(keyword)) {
                return Option.some(tag);
            }
        }
        return Option.none();
    }

    public boolean isBlockKind() {
        return BLOCK_KINDS.contains(this);
    }

    public boolean isRampLike() {
        return RAMP_LIKE.contains(this);
    }

    public boolean isRepeatMarker() {
        return this == START_REPEAT || this == END_REPEAT;
    }

    /**
     * Lower-case element name used for META fields in the output document.
     */
    public String elementName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
