package org.zwolang;

import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zwolang.error.ZwomError;
import org.zwolang.model.Workout;
import org.zwolang.render.ZwoRenderer;
import org.zwolang.syntax.ZwomParser;
import org.zwolang.validate.ValidatedWorkout;
import org.zwolang.validate.WorkoutValidator;

/**
 * Converts ZWOM source text to ZWO markup: parse, validate, render.
 *
 * <p>Example usage:
 * <pre>{@code
 * var zwo = ZwomConverter.create()
 *                        .convert("""
 *                            META {NAME "Foo", AUTHOR "sco1", DESCRIPTION "d"}
 *                            FREE {DURATION 11:06}
 *                            """);
 * }</pre>
 *
 * Instances are immutable and may be shared.
 */
public final class ZwomConverter {
    private static final Logger log = LoggerFactory.getLogger(ZwomConverter.class);

    private final ZwomParser parser;
    private final ZwoRenderer renderer;

    private ZwomConverter(ZwomParser parser, ZwoRenderer renderer) {
        this.parser = parser;
        this.renderer = renderer;
    }

    public static ZwomConverter create() {
        return create(ConverterConfig.DEFAULT);
    }

    public static ZwomConverter create(ConverterConfig config) {
        return new ZwomConverter(ZwomParser.create(config.parserConfig()),
                                 ZwoRenderer.create(config.indent(), config.sportType()));
    }

    public Either<ZwomError, Workout> parse(String source) {
        return parser.parse(source);
    }

    public Either<ZwomError, ValidatedWorkout> validate(Workout workout) {
        return WorkoutValidator.validate(workout);
    }

    public String render(ValidatedWorkout workout) {
        return renderer.render(workout);
    }

    /**
     * Run the whole pipeline. The first syntax or validation error is returned as is.
     */
    public Either<ZwomError, String> convert(String source) {
        return parse(source)
            .flatMap(this::validate)
            .map(this::render)
            .peekLeft(error -> log.debug("Conversion failed: {}", error.message()));
    }
}
