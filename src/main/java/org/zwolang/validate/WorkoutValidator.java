package org.zwolang.validate;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zwolang.error.ZwomError;
import org.zwolang.model.Block;
import org.zwolang.model.Tag;
import org.zwolang.model.Value;
import org.zwolang.model.Workout;

import static org.zwolang.validate.BlockRules.fail;

/**
 * Single left-to-right scan over the raw blocks: per-kind schema validation, FTP tracking, and
 * expansion of {@code START_REPEAT} / {@code END_REPEAT} regions.
 *
 * <p>The scan is a fold over {@link ScanState}; the first violation ends it. The input workout is
 * never modified.
 */
public final class WorkoutValidator {
    private static final Logger log = LoggerFactory.getLogger(WorkoutValidator.class);

    private WorkoutValidator() {}

    public static Either<ZwomError, ValidatedWorkout> validate(Workout workout) {
        if (workout.isEmpty() || workout.blocks().get(0).kind() != Tag.META) {
            return fail("ZWOM file must begin with a META block");
        }

        var meta = workout.blocks().get(0);
        var body = io.vavr.collection.List.ofAll(workout.blocks()).tail();

        return resolveFtp(meta)
            .flatMap(ftp -> body.foldLeft(Either.<ZwomError, ScanState>right(ScanState.initial(ftp)),
                                          (state, block) -> state.flatMap(current -> step(current, block))))
            .flatMap(WorkoutValidator::finish)
            .map(state -> new ValidatedWorkout(meta, state.emitted().toJavaList(), state.ftp()))
            .peek(validated -> log.debug("Validated {} body block(s), FTP {}",
                                         validated.body().size(),
                                         validated.ftp().map(String::valueOf).getOrElse("not set")));
    }

    private static Either<ZwomError, Option<Integer>> resolveFtp(Block meta) {
        return BlockRules.requireKeys(meta, BlockRules.META_KEYS)
                         .flatMap(checked -> checked.param(Tag.FTP)
                                                    .map(WorkoutValidator::ftpOf)
                                                    .getOrElse(() -> Either.right(Option.none())));
    }

    private static Either<ZwomError, Option<Integer>> ftpOf(Value value) {
        if (!(value instanceof Value.Number ftp)) {
            return fail("FTP must be a positive integer, received: '" + value.format() + "'");
        }
        if (ftp.value() == 0) {
            return fail("FTP must be > 0, received: " + ftp.value());
        }
        return Either.right(Option.some(ftp.value()));
    }

    private static Either<ZwomError, ScanState> step(ScanState state, Block block) {
        var kind = block.kind();

        if (kind == Tag.META) {
            return fail("Only one META block is allowed and it must be the first block");
        }
        if (!BlockRules.isKnownKind(kind)) {
            return fail("Unknown workout tag: '" + kind + "'");
        }
        if (kind == Tag.START_REPEAT && state.inRepeat()) {
            return fail("Nested block chunk repetition is not supported.");
        }
        if (kind == Tag.END_REPEAT && !state.inRepeat()) {
            return fail("Missing opening START_REPEAT block.");
        }

        return BlockRules.check(block, state.ftp())
                         .map(checked -> advance(state, checked));
    }

    private static ScanState advance(ScanState state, Block block) {
        if (block.kind().isRepeatMarker() && !block.messages().isEmpty()) {
            log.debug("Dropping {} message(s) attached to {}", block.messages().size(), block.kind());
        }
        if (block.kind() == Tag.START_REPEAT) {
            // REPEAT is a positive Number once the block passed its checks
            var count = ((Value.Number) block.params().get(Tag.REPEAT)).value();
            return state.openRepeat(count);
        }
        if (block.kind() == Tag.END_REPEAT) {
            log.debug("Expanding {} block(s) x {}", state.buffer().size(), state.repeatCount());
            return state.closeRepeat();
        }
        return state.accept(block);
    }

    private static Either<ZwomError, ScanState> finish(ScanState state) {
        return state.inRepeat()
               ? fail("START_REPEAT is missing a matching END_REPEAT.")
               : Either.right(state);
    }
}
