package org.zwolang.validate;

import io.vavr.control.Option;
import org.zwolang.model.Block;

import java.util.List;

/**
 * Outcome of validation: the META block, the body with repeat regions expanded, and the FTP
 * resolved from META, if any.
 */
public record ValidatedWorkout(Block meta, List<Block> body, Option<Integer> ftp) {

    public ValidatedWorkout {
        body = List.copyOf(body);
    }
}
