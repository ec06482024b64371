package org.zwolang.validate;

import io.vavr.collection.Vector;
import io.vavr.control.Option;
import org.zwolang.model.Block;

/**
 * Immutable state of the left-to-right validation scan over the body blocks.
 */
record ScanState(Mode mode, int repeatCount, Vector<Block> buffer, Vector<Block> emitted, Option<Integer> ftp) {

    enum Mode {
        NORMAL,
        IN_REPEAT
    }

    static ScanState initial(Option<Integer> ftp) {
        return new ScanState(Mode.NORMAL, 0, Vector.empty(), Vector.empty(), ftp);
    }

    boolean inRepeat() {
        return mode == Mode.IN_REPEAT;
    }

    /**
     * Emit a validated block, or hold it back while inside a repeat region.
     */
    ScanState accept(Block block) {
        return inRepeat()
               ? new ScanState(mode, repeatCount, buffer.append(block), emitted, ftp)
               : new ScanState(mode, repeatCount, buffer, emitted.append(block), ftp);
    }

    ScanState openRepeat(int count) {
        return new ScanState(Mode.IN_REPEAT, count, Vector.empty(), emitted, ftp);
    }

    /**
     * Emit the buffered region {@code repeatCount} times, contiguously.
     */
    ScanState closeRepeat() {
        var expanded = emitted;
        for (int i = 0; i < repeatCount; i++) {
            expanded = expanded.appendAll(buffer);
        }
        return new ScanState(Mode.NORMAL, 0, Vector.empty(), expanded, ftp);
    }
}
