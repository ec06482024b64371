package org.zwolang;

import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zwolang.error.ZwomError;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Text-in, text-out file boundary around {@link ZwomConverter}.
 */
public final class ZwomFiles {
    private static final Logger log = LoggerFactory.getLogger(ZwomFiles.class);

    private static final String TARGET_EXTENSION = ".zwo";

    private final ZwomConverter converter;

    private ZwomFiles(ZwomConverter converter) {
        this.converter = converter;
    }

    public static ZwomFiles create(ZwomConverter converter) {
        return new ZwomFiles(converter);
    }

    /**
     * Source path with its extension replaced by {@code .zwo}.
     */
    public static Path defaultTarget(Path source) {
        var fileName = source.getFileName().toString();
        var dot = fileName.lastIndexOf('.');
        var stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return source.resolveSibling(stem + TARGET_EXTENSION);
    }

    public Either<ZwomError, Path> convert(Path source) throws IOException {
        return convert(source, defaultTarget(source));
    }

    /**
     * Convert {@code source} and write the result to {@code target}, replacing any existing file.
     * Nothing is written unless the conversion succeeds.
     */
    public Either<ZwomError, Path> convert(Path source, Path target) throws IOException {
        var text = Files.readString(source, StandardCharsets.UTF_8);
        var result = converter.convert(text);
        if (result.isLeft()) {
            return Either.left(result.getLeft());
        }
        write(target, result.get());
        log.info("Wrote {}", target);
        return Either.right(target);
    }

    private static void write(Path target, String content) throws IOException {
        var directory = target.toAbsolutePath().getParent();
        var temp = Files.createTempFile(directory, ".zwolang-", ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, replacing in place", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
