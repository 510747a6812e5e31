package com.osman.badges.core.fs;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Derives the artifact path {@code baseDir/{rowIndex}-{displayName}.{extension}} for a record.
 * <p>
 * The base directory is created on demand; creation is idempotent and tolerates several workers
 * creating it at the same time. Repeated allocation with the same inputs yields the same path
 * and, under the default {@link CollisionPolicy#OVERWRITE}, the later artifact replaces the
 * earlier one.
 */
public final class OutputPathAllocator {

    private final CollisionPolicy collisionPolicy;

    public OutputPathAllocator() {
        this(CollisionPolicy.OVERWRITE);
    }

    public OutputPathAllocator(CollisionPolicy collisionPolicy) {
        this.collisionPolicy = Objects.requireNonNull(collisionPolicy, "collisionPolicy");
    }

    /**
     * @param baseDir     directory that holds artifacts of this kind
     * @param rowIndex    1-based row index of the record
     * @param displayName raw (unshaped) display name of the record
     * @param extension   file extension without the leading dot
     * @return the artifact path; its parent directory exists when this method returns
     * @throws IOException if the directory cannot be created, or the file exists under
     *                     {@link CollisionPolicy#FAIL_IF_EXISTS}
     */
    public Path allocate(Path baseDir, int rowIndex, String displayName, String extension) throws IOException {
        Objects.requireNonNull(baseDir, "baseDir");
        Objects.requireNonNull(extension, "extension");
        Files.createDirectories(baseDir);

        Path target = baseDir.resolve(fileName(rowIndex, displayName, extension));
        if (collisionPolicy == CollisionPolicy.FAIL_IF_EXISTS && Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        return target;
    }

    static String fileName(int rowIndex, String displayName, String extension) {
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        return rowIndex + "-" + FileNameSanitizer.sanitize(displayName) + "." + ext;
    }
}
