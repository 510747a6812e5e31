package com.osman.badges.core.fs;

/**
 * What {@link OutputPathAllocator} does when the allocated file already exists.
 */
public enum CollisionPolicy {
    /** Return the path anyway; the new artifact replaces the old one. */
    OVERWRITE,
    /** Refuse the allocation with a {@link java.nio.file.FileAlreadyExistsException}. */
    FAIL_IF_EXISTS
}
