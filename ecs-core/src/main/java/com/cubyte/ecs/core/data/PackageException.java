package com.cubyte.ecs.core.data;

/**
 * Raised when a package cannot be produced from, or turned back into, component data:
 * kind mismatches, missing fields, unknown types or malformed external encodings.
 */
public class PackageException extends RuntimeException {
    public PackageException(String message) {
        super(message);
    }

    public PackageException(String message, Throwable cause) {
        super(message, cause);
    }
}
