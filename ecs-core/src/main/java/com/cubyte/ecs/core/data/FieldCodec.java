package com.cubyte.ecs.core.data;

/**
 * User-supplied conversion between a field value and a package, for types the packer does not know.
 *
 * @param <T> the field type
 */
public interface FieldCodec<T> {

    Package encode(T value);

    /**
     * @throws PackageException if the package does not describe a valid value
     */
    T decode(Package pkg);
}
