/* (C)2026 */
package com.ammann.reflectometry.exception;

/**
 * Exception indicating that a measurement document could not be read or lacks a
 * required metadata entry.
 *
 * <p>Mapped to HTTP 422 (Unprocessable Entity) by {@link GlobalExceptionHandler}.
 */
public class MetadataReadException extends ApiException
{
    public MetadataReadException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public MetadataReadException(String message)
    {
        super(message);
    }

    /**
     * Creates exception for a metadata entry missing from a section.
     */
    public static MetadataReadException missingEntry(String section, String key)
    {
        return new MetadataReadException(
                String.format("Missing metadata entry '%s' in section '%s'", key, section));
    }
}
