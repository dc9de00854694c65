// file: storage/src/main/java/io/courselite/storage/CatalogLoadException.java
package io.courselite.storage;

/**
 * Raised when a course source cannot be read at all (missing file, I/O failure).
 * Individual bad lines never raise this; they are reported in {@link LoadReport}.
 */
public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
