package io.hearthwarrio.ariaindex.webdriver;

import io.hearthwarrio.ariaindex.core.AriaIndexException;

/**
 * Thrown when a ref, path or selector cannot be turned into exactly the element it describes.
 */
public class TargetResolutionException extends AriaIndexException {
    public TargetResolutionException(String message) {
        super(message);
    }

    public TargetResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
