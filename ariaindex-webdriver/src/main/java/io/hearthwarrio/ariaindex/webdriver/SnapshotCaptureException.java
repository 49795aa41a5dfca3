package io.hearthwarrio.ariaindex.webdriver;

import io.hearthwarrio.ariaindex.core.AriaIndexException;

public class SnapshotCaptureException extends AriaIndexException {
    public SnapshotCaptureException(String message) {
        super(message);
    }

    public SnapshotCaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
