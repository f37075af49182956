package com.qubi.sitepoller.core.spi;

import com.qubi.sitepoller.core.model.ErrorKind;

import java.util.Objects;

public class CollectException extends Exception {

    private final ErrorKind kind;

    public CollectException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public CollectException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
