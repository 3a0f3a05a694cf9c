package com.elssolution.livestxm.codec;

/** A message that cannot be decoded or does not fit the scan it claims to belong to. */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
