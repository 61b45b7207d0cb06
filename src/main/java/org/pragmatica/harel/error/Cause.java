package org.pragmatica.harel.error;

/**
 * Reason of a failed {@link Result}.
 */
public interface Cause {
    String message();
}
