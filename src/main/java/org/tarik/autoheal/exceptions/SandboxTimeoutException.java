package org.tarik.autoheal.exceptions;

/**
 * The execution sandbox didn't finish a script within its timeout. Classified as a timeout of the script, not as
 * an orchestrator fault.
 */
public class SandboxTimeoutException extends ServiceException {
    private final long elapsedMillis;

    public SandboxTimeoutException(String message, long elapsedMillis) {
        super(message, ServiceKind.EXECUTION);
        this.elapsedMillis = elapsedMillis;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }
}
