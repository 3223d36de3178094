package com.frenchtoast.alert.core.error;

/**
 * A status or subscriber store read/write failed.
 *
 * <p>Propagated to whoever started the cycle. The cycle is abandoned and picked up again by
 * the next trigger.</p>
 */
public class PersistenceException extends AlertEngineException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
