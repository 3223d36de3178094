package com.frenchtoast.alert.core.source;

import com.frenchtoast.alert.core.error.SourceException;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * StatusSource
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Reads the current status code from the upstream feed. One fetch per
 * call; retry policy belongs to the trigger cadence, not to this
 * contract.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - Mono emits the code, trimmed and upper-cased
 * - Mono errors with {@link SourceException}:
 *     NETWORK   → transport failure, timeout, non-2xx
 *     MALFORMED → unreadable document, missing or empty status
 *
 * The code is NOT validated against the known levels here.
 */
public interface StatusSource {

    Mono<String> fetch();
}
