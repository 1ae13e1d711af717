package com.quarry.query.extension;

import com.quarry.query.Request;

/**
 * Turns one extension namespace of a request into query conditions.
 * Runs before the plan is built, once per request.
 */
@FunctionalInterface
public interface ExtensionProcessor {

    void process(Request request);
}
