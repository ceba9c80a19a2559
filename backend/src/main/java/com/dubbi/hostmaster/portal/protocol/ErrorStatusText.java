package com.dubbi.hostmaster.portal.protocol;

/**
 * Portal numeric status code → human-readable text. Pure lookup, injected so it can be stubbed.
 */
@FunctionalInterface
public interface ErrorStatusText {
    String text(int code);
}
