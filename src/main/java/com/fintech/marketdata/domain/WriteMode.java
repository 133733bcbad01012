package com.fintech.marketdata.domain;

/**
 * How a store write treats existing partition content.
 */
public enum WriteMode {
    /** Merge with existing bars; on a timestamp conflict the new bar wins. */
    APPEND,
    /** Replace each touched partition wholesale. */
    OVERWRITE
}
