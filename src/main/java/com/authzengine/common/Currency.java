package com.authzengine.common;

/**
 * Currencies accepted by the banking rules.
 */
public enum Currency {
    USD,
    EUR,
    GBP
}
