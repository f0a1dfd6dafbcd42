package com.assetdiffbot.core.checkout;

/**
 * Base and head refs prepared by {@link CheckoutManager#openRevisionPair}.
 */
public record RevisionPair(
    RevisionRef base,
    RevisionRef head
) {}
