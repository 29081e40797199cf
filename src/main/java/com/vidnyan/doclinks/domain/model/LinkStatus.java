package com.vidnyan.doclinks.domain.model;

/**
 * Outcome of comparing a link's stored fingerprint with the current one.
 */
public enum LinkStatus {
    CURRENT,
    STALE
}
