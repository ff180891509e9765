package de.bsommerfeld.feedengine.core.config;

/**
 * Which Atom element wins when an entry carries both {@code <summary>} and
 * {@code <content>}. RSS items are not affected.
 */
public enum ContentPolicy {

    /** {@code <summary>} first, {@code <content>} as fallback. */
    SUMMARY_FIRST,

    /** {@code <content>} first, {@code <summary>} as fallback. */
    CONTENT_FIRST
}
