package com.dubbi.hostmaster.portal.web;

/**
 * How one cell's content is decoded into a record field.
 */
public enum FieldRule {
    /** trimmed cell text */
    TEXT,
    /** trimmed cell text plus the href of the cell's first link */
    TEXT_WITH_LINK,
    /** {@code used/total (pct%)} style utilisation figure */
    RATIO
}
