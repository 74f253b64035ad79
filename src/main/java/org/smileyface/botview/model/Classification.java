package org.smileyface.botview.model;

/**
 * Verdict of the block detector for one raw fetch result.
 */
public enum Classification {
    SUCCESS,
    BLOCKED,
    CHALLENGED
}
