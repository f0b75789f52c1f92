package com.bank.fraudshield.engine.explain;

/** How neural models without native attribution are explained. */
public enum DlAttributionMode {
    /** Replace one feature at a time by its baseline and measure the score change. */
    OCCLUSION,
    /** Leave neural models out of feature attribution. */
    NONE
}
