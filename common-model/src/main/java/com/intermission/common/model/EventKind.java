package com.intermission.common.model;

/** What the platform is asked to display. */
public enum EventKind {
    INTERSTITIAL,
    REWARDED
}
