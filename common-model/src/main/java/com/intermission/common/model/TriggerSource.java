package com.intermission.common.model;

public enum TriggerSource {
    NATURAL,   // recurring platform timer
    MANUAL,    // explicit request gated by frequency
    REWARDED
}
