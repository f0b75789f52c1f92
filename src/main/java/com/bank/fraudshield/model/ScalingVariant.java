package com.bank.fraudshield.model;

public enum ScalingVariant {
    NONE,
    STANDARD,
    MIN_MAX
}
