package com.bank.fraudshield.model;

public enum ModelFamily {
    ML,
    DL
}
