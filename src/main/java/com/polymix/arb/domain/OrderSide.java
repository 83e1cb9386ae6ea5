package com.polymix.arb.domain;

public enum OrderSide {
    YES, NO
}
