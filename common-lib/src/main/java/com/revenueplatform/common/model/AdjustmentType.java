package com.revenueplatform.common.model;

public enum AdjustmentType {
    INCREASE,
    DECREASE,
    NO_CHANGE
}
