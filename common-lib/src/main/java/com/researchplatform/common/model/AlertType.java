package com.researchplatform.common.model;

public enum AlertType {
    MARKET,
    NEWS
}
