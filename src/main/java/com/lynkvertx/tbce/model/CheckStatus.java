package com.lynkvertx.tbce.model;

public enum CheckStatus {
    PASS,
    FAIL
}
