package com.hrkey.rvl.dto;

public enum RiskLevel {
    LOW,       // 0~19
    MEDIUM,    // 20~39
    HIGH,      // 40~69
    CRITICAL   // 70+ (storage auto-flag)
}
