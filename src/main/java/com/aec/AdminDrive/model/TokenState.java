package com.aec.AdminDrive.model;

public enum TokenState {
    UNAUTHENTICATED,
    ACTIVE,
    REFRESHING,
    EXPIRED,
    DEACTIVATED
}
