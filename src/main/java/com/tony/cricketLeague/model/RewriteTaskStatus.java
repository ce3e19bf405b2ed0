package com.tony.cricketLeague.model;

public enum RewriteTaskStatus {
    PENDING,
    DONE,
    FAILED
}
