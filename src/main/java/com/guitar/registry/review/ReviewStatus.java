package com.guitar.registry.review;

public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
