package com.prioritymind.core.model;

/**
 * Why a bridging-task insertion was rejected.
 */
public enum InsertionFailure {
    VALIDATION,
    REFERENCE,
    ID_COLLISION,
    CIRCULAR_DEPENDENCY
}
