package com.example.readrouting.model;

/**
 * Role of a configured database node. Only the primary accepts writes.
 */
public enum NodeRole {
    PRIMARY,
    REPLICA
}
