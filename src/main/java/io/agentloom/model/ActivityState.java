package io.agentloom.model;

public enum ActivityState {
    IDLE,
    WORKING
}
