package org.example.integrationservice.model;

public enum ActorType {
    COORDINATOR,
    CANDIDATE,
    SYSTEM
}
