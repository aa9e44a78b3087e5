package org.example.integrationservice.model;

public enum NotificationEntityType {
    AVAILABILITY_REQUEST,
    SCHEDULING_REQUEST,
    BOOKING
}
