package org.example.integrationservice.model;

public enum NotificationType {
    CANDIDATE_AVAILABILITY_REQUEST,
    CANDIDATE_SELF_SCHEDULE_LINK,
    BOOKING_CONFIRMATION,
    RESCHEDULE_CONFIRMATION,
    CANCEL_NOTICE,
    REMINDER_24H,
    REMINDER_2H
}
