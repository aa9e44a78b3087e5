package org.example.integrationservice.client.ats;

public enum AtsHealthStatus {
    HEALTHY,
    DEGRADED,
    DOWN
}
