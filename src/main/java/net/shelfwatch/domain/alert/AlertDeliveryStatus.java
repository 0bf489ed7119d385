package net.shelfwatch.domain.alert;

public enum AlertDeliveryStatus {
    PENDING,
    SENT,
    FAILED
}
