package net.shelfwatch.domain.alert;

public enum AlertChannel {
    EMAIL,
    ADMIN
}
