package com.packsync.notification;

/**
 * Outbound channel for sync lifecycle notifications. Fire-and-forget: implementations
 * must not throw, and callers never let a delivery problem change a pass result.
 */
public interface SyncNotifier {

    void syncStarted(SyncNotification notification);

    void syncCompleted(SyncNotification notification);

    void syncFailed(SyncNotification notification);
}
