package com.interactiveemotes.port;

/** Local-only message to the initiator, e.g. "+10 Abigail". */
public interface NotificationPort {

    void notify(String initiatorId, String message);
}
