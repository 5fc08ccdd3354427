package io.tenderbridge.backend.notification.channel;

import io.tenderbridge.backend.notification.TenderNotice;

/** A delivery mechanism for tender notices (log, email, webhook...). */
public interface NotificationChannel {

  /** Unique identifier for this channel, e.g. "log". */
  String channelId();

  void deliver(TenderNotice notice);

  boolean isEnabled();
}
