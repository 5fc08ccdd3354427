package io.tenderbridge.backend.notification.channel;

import io.tenderbridge.backend.notification.TenderNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default channel: writes every notice to the application log. */
@Component
public class LoggingNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);

  @Override
  public String channelId() {
    return "log";
  }

  @Override
  public void deliver(TenderNotice notice) {
    log.info(
        "[{}] tender={} audience={} user={} {}",
        notice.type(),
        notice.tenderId(),
        notice.audienceCompanyId(),
        notice.audienceUserId(),
        notice.title());
  }

  @Override
  public boolean isEnabled() {
    return true;
  }
}
