package io.tenderbridge.backend.notification.channel;

import io.tenderbridge.backend.notification.TenderNotice;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fans notices out to every enabled {@link NotificationChannel}. A failing channel is logged and
 * skipped.
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final List<NotificationChannel> channels;

  public NotificationDispatcher(List<NotificationChannel> channelBeans) {
    this.channels = channelBeans.stream().filter(NotificationChannel::isEnabled).toList();
  }

  public void dispatch(TenderNotice notice) {
    for (var channel : channels) {
      try {
        channel.deliver(notice);
      } catch (Exception e) {
        log.warn(
            "Failed to deliver notice via channel={} type={} tender={}",
            channel.channelId(),
            notice.type(),
            notice.tenderId(),
            e);
      }
    }
  }
}
