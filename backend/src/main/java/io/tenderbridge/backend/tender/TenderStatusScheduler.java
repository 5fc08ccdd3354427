package io.tenderbridge.backend.tender;

import io.tenderbridge.backend.security.Actor;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Date-driven transitions: DRAFT tenders whose publish date has arrived are published, and OPEN
 * tenders past their closing date are closed. Each tender is moved in its own transaction through
 * {@link TenderLifecycleService} as the system actor, so one failure does not stop the rest.
 */
@Component
public class TenderStatusScheduler {

  private static final Logger log = LoggerFactory.getLogger(TenderStatusScheduler.class);

  private final TenderRepository tenderRepository;
  private final TenderLifecycleService lifecycleService;
  private final Clock clock;

  public TenderStatusScheduler(
      TenderRepository tenderRepository, TenderLifecycleService lifecycleService, Clock clock) {
    this.tenderRepository = tenderRepository;
    this.lifecycleService = lifecycleService;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${tenderbridge.tenders.transition-interval:300000}")
  public void scheduledRun() {
    runTransitions();
  }

  public TransitionSummary runTransitions() {
    var now = Instant.now(clock);
    int published =
        apply(
            tenderRepository.findIdsDueForPublication(TenderStatus.DRAFT, now),
            TenderStatus.PUBLISHED);
    int closed =
        apply(
            tenderRepository.findIdsPastClosingDate(TenderStatus.OPEN, now), TenderStatus.CLOSED);

    if (published > 0 || closed > 0) {
      log.info("Tender status scheduler: {} published, {} closed", published, closed);
    } else {
      log.debug("Tender status scheduler: nothing due");
    }
    return new TransitionSummary(published, closed);
  }

  private int apply(List<UUID> tenderIds, TenderStatus target) {
    int moved = 0;
    for (var tenderId : tenderIds) {
      try {
        lifecycleService.changeStatus(tenderId, target, null, Actor.system());
        moved++;
      } catch (Exception e) {
        log.error("Failed to move tender {} to {}", tenderId, target.value(), e);
      }
    }
    return moved;
  }

  public record TransitionSummary(int published, int closed) {}
}
