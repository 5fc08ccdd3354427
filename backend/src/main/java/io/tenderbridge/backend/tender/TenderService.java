package io.tenderbridge.backend.tender;

import io.tenderbridge.backend.exception.InvalidStateException;
import io.tenderbridge.backend.exception.ResourceNotFoundException;
import io.tenderbridge.backend.security.Actor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Authoring and querying of tenders. Status changes go through {@link TenderLifecycleService}. */
@Service
public class TenderService {

  private static final Logger log = LoggerFactory.getLogger(TenderService.class);

  private final TenderRepository tenderRepository;
  private final TenderAccessPolicy accessPolicy;
  private final Clock clock;

  public TenderService(
      TenderRepository tenderRepository, TenderAccessPolicy accessPolicy, Clock clock) {
    this.tenderRepository = tenderRepository;
    this.accessPolicy = accessPolicy;
    this.clock = clock;
  }

  @Transactional
  public Tender createTender(Actor actor, TenderDetails details) {
    accessPolicy.requireCanCreate(actor);
    var now = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    requireFutureClosingDate(details.closingDate(), now);

    var tender =
        new Tender(details.title(), details.closingDate(), actor.companyId(), actor.userId(), now);
    applyDetails(tender, details);
    tender = tenderRepository.save(tender);

    log.info("Created tender {} for company {}", tender.getId(), tender.getOwnerCompanyId());
    return tender;
  }

  @Transactional(readOnly = true)
  public Tender getTender(UUID tenderId) {
    return tenderRepository
        .findById(tenderId)
        .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
  }

  @Transactional(readOnly = true)
  public Page<Tender> listTenders(TenderStatus status, UUID ownerCompanyId, Pageable pageable) {
    return tenderRepository.findFiltered(status, ownerCompanyId, pageable);
  }

  /** Replaces the editable fields of a DRAFT or PUBLISHED tender. */
  @Transactional
  public Tender updateTender(UUID tenderId, Actor actor, TenderDetails details) {
    var tender =
        tenderRepository
            .findByIdForUpdate(tenderId)
            .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
    accessPolicy.requireCanAdminister(actor, tender);
    tender.requireEditable();
    if (!details.closingDate().equals(tender.getClosingDate())) {
      requireFutureClosingDate(
          details.closingDate(), Instant.now(clock).truncatedTo(ChronoUnit.MICROS));
    }

    tender.setTitle(details.title());
    tender.setClosingDate(details.closingDate());
    applyDetails(tender, details);
    return tenderRepository.save(tender);
  }

  private void applyDetails(Tender tender, TenderDetails details) {
    tender.setDescription(details.description());
    tender.setCategory(details.category());
    tender.setRequirements(details.requirements());
    tender.setPublishAt(details.publishAt());
    tender.setBudget(details.budget());
  }

  private void requireFutureClosingDate(Instant closingDate, Instant now) {
    if (!closingDate.isAfter(now)) {
      throw new InvalidStateException(
          "Invalid closing date", "Closing date must be in the future");
    }
  }

  /** Author-supplied fields of a tender. */
  public record TenderDetails(
      String title,
      String description,
      String category,
      String requirements,
      Instant closingDate,
      Instant publishAt,
      BigDecimal budget) {}
}
