package io.tenderbridge.backend.tender;

import io.tenderbridge.backend.exception.InvalidStateException;
import io.tenderbridge.backend.security.ActorResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TenderController {

  private final TenderService tenderService;
  private final TenderLifecycleService lifecycleService;
  private final TenderAccessPolicy accessPolicy;

  public TenderController(
      TenderService tenderService,
      TenderLifecycleService lifecycleService,
      TenderAccessPolicy accessPolicy) {
    this.tenderService = tenderService;
    this.lifecycleService = lifecycleService;
    this.accessPolicy = accessPolicy;
  }

  // --- Authoring ---

  @PostMapping("/api/tenders")
  public ResponseEntity<TenderResponse> createTender(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody TenderRequest request) {
    var tender = tenderService.createTender(ActorResolver.fromJwt(jwt), request.toDetails());
    return ResponseEntity.created(URI.create("/api/tenders/" + tender.getId()))
        .body(TenderResponse.from(tender));
  }

  @GetMapping("/api/tenders")
  public ResponseEntity<Page<TenderResponse>> listTenders(
      @RequestParam(required = false) String status,
      @RequestParam(required = false) UUID ownerCompanyId,
      Pageable pageable) {
    var page =
        tenderService.listTenders(
            status != null ? parseStatus(status) : null, ownerCompanyId, pageable);
    return ResponseEntity.ok(page.map(TenderResponse::from));
  }

  @GetMapping("/api/tenders/{id}")
  public ResponseEntity<TenderResponse> getTender(@PathVariable UUID id) {
    return ResponseEntity.ok(TenderResponse.from(tenderService.getTender(id)));
  }

  @PutMapping("/api/tenders/{id}")
  public ResponseEntity<TenderResponse> updateTender(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @Valid @RequestBody TenderRequest request) {
    var tender = tenderService.updateTender(id, ActorResolver.fromJwt(jwt), request.toDetails());
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  // --- Lifecycle ---

  @PutMapping("/api/tenders/{id}/status")
  public ResponseEntity<TenderResponse> changeStatus(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @Valid @RequestBody StatusChangeRequest request) {
    var actor = ActorResolver.fromJwt(jwt);
    accessPolicy.requireCanAdminister(actor, tenderService.getTender(id));
    var tender =
        lifecycleService.changeStatus(id, parseStatus(request.status()), request.reason(), actor);
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  @PostMapping("/api/tenders/{id}/close")
  public ResponseEntity<TenderResponse> closeTender(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    var actor = ActorResolver.fromJwt(jwt);
    accessPolicy.requireCanAdminister(actor, tenderService.getTender(id));
    return ResponseEntity.ok(TenderResponse.from(lifecycleService.close(id, actor)));
  }

  @PostMapping("/api/tenders/{id}/award")
  public ResponseEntity<TenderResponse> awardTender(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @Valid @RequestBody AwardRequest request) {
    var actor = ActorResolver.fromJwt(jwt);
    accessPolicy.requireCanAdminister(actor, tenderService.getTender(id));
    var tender =
        lifecycleService.award(id, request.winningBidId(), request.justification(), actor);
    return ResponseEntity.ok(TenderResponse.from(tender));
  }

  @GetMapping("/api/tenders/{id}/transitions")
  public ResponseEntity<List<String>> allowedTransitions(@PathVariable UUID id) {
    var tender = tenderService.getTender(id);
    return ResponseEntity.ok(TenderStateMachine.allowedValues(tender.getStatus()));
  }

  private static TenderStatus parseStatus(String value) {
    try {
      return TenderStatus.fromValue(value);
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid status", "Unknown tender status '" + value + "'");
    }
  }

  // --- DTOs ---

  public record TenderRequest(
      @NotBlank @Size(max = 300) String title,
      @Size(max = 10000) String description,
      @Size(max = 100) String category,
      @Size(max = 10000) String requirements,
      @NotNull Instant closingDate,
      Instant publishAt,
      @PositiveOrZero BigDecimal budget) {

    TenderService.TenderDetails toDetails() {
      return new TenderService.TenderDetails(
          title, description, category, requirements, closingDate, publishAt, budget);
    }
  }

  public record StatusChangeRequest(@NotBlank String status, @Size(max = 1000) String reason) {}

  public record AwardRequest(@NotNull UUID winningBidId, @Size(max = 4000) String justification) {}

  public record TenderResponse(
      UUID id,
      String title,
      String description,
      String category,
      String requirements,
      Instant closingDate,
      Instant publishAt,
      BigDecimal budget,
      UUID ownerCompanyId,
      UUID createdById,
      String status,
      Instant statusChangedAt,
      String cancellationReason,
      UUID cancelledById,
      Instant cancelledAt,
      UUID winningBidId,
      Instant awardedAt,
      UUID awardedById,
      String awardJustification,
      String ledgerCommitRef,
      String ledgerContentHash,
      Instant ledgerCommittedAt,
      Instant createdAt,
      Instant updatedAt) {

    public static TenderResponse from(Tender tender) {
      return new TenderResponse(
          tender.getId(),
          tender.getTitle(),
          tender.getDescription(),
          tender.getCategory(),
          tender.getRequirements(),
          tender.getClosingDate(),
          tender.getPublishAt(),
          tender.getBudget(),
          tender.getOwnerCompanyId(),
          tender.getCreatedById(),
          tender.getStatus().value(),
          tender.getStatusChangedAt(),
          tender.getCancellationReason(),
          tender.getCancelledById(),
          tender.getCancelledAt(),
          tender.getWinningBidId(),
          tender.getAwardedAt(),
          tender.getAwardedById(),
          tender.getAwardJustification(),
          tender.getLedgerCommitRef(),
          tender.getLedgerContentHash(),
          tender.getLedgerCommittedAt(),
          tender.getCreatedAt(),
          tender.getUpdatedAt());
    }
  }
}
