package io.tenderbridge.backend.bid;

import io.tenderbridge.backend.security.ActorResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BidController {

  private final BidService bidService;

  public BidController(BidService bidService) {
    this.bidService = bidService;
  }

  @PostMapping("/api/bids")
  public ResponseEntity<BidResponse> submitBid(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody SubmitBidRequest request) {
    var bid =
        bidService.submitBid(
            request.tenderId(),
            ActorResolver.fromJwt(jwt),
            request.amount(),
            request.documentRef());
    return ResponseEntity.created(URI.create("/api/bids/" + bid.getId()))
        .body(BidResponse.from(bid));
  }

  @GetMapping("/api/bids/{id}")
  public ResponseEntity<BidResponse> getBid(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    var bid = bidService.getBidFor(id, ActorResolver.fromJwt(jwt));
    return ResponseEntity.ok(BidResponse.from(bid));
  }

  @GetMapping("/api/tenders/{tenderId}/bids")
  public ResponseEntity<List<BidResponse>> listTenderBids(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID tenderId) {
    var bids = bidService.listTenderBids(tenderId, ActorResolver.fromJwt(jwt));
    return ResponseEntity.ok(bids.stream().map(BidResponse::from).toList());
  }

  @GetMapping("/api/companies/{companyId}/bids")
  public ResponseEntity<List<BidResponse>> listCompanyBids(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID companyId) {
    var bids = bidService.listCompanyBids(companyId, ActorResolver.fromJwt(jwt));
    return ResponseEntity.ok(bids.stream().map(BidResponse::from).toList());
  }

  @PostMapping("/api/bids/{id}/withdraw")
  public ResponseEntity<BidResponse> withdrawBid(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @Valid @RequestBody WithdrawBidRequest request) {
    var bid = bidService.withdrawBid(id, ActorResolver.fromJwt(jwt), request.reason());
    return ResponseEntity.ok(BidResponse.from(bid));
  }

  @PostMapping("/api/bids/{id}/revise")
  public ResponseEntity<BidResponse> reviseBid(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @Valid @RequestBody ReviseBidRequest request) {
    var bid =
        bidService.reviseBid(
            id, ActorResolver.fromJwt(jwt), request.amount(), request.documentRef());
    return ResponseEntity.created(URI.create("/api/bids/" + bid.getId()))
        .body(BidResponse.from(bid));
  }

  @PutMapping("/api/bids/{id}/shortlist")
  public ResponseEntity<BidResponse> shortlistBid(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @Valid @RequestBody ShortlistRequest request) {
    var bid = bidService.setShortlisted(id, ActorResolver.fromJwt(jwt), request.shortlisted());
    return ResponseEntity.ok(BidResponse.from(bid));
  }

  @GetMapping("/api/bids/{id}/revisions")
  public ResponseEntity<List<BidResponse>> revisionHistory(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    var chain = bidService.revisionHistory(id, ActorResolver.fromJwt(jwt));
    return ResponseEntity.ok(chain.stream().map(BidResponse::from).toList());
  }

  // --- DTOs ---

  public record SubmitBidRequest(
      @NotNull UUID tenderId,
      @NotNull @Positive @Digits(integer = 13, fraction = 2) BigDecimal amount,
      @Size(max = 500) String documentRef) {}

  public record WithdrawBidRequest(@Size(max = 1000) String reason) {}

  public record ReviseBidRequest(
      @NotNull @Positive @Digits(integer = 13, fraction = 2) BigDecimal amount,
      @Size(max = 500) String documentRef) {}

  public record ShortlistRequest(@NotNull Boolean shortlisted) {}

  public record BidResponse(
      UUID id,
      UUID tenderId,
      UUID companyId,
      UUID submittedById,
      BigDecimal amount,
      String documentRef,
      String status,
      int revisionNumber,
      UUID parentBidId,
      Instant submittedAt,
      Instant withdrawnAt,
      String withdrawalReason) {

    public static BidResponse from(Bid bid) {
      return new BidResponse(
          bid.getId(),
          bid.getTenderId(),
          bid.getCompanyId(),
          bid.getSubmittedById(),
          bid.getAmount(),
          bid.getDocumentRef(),
          bid.getStatus().value(),
          bid.getRevisionNumber(),
          bid.getParentBidId(),
          bid.getSubmittedAt(),
          bid.getWithdrawnAt(),
          bid.getWithdrawalReason());
    }
  }
}
