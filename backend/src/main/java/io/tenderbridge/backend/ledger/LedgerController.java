package io.tenderbridge.backend.ledger;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LedgerController {

  private final AwardVerificationService verificationService;

  public LedgerController(AwardVerificationService verificationService) {
    this.verificationService = verificationService;
  }

  @GetMapping("/api/tenders/{id}/verify")
  public ResponseEntity<AwardVerification> verifyAward(@PathVariable UUID id) {
    return ResponseEntity.ok(verificationService.verifyAward(id));
  }

  @GetMapping("/api/ledger/awards/{commitRef}")
  public ResponseEntity<AwardVerification> verifyCommit(@PathVariable String commitRef) {
    return ResponseEntity.ok(verificationService.verifyCommit(commitRef));
  }
}
