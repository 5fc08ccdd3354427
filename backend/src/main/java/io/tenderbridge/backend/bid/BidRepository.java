package io.tenderbridge.backend.bid;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BidRepository extends JpaRepository<Bid, UUID> {

  List<Bid> findByTenderIdOrderBySubmittedAtAsc(UUID tenderId);

  List<Bid> findByCompanyIdOrderBySubmittedAtDesc(UUID companyId);

  long countByTenderIdAndStatus(UUID tenderId, BidStatus status);
}
