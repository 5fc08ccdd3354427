package io.tenderbridge.backend.tender;

import io.tenderbridge.backend.exception.ForbiddenException;
import io.tenderbridge.backend.exception.UnassignedActorException;
import io.tenderbridge.backend.security.Actor;
import io.tenderbridge.backend.security.Roles;
import org.springframework.stereotype.Component;

/**
 * Authorization rules for tender administration. Controllers call these before delegating to
 * {@link TenderLifecycleService}, which trusts its caller on who may act.
 */
@Component
public class TenderAccessPolicy {

  /** Admins, or tender managers and above from the owning company. */
  public boolean canAdminister(Actor actor, Tender tender) {
    if (actor.isSystem() || actor.isAdmin()) {
      return true;
    }
    return actor.hasRoleAtLeast(Roles.TENDER_MANAGER)
        && tender.getOwnerCompanyId().equals(actor.companyId());
  }

  public void requireCanAdminister(Actor actor, Tender tender) {
    if (!canAdminister(actor, tender)) {
      throw new ForbiddenException(
          "Not authorized",
          "Only tender managers or admins of the owning company can administer this tender");
    }
  }

  public void requireCanCreate(Actor actor) {
    if (!actor.hasCompany()) {
      throw new UnassignedActorException("create a tender");
    }
    if (!actor.hasRoleAtLeast(Roles.TENDER_MANAGER)) {
      throw new ForbiddenException(
          "Not authorized", "Only tender managers and above can create tenders");
    }
  }
}
