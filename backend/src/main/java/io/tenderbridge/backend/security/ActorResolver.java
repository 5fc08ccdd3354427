package io.tenderbridge.backend.security;

import io.tenderbridge.backend.exception.ForbiddenException;
import java.util.UUID;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Builds an {@link Actor} from a validated JWT: {@code sub} is the user id, {@code company_id} the
 * optional company affiliation and {@code role} the platform role.
 */
public final class ActorResolver {

  public static final String COMPANY_CLAIM = "company_id";
  public static final String ROLE_CLAIM = "role";

  private ActorResolver() {}

  public static Actor fromJwt(Jwt jwt) {
    if (jwt == null) {
      throw new ForbiddenException("Not authenticated", "No authenticated principal");
    }
    UUID userId = parseUuid(jwt.getSubject(), "sub");
    String companyClaim = jwt.getClaimAsString(COMPANY_CLAIM);
    UUID companyId =
        companyClaim == null || companyClaim.isBlank()
            ? null
            : parseUuid(companyClaim, COMPANY_CLAIM);
    String role = jwt.getClaimAsString(ROLE_CLAIM);
    return new Actor(userId, companyId, role != null ? role : Roles.USER);
  }

  private static UUID parseUuid(String value, String claim) {
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new ForbiddenException("Invalid token", "Claim '" + claim + "' is not a valid id");
    }
  }
}
