package com.example.dcim.access.service;

import com.example.dcim.access.model.LocationScope;
import com.example.dcim.access.model.Permission;
import com.example.dcim.access.model.TokenClaims;
import com.example.dcim.access.repository.PrincipalRepository;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** 一覧・詳細クエリに渡すロケーション範囲を決める。location.all を持つ場合は全件。 */
@Service
@RequiredArgsConstructor
public class LocationScopeResolver {

  private final RoleResolver roleResolver;
  private final PrincipalRepository principalRepository;

  public LocationScope resolve(TokenClaims claims) {
    if (claims == null) {
      throw new AuthenticationException(AccessErrorCode.UNAUTHENTICATED, "authentication required");
    }
    if (roleResolver.permissionsFor(claims.roles()).contains(Permission.LOCATION_ALL)) {
      return LocationScope.unrestrictedScope();
    }
    final List<Long> assigned = principalRepository.findLocationIds(claims.subject());
    final Set<Long> locationIds = new HashSet<>();
    for (Long locationId : assigned) {
      if (locationId != null) {
        locationIds.add(locationId);
      }
    }
    if (locationIds.isEmpty()) {
      throw new AccessDeniedException("no locations assigned to " + claims.subject());
    }
    return LocationScope.restrictedTo(locationIds);
  }
}
