package com.example.dcim.access.service;

import com.example.dcim.access.model.Permission;
import com.example.dcim.access.model.Principal;
import com.example.dcim.access.repository.PrincipalRepository;
import java.util.Collection;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RoleResolver {

  private final PrincipalRepository principalRepository;
  private final RolePermissionCatalog catalog;

  /**
   * Roles currently assigned in the identity store, not the ones captured in a token. A missing or
   * disabled principal has no roles.
   */
  public Set<String> resolveRoles(String principalId) {
    if (principalId == null || principalId.isBlank()) {
      throw new IllegalArgumentException("principal_id is required");
    }
    return principalRepository
        .findByIdentifier(principalId)
        .filter(Principal::isActive)
        .map(Principal::roles)
        .orElse(Set.of());
  }

  public Set<Permission> permissionsFor(Collection<String> roleNames) {
    if (roleNames == null || roleNames.isEmpty()) {
      return Set.of();
    }
    return catalog.permissionsOf(roleNames);
  }
}
