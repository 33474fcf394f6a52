package com.example.dcim.access.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.example.dcim.access.model.Permission;
import com.example.dcim.access.model.RoleDefinition;
import com.example.dcim.access.repository.RoleRepository;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RolePermissionCatalogTest {

  @Mock private RoleRepository roleRepository;

  @Test
  void flattenUnionsPermissionsOfAllAncestors() {
    final Map<String, Set<Permission>> flattened =
        RolePermissionCatalog.flatten(
            List.of(
                new RoleDefinition("VIEWER", Set.of(Permission.DEVICE_VIEW), Set.of()),
                new RoleDefinition("EDITOR", Set.of(Permission.DEVICE_UPDATE), Set.of("VIEWER")),
                new RoleDefinition("ADMIN", Set.of(Permission.DEVICE_DELETE), Set.of("editor"))));

    assertThat(flattened.get("VIEWER")).containsExactly(Permission.DEVICE_VIEW);
    assertThat(flattened.get("EDITOR"))
        .containsExactlyInAnyOrder(Permission.DEVICE_VIEW, Permission.DEVICE_UPDATE);
    assertThat(flattened.get("ADMIN"))
        .containsExactlyInAnyOrder(
            Permission.DEVICE_VIEW, Permission.DEVICE_UPDATE, Permission.DEVICE_DELETE);
  }

  @Test
  void flattenToleratesCyclesAndMissingParents() {
    final Map<String, Set<Permission>> flattened =
        RolePermissionCatalog.flatten(
            List.of(
                new RoleDefinition("A", Set.of(Permission.RACK_VIEW), Set.of("B")),
                new RoleDefinition("B", Set.of(Permission.RACK_UPDATE), Set.of("A", "RETIRED"))));

    assertThat(flattened.get("A"))
        .containsExactlyInAnyOrder(Permission.RACK_VIEW, Permission.RACK_UPDATE);
    assertThat(flattened.get("B"))
        .containsExactlyInAnyOrder(Permission.RACK_VIEW, Permission.RACK_UPDATE);
    assertThat(flattened).doesNotContainKey("RETIRED");
  }

  @Test
  void reloadSwapsSnapshotAndAdvancesEpoch() {
    when(roleRepository.findRoleDefinitions())
        .thenReturn(
            List.of(new RoleDefinition("OPERATOR", Set.of(Permission.DEVICE_VIEW), Set.of())))
        .thenReturn(
            List.of(
                new RoleDefinition(
                    "OPERATOR",
                    Set.of(Permission.DEVICE_VIEW, Permission.NETWORK_RESET),
                    Set.of())));
    final RolePermissionCatalog catalog = new RolePermissionCatalog(roleRepository);

    catalog.reload();
    final long firstEpoch = catalog.epoch();
    assertThat(catalog.permissionsOf(List.of("operator")))
        .containsExactly(Permission.DEVICE_VIEW);

    catalog.reload();
    assertThat(catalog.epoch()).isEqualTo(firstEpoch + 1);
    assertThat(catalog.permissionsOf(List.of("OPERATOR")))
        .containsExactlyInAnyOrder(Permission.DEVICE_VIEW, Permission.NETWORK_RESET);
  }

  @Test
  void unknownRolesContributeNothing() {
    when(roleRepository.findRoleDefinitions())
        .thenReturn(
            List.of(new RoleDefinition("VIEWER", Set.of(Permission.DEVICE_VIEW), Set.of())));
    final RolePermissionCatalog catalog = new RolePermissionCatalog(roleRepository);
    catalog.reload();

    assertThat(catalog.permissionsOf(List.of("GHOST"))).isEmpty();
    assertThat(catalog.permissionsOf(List.of("GHOST", "VIEWER")))
        .containsExactly(Permission.DEVICE_VIEW);
  }
}
