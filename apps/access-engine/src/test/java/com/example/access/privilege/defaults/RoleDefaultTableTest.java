package com.example.access.privilege.defaults;

import com.example.access.exception.PolicyConfigurationException;
import com.example.access.exception.UnknownPrivilegeException;
import com.example.access.privilege.catalog.PrivilegeCatalog;
import com.example.access.privilege.model.PrivilegeDefinition;
import com.example.access.privilege.model.Scope;
import com.example.access.privilege.model.UnitRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static com.example.access.privilege.catalog.StandardPrivileges.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RoleDefaultTable")
class RoleDefaultTableTest {

    private final PrivilegeCatalog catalog = PrivilegeCatalog.standard();
    private final RoleDefaultTable table = RoleDefaultTable.standard(catalog);

    @Nested
    @DisplayName("standard table")
    class StandardTable {

        @ParameterizedTest
        @EnumSource(UnitRole.class)
        @DisplayName("should define a scope for every privilege")
        void shouldBeDense(UnitRole role) {
            for (PrivilegeDefinition definition : catalog.listPrivileges()) {
                assertThat(table.defaultScope(role, definition.code()))
                        .as("%s/%s", role, definition.code())
                        .isNotNull();
            }
            assertThat(table.row(role)).hasSize(catalog.size());
        }

        @Test
        @DisplayName("should keep row entries in catalog order")
        void shouldKeepCatalogOrder() {
            assertThat(table.row(UnitRole.PARENT).keySet())
                    .containsExactlyElementsOf(catalog.listPrivileges().stream()
                            .map(PrivilegeDefinition::code)
                            .toList());
        }

        @Test
        @DisplayName("should return the documented defaults")
        void shouldReturnDocumentedDefaults() {
            assertThat(table.defaultScope(UnitRole.MEMBER, MANAGE_MEMBERS)).isEqualTo(Scope.NONE);
            assertThat(table.defaultScope(UnitRole.MEMBER, VIEW_EVENTS)).isEqualTo(Scope.TROOP);
            assertThat(table.defaultScope(UnitRole.MEMBER, EXPORT_DATA)).isEqualTo(Scope.SELF);
            assertThat(table.defaultScope(UnitRole.PARENT, RECORD_SALES)).isEqualTo(Scope.HOUSEHOLD);
            assertThat(table.defaultScope(UnitRole.ASSISTANT, VIEW_SCOUT_PROFILES)).isEqualTo(Scope.DEN);
            assertThat(table.defaultScope(UnitRole.CO_LEADER, MANAGE_PRIVILEGES)).isEqualTo(Scope.NONE);
            assertThat(table.defaultScope(UnitRole.COOKIE_LEADER, MANAGE_FINANCIALS)).isEqualTo(Scope.TROOP);
            assertThat(table.defaultScope(UnitRole.TROOP_LEADER, MANAGE_PAYMENT_METHODS)).isEqualTo(Scope.SELF);
            assertThat(table.defaultScope(UnitRole.COUNCIL_ADMIN, VIEW_SCOUT_PROFILES)).isEqualTo(Scope.TROOP);
        }

        @Test
        @DisplayName("should fall back to lowest-trust defaults for unrecognized roles")
        void shouldFailClosedForUnknownRole() {
            assertThat(table.defaultScope((UnitRole) null, VIEW_ROSTER)).isEqualTo(Scope.NONE);
            assertThat(table.defaultScope("scoutmaster", VIEW_ROSTER)).isEqualTo(Scope.NONE);
            assertThat(table.defaultScope("scoutmaster", VIEW_SCOUT_PROFILES)).isEqualTo(Scope.SELF);
            assertThat(table.row(null)).isEqualTo(table.row(UnitRole.MEMBER));
        }

        @Test
        @DisplayName("should resolve recognized role codes")
        void shouldResolveRoleCodes() {
            assertThat(table.defaultScope("troop_leader", VIEW_ROSTER)).isEqualTo(Scope.TROOP);
            assertThat(table.roleOrLowestTrust("parent")).isEqualTo(UnitRole.PARENT);
        }

        @Test
        @DisplayName("should reject lookups of unknown privilege codes")
        void shouldRejectUnknownCode() {
            assertThatThrownBy(() -> table.defaultScope(UnitRole.MEMBER, "fly_plane"))
                    .isInstanceOf(UnknownPrivilegeException.class);
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        private final PrivilegeCatalog smallCatalog = new PrivilegeCatalog(List.of(
                PrivilegeDefinition.active("view_events", "View events", "Calendar"),
                PrivilegeDefinition.active("manage_events", "Manage events", "Calendar")));

        @Test
        @DisplayName("should build a complete table")
        void shouldBuildCompleteTable() {
            RoleDefaultTable.Builder builder = RoleDefaultTable.builder(smallCatalog);
            for (UnitRole role : UnitRole.values()) {
                builder.row(role, Map.of(
                        "view_events", Scope.TROOP,
                        "manage_events", role.getLevel() > 1 ? Scope.TROOP : Scope.NONE));
            }

            RoleDefaultTable built = builder.build();

            assertThat(built.defaultScope(UnitRole.PARENT, "manage_events")).isEqualTo(Scope.NONE);
            assertThat(built.defaultScope(UnitRole.TROOP_LEADER, "manage_events")).isEqualTo(Scope.TROOP);
        }

        @Test
        @DisplayName("should reject a table with a missing cell")
        void shouldRejectMissingCell() {
            RoleDefaultTable.Builder builder = RoleDefaultTable.builder(smallCatalog);
            for (UnitRole role : UnitRole.values()) {
                builder.set(role, "view_events", Scope.TROOP);
                if (role != UnitRole.VOLUNTEER) {
                    builder.set(role, "manage_events", Scope.NONE);
                }
            }

            assertThatThrownBy(builder::build)
                    .isInstanceOf(PolicyConfigurationException.class)
                    .hasMessageContaining("volunteer/manage_events");
        }

        @Test
        @DisplayName("should reject a table without a row for some role")
        void shouldRejectMissingRole() {
            RoleDefaultTable.Builder builder = RoleDefaultTable.builder(smallCatalog);
            builder.row(UnitRole.MEMBER, Map.of("view_events", Scope.TROOP, "manage_events", Scope.NONE));

            assertThatThrownBy(builder::build)
                    .isInstanceOf(PolicyConfigurationException.class)
                    .hasMessageContaining("council_admin/view_events");
        }

        @Test
        @DisplayName("should reject defaults for codes missing from the catalog")
        void shouldRejectUnknownCode() {
            RoleDefaultTable.Builder builder = RoleDefaultTable.builder(smallCatalog);

            assertThatThrownBy(() -> builder.set(UnitRole.MEMBER, "fly_plane", Scope.SELF))
                    .isInstanceOf(UnknownPrivilegeException.class)
                    .hasMessageContaining("fly_plane");
        }

        @Test
        @DisplayName("should reject a column without one scope per role")
        void shouldRejectShortColumn() {
            RoleDefaultTable.Builder builder = RoleDefaultTable.builder(smallCatalog);

            assertThatThrownBy(() -> builder.column("view_events", Scope.TROOP, Scope.TROOP))
                    .isInstanceOf(PolicyConfigurationException.class)
                    .hasMessageContaining("view_events");
        }
    }
}
