package com.example.access.privilege.defaults;

import com.example.access.privilege.model.Scope;

import static com.example.access.privilege.catalog.StandardPrivileges.*;

/**
 * Built-in default scopes, one column per privilege.
 */
final class StandardRoleDefaults {

    private static final Scope T = Scope.TROOP;
    private static final Scope D = Scope.DEN;
    private static final Scope H = Scope.HOUSEHOLD;
    private static final Scope S = Scope.SELF;
    private static final Scope N = Scope.NONE;

    private StandardRoleDefaults() {}

    static void populate(RoleDefaultTable.Builder b) {
        //                                 member parent volunteer assistant co-leader cookie troop council
        b.column(VIEW_ROSTER,              N,     N,     T,        T,        T,        T,     T,    T);
        b.column(MANAGE_MEMBERS,           N,     N,     N,        N,        T,        N,     T,    T);
        b.column(MANAGE_TROOP_SETTINGS,    N,     N,     N,        N,        T,        N,     T,    T);
        b.column(SEND_INVITATIONS,         N,     N,     N,        N,        T,        N,     T,    T);
        b.column(IMPORT_ROSTER,            N,     N,     N,        N,        T,        N,     T,    T);
        b.column(MANAGE_MEMBER_ROLES,      N,     N,     N,        N,        N,        N,     T,    T);
        b.column(MANAGE_PRIVILEGES,        N,     N,     N,        N,        N,        N,     T,    T);

        b.column(VIEW_SCOUT_PROFILES,      S,     H,     N,        D,        T,        N,     T,    T);
        b.column(EDIT_SCOUT_LEVEL,         N,     N,     N,        N,        T,        N,     T,    T);
        b.column(EDIT_SCOUT_STATUS,        N,     N,     N,        N,        T,        N,     T,    T);
        b.column(AWARD_BADGES,             N,     N,     N,        N,        T,        N,     T,    T);
        b.column(VIEW_BADGE_PROGRESS,      S,     H,     N,        D,        T,        N,     T,    T);
        b.column(EDIT_PERSONAL_INFO,       N,     H,     N,        N,        T,        N,     T,    T);

        b.column(VIEW_EVENTS,              T,     T,     T,        T,        T,        T,     T,    T);
        b.column(MANAGE_EVENTS,            N,     N,     N,        T,        T,        N,     T,    T);
        b.column(EXPORT_CALENDAR,          T,     T,     T,        T,        T,        T,     T,    T);

        b.column(VIEW_SALES,               S,     H,     N,        N,        T,        T,     T,    T);
        b.column(RECORD_SALES,             S,     H,     N,        N,        S,        T,     T,    T);
        b.column(MANAGE_FUNDRAISERS,       N,     N,     N,        N,        T,        T,     T,    T);
        b.column(VIEW_TROOP_SALES,         N,     N,     N,        N,        T,        T,     T,    T);
        b.column(VIEW_FINANCIALS,          N,     N,     N,        N,        T,        T,     T,    T);
        b.column(MANAGE_FINANCIALS,        N,     N,     N,        N,        N,        T,     T,    T);

        b.column(VIEW_DONATIONS,           S,     H,     N,        N,        T,        T,     T,    T);
        b.column(RECORD_DONATIONS,         S,     H,     N,        N,        S,        S,     T,    T);
        b.column(DELETE_DONATIONS,         S,     H,     N,        N,        S,        N,     T,    T);

        b.column(VIEW_GOALS,               T,     T,     T,        T,        T,        T,     T,    T);
        b.column(MANAGE_GOALS,             N,     N,     N,        N,        T,        N,     T,    T);
        b.column(VIEW_LEADERBOARD,         T,     T,     T,        T,        T,        T,     T,    T);

        b.column(MANAGE_PAYMENT_METHODS,   S,     S,     S,        S,        S,        S,     S,    S);
        b.column(IMPORT_DATA,              N,     N,     N,        N,        N,        T,     T,    T);
        b.column(EXPORT_DATA,              S,     H,     N,        N,        T,        T,     T,    T);
        b.column(DELETE_OWN_DATA,          S,     S,     S,        S,        S,        S,     S,    S);
    }
}
