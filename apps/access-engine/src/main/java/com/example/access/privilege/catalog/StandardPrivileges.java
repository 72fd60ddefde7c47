package com.example.access.privilege.catalog;

import com.example.access.privilege.model.PrivilegeDefinition;

import java.util.List;

import static com.example.access.privilege.model.PrivilegeDefinition.active;
import static com.example.access.privilege.model.PrivilegeDefinition.future;

/**
 * Privilege codes and the built-in catalog.
 */
public final class StandardPrivileges {

    public static final String CATEGORY_MEMBERS = "Troop & Member Management";
    public static final String CATEGORY_PROFILES = "Scout Profiles & Advancement";
    public static final String CATEGORY_CALENDAR = "Calendar & Events";
    public static final String CATEGORY_SALES = "Fundraising & Sales";
    public static final String CATEGORY_DONATIONS = "Donations";
    public static final String CATEGORY_GOALS = "Troop Goals & Reporting";
    public static final String CATEGORY_DATA = "Data & Settings";

    public static final String VIEW_ROSTER = "view_roster";
    public static final String MANAGE_MEMBERS = "manage_members";
    public static final String MANAGE_TROOP_SETTINGS = "manage_troop_settings";
    public static final String SEND_INVITATIONS = "send_invitations";
    public static final String IMPORT_ROSTER = "import_roster";
    public static final String MANAGE_MEMBER_ROLES = "manage_member_roles";
    public static final String MANAGE_PRIVILEGES = "manage_privileges";

    public static final String VIEW_SCOUT_PROFILES = "view_scout_profiles";
    public static final String EDIT_SCOUT_LEVEL = "edit_scout_level";
    public static final String EDIT_SCOUT_STATUS = "edit_scout_status";
    public static final String AWARD_BADGES = "award_badges";
    public static final String VIEW_BADGE_PROGRESS = "view_badge_progress";
    public static final String EDIT_PERSONAL_INFO = "edit_personal_info";

    public static final String VIEW_EVENTS = "view_events";
    public static final String MANAGE_EVENTS = "manage_events";
    public static final String EXPORT_CALENDAR = "export_calendar";

    public static final String VIEW_SALES = "view_sales";
    public static final String RECORD_SALES = "record_sales";
    public static final String MANAGE_FUNDRAISERS = "manage_fundraisers";
    public static final String VIEW_TROOP_SALES = "view_troop_sales";
    public static final String VIEW_FINANCIALS = "view_financials";
    public static final String MANAGE_FINANCIALS = "manage_financials";

    public static final String VIEW_DONATIONS = "view_donations";
    public static final String RECORD_DONATIONS = "record_donations";
    public static final String DELETE_DONATIONS = "delete_donations";

    public static final String VIEW_GOALS = "view_goals";
    public static final String MANAGE_GOALS = "manage_goals";
    public static final String VIEW_LEADERBOARD = "view_leaderboard";

    public static final String MANAGE_PAYMENT_METHODS = "manage_payment_methods";
    public static final String IMPORT_DATA = "import_data";
    public static final String EXPORT_DATA = "export_data";
    public static final String DELETE_OWN_DATA = "delete_own_data";

    static final List<PrivilegeDefinition> DEFINITIONS = List.of(
            active(VIEW_ROSTER, "View troop roster", CATEGORY_MEMBERS),
            active(MANAGE_MEMBERS, "Manage troop members", CATEGORY_MEMBERS),
            active(MANAGE_TROOP_SETTINGS, "Manage troop settings", CATEGORY_MEMBERS),
            active(SEND_INVITATIONS, "Send invitations", CATEGORY_MEMBERS),
            active(IMPORT_ROSTER, "Import roster", CATEGORY_MEMBERS),
            active(MANAGE_MEMBER_ROLES, "Manage member roles", CATEGORY_MEMBERS),
            active(MANAGE_PRIVILEGES, "Manage privileges", CATEGORY_MEMBERS),

            active(VIEW_SCOUT_PROFILES, "View scout profiles", CATEGORY_PROFILES),
            active(EDIT_SCOUT_LEVEL, "Edit scout level", CATEGORY_PROFILES),
            active(EDIT_SCOUT_STATUS, "Edit scout status", CATEGORY_PROFILES),
            active(AWARD_BADGES, "Award badges", CATEGORY_PROFILES),
            active(VIEW_BADGE_PROGRESS, "View badge progress", CATEGORY_PROFILES),
            active(EDIT_PERSONAL_INFO, "Edit personal info", CATEGORY_PROFILES),

            active(VIEW_EVENTS, "View events", CATEGORY_CALENDAR),
            active(MANAGE_EVENTS, "Manage events", CATEGORY_CALENDAR),
            active(EXPORT_CALENDAR, "Export calendar", CATEGORY_CALENDAR),

            future(VIEW_SALES, "View sales data", CATEGORY_SALES),
            future(RECORD_SALES, "Record sales", CATEGORY_SALES),
            future(MANAGE_FUNDRAISERS, "Manage fundraisers", CATEGORY_SALES),
            future(VIEW_TROOP_SALES, "View troop sales", CATEGORY_SALES),
            future(VIEW_FINANCIALS, "View financial accounts", CATEGORY_SALES),
            future(MANAGE_FINANCIALS, "Manage financial accounts", CATEGORY_SALES),

            active(VIEW_DONATIONS, "View donations", CATEGORY_DONATIONS),
            active(RECORD_DONATIONS, "Record donations", CATEGORY_DONATIONS),
            active(DELETE_DONATIONS, "Delete donations", CATEGORY_DONATIONS),

            active(VIEW_GOALS, "View goals", CATEGORY_GOALS),
            active(MANAGE_GOALS, "Manage goals", CATEGORY_GOALS),
            active(VIEW_LEADERBOARD, "View leaderboard", CATEGORY_GOALS),

            active(MANAGE_PAYMENT_METHODS, "Manage payment methods", CATEGORY_DATA),
            active(IMPORT_DATA, "Import data", CATEGORY_DATA),
            active(EXPORT_DATA, "Export data", CATEGORY_DATA),
            active(DELETE_OWN_DATA, "Delete own data", CATEGORY_DATA)
    );

    private StandardPrivileges() {}
}
