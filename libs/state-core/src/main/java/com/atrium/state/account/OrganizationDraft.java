package com.atrium.state.account;

/** Data for a new organization; the creator becomes its first owner. */
public record OrganizationDraft(String displayName, String description, String createdBy) {
}
