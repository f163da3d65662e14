package com.atrium.state.account;

public record PartnerDraft(String organizationId, String displayName, String companyName, String createdBy) {
}
