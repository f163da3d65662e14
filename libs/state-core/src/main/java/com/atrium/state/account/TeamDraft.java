package com.atrium.state.account;

public record TeamDraft(String organizationId, String displayName, String createdBy) {
}
