package com.atrium.state.config;

import com.atrium.state.store.MutationConcurrency;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Session store settings, bound from {@code atrium.session.*}:
 *
 * <pre>
 * atrium:
 *   session:
 *     mutation-concurrency: queue
 *     recent-document-limit: 20
 *     history-limit: 50
 * </pre>
 *
 * @param mutationConcurrency what a second mutation on an entity still in flight does (default REJECT)
 * @param recentDocumentLimit size of the recent-documents view (default 10)
 * @param recentWorkspaceLimit size of the recent-workspaces view (default 3)
 * @param historyLimit context switches remembered per session (default 50)
 * @param serviceName value of the {@code service} tag on store metrics
 * @param schedulerThreadName name of the thread store state is confined to
 */
@ConfigurationProperties(prefix = "atrium.session")
@Validated
public record SessionStoreProperties(
        MutationConcurrency mutationConcurrency,
        @Min(1) Integer recentDocumentLimit,
        @Min(1) Integer recentWorkspaceLimit,
        @Min(1) Integer historyLimit,
        @NotBlank String serviceName,
        @NotBlank String schedulerThreadName) {

    /** Defaults are applied before Bean Validation runs. */
    public SessionStoreProperties {
        if (mutationConcurrency == null) {
            mutationConcurrency = MutationConcurrency.REJECT;
        }
        if (recentDocumentLimit == null) {
            recentDocumentLimit = 10;
        }
        if (recentWorkspaceLimit == null) {
            recentWorkspaceLimit = 3;
        }
        if (historyLimit == null) {
            historyLimit = 50;
        }
        if (serviceName == null) {
            serviceName = "atrium-session";
        }
        if (schedulerThreadName == null) {
            schedulerThreadName = "atrium-store";
        }
    }
}
