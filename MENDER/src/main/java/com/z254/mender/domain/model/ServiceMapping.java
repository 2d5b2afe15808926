package com.z254.mender.domain.model;

/**
 * Routes a service to the repository (and branch) its remediation job runs against.
 */
public record ServiceMapping(String serviceName, String repository, String branch) {

    public static final String DEFAULT_BRANCH = "main";

    public ServiceMapping {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName is required");
        }
        if (repository == null || repository.isBlank()) {
            throw new IllegalArgumentException("repository is required for service " + serviceName);
        }
        if (branch == null || branch.isBlank()) {
            branch = DEFAULT_BRANCH;
        }
    }
}
