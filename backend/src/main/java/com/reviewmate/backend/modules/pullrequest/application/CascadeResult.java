package com.reviewmate.backend.modules.pullrequest.application;

/**
 * Tally of a deactivation cascade. {@code interrupted} is set when the loop stopped early.
 */
public record CascadeResult(int reassigned, int errors, boolean interrupted) {
}
