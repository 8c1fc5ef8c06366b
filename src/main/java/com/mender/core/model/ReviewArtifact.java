package com.mender.core.model;

/**
 * What gets handed to the review-routing collaborator for a fix that needs a human.
 */
public record ReviewArtifact(
    String fixId,
    String title,
    String body
) {}
