package com.bluecollar.validation;

/**
 * Validation group for presence checks. Requests that report missing fields separately from
 * malformed ones put their {@code @NotBlank} constraints in this group and validate it first.
 */
public interface RequiredChecks {}
