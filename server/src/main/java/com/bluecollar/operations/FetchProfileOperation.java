package com.bluecollar.operations;

import com.bluecollar.common.status.ErrorReason;
import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.common.status.Violation;
import com.bluecollar.db.Profile;
import com.bluecollar.db.Profiles;
import com.bluecollar.db.User;
import com.bluecollar.db.Users;
import com.bluecollar.rest.dto.FetchProfileRequest;
import com.bluecollar.validation.RequestValidator;
import com.google.common.collect.ImmutableList;
import org.tinylog.Logger;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Fetches a profile by user id or phone number.
 *
 * <p>When no profile is found, the user is looked up as well so that a caller can tell an unknown
 * user (USER_NOT_FOUND) from a known user without a profile (PROFILE_NOT_FOUND).
 */
public class FetchProfileOperation {
    private static final String FETCH_FAILED = "An error occurred while fetching the profile";

    private final Connection dbConnection;
    private final RequestValidator validator;

    public FetchProfileOperation(Connection dbConnection, RequestValidator validator) {
        this.dbConnection = dbConnection;
        this.validator = validator;
    }

    public StatusOr<Profile> execute(FetchProfileRequest request) {
        Status valid = validate(validator, request);
        if (!valid.isOk()) {
            return StatusOr.ofStatus(valid);
        }

        boolean byUserId = request.userId() != null;
        String identifier = byUserId ? request.userId() : request.phoneNumber();
        UUID userId = byUserId ? UUID.fromString(request.userId()) : null;

        StatusOr<Optional<Profile>> profileOr = byUserId
                ? Profiles.loadByUserId(dbConnection, userId)
                : Profiles.loadByPhoneNumber(dbConnection, request.phoneNumber());
        if (profileOr.isNotOk()) {
            return failed(profileOr.getStatus());
        }
        if (profileOr.getValue().isPresent()) {
            Profile profile = profileOr.getValue().get();
            Logger.info("Profile fetched for user: {}", profile.userId());
            return StatusOr.ofValue(profile);
        }

        StatusOr<Optional<User>> userOr = byUserId
                ? Users.loadById(dbConnection, userId)
                : Users.loadByPhoneNumber(dbConnection, request.phoneNumber());
        if (userOr.isNotOk()) {
            return failed(userOr.getStatus());
        }
        if (userOr.getValue().isEmpty()) {
            return StatusOr.ofStatus(
                    Status.notFound(ErrorReason.USER_NOT_FOUND, "User not found", identifier));
        }
        return StatusOr.ofStatus(
                Status.notFound(ErrorReason.PROFILE_NOT_FOUND, "Profile not found", identifier));
    }

    /** Checks the query parameters without touching the datastore. */
    public static Status validate(RequestValidator validator, FetchProfileRequest request) {
        List<Violation> violations = ImmutableList.<Violation>builder()
                .addAll(request.identifierViolations())
                .addAll(validator.validate(request))
                .build();
        return violations.isEmpty() ? Status.ok() : Status.invalid("Invalid parameters", violations);
    }

    private static <T> StatusOr<T> failed(Status cause) {
        Logger.error(cause.getCause(), "{}: {}", FETCH_FAILED, cause.getMessage());
        return StatusOr.ofStatus(Status.internal(FETCH_FAILED, cause.getCause()));
    }
}
