package com.bluecollar.operations;

import com.bluecollar.common.status.ErrorReason;
import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.common.status.Violation;
import com.bluecollar.db.Profile;
import com.bluecollar.db.Profiles;
import com.bluecollar.db.User;
import com.bluecollar.db.Users;
import com.bluecollar.rest.dto.CreateProfileRequest;
import com.bluecollar.validation.RequestValidator;
import com.google.common.collect.ImmutableList;
import org.tinylog.Logger;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates the profile of an existing user.
 *
 * <p>Runs validate, resolve the user, check for an existing profile, insert, stopping at the first
 * failing step. The existence check only exists to give a friendly error; two concurrent requests
 * can both pass it, and the loser is then turned away by the primary key on profile.user_id with
 * the same DUPLICATE_PROFILE outcome.
 */
public class CreateProfileOperation {
    private final Connection dbConnection;
    private final RequestValidator validator;

    /**
     * Creates a new CreateProfileOperation.
     *
     * @param dbConnection the database connection to use
     * @param validator validates the request body
     */
    public CreateProfileOperation(Connection dbConnection, RequestValidator validator) {
        this.dbConnection = dbConnection;
        this.validator = validator;
    }

    /**
     * Creates the profile described by the request.
     *
     * @return the stored profile; VALIDATION_ERROR, USER_NOT_FOUND, DUPLICATE_PROFILE or
     *     INTERNAL_ERROR otherwise
     */
    public StatusOr<Profile> execute(CreateProfileRequest request) {
        Status valid = validate(validator, request);
        if (!valid.isOk()) {
            return StatusOr.ofStatus(valid);
        }

        // A userId wins over a phone number; the phone number only ever resolves to a userId.
        String identifier;
        StatusOr<Optional<User>> userOr;
        if (request.userId() != null) {
            identifier = request.userId();
            userOr = Users.loadById(dbConnection, UUID.fromString(request.userId()));
        } else {
            identifier = request.phoneNumber();
            userOr = Users.loadByPhoneNumber(dbConnection, request.phoneNumber());
        }
        if (userOr.isNotOk()) {
            return internal("An error occurred while validating user", userOr.getStatus());
        }
        if (userOr.getValue().isEmpty()) {
            return StatusOr.ofStatus(
                    Status.notFound(ErrorReason.USER_NOT_FOUND, "User not found", identifier));
        }
        UUID userId = userOr.getValue().get().userId();

        StatusOr<Boolean> existsOr = Profiles.existsForUser(dbConnection, userId);
        if (existsOr.isNotOk()) {
            return internal("An error occurred while checking profile existence", existsOr.getStatus());
        }
        if (existsOr.getValue()) {
            return StatusOr.ofStatus(duplicate(userId));
        }

        Profile profile = new Profile(
                userId,
                request.headline(),
                request.summary(),
                request.skills(),
                request.certifications(),
                request.languages(),
                request.score(),
                request.shareUrl(),
                Instant.now()
        );
        StatusOr<Profile> insertOr = Profiles.insert(dbConnection, profile);
        if (insertOr.isNotOk()) {
            if (insertOr.getStatus().getReason() == ErrorReason.DUPLICATE_PROFILE) {
                Logger.info("Profile for user {} was created concurrently", userId);
                return StatusOr.ofStatus(duplicate(userId));
            }
            return internal("An error occurred while creating the profile", insertOr.getStatus());
        }

        Logger.info("Profile created for user: {}", userId);
        return insertOr;
    }

    /**
     * Checks the request without touching the datastore.
     *
     * @return OK, or VALIDATION_ERROR carrying every violation
     */
    public static Status validate(RequestValidator validator, CreateProfileRequest request) {
        List<Violation> violations = ImmutableList.<Violation>builder()
                .addAll(request.identifierViolations())
                .addAll(validator.validate(request))
                .build();
        return violations.isEmpty() ? Status.ok() : Status.invalid("Validation error", violations);
    }

    private static Status duplicate(UUID userId) {
        return Status.alreadyExists(
                        ErrorReason.DUPLICATE_PROFILE, "Profile already exists for this user")
                .withIdentifier(userId.toString());
    }

    private static <T> StatusOr<T> internal(String message, Status cause) {
        Logger.error(cause.getCause(), "{}: {}", message, cause.getMessage());
        return StatusOr.ofStatus(Status.internal(message, cause.getCause()));
    }
}
