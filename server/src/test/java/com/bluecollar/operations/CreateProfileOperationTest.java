package com.bluecollar.operations;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.mockStatic;

import com.bluecollar.common.status.ErrorReason;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.common.status.Violation;
import com.bluecollar.db.Profile;
import com.bluecollar.db.Profiles;
import com.bluecollar.db.User;
import com.bluecollar.db.util.PostgresTestHelper;
import com.bluecollar.rest.dto.CreateProfileRequest;
import com.bluecollar.validation.RequestValidator;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers
class CreateProfileOperationTest {

    private static PostgresTestHelper.PostgresContext postgres;
    private static RequestValidator validator;

    @BeforeAll
    static void setUp() throws SQLException {
        postgres = PostgresTestHelper.setupPostgres("bluecollar_create_profile_test");
        validator = new RequestValidator();
    }

    @AfterAll
    static void tearDown() {
        validator.close();
        if (postgres != null) {
            postgres.close();
        }
    }

    @BeforeEach
    void clearDatabase() throws SQLException {
        PostgresTestHelper.clearTables(postgres.getConnection());
    }

    private static StatusOr<Profile> create(CreateProfileRequest request) {
        Connection connection = postgres.getConnection();
        return new CreateProfileOperation(connection, validator).execute(request);
    }

    @Test
    void testCreateByUserId() {
        // Given: An existing user
        User user = PostgresTestHelper.insertUser(postgres.getConnection(), "+15553330000");
        CreateProfileRequest request = new CreateProfileRequest(
                user.userId().toString(), null, "Plumber", null,
                List.of("Pipe fitting"), null, List.of("English"), new BigDecimal("75"), null);

        // When: We create their profile
        StatusOr<Profile> result = create(request);

        // Then: The stored profile is returned
        assertTrue(result.isOk());
        assertEquals(user.userId(), result.getValue().userId());
        assertEquals("Plumber", result.getValue().headline());
        assertEquals(List.of("Pipe fitting"), result.getValue().skills());
    }

    @Test
    void testCreateByPhoneNumber() {
        // Given: An existing user with a phone number
        User user = PostgresTestHelper.insertUser(postgres.getConnection(), "+15553330001");

        // When: We create a profile naming only the phone number
        StatusOr<Profile> result = create(CreateProfileRequest.forPhoneNumber("+15553330001"));

        // Then: It is attached to that user
        assertTrue(result.isOk());
        assertEquals(user.userId(), result.getValue().userId());
    }

    @Test
    void testUserIdWinsOverPhoneNumber() {
        // Given: Two users
        User byId = PostgresTestHelper.insertUser(postgres.getConnection(), "+15553330002");
        PostgresTestHelper.insertUser(postgres.getConnection(), "+15553330003");

        // When: A request names the first by id and the second by phone number
        CreateProfileRequest request = new CreateProfileRequest(
                byId.userId().toString(), "+15553330003", null, null, null, null, null, null, null);
        StatusOr<Profile> result = create(request);

        // Then: The profile belongs to the user named by id
        assertTrue(result.isOk());
        assertEquals(byId.userId(), result.getValue().userId());
    }

    @Test
    void testSecondProfileIsRejected() {
        // Given: A user who already has a profile
        User user = PostgresTestHelper.insertUser(postgres.getConnection(), "+15553330004");
        assertTrue(create(CreateProfileRequest.forUser(user.userId().toString())).isOk());

        // When: We create another one
        StatusOr<Profile> result = create(CreateProfileRequest.forPhoneNumber("+15553330004"));

        // Then: It is a duplicate, reported with the resolved user id
        assertTrue(result.isNotOk());
        assertEquals(ErrorReason.DUPLICATE_PROFILE, result.getStatus().getReason());
        assertEquals(409, result.getStatus().getHttpCode());
        assertEquals("Profile already exists for this user", result.getStatus().getMessage());
        assertEquals(user.userId().toString(), result.getStatus().getIdentifier());
    }

    @Test
    void testProfileInsertedAfterExistenceCheckIsDuplicate() {
        // Given: A profile written by a concurrent request the existence check did not see
        User user = PostgresTestHelper.insertUser(postgres.getConnection(), "+15553330009");
        Connection connection = postgres.getConnection();
        Profile concurrent = new Profile(user.userId(), "First", null, null, null, null, null, null,
                Instant.now());
        assertTrue(Profiles.insert(connection, concurrent).isOk());

        StatusOr<Profile> result;
        try (MockedStatic<Profiles> profiles = mockStatic(Profiles.class, CALLS_REAL_METHODS)) {
            profiles.when(() -> Profiles.existsForUser(connection, user.userId()))
                    .thenReturn(StatusOr.ofValue(false));

            // When: The insert runs into the primary key
            result = create(CreateProfileRequest.forUser(user.userId().toString()));
        }

        // Then: It is reported as a duplicate, not as an internal error
        assertTrue(result.isNotOk());
        assertEquals(ErrorReason.DUPLICATE_PROFILE, result.getStatus().getReason());
        assertEquals(409, result.getStatus().getHttpCode());
        assertEquals(user.userId().toString(), result.getStatus().getIdentifier());
        assertEquals("First",
                Profiles.loadByUserId(connection, user.userId()).getValue().orElseThrow().headline());
    }

    @Test
    void testUnknownUser() {
        // When: The phone number belongs to nobody
        StatusOr<Profile> result = create(CreateProfileRequest.forPhoneNumber("+19998887777"));

        // Then: USER_NOT_FOUND names the phone number
        assertTrue(result.isNotOk());
        assertEquals(ErrorReason.USER_NOT_FOUND, result.getStatus().getReason());
        assertEquals("User not found", result.getStatus().getMessage());
        assertEquals("+19998887777", result.getStatus().getIdentifier());
    }

    @Test
    void testUnknownUserId() {
        String userId = UUID.randomUUID().toString();

        StatusOr<Profile> result = create(CreateProfileRequest.forUser(userId));

        assertEquals(ErrorReason.USER_NOT_FOUND, result.getStatus().getReason());
        assertEquals(userId, result.getStatus().getIdentifier());
    }

    @Test
    void testMissingIdentifierIsReportedWithOtherViolations() {
        // Given: No identifier and an out-of-range score
        CreateProfileRequest request = new CreateProfileRequest(
                null, null, null, null, null, null, null, new BigDecimal("101"), null);

        // When: We try to create it
        StatusOr<Profile> result = create(request);

        // Then: Both problems are listed, identifier first
        assertTrue(result.isNotOk());
        assertEquals(ErrorReason.VALIDATION_ERROR, result.getStatus().getReason());
        assertEquals("Validation error", result.getStatus().getMessage());
        assertEquals(
                List.of(
                        new Violation("userId", "Either userId or phoneNumber is required"),
                        new Violation("score", "Score must be between 0 and 100 (received 101)")),
                result.getStatus().getViolations());
    }

    @Test
    void testInvalidRequestDoesNotTouchDatabase() {
        // Given: A malformed user id
        CreateProfileRequest request = CreateProfileRequest.forUser("not-a-uuid");

        // When: We run the operation without a connection
        StatusOr<Profile> result = new CreateProfileOperation(null, validator).execute(request);

        // Then: Validation fails before any query
        assertEquals(
                List.of(new Violation("userId", "userId must be a valid UUID format")),
                result.getStatus().getViolations());
    }
}
