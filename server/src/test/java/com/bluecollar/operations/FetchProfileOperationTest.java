package com.bluecollar.operations;

import static org.junit.jupiter.api.Assertions.*;

import com.bluecollar.common.status.ErrorReason;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.db.Profile;
import com.bluecollar.db.User;
import com.bluecollar.db.util.PostgresTestHelper;
import com.bluecollar.rest.dto.CreateProfileRequest;
import com.bluecollar.rest.dto.FetchProfileRequest;
import com.bluecollar.validation.RequestValidator;
import java.sql.SQLException;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers
class FetchProfileOperationTest {

    private static PostgresTestHelper.PostgresContext postgres;
    private static RequestValidator validator;

    @BeforeAll
    static void setUp() throws SQLException {
        postgres = PostgresTestHelper.setupPostgres("bluecollar_fetch_profile_test");
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

    private static StatusOr<Profile> fetch(String userId, String phoneNumber) {
        return new FetchProfileOperation(postgres.getConnection(), validator)
                .execute(new FetchProfileRequest(userId, phoneNumber));
    }

    @Test
    void testFetchByEitherIdentifier() {
        // Given: A user with a profile
        User user = PostgresTestHelper.insertUser(postgres.getConnection(), "+15554440000");
        new CreateProfileOperation(postgres.getConnection(), validator)
                .execute(CreateProfileRequest.forUser(user.userId().toString()));

        // Then: It can be fetched by id or by phone number
        assertEquals(user.userId(), fetch(user.userId().toString(), null).getValue().userId());
        assertEquals(user.userId(), fetch(null, "+15554440000").getValue().userId());
    }

    @Test
    void testUserWithoutProfile() {
        // Given: A user with no profile
        PostgresTestHelper.insertUser(postgres.getConnection(), "+15554440001");

        // When: We fetch their profile
        StatusOr<Profile> result = fetch(null, "+15554440001");

        // Then: PROFILE_NOT_FOUND, not USER_NOT_FOUND
        assertEquals(ErrorReason.PROFILE_NOT_FOUND, result.getStatus().getReason());
        assertEquals("Profile not found", result.getStatus().getMessage());
        assertEquals("+15554440001", result.getStatus().getIdentifier());
    }

    @Test
    void testUnknownUser() {
        String userId = UUID.randomUUID().toString();

        StatusOr<Profile> result = fetch(userId, null);

        assertEquals(ErrorReason.USER_NOT_FOUND, result.getStatus().getReason());
        assertEquals(404, result.getStatus().getHttpCode());
        assertEquals(userId, result.getStatus().getIdentifier());
    }

    @Test
    void testBothOrNeitherIdentifier() {
        StatusOr<Profile> neither = fetch(null, null);
        StatusOr<Profile> both = fetch(UUID.randomUUID().toString(), "+15554440002");

        assertEquals("Invalid parameters", neither.getStatus().getMessage());
        assertEquals(
                "Must provide either phoneNumber or userId (not both)",
                neither.getStatus().getViolations().get(0).message());
        assertEquals(ErrorReason.VALIDATION_ERROR, both.getStatus().getReason());
    }

    @Test
    void testMalformedUserId() {
        StatusOr<Profile> result = fetch("invalid-uuid", null);

        assertEquals(400, result.getStatus().getHttpCode());
        assertEquals("Invalid UUID format", result.getStatus().getViolations().get(0).message());
    }
}
