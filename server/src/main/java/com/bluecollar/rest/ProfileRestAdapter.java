package com.bluecollar.rest;

import com.bluecollar.common.status.Status;
import com.bluecollar.common.status.StatusOr;
import com.bluecollar.db.Profile;
import com.bluecollar.operations.CreateProfileOperation;
import com.bluecollar.operations.FetchProfileOperation;
import com.bluecollar.rest.dto.CreateProfileRequest;
import com.bluecollar.rest.dto.ErrorResponse;
import com.bluecollar.rest.dto.FetchProfileRequest;
import com.bluecollar.rest.dto.ProfileEnvelope;
import com.bluecollar.rest.dto.ProfileResponse;
import com.bluecollar.security.BearerTokenAuthenticator;
import com.bluecollar.validation.RequestValidator;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import io.javalin.openapi.OpenApiSecurity;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * REST adapter for the profile endpoints. Both require the internal bearer token.
 */
public class ProfileRestAdapter implements RestAdapter {

  private final DataSource dataSource;
  private final BearerTokenAuthenticator authenticator;
  private final RequestValidator validator;

  /**
   * Creates a new ProfileRestAdapter.
   *
   * @param dataSource Data source for database connections
   * @param authenticator Checks the bearer token of every request
   * @param validator Validates request bodies and parameters
   */
  public ProfileRestAdapter(
      DataSource dataSource, BearerTokenAuthenticator authenticator, RequestValidator validator) {
    this.dataSource = dataSource;
    this.authenticator = authenticator;
    this.validator = validator;
  }

  /**
   * Handles a REST request to create a profile for an existing user.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/api/profiles",
      methods = {HttpMethod.POST},
      summary = "Create a profile",
      description =
          "Creates the profile of an existing user, identified by userId or phoneNumber. "
              + "Every invalid field is reported. A user can have at most one profile.",
      operationId = "createProfile",
      tags = "Profiles",
      security = {@OpenApiSecurity(name = "BearerAuth")},
      requestBody =
          @OpenApiRequestBody(
              required = true,
              content = @OpenApiContent(from = CreateProfileRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "201",
            description = "Profile created",
            content = @OpenApiContent(from = ProfileEnvelope.class)),
        @OpenApiResponse(
            status = "400",
            description = "Validation error",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "401",
            description = "Missing or malformed Authorization header",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "403",
            description = "Invalid token",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "404",
            description = "USER_NOT_FOUND",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "409",
            description = "DUPLICATE_PROFILE",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "500",
            description = "Internal server error",
            content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleCreateProfile(Context ctx) {
    Logger.info("REST CreateProfile request");
    if (!authorize(ctx, authenticator)) {
      return;
    }

    StatusOr<CreateProfileRequest> requestOr =
        parseBody(ctx, CreateProfileRequest.class, "Validation error");
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }
    Status valid = CreateProfileOperation.validate(validator, requestOr.getValue());
    if (!valid.isOk()) {
      setError(ctx, valid);
      return;
    }

    try (Connection connection = dataSource.getConnection()) {
      var operation = new CreateProfileOperation(connection, validator);
      StatusOr<Profile> profileOr = operation.execute(requestOr.getValue());
      if (profileOr.isNotOk()) {
        setError(ctx, profileOr.getStatus());
        return;
      }
      ctx.status(201).json(ProfileEnvelope.created(ProfileResponse.from(profileOr.getValue())));
    } catch (SQLException e) {
      setError(ctx, Status.internal("An error occurred while creating the profile", e));
    }
  }

  /**
   * Handles a REST request to fetch a profile by exactly one of userId or phoneNumber.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/api/profiles",
      methods = {HttpMethod.GET},
      summary = "Fetch a profile",
      description =
          "Fetches the profile of a user. Exactly one of userId and phoneNumber must be given. "
              + "A 404 says whether the user or only the profile is missing.",
      operationId = "getProfile",
      tags = "Profiles",
      security = {@OpenApiSecurity(name = "BearerAuth")},
      queryParams = {
        @OpenApiParam(
            name = "userId",
            description = "UUID of the user",
            example = "123e4567-e89b-12d3-a456-426614174000"),
        @OpenApiParam(
            name = "phoneNumber",
            description = "Phone number of the user in international format",
            example = "+1234567890")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Profile found",
            content = @OpenApiContent(from = ProfileEnvelope.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid parameters",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "401", description = "Missing or malformed Authorization header"),
        @OpenApiResponse(status = "403", description = "Invalid token"),
        @OpenApiResponse(
            status = "404",
            description = "USER_NOT_FOUND or PROFILE_NOT_FOUND",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "500", description = "Internal server error")
      })
  public void handleGetProfile(Context ctx) {
    Logger.info("REST GetProfile request");
    if (!authorize(ctx, authenticator)) {
      return;
    }

    var request = new FetchProfileRequest(ctx.queryParam("userId"), ctx.queryParam("phoneNumber"));
    Status valid = FetchProfileOperation.validate(validator, request);
    if (!valid.isOk()) {
      setError(ctx, valid);
      return;
    }

    try (Connection connection = dataSource.getConnection()) {
      var operation = new FetchProfileOperation(connection, validator);
      StatusOr<Profile> profileOr = operation.execute(request);
      if (profileOr.isNotOk()) {
        setError(ctx, profileOr.getStatus());
        return;
      }
      ctx.status(200).json(ProfileEnvelope.found(ProfileResponse.from(profileOr.getValue())));
    } catch (SQLException e) {
      setError(ctx, Status.internal("An error occurred while fetching the profile", e));
    }
  }
}
