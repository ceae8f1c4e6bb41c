package com.bluecollar.rest.dto;

import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.Visibility;

/**
 * Success response of both profile endpoints: {@code POST} answers with
 * "Profile created successfully", {@code GET} with "Profile found".
 */
@OpenApiDescription("A profile with a success message")
@OpenApiName("ProfileEnvelope")
@OpenApiByFields(Visibility.PUBLIC)
public record ProfileEnvelope(
    @OpenApiExample("true")
    @OpenApiRequired
    boolean success,

    @OpenApiExample("Profile found")
    @OpenApiRequired
    String message,

    @OpenApiRequired
    ProfileResponse data
) {

  public static ProfileEnvelope created(ProfileResponse data) {
    return new ProfileEnvelope(true, "Profile created successfully", data);
  }

  public static ProfileEnvelope found(ProfileResponse data) {
    return new ProfileEnvelope(true, "Profile found", data);
  }
}
