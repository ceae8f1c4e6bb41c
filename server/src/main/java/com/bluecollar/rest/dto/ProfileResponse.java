package com.bluecollar.rest.dto;

import com.bluecollar.db.Profile;
import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiPropertyType;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.OpenApiStringValidation;
import io.javalin.openapi.Visibility;
import java.math.BigDecimal;
import java.util.List;

/**
 * The public fields of a profile. Storage-only columns such as the creation time are left out.
 */
@OpenApiDescription("A worker profile")
@OpenApiName("Profile")
@OpenApiByFields(Visibility.PUBLIC)
public record ProfileResponse(
    @OpenApiDescription("The owning user")
    @OpenApiExample("123e4567-e89b-12d3-a456-426614174000")
    @OpenApiRequired
    @OpenApiStringValidation(format = "uuid")
    String userId,

    @OpenApiDescription("Short professional headline")
    @OpenApiNullable
    String headline,

    @OpenApiDescription("Longer description of the worker's background")
    @OpenApiNullable
    String summary,

    @OpenApiDescription("Distinct skills")
    @OpenApiNullable
    List<String> skills,

    @OpenApiDescription("Distinct certifications")
    @OpenApiNullable
    List<String> certifications,

    @OpenApiDescription("Distinct spoken languages")
    @OpenApiNullable
    List<String> languages,

    @OpenApiDescription("Score between 0 and 100")
    @OpenApiExample("87.5")
    @OpenApiPropertyType(definedBy = Double.class)
    @OpenApiNullable
    BigDecimal score,

    @OpenApiDescription("Public link to the profile")
    @OpenApiNullable
    String shareUrl
) {

  public static ProfileResponse from(Profile profile) {
    return new ProfileResponse(
        profile.userId().toString(),
        profile.headline(),
        profile.summary(),
        profile.skills(),
        profile.certifications(),
        profile.languages(),
        profile.score(),
        profile.shareUrl());
  }
}
