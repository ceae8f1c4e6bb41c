package com.bluecollar.rest.dto;

import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.Visibility;

@OpenApiName("Health")
@OpenApiByFields(Visibility.PUBLIC)
public record HealthResponse(
    @OpenApiRequired boolean success,
    @OpenApiExample("Blue Collar Workers API is running!") @OpenApiRequired String message,
    @OpenApiExample("2025-01-26T10:15:30Z") @OpenApiRequired String timestamp,
    @OpenApiExample("http://localhost:3000/api-docs") @OpenApiRequired String documentation
) {

  public static final String MESSAGE = "Blue Collar Workers API is running!";
}
