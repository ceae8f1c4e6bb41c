/**
 * JSON request and response bodies of the REST API.
 *
 * <p>Every DTO is a record annotated for the OpenAPI annotation processor
 * ({@code @OpenApiName}, {@code @OpenApiDescription}, {@code @OpenApiRequired},
 * {@code @OpenApiNullable}, {@code @OpenApiExample}), which generates the document served at
 * {@code /api-docs.json}.
 *
 * <p>Request records also carry Jakarta Bean Validation constraints. Their compact constructors
 * normalize input (trimming strings, blank to absent) so validation sees what will be stored.
 * Responses expose ids as strings and timestamps as ISO-8601 strings. Failed requests of every
 * endpoint use {@link com.bluecollar.rest.dto.ErrorResponse}.
 */
package com.bluecollar.rest.dto;
