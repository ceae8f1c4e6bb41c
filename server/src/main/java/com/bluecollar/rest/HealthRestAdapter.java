package com.bluecollar.rest;

import com.bluecollar.rest.dto.HealthResponse;
import com.google.common.base.MoreObjects;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiResponse;
import java.time.Clock;
import java.time.Instant;

/** REST adapter for the liveness endpoint at the root path. */
public class HealthRestAdapter implements RestAdapter {

  private final Clock clock;

  public HealthRestAdapter(Clock clock) {
    this.clock = clock;
  }

  @OpenApi(
      path = "/",
      methods = {HttpMethod.GET},
      summary = "Health check",
      description = "Reports that the API is running and where its documentation lives.",
      operationId = "health",
      tags = "Health",
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The API is running",
            content = @OpenApiContent(from = HealthResponse.class))
      })
  public void handleHealth(Context ctx) {
    String host = MoreObjects.firstNonNull(ctx.host(), "localhost");
    ctx.status(200)
        .json(
            new HealthResponse(
                true,
                HealthResponse.MESSAGE,
                Instant.now(clock).toString(),
                ctx.scheme() + "://" + host + "/api-docs"));
  }
}
