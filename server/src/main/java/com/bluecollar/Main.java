package com.bluecollar;

import com.bluecollar.common.status.Status;
import com.bluecollar.config.ServerConfig;
import com.bluecollar.rest.JsonMappers;
import com.bluecollar.rest.RestAdapterFactory;
import com.bluecollar.rest.dto.ErrorResponse;
import com.bluecollar.validation.RequestValidator;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import io.javalin.openapi.OpenApiInfo;
import io.javalin.openapi.plugin.OpenApiPlugin;
import io.javalin.openapi.plugin.redoc.ReDocPlugin;
import io.javalin.openapi.plugin.swagger.SwaggerPlugin;
import io.javalin.plugin.bundled.CorsPluginConfig.CorsRule;
import org.tinylog.Logger;

/**
 * Entry point of the Blue Collar Workers API.
 *
 * <p>Reads {@link ServerConfig} from the environment, opens the HikariCP pool, and serves the REST
 * API with Javalin together with its OpenAPI document ({@code /api-docs.json}), Swagger UI
 * ({@code /api-docs}) and ReDoc ({@code /redoc}).
 *
 * <h2>Error Handling</h2>
 *
 * <p>Handlers report expected failures as {@link Status} values, written as an
 * {@link ErrorResponse}:
 *
 * <ul>
 *   <li>Validation errors return 400 Bad Request
 *   <li>Authentication errors return 401 Unauthorized
 *   <li>Token mismatches return 403 Forbidden
 *   <li>Unknown users and profiles return 404 Not Found
 *   <li>Duplicate profiles return 409 Conflict
 *   <li>Anything else returns 500 Internal Server Error
 * </ul>
 */
public class Main {

  private static final String DOCS_JSON_PATH = "/api-docs.json";

  private final ServerConfig config;
  private final HikariDataSource dataSource;
  private final RequestValidator validator;
  private Javalin app;

  public Main(ServerConfig config) {
    this.config = config;
    Logger.info("Starting with configuration: {}", config.toSecureString());
    if (config.usesDefaultToken()) {
      Logger.warn("INTERNAL_API_TOKEN is not set; the default token is in use.");
    }
    this.dataSource = setupDataSource();
    this.validator = new RequestValidator();
  }

  /**
   * Sets up and configures the HikariCP connection pool.
   *
   * @return A configured HikariDataSource for database connections
   */
  private HikariDataSource setupDataSource() {
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(config.dbUrl());
    hikariConfig.setUsername(config.dbUser());
    hikariConfig.setPassword(config.dbPassword());
    hikariConfig.setMaximumPoolSize(10);
    hikariConfig.setMinimumIdle(2);
    hikariConfig.setIdleTimeout(30000);
    hikariConfig.setMaxLifetime(1800000);
    hikariConfig.setConnectionTimeout(30000);
    hikariConfig.setAutoCommit(true);
    hikariConfig.setPoolName("BlueCollarPool");
    hikariConfig.addDataSourceProperty("cachePrepStmts", "true");
    hikariConfig.addDataSourceProperty("prepStmtCacheSize", "250");
    hikariConfig.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

    Logger.info(
        "Initializing database connection pool with URL: {} and user {}",
        config.dbUrl(),
        config.dbUser());
    return new HikariDataSource(hikariConfig);
  }

  private OpenApiInfo getOpenApiInfo(OpenApiInfo openApiInfo) {
    return openApiInfo
        .title("Blue Collar Workers API")
        .description(
            "Profiles of blue collar workers and the news feeds published for them. "
                + "Profile and ingestion endpoints require a bearer token.")
        .version("1.2.0");
  }

  public void startJavalinServer() {
    var restAdapterFactory = new RestAdapterFactory(dataSource, config, validator);

    app =
        Javalin.create(
            javalinConfig -> {
              javalinConfig.jsonMapper(new JavalinJackson(JsonMappers.newObjectMapper(), false));
              javalinConfig.bundledPlugins.enableCors(cors -> cors.addRule(CorsRule::anyHost));
              javalinConfig.registerPlugin(
                  new OpenApiPlugin(
                      openApiConfig ->
                          openApiConfig
                              .withDocumentationPath(DOCS_JSON_PATH)
                              .withPrettyOutput()
                              .withDefinitionConfiguration(
                                  (version, openApiDefinition) ->
                                      openApiDefinition
                                          .withInfo(this::getOpenApiInfo)
                                          .withSecurity(
                                              openApiSecurity ->
                                                  openApiSecurity.withBearerAuth()))));

              javalinConfig.registerPlugin(
                  new SwaggerPlugin(
                      swaggerConfiguration -> {
                        swaggerConfiguration.setUiPath("/api-docs");
                        swaggerConfiguration.setDocumentationPath(DOCS_JSON_PATH);
                      }));

              javalinConfig.registerPlugin(
                  new ReDocPlugin(
                      reDocConfiguration -> {
                        reDocConfiguration.setUiPath("/redoc");
                        reDocConfiguration.setDocumentationPath(DOCS_JSON_PATH);
                      }));

              restAdapterFactory.configureRoutes(javalinConfig.router);
            });

    app.exception(
        Exception.class,
        (e, ctx) -> {
          Logger.error(e, "Unhandled exception for {} {}", ctx.method(), ctx.path());
          ctx.status(500)
              .json(
                  ErrorResponse.from(
                      Status.internal(
                          "An unexpected error occurred while processing your request", e)));
        });

    app.start(config.port());
    Logger.info("REST server started, listening on port {}.", config.port());

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down server since JVM is shutting down");
                  try {
                    Main.this.shutdown();
                  } catch (Exception e) {
                    Logger.error(e, "Error during shutdown.");
                  }
                }));
  }

  private void shutdown() {
    if (app != null) {
      app.stop();
    }
    validator.close();
    // Shut down HikariCP connection pool
    if (dataSource != null && !dataSource.isClosed()) {
      Logger.info("Shutting down database connection pool");
      dataSource.close();
    }
  }

  public static void main(String[] args) {
    Main server = new Main(ServerConfig.fromEnvironment(System.getenv()));
    server.startJavalinServer();
  }
}
