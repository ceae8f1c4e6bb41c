package com.bluecollar.rest;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;

import com.bluecollar.config.ServerConfig;
import com.bluecollar.security.BearerTokenAuthenticator;
import com.bluecollar.validation.RequestValidator;
import io.javalin.config.RouterConfig;
import java.time.Clock;
import javax.sql.DataSource;

/**
 * Factory for creating REST adapters for all service endpoints.
 *
 * <p>This factory creates the adapters with their shared collaborators and registers their
 * handlers with the Javalin router.
 */
public class RestAdapterFactory {

  private final ProfileRestAdapter profileAdapter;
  private final FeedRestAdapter feedAdapter;
  private final HealthRestAdapter healthAdapter;

  /**
   * Creates a new RestAdapterFactory.
   *
   * @param dataSource The data source for database connections
   * @param config Supplies the system user and the internal API token
   * @param validator Validates request bodies and parameters
   */
  public RestAdapterFactory(DataSource dataSource, ServerConfig config, RequestValidator validator) {
    var authenticator = new BearerTokenAuthenticator(config.internalApiToken());
    this.profileAdapter = new ProfileRestAdapter(dataSource, authenticator, validator);
    this.feedAdapter =
        new FeedRestAdapter(dataSource, authenticator, validator, config.systemUserId());
    this.healthAdapter = new HealthRestAdapter(Clock.systemUTC());
  }

  /**
   * Configures the Javalin router to use the REST adapters.
   */
  public void configureRoutes(RouterConfig router) {
    router.apiBuilder(
        () -> {
          get("/", healthAdapter::handleHealth);

          // Profile endpoints
          path(
              "/api/profiles",
              () -> {
                post(profileAdapter::handleCreateProfile);
                get(profileAdapter::handleGetProfile);
              });

          // Feed endpoints; "public" is registered before the {userId} match
          path(
              "/api/feeds",
              () -> {
                get(feedAdapter::handleListAllFeeds);
                get("public", feedAdapter::handleListPublicFeeds);
                get("{userId}", feedAdapter::handleListUserFeeds);
              });

          // Ingestion endpoint
          path(
              "/api/internal/feeds",
              () -> {
                post(feedAdapter::handleCreateFeed);
              });
        });
  }

  public ProfileRestAdapter getProfileAdapter() {
    return profileAdapter;
  }

  public FeedRestAdapter getFeedAdapter() {
    return feedAdapter;
  }
}
