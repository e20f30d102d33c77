package io.github.brokerbench.results;

import io.github.brokerbench.model.SubscriberResult;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the subscriber's finalized result at {@code GET /results}, 404 until there is one.
 */
public class ResultsHandler {

  private static final Logger log = LoggerFactory.getLogger(ResultsHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final Supplier<Optional<SubscriberResult>> result;

  public ResultsHandler(Supplier<Optional<SubscriberResult>> result) {
    this.result = result;
  }

  public void registerRoutes(Router router) {
    router.get("/results").handler(this::handleResults);
    log.info("Registered results endpoint at /results");
  }

  private void handleResults(RoutingContext ctx) {
    Optional<SubscriberResult> current = result.get();
    ctx.response().putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON);
    if (current.isPresent()) {
      ctx.response().setStatusCode(200).end(JsonResultsWriter.toJson(current.get()).encode());
    } else {
      ctx.response().setStatusCode(404).end("{\"error\": \"Benchmark not finished\"}");
    }
  }
}
