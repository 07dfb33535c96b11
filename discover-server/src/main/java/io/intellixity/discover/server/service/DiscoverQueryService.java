package io.intellixity.discover.server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.discover.governance.AccessContext;
import io.intellixity.discover.governance.AccessContextResolver;
import io.intellixity.discover.governance.AccessValidator;
import io.intellixity.discover.query.DiscoverRequest;
import io.intellixity.discover.query.QuerySpec;
import io.intellixity.discover.query.QueryValidationException;
import io.intellixity.discover.spi.exec.OffsetPage;
import io.intellixity.discover.spi.exec.QueryExecutor;
import io.intellixity.discover.validate.QuerySpecValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Runs one discover query for a member of an organization: feature gate, access context, validation,
 * execution. Raw queries return the requested page only; aggregation queries return everything in one go.
 */
@Service
public final class DiscoverQueryService {
  private static final Logger log = LoggerFactory.getLogger(DiscoverQueryService.class);

  private final FeatureGate features;
  private final AccessContextResolver contexts;
  private final AccessValidator access;
  private final QuerySpecValidator validator;
  private final QueryExecutor executor;
  private final ObjectMapper mapper;

  public DiscoverQueryService(FeatureGate features,
                              AccessContextResolver contexts,
                              AccessValidator access,
                              QuerySpecValidator validator,
                              QueryExecutor executor,
                              ObjectMapper mapper) {
    this.features = Objects.requireNonNull(features, "features");
    this.contexts = Objects.requireNonNull(contexts, "contexts");
    this.access = Objects.requireNonNull(access, "access");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public DiscoverResult query(String organization, String member, JsonNode body, OffsetPage page) {
    Objects.requireNonNull(page, "page");
    if (!features.isEnabled(organization, FeatureGate.DISCOVER)) {
      throw new FeatureDisabledException(organization, FeatureGate.DISCOVER);
    }
    AccessContext ctx = contexts.resolve(organization, member);

    DiscoverRequest request = readRequest(body);
    QuerySpec spec = validator.validate(request, projects -> access.validate(ctx, projects));

    if (log.isDebugEnabled()) {
      log.debug("discover.query org={} member={} projects={} aggregations={} offset={} perPage={}",
          organization, member, spec.projects().size(), spec.aggregations().size(), page.offset(), page.limit());
    }
    if (QueryExecutor.isPaginated(spec)) {
      return DiscoverResult.paged(executor.executePage(spec, ctx.visibleProjects(), page));
    }
    return DiscoverResult.single(executor.execute(spec, ctx.visibleProjects()));
  }

  private DiscoverRequest readRequest(JsonNode body) {
    JsonNode node = (body == null || body.isNull() || body.isMissingNode()) ? mapper.createObjectNode() : body;
    try {
      return mapper.treeToValue(node, DiscoverRequest.class);
    } catch (JsonProcessingException e) {
      throw QueryValidationException.forField(QueryValidationException.NON_FIELD_ERRORS, "Invalid data.");
    }
  }
}
