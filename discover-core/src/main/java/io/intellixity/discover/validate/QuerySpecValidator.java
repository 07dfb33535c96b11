package io.intellixity.discover.validate;

import io.intellixity.discover.query.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * Validation pipeline turning a {@link DiscoverRequest} into a {@link QuerySpec}.
 * <p>
 * Project access is checked first and denies outright. Every other step records its field errors
 * and the request is rejected as a whole with all of them.
 */
public final class QuerySpecValidator {
  private static final Logger log = LoggerFactory.getLogger(QuerySpecValidator.class);

  static final String REQUIRED = "This field is required.";
  static final String EMPTY_PROJECTS = "This list may not be empty.";
  static final String LIMIT_MIN = "Ensure this value is greater than or equal to 0.";
  static final String LIMIT_MAX = "Ensure this value is less than or equal to " + QuerySpec.MAX_LIMIT + ".";

  private final TimeRangeResolver timeRange;
  private final AggregationValidator aggregations;
  private final OrderByValidator orderBy;
  private final ConditionParser conditions;
  private final ArrayJoinResolver arrayJoin;

  public QuerySpecValidator(Clock clock) {
    this(new TimeRangeResolver(clock), new AggregationValidator(), new OrderByValidator(),
        new ConditionParser(), new ArrayJoinResolver());
  }

  public QuerySpecValidator(TimeRangeResolver timeRange,
                            AggregationValidator aggregations,
                            OrderByValidator orderBy,
                            ConditionParser conditions,
                            ArrayJoinResolver arrayJoin) {
    this.timeRange = Objects.requireNonNull(timeRange, "timeRange");
    this.aggregations = Objects.requireNonNull(aggregations, "aggregations");
    this.orderBy = Objects.requireNonNull(orderBy, "orderBy");
    this.conditions = Objects.requireNonNull(conditions, "conditions");
    this.arrayJoin = Objects.requireNonNull(arrayJoin, "arrayJoin");
  }

  public QuerySpec validate(DiscoverRequest request, ProjectAccessCheck access) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(access, "access");

    ValidationErrors errors = new ValidationErrors().addAll(request.parseErrors());

    Set<Long> projects = null;
    if (!errors.has("projects")) {
      if (request.projects() == null) {
        errors.add("projects", REQUIRED);
      } else if (request.projects().isEmpty()) {
        errors.add("projects", EMPTY_PROJECTS);
      } else {
        projects = new LinkedHashSet<>(request.projects());
        access.check(Collections.unmodifiableSet(projects));
      }
    }

    TimeWindow window = null;
    if (!errors.has("start") && !errors.has("end") && !errors.has("range")) {
      window = errors.collect(() -> timeRange.resolve(request.start(), request.end(), request.range()));
    }

    Integer limit = request.limit();
    if (limit != null && limit < 0) errors.add("limit", LIMIT_MIN);
    if (limit != null && limit > QuerySpec.MAX_LIMIT) errors.add("limit", LIMIT_MAX);

    List<String> fields = request.fields() == null ? List.of() : request.fields();

    List<Aggregation> aggs = errors.has(AggregationValidator.FIELD) ? null
        : errors.collect(() -> aggregations.parse(request.aggregations()));
    if (aggs != null) {
      List<Aggregation> parsed = aggs;
      errors.check(() -> aggregations.validate(parsed));
    }

    OrderBy order = null;
    if (aggs != null && !errors.has(OrderByValidator.FIELD)) {
      List<Aggregation> parsed = aggs;
      order = errors.collect(() -> orderBy.validate(request.orderby(), fields, parsed));
    }

    String arrayjoin = arrayJoin.resolve(fields);
    List<Condition> conds = null;
    if (!errors.has(ConditionParser.FIELD)) {
      List<ColumnCondition> parsed = errors.collect(() -> conditions.parse(request.conditions()));
      if (parsed != null) conds = arrayJoin.rewrite(parsed, arrayjoin);
    }

    errors.throwIfAny();

    List<String> groupby = new ArrayList<>(request.groupby() == null ? List.of() : request.groupby());
    if (!aggs.isEmpty()) {
      for (String f : fields) {
        if (!groupby.contains(f)) groupby.add(f);
      }
    }

    QuerySpec spec = new QuerySpec(projects, window, fields, aggs, groupby, order, conds,
        limit, request.rollup(), arrayjoin, request.turbo());
    if (log.isDebugEnabled()) {
      log.debug("discover.validate projects={} fields={} aggregations={} groupby={} conditions={} arrayjoin={}",
          spec.projects(), spec.fields().size(), spec.aggregations().size(), spec.groupby(),
          spec.conditions().size(), arrayjoin);
    }
    return spec;
  }
}
