package io.intellixity.discover.server.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.discover.governance.AccessContextResolver;
import io.intellixity.discover.governance.AccessValidator;
import io.intellixity.discover.server.config.PropertiesOrganizationDirectory;
import io.intellixity.discover.server.service.DiscoverQueryService;
import io.intellixity.discover.spi.exec.QueryEngine;
import io.intellixity.discover.spi.exec.QueryEngineException;
import io.intellixity.discover.spi.exec.QueryExecutor;
import io.intellixity.discover.spi.physical.PhysicalQuery;
import io.intellixity.discover.spi.result.ColumnMeta;
import io.intellixity.discover.spi.result.EngineResult;
import io.intellixity.discover.validate.QuerySpecValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;

import static io.intellixity.discover.server.config.DiscoverFixtures.acme;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

final class DiscoverQueryControllerTest {
  private static final String URL = "/api/0/organizations/{organization}/discover/query";
  private static final Instant NOW = Instant.parse("2024-03-02T00:00:00Z");

  /** In-memory event store: {@code total} rows spread over projects 1 and 2. */
  static final class FakeEngine implements QueryEngine {
    final List<PhysicalQuery> queries = new ArrayList<>();
    int total = 5;
    boolean fail;

    @Override
    public EngineResult query(PhysicalQuery q) {
      queries.add(q);
      if (fail) throw new QueryEngineException("timeout");
      if (!q.aggregations().isEmpty()) {
        return new EngineResult(List.of(new ColumnMeta("project_id", "UInt64"), new ColumnMeta("count", "UInt64")),
            List.of(row("project_id", 1L, "count", 3L), row("project_id", 2L, "count", 2L)));
      }
      int offset = q.offset() == null ? 0 : q.offset();
      int limit = q.limit() == null ? total : q.limit();
      List<Map<String, Object>> rows = new ArrayList<>();
      for (int i = offset; i < Math.min(total, offset + limit); i++) {
        rows.add(row("message", "event " + i, "project_id", (long) (i % 2 + 1)));
      }
      return new EngineResult(List.of(new ColumnMeta("message", "String"), new ColumnMeta("project_id", "UInt64")), rows);
    }

    private static Map<String, Object> row(Object... kv) {
      Map<String, Object> m = new LinkedHashMap<>();
      for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
      return m;
    }
  }

  private FakeEngine engine;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    engine = new FakeEngine();
    PropertiesOrganizationDirectory directory = new PropertiesOrganizationDirectory(acme());
    DiscoverQueryService service = new DiscoverQueryService(
        directory,
        new AccessContextResolver(directory, 100, 60_000L),
        new AccessValidator(),
        new QuerySpecValidator(Clock.fixed(NOW, ZoneOffset.UTC)),
        new QueryExecutor(engine),
        new ObjectMapper());
    mvc = MockMvcBuilders.standaloneSetup(new DiscoverQueryController(service))
        .setControllerAdvice(new DiscoverExceptionHandler())
        .addFilters(new MemberContextFilter())
        .build();
  }

  private static MockHttpServletRequestBuilder query(String org, String member, String json) {
    MockHttpServletRequestBuilder b = post(URL, org).contentType(MediaType.APPLICATION_JSON).content(json);
    return member == null ? b : b.header(MemberContextFilter.MEMBER_HEADER, member);
  }

  @Test
  void missingMemberHeaderIsUnauthorized() throws Exception {
    mvc.perform(query("acme", null, "{}")).andExpect(status().isUnauthorized());
    assertTrue(engine.queries.isEmpty());
  }

  @Test
  void disabledFeatureIsNotFound() throws Exception {
    mvc.perform(query("beta", "alice", "{\"projects\":[1],\"range\":\"1d\"}")).andExpect(status().isNotFound());
  }

  @Test
  void nonMemberIsForbidden() throws Exception {
    mvc.perform(query("acme", "mallory", "{\"projects\":[1],\"range\":\"1d\"}")).andExpect(status().isForbidden());
  }

  @Test
  void projectOutsideMemberTeamsIsForbiddenEvenWithOtherErrors() throws Exception {
    mvc.perform(query("acme", "bob", "{\"projects\":[1,2],\"aggregations\":[[\"sum\",\"x\",\"s\"]]}"))
        .andExpect(status().isForbidden());
    assertTrue(engine.queries.isEmpty());
  }

  @Test
  void hiddenProjectIsForbiddenForOwners() throws Exception {
    mvc.perform(query("acme", "alice", "{\"projects\":[3],\"range\":\"1d\"}")).andExpect(status().isForbidden());
  }

  @Test
  void validationErrorsAreReportedPerField() throws Exception {
    String body = "{\"projects\":[1],\"range\":\"1d\",\"start\":\"2024-03-01T00:00:00Z\",\"end\":\"2024-03-02T00:00:00Z\","
        + "\"aggregations\":[[\"sum\",\"x\",\"s\"],[\"max\",\"y\",\"m\"]]}";
    mvc.perform(query("acme", "alice", body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.range[0]").value("Either start and end dates or range is required"))
        .andExpect(jsonPath("$.aggregations[0]").value("Invalid aggregate function - sum, max"));
    assertTrue(engine.queries.isEmpty());
  }

  @Test
  void nonObjectBodyIsRejected() throws Exception {
    mvc.perform(query("acme", "alice", "[1,2]"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.non_field_errors").isArray());
  }

  @Test
  void rawQueryReturnsOnePageWithLinks() throws Exception {
    String body = "{\"projects\":[1,2],\"range\":\"1d\",\"fields\":[\"message\",\"project_name\"]}";
    mvc.perform(query("acme", "alice", body).param("per_page", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.meta[0].name").value("message"))
        .andExpect(jsonPath("$.meta[1].name").value("project_name"))
        .andExpect(jsonPath("$.meta[1].type").value("string"))
        .andExpect(jsonPath("$.meta.length()").value(2))
        .andExpect(jsonPath("$.data.length()").value(2))
        .andExpect(jsonPath("$.data[0].project_name").value("backend"))
        .andExpect(jsonPath("$.data[1].project_name").value("frontend"))
        .andExpect(jsonPath("$.data[0].project_id").doesNotExist())
        .andExpect(header().string("Link", containsString("rel=\"next\"; results=\"true\"; cursor=\"0:2:0\"")))
        .andExpect(header().string("Link", containsString("rel=\"previous\"; results=\"false\"; cursor=\"0:0:1\"")));

    PhysicalQuery sent = engine.queries.get(0);
    assertEquals(Integer.valueOf(3), sent.limit());
    assertEquals(Integer.valueOf(0), sent.offset());
    assertEquals(List.of("message", "project_id"), sent.selectedColumns());
    assertEquals(Map.of("project_id", Set.of(1L, 2L)), sent.filterKeys());
    assertEquals(NOW, sent.end());
    assertEquals(NOW.minusSeconds(86_400), sent.start());
  }

  @Test
  void lastPageHasNoNextLink() throws Exception {
    String body = "{\"projects\":[1],\"range\":\"1d\",\"fields\":[\"message\"]}";
    mvc.perform(query("acme", "bob", body).param("per_page", "2").param("cursor", "0:4:0"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.length()").value(1))
        .andExpect(header().string("Link", containsString("rel=\"next\"; results=\"false\"")))
        .andExpect(header().string("Link", containsString("rel=\"previous\"; results=\"true\"; cursor=\"0:2:1\"")));
  }

  @Test
  void aggregationQueryIsSingleShotWithoutLinks() throws Exception {
    String body = "{\"projects\":[1,2],\"range\":\"24h\",\"fields\":[\"project_name\"],"
        + "\"aggregations\":[[\"count()\",null,\"count\"]],\"orderby\":\"-count\"}";
    mvc.perform(query("acme", "alice", body))
        .andExpect(status().isOk())
        .andExpect(header().doesNotExist("Link"))
        .andExpect(jsonPath("$.meta[0].name").value("project_name"))
        .andExpect(jsonPath("$.meta[1].type").value("integer"))
        .andExpect(jsonPath("$.data[1].project_name").value("frontend"))
        .andExpect(jsonPath("$.data[1].count").value(2));

    assertEquals(1, engine.queries.size());
    assertTrue(engine.queries.get(0).selectedColumns().isEmpty());
    assertEquals(List.of("project_id"), engine.queries.get(0).groupby());
  }

  @Test
  void engineFailureIsBadGateway() throws Exception {
    engine.fail = true;
    mvc.perform(query("acme", "alice", "{\"projects\":[1],\"range\":\"1d\",\"fields\":[\"message\"]}"))
        .andExpect(status().isBadGateway());
  }

  @Test
  void malformedCursorIsBadRequest() throws Exception {
    mvc.perform(query("acme", "alice", "{\"projects\":[1],\"range\":\"1d\"}").param("cursor", "nope"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Invalid cursor parameter."));
  }
}
