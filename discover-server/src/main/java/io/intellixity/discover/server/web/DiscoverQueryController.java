package io.intellixity.discover.server.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.discover.server.service.DiscoverQueryService;
import io.intellixity.discover.server.service.DiscoverResult;
import io.intellixity.discover.spi.exec.OffsetPage;
import io.intellixity.discover.spi.exec.PageResult;
import io.intellixity.discover.spi.exec.QueryExecutor;
import io.intellixity.discover.spi.result.ResultSet;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequestMapping("/api/0/organizations/{organization}/discover")
public final class DiscoverQueryController {
  public static final int DEFAULT_PER_PAGE = 100;
  static final String INVALID_PER_PAGE = "Invalid per_page parameter.";

  private final DiscoverQueryService discover;

  public DiscoverQueryController(DiscoverQueryService discover) {
    this.discover = discover;
  }

  @PostMapping("/query")
  public ResponseEntity<ResultSet> query(@PathVariable("organization") String organization,
                                         @RequestAttribute(MemberContextFilter.MEMBER_ATTRIBUTE) String member,
                                         @RequestParam(value = "cursor", required = false) String cursor,
                                         @RequestParam(value = "per_page", required = false) String perPage,
                                         @RequestBody(required = false) JsonNode body,
                                         HttpServletRequest request) {
    OffsetCursor at = OffsetCursor.parse(cursor);
    OffsetPage page = new OffsetPage(at.offset(), perPage(perPage));

    DiscoverResult result = discover.query(organization, member, body, page);
    if (!result.paginated()) return ResponseEntity.ok(result.results());
    return ResponseEntity.ok()
        .header(HttpHeaders.LINK, linkHeader(request, result.page()))
        .body(result.results());
  }

  static int perPage(String raw) {
    if (raw == null || raw.isBlank()) return DEFAULT_PER_PAGE;
    int n;
    try {
      n = Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new InvalidPageRequestException(INVALID_PER_PAGE);
    }
    if (n < 1) throw new InvalidPageRequestException(INVALID_PER_PAGE);
    return Math.min(n, QueryExecutor.MAX_PAGE_SIZE);
  }

  static String linkHeader(HttpServletRequest request, PageResult page) {
    int offset = page.page().offset();
    int size = page.page().limit();
    return link(request, OffsetCursor.previous(offset, size), "previous", page.hasPrevious())
        + ", " + link(request, OffsetCursor.next(offset, size), "next", page.hasNext());
  }

  private static String link(HttpServletRequest request, OffsetCursor cursor, String rel, boolean results) {
    String url = ServletUriComponentsBuilder.fromRequest(request)
        .replaceQueryParam("cursor", cursor.toString())
        .toUriString();
    return "<" + url + ">; rel=\"" + rel + "\"; results=\"" + results + "\"; cursor=\"" + cursor + "\"";
  }
}
