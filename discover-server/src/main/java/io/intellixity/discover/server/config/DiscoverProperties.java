package io.intellixity.discover.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "discover")
public class DiscoverProperties {
  private final Map<String, Organization> organizations = new HashMap<>();
  private final Engine engine = new Engine();
  private final AccessCache accessCache = new AccessCache();

  public Map<String, Organization> getOrganizations() { return organizations; }
  public Engine getEngine() { return engine; }
  public AccessCache getAccessCache() { return accessCache; }

  public static class Organization {
    /** Enabled features; {@code discover} turns the query endpoint on. */
    private List<String> features = new ArrayList<>();
    private List<Project> projects = new ArrayList<>();
    /** Team slug to the ids of the projects it owns. */
    private Map<String, List<Long>> teams = new HashMap<>();
    /** Member identity to membership. */
    private Map<String, Member> members = new HashMap<>();

    public List<String> getFeatures() { return features; }
    public void setFeatures(List<String> features) { this.features = features; }
    public List<Project> getProjects() { return projects; }
    public void setProjects(List<Project> projects) { this.projects = projects; }
    public Map<String, List<Long>> getTeams() { return teams; }
    public void setTeams(Map<String, List<Long>> teams) { this.teams = teams; }
    public Map<String, Member> getMembers() { return members; }
    public void setMembers(Map<String, Member> members) { this.members = members; }
  }

  public static class Project {
    private long id;
    private String slug;
    /** False while the project is pending deletion. */
    private boolean visible = true;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }
    public String getSlug() { return slug; }
    public void setSlug(String slug) { this.slug = slug; }
    public boolean isVisible() { return visible; }
    public void setVisible(boolean visible) { this.visible = visible; }
  }

  public static class Member {
    private String role = "member";
    private List<String> teams = new ArrayList<>();

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }
    public List<String> getTeams() { return teams; }
    public void setTeams(List<String> teams) { this.teams = teams; }
  }

  public static class Engine {
    private String jdbcUrl;
    private String username;
    private String password;
    private String table = "events";
    private int queryTimeoutSeconds = 30;
    private int maxPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getTable() { return table; }
    public void setTable(String table) { this.table = table; }
    public int getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) { this.queryTimeoutSeconds = queryTimeoutSeconds; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
  }

  public static class AccessCache {
    private int maxEntries = 1000;
    private long ttlMillis = 60_000L;

    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    public long getTtlMillis() { return ttlMillis; }
    public void setTtlMillis(long ttlMillis) { this.ttlMillis = ttlMillis; }
  }
}
