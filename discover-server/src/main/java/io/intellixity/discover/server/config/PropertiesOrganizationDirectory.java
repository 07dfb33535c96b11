package io.intellixity.discover.server.config;

import io.intellixity.discover.governance.MemberRole;
import io.intellixity.discover.governance.OrganizationDirectory;
import io.intellixity.discover.server.service.FeatureGate;

import java.util.*;

/** Organization directory and feature flags read from {@code discover.organizations}. */
public final class PropertiesOrganizationDirectory implements OrganizationDirectory, FeatureGate {
  private final DiscoverProperties props;

  public PropertiesOrganizationDirectory(DiscoverProperties props) {
    this.props = Objects.requireNonNull(props, "props");
  }

  @Override
  public List<ProjectRef> visibleProjects(String organization) {
    DiscoverProperties.Organization org = props.getOrganizations().get(organization);
    if (org == null) return List.of();
    List<ProjectRef> out = new ArrayList<>();
    for (DiscoverProperties.Project p : org.getProjects()) {
      if (p.isVisible()) out.add(new ProjectRef(p.getId(), p.getSlug()));
    }
    return out;
  }

  @Override
  public Optional<Membership> membership(String organization, String member) {
    DiscoverProperties.Organization org = props.getOrganizations().get(organization);
    if (org == null) return Optional.empty();
    DiscoverProperties.Member m = org.getMembers().get(member);
    if (m == null) return Optional.empty();
    return Optional.of(new Membership(MemberRole.of(m.getRole()), new LinkedHashSet<>(m.getTeams())));
  }

  @Override
  public Set<Long> teamProjects(String organization, Set<String> teams) {
    DiscoverProperties.Organization org = props.getOrganizations().get(organization);
    if (org == null || teams.isEmpty()) return Set.of();
    Set<Long> out = new LinkedHashSet<>();
    for (String team : teams) {
      List<Long> ids = org.getTeams().get(team);
      if (ids != null) out.addAll(ids);
    }
    return out;
  }

  @Override
  public boolean isEnabled(String organization, String feature) {
    DiscoverProperties.Organization org = props.getOrganizations().get(organization);
    return org != null && org.getFeatures().contains(feature);
  }
}
