package com.dollarstore.exchangeapi.config;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;

/**
 * Maps scopes plus the Keycloak-style {@code realm_access.roles} and {@code
 * resource_access.<client>.roles} claims to Spring authorities. Roles become {@code ROLE_<UPPER>}.
 */
public class RealmRoleGrantedAuthoritiesConverter
    implements Converter<Jwt, Collection<GrantedAuthority>> {
  public static final String DEFAULT_CLIENT_ID = "exchange-api";

  private final JwtGrantedAuthoritiesConverter scopeConverter =
      new JwtGrantedAuthoritiesConverter();
  private final String clientId;

  public RealmRoleGrantedAuthoritiesConverter() {
    this(DEFAULT_CLIENT_ID);
  }

  public RealmRoleGrantedAuthoritiesConverter(String clientId) {
    this.clientId = clientId;
  }

  @Override
  public Collection<GrantedAuthority> convert(Jwt jwt) {
    Set<GrantedAuthority> authorities = new LinkedHashSet<>();
    Collection<GrantedAuthority> scopes = scopeConverter.convert(jwt);
    if (scopes != null) {
      authorities.addAll(scopes);
    }
    for (String role : rolesIn(jwt.getClaims().get("realm_access"))) {
      addRole(authorities, role);
    }
    Object resourceAccess = jwt.getClaims().get("resource_access");
    if (resourceAccess instanceof Map<?, ?> clients) {
      for (String role : rolesIn(clients.get(clientId))) {
        addRole(authorities, role);
      }
    }
    return authorities;
  }

  private static List<String> rolesIn(Object access) {
    if (access instanceof Map<?, ?> accessMap
        && accessMap.get("roles") instanceof Collection<?> roles) {
      return roles.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }
    return List.of();
  }

  private static void addRole(Set<GrantedAuthority> authorities, String role) {
    if (!role.isBlank()) {
      authorities.add(new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT)));
    }
  }
}
