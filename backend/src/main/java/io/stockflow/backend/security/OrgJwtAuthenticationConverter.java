package io.stockflow.backend.security;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class OrgJwtAuthenticationConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.SUPER_ADMIN, Roles.AUTHORITY_SUPER_ADMIN,
          Roles.ADMIN, Roles.AUTHORITY_ADMIN,
          Roles.MANAGER, Roles.AUTHORITY_MANAGER,
          Roles.EMPLOYEE, Roles.AUTHORITY_EMPLOYEE,
          Roles.CONTADOR, Roles.AUTHORITY_CONTADOR);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    return new JwtAuthenticationToken(jwt, extractAuthorities(jwt), jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    String orgRole = OrgJwtUtils.extractOrgRole(jwt);
    String springRole = orgRole == null ? null : ROLE_MAPPING.get(orgRole);
    if (springRole == null) {
      return List.of();
    }
    return List.of(new SimpleGrantedAuthority(springRole));
  }
}
