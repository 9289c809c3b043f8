package com.wellbridge.ai.api;

import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

public final class TenantContextResolver {

    static final String TENANT_CLAIM = "tenant_id";
    static final String ROLE_CLAIM = "role";
    static final String DEFAULT_ROLE = "patient";

    private TenantContextResolver() {}

    public static TenantContext resolve(Jwt jwt) {
        if (jwt == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing access token");
        }
        String tenantId = jwt.getClaimAsString(TENANT_CLAIM);
        String userId = jwt.getSubject();
        if (!StringUtils.hasText(tenantId) || !StringUtils.hasText(userId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Token has no tenant or subject");
        }
        String role = jwt.getClaimAsString(ROLE_CLAIM);
        return new TenantContext(tenantId, userId, StringUtils.hasText(role) ? role : DEFAULT_ROLE);
    }
}
