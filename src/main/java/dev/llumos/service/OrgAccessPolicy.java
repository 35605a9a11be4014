package dev.llumos.service;

import dev.llumos.config.SecurityProperties;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Org scoping for batch endpoints: the scheduler may act on any organization, a user token
 * only on the organization in its org claim.
 */
@Component
public class OrgAccessPolicy {

    public static final String SCHEDULER_ROLE = "ROLE_SCHEDULER";

    private final String orgClaim;

    public OrgAccessPolicy(SecurityProperties properties) {
        this.orgClaim = properties.orgClaim();
    }

    public void checkAccess(Authentication authentication, UUID orgId) {
        if (isScheduler(authentication)) return;
        if (authentication instanceof JwtAuthenticationToken jwt && orgId != null) {
            String claimed = jwt.getToken().getClaimAsString(orgClaim);
            if (orgId.toString().equalsIgnoreCase(claimed)) return;
        }
        throw new AccessDeniedException("Not allowed to act on organization " + orgId);
    }

    public boolean isScheduler(Authentication authentication) {
        if (authentication == null) return false;
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            if (SCHEDULER_ROLE.equals(authority.getAuthority())) return true;
        }
        return false;
    }
}
