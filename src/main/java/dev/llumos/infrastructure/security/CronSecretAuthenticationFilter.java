package dev.llumos.infrastructure.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates scheduler calls by the cron secret header, granting {@code ROLE_SCHEDULER}.
 * A wrong secret is rejected outright; a missing header falls through to bearer authentication.
 */
public class CronSecretAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CronSecretAuthenticationFilter.class);

    static final String PRINCIPAL = "scheduler";

    private final CronSecretVerifier verifier;
    private final String headerName;

    public CronSecretAuthenticationFilter(CronSecretVerifier verifier, String headerName) {
        this.verifier = verifier;
        this.headerName = headerName;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String presented = request.getHeader(headerName);
        if (presented == null) {
            chain.doFilter(request, response);
            return;
        }
        if (!verifier.isValid(presented)) {
            log.warn("Rejected cron secret on {} {}", request.getMethod(), request.getRequestURI());
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "invalid cron secret");
            return;
        }
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(UsernamePasswordAuthenticationToken.authenticated(
                PRINCIPAL, null, AuthorityUtils.createAuthorityList("ROLE_SCHEDULER")));
        SecurityContextHolder.setContext(context);
        chain.doFilter(request, response);
    }
}
