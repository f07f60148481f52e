package uk.gegc.accounting.features.account.infra.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import uk.gegc.accounting.features.account.application.IdentityMirrorService;
import uk.gegc.accounting.features.account.domain.model.UserAccount;
import uk.gegc.accounting.shared.api.problem.ErrorTypes;
import uk.gegc.accounting.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.accounting.shared.security.AuthenticatedCaller;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Authenticates bearer tokens and mirrors the verified identity locally before the request proceeds.
 */
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final IdentityTokenVerifier tokenVerifier;
    private final IdentityMirrorService identityMirrorService;
    private final ObjectMapper objectMapper;

    public JwtAuthenticationFilter(IdentityTokenVerifier tokenVerifier,
                                   IdentityMirrorService identityMirrorService,
                                   ObjectMapper objectMapper) {
        this.tokenVerifier = tokenVerifier;
        this.identityMirrorService = identityMirrorService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response, @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            String token = authHeader.substring(7);
            try {
                tokenVerifier.verify(token).ifPresentOrElse(
                        identity -> authenticate(identity, request),
                        () -> log.warn("Invalid identity token received from IP: {}, URI: {}",
                                request.getRemoteAddr(), request.getRequestURI())
                );
            } catch (DataAccessException ex) {
                log.error("Could not mirror caller identity for {}", request.getRequestURI(), ex);
                writeStorageError(request, response);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(VerifiedIdentity identity, HttpServletRequest request) {
        UserAccount account = identityMirrorService.ensureUser(
                identity.userId(), identity.username(), identity.email(), identity.role());

        AuthenticatedCaller caller = new AuthenticatedCaller(
                account.getUserId(), account.getUsername(), account.getEmail(), account.getRole());

        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_" + caller.role().name()));
        caller.role().capabilities()
                .forEach(capability -> authorities.add(new SimpleGrantedAuthority(capability.name())));

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(caller, null, authorities);
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("Authenticated user {} with role {} for {}", caller.userId(), caller.role(), request.getRequestURI());
    }

    private void writeStorageError(HttpServletRequest request, HttpServletResponse response) throws IOException {
        ProblemDetail problemDetail = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.STORAGE_ERROR,
                "Storage Error",
                "The ledger could not be read or written",
                request
        );
        problemDetail.setProperty("errorCode", "STORAGE_ERROR");

        response.setStatus(HttpStatus.INTERNAL_SERVER_ERROR.value());
        response.setContentType("application/problem+json");
        response.getWriter().write(objectMapper.writeValueAsString(problemDetail));
    }
}
